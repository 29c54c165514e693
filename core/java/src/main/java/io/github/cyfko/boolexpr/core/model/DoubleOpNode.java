package io.github.cyfko.boolexpr.core.model;

import io.github.cyfko.boolexpr.core.api.Node;
import io.github.cyfko.boolexpr.core.api.NodeVisitor;

import java.util.Objects;

/**
 * Binary operator with two operands. The parser builds {@link TokenType#AND}, {@link TokenType#OR},
 * {@link TokenType#XOR} and {@link TokenType#EQUAL}; chains at the same level lean left,
 * so {@code a&b&c} is {@code (a&b)&c}.
 *
 * @param op    the operator
 * @param left  left operand
 * @param right right operand
 * @since 1.0
 */
public record DoubleOpNode(TokenType op, Node left, Node right) implements Node {

    public DoubleOpNode {
        Objects.requireNonNull(op, "Operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDoubleOp(this);
    }
}
