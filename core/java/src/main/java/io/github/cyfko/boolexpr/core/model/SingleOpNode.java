package io.github.cyfko.boolexpr.core.model;

import io.github.cyfko.boolexpr.core.api.Node;
import io.github.cyfko.boolexpr.core.api.NodeVisitor;

import java.util.Objects;

/**
 * Unary operator applied to one operand. The parser only ever builds {@link TokenType#NOT}.
 *
 * @param op      the operator
 * @param operand the operand subtree
 * @since 1.0
 */
public record SingleOpNode(TokenType op, Node operand) implements Node {

    public SingleOpNode {
        Objects.requireNonNull(op, "Operator cannot be null");
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    /**
     * @param operand the negated subtree
     * @return {@code !operand}
     */
    public static SingleOpNode not(Node operand) {
        return new SingleOpNode(TokenType.NOT, operand);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSingleOp(this);
    }
}
