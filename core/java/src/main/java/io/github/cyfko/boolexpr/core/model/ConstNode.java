package io.github.cyfko.boolexpr.core.model;

import io.github.cyfko.boolexpr.core.api.Node;
import io.github.cyfko.boolexpr.core.api.NodeVisitor;

/**
 * Boolean literal, written {@code 1}/{@code true} or {@code 0}/{@code false}.
 *
 * @param value the literal value
 * @since 1.0
 */
public record ConstNode(boolean value) implements Node {

    public static final ConstNode TRUE = new ConstNode(true);
    public static final ConstNode FALSE = new ConstNode(false);

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitConst(this);
    }
}
