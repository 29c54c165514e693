package io.github.cyfko.boolexpr.core.model;

import io.github.cyfko.boolexpr.core.api.Node;
import io.github.cyfko.boolexpr.core.api.NodeVisitor;

import java.util.Objects;

/**
 * Explicit parentheses around a subexpression. Evaluates exactly like {@code inner}; kept in the
 * tree so the source structure stays visible.
 *
 * @param inner the parenthesized subtree
 * @since 1.0
 */
public record GroupNode(Node inner) implements Node {

    public GroupNode {
        Objects.requireNonNull(inner, "Group content cannot be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitGroup(this);
    }
}
