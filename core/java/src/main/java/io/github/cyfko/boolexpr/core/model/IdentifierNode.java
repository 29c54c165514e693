package io.github.cyfko.boolexpr.core.model;

import io.github.cyfko.boolexpr.core.api.Node;
import io.github.cyfko.boolexpr.core.api.NodeVisitor;

/**
 * Free variable, a single lowercase letter.
 *
 * @param name the variable letter, {@code a} to {@code z}
 * @since 1.0
 */
public record IdentifierNode(char name) implements Node {

    public IdentifierNode {
        if (name < 'a' || name > 'z') {
            throw new IllegalArgumentException("Identifier must be a lowercase letter a-z, got: '" + name + "'");
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
