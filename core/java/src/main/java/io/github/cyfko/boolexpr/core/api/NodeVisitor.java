package io.github.cyfko.boolexpr.core.api;

import io.github.cyfko.boolexpr.core.model.ConstNode;
import io.github.cyfko.boolexpr.core.model.DoubleOpNode;
import io.github.cyfko.boolexpr.core.model.GroupNode;
import io.github.cyfko.boolexpr.core.model.IdentifierNode;
import io.github.cyfko.boolexpr.core.model.SingleOpNode;

/**
 * Visitor over the closed set of {@link Node} variants.
 *
 * @param <R> result type of the traversal
 * @since 1.0
 */
public interface NodeVisitor<R> {

    R visitConst(ConstNode node);

    R visitIdentifier(IdentifierNode node);

    R visitSingleOp(SingleOpNode node);

    R visitDoubleOp(DoubleOpNode node);

    R visitGroup(GroupNode node);
}
