package io.github.cyfko.boolexpr.core.api;

import io.github.cyfko.boolexpr.core.model.ConstNode;
import io.github.cyfko.boolexpr.core.model.DoubleOpNode;
import io.github.cyfko.boolexpr.core.model.GroupNode;
import io.github.cyfko.boolexpr.core.model.IdentifierNode;
import io.github.cyfko.boolexpr.core.model.SingleOpNode;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Node of the abstract syntax tree produced by an {@link ExpressionParser}.
 * <p>
 * The set of variants is closed:
 * </p>
 * <ul>
 *   <li>{@link ConstNode}: literal true/false</li>
 *   <li>{@link IdentifierNode}: free variable {@code a} to {@code z}</li>
 *   <li>{@link SingleOpNode}: unary operator (NOT) applied to one operand</li>
 *   <li>{@link DoubleOpNode}: binary operator (AND, OR, XOR, EQUAL) with two operands</li>
 *   <li>{@link GroupNode}: explicit parentheses, evaluation-transparent</li>
 * </ul>
 *
 * <h2>Ownership</h2>
 * <p>
 * Nodes are immutable records. A tree built by the parser never shares a child between two
 * parents and never contains a cycle.
 * </p>
 *
 * <h2>Traversal</h2>
 * <p>
 * Behaviour over the tree is written as a {@link NodeVisitor}, keeping the nodes pure data:
 * </p>
 * <pre>{@code
 * int depth = ast.accept(new NodeVisitor<Integer>() { ... });
 * }</pre>
 *
 * @see NodeVisitor
 * @since 1.0
 */
public interface Node {

    /**
     * Dispatches to the visitor method matching this variant.
     *
     * @param visitor the visitor
     * @param <R>     result type
     * @return the visitor result
     */
    <R> R accept(NodeVisitor<R> visitor);

    /**
     * Counts the nodes of this tree. A group counts as its inner node only.
     *
     * @return number of nodes
     */
    default int countNodes() {
        return NodeCounter.count(this);
    }

    /**
     * Visitor behind {@link #countNodes()}. Walks the tree with its own stack.
     */
    final class NodeCounter implements NodeVisitor<Void> {
        private final Deque<Node> pending = new ArrayDeque<>();
        private int count;

        private NodeCounter() {}

        static int count(Node root) {
            NodeCounter counter = new NodeCounter();
            counter.pending.push(root);
            while (!counter.pending.isEmpty()) {
                counter.pending.pop().accept(counter);
            }
            return counter.count;
        }

        @Override
        public Void visitConst(ConstNode node) {
            count++;
            return null;
        }

        @Override
        public Void visitIdentifier(IdentifierNode node) {
            count++;
            return null;
        }

        @Override
        public Void visitSingleOp(SingleOpNode node) {
            count++;
            pending.push(node.operand());
            return null;
        }

        @Override
        public Void visitDoubleOp(DoubleOpNode node) {
            count++;
            pending.push(node.right());
            pending.push(node.left());
            return null;
        }

        @Override
        public Void visitGroup(GroupNode node) {
            pending.push(node.inner());
            return null;
        }
    }
}
