package io.github.cyfko.boolexpr.core.eval;

import io.github.cyfko.boolexpr.core.api.Node;
import io.github.cyfko.boolexpr.core.api.NodeVisitor;
import io.github.cyfko.boolexpr.core.model.ConstNode;
import io.github.cyfko.boolexpr.core.model.DoubleOpNode;
import io.github.cyfko.boolexpr.core.model.GroupNode;
import io.github.cyfko.boolexpr.core.model.IdentifierNode;
import io.github.cyfko.boolexpr.core.model.PassResult;
import io.github.cyfko.boolexpr.core.model.RowFilter;
import io.github.cyfko.boolexpr.core.model.SingleOpNode;
import io.github.cyfko.boolexpr.core.model.TokenType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Evaluates a parsed expression under bitmask-encoded variable assignments.
 * <p>
 * A <em>pass</em> is an unsigned mask whose bit {@code i} holds the value of the {@code i}-th
 * identifier of the {@link IdentifierIndex} (ascending letter order): 1 is true, 0 is false.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Evaluator evaluator = new Evaluator(parser.parse("a & b", true));
 * evaluator.evaluate(0b11);            // true
 *
 * for (PassResult row : evaluator.evaluateAll()) {
 *     // pass 0..3, one row per assignment
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * The tree and the index are immutable and evaluation writes no shared state, so one instance
 * can serve concurrent callers.
 * </p>
 *
 * <p>
 * Evaluation keeps its own work stack instead of recursing, so tree depth is bounded by heap only.
 * </p>
 *
 * <p>
 * The evaluator trusts its input to come from the parser: an operator that does not belong to
 * a node kind (e.g. a {@link SingleOpNode} holding AND) raises {@link IllegalStateException}.
 * </p>
 *
 * @since 1.0
 */
public final class Evaluator {

    private final Node ast;
    private final IdentifierIndex index;

    /**
     * Builds the canonical identifier index of {@code ast}.
     *
     * @param ast the tree to evaluate
     */
    public Evaluator(Node ast) {
        this.ast = Objects.requireNonNull(ast, "AST cannot be null");
        this.index = IdentifierIndex.of(ast);
    }

    public IdentifierIndex getIndex() {
        return index;
    }

    /**
     * @return distinct identifiers of the expression, ascending
     */
    public List<Character> getIdentifiers() {
        return index.identifiers();
    }

    /**
     * @return number of rows of the full truth table, {@code 2^n} for {@code n} identifiers
     */
    public long rowCount() {
        return 1L << index.size();
    }

    /**
     * Evaluates the expression under one assignment.
     *
     * @param pass assignment mask
     * @return the expression value
     * @throws IllegalStateException if the tree holds an operator its node kind does not accept
     */
    public boolean evaluate(long pass) {
        return new PassEvaluator(pass).run(ast);
    }

    /**
     * Value of one identifier in a pass.
     *
     * @param identifier a variable letter of the expression
     * @param pass       assignment mask
     * @return the bit of that identifier
     * @throws IllegalArgumentException if the expression has no such variable
     */
    public boolean identifierState(char identifier, long pass) {
        return (pass & (1L << index.bitOf(identifier))) != 0;
    }

    /**
     * Evaluates one assignment and decodes it into a truth table row.
     *
     * @param pass assignment mask
     * @return the row
     */
    public PassResult evaluatePass(long pass) {
        Map<Character, Boolean> states = new LinkedHashMap<>();
        for (Character identifier : index.identifiers()) {
            states.put(identifier, identifierState(identifier, pass));
        }
        return new PassResult(pass, states, evaluate(pass));
    }

    /**
     * Lazily enumerates every pass from {@code 0} to {@code 2^n - 1} in ascending order.
     * <p>
     * Each call to {@link Iterable#iterator()} starts a new enumeration. With no identifiers the
     * sequence holds exactly one row. No size limit is applied here.
     * </p>
     *
     * @return the truth table rows
     */
    public Iterable<PassResult> evaluateAll() {
        return evaluateAll(RowFilter.ALL);
    }

    /**
     * Same as {@link #evaluateAll()}, keeping only the rows accepted by {@code filter}.
     *
     * @param filter row selection
     * @return the selected truth table rows
     */
    public Iterable<PassResult> evaluateAll(RowFilter filter) {
        Objects.requireNonNull(filter, "Row filter cannot be null");
        return () -> new PassIterator(filter);
    }

    /**
     * @param filter row selection
     * @return the selected rows as a sequential stream
     */
    public Stream<PassResult> stream(RowFilter filter) {
        return StreamSupport.stream(evaluateAll(filter).spliterator(), false);
    }

    private final class PassIterator implements Iterator<PassResult> {
        private final RowFilter filter;
        private final long end = rowCount();
        private long nextPass;
        private PassResult next;

        private PassIterator(RowFilter filter) {
            this.filter = filter;
        }

        @Override
        public boolean hasNext() {
            while (next == null && nextPass < end) {
                PassResult row = evaluatePass(nextPass++);
                if (filter.test(row)) {
                    next = row;
                }
            }
            return next != null;
        }

        @Override
        public PassResult next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            PassResult row = next;
            next = null;
            return row;
        }
    }

    /**
     * Post-order walk over an explicit stack: a node is first expanded into its operands, then
     * reduced once their values are on {@code values}.
     */
    private final class PassEvaluator implements NodeVisitor<Void> {
        private final long pass;
        private final Deque<Step> steps = new ArrayDeque<>();
        private final Deque<Boolean> values = new ArrayDeque<>();

        private PassEvaluator(long pass) {
            this.pass = pass;
        }

        private boolean run(Node root) {
            steps.push(new Step(root, false));
            while (!steps.isEmpty()) {
                Step step = steps.pop();
                if (step.reduce()) {
                    reduce(step.node());
                } else {
                    step.node().accept(this);
                }
            }
            return values.pop();
        }

        @Override
        public Void visitConst(ConstNode node) {
            values.push(node.value());
            return null;
        }

        @Override
        public Void visitIdentifier(IdentifierNode node) {
            values.push(identifierState(node.name(), pass));
            return null;
        }

        @Override
        public Void visitSingleOp(SingleOpNode node) {
            if (node.op() != TokenType.NOT) {
                throw invalidOperator(node.op());
            }
            steps.push(new Step(node, true));
            steps.push(new Step(node.operand(), false));
            return null;
        }

        @Override
        public Void visitDoubleOp(DoubleOpNode node) {
            if (!node.op().isBinaryOperator()) {
                throw invalidOperator(node.op());
            }
            steps.push(new Step(node, true));
            steps.push(new Step(node.right(), false));
            steps.push(new Step(node.left(), false));
            return null;
        }

        @Override
        public Void visitGroup(GroupNode node) {
            steps.push(new Step(node.inner(), false));
            return null;
        }

        private void reduce(Node node) {
            if (node instanceof SingleOpNode) {
                values.push(!values.pop());
                return;
            }
            TokenType op = ((DoubleOpNode) node).op();
            boolean right = values.pop();
            boolean left = values.pop();
            values.push(switch (op) {
                case AND -> left && right;
                case OR -> left || right;
                case XOR -> left ^ right;
                case EQUAL -> left == right;
                default -> throw invalidOperator(op);
            });
        }

        private IllegalStateException invalidOperator(TokenType op) {
            return new IllegalStateException(
                    "Invalid operator " + op + " in expression tree, it was not produced by the parser");
        }
    }

    private record Step(Node node, boolean reduce) {
    }
}
