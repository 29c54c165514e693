package io.github.cyfko.boolexpr.core;

import io.github.cyfko.boolexpr.core.api.ExpressionParser;
import io.github.cyfko.boolexpr.core.api.Node;
import io.github.cyfko.boolexpr.core.config.ExpressionPolicy;
import io.github.cyfko.boolexpr.core.eval.Evaluator;
import io.github.cyfko.boolexpr.core.exception.AssignmentFormatException;
import io.github.cyfko.boolexpr.core.exception.ExpressionSyntaxException;
import io.github.cyfko.boolexpr.core.impl.BasicExpressionParser;
import io.github.cyfko.boolexpr.core.model.PassResult;
import io.github.cyfko.boolexpr.core.model.RowFilter;
import io.github.cyfko.boolexpr.core.model.TruthTable;
import io.github.cyfko.boolexpr.core.utils.AssignmentParser;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * High-level facade running the whole pipeline: text, tokens, tree, evaluation.
 *
 * <p><strong>Operations:</strong></p>
 * <ol>
 *   <li><strong>Evaluate:</strong> constant expression, identifiers rejected</li>
 *   <li><strong>Evaluate with assignment:</strong> identifiers bound by a pass mask or textual values</li>
 *   <li><strong>Truth table:</strong> every assignment, optionally filtered by result</li>
 *   <li><strong>Parse tree:</strong> the AST itself, for structural consumers such as tree printers</li>
 * </ol>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * BoolExpr boolExpr = BoolExpr.of();
 *
 * boolExpr.evaluate("1 & !0");                              // true
 * boolExpr.evaluate("a ^ b", List.of("1", "0")).result();   // true
 *
 * TruthTable table = boolExpr.truthTable("a = b", RowFilter.TRUE_ONLY);
 * table.identifiers();                                      // [a, b]
 * table.toList().size();                                    // 2
 * }</pre>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>{@link ExpressionSyntaxException} - Invalid expression, with positioned diagnostic</li>
 *   <li>{@link AssignmentFormatException} - Invalid textual assignment</li>
 * </ul>
 *
 * <p>
 * Large truth tables are not refused: from {@link ExpressionPolicy#largeTableThreshold()} variables
 * a warning is logged and the caller decides whether to read the rows.
 * </p>
 *
 * @see ExpressionParser
 * @see Evaluator
 * @since 1.0
 */
public class BoolExpr {

    private static final Logger log = Logger.getLogger(BoolExpr.class.getName());

    private final ExpressionParser parser;
    private final ExpressionPolicy policy;

    private BoolExpr(ExpressionParser parser, ExpressionPolicy policy) {
        this.parser = Objects.requireNonNull(parser, "Parser cannot be null");
        this.policy = Objects.requireNonNull(policy, "Policy cannot be null");
    }

    /**
     * @return a facade using {@link ExpressionPolicy#defaults()}
     */
    public static BoolExpr of() {
        return of(ExpressionPolicy.defaults());
    }

    /**
     * @param policy the policy applied to parsing and truth tables
     * @return a facade using a {@link BasicExpressionParser} with that policy
     */
    public static BoolExpr of(ExpressionPolicy policy) {
        return new BoolExpr(new BasicExpressionParser(policy), policy);
    }

    /**
     * @param parser custom parser
     * @param policy the policy used for truth table warnings
     * @return a facade using the given parser
     */
    public static BoolExpr of(ExpressionParser parser, ExpressionPolicy policy) {
        return new BoolExpr(parser, policy);
    }

    /**
     * Evaluates an expression made of constants only.
     *
     * @param expression the expression, identifiers are not allowed
     * @return the value
     * @throws ExpressionSyntaxException if the expression is invalid or contains a letter
     */
    public boolean evaluate(String expression) {
        return new Evaluator(parser.parse(expression, false)).evaluate(0L);
    }

    /**
     * Evaluates an expression under one assignment.
     *
     * @param expression the expression
     * @param pass       assignment mask, bit {@code i} is the {@code i}-th identifier in ascending order
     * @return the row for that assignment
     */
    public PassResult evaluate(String expression, long pass) {
        return new Evaluator(parser.parse(expression, true)).evaluatePass(pass);
    }

    /**
     * Evaluates an expression under a textual assignment, see {@link AssignmentParser}.
     *
     * @param expression the expression
     * @param assignment one binary/decimal/boolean value, or one boolean per identifier
     * @return the row for that assignment
     * @throws AssignmentFormatException if the assignment cannot be read
     */
    public PassResult evaluate(String expression, List<String> assignment) {
        long pass = AssignmentParser.parse(assignment);
        return evaluate(expression, pass);
    }

    /**
     * @param expression the expression
     * @return the full truth table
     */
    public TruthTable truthTable(String expression) {
        return truthTable(expression, RowFilter.ALL);
    }

    /**
     * Builds the truth table of an expression, keeping the rows accepted by {@code filter}.
     *
     * @param expression the expression
     * @param filter     row selection
     * @return the lazily computed table
     */
    public TruthTable truthTable(String expression, RowFilter filter) {
        Evaluator evaluator = new Evaluator(parser.parse(expression, true));
        int variables = evaluator.getIdentifiers().size();

        if (variables >= policy.largeTableThreshold()) {
            log.warning(() -> String.format(
                    "Truth table of '%s' has %d variables: %d rows will be computed",
                    expression, variables, evaluator.rowCount()
            ));
        } else {
            log.fine(() -> String.format(
                    "Truth table of '%s': %d variables, %d rows", expression, variables, evaluator.rowCount()
            ));
        }

        return new TruthTable(evaluator.getIdentifiers(), evaluator.evaluateAll(filter), filter, evaluator.rowCount());
    }

    /**
     * @param expression the expression, identifiers allowed
     * @return its syntax tree
     */
    public Node parseTree(String expression) {
        return parser.parse(expression, true);
    }
}
