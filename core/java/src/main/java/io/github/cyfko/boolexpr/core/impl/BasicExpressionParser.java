package io.github.cyfko.boolexpr.core.impl;

import io.github.cyfko.boolexpr.core.api.ExpressionParser;
import io.github.cyfko.boolexpr.core.api.Node;
import io.github.cyfko.boolexpr.core.config.ExpressionPolicy;
import io.github.cyfko.boolexpr.core.exception.ExpressionPolicyViolationException;
import io.github.cyfko.boolexpr.core.exception.ExpressionSyntaxException;
import io.github.cyfko.boolexpr.core.model.TokenizedExpression;
import io.github.cyfko.boolexpr.core.parsing.RecursiveDescentParser;
import io.github.cyfko.boolexpr.core.parsing.Tokenizer;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Default {@link ExpressionParser}: policy check, {@link Tokenizer}, then {@link RecursiveDescentParser}.
 *
 * <h2>Phases</h2>
 * <ol>
 *   <li><strong>Policy</strong>: rejects expressions longer than {@link ExpressionPolicy#maxExpressionLength()}</li>
 *   <li><strong>Scanning</strong>: single forward pass producing tokens and their offsets</li>
 *   <li><strong>Parsing</strong>: recursive descent with one token of lookahead, bounded by
 *       {@link ExpressionPolicy#maxNestingDepth()}</li>
 * </ol>
 *
 * <p>Instances are immutable and can be shared between threads; each call uses its own cursor.</p>
 *
 * @since 1.0
 */
public class BasicExpressionParser implements ExpressionParser {

    private static final Logger log = Logger.getLogger(BasicExpressionParser.class.getName());

    private final ExpressionPolicy policy;
    private final Tokenizer tokenizer;

    /**
     * Default constructor using {@link ExpressionPolicy#defaults()}.
     */
    public BasicExpressionParser() {
        this(ExpressionPolicy.defaults());
    }

    /**
     * @param policy the policy to apply
     * @throws IllegalArgumentException if policy is null
     */
    public BasicExpressionParser(ExpressionPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Expression policy is required");
        }
        this.policy = policy;
        this.tokenizer = new Tokenizer(policy.strictKeywordBoundaries());
    }

    public ExpressionPolicy getPolicy() {
        return policy;
    }

    @Override
    public Node parse(String expression, boolean allowIdentifiers) throws ExpressionSyntaxException {
        Objects.requireNonNull(expression, "Expression cannot be null");

        if (expression.length() > policy.maxExpressionLength()) {
            log.fine(() -> String.format(
                    "Rejected expression of %d characters (max: %d, policy: %s)",
                    expression.length(), policy.maxExpressionLength(), policy.policyName()
            ));
            throw new ExpressionPolicyViolationException(expression, policy);
        }

        TokenizedExpression tokens = tokenizer.tokenize(expression, allowIdentifiers);
        Node ast = RecursiveDescentParser.parse(tokens, policy.maxNestingDepth());

        log.fine(() -> String.format(
                "Parsed expression '%s': %d tokens, %d nodes",
                expression, tokens.size(), ast.countNodes()
        ));
        return ast;
    }
}
