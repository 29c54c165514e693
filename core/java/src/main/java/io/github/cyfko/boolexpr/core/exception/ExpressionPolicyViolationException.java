package io.github.cyfko.boolexpr.core.exception;

import io.github.cyfko.boolexpr.core.config.ExpressionPolicy;

/**
 * Raised before scanning when an expression exceeds {@link ExpressionPolicy#maxExpressionLength()}.
 * <p>
 * The diagnostic points at the first character beyond the allowed length.
 * </p>
 *
 * @since 1.0
 */
public class ExpressionPolicyViolationException extends ExpressionSyntaxException {

    private final String policyName;

    /**
     * @param source the rejected expression
     * @param policy the policy that rejected it
     */
    public ExpressionPolicyViolationException(String source, ExpressionPolicy policy) {
        super(source, policy.maxExpressionLength());
        this.policyName = policy.policyName();
    }

    /**
     * @return name of the policy that rejected the expression
     */
    public String getPolicyName() {
        return policyName;
    }
}
