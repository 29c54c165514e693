package io.github.cyfko.boolexpr.core.exception;

/**
 * Raised by the parser when the token sequence does not form a complete expression.
 * <p>
 * Covers missing operands ({@code "a &"}), consecutive binary operators ({@code "a & & b"}),
 * unterminated groups ({@code "(a & b"}) and trailing tokens ({@code "a b"}).
 * The position points at the token that could not be consumed, or at the end of the source.
 * </p>
 *
 * @since 1.0
 */
public class ExpressionParseException extends ExpressionSyntaxException {

    /**
     * @param source   the full original expression
     * @param position zero-based index where parsing stopped
     */
    public ExpressionParseException(String source, int position) {
        super(source, position);
    }
}
