package io.github.cyfko.boolexpr.core.exception;

/**
 * Raised by the tokenizer when a character cannot start any token.
 * <p>
 * Typical causes are symbols outside the grammar ({@code ?}, {@code +}), upper case letters,
 * or letters when identifiers are not allowed.
 * </p>
 *
 * @since 1.0
 */
public class ExpressionLexException extends ExpressionSyntaxException {

    /**
     * @param source   the full original expression
     * @param position zero-based index of the rejected character
     */
    public ExpressionLexException(String source, int position) {
        super(source, position);
    }
}
