package io.github.cyfko.boolexpr.core.exception;

import io.github.cyfko.boolexpr.core.api.ExpressionParser;
import io.github.cyfko.boolexpr.core.utils.DiagnosticFormatter;

/**
 * Base exception for every syntax error raised while turning text into an expression tree.
 * <p>
 * The message is always the canonical positioned diagnostic produced by
 * {@link DiagnosticFormatter}, so callers can print it as is:
 * </p>
 * <pre>{@code
 * try {
 *     Node ast = parser.parse("a & ?");
 * } catch (ExpressionSyntaxException e) {
 *     System.err.print(e.getMessage());
 *     // Invalid character '?' at pos 4
 *     //
 *     // a & ?
 *     //     ^^^
 * }
 * }</pre>
 *
 * <p>Two concrete kinds exist:</p>
 * <ul>
 *   <li>{@link ExpressionLexException}: unrecognized character during scanning</li>
 *   <li>{@link ExpressionParseException}: unexpected token, missing operand, unterminated group, trailing tokens</li>
 * </ul>
 * <p>Both are terminal: no partial tree is ever produced.</p>
 *
 * @see ExpressionParser
 * @since 1.0
 */
public class ExpressionSyntaxException extends RuntimeException {

    private final String source;
    private final int position;
    private final char offendingChar;

    /**
     * Creates an exception for the character found at {@code position}.
     *
     * @param source   the full original expression
     * @param position zero-based character index of the error
     */
    public ExpressionSyntaxException(String source, int position) {
        this(source, position, DiagnosticFormatter.charAt(source, position));
    }

    /**
     * Creates an exception with an explicit offending character.
     *
     * @param source        the full original expression
     * @param position      zero-based character index of the error
     * @param offendingChar the character reported in the diagnostic
     */
    public ExpressionSyntaxException(String source, int position, char offendingChar) {
        super(DiagnosticFormatter.format(source, position, offendingChar));
        this.source = source;
        this.position = position;
        this.offendingChar = offendingChar;
    }

    /**
     * @return the expression that failed
     */
    public String getSource() {
        return source;
    }

    /**
     * @return zero-based character index of the error
     */
    public int getPosition() {
        return position;
    }

    /**
     * @return the character reported in the diagnostic, a space past the end of input
     */
    public char getOffendingChar() {
        return offendingChar;
    }
}
