package io.github.cyfko.boolexpr.core.utils;

import java.util.Objects;

/**
 * Builds the positioned diagnostic shared by every syntax error of the pipeline.
 * <p>
 * The produced text is part of the public contract and must stay byte-for-byte stable:
 * </p>
 * <pre>
 * Invalid character '&lt;c&gt;' at pos &lt;n&gt;
 *
 * &lt;source&gt;
 * &lt;n spaces&gt;^^^
 * </pre>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * String message = DiagnosticFormatter.format("a|?", 2);
 * // "Invalid character '?' at pos 2\n\na|?\n  ^^^\n"
 * }</pre>
 *
 * @since 1.0
 */
public final class DiagnosticFormatter {

    /**
     * Character reported when the position lies past the end of the source.
     */
    public static final char END_OF_INPUT = ' ';

    private static final String MARKER = "^^^";

    private DiagnosticFormatter() {}

    /**
     * Formats the diagnostic for the character found at {@code position} in {@code source}.
     *
     * @param source   the full original expression
     * @param position zero-based character index of the offending position
     * @return the canonical multi-line diagnostic
     * @throws IllegalArgumentException if position is negative
     */
    public static String format(String source, int position) {
        return format(source, position, charAt(source, position));
    }

    /**
     * Formats the diagnostic with an explicit offending character.
     *
     * @param source        the full original expression
     * @param position      zero-based character index of the offending position
     * @param offendingChar the character to report
     * @return the canonical multi-line diagnostic
     * @throws IllegalArgumentException if position is negative
     */
    public static String format(String source, int position, char offendingChar) {
        Objects.requireNonNull(source, "source cannot be null");
        if (position < 0) {
            throw new IllegalArgumentException("position must not be negative, got: " + position);
        }

        return "Invalid character '" + offendingChar + "' at pos " + position + "\n\n"
                + source + "\n"
                + " ".repeat(position) + MARKER + "\n";
    }

    /**
     * Returns the character at {@code position}, or {@link #END_OF_INPUT} when out of range.
     *
     * @param source   the expression
     * @param position zero-based index
     * @return the character or a space
     */
    public static char charAt(String source, int position) {
        if (source == null || position < 0 || position >= source.length()) {
            return END_OF_INPUT;
        }
        return source.charAt(position);
    }
}
