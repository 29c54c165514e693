package io.github.cyfko.boolexpr.core.utils;

import io.github.cyfko.boolexpr.core.exception.AssignmentFormatException;

import java.util.List;
import java.util.Objects;

/**
 * Converts textual variable assignments into a pass mask.
 *
 * <h2>Accepted forms</h2>
 * <ul>
 *   <li><strong>Single value</strong>:
 *     <ul>
 *       <li>binary string of {@code 0}/{@code 1}: {@code "101"} gives 5</li>
 *       <li>{@code true} / {@code false}, any case: 1 / 0</li>
 *       <li>decimal number: {@code "12"} gives 12</li>
 *     </ul>
 *   </li>
 *   <li><strong>Several values</strong>: value {@code i} sets bit {@code i} when it reads
 *       {@code true} or {@code 1}, and leaves it clear for {@code false} or {@code 0} (any case)</li>
 * </ul>
 *
 * <pre>{@code
 * AssignmentParser.parse(List.of("110"));                 // 6
 * AssignmentParser.parse(List.of("true", "0", "TRUE"));   // 5
 * }</pre>
 *
 * <p>Note that a single {@code "10"} reads as binary (2), not decimal.</p>
 *
 * @since 1.0
 */
public final class AssignmentParser {

    private static final int MAX_BITS = Long.SIZE - 1;

    private AssignmentParser() {}

    /**
     * @param inputs one or more assignment values
     * @return the pass mask
     * @throws AssignmentFormatException if a value is not in an accepted form or does not fit
     */
    public static long parse(List<String> inputs) {
        Objects.requireNonNull(inputs, "Assignment inputs cannot be null");
        if (inputs.isEmpty()) {
            throw new AssignmentFormatException("At least one assignment value is required");
        }

        if (inputs.size() == 1) {
            return parseSingle(inputs.get(0));
        }
        return parseList(inputs);
    }

    private static long parseSingle(String input) {
        Objects.requireNonNull(input, "Assignment value cannot be null");

        if (!input.isEmpty() && input.chars().allMatch(c -> c == '0' || c == '1')) {
            return parseNumber(input, 2);
        }
        if (input.equalsIgnoreCase("true")) {
            return 1L;
        }
        if (input.equalsIgnoreCase("false")) {
            return 0L;
        }
        if (!input.isEmpty() && input.chars().allMatch(c -> c >= '0' && c <= '9')) {
            return parseNumber(input, 10);
        }
        throw new AssignmentFormatException(String.format(
                "Invalid input: %s%nEither must be a boolean (true|false|0|1) or a binary string (010101) or number (uint)",
                input
        ));
    }

    private static long parseList(List<String> inputs) {
        if (inputs.size() > MAX_BITS) {
            throw new AssignmentFormatException(
                    "Too many assignment values: " + inputs.size() + " (max: " + MAX_BITS + ")");
        }

        long pass = 0L;
        for (int i = 0; i < inputs.size(); i++) {
            String value = Objects.requireNonNull(inputs.get(i), "Assignment value cannot be null");
            if (value.equalsIgnoreCase("true") || value.equals("1")) {
                pass |= 1L << i;
            } else if (!value.equalsIgnoreCase("false") && !value.equals("0")) {
                throw new AssignmentFormatException(String.format(
                        "Invalid input: %s at index %d%nEither must be a boolean (true|false|0|1)",
                        value, i
                ));
            }
        }
        return pass;
    }

    private static long parseNumber(String input, int radix) {
        try {
            return Long.parseLong(input, radix);
        } catch (NumberFormatException e) {
            throw new AssignmentFormatException("Assignment value out of range: " + input, e);
        }
    }
}
