package io.github.cyfko.boolexpr.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row of a truth table: the pass mask, the value of every identifier and the result.
 *
 * @param pass            assignment mask, bit {@code i} is the {@code i}-th identifier in ascending order
 * @param identifierStates identifier values in ascending identifier order
 * @param result          value of the expression under this assignment
 * @since 1.0
 */
public record PassResult(long pass, Map<Character, Boolean> identifierStates, boolean result) {

    public PassResult {
        Objects.requireNonNull(identifierStates, "identifierStates cannot be null");
        identifierStates = Collections.unmodifiableMap(new LinkedHashMap<>(identifierStates));
    }

    /**
     * @param identifier a variable letter of the expression
     * @return its value in this row
     * @throws IllegalArgumentException if the expression has no such variable
     */
    public boolean stateOf(char identifier) {
        Boolean state = identifierStates.get(identifier);
        if (state == null) {
            throw new IllegalArgumentException("Unknown identifier: '" + identifier + "'");
        }
        return state;
    }
}
