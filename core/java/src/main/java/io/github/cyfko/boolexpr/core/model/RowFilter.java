package io.github.cyfko.boolexpr.core.model;

import java.util.function.Predicate;

/**
 * Selection of truth table rows by result.
 *
 * @since 1.0
 */
public enum RowFilter implements Predicate<PassResult> {
    /** Every row. */
    ALL {
        @Override
        public boolean test(PassResult row) {
            return true;
        }
    },
    /** Rows where the expression is true. */
    TRUE_ONLY {
        @Override
        public boolean test(PassResult row) {
            return row.result();
        }
    },
    /** Rows where the expression is false. */
    FALSE_ONLY {
        @Override
        public boolean test(PassResult row) {
            return !row.result();
        }
    }
}
