package io.github.cyfko.boolexpr.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Truth table of an expression: the identifier columns in bit order and a lazily computed
 * sequence of rows.
 * <p>
 * Rows are produced on iteration and every iteration recomputes them, so a table over many
 * variables costs nothing until it is read.
 * </p>
 *
 * @param identifiers column order, ascending identifier letters
 * @param rows        rows in ascending pass order, possibly filtered
 * @param filter      the filter applied to {@code rows}
 * @param totalRows   number of assignments before filtering, {@code 2^identifiers.size()}
 * @since 1.0
 */
public record TruthTable(List<Character> identifiers, Iterable<PassResult> rows, RowFilter filter, long totalRows) {

    public TruthTable {
        identifiers = List.copyOf(identifiers);
        Objects.requireNonNull(rows, "rows cannot be null");
        Objects.requireNonNull(filter, "filter cannot be null");
    }

    /**
     * Materializes the rows.
     *
     * @return all rows of this table
     */
    public List<PassResult> toList() {
        List<PassResult> list = new ArrayList<>();
        rows.forEach(list::add);
        return list;
    }
}
