package com.rollupduck.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fully read result of a query: column labels and rows of JDBC values.
 *
 * @param columns the column labels, in order
 * @param rows the rows; values may be null
 */
public record QueryResult(List<String> columns, List<List<Object>> rows) {

    public QueryResult {
        columns = List.copyOf(columns);
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        rows = Collections.unmodifiableList(copy);
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public Object get(int row, int column) {
        return rows.get(row).get(column);
    }

    /**
     * Returns a value by column label.
     *
     * @param row the row index
     * @param column the column label
     * @return the value
     * @throws IllegalArgumentException if no column has that label
     */
    public Object get(int row, String column) {
        int index = columns.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("No column '" + column + "' in " + columns);
        }
        return get(row, index);
    }
}
