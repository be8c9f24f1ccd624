package com.rollupduck.query;

import java.util.Objects;

/**
 * A bare column in a SELECT list.
 */
public record ColumnItem(String column) implements SelectItem {

    public ColumnItem {
        Objects.requireNonNull(column, "column must not be null");
    }

    @Override
    public String label() {
        return column;
    }

    @Override
    public String toString() {
        return column;
    }
}
