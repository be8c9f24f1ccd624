package com.rollupduck.expression;

import com.rollupduck.generator.SQLQuoting;

import java.util.Objects;

/**
 * Expression representing a reference to a column.
 *
 * <p>Quoting is only applied when the name requires it, so that generated
 * SQL stays readable: {@code day} stays {@code day}, {@code order} becomes
 * {@code "order"}.
 */
public final class ColumnReference implements Expression {

    private final String columnName;

    public ColumnReference(String columnName) {
        this.columnName = Objects.requireNonNull(columnName, "columnName must not be null");
    }

    public static ColumnReference of(String columnName) {
        return new ColumnReference(columnName);
    }

    public String columnName() {
        return columnName;
    }

    @Override
    public String toSQL() {
        return SQLQuoting.quoteIdentifierIfNeeded(columnName);
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnReference that)) return false;
        return columnName.equals(that.columnName);
    }

    @Override
    public int hashCode() {
        return columnName.hashCode();
    }
}
