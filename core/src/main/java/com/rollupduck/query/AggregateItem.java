package com.rollupduck.query;

import java.util.Objects;

/**
 * An aggregate request {@code (function, column)} in a SELECT list.
 *
 * <p>The column {@code *} denotes a row count and is only meaningful with
 * {@link AggregateFunction#COUNT}.
 */
public record AggregateItem(AggregateFunction function, String column) implements SelectItem {

    public static final String STAR = "*";

    public AggregateItem {
        Objects.requireNonNull(function, "function must not be null");
        Objects.requireNonNull(column, "column must not be null");
    }

    public static AggregateItem countStar() {
        return new AggregateItem(AggregateFunction.COUNT, STAR);
    }

    /**
     * Returns true for {@code COUNT(*)}.
     *
     * @return whether this item counts rows
     */
    public boolean isRowCount() {
        return function == AggregateFunction.COUNT && STAR.equals(column);
    }

    @Override
    public String label() {
        return function.name() + "(" + column + ")";
    }

    @Override
    public String toString() {
        return label();
    }
}
