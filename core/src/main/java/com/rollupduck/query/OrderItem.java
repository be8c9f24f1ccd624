package com.rollupduck.query;

import java.util.Objects;

/**
 * One ORDER BY entry. The expression is either a column name or the label of
 * an aggregate in the SELECT list, e.g. {@code COUNT(*)}.
 */
public record OrderItem(String expression, SortDirection direction) {

    public OrderItem {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
    }

    public static OrderItem asc(String expression) {
        return new OrderItem(expression, SortDirection.ASC);
    }

    public static OrderItem desc(String expression) {
        return new OrderItem(expression, SortDirection.DESC);
    }
}
