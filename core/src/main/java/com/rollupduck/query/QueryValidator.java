package com.rollupduck.query;

import com.rollupduck.exception.MalformedQueryException;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Validates queries before analysis or routing.
 *
 * <p>Validation rules:
 * <ul>
 *   <li>SELECT must not be empty</li>
 *   <li>GROUP BY must not list a column twice</li>
 *   <li>When a query groups or aggregates, every bare SELECT column must
 *       appear in GROUP BY</li>
 *   <li>Every ORDER BY expression must be a GROUP BY column or the label of a
 *       SELECT item</li>
 *   <li>LIMIT, when present, must be non-negative</li>
 *   <li>{@code COUNT(*)} is the only aggregate allowed on {@code *}</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   QueryValidator.validate(query);  // Throws MalformedQueryException if invalid
 * </pre>
 */
public final class QueryValidator {

    private QueryValidator() {}

    /**
     * Validates a query.
     *
     * @param query the query to validate
     * @throws MalformedQueryException if validation fails
     * @throws NullPointerException if query is null
     */
    public static void validate(Query query) {
        Objects.requireNonNull(query, "query must not be null");
        String id = query.id();

        if (query.select().isEmpty()) {
            throw new MalformedQueryException("SELECT list is empty", id);
        }

        Set<String> groupBy = new HashSet<>();
        for (String column : query.groupBy()) {
            if (!groupBy.add(column)) {
                throw new MalformedQueryException(
                    "Column '%s' appears more than once in GROUP BY".formatted(column), id);
            }
        }

        if (query.isAggregation()) {
            for (String column : query.bareColumns()) {
                if (!groupBy.contains(column)) {
                    throw new MalformedQueryException(
                        "Column '%s' must appear in GROUP BY or be used in an aggregate".formatted(column), id);
                }
            }
        }

        for (AggregateItem aggregate : query.aggregates()) {
            if (AggregateItem.STAR.equals(aggregate.column()) && !aggregate.isRowCount()) {
                throw new MalformedQueryException(
                    "%s(*) is not a valid aggregate".formatted(aggregate.function()), id);
            }
        }

        Set<String> orderable = new HashSet<>(groupBy);
        for (SelectItem item : query.select()) {
            orderable.add(item.label());
        }
        for (OrderItem order : query.orderBy()) {
            if (!orderable.contains(order.expression())) {
                throw new MalformedQueryException(
                    "ORDER BY expression '%s' is neither selected nor grouped".formatted(order.expression()), id);
            }
        }

        if (query.limit().isPresent() && query.limit().getAsInt() < 0) {
            throw new MalformedQueryException("LIMIT must be non-negative", id);
        }
    }
}
