package com.rollupduck.query;

import com.rollupduck.exception.MalformedQueryException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * A single WHERE condition {@code (column, operator, value)}.
 *
 * <p>The value shape depends on the operator:
 * <ul>
 *   <li>{@code eq, lt, lte, gt, gte}: a scalar</li>
 *   <li>{@code between}: a list of exactly two bounds</li>
 *   <li>{@code in}: a non-empty list of distinct scalars</li>
 * </ul>
 *
 * <p>Numbers are normalized so that equal constants compare equal no matter
 * how they were parsed: integral values become {@link Long}, others
 * {@link Double}.
 */
public record Predicate(String column, Operator operator, Object value) {

    public Predicate {
        Objects.requireNonNull(column, "column must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        value = normalizeValue(column, operator, value);
    }

    public static Predicate of(String column, Operator operator, Object value) {
        return new Predicate(column, operator, value);
    }

    public static Predicate eq(String column, Object value) {
        return new Predicate(column, Operator.EQ, value);
    }

    public static Predicate between(String column, Object lower, Object upper) {
        return new Predicate(column, Operator.BETWEEN, List.of(lower, upper));
    }

    public static Predicate in(String column, Collection<?> values) {
        return new Predicate(column, Operator.IN, new ArrayList<>(values));
    }

    /**
     * Returns the scalar value of a comparison or equality predicate.
     *
     * @return the value
     * @throws IllegalStateException if this predicate carries a list
     */
    public Object scalar() {
        if (value instanceof List) {
            throw new IllegalStateException(operator.wireName() + " predicate has no scalar value");
        }
        return value;
    }

    /**
     * Returns the list value of a BETWEEN or IN predicate.
     *
     * @return the values
     * @throws IllegalStateException if this predicate carries a scalar
     */
    @SuppressWarnings("unchecked")
    public List<Object> values() {
        if (!(value instanceof List)) {
            throw new IllegalStateException(operator.wireName() + " predicate has no value list");
        }
        return (List<Object>) value;
    }

    private static Object normalizeValue(String column, Operator operator, Object value) {
        switch (operator) {
            case EQ, LT, LTE, GT, GTE -> {
                if (value == null || value instanceof Collection) {
                    throw new MalformedQueryException(
                        "Predicate '%s %s' requires a single non-null value".formatted(column, operator.wireName()));
                }
                return normalizeScalar(column, value);
            }
            case BETWEEN -> {
                List<Object> bounds = normalizeList(column, operator, value);
                if (bounds.size() != 2) {
                    throw new MalformedQueryException(
                        "Predicate '%s between' requires exactly two bounds, got %d".formatted(column, bounds.size()));
                }
                return bounds;
            }
            case IN -> {
                List<Object> members = normalizeList(column, operator, value);
                if (members.isEmpty()) {
                    throw new MalformedQueryException(
                        "Predicate '%s in' requires at least one value".formatted(column));
                }
                return List.copyOf(new LinkedHashSet<>(members));
            }
        }
        throw new IllegalStateException("Unhandled operator: " + operator);
    }

    private static List<Object> normalizeList(String column, Operator operator, Object value) {
        if (!(value instanceof Collection<?> collection)) {
            throw new MalformedQueryException(
                "Predicate '%s %s' requires a list value".formatted(column, operator.wireName()));
        }
        List<Object> result = new ArrayList<>(collection.size());
        for (Object element : collection) {
            if (element == null || element instanceof Collection) {
                throw new MalformedQueryException(
                    "Predicate '%s %s' values must be non-null scalars".formatted(column, operator.wireName()));
            }
            result.add(normalizeScalar(column, element));
        }
        return List.copyOf(result);
    }

    private static Object normalizeScalar(String column, Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof BigDecimal decimal) {
            if (decimal.stripTrailingZeros().scale() <= 0) {
                return decimal.longValueExact();
            }
            return decimal.doubleValue();
        }
        if (value instanceof Long || value instanceof Double
                || value instanceof String || value instanceof Boolean) {
            return value;
        }
        throw new MalformedQueryException(
            "Unsupported value type %s in predicate on '%s'".formatted(value.getClass().getSimpleName(), column));
    }

    @Override
    public String toString() {
        return column + " " + operator.wireName() + " " + value;
    }
}
