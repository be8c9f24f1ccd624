package com.rollupduck.expression;

import java.util.Objects;

/**
 * Expression representing a BETWEEN predicate (bounds inclusive).
 *
 * <pre>
 *   day BETWEEN '2024-10-20' AND '2024-10-23'
 * </pre>
 */
public final class BetweenExpression implements Expression {

    private final Expression value;
    private final Expression lower;
    private final Expression upper;

    public BetweenExpression(Expression value, Expression lower, Expression upper) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.lower = Objects.requireNonNull(lower, "lower must not be null");
        this.upper = Objects.requireNonNull(upper, "upper must not be null");
    }

    public Expression value() {
        return value;
    }

    public Expression lower() {
        return lower;
    }

    public Expression upper() {
        return upper;
    }

    @Override
    public String toSQL() {
        return "(%s BETWEEN %s AND %s)".formatted(value.toSQL(), lower.toSQL(), upper.toSQL());
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BetweenExpression that)) return false;
        return value.equals(that.value) &&
               lower.equals(that.lower) &&
               upper.equals(that.upper);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, lower, upper);
    }
}
