package com.rollupduck.expression;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression representing an IN list.
 *
 * <p>SQL form: {@code expr IN (val1, val2, val3)}
 */
public final class InExpression implements Expression {

    private final Expression testExpr;
    private final List<Expression> values;

    /**
     * Creates an IN expression.
     *
     * @param testExpr the expression being tested
     * @param values the values to test against
     * @throws IllegalArgumentException if values is empty
     */
    public InExpression(Expression testExpr, List<Expression> values) {
        this.testExpr = Objects.requireNonNull(testExpr, "testExpr must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (values.isEmpty()) {
            throw new IllegalArgumentException("IN clause requires at least one value");
        }
        this.values = List.copyOf(values);
    }

    public Expression testExpr() {
        return testExpr;
    }

    public List<Expression> values() {
        return values;
    }

    @Override
    public String toSQL() {
        return "(" + testExpr.toSQL() + " IN (" +
               values.stream().map(Expression::toSQL).collect(Collectors.joining(", ")) + "))";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof InExpression that)) return false;
        return testExpr.equals(that.testExpr) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(testExpr, values);
    }
}
