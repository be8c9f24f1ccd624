package com.rollupduck.expression;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression representing a function call.
 *
 * <p>Examples:
 * <pre>
 *   SUM(sum_bid_price)         -- re-aggregation
 *   COUNT(*)                   -- row count
 *   COALESCE(SUM(row_count), 0)
 * </pre>
 */
public final class FunctionCall implements Expression {

    private final String functionName;
    private final List<Expression> arguments;

    public FunctionCall(String functionName, List<Expression> arguments) {
        this.functionName = Objects.requireNonNull(functionName, "functionName must not be null");
        if (functionName.isBlank()) {
            throw new IllegalArgumentException("functionName must not be empty");
        }
        this.arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments must not be null"));
    }

    public static FunctionCall of(String functionName, Expression... arguments) {
        return new FunctionCall(functionName, List.of(arguments));
    }

    /**
     * Creates a single-column aggregate such as {@code SUM(col)}.
     *
     * @param functionName the aggregate function
     * @param column the argument column
     * @return the function call
     */
    public static FunctionCall aggregate(String functionName, String column) {
        return of(functionName, ColumnReference.of(column));
    }

    public static FunctionCall countStar() {
        return of("COUNT", StarExpression.INSTANCE);
    }

    public String functionName() {
        return functionName;
    }

    public List<Expression> arguments() {
        return arguments;
    }

    @Override
    public String toSQL() {
        return functionName + "(" +
               arguments.stream().map(Expression::toSQL).collect(Collectors.joining(", ")) + ")";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall that)) return false;
        return functionName.equals(that.functionName) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, arguments);
    }
}
