package com.rollupduck.expression;

import java.util.Objects;

/**
 * Expression representing a binary operation.
 *
 * <p>Used for re-applied comparison predicates ({@code day >= '2024-10-20'})
 * and for the weighted average reconstruction
 * ({@code SUM(sum_bid_price) / SUM(row_count)}).
 */
public final class BinaryExpression implements Expression {

    /**
     * Binary operators.
     */
    public enum Operator {
        EQUAL("="),
        LESS_THAN("<"),
        LESS_THAN_OR_EQUAL("<="),
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUAL(">="),
        DIVIDE("/");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;

    public BinaryExpression(Expression left, Operator operator, Expression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public static BinaryExpression divide(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.DIVIDE, right);
    }

    public Expression left() {
        return left;
    }

    public Operator operator() {
        return operator;
    }

    public Expression right() {
        return right;
    }

    /**
     * Converts this binary expression to SQL. The result is parenthesized so
     * that nesting never depends on operator precedence.
     *
     * @return the SQL string
     */
    @Override
    public String toSQL() {
        return "(" + left.toSQL() + " " + operator.symbol() + " " + right.toSQL() + ")";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BinaryExpression that)) return false;
        return operator == that.operator &&
               left.equals(that.left) &&
               right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }
}
