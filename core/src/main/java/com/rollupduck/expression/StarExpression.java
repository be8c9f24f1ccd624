package com.rollupduck.expression;

/**
 * The {@code *} argument of {@code COUNT(*)}.
 */
public final class StarExpression implements Expression {

    public static final StarExpression INSTANCE = new StarExpression();

    private StarExpression() {
    }

    @Override
    public String toSQL() {
        return "*";
    }

    @Override
    public String toString() {
        return "*";
    }
}
