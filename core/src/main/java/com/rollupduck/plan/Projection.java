package com.rollupduck.plan;

import com.rollupduck.expression.ColumnReference;
import com.rollupduck.expression.Expression;
import com.rollupduck.generator.SQLQuoting;

import java.util.Objects;

/**
 * One item of a SELECT list: an expression with an optional output alias.
 *
 * @param expression the projected expression
 * @param alias the output name, or null to keep the expression's own name
 */
public record Projection(Expression expression, String alias) {

    public Projection {
        Objects.requireNonNull(expression, "expression must not be null");
    }

    public static Projection column(String column) {
        return new Projection(ColumnReference.of(column), null);
    }

    public static Projection aliased(Expression expression, String alias) {
        return new Projection(expression, Objects.requireNonNull(alias, "alias must not be null"));
    }

    public String toSQL() {
        if (alias == null) {
            return expression.toSQL();
        }
        return expression.toSQL() + " AS " + SQLQuoting.quoteIdentifierIfNeeded(alias);
    }
}
