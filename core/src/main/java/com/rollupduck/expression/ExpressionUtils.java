package com.rollupduck.expression;

import com.rollupduck.query.Predicate;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversions from the query model to SQL expressions.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {
    }

    /**
     * Converts a WHERE predicate to a boolean expression over its column.
     *
     * @param predicate the predicate
     * @return the expression
     */
    public static Expression fromPredicate(Predicate predicate) {
        ColumnReference column = ColumnReference.of(predicate.column());
        return switch (predicate.operator()) {
            case EQ -> comparison(column, BinaryExpression.Operator.EQUAL, predicate);
            case LT -> comparison(column, BinaryExpression.Operator.LESS_THAN, predicate);
            case LTE -> comparison(column, BinaryExpression.Operator.LESS_THAN_OR_EQUAL, predicate);
            case GT -> comparison(column, BinaryExpression.Operator.GREATER_THAN, predicate);
            case GTE -> comparison(column, BinaryExpression.Operator.GREATER_THAN_OR_EQUAL, predicate);
            case BETWEEN -> new BetweenExpression(column,
                Literal.of(predicate.values().get(0)), Literal.of(predicate.values().get(1)));
            case IN -> {
                List<Expression> values = new ArrayList<>(predicate.values().size());
                for (Object value : predicate.values()) {
                    values.add(Literal.of(value));
                }
                yield new InExpression(column, values);
            }
        };
    }

    /**
     * Converts predicates to expressions, preserving order.
     *
     * @param predicates the predicates
     * @return the expressions
     */
    public static List<Expression> fromPredicates(List<Predicate> predicates) {
        List<Expression> result = new ArrayList<>(predicates.size());
        for (Predicate predicate : predicates) {
            result.add(fromPredicate(predicate));
        }
        return result;
    }

    private static Expression comparison(ColumnReference column, BinaryExpression.Operator operator,
                                         Predicate predicate) {
        return new BinaryExpression(column, operator, Literal.of(predicate.scalar()));
    }
}
