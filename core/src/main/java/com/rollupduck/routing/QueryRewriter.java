package com.rollupduck.routing;

import com.rollupduck.analysis.AggregatePrimitive;
import com.rollupduck.analysis.Classification;
import com.rollupduck.analysis.ClassifiedPredicate;
import com.rollupduck.analysis.FilterClass;
import com.rollupduck.analysis.SummarySpec;
import com.rollupduck.expression.BinaryExpression;
import com.rollupduck.expression.Expression;
import com.rollupduck.expression.ExpressionUtils;
import com.rollupduck.expression.FunctionCall;
import com.rollupduck.expression.Literal;
import com.rollupduck.plan.PhysicalQuery;
import com.rollupduck.plan.Projection;
import com.rollupduck.query.AggregateItem;
import com.rollupduck.query.ColumnItem;
import com.rollupduck.query.Query;
import com.rollupduck.query.SelectItem;

/**
 * Rewrites a query into a re-aggregation over a matched summary table.
 *
 * <pre>
 *   SUM(c)    -> SUM(sum_c)
 *   COUNT(*)  -> SUM(row_count)
 *   AVG(c)    -> SUM(sum_c) / SUM(row_count)
 *   MIN(c)    -> MIN(min_c)
 *   MAX(c)    -> MAX(max_c)
 * </pre>
 *
 * <p>Constant predicates are dropped since the summary already applies them.
 * All other predicates are re-applied against the summary's dimension
 * columns. The result groups by the query's own GROUP BY, so any extra
 * dimensions of the summary are aggregated away. ORDER BY and LIMIT pass
 * through unchanged; aggregate outputs keep their labels as aliases.
 *
 * <p>A global {@code COUNT(*)} is wrapped in {@code COALESCE(..., 0)} so that
 * an empty selection counts 0 as it does on the main table.
 *
 * <p>AVG divides by {@code row_count}, which counts every row of the group
 * whether or not the measure is null. It therefore agrees with {@code AVG(c)}
 * on the main table only while {@code c} holds no nulls. Measure columns are
 * assumed non-null.
 */
public class QueryRewriter {

    /**
     * Rewrites the classified query against the summary table.
     *
     * @param classification the query's classification
     * @param spec the matched spec; must satisfy every aggregate of the query
     * @return the rewritten query
     * @throws IllegalArgumentException if an aggregate cannot be rebuilt from the summary table
     */
    public PhysicalQuery rewrite(Classification classification, SummarySpec spec) {
        Query query = classification.query();
        PhysicalQuery.Builder builder = PhysicalQuery.builder(spec.tableName());

        for (SelectItem item : query.select()) {
            if (item instanceof ColumnItem column) {
                builder.project(Projection.column(column.column()));
            } else {
                AggregateItem aggregate = (AggregateItem) item;
                if (!spec.canSatisfy(aggregate)) {
                    throw new IllegalArgumentException(
                        "%s cannot answer %s".formatted(spec.tableName(), aggregate.label()));
                }
                builder.project(Projection.aliased(reaggregate(aggregate, query), aggregate.label()));
            }
        }

        for (ClassifiedPredicate classified : classification.predicates()) {
            if (classified.filterClass() != FilterClass.CONSTANT) {
                builder.filter(ExpressionUtils.fromPredicate(classified.predicate()));
            }
        }

        builder.groupBy(query.groupBy());
        query.orderBy().forEach(builder::orderBy);
        query.limit().ifPresent(builder::limit);
        return builder.build();
    }

    private static Expression reaggregate(AggregateItem item, Query query) {
        String column = item.column();
        return switch (item.function()) {
            case SUM -> sumOf(AggregatePrimitive.sum(column));
            case AVG -> BinaryExpression.divide(
                sumOf(AggregatePrimitive.sum(column)), sumOf(AggregatePrimitive.rowCount()));
            case COUNT -> {
                if (!item.isRowCount()) {
                    throw new IllegalArgumentException("Cannot rewrite " + item.label());
                }
                Expression count = sumOf(AggregatePrimitive.rowCount());
                yield query.groupBy().isEmpty() ? FunctionCall.of("COALESCE", count, Literal.of(0L)) : count;
            }
            case MIN -> FunctionCall.aggregate("MIN", AggregatePrimitive.min(column).outputColumn());
            case MAX -> FunctionCall.aggregate("MAX", AggregatePrimitive.max(column).outputColumn());
        };
    }

    private static Expression sumOf(AggregatePrimitive primitive) {
        return FunctionCall.aggregate("SUM", primitive.outputColumn());
    }
}
