package com.rollupduck.generator;

import com.rollupduck.analysis.AggregatePrimitive;
import com.rollupduck.analysis.SummarySpec;
import com.rollupduck.expression.BinaryExpression;
import com.rollupduck.expression.ColumnReference;
import com.rollupduck.expression.Expression;
import com.rollupduck.expression.FunctionCall;
import com.rollupduck.expression.Literal;
import com.rollupduck.plan.PhysicalQuery;
import com.rollupduck.plan.Projection;
import com.rollupduck.query.OrderItem;

import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

import static com.rollupduck.generator.SQLQuoting.quoteIdentifierIfNeeded;
import static com.rollupduck.generator.SQLQuoting.quoteTableName;

/**
 * Emits DuckDB SQL for physical queries and summary table definitions.
 *
 * <p>The generator holds no state; one instance may be shared.
 *
 * <p>Example usage:
 * <pre>
 *   SQLGenerator generator = new SQLGenerator();
 *   String create = generator.createSummaryTable(spec, "events");
 *   String select = generator.generate(routedQuery);
 * </pre>
 */
public class SQLGenerator {

    /**
     * Generates one flat SELECT statement.
     *
     * @param query the physical query
     * @return the SQL text
     */
    public String generate(PhysicalQuery query) {
        Objects.requireNonNull(query, "query must not be null");

        StringBuilder sql = new StringBuilder("SELECT ");
        StringJoiner select = new StringJoiner(", ");
        for (Projection projection : query.projections()) {
            select.add(projection.toSQL());
        }
        sql.append(select).append(" FROM ").append(quoteTableName(query.table()));

        if (!query.filters().isEmpty()) {
            StringJoiner where = new StringJoiner(" AND ", " WHERE ", "");
            for (Expression filter : query.filters()) {
                where.add(filter.toSQL());
            }
            sql.append(where);
        }

        if (!query.groupBy().isEmpty()) {
            StringJoiner groupBy = new StringJoiner(", ", " GROUP BY ", "");
            for (String column : query.groupBy()) {
                groupBy.add(quoteIdentifierIfNeeded(column));
            }
            sql.append(groupBy);
        }

        if (!query.orderBy().isEmpty()) {
            StringJoiner orderBy = new StringJoiner(", ", " ORDER BY ", "");
            for (OrderItem item : query.orderBy()) {
                orderBy.add(quoteIdentifierIfNeeded(item.expression()) + " " + item.direction().name());
            }
            sql.append(orderBy);
        }

        query.limit().ifPresent(limit -> sql.append(" LIMIT ").append(limit));
        return sql.toString();
    }

    /**
     * Builds the SELECT that computes a summary table from the main table.
     *
     * <p>Output columns are the dimensions followed by one column per
     * aggregate primitive, named by {@link AggregatePrimitive#outputColumn()}.
     * Constant filters become the WHERE clause.
     *
     * @param spec the summary spec
     * @param mainTable the main table name
     * @return the physical query
     */
    public PhysicalQuery summarySelect(SummarySpec spec, String mainTable) {
        PhysicalQuery.Builder builder = PhysicalQuery.builder(mainTable);
        for (String dimension : spec.dimensions()) {
            builder.project(Projection.column(dimension));
        }
        for (AggregatePrimitive primitive : spec.aggregates()) {
            Expression call = primitive.kind() == AggregatePrimitive.Kind.ROW_COUNT
                ? FunctionCall.countStar()
                : FunctionCall.aggregate(primitive.kind().function(), primitive.column());
            builder.project(Projection.aliased(call, primitive.outputColumn()));
        }
        for (Map.Entry<String, Object> constant : spec.constantFilters().entrySet()) {
            builder.filter(new BinaryExpression(ColumnReference.of(constant.getKey()),
                BinaryExpression.Operator.EQUAL, Literal.of(constant.getValue())));
        }
        builder.groupBy(spec.dimensions().toArray(new String[0]));
        return builder.build();
    }

    /**
     * Generates the statement that materializes a summary table.
     *
     * <pre>
     *   CREATE OR REPLACE TABLE summary_day_1a2b3c4d AS
     *   SELECT day, SUM(bid_price) AS sum_bid_price, COUNT(*) AS row_count
     *   FROM events WHERE (type = 'impression') GROUP BY day
     * </pre>
     *
     * @param spec a named summary spec
     * @param mainTable the main table name
     * @return the SQL text
     */
    public String createSummaryTable(SummarySpec spec, String mainTable) {
        Objects.requireNonNull(spec.tableName(), "spec must be named before materialization");
        return "CREATE OR REPLACE TABLE " + quoteTableName(spec.tableName()) + " AS " +
               generate(summarySelect(spec, mainTable));
    }

    /**
     * Generates the statement that drops a summary table.
     *
     * @param tableName the table name
     * @return the SQL text
     */
    public String dropTable(String tableName) {
        return "DROP TABLE IF EXISTS " + quoteTableName(tableName);
    }
}
