package com.rollupduck.runtime;

import com.rollupduck.analysis.ColumnStatistics;
import com.rollupduck.generator.SQLQuoting;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Computes row count and approximate distinct counts for the cardinality guard.
 *
 * <pre>
 *   SELECT COUNT(*), approx_count_distinct(day), approx_count_distinct(minute) FROM events
 * </pre>
 */
public class ColumnStatisticsCollector {

    private final QueryExecutor executor;

    public ColumnStatisticsCollector(QueryExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /**
     * Collects statistics for the given columns in one scan.
     *
     * @param table the table to scan
     * @param columns the columns to estimate
     * @return the statistics
     * @throws com.rollupduck.exception.QueryExecutionException if the scan fails
     */
    public ColumnStatistics collect(String table, Collection<String> columns) {
        List<String> ordered = new ArrayList<>(columns);
        StringJoiner select = new StringJoiner(", ", "SELECT ", " FROM " + SQLQuoting.quoteTableName(table));
        select.add("COUNT(*)");
        for (String column : ordered) {
            select.add("approx_count_distinct(" + SQLQuoting.quoteIdentifierIfNeeded(column) + ")");
        }

        QueryResult result = executor.executeQuery(select.toString());
        long rowCount = toLong(result.get(0, 0));
        Map<String, Long> distinct = new LinkedHashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            distinct.put(ordered.get(i), toLong(result.get(0, i + 1)));
        }
        return new ColumnStatistics(rowCount, distinct);
    }

    private static long toLong(Object value) {
        return value == null ? 0L : ((Number) value).longValue();
    }
}
