package com.rollupduck.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Row count and per-column distinct-value estimates of the main table.
 *
 * <p>Supplied by the loader or computed with
 * {@code com.rollupduck.runtime.ColumnStatisticsCollector}.
 */
public final class ColumnStatistics {

    private static final ColumnStatistics EMPTY = new ColumnStatistics(0, Map.of());

    private final long rowCount;
    private final Map<String, Long> distinctCounts;

    public ColumnStatistics(long rowCount, Map<String, Long> distinctCounts) {
        if (rowCount < 0) {
            throw new IllegalArgumentException("rowCount must not be negative: " + rowCount);
        }
        this.rowCount = rowCount;
        this.distinctCounts = Collections.unmodifiableMap(
            new LinkedHashMap<>(Objects.requireNonNull(distinctCounts, "distinctCounts must not be null")));
    }

    public static ColumnStatistics empty() {
        return EMPTY;
    }

    public long rowCount() {
        return rowCount;
    }

    public OptionalLong distinctCount(String column) {
        Long count = distinctCounts.get(column);
        return count == null ? OptionalLong.empty() : OptionalLong.of(count);
    }

    public Map<String, Long> distinctCounts() {
        return distinctCounts;
    }

    @Override
    public String toString() {
        return "ColumnStatistics{rowCount=" + rowCount + ", distinct=" + distinctCounts + "}";
    }
}
