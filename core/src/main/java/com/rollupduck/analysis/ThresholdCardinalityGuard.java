package com.rollupduck.analysis;

import com.rollupduck.config.RollupConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Threshold-based cardinality guard.
 *
 * <p>A column is high-cardinality if it is listed in the configuration or its
 * distinct estimate is at least {@code rowCount / divisor}. The selectivity of
 * the constant filters is estimated as the product of {@code 1 / distinct(col)}
 * over the constant columns; columns without statistics contribute 1.
 *
 * <p>A dimension set is rejected when it holds a high-cardinality column and
 * the estimated selectivity exceeds {@code maxSelectivity}.
 */
public final class ThresholdCardinalityGuard implements CardinalityGuard {

    private static final Logger logger = LoggerFactory.getLogger(ThresholdCardinalityGuard.class);

    private final ColumnStatistics statistics;
    private final Set<String> flaggedColumns;
    private final long divisor;
    private final double maxSelectivity;

    public ThresholdCardinalityGuard(ColumnStatistics statistics, Set<String> flaggedColumns,
                                     long divisor, double maxSelectivity) {
        if (divisor <= 0) {
            throw new IllegalArgumentException("divisor must be positive: " + divisor);
        }
        this.statistics = Objects.requireNonNull(statistics, "statistics must not be null");
        this.flaggedColumns = Set.copyOf(flaggedColumns);
        this.divisor = divisor;
        this.maxSelectivity = maxSelectivity;
    }

    public static ThresholdCardinalityGuard fromConfig(RollupConfig config, ColumnStatistics statistics) {
        return new ThresholdCardinalityGuard(statistics, config.highCardinalityColumns(),
            config.guardDivisor(), config.guardMaxSelectivity());
    }

    @Override
    public boolean rejects(Set<String> dimensions, Map<String, Object> constantFilters) {
        String highCardinality = null;
        for (String dimension : dimensions) {
            if (isHighCardinality(dimension)) {
                highCardinality = dimension;
                break;
            }
        }
        if (highCardinality == null) {
            return false;
        }
        double selectivity = estimateSelectivity(constantFilters.keySet());
        boolean reject = selectivity > maxSelectivity;
        logger.debug("Dimension '{}' is high-cardinality, selectivity {} -> {}",
            highCardinality, selectivity, reject ? "reject" : "accept");
        return reject;
    }

    /**
     * Returns whether a column is listed as, or estimated to be, high-cardinality.
     *
     * @param column the column
     * @return true if high-cardinality
     */
    public boolean isHighCardinality(String column) {
        if (flaggedColumns.contains(column)) {
            return true;
        }
        OptionalLong distinct = statistics.distinctCount(column);
        if (distinct.isEmpty() || statistics.rowCount() == 0) {
            return false;
        }
        return distinct.getAsLong() >= (double) statistics.rowCount() / divisor;
    }

    /**
     * Estimates the fraction of rows kept by equality filters on the columns.
     *
     * @param constantColumns the filtered columns
     * @return the selectivity in (0, 1]
     */
    public double estimateSelectivity(Set<String> constantColumns) {
        double selectivity = 1.0;
        for (String column : constantColumns) {
            OptionalLong distinct = statistics.distinctCount(column);
            if (distinct.isPresent() && distinct.getAsLong() > 0) {
                selectivity /= distinct.getAsLong();
            }
        }
        return selectivity;
    }
}
