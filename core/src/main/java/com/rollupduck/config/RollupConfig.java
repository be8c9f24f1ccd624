package com.rollupduck.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration for analysis, routing and materialization.
 *
 * <p>Values are read from {@code rollupduck.*} system properties; missing or
 * unparsable values fall back to the defaults.
 *
 * <table>
 *   <caption>Properties</caption>
 *   <tr><th>Property</th><th>Default</th></tr>
 *   <tr><td>rollupduck.mainTable</td><td>events</td></tr>
 *   <tr><td>rollupduck.guard.divisor</td><td>10</td></tr>
 *   <tr><td>rollupduck.guard.maxSelectivity</td><td>0.05</td></tr>
 *   <tr><td>rollupduck.guard.highCardinalityColumns</td><td>(none)</td></tr>
 *   <tr><td>rollupduck.analysis.threads</td><td>min(cores, 8)</td></tr>
 *   <tr><td>rollupduck.materialize.failFast</td><td>false</td></tr>
 * </table>
 */
public final class RollupConfig {

    private static final Logger logger = LoggerFactory.getLogger(RollupConfig.class);

    public static final String PROP_MAIN_TABLE = "rollupduck.mainTable";
    public static final String PROP_GUARD_DIVISOR = "rollupduck.guard.divisor";
    public static final String PROP_GUARD_MAX_SELECTIVITY = "rollupduck.guard.maxSelectivity";
    public static final String PROP_GUARD_HIGH_CARDINALITY_COLUMNS = "rollupduck.guard.highCardinalityColumns";
    public static final String PROP_ANALYSIS_THREADS = "rollupduck.analysis.threads";
    public static final String PROP_MATERIALIZE_FAIL_FAST = "rollupduck.materialize.failFast";

    public static final String DEFAULT_MAIN_TABLE = "events";
    public static final long DEFAULT_GUARD_DIVISOR = 10;
    public static final double DEFAULT_GUARD_MAX_SELECTIVITY = 0.05;

    private final String mainTable;
    private final long guardDivisor;
    private final double guardMaxSelectivity;
    private final Set<String> highCardinalityColumns;
    private final int analysisThreads;
    private final boolean failFastMaterialization;

    private RollupConfig(Builder builder) {
        this.mainTable = Objects.requireNonNull(builder.mainTable, "mainTable must not be null");
        this.guardDivisor = builder.guardDivisor;
        this.guardMaxSelectivity = builder.guardMaxSelectivity;
        this.highCardinalityColumns = Collections.unmodifiableSet(new LinkedHashSet<>(builder.highCardinalityColumns));
        this.analysisThreads = builder.analysisThreads;
        this.failFastMaterialization = builder.failFastMaterialization;
    }

    /**
     * Returns the configuration with every value at its default.
     *
     * @return the default configuration
     */
    public static RollupConfig defaults() {
        return builder().build();
    }

    /**
     * Reads the configuration from system properties.
     *
     * @return the configuration
     */
    public static RollupConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Reads the configuration from the given properties.
     *
     * @param props the properties
     * @return the configuration
     */
    public static RollupConfig fromProperties(Properties props) {
        Builder builder = builder();

        String mainTable = props.getProperty(PROP_MAIN_TABLE);
        if (mainTable != null && !mainTable.isBlank()) {
            builder.mainTable(mainTable.trim());
        }

        long divisor = parseLong(PROP_GUARD_DIVISOR, props.getProperty(PROP_GUARD_DIVISOR), -1);
        if (divisor > 0) {
            builder.guardDivisor(divisor);
        }

        double selectivity = parseDouble(PROP_GUARD_MAX_SELECTIVITY, props.getProperty(PROP_GUARD_MAX_SELECTIVITY), -1);
        if (selectivity >= 0 && selectivity <= 1) {
            builder.guardMaxSelectivity(selectivity);
        }

        String columns = props.getProperty(PROP_GUARD_HIGH_CARDINALITY_COLUMNS);
        if (columns != null) {
            builder.highCardinalityColumns(Arrays.stream(columns.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new)));
        }

        long threads = parseLong(PROP_ANALYSIS_THREADS, props.getProperty(PROP_ANALYSIS_THREADS), -1);
        if (threads > 0 && threads <= Integer.MAX_VALUE) {
            builder.analysisThreads((int) threads);
        }

        String failFast = props.getProperty(PROP_MATERIALIZE_FAIL_FAST);
        if (failFast != null) {
            builder.failFastMaterialization(Boolean.parseBoolean(failFast.trim()));
        }

        return builder.build();
    }

    public String mainTable() {
        return mainTable;
    }

    public long guardDivisor() {
        return guardDivisor;
    }

    public double guardMaxSelectivity() {
        return guardMaxSelectivity;
    }

    public Set<String> highCardinalityColumns() {
        return highCardinalityColumns;
    }

    public int analysisThreads() {
        return analysisThreads;
    }

    public boolean failFastMaterialization() {
        return failFastMaterialization;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "RollupConfig{mainTable=" + mainTable +
               ", guardDivisor=" + guardDivisor +
               ", guardMaxSelectivity=" + guardMaxSelectivity +
               ", highCardinalityColumns=" + highCardinalityColumns +
               ", analysisThreads=" + analysisThreads +
               ", failFastMaterialization=" + failFastMaterialization + "}";
    }

    private static long parseLong(String property, String value, long fallback) {
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Ignoring {}={}: not an integer", property, value);
            }
        }
        return fallback;
    }

    private static double parseDouble(String property, String value, double fallback) {
        if (value != null) {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Ignoring {}={}: not a number", property, value);
            }
        }
        return fallback;
    }

    /**
     * Builder for {@link RollupConfig}.
     */
    public static final class Builder {
        private String mainTable = DEFAULT_MAIN_TABLE;
        private long guardDivisor = DEFAULT_GUARD_DIVISOR;
        private double guardMaxSelectivity = DEFAULT_GUARD_MAX_SELECTIVITY;
        private Set<String> highCardinalityColumns = Set.of();
        private int analysisThreads = Math.min(Runtime.getRuntime().availableProcessors(), 8);
        private boolean failFastMaterialization = false;

        private Builder() {}

        public Builder mainTable(String value) {
            this.mainTable = value;
            return this;
        }

        public Builder guardDivisor(long value) {
            if (value <= 0) {
                throw new IllegalArgumentException("guardDivisor must be positive: " + value);
            }
            this.guardDivisor = value;
            return this;
        }

        public Builder guardMaxSelectivity(double value) {
            if (value < 0 || value > 1) {
                throw new IllegalArgumentException("guardMaxSelectivity must be within [0, 1]: " + value);
            }
            this.guardMaxSelectivity = value;
            return this;
        }

        public Builder highCardinalityColumns(Set<String> value) {
            this.highCardinalityColumns = Objects.requireNonNull(value, "highCardinalityColumns must not be null");
            return this;
        }

        public Builder analysisThreads(int value) {
            if (value <= 0) {
                throw new IllegalArgumentException("analysisThreads must be positive: " + value);
            }
            this.analysisThreads = value;
            return this;
        }

        public Builder failFastMaterialization(boolean value) {
            this.failFastMaterialization = value;
            return this;
        }

        public RollupConfig build() {
            return new RollupConfig(this);
        }
    }
}
