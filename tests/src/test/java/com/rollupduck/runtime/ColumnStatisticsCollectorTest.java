package com.rollupduck.runtime;

import com.rollupduck.analysis.ColumnStatistics;
import com.rollupduck.analysis.ThresholdCardinalityGuard;
import com.rollupduck.exception.QueryExecutionException;
import com.rollupduck.test.TestBase;
import com.rollupduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Integration
@TestCategories.Tier2
@DisplayName("Column statistics")
public class ColumnStatisticsCollectorTest extends TestBase {

    private DuckDBRuntime runtime;
    private ColumnStatisticsCollector collector;

    @Override
    protected void doSetUp() {
        runtime = DuckDBRuntime.createInMemory();
        QueryExecutor executor = new QueryExecutor(runtime);
        executor.executeUpdate(CREATE_EVENTS);
        collector = new ColumnStatisticsCollector(executor);
    }

    @Override
    protected void doTearDown() {
        runtime.close();
    }

    @Test
    @DisplayName("Row count is exact and distinct counts are close")
    void testCollect() {
        ColumnStatistics stats = collector.collect("events", List.of("day", "country", "minute"));
        logData("Statistics", stats);

        assertThat(stats.rowCount()).isEqualTo(EVENT_ROWS);
        assertThat(stats.distinctCount("day").getAsLong()).isBetween(7L, 9L);
        assertThat(stats.distinctCount("country").getAsLong()).isBetween(3L, 5L);
        assertThat(stats.distinctCount("minute").getAsLong()).isBetween(4500L, 5500L);
        assertThat(stats.distinctCount("type")).isEmpty();
    }

    @Test
    @DisplayName("Collected statistics flag the per-row column only")
    void testGuardOnCollectedStats() {
        ColumnStatistics stats = collector.collect("events", List.of("day", "publisher_id", "minute"));
        ThresholdCardinalityGuard guard = new ThresholdCardinalityGuard(stats, Set.of(), 10, 0.05);

        assertThat(guard.isHighCardinality("minute")).isTrue();
        assertThat(guard.isHighCardinality("day")).isFalse();
        assertThat(guard.isHighCardinality("publisher_id")).isFalse();
        assertThat(guard.rejects(Set.of("minute"), Map.of())).isTrue();
        assertThat(guard.rejects(Set.of("day", "publisher_id"), Map.of())).isFalse();
    }

    @Test
    @DisplayName("Unknown column raises an execution error")
    void testUnknownColumn() {
        assertThatThrownBy(() -> collector.collect("events", List.of("no_such_column")))
            .isInstanceOf(QueryExecutionException.class);
    }
}
