package com.rollupduck.analysis;

import com.rollupduck.config.RollupConfig;
import com.rollupduck.test.TestBase;
import com.rollupduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@TestCategories.Unit
@TestCategories.Tier1
@DisplayName("Threshold cardinality guard")
public class ThresholdCardinalityGuardTest extends TestBase {

    private static final ColumnStatistics STATS = new ColumnStatistics(1_000_000, Map.of(
        "minute", 525_600L,
        "day", 30L,
        "type", 3L,
        "country", 50L,
        "publisher_id", 2_000L,
        "user_id", 400_000L));

    private ThresholdCardinalityGuard guard;

    @Override
    protected void doSetUp() {
        guard = ThresholdCardinalityGuard.fromConfig(RollupConfig.defaults(), STATS);
    }

    @Test
    @DisplayName("Distinct count at or above rowCount/divisor is high-cardinality")
    void testHighCardinalityDetection() {
        assertThat(guard.isHighCardinality("minute")).isTrue();
        assertThat(guard.isHighCardinality("user_id")).isTrue();
        assertThat(guard.isHighCardinality("publisher_id")).isFalse();
        assertThat(guard.isHighCardinality("unknown")).isFalse();
    }

    @Test
    @DisplayName("Configured columns are high-cardinality regardless of statistics")
    void testConfiguredColumns() {
        ThresholdCardinalityGuard configured = ThresholdCardinalityGuard.fromConfig(
            RollupConfig.builder().highCardinalityColumns(Set.of("publisher_id")).build(), STATS);

        assertThat(configured.isHighCardinality("publisher_id")).isTrue();
        assertThat(configured.rejects(Set.of("publisher_id"), Map.of())).isTrue();
    }

    @Test
    @DisplayName("High-cardinality dimension without narrowing constants is rejected")
    void testRejectsUnfiltered() {
        assertThat(guard.rejects(Set.of("minute"), Map.of())).isTrue();
    }

    @Test
    @DisplayName("Constant filters selective enough keep the summary")
    void testNarrowingConstants() {
        // 1/3 * 1/50 = 0.0067 <= 0.05
        assertThat(guard.rejects(Set.of("minute"), Map.of("type", "impression", "country", "JP"))).isFalse();
    }

    @Test
    @DisplayName("Weak constant filter does not rescue a high-cardinality dimension")
    void testWeakConstant() {
        // 1/3 > 0.05
        assertThat(guard.rejects(Set.of("minute", "day"), Map.of("type", "impression"))).isTrue();
    }

    @Test
    @DisplayName("Low-cardinality dimensions are always accepted")
    void testLowCardinality() {
        assertThat(guard.rejects(Set.of("day", "publisher_id", "country"), Map.of())).isFalse();
    }

    @Test
    @DisplayName("Selectivity multiplies 1/distinct and ignores unknown columns")
    void testSelectivity() {
        assertThat(guard.estimateSelectivity(Set.of("type", "country", "unknown")))
            .isCloseTo(1.0 / 150, within(1e-12));
        assertThat(guard.estimateSelectivity(Set.of())).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Permissive guard never rejects")
    void testNever() {
        assertThat(CardinalityGuard.never().rejects(Set.of("minute"), Map.of())).isFalse();
    }
}
