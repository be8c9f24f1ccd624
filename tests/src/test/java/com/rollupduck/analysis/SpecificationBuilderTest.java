package com.rollupduck.analysis;

import com.rollupduck.query.AggregateFunction;
import com.rollupduck.query.AggregateItem;
import com.rollupduck.query.Query;
import com.rollupduck.test.TestBase;
import com.rollupduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@TestCategories.Unit
@TestCategories.Tier1
@DisplayName("Specification building")
public class SpecificationBuilderTest extends TestBase {

    private SpecificationBuilder builder;

    @Override
    protected void doSetUp() {
        builder = new SpecificationBuilder(CardinalityGuard.never());
    }

    private SummarySpec candidate(Query query) {
        BuildOutcome outcome = builder.build(query);
        assertThat(outcome).isInstanceOf(BuildOutcome.Candidate.class);
        return ((BuildOutcome.Candidate) outcome).spec();
    }

    @Nested
    @DisplayName("Aggregate primitives")
    class PrimitiveTests {

        @Test
        @DisplayName("SUM maps to Sum and RowCount is always present")
        void testSum() {
            SummarySpec spec = candidate(dailyImpressionSpend("q1"));

            assertThat(spec.aggregates()).containsExactly(
                AggregatePrimitive.sum("bid_price"), AggregatePrimitive.rowCount());
        }

        @Test
        @DisplayName("AVG implies both Sum and RowCount")
        void testAverage() {
            SummarySpec spec = candidate(dailyImpressionAverage("q2"));

            assertThat(spec.aggregates()).contains(AggregatePrimitive.sum("bid_price"), AggregatePrimitive.rowCount());
            assertThat(spec.canSatisfy(new AggregateItem(AggregateFunction.AVG, "bid_price"))).isTrue();
        }

        @Test
        @DisplayName("MIN and MAX map to themselves, COUNT(*) to RowCount only")
        void testMinMaxCount() {
            Query query = Query.builder("q1")
                .select("country")
                .select(AggregateFunction.MIN, "bid_price")
                .select(AggregateFunction.MAX, "bid_price")
                .select(AggregateFunction.COUNT, "*")
                .groupBy("country")
                .build();

            SummarySpec spec = candidate(query);

            assertThat(spec.aggregates()).containsExactlyInAnyOrder(
                AggregatePrimitive.rowCount(), AggregatePrimitive.min("bid_price"), AggregatePrimitive.max("bid_price"));
        }

        @Test
        @DisplayName("Output columns follow the sum_/min_/max_ naming")
        void testOutputColumns() {
            assertThat(AggregatePrimitive.sum("bid_price").outputColumn()).isEqualTo("sum_bid_price");
            assertThat(AggregatePrimitive.min("bid_price").outputColumn()).isEqualTo("min_bid_price");
            assertThat(AggregatePrimitive.max("bid_price").outputColumn()).isEqualTo("max_bid_price");
            assertThat(AggregatePrimitive.rowCount().outputColumn()).isEqualTo("row_count");
        }
    }

    @Nested
    @DisplayName("Dimensions and constants")
    class SignatureTests {

        @Test
        @DisplayName("Range filter column joins the GROUP BY columns as a dimension")
        void testFilterDimension() {
            SummarySpec spec = candidate(publisherRevenueJP("q3"));

            assertThat(spec.dimensions()).containsExactly("day", "publisher_id");
            assertThat(spec.constantFilters()).isEqualTo(Map.of("type", "impression", "country", "JP"));
            assertThat(spec.sourceQueries()).containsExactly("q3");
            assertThat(spec.tableName()).isNull();
        }

        @Test
        @DisplayName("Spec dimensions are exactly the signature dimensions")
        void testSignatureConsistency() {
            SummarySpec spec = candidate(publisherRevenueJP("q3"));

            assertThat(spec.dimensions()).isEqualTo(spec.signature().dimensions());
            assertThat(spec.constantFilters()).isEqualTo(spec.signature().constants());
        }
    }

    @Nested
    @DisplayName("Rejections")
    class RejectionTests {

        @Test
        @DisplayName("COUNT of a column is not decomposable")
        void testCountColumn() {
            Query query = Query.builder("q1").select(AggregateFunction.COUNT, "bid_price").build();

            BuildOutcome outcome = builder.build(query);

            assertThat(outcome).isEqualTo(new BuildOutcome.Rejected(
                "q1", RejectionReason.NON_DECOMPOSABLE_AGGREGATE, "COUNT(bid_price)"));
        }

        @Test
        @DisplayName("Plain projections are not summarizable")
        void testPlainProjection() {
            BuildOutcome outcome = builder.build(Query.builder("q1").select("day").build());

            assertThat(outcome).isInstanceOfSatisfying(BuildOutcome.Rejected.class,
                rejected -> assertThat(rejected.reason()).isEqualTo(RejectionReason.NOT_AGGREGATED));
        }

        @Test
        @DisplayName("Guard rejection yields HIGH_CARDINALITY")
        void testGuardRejection() {
            SpecificationBuilder guarded = new SpecificationBuilder(
                (dimensions, constants) -> dimensions.contains("minute") && constants.isEmpty());
            Query query = Query.builder("q4")
                .select("minute")
                .select(AggregateFunction.COUNT, "*")
                .groupBy("minute")
                .build();

            BuildOutcome outcome = guarded.build(query);

            assertThat(outcome).isInstanceOfSatisfying(BuildOutcome.Rejected.class, rejected -> {
                assertThat(rejected.queryId()).isEqualTo("q4");
                assertThat(rejected.reason()).isEqualTo(RejectionReason.HIGH_CARDINALITY);
            });
        }

        @Test
        @DisplayName("Guard sees the full dimension set and constants")
        void testGuardInputs() {
            AtomicReference<Set<String>> seenDimensions = new AtomicReference<>();
            AtomicReference<Map<String, Object>> seenConstants = new AtomicReference<>();
            SpecificationBuilder recording = new SpecificationBuilder((dimensions, constants) -> {
                seenDimensions.set(dimensions);
                seenConstants.set(constants);
                return false;
            });

            recording.build(publisherRevenueJP("q3"));

            assertThat(seenDimensions.get()).containsExactly("day", "publisher_id");
            assertThat(seenConstants.get()).containsOnlyKeys("country", "type");
        }
    }
}
