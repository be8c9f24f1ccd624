package com.rollupduck.routing;

import com.rollupduck.analysis.AggregatePrimitive;
import com.rollupduck.analysis.BatchAnalysis;
import com.rollupduck.analysis.BatchAnalyzer;
import com.rollupduck.analysis.CardinalityGuard;
import com.rollupduck.analysis.Catalog;
import com.rollupduck.analysis.Signature;
import com.rollupduck.analysis.SpecificationBuilder;
import com.rollupduck.analysis.SummarySpec;
import com.rollupduck.generator.SQLGenerator;
import com.rollupduck.query.AggregateFunction;
import com.rollupduck.query.Operator;
import com.rollupduck.query.Predicate;
import com.rollupduck.query.Query;
import com.rollupduck.test.TestBase;
import com.rollupduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

@TestCategories.Unit
@TestCategories.Tier1
@DisplayName("Query routing")
public class QueryRouterTest extends TestBase {

    private SQLGenerator generator;

    @Override
    protected void doSetUp() {
        generator = new SQLGenerator();
    }

    private static BatchAnalysis analyze(CardinalityGuard guard, Query... queries) {
        try (BatchAnalyzer analyzer = new BatchAnalyzer(new SpecificationBuilder(guard), 2)) {
            return analyzer.analyze(List.of(queries));
        }
    }

    private static SummarySpec spec(String table, Set<String> dimensions, Map<String, Object> constants,
                                    AggregatePrimitive... aggregates) {
        return SummarySpec.of(table, Signature.of(dimensions, constants), List.of(aggregates), List.of());
    }

    @Nested
    @DisplayName("Reference scenarios")
    class ScenarioTests {

        @Test
        @DisplayName("SUM and AVG queries share one table and re-aggregate")
        void testSharedTable() {
            BatchAnalysis analysis = analyze(CardinalityGuard.never(),
                dailyImpressionSpend("q1"), dailyImpressionAverage("q2"));
            QueryRouter router = QueryRouter.forAnalysis(analysis);
            String table = analysis.catalog().specs().get(0).tableName();

            RoutingResult first = router.route(dailyImpressionSpend("q1"));
            RoutingResult second = router.route(dailyImpressionAverage("q2"));

            assertThat(first).isInstanceOf(RoutingResult.Routed.class);
            assertThat(second).isInstanceOf(RoutingResult.Routed.class);
            assertThat(((RoutingResult.Routed) first).spec()).isSameAs(((RoutingResult.Routed) second).spec());

            String sql1 = generator.generate(first.physicalQuery("events"));
            String sql2 = generator.generate(second.physicalQuery("events"));
            logData("Rewritten SUM", sql1);
            logData("Rewritten AVG", sql2);
            assertThat(sql1).isEqualTo(
                "SELECT day, SUM(sum_bid_price) AS \"SUM(bid_price)\" FROM " + table + " GROUP BY day");
            assertThat(sql2).isEqualTo(
                "SELECT day, (SUM(sum_bid_price) / SUM(row_count)) AS \"AVG(bid_price)\" FROM " + table +
                " GROUP BY day");
        }

        @Test
        @DisplayName("High-cardinality rejection pins the query to the main table")
        void testHighCardinalityFallback() {
            Query minutes = Query.builder("q4")
                .select("minute")
                .select(AggregateFunction.COUNT, "*")
                .groupBy("minute")
                .build();
            BatchAnalysis analysis = analyze(
                (dimensions, constants) -> dimensions.contains("minute") && constants.isEmpty(), minutes);

            RoutingResult result = QueryRouter.forAnalysis(analysis).route(minutes);

            assertThat(analysis.catalog().isEmpty()).isTrue();
            assertThat(result).isEqualTo(new RoutingResult.Fallback(minutes));
        }

        @Test
        @DisplayName("Range filter is re-applied and the extra dimension aggregated away")
        void testFilterDimensionRewrite() {
            BatchAnalysis analysis = analyze(CardinalityGuard.never(), publisherRevenueJP("q3"));
            SummarySpec spec = analysis.catalog().specs().get(0);

            RoutingResult result = QueryRouter.forAnalysis(analysis).route(publisherRevenueJP("q3"));

            assertThat(spec.dimensions()).containsExactly("day", "publisher_id");
            assertThat(generator.generate(result.physicalQuery("events"))).isEqualTo(
                "SELECT publisher_id, SUM(sum_bid_price) AS \"SUM(bid_price)\" FROM " + spec.tableName() +
                " WHERE (day BETWEEN '2024-10-20' AND '2024-10-23') GROUP BY publisher_id");
        }

        @Test
        @DisplayName("Different constants route to their own tables")
        void testDistinctConstants() {
            BatchAnalysis analysis = analyze(CardinalityGuard.never(),
                countryCount("us", "US"), countryCount("jp", "JP"));
            QueryRouter router = QueryRouter.forAnalysis(analysis);

            RoutingResult us = router.route(countryCount("us", "US"));
            RoutingResult jp = router.route(countryCount("jp", "JP"));

            assertThat(analysis.catalog().size()).isEqualTo(2);
            assertThat(((RoutingResult.Routed) us).spec().tableName())
                .isNotEqualTo(((RoutingResult.Routed) jp).spec().tableName());
            assertThat(((RoutingResult.Routed) us).spec().constantFilters()).containsEntry("country", "US");
        }

        @Test
        @DisplayName("Missing MIN primitive forces fallback")
        void testUnsatisfiableAggregate() {
            Catalog catalog = Catalog.of(List.of(spec("summary_daily", Set.of("day"), Map.of("type", "impression"),
                AggregatePrimitive.sum("price"))));
            Query query = Query.builder("q5")
                .select("day")
                .select(AggregateFunction.MIN, "price")
                .where(Predicate.eq("type", "impression"))
                .groupBy("day")
                .build();

            assertThat(new QueryRouter(catalog).route(query)).isEqualTo(new RoutingResult.Fallback(query));
        }
    }

    @Nested
    @DisplayName("Matching rules")
    class MatchingTests {

        private final SummarySpec byDayCountry = spec("by_day_country", Set.of("day", "country"),
            Map.of("type", "impression"), AggregatePrimitive.sum("bid_price"));
        private final SummarySpec byDay = spec("by_day", Set.of("day"),
            Map.of("type", "impression"), AggregatePrimitive.sum("bid_price"));
        private final SummarySpec byDayPublisher = spec("by_day_publisher", Set.of("day", "publisher_id"),
            Map.of("type", "impression"), AggregatePrimitive.sum("bid_price"));
        private final Catalog catalog = Catalog.of(List.of(byDayCountry, byDay, byDayPublisher));

        @Test
        @DisplayName("Fewest extra dimensions wins")
        void testFewestExtras() {
            RoutingResult result = new QueryRouter(catalog).route(dailyImpressionSpend("q"));

            assertThat(((RoutingResult.Routed) result).spec().tableName()).isEqualTo("by_day");
        }

        @Test
        @DisplayName("Ties go to the earliest catalog entry")
        void testTieBreak() {
            Query query = dailyImpressionSpend("q");

            RoutingResult first = new QueryRouter(Catalog.of(List.of(byDayPublisher, byDayCountry))).route(query);
            RoutingResult second = new QueryRouter(Catalog.of(List.of(byDayCountry, byDayPublisher))).route(query);

            assertThat(((RoutingResult.Routed) first).spec().tableName()).isEqualTo("by_day_publisher");
            assertThat(((RoutingResult.Routed) second).spec().tableName()).isEqualTo("by_day_country");
        }

        @Test
        @DisplayName("A table with extra dimensions answers a coarser query")
        void testSupersetDimensions() {
            Catalog onlyFine = Catalog.of(List.of(byDayCountry));

            RoutingResult result = new QueryRouter(onlyFine).route(dailyImpressionSpend("q"));

            assertThat(result.isRouted()).isTrue();
            assertThat(generator.generate(result.physicalQuery("events")))
                .isEqualTo("SELECT day, SUM(sum_bid_price) AS \"SUM(bid_price)\" FROM by_day_country GROUP BY day");
        }

        @Test
        @DisplayName("Extra constant filter on the query prevents a match")
        void testExtraConstant() {
            Query query = Query.builder("q")
                .select("day")
                .select(AggregateFunction.SUM, "bid_price")
                .where(Predicate.eq("type", "impression"), Predicate.eq("country", "JP"))
                .groupBy("day")
                .build();

            assertThat(new QueryRouter(catalog).route(query).isRouted()).isFalse();
        }

        @Test
        @DisplayName("Missing constant filter on the query prevents a match")
        void testMissingConstant() {
            Query query = Query.builder("q")
                .select("day")
                .select(AggregateFunction.SUM, "bid_price")
                .groupBy("day")
                .build();

            assertThat(new QueryRouter(catalog).route(query).isRouted()).isFalse();
        }

        @Test
        @DisplayName("Dimension not carried by any table prevents a match")
        void testMissingDimension() {
            Query query = Query.builder("q")
                .select("publisher_id")
                .select(AggregateFunction.SUM, "bid_price")
                .where(Predicate.eq("type", "impression"))
                .groupBy("publisher_id")
                .build();

            assertThat(new QueryRouter(catalog).route(query).isRouted()).isFalse();
        }

        @Test
        @DisplayName("Predicate on a grouped column does not change the match")
        void testGroupedColumnPredicate() {
            Query query = dailyImpressionSpend("q").toBuilder("q")
                .where(Predicate.of("day", Operator.GTE, "2024-10-21"))
                .build();

            RoutingResult result = new QueryRouter(catalog).route(query);

            assertThat(((RoutingResult.Routed) result).spec().tableName()).isEqualTo("by_day");
            assertThat(generator.generate(result.physicalQuery("events")))
                .contains("WHERE (day >= '2024-10-21')");
        }

        @Test
        @DisplayName("COUNT of a column and plain projections always fall back")
        void testNonSummarizable() {
            QueryRouter router = new QueryRouter(catalog);
            Query countColumn = Query.builder("q")
                .select("day")
                .select(AggregateFunction.COUNT, "bid_price")
                .where(Predicate.eq("type", "impression"))
                .groupBy("day")
                .build();
            Query projection = Query.builder("p").select("day").where(Predicate.eq("type", "impression")).build();

            assertThat(router.route(countColumn).isRouted()).isFalse();
            assertThat(router.route(projection).isRouted()).isFalse();
        }

        @Test
        @DisplayName("Query with conflicting constants falls back instead of failing")
        void testMalformedFallsBack() {
            Query query = Query.builder("q")
                .select(AggregateFunction.COUNT, "*")
                .where(Predicate.eq("type", "impression"), Predicate.eq("type", "click"))
                .build();

            assertThat(new QueryRouter(catalog).route(query)).isEqualTo(new RoutingResult.Fallback(query));
        }

        @Test
        @DisplayName("Empty catalog always falls back")
        void testEmptyCatalog() {
            assertThat(new QueryRouter(Catalog.empty()).route(dailyImpressionSpend("q")).isRouted()).isFalse();
        }
    }

    @Nested
    @DisplayName("Fallback safeguards")
    class SafeguardTests {

        @Test
        @DisplayName("Ungrouped bare column falls back even when a table would match")
        void testUngroupedColumnFallsBack() {
            BatchAnalysis analysis = analyze(CardinalityGuard.never(), dailyImpressionSpend("q1"));
            Query ungrouped = Query.builder("bad")
                .select("day")
                .select(AggregateFunction.SUM, "bid_price")
                .where(Predicate.eq("type", "impression"))
                .build();

            RoutingResult result = QueryRouter.forAnalysis(analysis).route(ungrouped);

            assertThat(analysis.catalog().size()).isEqualTo(1);
            assertThat(result).isEqualTo(new RoutingResult.Fallback(ungrouped));
        }

        @Test
        @DisplayName("Different query reusing a rejected id is routed normally")
        void testPinningIsByQueryNotId() {
            Query minutes = Query.builder("q4")
                .select("minute")
                .select(AggregateFunction.COUNT, "*")
                .groupBy("minute")
                .build();
            BatchAnalysis analysis = analyze(
                (dimensions, constants) -> dimensions.contains("minute") && constants.isEmpty(),
                minutes, dailyImpressionSpend("q1"));
            QueryRouter router = QueryRouter.forAnalysis(analysis);

            RoutingResult rejected = router.route(minutes);
            RoutingResult adHoc = router.route(dailyImpressionSpend("q4"));

            assertThat(rejected).isEqualTo(new RoutingResult.Fallback(minutes));
            assertThat(adHoc.isRouted()).isTrue();
            assertThat(((RoutingResult.Routed) adHoc).spec().sourceQueries()).containsExactly("q1");
        }
    }

    @Nested
    @DisplayName("Determinism")
    class DeterminismTests {

        @Test
        @DisplayName("Routing the same query twice gives equal results")
        void testRepeatable() {
            BatchAnalysis analysis = analyze(CardinalityGuard.never(),
                dailyImpressionSpend("q1"), publisherRevenueJP("q3"));
            QueryRouter router = QueryRouter.forAnalysis(analysis);

            assertThat(router.route(publisherRevenueJP("q3"))).isEqualTo(router.route(publisherRevenueJP("q3")));
        }

        @Test
        @DisplayName("Concurrent routing agrees with sequential routing")
        void testConcurrentRouting() throws Exception {
            BatchAnalysis analysis = analyze(CardinalityGuard.never(),
                dailyImpressionSpend("q1"), dailyImpressionAverage("q2"), publisherRevenueJP("q3"));
            QueryRouter router = QueryRouter.forAnalysis(analysis);
            List<Query> queries = List.of(
                dailyImpressionSpend("q1"), dailyImpressionAverage("q2"), publisherRevenueJP("q3"),
                countryCount("q4", "JP"));
            List<RoutingResult> expected = new ArrayList<>();
            for (Query query : queries) {
                expected.add(router.route(query));
            }

            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Future<RoutingResult>> futures = new ArrayList<>();
                for (int i = 0; i < 200; i++) {
                    Query query = queries.get(i % queries.size());
                    futures.add(pool.submit(() -> router.route(query)));
                }
                for (int i = 0; i < futures.size(); i++) {
                    assertThat(futures.get(i).get()).isEqualTo(expected.get(i % queries.size()));
                }
            } finally {
                pool.shutdownNow();
            }
        }
    }
}
