package com.rollupduck.analysis;

import com.rollupduck.exception.MalformedQueryException;
import com.rollupduck.query.AggregateFunction;
import com.rollupduck.query.Operator;
import com.rollupduck.query.Predicate;
import com.rollupduck.query.Query;
import com.rollupduck.test.TestBase;
import com.rollupduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Unit
@TestCategories.Tier1
@DisplayName("Filter classification")
public class FilterClassifierTest extends TestBase {

    private FilterClassifier classifier;

    @Override
    protected void doSetUp() {
        classifier = new FilterClassifier();
    }

    private static Predicate sample(Operator operator) {
        return switch (operator) {
            case BETWEEN -> Predicate.between("day", "2024-10-20", "2024-10-23");
            case IN -> Predicate.in("day", List.of("2024-10-20", "2024-10-21"));
            default -> Predicate.of("day", operator, "2024-10-20");
        };
    }

    @Nested
    @DisplayName("Single predicates")
    class PredicateTests {

        @ParameterizedTest
        @EnumSource(Operator.class)
        @DisplayName("Any predicate on a GROUP BY column is ignored")
        void testGroupedColumnIgnored(Operator operator) {
            assertThat(classifier.classify(sample(operator), Set.of("day"))).isEqualTo(FilterClass.IGNORED);
        }

        @Test
        @DisplayName("Equality on a non-grouped column is a constant")
        void testEqualityIsConstant() {
            assertThat(classifier.classify(sample(Operator.EQ), Set.of("country"))).isEqualTo(FilterClass.CONSTANT);
        }

        @ParameterizedTest
        @EnumSource(value = Operator.class, names = {"LT", "LTE", "GT", "GTE", "BETWEEN", "IN"})
        @DisplayName("Other operators on a non-grouped column promote it to a dimension")
        void testOtherOperatorsAreDimensions(Operator operator) {
            assertThat(classifier.classify(sample(operator), Set.of())).isEqualTo(FilterClass.DIMENSION);
        }
    }

    @Nested
    @DisplayName("Whole queries")
    class QueryTests {

        @Test
        @DisplayName("Constants and filter dimensions feed the required sets")
        void testRequiredSets() {
            Classification classification = classifier.classify(publisherRevenueJP("q3"));
            logData("Classification", classification);

            assertThat(classification.requiredConstants())
                .containsExactly(Map.entry("country", "JP"), Map.entry("type", "impression"));
            assertThat(classification.filterDimensions()).containsExactly("day");
            assertThat(classification.requiredDimensions()).containsExactly("day", "publisher_id");
        }

        @Test
        @DisplayName("Classification preserves WHERE order and covers every predicate")
        void testTotality() {
            Query query = publisherRevenueJP("q3");
            Classification classification = classifier.classify(query);

            assertThat(classification.predicates()).extracting(ClassifiedPredicate::predicate)
                .containsExactlyElementsOf(query.where());
            assertThat(classification.ofClass(FilterClass.CONSTANT)).hasSize(2);
            assertThat(classification.ofClass(FilterClass.DIMENSION)).hasSize(1);
            assertThat(classification.ofClass(FilterClass.IGNORED)).isEmpty();
        }

        @Test
        @DisplayName("Repeated classification yields equal results")
        void testDeterminism() {
            Query query = publisherRevenueJP("q3");

            Classification first = classifier.classify(query);
            Classification second = classifier.classify(query);

            assertThat(second.predicates()).isEqualTo(first.predicates());
            assertThat(second.requiredDimensions()).isEqualTo(first.requiredDimensions());
            assertThat(second.requiredConstants()).isEqualTo(first.requiredConstants());
        }

        @Test
        @DisplayName("Repeated identical equality filters are tolerated")
        void testRepeatedEquality() {
            Query query = Query.builder("q1")
                .select(AggregateFunction.COUNT, "*")
                .where(Predicate.eq("country", "JP"), Predicate.eq("country", "JP"))
                .build();

            assertThat(classifier.classify(query).requiredConstants()).containsOnlyKeys("country");
        }

        @Test
        @DisplayName("Conflicting equality filters on one column are malformed")
        void testConflictingEquality() {
            Query query = Query.builder("q9")
                .select(AggregateFunction.COUNT, "*")
                .where(Predicate.eq("country", "JP"), Predicate.eq("country", "US"))
                .build();

            assertThatThrownBy(() -> classifier.classify(query))
                .isInstanceOf(MalformedQueryException.class)
                .hasMessageContaining("country");
        }
    }
}
