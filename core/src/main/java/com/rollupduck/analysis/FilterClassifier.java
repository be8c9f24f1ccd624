package com.rollupduck.analysis;

import com.rollupduck.query.Predicate;
import com.rollupduck.query.Query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Classifies each predicate of a query as {@link FilterClass#IGNORED},
 * {@link FilterClass#CONSTANT} or {@link FilterClass#DIMENSION}.
 *
 * <p>Rules:
 * <pre>
 *   column in GROUP BY              -> IGNORED    (filtered at query time)
 *   operator = eq                   -> CONSTANT   (baked into the summary)
 *   any other operator              -> DIMENSION  (column added to the summary grouping)
 * </pre>
 *
 * <p>Classification is a pure function of the predicate and the GROUP BY set;
 * the classifier holds no state and is safe to share between threads.
 */
public final class FilterClassifier {

    /**
     * Classifies a single predicate.
     *
     * @param predicate the predicate
     * @param groupBy the query's GROUP BY columns
     * @return the filter class
     */
    public FilterClass classify(Predicate predicate, Set<String> groupBy) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        Objects.requireNonNull(groupBy, "groupBy must not be null");

        if (groupBy.contains(predicate.column())) {
            return FilterClass.IGNORED;
        }
        return switch (predicate.operator()) {
            case EQ -> FilterClass.CONSTANT;
            case LT, LTE, GT, GTE, BETWEEN, IN -> FilterClass.DIMENSION;
        };
    }

    /**
     * Classifies every predicate of a query.
     *
     * @param query the query
     * @return the classification
     * @throws com.rollupduck.exception.MalformedQueryException if two equality
     *         filters assign different values to the same column
     */
    public Classification classify(Query query) {
        Objects.requireNonNull(query, "query must not be null");
        Set<String> groupBy = query.groupBySet();
        List<ClassifiedPredicate> classified = new ArrayList<>(query.where().size());
        for (Predicate predicate : query.where()) {
            classified.add(new ClassifiedPredicate(predicate, classify(predicate, groupBy)));
        }
        return new Classification(query, classified);
    }
}
