package com.rollupduck.analysis;

import com.rollupduck.exception.MalformedQueryException;
import com.rollupduck.query.Query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The three-way partition of a query's predicates.
 *
 * <p>Derived from a query and never stored. {@link #requiredDimensions()} and
 * {@link #requiredConstants()} are what a summary table must carry to answer
 * the query.
 *
 * @see FilterClassifier
 */
public final class Classification {

    private final Query query;
    private final List<ClassifiedPredicate> predicates;
    private final SortedSet<String> requiredDimensions;
    private final SortedMap<String, Object> requiredConstants;

    Classification(Query query, List<ClassifiedPredicate> predicates) {
        this.query = Objects.requireNonNull(query, "query must not be null");
        this.predicates = List.copyOf(predicates);

        SortedSet<String> dimensions = new TreeSet<>(query.groupBy());
        SortedMap<String, Object> constants = new TreeMap<>();
        for (ClassifiedPredicate classified : this.predicates) {
            switch (classified.filterClass()) {
                case IGNORED -> { }
                case DIMENSION -> dimensions.add(classified.column());
                case CONSTANT -> {
                    Object value = classified.predicate().scalar();
                    Object previous = constants.putIfAbsent(classified.column(), value);
                    if (previous != null && !previous.equals(value)) {
                        throw new MalformedQueryException(
                            "Conflicting equality filters on '%s': %s and %s".formatted(
                                classified.column(), previous, value), query.id());
                    }
                }
            }
        }
        this.requiredDimensions = Collections.unmodifiableSortedSet(dimensions);
        this.requiredConstants = Collections.unmodifiableSortedMap(constants);
    }

    public Query query() {
        return query;
    }

    /**
     * Returns every predicate with its class, in WHERE order.
     *
     * @return the classified predicates
     */
    public List<ClassifiedPredicate> predicates() {
        return predicates;
    }

    public List<ClassifiedPredicate> ofClass(FilterClass filterClass) {
        List<ClassifiedPredicate> result = new ArrayList<>();
        for (ClassifiedPredicate classified : predicates) {
            if (classified.filterClass() == filterClass) {
                result.add(classified);
            }
        }
        return result;
    }

    /**
     * Returns the columns promoted to dimensions by range or set predicates.
     *
     * @return the filter dimension columns, sorted
     */
    public SortedSet<String> filterDimensions() {
        SortedSet<String> result = new TreeSet<>();
        for (ClassifiedPredicate classified : ofClass(FilterClass.DIMENSION)) {
            result.add(classified.column());
        }
        return result;
    }

    /**
     * Returns GROUP BY columns united with filter dimension columns.
     *
     * @return the required dimensions, sorted
     */
    public SortedSet<String> requiredDimensions() {
        return requiredDimensions;
    }

    /**
     * Returns the constant filter assignment {@code column -> value}.
     *
     * @return the required constants, sorted by column
     */
    public SortedMap<String, Object> requiredConstants() {
        return requiredConstants;
    }

    @Override
    public String toString() {
        return "Classification[" + query.id() + "]{dimensions=" + requiredDimensions +
               ", constants=" + requiredConstants + "}";
    }
}
