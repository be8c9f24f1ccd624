package com.rollupduck.analysis;

import com.rollupduck.query.Predicate;

import java.util.Objects;

/**
 * A predicate together with its classification.
 */
public record ClassifiedPredicate(Predicate predicate, FilterClass filterClass) {

    public ClassifiedPredicate {
        Objects.requireNonNull(predicate, "predicate must not be null");
        Objects.requireNonNull(filterClass, "filterClass must not be null");
    }

    public String column() {
        return predicate.column();
    }
}
