package com.rollupduck.analysis;

import java.util.Map;
import java.util.Set;

/**
 * Policy deciding whether a dimension set is too fine-grained to materialize.
 *
 * <p>Implementations must be deterministic for the same inputs and free of
 * side effects; the builder calls them from several threads.
 *
 * @see ThresholdCardinalityGuard
 */
@FunctionalInterface
public interface CardinalityGuard {

    /**
     * Returns true if a summary over these dimensions should not be built.
     *
     * @param dimensions the summary dimensions
     * @param constantFilters the equality filters baked into the summary
     * @return whether to reject
     */
    boolean rejects(Set<String> dimensions, Map<String, Object> constantFilters);

    /**
     * Returns a guard that accepts everything.
     *
     * @return the permissive guard
     */
    static CardinalityGuard never() {
        return (dimensions, constantFilters) -> false;
    }
}
