package com.rollupduck.analysis;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Merge key of a summary table: the sorted dimension set plus the sorted
 * constant-filter assignment.
 *
 * <p>Two candidate specifications share a table only when their signatures
 * are equal. A signature with an extra dimension or a different constant
 * never matches, even when one would subsume the other.
 */
public record Signature(SortedSet<String> dimensions, SortedMap<String, Object> constants) {

    public Signature {
        dimensions = Collections.unmodifiableSortedSet(new TreeSet<>(dimensions));
        constants = Collections.unmodifiableSortedMap(new TreeMap<>(constants));
    }

    public static Signature of(Set<String> dimensions, Map<String, Object> constants) {
        return new Signature(new TreeSet<>(dimensions), new TreeMap<>(constants));
    }

    /**
     * Returns a canonical text form, e.g.
     * {@code dims=[day,publisher_id];const={country:String=JP,type:String=impression}}.
     *
     * <p>Value types are part of the form so that {@code 1} and {@code '1'}
     * never collapse into one signature.
     *
     * @return the canonical string
     */
    public String canonical() {
        StringBuilder sb = new StringBuilder("dims=[");
        sb.append(String.join(",", dimensions)).append("];const={");
        boolean first = true;
        for (Map.Entry<String, Object> entry : constants.entrySet()) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            Object value = entry.getValue();
            sb.append(entry.getKey()).append(':')
              .append(value.getClass().getSimpleName()).append('=').append(value);
        }
        return sb.append('}').toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Signature that)) return false;
        return dimensions.equals(that.dimensions) && constants.equals(that.constants);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimensions, constants);
    }

    @Override
    public String toString() {
        return canonical();
    }
}
