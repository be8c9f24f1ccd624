package com.rollupduck.analysis;

import com.rollupduck.query.AggregateItem;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Specification of one summary table.
 *
 * <p>A spec is keyed by its {@link Signature}: {@link #dimensions()} and
 * {@link #constantFilters()} are always exactly the signature's components.
 * The aggregate set always contains {@link AggregatePrimitive#rowCount()}.
 *
 * <p>Instances are immutable. Merging returns a new spec whose aggregates and
 * source queries are the union of both inputs.
 */
public final class SummarySpec {

    private final Signature signature;
    private final SortedSet<AggregatePrimitive> aggregates;
    private final Set<String> sourceQueries;
    private final String tableName;

    private SummarySpec(Signature signature, Collection<AggregatePrimitive> aggregates,
                        Collection<String> sourceQueries, String tableName) {
        this.signature = Objects.requireNonNull(signature, "signature must not be null");
        SortedSet<AggregatePrimitive> primitives = new TreeSet<>(aggregates);
        primitives.add(AggregatePrimitive.rowCount());
        this.aggregates = Collections.unmodifiableSortedSet(primitives);
        this.sourceQueries = Collections.unmodifiableSet(new LinkedHashSet<>(sourceQueries));
        this.tableName = tableName;
    }

    /**
     * Creates an unnamed candidate spec for a single query.
     *
     * @param signature the merge key
     * @param aggregates the primitives the query needs
     * @param queryId the originating query
     * @return the candidate
     */
    public static SummarySpec candidate(Signature signature, Collection<AggregatePrimitive> aggregates,
                                        String queryId) {
        return new SummarySpec(signature, aggregates, List.of(queryId), null);
    }

    /**
     * Creates a named spec directly, e.g. for a catalog loaded from elsewhere.
     */
    public static SummarySpec of(String tableName, Signature signature,
                                 Collection<AggregatePrimitive> aggregates, Collection<String> sourceQueries) {
        return new SummarySpec(signature, aggregates, sourceQueries,
            Objects.requireNonNull(tableName, "tableName must not be null"));
    }

    public Signature signature() {
        return signature;
    }

    public SortedSet<String> dimensions() {
        return signature.dimensions();
    }

    public SortedMap<String, Object> constantFilters() {
        return signature.constants();
    }

    public SortedSet<AggregatePrimitive> aggregates() {
        return aggregates;
    }

    public Set<String> sourceQueries() {
        return sourceQueries;
    }

    /**
     * Returns the physical table name, or null for an unmerged candidate.
     *
     * @return the table name
     */
    public String tableName() {
        return tableName;
    }

    /**
     * Returns a spec holding the union of both aggregate sets and source queries.
     *
     * @param other a spec with the same signature
     * @return the merged spec
     * @throws IllegalArgumentException if the signatures differ
     */
    public SummarySpec mergedWith(SummarySpec other) {
        if (!signature.equals(other.signature)) {
            throw new IllegalArgumentException(
                "Cannot merge specs with different signatures: " + signature + " vs " + other.signature);
        }
        SortedSet<AggregatePrimitive> union = new TreeSet<>(aggregates);
        union.addAll(other.aggregates);
        Set<String> sources = new LinkedHashSet<>(sourceQueries);
        sources.addAll(other.sourceQueries);
        return new SummarySpec(signature, union, sources, tableName);
    }

    public SummarySpec withTableName(String name) {
        return new SummarySpec(signature, aggregates, sourceQueries,
            Objects.requireNonNull(name, "name must not be null"));
    }

    /**
     * Returns whether the stored primitives can answer the aggregate, directly
     * or by derivation (AVG from Sum and RowCount, COUNT(*) from RowCount).
     *
     * @param item the requested aggregate
     * @return true if the aggregate is satisfiable
     */
    public boolean canSatisfy(AggregateItem item) {
        Optional<List<AggregatePrimitive>> needed = AggregatePrimitive.decompose(item);
        return needed.isPresent() && aggregates.containsAll(needed.get());
    }

    public boolean canSatisfyAll(Collection<AggregateItem> items) {
        for (AggregateItem item : items) {
            if (!canSatisfy(item)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SummarySpec that)) return false;
        return signature.equals(that.signature) &&
               aggregates.equals(that.aggregates) &&
               sourceQueries.equals(that.sourceQueries) &&
               Objects.equals(tableName, that.tableName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(signature, aggregates, sourceQueries, tableName);
    }

    @Override
    public String toString() {
        return "SummarySpec{" + (tableName != null ? tableName + ", " : "") +
               "dimensions=" + dimensions() +
               ", constants=" + constantFilters() +
               ", aggregates=" + aggregates +
               ", sources=" + sourceQueries + "}";
    }
}
