package com.rollupduck.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of summary specifications, one per signature, in the order
 * their signatures were first seen.
 *
 * <p>A catalog is never modified. Removing entries, for instance after a
 * failed materialization, returns a new catalog. Instances may be read from
 * any number of threads.
 */
public final class Catalog {

    private static final Catalog EMPTY = new Catalog(List.of());

    private final List<SummarySpec> specs;
    private final Map<Signature, SummarySpec> bySignature;
    private final Map<String, SummarySpec> byTableName;

    private Catalog(List<SummarySpec> specs) {
        Map<Signature, SummarySpec> signatures = new LinkedHashMap<>();
        Map<String, SummarySpec> names = new LinkedHashMap<>();
        for (SummarySpec spec : specs) {
            Objects.requireNonNull(spec.tableName(), "catalog entries must be named: " + spec);
            if (signatures.putIfAbsent(spec.signature(), spec) != null) {
                throw new IllegalArgumentException("Duplicate signature in catalog: " + spec.signature());
            }
            if (names.putIfAbsent(spec.tableName(), spec) != null) {
                throw new IllegalArgumentException("Duplicate table name in catalog: " + spec.tableName());
            }
        }
        this.specs = List.copyOf(specs);
        this.bySignature = Collections.unmodifiableMap(signatures);
        this.byTableName = Collections.unmodifiableMap(names);
    }

    public static Catalog empty() {
        return EMPTY;
    }

    /**
     * Creates a catalog from named specs.
     *
     * @param specs the specs, in insertion order
     * @return the catalog
     * @throws IllegalArgumentException if two specs share a signature or a table name
     */
    public static Catalog of(List<SummarySpec> specs) {
        return specs.isEmpty() ? EMPTY : new Catalog(specs);
    }

    /**
     * Returns the specs in insertion order.
     *
     * @return the specs
     */
    public List<SummarySpec> specs() {
        return specs;
    }

    public int size() {
        return specs.size();
    }

    public boolean isEmpty() {
        return specs.isEmpty();
    }

    public Optional<SummarySpec> get(Signature signature) {
        return Optional.ofNullable(bySignature.get(signature));
    }

    public Optional<SummarySpec> byTableName(String tableName) {
        return Optional.ofNullable(byTableName.get(tableName));
    }

    public Set<String> tableNames() {
        return byTableName.keySet();
    }

    /**
     * Returns a catalog without the named table.
     *
     * @param tableName the table to drop
     * @return a new catalog, or this one if the table is absent
     */
    public Catalog without(String tableName) {
        return without(List.of(tableName));
    }

    /**
     * Returns a catalog without the named tables.
     *
     * @param tableNames the tables to drop
     * @return a new catalog, or this one if none of the tables is present
     */
    public Catalog without(Collection<String> tableNames) {
        Set<String> drop = new HashSet<>(tableNames);
        List<SummarySpec> kept = new ArrayList<>(specs.size());
        for (SummarySpec spec : specs) {
            if (!drop.contains(spec.tableName())) {
                kept.add(spec);
            }
        }
        return kept.size() == specs.size() ? this : of(kept);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Catalog that)) return false;
        return specs.equals(that.specs);
    }

    @Override
    public int hashCode() {
        return specs.hashCode();
    }

    @Override
    public String toString() {
        return "Catalog" + byTableName.keySet();
    }
}
