package com.rollupduck.runtime;

import com.rollupduck.analysis.Catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of materializing a catalog.
 *
 * @param catalog the catalog holding only the tables that were created
 * @param created the created tables, in catalog order
 * @param failures failed table name to error message
 */
public record MaterializationReport(Catalog catalog, List<String> created, Map<String, String> failures) {

    public MaterializationReport {
        Objects.requireNonNull(catalog, "catalog must not be null");
        created = List.copyOf(created);
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}
