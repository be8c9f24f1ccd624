package com.rollupduck.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges candidate specs that share a signature and names the resulting tables.
 *
 * <p>Candidates merge only when their signatures are equal. A candidate with
 * an extra dimension or a different constant never merges with another, even
 * when one would subsume it.
 *
 * <p>Table names have the form {@code summary_<dims>_<hash>}, where
 * {@code <dims>} is the sorted dimension list joined by {@code _} (or
 * {@code all} for no dimensions) and {@code <hash>} is the first 8 hex digits
 * of the SHA-256 of {@link Signature#canonical()}. Equal signatures always get
 * equal names; if two signatures collide, a numeric suffix is appended.
 */
public class SignatureMerger {

    private static final Logger logger = LoggerFactory.getLogger(SignatureMerger.class);

    static final String TABLE_PREFIX = "summary_";

    /**
     * Merges candidates into a catalog. Must be called once, with every
     * candidate of the batch.
     *
     * @param candidates the candidate specs, in query order
     * @return the frozen catalog
     */
    public Catalog merge(List<SummarySpec> candidates) {
        Map<Signature, SummarySpec> groups = new LinkedHashMap<>();
        for (SummarySpec candidate : candidates) {
            groups.merge(candidate.signature(), candidate, SummarySpec::mergedWith);
        }

        Set<String> used = new HashSet<>();
        List<SummarySpec> named = new ArrayList<>(groups.size());
        for (SummarySpec spec : groups.values()) {
            String base = tableName(spec.signature());
            String name = base;
            for (int suffix = 2; !used.add(name); suffix++) {
                name = base + "_" + suffix;
            }
            named.add(spec.withTableName(name));
        }

        Catalog catalog = Catalog.of(named);
        logger.info("Merged {} candidates into {} summary tables", candidates.size(), catalog.size());
        return catalog;
    }

    /**
     * Returns the base table name for a signature.
     *
     * @param signature the signature
     * @return the table name, without collision suffix
     */
    public static String tableName(Signature signature) {
        String dims = signature.dimensions().isEmpty()
            ? "all"
            : String.join("_", signature.dimensions());
        return TABLE_PREFIX + sanitize(dims) + "_" + shortHash(signature.canonical());
    }

    private static String sanitize(String text) {
        return text.replaceAll("[^A-Za-z0-9_]", "_").toLowerCase();
    }

    private static String shortHash(String text) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(8);
            for (int i = 0; i < 4; i++) {
                hex.append(String.format("%02x", digest[i]));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
