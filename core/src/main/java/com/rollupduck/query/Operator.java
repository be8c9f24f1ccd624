package com.rollupduck.query;

import com.rollupduck.exception.UnsupportedPredicateException;

/**
 * Predicate operators understood by the analyzer.
 *
 * <p>The set is closed: classification and rewrite sites switch over it
 * exhaustively, so adding an operator is a compile-time checked change.
 */
public enum Operator {
    EQ("eq", "="),
    LT("lt", "<"),
    LTE("lte", "<="),
    GT("gt", ">"),
    GTE("gte", ">="),
    BETWEEN("between", "BETWEEN"),
    IN("in", "IN");

    private final String wireName;
    private final String symbol;

    Operator(String wireName, String symbol) {
        this.wireName = wireName;
        this.symbol = symbol;
    }

    /**
     * Returns the operator name used in JSON query batches.
     *
     * @return the wire name, e.g. {@code "lte"}
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Returns the SQL symbol or keyword for this operator.
     *
     * @return the SQL symbol
     */
    public String symbol() {
        return symbol;
    }

    public boolean isComparison() {
        return this == LT || this == LTE || this == GT || this == GTE;
    }

    /**
     * Resolves an operator from its wire name (case-insensitive).
     *
     * @param name the operator name
     * @return the operator
     * @throws UnsupportedPredicateException if the name is not a supported operator
     */
    public static Operator fromWireName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase();
            for (Operator op : values()) {
                if (op.wireName.equals(normalized)) {
                    return op;
                }
            }
        }
        throw new UnsupportedPredicateException(String.valueOf(name));
    }
}
