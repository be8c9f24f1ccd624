package com.rollupduck.analysis;

import com.rollupduck.query.AggregateItem;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An aggregate value physically stored in a summary table.
 *
 * <p>Each primitive maps to one output column:
 * <pre>
 *   Sum(col)  -> sum_col
 *   RowCount  -> row_count
 *   Min(col)  -> min_col
 *   Max(col)  -> max_col
 * </pre>
 *
 * <p>AVG and COUNT are never stored; they are rebuilt from sums and row
 * counts when a query is routed.
 */
public record AggregatePrimitive(Kind kind, String column) implements Comparable<AggregatePrimitive> {

    public static final String ROW_COUNT_COLUMN = "row_count";

    private static final AggregatePrimitive ROW_COUNT = new AggregatePrimitive(Kind.ROW_COUNT, null);

    private static final Comparator<AggregatePrimitive> ORDER =
        Comparator.comparing(AggregatePrimitive::kind)
            .thenComparing(AggregatePrimitive::column, Comparator.nullsFirst(Comparator.naturalOrder()));

    /**
     * Primitive kinds, each with the SQL function that computes it from raw rows.
     */
    public enum Kind {
        SUM("SUM", "sum_"),
        ROW_COUNT("COUNT", null),
        MIN("MIN", "min_"),
        MAX("MAX", "max_");

        private final String function;
        private final String prefix;

        Kind(String function, String prefix) {
            this.function = function;
            this.prefix = prefix;
        }

        public String function() {
            return function;
        }
    }

    public AggregatePrimitive {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == Kind.ROW_COUNT) {
            if (column != null) {
                throw new IllegalArgumentException("RowCount takes no column");
            }
        } else {
            Objects.requireNonNull(column, "column must not be null for " + kind);
        }
    }

    public static AggregatePrimitive sum(String column) {
        return new AggregatePrimitive(Kind.SUM, column);
    }

    public static AggregatePrimitive rowCount() {
        return ROW_COUNT;
    }

    public static AggregatePrimitive min(String column) {
        return new AggregatePrimitive(Kind.MIN, column);
    }

    public static AggregatePrimitive max(String column) {
        return new AggregatePrimitive(Kind.MAX, column);
    }

    /**
     * Returns the summary table column holding this primitive.
     *
     * @return the output column name
     */
    public String outputColumn() {
        return kind == Kind.ROW_COUNT ? ROW_COUNT_COLUMN : kind.prefix + column;
    }

    /**
     * Decomposes a requested aggregate into the primitives needed to answer it.
     *
     * <pre>
     *   SUM(c)    -> Sum(c)
     *   COUNT(*)  -> RowCount
     *   AVG(c)    -> Sum(c), RowCount
     *   MIN(c)    -> Min(c)
     *   MAX(c)    -> Max(c)
     *   COUNT(c)  -> not decomposable (counts non-null values, not rows)
     * </pre>
     *
     * @param item the aggregate request
     * @return the primitives, or empty if the aggregate cannot be rebuilt from primitives
     */
    public static Optional<List<AggregatePrimitive>> decompose(AggregateItem item) {
        String column = item.column();
        return switch (item.function()) {
            case SUM -> Optional.of(List.of(sum(column)));
            case AVG -> Optional.of(List.of(sum(column), rowCount()));
            case COUNT -> item.isRowCount() ? Optional.of(List.of(rowCount())) : Optional.empty();
            case MIN -> Optional.of(List.of(min(column)));
            case MAX -> Optional.of(List.of(max(column)));
        };
    }

    @Override
    public int compareTo(AggregatePrimitive other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case SUM -> "Sum(" + column + ")";
            case ROW_COUNT -> "RowCount";
            case MIN -> "Min(" + column + ")";
            case MAX -> "Max(" + column + ")";
        };
    }
}
