package com.rollupduck.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Immutable structured representation of an analytical query.
 *
 * <p>A query is a single SELECT over the main events table:
 * <pre>
 *   SELECT select... FROM events
 *   WHERE where[0] AND where[1] ...
 *   GROUP BY groupBy...
 *   ORDER BY orderBy...
 *   LIMIT limit
 * </pre>
 *
 * <p>Queries are created once (usually by {@link QueryParser}) and never
 * mutated. Every query carries an id used to trace which queries contributed
 * to a summary table.
 *
 * <p>Example:
 * <pre>
 *   Query q = Query.builder("q1")
 *       .select("day")
 *       .select(AggregateFunction.SUM, "bid_price")
 *       .where(Predicate.eq("type", "impression"))
 *       .groupBy("day")
 *       .build();
 * </pre>
 */
public final class Query {

    private final String id;
    private final List<SelectItem> select;
    private final List<Predicate> where;
    private final List<String> groupBy;
    private final List<OrderItem> orderBy;
    private final OptionalInt limit;

    private Query(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.select = List.copyOf(builder.select);
        this.where = List.copyOf(builder.where);
        this.groupBy = List.copyOf(builder.groupBy);
        this.orderBy = List.copyOf(builder.orderBy);
        this.limit = builder.limit;
    }

    public String id() {
        return id;
    }

    public List<SelectItem> select() {
        return select;
    }

    public List<Predicate> where() {
        return where;
    }

    public List<String> groupBy() {
        return groupBy;
    }

    public List<OrderItem> orderBy() {
        return orderBy;
    }

    public OptionalInt limit() {
        return limit;
    }

    /**
     * Returns the group-by columns as a set, in declaration order.
     *
     * @return the group-by set
     */
    public Set<String> groupBySet() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(groupBy));
    }

    /**
     * Returns the aggregate requests of the SELECT list, in order.
     *
     * @return the aggregate items
     */
    public List<AggregateItem> aggregates() {
        List<AggregateItem> result = new ArrayList<>();
        for (SelectItem item : select) {
            if (item instanceof AggregateItem aggregate) {
                result.add(aggregate);
            }
        }
        return result;
    }

    /**
     * Returns the bare columns of the SELECT list, in order.
     *
     * @return the column names
     */
    public List<String> bareColumns() {
        List<String> result = new ArrayList<>();
        for (SelectItem item : select) {
            if (item instanceof ColumnItem column) {
                result.add(column.column());
            }
        }
        return result;
    }

    /**
     * Returns whether this query groups or aggregates.
     *
     * <p>Plain projections (no aggregate, no GROUP BY) return false; they can
     * never be answered from a summary table.
     *
     * @return true if the query aggregates
     */
    public boolean isAggregation() {
        return !groupBy.isEmpty() || !aggregates().isEmpty();
    }

    /**
     * Returns a copy of this query with a different id.
     *
     * @param newId the new id
     * @return the re-identified query
     */
    public Query withId(String newId) {
        return toBuilder(newId).build();
    }

    public Builder toBuilder(String newId) {
        Builder builder = new Builder(newId);
        builder.select.addAll(select);
        builder.where.addAll(where);
        builder.groupBy.addAll(groupBy);
        builder.orderBy.addAll(orderBy);
        builder.limit = limit;
        return builder;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Query that)) return false;
        return id.equals(that.id) &&
               select.equals(that.select) &&
               where.equals(that.where) &&
               groupBy.equals(that.groupBy) &&
               orderBy.equals(that.orderBy) &&
               limit.equals(that.limit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, select, where, groupBy, orderBy, limit);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Query[").append(id).append("]{select=").append(select);
        if (!where.isEmpty()) {
            sb.append(", where=").append(where);
        }
        if (!groupBy.isEmpty()) {
            sb.append(", groupBy=").append(groupBy);
        }
        if (!orderBy.isEmpty()) {
            sb.append(", orderBy=").append(orderBy);
        }
        limit.ifPresent(l -> sb.append(", limit=").append(l));
        return sb.append('}').toString();
    }

    /**
     * Builder for {@link Query}.
     */
    public static final class Builder {
        private final String id;
        private final List<SelectItem> select = new ArrayList<>();
        private final List<Predicate> where = new ArrayList<>();
        private final List<String> groupBy = new ArrayList<>();
        private final List<OrderItem> orderBy = new ArrayList<>();
        private OptionalInt limit = OptionalInt.empty();

        private Builder(String id) {
            this.id = id;
        }

        public Builder select(String... columns) {
            for (String column : columns) {
                select.add(new ColumnItem(column));
            }
            return this;
        }

        public Builder select(AggregateFunction function, String column) {
            select.add(new AggregateItem(function, column));
            return this;
        }

        public Builder select(SelectItem item) {
            select.add(Objects.requireNonNull(item, "item must not be null"));
            return this;
        }

        public Builder where(Predicate... predicates) {
            where.addAll(Arrays.asList(predicates));
            return this;
        }

        public Builder groupBy(String... columns) {
            groupBy.addAll(Arrays.asList(columns));
            return this;
        }

        public Builder orderBy(String expression, SortDirection direction) {
            orderBy.add(new OrderItem(expression, direction));
            return this;
        }

        public Builder orderBy(OrderItem item) {
            orderBy.add(Objects.requireNonNull(item, "item must not be null"));
            return this;
        }

        public Builder limit(int value) {
            this.limit = OptionalInt.of(value);
            return this;
        }

        public Query build() {
            return new Query(this);
        }
    }
}
