package com.rollupduck.plan;

import com.rollupduck.expression.ColumnReference;
import com.rollupduck.expression.Expression;
import com.rollupduck.expression.ExpressionUtils;
import com.rollupduck.expression.FunctionCall;
import com.rollupduck.query.AggregateItem;
import com.rollupduck.query.ColumnItem;
import com.rollupduck.query.OrderItem;
import com.rollupduck.query.Query;
import com.rollupduck.query.SelectItem;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * A single flat SELECT over one physical table, ready for SQL emission.
 *
 * <pre>
 *   SELECT projections FROM table
 *   WHERE filters[0] AND filters[1] ...
 *   GROUP BY groupBy
 *   ORDER BY orderBy
 *   LIMIT limit
 * </pre>
 *
 * <p>ORDER BY items name either a GROUP BY column or a projection alias.
 */
public final class PhysicalQuery {

    private final String table;
    private final List<Projection> projections;
    private final List<Expression> filters;
    private final List<String> groupBy;
    private final List<OrderItem> orderBy;
    private final OptionalInt limit;

    private PhysicalQuery(Builder builder) {
        this.table = Objects.requireNonNull(builder.table, "table must not be null");
        if (builder.projections.isEmpty()) {
            throw new IllegalArgumentException("A query needs at least one projection");
        }
        this.projections = List.copyOf(builder.projections);
        this.filters = List.copyOf(builder.filters);
        this.groupBy = List.copyOf(builder.groupBy);
        this.orderBy = List.copyOf(builder.orderBy);
        this.limit = builder.limit;
    }

    /**
     * Renders a query unchanged against the main table. This is the fallback path.
     *
     * @param query the query
     * @param mainTable the main table name
     * @return the physical query
     */
    public static PhysicalQuery fromQuery(Query query, String mainTable) {
        Builder builder = builder(mainTable);
        for (SelectItem item : query.select()) {
            builder.project(rawProjection(item));
        }
        builder.filters(ExpressionUtils.fromPredicates(query.where()));
        builder.groupBy(query.groupBy());
        query.orderBy().forEach(builder::orderBy);
        query.limit().ifPresent(builder::limit);
        return builder.build();
    }

    private static Projection rawProjection(SelectItem item) {
        if (item instanceof ColumnItem column) {
            return Projection.column(column.column());
        }
        AggregateItem aggregate = (AggregateItem) item;
        Expression call = aggregate.isRowCount()
            ? FunctionCall.countStar()
            : FunctionCall.of(aggregate.function().name(), ColumnReference.of(aggregate.column()));
        return Projection.aliased(call, aggregate.label());
    }

    public String table() {
        return table;
    }

    public List<Projection> projections() {
        return projections;
    }

    public List<Expression> filters() {
        return filters;
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

    public static Builder builder(String table) {
        return new Builder(table);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PhysicalQuery that)) return false;
        return table.equals(that.table) &&
               projections.equals(that.projections) &&
               filters.equals(that.filters) &&
               groupBy.equals(that.groupBy) &&
               orderBy.equals(that.orderBy) &&
               limit.equals(that.limit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, projections, filters, groupBy, orderBy, limit);
    }

    @Override
    public String toString() {
        return "PhysicalQuery{table=" + table + ", projections=" + projections.size() +
               ", filters=" + filters + ", groupBy=" + groupBy + "}";
    }

    /**
     * Builder for {@link PhysicalQuery}.
     */
    public static final class Builder {
        private final String table;
        private final List<Projection> projections = new ArrayList<>();
        private final List<Expression> filters = new ArrayList<>();
        private final List<String> groupBy = new ArrayList<>();
        private final List<OrderItem> orderBy = new ArrayList<>();
        private OptionalInt limit = OptionalInt.empty();

        private Builder(String table) {
            this.table = table;
        }

        public Builder project(Projection projection) {
            projections.add(Objects.requireNonNull(projection, "projection must not be null"));
            return this;
        }

        public Builder filter(Expression filter) {
            filters.add(Objects.requireNonNull(filter, "filter must not be null"));
            return this;
        }

        public Builder filters(List<Expression> values) {
            values.forEach(this::filter);
            return this;
        }

        public Builder groupBy(List<String> columns) {
            groupBy.addAll(columns);
            return this;
        }

        public Builder groupBy(String... columns) {
            return groupBy(Arrays.asList(columns));
        }

        public Builder orderBy(OrderItem item) {
            orderBy.add(Objects.requireNonNull(item, "item must not be null"));
            return this;
        }

        public Builder limit(int value) {
            this.limit = OptionalInt.of(value);
            return this;
        }

        public PhysicalQuery build() {
            return new PhysicalQuery(this);
        }
    }
}
