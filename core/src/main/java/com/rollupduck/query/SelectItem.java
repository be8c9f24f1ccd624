package com.rollupduck.query;

/**
 * One entry of a query's SELECT list: either a bare column or an aggregate
 * request.
 */
public sealed interface SelectItem permits ColumnItem, AggregateItem {

    /**
     * Returns the output column name of this item.
     *
     * <p>Bare columns keep their name; aggregates use their label, e.g.
     * {@code SUM(bid_price)} or {@code COUNT(*)}.
     *
     * @return the output label
     */
    String label();
}
