package com.rollupduck.expression;

/**
 * Base interface for SQL expressions emitted by the generator.
 *
 * <p>Expressions appear in:
 * <ul>
 *   <li>SELECT lists (plain columns and aggregate calls)</li>
 *   <li>WHERE clauses (re-applied predicates)</li>
 * </ul>
 *
 * <p>All implementations are immutable and {@code final}.
 */
public interface Expression {

    /**
     * Converts this expression to DuckDB SQL text.
     *
     * @return the SQL string representation
     */
    String toSQL();
}
