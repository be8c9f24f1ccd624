package com.rollupduck.generator;

import java.util.Set;

/**
 * Utilities for safely quoting SQL identifiers and literals.
 *
 * <p>Column names, aggregate labels and predicate values reach the generated
 * SQL from query input, so every identifier and string literal passes through
 * this class.
 *
 * <p>Example usage:
 * <pre>
 *   SQLQuoting.quoteIdentifierIfNeeded("day");            // day
 *   SQLQuoting.quoteIdentifierIfNeeded("SUM(bid_price)"); // "SUM(bid_price)"
 *   SQLQuoting.quoteLiteral("O'Reilly");                  // 'O''Reilly'
 * </pre>
 *
 * @see SQLGenerator
 */
public final class SQLQuoting {

    private static final Set<String> RESERVED_WORDS = Set.of(
        "SELECT", "FROM", "WHERE", "GROUP", "BY", "ORDER", "HAVING", "JOIN",
        "ON", "USING", "AS", "AND", "OR", "NOT", "IN", "EXISTS", "CASE", "WHEN",
        "THEN", "ELSE", "END", "NULL", "TRUE", "FALSE", "UNION", "INTERSECT",
        "EXCEPT", "LIMIT", "OFFSET", "ALL", "DISTINCT", "IS", "BETWEEN", "LIKE",
        "ILIKE", "ASC", "DESC", "TABLE", "CREATE", "DEFAULT", "CAST");

    private SQLQuoting() {
    }

    /**
     * Quotes an identifier with double quotes, doubling any embedded quote.
     *
     * @param identifier the identifier to quote
     * @return quoted identifier safe for SQL
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Quotes an identifier only if it is not a plain lowercase-safe name or is
     * a reserved word.
     *
     * @param identifier the identifier to conditionally quote
     * @return the identifier, quoted if necessary
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifierIfNeeded(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return needsQuoting(identifier) ? quoteIdentifier(identifier) : identifier;
    }

    /**
     * Quotes a string literal value with single quotes.
     *
     * @param value the string value to quote
     * @return quoted literal safe for SQL, or NULL if value is null
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "NULL";
        }
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Quotes a table name for use in SQL.
     *
     * @param tableName the table name to quote
     * @return the table name, quoted if needed
     * @throws IllegalArgumentException if the name is null or contains statement separators
     */
    public static String quoteTableName(String tableName) {
        if (tableName == null) {
            throw new IllegalArgumentException("Table name cannot be null");
        }
        if (tableName.contains(";") || tableName.contains("--")) {
            throw new IllegalArgumentException("Table name contains invalid characters: " + tableName);
        }
        return quoteIdentifierIfNeeded(tableName);
    }

    private static boolean needsQuoting(String identifier) {
        char first = identifier.charAt(0);
        if (!Character.isLetter(first) && first != '_') {
            return true;
        }
        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return true;
            }
        }
        return RESERVED_WORDS.contains(identifier.toUpperCase());
    }
}
