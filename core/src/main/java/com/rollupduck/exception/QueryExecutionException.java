package com.rollupduck.exception;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Exception thrown when DuckDB fails to execute a generated statement.
 *
 * <p>Wraps the {@link java.sql.SQLException} together with the SQL that
 * failed. The DuckDB error text is sorted into an {@link ErrorKind} so that
 * callers can tell a missing summary table apart from a bad predicate value.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       QueryResult result = executor.executeQuery(sql);
 *   } catch (QueryExecutionException e) {
 *       logger.error(e.getUserMessage());
 *       logger.debug("Failed SQL: {}", e.getFailedSQL());
 *   }
 * </pre>
 *
 * @see com.rollupduck.runtime.QueryExecutor
 */
public class QueryExecutionException extends RuntimeException {

    /**
     * Broad categories of DuckDB execution errors.
     */
    public enum ErrorKind {
        COLUMN_NOT_FOUND,
        TABLE_NOT_FOUND,
        TYPE_MISMATCH,
        OUT_OF_MEMORY,
        SYNTAX,
        OTHER
    }

    private static final Pattern MISSING_COLUMN = Pattern.compile("column \"([^\"]+)\" not found");
    private static final Pattern MISSING_TABLE = Pattern.compile("Table with name ([^ ]+) does not exist");

    private final String failedSQL;
    private final ErrorKind kind;

    public QueryExecutionException(String message, String sql) {
        this(message, null, sql);
    }

    /**
     * Creates a query execution exception.
     *
     * @param message the error message, usually carrying DuckDB's own text
     * @param cause the underlying cause, may be null
     * @param sql the statement that failed
     */
    public QueryExecutionException(String message, Throwable cause, String sql) {
        super(message, cause);
        this.failedSQL = sql;
        this.kind = classify(message);
    }

    public String getFailedSQL() {
        return failedSQL;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Returns a short message suitable for logs and CLI output.
     *
     * @return the user-facing message
     */
    public String getUserMessage() {
        String message = getMessage();
        switch (kind) {
            case COLUMN_NOT_FOUND: {
                String column = firstGroup(MISSING_COLUMN, message);
                return column != null
                    ? "Column '" + column + "' not found. Check that the summary table or main table carries it."
                    : "Column not found: " + message;
            }
            case TABLE_NOT_FOUND: {
                String table = firstGroup(MISSING_TABLE, message);
                return table != null
                    ? "Table " + table + " does not exist. It may not have been materialized."
                    : "Table error: " + message;
            }
            case TYPE_MISMATCH:
                return "Predicate value does not match the column type.";
            case OUT_OF_MEMORY:
                return "Query needs more memory than DuckDB may use. Add filters or raise the memory limit.";
            case SYNTAX:
                return "Generated SQL could not be parsed.";
            default:
                return message == null ? "Query execution failed." : "Query execution failed: " + message;
        }
    }

    /**
     * Returns the message, the failed SQL and the cause on separate lines.
     *
     * @return the technical message
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder()
            .append("[").append(kind).append("] ").append(getMessage()).append('\n');
        if (failedSQL != null) {
            sb.append("SQL: ").append(failedSQL).append('\n');
        }
        if (getCause() != null) {
            sb.append("Caused by ").append(getCause().getClass().getName())
              .append(": ").append(getCause().getMessage()).append('\n');
        }
        return sb.toString();
    }

    private static ErrorKind classify(String message) {
        if (message == null) {
            return ErrorKind.OTHER;
        }
        if (message.contains("Binder Error") && message.contains("not found")) {
            return ErrorKind.COLUMN_NOT_FOUND;
        }
        if (message.contains("Catalog Error")) {
            return ErrorKind.TABLE_NOT_FOUND;
        }
        if (message.contains("Conversion Error")) {
            return ErrorKind.TYPE_MISMATCH;
        }
        if (message.contains("Out of Memory Error")) {
            return ErrorKind.OUT_OF_MEMORY;
        }
        if (message.contains("Parser Error") || message.contains("Syntax Error")) {
            return ErrorKind.SYNTAX;
        }
        return ErrorKind.OTHER;
    }

    private static String firstGroup(Pattern pattern, String message) {
        Matcher matcher = pattern.matcher(message);
        return matcher.find() ? matcher.group(1) : null;
    }
}
