package com.rollupduck.exception;

/**
 * Exception thrown when a summary table cannot be materialized.
 *
 * <p>Raised by {@link com.rollupduck.runtime.SummaryMaterializer} in fail-fast
 * mode. In the default mode the failure is reported in the
 * {@link com.rollupduck.runtime.MaterializationReport} instead, and the
 * corresponding catalog entry is dropped before routing starts.
 */
public class MaterializationException extends RuntimeException {

    private final String tableName;

    public MaterializationException(String tableName, Throwable cause) {
        super("Failed to materialize summary table " + tableName + ": " +
              (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.tableName = tableName;
    }

    /**
     * Returns the summary table that failed.
     *
     * @return the table name
     */
    public String getTableName() {
        return tableName;
    }
}
