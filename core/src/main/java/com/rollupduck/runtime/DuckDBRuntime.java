package com.rollupduck.runtime;

import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Holds the DuckDB connection that the main table and the summary tables
 * live behind.
 *
 * <p>One runtime wraps one connection. Executors borrow it through
 * {@link #getConnection()} and must not close it; closing the runtime closes
 * the connection.
 *
 * <pre>{@code
 * try (DuckDBRuntime runtime = DuckDBRuntime.createPersistent("/data/events.duckdb")) {
 *     AdaptiveQueryEngine engine = new AdaptiveQueryEngine(runtime, RollupConfig.fromSystemProperties());
 *     engine.prepare(batch);
 * }
 * }</pre>
 *
 * <p>Tests use {@link #createInMemory()}, which gives every caller its own
 * database.
 */
public class DuckDBRuntime implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBRuntime.class);

    private static final String URL_PREFIX = "jdbc:duckdb:";
    private static final AtomicInteger inMemoryDatabases = new AtomicInteger();

    private final String jdbcUrl;
    private final DuckDBConnection connection;
    private volatile boolean closed;

    private DuckDBRuntime(String jdbcUrl, DuckDBConnection connection) {
        this.jdbcUrl = jdbcUrl;
        this.connection = connection;
    }

    /**
     * Opens a runtime for a DuckDB JDBC URL.
     *
     * @param jdbcUrl the URL, e.g. {@code jdbc:duckdb:/data/events.duckdb}
     * @return the runtime
     * @throws IllegalStateException if the connection cannot be opened
     */
    public static DuckDBRuntime create(String jdbcUrl) {
        logger.info("Opening DuckDB at {}", jdbcUrl);
        DuckDBConnection connection = null;
        try {
            connection = DriverManager.getConnection(jdbcUrl).unwrap(DuckDBConnection.class);
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("SET enable_progress_bar=false");
                stmt.execute("SET preserve_insertion_order=true");
            }
            return new DuckDBRuntime(jdbcUrl, connection);
        } catch (SQLException e) {
            closeQuietly(connection);
            throw new IllegalStateException("Cannot open DuckDB at " + jdbcUrl, e);
        }
    }

    public static DuckDBRuntime createInMemory() {
        return create(URL_PREFIX + ":memory:rollupduck_" + inMemoryDatabases.incrementAndGet()
            + "_" + System.nanoTime());
    }

    /**
     * Opens an on-disk database, creating the file if needed.
     *
     * @param dbPath the database file
     * @return the runtime
     */
    public static DuckDBRuntime createPersistent(String dbPath) {
        return create(URL_PREFIX + dbPath);
    }

    /**
     * Returns the shared connection.
     *
     * @return the connection
     * @throws IllegalStateException after {@link #close()}
     */
    public DuckDBConnection getConnection() {
        if (closed) {
            throw new IllegalStateException("DuckDB runtime " + jdbcUrl + " is closed");
        }
        return connection;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        logger.info("Closing DuckDB at {}", jdbcUrl);
        try {
            connection.close();
        } catch (SQLException e) {
            logger.error("Failed to close DuckDB connection {}", jdbcUrl, e);
        }
    }

    private static void closeQuietly(DuckDBConnection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException suppressed) {
            logger.debug("Ignoring close failure after open error", suppressed);
        }
    }
}
