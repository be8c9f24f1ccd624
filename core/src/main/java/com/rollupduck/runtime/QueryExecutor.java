package com.rollupduck.runtime;

import com.rollupduck.exception.QueryExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Executes SQL against the runtime's DuckDB connection.
 *
 * <p>Example usage:
 * <pre>
 *   QueryExecutor executor = new QueryExecutor(runtime);
 *   executor.executeUpdate("CREATE TABLE events AS SELECT * FROM read_parquet('events.parquet')");
 *   QueryResult result = executor.executeQuery("SELECT COUNT(*) FROM events");
 * </pre>
 *
 * <p>Every {@link SQLException} is wrapped in a
 * {@link QueryExecutionException} that carries the failed SQL.
 */
public class QueryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private final DuckDBRuntime runtime;

    public QueryExecutor(DuckDBRuntime runtime) {
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
    }

    /**
     * Executes a query and reads all rows.
     *
     * @param sql the SQL query to execute
     * @return the result
     * @throws QueryExecutionException if query execution fails
     */
    public QueryResult executeQuery(String sql) {
        Objects.requireNonNull(sql, "sql must not be null");
        logger.debug("Executing query: {}", sql);

        try (Statement stmt = runtime.getConnection().createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            ResultSetMetaData meta = rs.getMetaData();
            int columnCount = meta.getColumnCount();
            List<String> columns = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                columns.add(meta.getColumnLabel(i));
            }
            List<List<Object>> rows = new ArrayList<>();
            while (rs.next()) {
                List<Object> row = new ArrayList<>(columnCount);
                for (int i = 1; i <= columnCount; i++) {
                    row.add(rs.getObject(i));
                }
                rows.add(row);
            }
            return new QueryResult(columns, rows);
        } catch (SQLException e) {
            throw new QueryExecutionException("Failed to execute query: " + e.getMessage(), e, sql);
        }
    }

    /**
     * Executes an update or DDL statement.
     *
     * @param sql the SQL statement to execute
     * @return the number of rows affected (for DML), or 0 (for DDL)
     * @throws QueryExecutionException if statement execution fails
     */
    public int executeUpdate(String sql) {
        Objects.requireNonNull(sql, "sql must not be null");
        logger.debug("Executing update: {}", sql);

        try (Statement stmt = runtime.getConnection().createStatement()) {
            return stmt.executeUpdate(sql);
        } catch (SQLException e) {
            throw new QueryExecutionException("Failed to execute update: " + e.getMessage(), e, sql);
        }
    }
}
