package com.rollupduck.exception;

import com.rollupduck.test.TestBase;
import com.rollupduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

@TestCategories.Unit
@TestCategories.Tier2
@DisplayName("Execution error messages")
public class QueryExecutionExceptionTest extends TestBase {

    @Test
    @DisplayName("Missing column names the column")
    void testMissingColumn() {
        QueryExecutionException e = new QueryExecutionException(
            "Binder Error: Referenced column \"sum_cost\" not found in FROM clause!", "SELECT sum_cost FROM t");

        assertThat(e.getKind()).isEqualTo(QueryExecutionException.ErrorKind.COLUMN_NOT_FOUND);
        assertThat(e.getUserMessage()).startsWith("Column 'sum_cost' not found");
    }

    @Test
    @DisplayName("Missing table suggests it was never materialized")
    void testMissingTable() {
        QueryExecutionException e = new QueryExecutionException(
            "Catalog Error: Table with name summary_day_0a1b2c3d does not exist!", "SELECT * FROM summary_day_0a1b2c3d");

        assertThat(e.getKind()).isEqualTo(QueryExecutionException.ErrorKind.TABLE_NOT_FOUND);
        assertThat(e.getUserMessage()).contains("summary_day_0a1b2c3d").contains("materialized");
    }

    @Test
    @DisplayName("Conversion errors are type mismatches")
    void testConversion() {
        QueryExecutionException e = new QueryExecutionException(
            "Conversion Error: Could not convert string 'abc' to INT32", "SELECT 1");

        assertThat(e.getKind()).isEqualTo(QueryExecutionException.ErrorKind.TYPE_MISMATCH);
    }

    @Test
    @DisplayName("Technical message carries SQL and cause")
    void testTechnicalMessage() {
        SQLException cause = new SQLException("Parser Error: syntax error at or near \"FORM\"");
        QueryExecutionException e = new QueryExecutionException(
            "Failed to execute query: " + cause.getMessage(), cause, "SELECT 1 FORM t");

        assertThat(e.getKind()).isEqualTo(QueryExecutionException.ErrorKind.SYNTAX);
        assertThat(e.getTechnicalMessage())
            .contains("SQL: SELECT 1 FORM t")
            .contains("Caused by java.sql.SQLException");
        assertThat(e.getFailedSQL()).isEqualTo("SELECT 1 FORM t");
    }

    @Test
    @DisplayName("Unknown errors keep the original text")
    void testOther() {
        QueryExecutionException e = new QueryExecutionException("Something odd", "SELECT 1");

        assertThat(e.getKind()).isEqualTo(QueryExecutionException.ErrorKind.OTHER);
        assertThat(e.getUserMessage()).isEqualTo("Query execution failed: Something odd");
    }
}
