package com.tabledesigner.service;

import com.tabledesigner.config.DesignerSettings;
import com.tabledesigner.error.SchemaOperationFailedException;
import com.tabledesigner.model.QueryResult;
import com.tabledesigner.model.StatementResult;
import com.tabledesigner.util.JdbcJsonSafe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin access layer over the live SQLite database.
 *
 * <p>The catalog is never cached: every call re-reads {@code sqlite_master}, so tables created or
 * dropped behind the designer's back are seen immediately.
 */
@Slf4j
@Service
public class CatalogGateway {
    private static final String EXISTS_SQL =
            "SELECT name FROM sqlite_master WHERE type = 'table' AND name = ? COLLATE NOCASE";
    private static final String LIST_TABLES_SQL =
            "SELECT name FROM sqlite_master WHERE type = 'table' AND name NOT LIKE 'sqlite_%' ORDER BY name";

    private final DataSource dataSource;
    private final int maxRows;

    public CatalogGateway(@Qualifier("schemaDataSource") DataSource dataSource, DesignerSettings settings) {
        this.dataSource = dataSource;
        this.maxRows = settings.maxRows();
    }

    public boolean exists(String tableName) {
        if (tableName == null || tableName.isBlank()) {
            return false;
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(EXISTS_SQL)) {
            ps.setString(1, tableName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new SchemaOperationFailedException("Failed to look up table " + tableName, e);
        }
    }

    /**
     * Resolves the catalog spelling of a table name, which may differ in case from the requested one.
     *
     * @param tableName requested name
     * @return name as stored in the catalog, or null when the table does not exist
     */
    public String canonicalName(String tableName) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(EXISTS_SQL)) {
            ps.setString(1, tableName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        } catch (SQLException e) {
            throw new SchemaOperationFailedException("Failed to look up table " + tableName, e);
        }
    }

    /**
     * Executes one statement verbatim.
     *
     * <p>This is also the ad-hoc SQL entry point. No allow-listing is applied; the engine's own checks
     * are the only guard.
     *
     * @param sql statement text
     * @return rows when the statement produced a result set, otherwise the affected-row count
     */
    public StatementResult execute(String sql) {
        long startTime = System.currentTimeMillis();
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            boolean isResultSet = stmt.execute(sql);
            if (isResultSet) {
                try (ResultSet rs = stmt.getResultSet()) {
                    QueryResult result = readResultSet(rs);
                    return StatementResult.tabular(result, System.currentTimeMillis() - startTime);
                }
            }
            int updateCount = stmt.getUpdateCount();
            return StatementResult.update(Math.max(updateCount, 0), System.currentTimeMillis() - startTime);
        } catch (SQLException e) {
            throw new SchemaOperationFailedException("Statement failed", e);
        }
    }

    /**
     * Executes statements in one engine transaction. SQLite DDL is transactional, so a failure rolls
     * back every statement of the batch, drops included.
     *
     * @param statements statements in execution order
     */
    public void executeInTransaction(List<String> statements) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                for (String sql : statements) {
                    log.debug("Executing DDL: {}", sql);
                    stmt.execute(sql);
                }
                conn.commit();
            } catch (SQLException e) {
                rollbackQuietly(conn, e);
                restoreAutoCommit(conn, autoCommit, e);
                throw e;
            }
            conn.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            throw new SchemaOperationFailedException("Schema change failed", e);
        }
    }

    public List<String> listTables() {
        List<String> tables = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(LIST_TABLES_SQL)) {
            while (rs.next()) {
                tables.add(rs.getString(1));
            }
            return tables;
        } catch (SQLException e) {
            throw new SchemaOperationFailedException("Failed to list tables", e);
        }
    }

    /**
     * Size of the database in bytes, computed from page count and page size.
     */
    public long sizeInBytes() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                     "SELECT page_count * page_size FROM pragma_page_count(), pragma_page_size()")) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new SchemaOperationFailedException("Failed to read database size", e);
        }
    }

    private QueryResult readResultSet(ResultSet rs) throws SQLException {
        ResultSetMetaData rsmd = rs.getMetaData();
        int columnCount = rsmd.getColumnCount();

        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(rsmd.getColumnLabel(i));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        boolean truncated = false;
        while (rs.next()) {
            if (maxRows > 0 && rows.size() >= maxRows) {
                truncated = true;
                break;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(columns.get(i - 1), JdbcJsonSafe.readJsonSafeValue(rs, i));
            }
            rows.add(row);
        }
        return new QueryResult(columns, rows, truncated);
    }

    private void restoreAutoCommit(Connection conn, boolean autoCommit, SQLException cause) {
        try {
            conn.setAutoCommit(autoCommit);
        } catch (SQLException restoreError) {
            cause.addSuppressed(restoreError);
            log.warn("Could not restore auto-commit after schema change error", restoreError);
        }
    }

    private void rollbackQuietly(Connection conn, SQLException cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
            log.warn("Rollback failed after schema change error", rollbackError);
        }
    }
}
