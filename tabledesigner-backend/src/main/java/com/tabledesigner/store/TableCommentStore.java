package com.tabledesigner.store;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

/**
 * Table comments, kept beside the design records because SQLite has no table comments.
 *
 * <p>Writes are best effort: a failure is logged and never fails the schema change that triggered it.
 */
@Slf4j
@Component
public class TableCommentStore {
    private final DataSource dataSource;

    public TableCommentStore(@Qualifier("designDataSource") DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @PostConstruct
    public void initialize() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS table_comments ("
                    + "table_name TEXT PRIMARY KEY COLLATE NOCASE, "
                    + "comment TEXT)");
        }
    }

    public void save(String tableName, String comment) {
        if (comment == null || comment.isBlank()) {
            return;
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                     "INSERT OR REPLACE INTO table_comments (table_name, comment) VALUES (?, ?)")) {
            ps.setString(1, tableName);
            ps.setString(2, comment);
            ps.executeUpdate();
        } catch (SQLException e) {
            log.warn("Failed to save comment of table {}: {}", tableName, e.getMessage());
        }
    }

    public Optional<String> find(String tableName) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT comment FROM table_comments WHERE table_name = ?")) {
            ps.setString(1, tableName);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            log.warn("Failed to read comment of table {}: {}", tableName, e.getMessage());
            return Optional.empty();
        }
    }

    public void delete(String tableName) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("DELETE FROM table_comments WHERE table_name = ?")) {
            ps.setString(1, tableName);
            ps.executeUpdate();
        } catch (SQLException e) {
            log.warn("Failed to delete comment of table {}: {}", tableName, e.getMessage());
        }
    }
}
