package com.tabledesigner.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tabledesigner.error.DesignNotFoundException;
import com.tabledesigner.model.DesignRecord;
import com.tabledesigner.model.DesignSummary;
import com.tabledesigner.model.TableDesign;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Keeps the latest design of every managed table, keyed by table name (case-insensitive).
 *
 * <p>Each {@link #put(TableDesign)} is a single upsert statement, so readers see either the previous
 * record or the new one. Designs are stored as JSON and are not validated here.
 */
@Slf4j
@Component
public class DesignStore {
    private static final String CREATE_SQL = "CREATE TABLE IF NOT EXISTS table_designs ("
            + "table_name TEXT NOT NULL UNIQUE COLLATE NOCASE, "
            + "design_data TEXT NOT NULL, "
            + "version INTEGER NOT NULL DEFAULT 1, "
            + "created_at TEXT NOT NULL, "
            + "updated_at TEXT NOT NULL)";
    private static final String UPSERT_SQL = "INSERT INTO table_designs (table_name, design_data, version, created_at, updated_at) "
            + "VALUES (?, ?, 1, ?, ?) "
            + "ON CONFLICT(table_name) DO UPDATE SET "
            + "design_data = excluded.design_data, "
            + "version = table_designs.version + 1, "
            + "updated_at = excluded.updated_at "
            + "RETURNING table_name, design_data, version, created_at, updated_at";
    private static final String SELECT_SQL =
            "SELECT table_name, design_data, version, created_at, updated_at FROM table_designs WHERE table_name = ?";
    private static final String LIST_SQL =
            "SELECT table_name, design_data, version, created_at, updated_at FROM table_designs ORDER BY table_name";
    private static final String DELETE_SQL = "DELETE FROM table_designs WHERE table_name = ?";

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public DesignStore(@Qualifier("designDataSource") DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = dataSource;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void initialize() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_SQL);
        }
    }

    /**
     * Inserts or replaces the record of {@code design.getName()}.
     *
     * @param design design to record
     * @return the record as stored, with its new version
     * @throws DesignStoreException when the write fails; the previous record is then unchanged
     */
    public DesignRecord put(TableDesign design) {
        String json = serialize(design);
        String now = OffsetDateTime.now(ZoneOffset.UTC).toString();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
            ps.setString(1, design.getName());
            ps.setString(2, json);
            ps.setString(3, now);
            ps.setString(4, now);
            // the upsert reports the stored row itself, so no second read can fail after the write
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new DesignStoreException("Upsert of " + design.getName() + " returned no row", null);
                }
                return readRecord(rs);
            }
        } catch (SQLException e) {
            throw new DesignStoreException("Failed to store design of " + design.getName(), e);
        }
    }

    public Optional<DesignRecord> get(String tableName) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_SQL)) {
            ps.setString(1, tableName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readRecord(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new DesignStoreException("Failed to read design of " + tableName, e);
        }
    }

    public DesignRecord require(String tableName) {
        return get(tableName).orElseThrow(() -> new DesignNotFoundException(
                "No design recorded for table " + tableName));
    }

    /**
     * @param tableName table name
     * @return true when a record was removed
     */
    public boolean delete(String tableName) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(DELETE_SQL)) {
            ps.setString(1, tableName);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new DesignStoreException("Failed to delete design of " + tableName, e);
        }
    }

    public List<DesignSummary> list() {
        List<DesignSummary> summaries = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(LIST_SQL)) {
            while (rs.next()) {
                DesignRecord record = readRecord(rs);
                TableDesign design = record.getDesign();
                summaries.add(DesignSummary.builder()
                        .tableName(record.getTableName())
                        .comment(design.getComment())
                        .fieldCount(design.getFields() != null ? design.getFields().size() : 0)
                        .version(record.getVersion())
                        .updatedAt(record.getUpdatedAt())
                        .build());
            }
            return summaries;
        } catch (SQLException e) {
            throw new DesignStoreException("Failed to list designs", e);
        }
    }

    private DesignRecord readRecord(ResultSet rs) throws SQLException {
        String tableName = rs.getString("table_name");
        TableDesign design;
        try {
            design = objectMapper.readValue(rs.getString("design_data"), TableDesign.class);
        } catch (JsonProcessingException e) {
            throw new DesignStoreException("Stored design of " + tableName + " is not readable", e);
        }
        return DesignRecord.builder()
                .tableName(tableName)
                .design(design)
                .version(rs.getLong("version"))
                .createdAt(OffsetDateTime.parse(rs.getString("created_at")))
                .updatedAt(OffsetDateTime.parse(rs.getString("updated_at")))
                .build();
    }

    private String serialize(TableDesign design) {
        try {
            return objectMapper.writeValueAsString(design);
        } catch (JsonProcessingException e) {
            throw new DesignStoreException("Failed to serialize design of " + design.getName(), e);
        }
    }
}
