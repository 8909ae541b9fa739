package com.tabledesigner.service;

import com.tabledesigner.error.SchemaOperationFailedException;
import com.tabledesigner.error.TableNotFoundException;
import com.tabledesigner.model.ColumnInfo;
import com.tabledesigner.model.FieldSpec;
import com.tabledesigner.model.TableDesign;
import com.tabledesigner.model.TableStructure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Reads table structure straight from the live catalog. The design store is never consulted, so
 * the snapshot shows manual changes made outside the designer.
 */
@Slf4j
@Service
public class SchemaInspector {
    private static final String TABLE_INFO_SQL =
            "SELECT name, type, \"notnull\", dflt_value, pk FROM pragma_table_info(?) ORDER BY cid";
    private static final String INDEX_LIST_SQL =
            "SELECT name, \"unique\", origin FROM pragma_index_list(?)";
    private static final String INDEX_INFO_SQL =
            "SELECT name FROM pragma_index_info(?) ORDER BY seqno";

    private final DataSource dataSource;
    private final CatalogGateway catalogGateway;

    public SchemaInspector(@Qualifier("schemaDataSource") DataSource dataSource, CatalogGateway catalogGateway) {
        this.dataSource = dataSource;
        this.catalogGateway = catalogGateway;
    }

    /**
     * Snapshot of a live table.
     *
     * @param tableName table name, matched case-insensitively
     * @return columns in declaration order with key and uniqueness flags
     * @throws TableNotFoundException when the catalog has no such table
     */
    public TableStructure describe(String tableName) {
        String canonical = catalogGateway.canonicalName(tableName);
        if (canonical == null) {
            throw new TableNotFoundException("Table " + tableName + " does not exist");
        }

        try (Connection conn = dataSource.getConnection()) {
            List<ColumnInfo> columns = new ArrayList<>();
            TreeMap<Integer, String> keyPositions = new TreeMap<>();
            try (PreparedStatement ps = conn.prepareStatement(TABLE_INFO_SQL)) {
                ps.setString(1, canonical);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        int pk = rs.getInt("pk");
                        ColumnInfo column = ColumnInfo.builder()
                                .name(rs.getString("name"))
                                .type(rs.getString("type"))
                                .nullable(rs.getInt("notnull") == 0)
                                .defaultValue(rs.getString("dflt_value"))
                                .primaryKey(pk > 0)
                                .build();
                        columns.add(column);
                        if (pk > 0) {
                            keyPositions.put(pk, column.getName());
                        }
                    }
                }
            }

            List<List<String>> uniqueConstraints = readUniqueConstraints(conn, canonical);
            Set<String> singleUniqueColumns = uniqueConstraints.stream()
                    .filter(cols -> cols.size() == 1)
                    .map(cols -> cols.get(0).toLowerCase(Locale.ROOT))
                    .collect(Collectors.toSet());
            for (ColumnInfo column : columns) {
                column.setUnique(singleUniqueColumns.contains(column.getName().toLowerCase(Locale.ROOT)));
            }

            return TableStructure.builder()
                    .name(canonical)
                    .columns(columns)
                    .primaryKeys(new ArrayList<>(keyPositions.values()))
                    .uniqueConstraints(uniqueConstraints)
                    .build();
        } catch (SQLException e) {
            throw new SchemaOperationFailedException("Failed to describe table " + tableName, e);
        }
    }

    public List<TableStructure> describeAll() {
        List<TableStructure> structures = new ArrayList<>();
        for (String table : catalogGateway.listTables()) {
            try {
                structures.add(describe(table));
            } catch (TableNotFoundException e) {
                // dropped between listing and describing
                log.debug("Skipping table {}: {}", table, e.getMessage());
            }
        }
        return structures;
    }

    /**
     * Whether a live table matches a design in column names and primary key set.
     *
     * @param structure live snapshot
     * @param design recorded design
     * @return true when both agree, ignoring identifier case
     */
    public boolean isConsistent(TableStructure structure, TableDesign design) {
        if (structure == null || design == null || design.getFields() == null) {
            return false;
        }
        Set<String> designColumns = lowerCased(design.getFields().stream().map(FieldSpec::getName).toList());
        Set<String> designKeys = lowerCased(design.getFields().stream()
                .filter(FieldSpec::isPrimary)
                .map(FieldSpec::getName)
                .toList());
        return designColumns.equals(lowerCased(structure.columnNames()))
                && designKeys.equals(lowerCased(structure.getPrimaryKeys()));
    }

    private List<List<String>> readUniqueConstraints(Connection conn, String tableName) throws SQLException {
        List<String> uniqueIndexes = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(INDEX_LIST_SQL)) {
            ps.setString(1, tableName);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    // origin 'u' is a UNIQUE constraint, 'pk' the primary key, 'c' a CREATE INDEX
                    if (rs.getInt("unique") == 1 && "u".equals(rs.getString("origin"))) {
                        uniqueIndexes.add(rs.getString("name"));
                    }
                }
            }
        }

        List<List<String>> constraints = new ArrayList<>();
        for (String indexName : uniqueIndexes) {
            List<String> cols = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(INDEX_INFO_SQL)) {
                ps.setString(1, indexName);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        cols.add(rs.getString("name"));
                    }
                }
            }
            constraints.add(cols);
        }
        return constraints;
    }

    private static Set<String> lowerCased(List<String> names) {
        Set<String> out = new HashSet<>();
        for (String name : names) {
            out.add(name.toLowerCase(Locale.ROOT));
        }
        return out;
    }
}
