package com.tabledesigner.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Optional;

/**
 * Read-only snapshot of a live table. Recomputed on demand, never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TableStructure {
    private String name;
    private List<ColumnInfo> columns;
    // ordered by key position
    private List<String> primaryKeys;
    private List<List<String>> uniqueConstraints;

    public Optional<ColumnInfo> findColumn(String columnName) {
        if (columnName == null || columns == null) {
            return Optional.empty();
        }
        return columns.stream()
                .filter(c -> c.getName().equalsIgnoreCase(columnName))
                .findFirst();
    }

    public List<String> columnNames() {
        return columns == null ? List.of() : columns.stream().map(ColumnInfo::getName).toList();
    }
}
