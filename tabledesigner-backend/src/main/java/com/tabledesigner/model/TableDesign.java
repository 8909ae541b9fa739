package com.tabledesigner.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Declarative description of a table: the only source of truth for what the live table should look like.
 * Field order is column order.
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TableDesign {
    private String name;
    private String comment;
    private List<FieldSpec> fields = new ArrayList<>();

    public TableDesign(String name, List<FieldSpec> fields) {
        this.name = name;
        this.fields = new ArrayList<>(fields);
    }

    public Optional<FieldSpec> findField(String fieldName) {
        if (fieldName == null || fields == null) {
            return Optional.empty();
        }
        return fields.stream()
                .filter(f -> f.getName() != null && f.getName().equalsIgnoreCase(fieldName))
                .findFirst();
    }

    /**
     * Deep copy, optionally under another table name.
     *
     * @param tableName name of the copy
     * @param newFields field list of the copy
     * @return new design sharing no mutable state with this one
     */
    public TableDesign withFields(String tableName, List<FieldSpec> newFields) {
        List<FieldSpec> copied = new ArrayList<>(newFields.size());
        for (FieldSpec f : newFields) {
            copied.add(f.copy());
        }
        TableDesign copy = new TableDesign(tableName, copied);
        copy.setComment(comment);
        return copy;
    }
}
