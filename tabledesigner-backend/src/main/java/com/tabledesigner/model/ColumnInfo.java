package com.tabledesigner.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Column of a live table as reported by the engine catalog.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ColumnInfo {
    private String name;
    private String type;
    private boolean nullable;
    private String defaultValue;
    private boolean primaryKey;
    private boolean unique;
}
