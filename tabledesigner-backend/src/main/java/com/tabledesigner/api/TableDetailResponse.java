package com.tabledesigner.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tabledesigner.model.TableDesign;
import com.tabledesigner.model.TableStructure;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TableDetailResponse {
    private boolean success;
    private TableStructure table;
    // null when the table predates the design store
    private TableDesign design;
    private boolean inSync;
}
