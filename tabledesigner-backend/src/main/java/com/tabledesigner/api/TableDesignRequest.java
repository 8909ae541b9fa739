package com.tabledesigner.api;

import com.tabledesigner.model.TableDesign;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class TableDesignRequest {
    @NotNull(message = "Table design is required")
    private TableDesign table;
}
