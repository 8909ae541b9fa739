package com.tabledesigner.api;

import com.tabledesigner.model.FieldSpec;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class FieldRequest {
    @NotNull(message = "Field definition is required")
    private FieldSpec field;
}
