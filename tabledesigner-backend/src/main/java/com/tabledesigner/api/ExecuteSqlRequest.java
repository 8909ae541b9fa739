package com.tabledesigner.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ExecuteSqlRequest {
    @NotBlank(message = "SQL is required")
    private String sql;
}
