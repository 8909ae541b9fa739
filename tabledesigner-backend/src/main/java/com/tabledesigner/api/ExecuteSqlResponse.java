package com.tabledesigner.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Ad-hoc statement result: {@code tabular} carries columns and results, {@code text} carries the
 * affected-row count.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExecuteSqlResponse {
    private boolean success;
    private String type; // tabular | text
    private List<String> columns;
    private List<Map<String, Object>> results;
    private Long rowsAffected;
    private Boolean truncated;
    private long durationMs;
    private String message;
}
