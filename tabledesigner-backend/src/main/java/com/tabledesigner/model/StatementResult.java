package com.tabledesigner.model;

/**
 * Outcome of an arbitrary statement: a {@link QueryResult} when the engine produced rows, an
 * affected-row count otherwise.
 */
public final class StatementResult {
    private final QueryResult queryResult;
    private final long rowsAffected;
    private final long durationMs;

    private StatementResult(QueryResult queryResult, long rowsAffected, long durationMs) {
        this.queryResult = queryResult;
        this.rowsAffected = rowsAffected;
        this.durationMs = durationMs;
    }

    public static StatementResult tabular(QueryResult queryResult, long durationMs) {
        return new StatementResult(queryResult, queryResult.getRows().size(), durationMs);
    }

    public static StatementResult update(long rowsAffected, long durationMs) {
        return new StatementResult(null, rowsAffected, durationMs);
    }

    public boolean isTabular() {
        return queryResult != null;
    }

    public QueryResult getQueryResult() {
        return queryResult;
    }

    public long getRowsAffected() {
        return rowsAffected;
    }

    public long getDurationMs() {
        return durationMs;
    }
}
