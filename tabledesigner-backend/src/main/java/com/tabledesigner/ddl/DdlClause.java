package com.tabledesigner.ddl;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One rendered fragment of a DDL statement. Statements are built as clause lists and rendered in one
 * pass, so quoting decisions only happen in the factories below.
 */
@FunctionalInterface
public interface DdlClause {

    String render();

    static DdlClause keyword(String keyword) {
        return () -> keyword;
    }

    static DdlClause identifier(String name) {
        String quoted = SqlLiterals.quoteIdentifier(name);
        return () -> quoted;
    }

    static DdlClause type(String type, Integer length) {
        String trimmed = type.trim();
        return () -> length != null ? trimmed + "(" + length + ")" : trimmed;
    }

    static DdlClause notNull() {
        return () -> "NOT NULL";
    }

    static DdlClause unique() {
        return () -> "UNIQUE";
    }

    static DdlClause defaultValue(String value) {
        String literal = SqlLiterals.renderDefault(value);
        return () -> "DEFAULT " + literal;
    }

    static DdlClause primaryKey(List<String> columns) {
        DdlClause keys = parenthesized(columns.stream().map(DdlClause::identifier).toList());
        return () -> "PRIMARY KEY " + keys.render();
    }

    /**
     * Comma separated, parenthesized list.
     */
    static DdlClause parenthesized(List<? extends DdlClause> items) {
        return () -> items.stream().map(DdlClause::render).collect(Collectors.joining(", ", "(", ")"));
    }

    /**
     * Space separated sequence.
     */
    static DdlClause sequence(List<? extends DdlClause> parts) {
        return () -> parts.stream().map(DdlClause::render).collect(Collectors.joining(" "));
    }
}
