package com.tabledesigner.ddl;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class SqlLiteralsTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "0|0",
            "-12.5|-12.5",
            "1e3|1e3",
            "null|NULL",
            "current_timestamp|CURRENT_TIMESTAMP",
            "true|TRUE",
            "'draft'|'draft'",
            "'it''s'|'it''s'",
            "(datetime('now'))|(datetime('now'))",
            "active|'active'",
            "it's|'it''s'",
            "(1); DROP TABLE users|'(1); DROP TABLE users'",
            "(1) + (2)|'(1) + (2)'",
            "\"'a' || 'b'\"|\"'''a'' || ''b'''\""
    })
    void rendersDefaultsByPolicy(String raw, String expected) {
        assertThat(SqlLiterals.renderDefault(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"INTEGER", "varchar", "DOUBLE PRECISION", "VARCHAR(50)", "DECIMAL(10, 2)", "UNSIGNED BIG INT"})
    void acceptsEngineTypeNames(String type) {
        assertThat(SqlLiterals.isValidType(type)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "1INT", "TEXT,", "TEXT) --", "INT(abc)",
            "INTEGER PRIMARY KEY", "TEXT UNIQUE", "TEXT NOT NULL", "INT REFERENCES x", "text collate nocase",
            "VARCHAR DEFAULT (5)"})
    void rejectsAnythingElse(String type) {
        assertThat(SqlLiterals.isValidType(type)).isFalse();
    }
}
