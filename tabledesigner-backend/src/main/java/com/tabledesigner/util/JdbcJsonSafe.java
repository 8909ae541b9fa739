package com.tabledesigner.util;

import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Base64;

/**
 * Converts JDBC column values into JSON-safe primitives before they reach a response body.
 */
public final class JdbcJsonSafe {
    private static final int MAX_STRING_CHARS = 100_000;
    private static final int MAX_BLOB_BYTES = 100_000;

    private JdbcJsonSafe() {
    }

    /**
     * Reads a JDBC column value and returns a JSON-safe equivalent.
     *
     * @param rs result set
     * @param columnIndex 1-based column index
     * @return json-safe value
     * @throws SQLException when the value cannot be read at all
     */
    public static Object readJsonSafeValue(ResultSet rs, int columnIndex) throws SQLException {
        return toJsonSafe(rs.getObject(columnIndex));
    }

    public static Object toJsonSafe(Object v) throws SQLException {
        if (v == null) {
            return null;
        }
        if (v instanceof Number || v instanceof Boolean) {
            return v;
        }
        if (v instanceof String s) {
            return truncateString(s);
        }
        // SQLite BLOB columns come back as byte[]
        if (v instanceof byte[] bytes) {
            return encodeBytes(bytes);
        }
        if (v instanceof Clob clob) {
            long length = clob.length();
            return length <= 0 ? "" : clob.getSubString(1, (int) Math.min(length, MAX_STRING_CHARS));
        }
        if (v instanceof Blob blob) {
            long length = blob.length();
            return length <= 0 ? "" : encodeBytes(blob.getBytes(1, (int) Math.min(length, MAX_BLOB_BYTES)));
        }
        if (v instanceof java.util.Date || v instanceof java.time.temporal.Temporal) {
            return v.toString();
        }
        return truncateString(String.valueOf(v));
    }

    private static String encodeBytes(byte[] bytes) {
        if (bytes.length > MAX_BLOB_BYTES) {
            byte[] head = new byte[MAX_BLOB_BYTES];
            System.arraycopy(bytes, 0, head, 0, MAX_BLOB_BYTES);
            return Base64.getEncoder().encodeToString(head);
        }
        return Base64.getEncoder().encodeToString(bytes);
    }

    private static String truncateString(String s) {
        if (s.length() <= MAX_STRING_CHARS) {
            return s;
        }
        return s.substring(0, MAX_STRING_CHARS);
    }
}
