package com.tabledesigner.ddl;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Every piece of caller-supplied text that ends up inside a DDL statement passes through here:
 * identifiers are quoted, type names are checked against a closed grammar and default values follow
 * a fixed literal policy.
 */
public final class SqlLiterals {
    private static final Pattern TYPE_PATTERN = Pattern.compile(
            "^[A-Za-z][A-Za-z0-9_]*(\\s+[A-Za-z][A-Za-z0-9_]*)*(\\s*\\(\\s*\\d+\\s*(,\\s*\\d+\\s*)?\\))?$");
    private static final Pattern SIZED_TYPE_PATTERN = Pattern.compile(".*\\(.*\\)\\s*$");
    private static final Pattern NUMERIC_PATTERN = Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?$");
    private static final Set<String> KEYWORD_LITERALS = Set.of(
            "NULL", "TRUE", "FALSE", "CURRENT_TIMESTAMP", "CURRENT_DATE", "CURRENT_TIME");
    // words that start a column constraint and so can never be part of a type name
    private static final Set<String> CONSTRAINT_WORDS = Set.of(
            "PRIMARY", "KEY", "UNIQUE", "NOT", "NULL", "DEFAULT", "REFERENCES", "CHECK", "COLLATE",
            "GENERATED", "ALWAYS", "AS", "CONSTRAINT", "AUTOINCREMENT", "FOREIGN", "ON", "CONFLICT");

    private SqlLiterals() {
    }

    /**
     * Quotes an identifier with double quotes, doubling embedded quotes.
     *
     * @param identifier raw identifier
     * @return quoted identifier
     * @throws IllegalArgumentException when the identifier is blank or holds control characters
     */
    public static String quoteIdentifier(String identifier) {
        if (!isValidIdentifier(identifier)) {
            throw new IllegalArgumentException("Invalid identifier: " + identifier);
        }
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    public static boolean isValidIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return false;
        }
        return identifier.chars().noneMatch(Character::isISOControl);
    }

    /**
     * Whether {@code type} is an engine type name, optionally with an inline size such as
     * {@code VARCHAR(50)} or {@code DECIMAL(10, 2)}. Constraint keywords are refused anywhere in the
     * name, so {@code INTEGER PRIMARY KEY} is not a type.
     *
     * @param type type name
     * @return true when the name is acceptable
     */
    public static boolean isValidType(String type) {
        if (type == null || !TYPE_PATTERN.matcher(type.trim()).matches()) {
            return false;
        }
        int paren = type.indexOf('(');
        String words = paren >= 0 ? type.substring(0, paren) : type;
        for (String word : words.trim().split("\\s+")) {
            if (CONSTRAINT_WORDS.contains(word.toUpperCase(Locale.ROOT))) {
                return false;
            }
        }
        return true;
    }

    public static boolean hasInlineSize(String type) {
        return type != null && SIZED_TYPE_PATTERN.matcher(type).matches();
    }

    /**
     * Renders a default value.
     *
     * <p>Numbers, {@code NULL}, booleans, the {@code CURRENT_*} keywords, well-formed single-quoted
     * strings and parenthesized expressions without statement separators or comments are emitted
     * verbatim. Anything else becomes a single-quoted string.
     *
     * @param value raw default as supplied by the caller
     * @return literal safe to append after {@code DEFAULT}
     */
    public static String renderDefault(String value) {
        String trimmed = value.trim();
        if (NUMERIC_PATTERN.matcher(trimmed).matches()) {
            return trimmed;
        }
        String upper = trimmed.toUpperCase(Locale.ROOT);
        if (KEYWORD_LITERALS.contains(upper)) {
            return upper;
        }
        if (isQuotedString(trimmed)) {
            return trimmed;
        }
        if (isSafeExpression(trimmed)) {
            return trimmed;
        }
        return quoteString(trimmed);
    }

    public static String quoteString(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    private static boolean isQuotedString(String s) {
        if (s.length() < 2 || s.charAt(0) != '\'' || s.charAt(s.length() - 1) != '\'') {
            return false;
        }
        String inner = s.substring(1, s.length() - 1).replace("''", "");
        return inner.indexOf('\'') < 0;
    }

    private static boolean isSafeExpression(String s) {
        if (s.length() < 2 || s.charAt(0) != '(' || s.charAt(s.length() - 1) != ')') {
            return false;
        }
        if (s.contains(";") || s.contains("--") || s.contains("/*")) {
            return false;
        }
        int depth = 0;
        boolean inString = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\'') {
                inString = !inString;
            } else if (!inString && c == '(') {
                depth++;
            } else if (!inString && c == ')') {
                depth--;
                // the outer parentheses must enclose the whole expression
                if (depth == 0 && i != s.length() - 1) {
                    return false;
                }
            }
            if (depth < 0) {
                return false;
            }
        }
        return depth == 0 && !inString;
    }
}
