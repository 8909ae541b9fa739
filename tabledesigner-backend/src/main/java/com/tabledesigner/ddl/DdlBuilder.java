package com.tabledesigner.ddl;

import com.tabledesigner.error.InvalidDesignException;
import com.tabledesigner.error.InvalidFieldException;
import com.tabledesigner.model.FieldSpec;
import com.tabledesigner.model.TableDesign;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.tabledesigner.ddl.DdlClause.identifier;
import static com.tabledesigner.ddl.DdlClause.keyword;
import static com.tabledesigner.ddl.DdlClause.sequence;

/**
 * Renders table designs into DDL statements. Pure functions, no I/O.
 */
public final class DdlBuilder {

    private DdlBuilder() {
    }

    /**
     * Renders {@code CREATE TABLE} for a design.
     *
     * <p>Primary key fields are collected into one table-level {@code PRIMARY KEY} clause, so two
     * primary fields make a composite key.
     *
     * @param design table design
     * @return create statement
     * @throws InvalidDesignException when the design is malformed
     */
    public static String buildCreate(TableDesign design) {
        validateDesign(design);

        List<DdlClause> definitions = new ArrayList<>();
        List<String> primaryKeys = new ArrayList<>();
        for (FieldSpec field : design.getFields()) {
            definitions.add(columnDefinition(field));
            if (field.isPrimary()) {
                primaryKeys.add(field.getName());
            }
        }
        if (!primaryKeys.isEmpty()) {
            definitions.add(DdlClause.primaryKey(primaryKeys));
        }

        return sequence(List.of(
                keyword("CREATE TABLE"),
                identifier(design.getName()),
                DdlClause.parenthesized(definitions)
        )).render();
    }

    /**
     * Renders {@code ALTER TABLE ... ADD COLUMN} for one field, using the same column clause rules as
     * {@link #buildCreate(TableDesign)}.
     *
     * @param tableName target table
     * @param field field to add
     * @return alter statement
     * @throws InvalidFieldException when the field is malformed
     */
    public static String buildAddColumn(String tableName, FieldSpec field) {
        if (!SqlLiterals.isValidIdentifier(tableName)) {
            throw new InvalidFieldException("Table name is required");
        }
        validateField(field);
        return sequence(List.of(
                keyword("ALTER TABLE"),
                identifier(tableName),
                keyword("ADD COLUMN"),
                columnDefinition(field)
        )).render();
    }

    public static String buildDropTable(String tableName) {
        return sequence(List.of(keyword("DROP TABLE"), identifier(tableName))).render();
    }

    public static String buildDropTableIfExists(String tableName) {
        return sequence(List.of(keyword("DROP TABLE IF EXISTS"), identifier(tableName))).render();
    }

    public static String buildRenameTable(String from, String to) {
        return sequence(List.of(
                keyword("ALTER TABLE"),
                identifier(from),
                keyword("RENAME TO"),
                identifier(to)
        )).render();
    }

    public static String buildDropColumn(String tableName, String columnName) {
        return sequence(List.of(
                keyword("ALTER TABLE"),
                identifier(tableName),
                keyword("DROP COLUMN"),
                identifier(columnName)
        )).render();
    }

    public static String buildRenameColumn(String tableName, String from, String to) {
        return sequence(List.of(
                keyword("ALTER TABLE"),
                identifier(tableName),
                keyword("RENAME COLUMN"),
                identifier(from),
                keyword("TO"),
                identifier(to)
        )).render();
    }

    /**
     * Renders {@code INSERT INTO target (...) SELECT ... FROM source}.
     *
     * @param target table receiving the rows
     * @param source table providing the rows
     * @param columnMapping target column to source column, in target order
     * @return copy statement
     */
    public static String buildCopyRows(String target, String source, Map<String, String> columnMapping) {
        if (columnMapping.isEmpty()) {
            throw new IllegalArgumentException("At least one column is required to copy rows");
        }
        List<DdlClause> targetColumns = columnMapping.keySet().stream().map(DdlClause::identifier).toList();
        List<DdlClause> sourceColumns = columnMapping.values().stream().map(DdlClause::identifier).toList();
        DdlClause selectList = () -> String.join(", ", sourceColumns.stream().map(DdlClause::render).toList());
        return sequence(List.of(
                keyword("INSERT INTO"),
                identifier(target),
                DdlClause.parenthesized(targetColumns),
                keyword("SELECT"),
                selectList,
                keyword("FROM"),
                identifier(source)
        )).render();
    }

    /**
     * Checks table name, field presence, field names, uniqueness of names, types and lengths.
     *
     * @param design design to check
     * @throws InvalidDesignException on the first problem found
     */
    public static void validateDesign(TableDesign design) {
        if (design == null || !SqlLiterals.isValidIdentifier(design.getName())) {
            throw new InvalidDesignException("Table name is required");
        }
        if (design.getName().toLowerCase(Locale.ROOT).startsWith("sqlite_")) {
            throw new InvalidDesignException("Table names starting with sqlite_ are reserved: " + design.getName());
        }
        if (design.getFields() == null || design.getFields().isEmpty()) {
            throw new InvalidDesignException("Table " + design.getName() + " must declare at least one field");
        }
        Set<String> seen = new HashSet<>();
        for (FieldSpec field : design.getFields()) {
            try {
                validateField(field);
            } catch (InvalidFieldException e) {
                throw new InvalidDesignException(e.getMessage());
            }
            if (!seen.add(field.getName().toLowerCase(Locale.ROOT))) {
                throw new InvalidDesignException("Duplicate field name: " + field.getName());
            }
        }
    }

    /**
     * Checks one field in isolation.
     *
     * @param field field to check
     * @throws InvalidFieldException when the name, type or length is unusable
     */
    public static void validateField(FieldSpec field) {
        if (field == null || !SqlLiterals.isValidIdentifier(field.getName())) {
            throw new InvalidFieldException("Field name is required");
        }
        if (!SqlLiterals.isValidType(field.getType())) {
            throw new InvalidFieldException("Invalid type for field " + field.getName() + ": " + field.getType());
        }
        if (field.getLength() != null) {
            if (field.getLength() <= 0) {
                throw new InvalidFieldException("Length of field " + field.getName() + " must be positive");
            }
            if (SqlLiterals.hasInlineSize(field.getType())) {
                throw new InvalidFieldException("Field " + field.getName() + " declares a size both in its type and its length");
            }
        }
    }

    private static DdlClause columnDefinition(FieldSpec field) {
        List<DdlClause> parts = new ArrayList<>();
        parts.add(identifier(field.getName()));
        parts.add(DdlClause.type(field.getType(), field.getLength()));
        if (!field.isNullable()) {
            parts.add(DdlClause.notNull());
        }
        if (field.isUnique()) {
            parts.add(DdlClause.unique());
        }
        if (field.hasDefault()) {
            parts.add(DdlClause.defaultValue(field.getDefaultValue()));
        }
        return sequence(parts);
    }
}
