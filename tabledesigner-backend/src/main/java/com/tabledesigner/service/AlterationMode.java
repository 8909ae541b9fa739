package com.tabledesigner.service;

import com.tabledesigner.model.FieldSpec;

import java.util.Locale;

/**
 * How field removal and field changes reach the live table.
 *
 * <p>{@link #REBUILD} always drops and recreates the table from the full field list.
 * {@link #IN_PLACE} uses {@code DROP COLUMN} and {@code RENAME COLUMN} where the engine can apply them
 * and rebuilds otherwise. Column addition is in place in both modes unless the new column carries a
 * constraint the engine cannot add to an existing table.
 */
public enum AlterationMode {
    REBUILD,
    IN_PLACE;

    public static AlterationMode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return REBUILD;
        }
        String s = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if ("INPLACE".equals(s)) {
            return IN_PLACE;
        }
        return AlterationMode.valueOf(s);
    }

    /**
     * SQLite refuses {@code ADD COLUMN} for primary key and unique columns.
     */
    public boolean canAddInPlace(FieldSpec field) {
        return !field.isPrimary() && !field.isUnique();
    }

    /**
     * SQLite refuses {@code DROP COLUMN} for primary key and unique columns.
     */
    public boolean canDropInPlace(FieldSpec field) {
        return this == IN_PLACE && !field.isPrimary() && !field.isUnique();
    }

    public boolean canRenameInPlace(FieldSpec current, FieldSpec replacement) {
        return this == IN_PLACE
                && current.sameDefinitionAs(replacement)
                && !current.getName().equals(replacement.getName());
    }
}
