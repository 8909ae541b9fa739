package com.tabledesigner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Objects;

/**
 * One column of a table design.
 *
 * <p>{@code default} holds a literal in engine syntax. JSON numbers and booleans are accepted and kept
 * as their literal text, so {@code "default": 0} renders {@code DEFAULT 0}.
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FieldSpec {
    private String name;
    private String type;
    private Integer length;
    private boolean nullable = true;
    private boolean unique;
    private boolean primary;

    @JsonProperty("default")
    private String defaultValue;

    public FieldSpec(String name, String type) {
        this.name = name;
        this.type = type;
    }

    public boolean hasDefault() {
        return defaultValue != null && !defaultValue.isBlank();
    }

    public FieldSpec copy() {
        FieldSpec copy = new FieldSpec(name, type);
        copy.setLength(length);
        copy.setNullable(nullable);
        copy.setUnique(unique);
        copy.setPrimary(primary);
        copy.setDefaultValue(defaultValue);
        return copy;
    }

    /**
     * Whether this field and {@code other} declare the same column apart from its name.
     *
     * @param other other field
     * @return true when type, length, constraints and default match
     */
    public boolean sameDefinitionAs(FieldSpec other) {
        return other != null
                && type != null && type.equalsIgnoreCase(other.type)
                && Objects.equals(length, other.length)
                && nullable == other.nullable
                && unique == other.unique
                && primary == other.primary
                && Objects.equals(defaultValue, other.defaultValue);
    }
}
