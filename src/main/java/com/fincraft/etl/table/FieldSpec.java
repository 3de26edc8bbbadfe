package com.fincraft.etl.table;

/**
 * Maps one upstream attribute onto a stored business field.
 */
public record FieldSpec(String column, String apiField, ValueType type) {

    public enum ValueType {
        NUMBER,
        TEXT
    }

    public static FieldSpec number(String column, String apiField) {
        return new FieldSpec(column, apiField, ValueType.NUMBER);
    }

    public static FieldSpec text(String column, String apiField) {
        return new FieldSpec(column, apiField, ValueType.TEXT);
    }
}
