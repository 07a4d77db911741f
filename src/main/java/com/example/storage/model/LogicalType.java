package com.example.storage.model;

public enum LogicalType {
    SMALLINT,
    INTEGER,
    BIGINT,
    DECIMAL,
    FLOAT,
    BOOLEAN,
    STRING,
    TEXT,
    DATE,
    TIMESTAMP,
    JSON,
    UUID,
    BINARY,
    ARRAY;

    public boolean isNumeric() {
        return switch (this) {
            case SMALLINT, INTEGER, BIGINT, DECIMAL, FLOAT -> true;
            default -> false;
        };
    }
}
