package com.example.storage.error;

import com.example.storage.model.LogicalType;

public class ValidationBypassException extends StorageException {

    private final String column;

    public ValidationBypassException(String table, String column, LogicalType type, Object value) {
        super("Value of type " + (value == null ? "null" : value.getClass().getSimpleName())
                + " is not valid for " + type + " column " + table + "." + column);
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
