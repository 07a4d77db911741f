package com.example.storage.error;

import com.example.storage.model.LogicalType;

public class UnsupportedTypeException extends StorageException {

    public UnsupportedTypeException(String table, String column, LogicalType type, String dialect) {
        super("Column " + table + "." + column + " declares type " + type
                + " which has no mapping for dialect " + dialect + "; declare a native type");
    }
}
