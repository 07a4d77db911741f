package com.example.storage.model;

public enum ChangeType {
    ADD_TABLE,
    ADD_COLUMN,
    ADD_INDEX,
    ALTER_COLUMN,
    DROP_INDEX,
    DROP_COLUMN,
    DROP_TABLE
}
