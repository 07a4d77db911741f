package com.example.storage.model;

import java.util.Locale;

public enum AuditOperation {
    INSERT,
    UPDATE,
    DELETE;

    public String sqlValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AuditOperation fromSqlValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
