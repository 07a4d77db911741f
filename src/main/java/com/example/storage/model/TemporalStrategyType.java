package com.example.storage.model;

import java.util.Locale;

public enum TemporalStrategyType {
    /** Single row per record, updated in place, no history. */
    NONE,
    /** Single row per record plus one audit row per changed field. */
    COPY_ON_CHANGE,
    /** Immutable versions with a validity window per version. */
    SCD2;

    public static TemporalStrategyType fromString(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
