package com.example.storage.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ColumnDefinition {
    String name;
    LogicalType type;
    @Builder.Default
    boolean nullable = true;
    /** Dialect spelling, e.g. {@code VARCHAR(255)}. Resolved from {@link #type} when null. */
    String nativeType;
    /** Raw SQL default expression, e.g. {@code 'active'} or {@code FALSE}. */
    String defaultValue;
    Integer maxLength;
    Integer precision;
    Integer scale;

    public static ColumnDefinition of(String name, LogicalType type) {
        return builder().name(name).type(type).build();
    }

    public static ColumnDefinition required(String name, LogicalType type) {
        return builder().name(name).type(type).nullable(false).build();
    }
}
