package com.example.storage.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class IndexDefinition {
    String name;
    String tableName;
    @Singular("column")
    List<String> columns;
    boolean unique;
    @Builder.Default
    String method = "btree";
    /** Partial-index predicate without the {@code WHERE} keyword, or null. */
    String predicate;

    public boolean isPartial() {
        return predicate != null && !predicate.isBlank();
    }
}
