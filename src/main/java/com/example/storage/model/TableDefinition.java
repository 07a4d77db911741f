package com.example.storage.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Value
@Builder(toBuilder = true)
public class TableDefinition {
    @Builder.Default
    String schema = "public";
    String name;
    @Singular("column")
    List<ColumnDefinition> columns;
    @Singular("index")
    List<IndexDefinition> indexes;
    @Singular("primaryKey")
    List<String> primaryKeys;
    @Builder.Default
    TemporalStrategyType strategy = TemporalStrategyType.NONE;
    boolean multiTenant;
    boolean softDelete;

    public String getQualifiedName() {
        return schema + "." + name;
    }

    /** Case-insensitive key used to match declared and introspected tables. */
    public String key() {
        return getQualifiedName().toLowerCase(Locale.ROOT);
    }

    public Optional<ColumnDefinition> findColumn(String columnName) {
        return columns.stream()
                .filter(c -> c.getName().equalsIgnoreCase(columnName))
                .findFirst();
    }

    public boolean hasColumn(String columnName) {
        return findColumn(columnName).isPresent();
    }
}
