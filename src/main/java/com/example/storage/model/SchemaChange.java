package com.example.storage.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SchemaChange {
    ChangeType type;
    TableDefinition table;
    ColumnDefinition column;
    ColumnDefinition previousColumn;
    IndexDefinition index;
    /** ADD_INDEX only: an index of the same name exists with another definition. */
    boolean replacing;
    /** ALTER_COLUMN only: why the change cannot be applied without manual migration. */
    String blockedReason;

    public static SchemaChange addTable(TableDefinition table) {
        return new SchemaChange(ChangeType.ADD_TABLE, table, null, null, null, false, null);
    }

    public static SchemaChange dropTable(TableDefinition table) {
        return new SchemaChange(ChangeType.DROP_TABLE, table, null, null, null, false, null);
    }

    public static SchemaChange addColumn(TableDefinition table, ColumnDefinition column) {
        return new SchemaChange(ChangeType.ADD_COLUMN, table, column, null, null, false, null);
    }

    public static SchemaChange dropColumn(TableDefinition table, ColumnDefinition column) {
        return new SchemaChange(ChangeType.DROP_COLUMN, table, column, null, null, false, null);
    }

    public static SchemaChange alterColumn(TableDefinition table, ColumnDefinition previous,
                                           ColumnDefinition column, String blockedReason) {
        return new SchemaChange(ChangeType.ALTER_COLUMN, table, column, previous, null, false, blockedReason);
    }

    public static SchemaChange addIndex(TableDefinition table, IndexDefinition index, boolean replacing) {
        return new SchemaChange(ChangeType.ADD_INDEX, table, null, null, index, replacing, null);
    }

    public static SchemaChange dropIndex(TableDefinition table, IndexDefinition index) {
        return new SchemaChange(ChangeType.DROP_INDEX, table, null, null, index, false, null);
    }

    /** Removes data-bearing structure, so it needs an explicit allowance. */
    public boolean isDestructive() {
        return switch (type) {
            case DROP_TABLE, DROP_COLUMN, DROP_INDEX -> true;
            case ADD_INDEX -> replacing;
            default -> false;
        };
    }

    public boolean isBlocked() {
        return blockedReason != null;
    }

    public String subjectName() {
        if (column != null) {
            return column.getName();
        }
        if (index != null) {
            return index.getName();
        }
        return "";
    }

    public String describe() {
        String subject = subjectName();
        return type + " " + table.getQualifiedName() + (subject.isEmpty() ? "" : "." + subject);
    }

    @Override
    public String toString() {
        return describe();
    }
}
