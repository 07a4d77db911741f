package com.example.storage.schema;

import com.example.storage.model.ColumnDefinition;
import com.example.storage.model.IndexDefinition;
import com.example.storage.model.LogicalType;
import com.example.storage.model.TableDefinition;
import com.example.storage.model.TemporalStrategyType;
import com.example.storage.util.SqlIdentifierValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public class TemporalSchema {

    public static final String ID = "id";
    public static final String TENANT_ID = "tenant_id";
    public static final String VERSION = "version";
    public static final String VALID_FROM = "valid_from";
    public static final String VALID_TO = "valid_to";
    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";
    public static final String CREATED_BY = "created_by";
    public static final String UPDATED_BY = "updated_by";
    public static final String DELETED_AT = "deleted_at";
    public static final String DELETED_BY = "deleted_by";

    public static final Set<String> SYSTEM_COLUMNS = Set.of(ID, TENANT_ID, VERSION, VALID_FROM, VALID_TO,
            CREATED_AT, UPDATED_AT, CREATED_BY, UPDATED_BY, DELETED_AT, DELETED_BY);

    public static final String AUDIT_ID = "audit_id";
    public static final String RECORD_ID = "record_id";
    public static final String FIELD_NAME = "field_name";
    public static final String OLD_VALUE = "old_value";
    public static final String NEW_VALUE = "new_value";
    public static final String OPERATION = "operation";
    public static final String CHANGED_AT = "changed_at";
    public static final String CHANGED_BY = "changed_by";
    public static final String TRANSACTION_ID = "transaction_id";
    public static final String METADATA = "metadata";

    private final String auditSuffix;

    public TemporalSchema() {
        this("_audit");
    }

    public TemporalSchema(String auditSuffix) {
        this.auditSuffix = auditSuffix;
    }

    /** The declared table and, for copy-on-change, its audit table. */
    public List<TableDefinition> physicalTables(TableDefinition declared) {
        List<TableDefinition> tables = new ArrayList<>();
        tables.add(expand(declared));
        auditTable(declared).ifPresent(tables::add);
        return tables;
    }

    public TableDefinition expand(TableDefinition declared) {
        validate(declared);
        String t = declared.getName();
        TableDefinition.TableDefinitionBuilder table = declared.toBuilder()
                .clearColumns()
                .clearIndexes()
                .clearPrimaryKeys();

        table.column(ColumnDefinition.required(ID, LogicalType.UUID));
        if (declared.isMultiTenant()) {
            table.column(ColumnDefinition.required(TENANT_ID, LogicalType.UUID));
        }
        table.columns(declared.getColumns());
        if (declared.getStrategy() == TemporalStrategyType.SCD2) {
            table.column(ColumnDefinition.required(VERSION, LogicalType.INTEGER));
            table.column(ColumnDefinition.required(VALID_FROM, LogicalType.TIMESTAMP));
            table.column(ColumnDefinition.of(VALID_TO, LogicalType.TIMESTAMP));
        }
        table.column(ColumnDefinition.required(CREATED_AT, LogicalType.TIMESTAMP));
        table.column(ColumnDefinition.required(UPDATED_AT, LogicalType.TIMESTAMP));
        table.column(ColumnDefinition.of(CREATED_BY, LogicalType.UUID));
        table.column(ColumnDefinition.of(UPDATED_BY, LogicalType.UUID));
        if (declared.isSoftDelete()) {
            table.column(ColumnDefinition.of(DELETED_AT, LogicalType.TIMESTAMP));
            table.column(ColumnDefinition.of(DELETED_BY, LogicalType.UUID));
        }

        if (declared.getStrategy() == TemporalStrategyType.SCD2) {
            table.primaryKey(ID).primaryKey(VERSION);
        } else {
            table.primaryKey(ID);
        }

        if (declared.isMultiTenant()) {
            table.index(index(t, "idx_" + t + "_tenant_id", false, null, TENANT_ID));
        }
        if (declared.isSoftDelete()) {
            table.index(index(t, "idx_" + t + "_not_deleted", false, "deleted_at IS NULL", DELETED_AT));
        }
        if (declared.getStrategy() == TemporalStrategyType.SCD2) {
            table.index(index(t, "idx_" + t + "_valid_period", false, null, VALID_FROM, VALID_TO));
            table.index(index(t, "idx_" + t + "_current", true, "valid_to IS NULL", ID));
        }
        table.indexes(declared.getIndexes());
        return table.build();
    }

    public Optional<TableDefinition> auditTable(TableDefinition declared) {
        if (declared.getStrategy() != TemporalStrategyType.COPY_ON_CHANGE) {
            return Optional.empty();
        }
        String name = auditTableName(declared);
        TableDefinition.TableDefinitionBuilder audit = TableDefinition.builder()
                .schema(declared.getSchema())
                .name(name)
                .strategy(TemporalStrategyType.NONE)
                .column(ColumnDefinition.required(AUDIT_ID, LogicalType.UUID))
                .column(ColumnDefinition.required(RECORD_ID, LogicalType.UUID));
        if (declared.isMultiTenant()) {
            audit.column(ColumnDefinition.required(TENANT_ID, LogicalType.UUID));
        }
        audit.column(ColumnDefinition.builder().name(FIELD_NAME).type(LogicalType.STRING)
                        .maxLength(255).nullable(false).build())
                .column(ColumnDefinition.of(OLD_VALUE, LogicalType.JSON))
                .column(ColumnDefinition.of(NEW_VALUE, LogicalType.JSON))
                .column(ColumnDefinition.builder().name(OPERATION).type(LogicalType.STRING)
                        .maxLength(10).nullable(false).build())
                .column(ColumnDefinition.required(CHANGED_AT, LogicalType.TIMESTAMP))
                .column(ColumnDefinition.of(CHANGED_BY, LogicalType.UUID))
                .column(ColumnDefinition.of(TRANSACTION_ID, LogicalType.UUID))
                .column(ColumnDefinition.of(METADATA, LogicalType.JSON))
                .primaryKey(AUDIT_ID)
                .index(index(name, "idx_" + name + "_changed_at", false, null, CHANGED_AT))
                .index(index(name, "idx_" + name + "_record_field", false, null, RECORD_ID, FIELD_NAME));
        if (declared.isMultiTenant()) {
            audit.index(index(name, "idx_" + name + "_tenant", false, null, TENANT_ID));
        }
        return Optional.of(audit.build());
    }

    public String auditTableName(TableDefinition declared) {
        return declared.getName() + auditSuffix;
    }

    private void validate(TableDefinition declared) {
        SqlIdentifierValidator.validate(declared.getSchema());
        SqlIdentifierValidator.validate(declared.getName());
        for (ColumnDefinition column : declared.getColumns()) {
            SqlIdentifierValidator.validate(column.getName());
            if (SYSTEM_COLUMNS.contains(column.getName().toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("Column " + declared.getQualifiedName() + "." + column.getName()
                        + " collides with a system column");
            }
        }
        for (IndexDefinition index : declared.getIndexes()) {
            SqlIdentifierValidator.validate(index.getName());
            for (String column : index.getColumns()) {
                if (!declared.hasColumn(column) && !SYSTEM_COLUMNS.contains(column.toLowerCase(Locale.ROOT))) {
                    throw new IllegalArgumentException("Index " + index.getName() + " references unknown column "
                            + column + " of " + declared.getQualifiedName());
                }
            }
        }
    }

    private static IndexDefinition index(String table, String name, boolean unique, String predicate,
                                         String... columns) {
        return IndexDefinition.builder()
                .name(name)
                .tableName(table)
                .columns(List.of(columns))
                .unique(unique)
                .predicate(predicate)
                .build();
    }
}
