package com.example.storage.schema;

import com.example.storage.model.ColumnDefinition;
import com.example.storage.model.IndexDefinition;
import com.example.storage.model.LogicalType;
import com.example.storage.model.TableDefinition;
import com.example.storage.model.TemporalStrategyType;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TemporalSchemaTest {

    private final TemporalSchema temporalSchema = new TemporalSchema();

    @Test
    public void testScd2TableGetsVersioningColumnsAndIndexes() {
        TableDefinition declared = TableDefinition.builder()
                .name("regulations")
                .column(ColumnDefinition.of("title", LogicalType.STRING))
                .strategy(TemporalStrategyType.SCD2)
                .multiTenant(true)
                .softDelete(true)
                .build();

        TableDefinition table = temporalSchema.expand(declared);

        assertThat(table.getColumns()).extracting(ColumnDefinition::getName).containsExactly(
                "id", "tenant_id", "title", "version", "valid_from", "valid_to",
                "created_at", "updated_at", "created_by", "updated_by", "deleted_at", "deleted_by");
        assertThat(table.getPrimaryKeys()).containsExactly("id", "version");
        assertThat(table.getIndexes()).extracting(IndexDefinition::getName).containsExactly(
                "idx_regulations_tenant_id", "idx_regulations_not_deleted",
                "idx_regulations_valid_period", "idx_regulations_current");
        IndexDefinition current = table.getIndexes().get(3);
        assertThat(current.isUnique()).isTrue();
        assertThat(current.getPredicate()).isEqualTo("valid_to IS NULL");
    }

    @Test
    public void testPlainTableHasOnlyBaseColumns() {
        TableDefinition declared = TableDefinition.builder()
                .name("settings")
                .column(ColumnDefinition.of("value", LogicalType.STRING))
                .build();

        TableDefinition table = temporalSchema.expand(declared);

        assertThat(table.getColumns()).extracting(ColumnDefinition::getName)
                .containsExactly("id", "value", "created_at", "updated_at", "created_by", "updated_by");
        assertThat(table.getPrimaryKeys()).containsExactly("id");
        assertThat(table.getIndexes()).isEmpty();
        assertThat(temporalSchema.auditTable(declared)).isEmpty();
    }

    @Test
    public void testCopyOnChangeTableGetsAuditTable() {
        TableDefinition declared = TableDefinition.builder()
                .name("products")
                .column(ColumnDefinition.of("name", LogicalType.STRING))
                .strategy(TemporalStrategyType.COPY_ON_CHANGE)
                .multiTenant(true)
                .build();

        Optional<TableDefinition> audit = temporalSchema.auditTable(declared);

        assertThat(audit).isPresent();
        assertThat(audit.get().getName()).isEqualTo("products_audit");
        assertThat(audit.get().getColumns()).extracting(ColumnDefinition::getName).containsExactly(
                "audit_id", "record_id", "tenant_id", "field_name", "old_value", "new_value",
                "operation", "changed_at", "changed_by", "transaction_id", "metadata");
        assertThat(audit.get().getIndexes()).extracting(IndexDefinition::getName).containsExactly(
                "idx_products_audit_changed_at", "idx_products_audit_record_field", "idx_products_audit_tenant");
        assertThat(temporalSchema.physicalTables(declared)).hasSize(2);
    }

    @Test
    public void testUserColumnMayNotShadowSystemColumn() {
        TableDefinition declared = TableDefinition.builder()
                .name("things")
                .column(ColumnDefinition.of("version", LogicalType.INTEGER))
                .build();

        assertThatThrownBy(() -> temporalSchema.expand(declared))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("collides with a system column");
    }

    @Test
    public void testInvalidIdentifierIsRejected() {
        TableDefinition declared = TableDefinition.builder()
                .name("things; DROP TABLE users")
                .build();

        assertThatThrownBy(() -> temporalSchema.expand(declared))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid SQL identifier");
    }
}
