package com.example.storage.schema;

import com.example.storage.error.SchemaConflictException;
import com.example.storage.model.ChangeType;
import com.example.storage.model.ColumnDefinition;
import com.example.storage.model.IndexDefinition;
import com.example.storage.model.LogicalType;
import com.example.storage.model.SchemaChange;
import com.example.storage.model.TableDefinition;
import com.example.storage.model.TemporalStrategyType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
public class SchemaManagerIntegrationTest {

    @Autowired
    private SchemaManager schemaManager;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private static TableDefinition customers(String schema) {
        return TableDefinition.builder()
                .schema(schema)
                .name("customers")
                .strategy(TemporalStrategyType.SCD2)
                .softDelete(true)
                .column(ColumnDefinition.builder().name("email").type(LogicalType.STRING).maxLength(200)
                        .nullable(false).build())
                .column(ColumnDefinition.of("nickname", LogicalType.STRING))
                .column(ColumnDefinition.builder().name("score").type(LogicalType.DECIMAL)
                        .precision(8).scale(2).defaultValue("0").build())
                .column(ColumnDefinition.of("profile", LogicalType.JSON))
                .index(IndexDefinition.builder().name("idx_customers_email").tableName("customers")
                        .column("email").build())
                .build();
    }

    private boolean tableExists(String schema, String table) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM information_schema.tables WHERE table_schema = ? AND table_name = ?",
                Long.class, schema, table);
        return count != null && count > 0;
    }

    private boolean columnExists(String schema, String table, String column) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM information_schema.columns"
                        + " WHERE table_schema = ? AND table_name = ? AND column_name = ?",
                Long.class, schema, table, column);
        return count != null && count > 0;
    }

    @Test
    public void testSecondSyncIsANoOp() {
        List<TableDefinition> models = List.of(customers("sync_idempotent"));

        SyncReport first = schemaManager.syncSchema(models, false, false);
        assertThat(first.getChangeCount()).isPositive();
        assertThat(first.getApplied().get(0).getType()).isEqualTo(ChangeType.ADD_TABLE);
        assertThat(tableExists("sync_idempotent", "customers")).isTrue();

        SyncReport second = schemaManager.syncSchema(models, false, false);
        assertThat(second.getPlanned()).isEmpty();
        assertThat(second.getChangeCount()).isZero();
        assertThat(schemaManager.planChanges(models)).isEmpty();
    }

    @Test
    public void testCopyOnChangeCreatesAuditTable() {
        TableDefinition orders = TableDefinition.builder()
                .schema("sync_audit")
                .name("orders")
                .strategy(TemporalStrategyType.COPY_ON_CHANGE)
                .multiTenant(true)
                .column(ColumnDefinition.of("total", LogicalType.DECIMAL))
                .build();

        schemaManager.syncSchema(List.of(orders), false, false);

        assertThat(tableExists("sync_audit", "orders")).isTrue();
        assertThat(tableExists("sync_audit", "orders_audit")).isTrue();
        assertThat(columnExists("sync_audit", "orders_audit", "transaction_id")).isTrue();
        assertThat(schemaManager.planChanges(List.of(orders))).isEmpty();
    }

    @Test
    public void testDryRunExecutesNothing() {
        List<TableDefinition> models = List.of(customers("sync_dry_run"));

        SyncReport report = schemaManager.syncSchema(models, false, true);

        assertThat(report.isDryRun()).isTrue();
        assertThat(report.getChangeCount()).isEqualTo(report.getPlanned().size()).isPositive();
        assertThat(tableExists("sync_dry_run", "customers")).isFalse();
    }

    @Test
    public void testNewColumnIsAdded() {
        TableDefinition before = customers("sync_add_column");
        schemaManager.syncSchema(List.of(before), false, false);
        jdbcTemplate.update("INSERT INTO sync_add_column.customers (id, email, version, valid_from, created_at,"
                + " updated_at) VALUES (RANDOM_UUID(), 'a@example.com', 1, NOW(), NOW(), NOW())");

        TableDefinition after = before.toBuilder()
                .column(ColumnDefinition.builder().name("tier").type(LogicalType.STRING).maxLength(20)
                        .nullable(false).defaultValue("'basic'").build())
                .build();
        SyncReport report = schemaManager.syncSchema(List.of(after), false, false);

        assertThat(report.getApplied()).extracting(SchemaChange::getType).containsExactly(ChangeType.ADD_COLUMN);
        assertThat(jdbcTemplate.queryForObject("SELECT tier FROM sync_add_column.customers", String.class))
                .isEqualTo("basic");
    }

    @Test
    public void testDestructiveChangesNeedPermission() {
        TableDefinition before = customers("sync_destructive");
        schemaManager.syncSchema(List.of(before), false, false);
        TableDefinition after = before.toBuilder()
                .clearColumns()
                .columns(before.getColumns().stream().filter(c -> !c.getName().equals("nickname")).toList())
                .build();

        SyncReport skipped = schemaManager.syncSchema(List.of(after), false, false);
        assertThat(skipped.getSkippedDestructive()).extracting(SchemaChange::getType)
                .containsExactly(ChangeType.DROP_COLUMN);
        assertThat(skipped.getChangeCount()).isZero();
        assertThat(columnExists("sync_destructive", "customers", "nickname")).isTrue();

        SyncReport applied = schemaManager.syncSchema(List.of(after), SyncOptions.builder()
                .allowDestructive(true)
                .authorizedBy("dba@example.com")
                .reason("nickname retired")
                .build());
        assertThat(applied.getApplied()).extracting(SchemaChange::getType).containsExactly(ChangeType.DROP_COLUMN);
        assertThat(columnExists("sync_destructive", "customers", "nickname")).isFalse();
    }

    @Test
    public void testTypeChangeNeedingMigrationIsAConflict() {
        TableDefinition before = customers("sync_conflict");
        schemaManager.syncSchema(List.of(before), false, false);
        TableDefinition after = before.toBuilder()
                .clearColumns()
                .columns(before.getColumns().stream()
                        .map(c -> c.getName().equals("nickname") ? ColumnDefinition.of("nickname", LogicalType.INTEGER) : c)
                        .toList())
                .column(ColumnDefinition.of("referrer", LogicalType.UUID))
                .build();

        SyncReport dryRun = schemaManager.syncSchema(List.of(after), false, true);
        assertThat(dryRun.getConflicts()).hasSize(1);

        assertThatThrownBy(() -> schemaManager.syncSchema(List.of(after), false, false))
                .isInstanceOf(SchemaConflictException.class)
                .hasMessageContaining("nickname")
                .satisfies(e -> assertThat(((SchemaConflictException) e).getReport().getApplied())
                        .extracting(SchemaChange::getType).containsExactly(ChangeType.ADD_COLUMN));
        assertThat(columnExists("sync_conflict", "customers", "referrer")).isTrue();
    }

    @Test
    public void testWideningAlterIsApplied() {
        TableDefinition before = customers("sync_widen");
        schemaManager.syncSchema(List.of(before), false, false);
        TableDefinition after = before.toBuilder()
                .clearColumns()
                .columns(before.getColumns().stream()
                        .map(c -> c.getName().equals("email") ? c.toBuilder().maxLength(320).build() : c)
                        .toList())
                .build();

        SyncReport report = schemaManager.syncSchema(List.of(after), false, false);

        assertThat(report.getApplied()).extracting(SchemaChange::getType).containsExactly(ChangeType.ALTER_COLUMN);
        assertThat(schemaManager.planChanges(List.of(after))).isEmpty();
    }
}
