package com.example.storage.temporal;

import com.example.storage.model.AuditEntry;
import com.example.storage.model.AuditOperation;
import com.example.storage.model.TableDefinition;
import com.example.storage.model.TemporalStrategyType;
import com.example.storage.model.VersionedRecord;
import com.example.storage.schema.TemporalSchema;
import com.example.storage.sql.Condition;
import com.example.storage.sql.SqlStatement;
import com.example.storage.util.JsonValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One row per record, changed in place, plus one row in {@code <table>_audit} for
 * every field a mutation touched. Audit rows share the transaction id of the
 * mutation that wrote them and are never changed afterwards.
 */
@Slf4j
public class CopyOnChangeRepository extends AbstractTemporalRepository {

    private static final List<String> AUDIT_ORDER =
            List.of(TemporalSchema.CHANGED_AT, TemporalSchema.FIELD_NAME, TemporalSchema.AUDIT_ID);

    private final TableDefinition auditTable;
    private final RowMapper<AuditEntry> auditMapper = (rs, rowNum) -> AuditEntry.builder()
            .auditId(ColumnReader.uuid(rs, TemporalSchema.AUDIT_ID))
            .recordId(ColumnReader.uuid(rs, TemporalSchema.RECORD_ID))
            .tenantId(declared.isMultiTenant() ? ColumnReader.uuid(rs, TemporalSchema.TENANT_ID) : null)
            .fieldName(rs.getString(TemporalSchema.FIELD_NAME))
            .oldValue(json(rs.getString(TemporalSchema.OLD_VALUE)))
            .newValue(json(rs.getString(TemporalSchema.NEW_VALUE)))
            .operation(AuditOperation.fromSqlValue(rs.getString(TemporalSchema.OPERATION)))
            .changedAt(ColumnReader.instant(rs, TemporalSchema.CHANGED_AT))
            .changedBy(ColumnReader.uuid(rs, TemporalSchema.CHANGED_BY))
            .transactionId(ColumnReader.uuid(rs, TemporalSchema.TRANSACTION_ID))
            .metadata(json(rs.getString(TemporalSchema.METADATA)))
            .build();

    public CopyOnChangeRepository(TableDefinition table, UUID tenantId, RepositoryContext context) {
        super(table, tenantId, context);
        this.auditTable = context.getTemporalSchema().auditTable(table)
                .orElseThrow(() -> new IllegalArgumentException("Table " + table.getQualifiedName()
                        + " is not a copy-on-change table"));
    }

    @Override
    public TemporalStrategyType getStrategy() {
        return TemporalStrategyType.COPY_ON_CHANGE;
    }

    @Override
    protected TemporalRepository withContext(RepositoryContext context) {
        return new CopyOnChangeRepository(declared, tenantId, context);
    }

    @Override
    protected void afterInsert(VersionedRecord created, Map<String, Object> data, UUID actor, Instant now) {
        UUID transactionId = UUID.randomUUID();
        data.forEach((field, value) -> audit(created.getId(), declared.findColumn(field).orElseThrow().getName(),
                null, value, AuditOperation.INSERT, actor, now, transactionId));
    }

    @Override
    protected void afterUpdate(VersionedRecord before, VersionedRecord after, Map<String, Object> data,
                               UUID actor, Instant now) {
        UUID transactionId = UUID.randomUUID();
        int changed = 0;
        for (String field : data.keySet()) {
            String column = declared.findColumn(field).orElseThrow().getName();
            if (!sameValue(before.get(column), after.get(column))) {
                audit(after.getId(), column, before.get(column), data.get(field), AuditOperation.UPDATE,
                        actor, now, transactionId);
                changed++;
            }
        }
        log.debug("Audited {} changed fields of {} in {}", changed, after.getId(), auditTable.getQualifiedName());
    }

    @Override
    protected void afterSoftDelete(VersionedRecord deleted, UUID actor, Instant now) {
        audit(deleted.getId(), TemporalSchema.DELETED_AT, null, now, AuditOperation.DELETE, actor, now,
                UUID.randomUUID());
    }

    /** The audit trail outlives the record and ends with a delete entry. */
    @Override
    protected void afterHardDelete(VersionedRecord deleted, UUID actor, Instant now) {
        audit(deleted.getId(), TemporalSchema.ID, deleted.getId(), null, AuditOperation.DELETE, actor, now,
                UUID.randomUUID());
    }

    @Override
    protected void afterRestore(VersionedRecord restored, UUID actor, Instant now) {
        audit(restored.getId(), TemporalSchema.DELETED_AT, restored.getDeletedAt(), null, AuditOperation.UPDATE,
                actor, now, UUID.randomUUID());
    }

    @Override
    public List<AuditEntry> getAuditHistory(UUID id) {
        return auditQuery(scoped(Condition.eq(TemporalSchema.RECORD_ID, id)));
    }

    @Override
    public List<AuditEntry> getFieldHistory(UUID id, String fieldName) {
        return auditQuery(scoped(Condition.eq(TemporalSchema.RECORD_ID, id),
                Condition.eq(TemporalSchema.FIELD_NAME, fieldName)));
    }

    private List<AuditEntry> auditQuery(List<Condition> where) {
        SqlStatement statement = queryBuilder.select(auditTable, where, AUDIT_ORDER, null, null);
        return read(status -> {
            log.debug("Query on {}: {}", auditTable.getQualifiedName(), statement.getSql());
            List<AuditEntry> entries = jdbcTemplate.query(statement.getSql(), auditMapper, statement.args());
            entries.forEach(entry -> checkTenant(entry.getTenantId()));
            return entries;
        });
    }

    private void audit(UUID recordId, String field, Object oldValue, Object newValue, AuditOperation operation,
                       UUID actor, Instant now, UUID transactionId) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(TemporalSchema.AUDIT_ID, UUID.randomUUID());
        row.put(TemporalSchema.RECORD_ID, recordId);
        if (tenantId != null) {
            row.put(TemporalSchema.TENANT_ID, tenantId);
        }
        row.put(TemporalSchema.FIELD_NAME, field);
        row.put(TemporalSchema.OLD_VALUE, oldValue);
        row.put(TemporalSchema.NEW_VALUE, newValue);
        row.put(TemporalSchema.OPERATION, operation.sqlValue());
        row.put(TemporalSchema.CHANGED_AT, now);
        row.put(TemporalSchema.CHANGED_BY, actor);
        row.put(TemporalSchema.TRANSACTION_ID, transactionId);
        SqlStatement statement = queryBuilder.insert(auditTable, row);
        log.debug("Executing on {}: {}", auditTable.getQualifiedName(), statement.getSql());
        jdbcTemplate.update(statement.getSql(), statement.args());
    }

    private static Object json(String value) {
        return value == null ? null : JsonValues.fromJson(value);
    }
}
