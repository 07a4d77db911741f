package com.example.storage.temporal;

import com.example.storage.error.OptimisticConflictException;
import com.example.storage.error.RecordNotFoundException;
import com.example.storage.model.ColumnDefinition;
import com.example.storage.model.FieldChange;
import com.example.storage.model.TableDefinition;
import com.example.storage.model.TemporalStrategyType;
import com.example.storage.model.VersionedRecord;
import com.example.storage.schema.TemporalSchema;
import com.example.storage.sql.Condition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable versions: an update closes the current version and appends the next
 * one, so every past state stays readable by version number or point in time.
 * <p>
 * Closing is a conditional update on the version that was read, which makes the
 * loser of two concurrent updates fail with {@link OptimisticConflictException}
 * instead of forking the history.
 */
@Slf4j
public class Scd2Repository extends AbstractTemporalRepository {

    private static final List<Condition> CURRENT = List.of(Condition.isNull(TemporalSchema.VALID_TO));
    private static final List<String> VERSION_ORDER = List.of(TemporalSchema.VERSION);

    public Scd2Repository(TableDefinition table, UUID tenantId, RepositoryContext context) {
        super(table, tenantId, context);
    }

    @Override
    public TemporalStrategyType getStrategy() {
        return TemporalStrategyType.SCD2;
    }

    @Override
    protected TemporalRepository withContext(RepositoryContext context) {
        return new Scd2Repository(declared, tenantId, context);
    }

    @Override
    protected List<Condition> currentVersion() {
        return CURRENT;
    }

    @Override
    protected void addInsertColumns(Map<String, Object> row, Instant now) {
        row.put(TemporalSchema.VERSION, 1);
        row.put(TemporalSchema.VALID_FROM, now);
    }

    @Override
    public VersionedRecord update(UUID id, Map<String, Object> data, UUID actor) {
        return newVersion(id, data, actor, null);
    }

    @Override
    public VersionedRecord update(UUID id, Map<String, Object> data, UUID actor, int expectedVersion) {
        return newVersion(id, data, actor, expectedVersion);
    }

    private VersionedRecord newVersion(UUID id, Map<String, Object> data, UUID actor, Integer expectedVersion) {
        requireUserFields(data);
        return write(status -> {
            VersionedRecord current = findCurrent(id, false, false)
                    .orElseThrow(() -> new RecordNotFoundException(table.getQualifiedName(), id));
            int version = current.getVersion();
            if (expectedVersion != null && expectedVersion != version) {
                throw new OptimisticConflictException(table.getQualifiedName(), id, expectedVersion);
            }
            Instant now = now();
            if (now.isBefore(current.getValidFrom())) {
                now = current.getValidFrom();
            }

            List<Condition> closing = scoped(Condition.eq(TemporalSchema.ID, id),
                    Condition.eq(TemporalSchema.VERSION, version),
                    Condition.isNull(TemporalSchema.VALID_TO));
            Map<String, Object> close = Map.of(TemporalSchema.VALID_TO, now);
            if (execute(queryBuilder.update(table, close, closing)) == 0) {
                throw new OptimisticConflictException(table.getQualifiedName(), id, version);
            }

            Map<String, Object> merged = new LinkedHashMap<>(current.getData());
            data.forEach((field, value) -> merged.put(declared.findColumn(field).orElseThrow().getName(), value));
            Map<String, Object> row = insertRow(id, merged, actor, now);
            row.put(TemporalSchema.CREATED_AT, current.getCreatedAt());
            row.put(TemporalSchema.CREATED_BY, current.getCreatedBy());
            row.put(TemporalSchema.VERSION, version + 1);
            row.put(TemporalSchema.VALID_FROM, now);
            try {
                execute(queryBuilder.insert(table, row));
            } catch (DuplicateKeyException e) {
                throw new OptimisticConflictException(table.getQualifiedName(), id, version);
            }
            log.debug("Record {} of {} moved to version {}", id, table.getQualifiedName(), version + 1);
            return requireCurrent(id);
        });
    }

    @Override
    public Optional<VersionedRecord> getVersion(UUID id, int version) {
        return read(status -> first(query(queryBuilder.select(table,
                scoped(Condition.eq(TemporalSchema.ID, id), Condition.eq(TemporalSchema.VERSION, version)),
                null, null, null))));
    }

    /** Every version, oldest first, soft-deleted ones included. */
    @Override
    public List<VersionedRecord> getVersionHistory(UUID id) {
        return read(status -> query(queryBuilder.select(table, scoped(Condition.eq(TemporalSchema.ID, id)),
                VERSION_ORDER, null, null)));
    }

    /**
     * Every declared field of the two versions, with {@code changed} set where they differ.
     *
     * @throws RecordNotFoundException if either version does not exist
     */
    @Override
    public Map<String, FieldChange> compareVersions(UUID id, int version1, int version2) {
        VersionedRecord left = getVersion(id, version1)
                .orElseThrow(() -> new RecordNotFoundException(table.getQualifiedName(), id));
        VersionedRecord right = getVersion(id, version2)
                .orElseThrow(() -> new RecordNotFoundException(table.getQualifiedName(), id));
        Map<String, FieldChange> changes = new LinkedHashMap<>();
        for (ColumnDefinition column : declared.getColumns()) {
            Object before = left.get(column.getName());
            Object after = right.get(column.getName());
            changes.put(column.getName(), new FieldChange(before, after, !sameValue(before, after)));
        }
        return changes;
    }
}
