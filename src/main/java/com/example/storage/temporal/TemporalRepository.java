package com.example.storage.temporal;

import com.example.storage.model.AuditEntry;
import com.example.storage.model.FieldChange;
import com.example.storage.model.TableDefinition;
import com.example.storage.model.TemporalStrategyType;
import com.example.storage.model.VersionedRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD over one declared table, following the table's temporal strategy.
 * <p>
 * A repository is bound to one tenant for multi-tenant tables: every statement
 * it issues is scoped to that tenant. Each mutating call runs in one transaction.
 * Operations a strategy does not keep the data for throw
 * {@link UnsupportedOperationException}.
 */
public interface TemporalRepository {

    TableDefinition getTable();

    TemporalStrategyType getStrategy();

    VersionedRecord create(Map<String, Object> data, UUID actor);

    /** Creates all records in one transaction. */
    List<VersionedRecord> createMany(List<Map<String, Object>> rows, UUID actor);

    /**
     * Applies {@code data} on top of the current field values.
     *
     * @throws com.example.storage.error.RecordNotFoundException if there is no live record with that id
     */
    VersionedRecord update(UUID id, Map<String, Object> data, UUID actor);

    /**
     * Update that only succeeds while {@code expectedVersion} is still the current version.
     *
     * @throws com.example.storage.error.OptimisticConflictException if another version became current
     */
    default VersionedRecord update(UUID id, Map<String, Object> data, UUID actor, int expectedVersion) {
        throw new UnsupportedOperationException(getStrategy() + " tables are not versioned");
    }

    default boolean delete(UUID id, UUID actor) {
        return delete(id, actor, false);
    }

    /**
     * Soft-deletes when the table has soft delete, otherwise (or with {@code force})
     * removes the record physically.
     *
     * @return false if there was nothing to delete
     */
    boolean delete(UUID id, UUID actor, boolean force);

    /**
     * Clears the soft-delete marker.
     *
     * @throws com.example.storage.error.RecordNotFoundException if the record does not exist
     */
    VersionedRecord restore(UUID id, UUID actor);

    /** Current, non-deleted record. */
    default Optional<VersionedRecord> get(UUID id) {
        return get(id, null, false);
    }

    /**
     * @param asOf point in time to read at, SCD2 tables only; null reads the current version
     */
    Optional<VersionedRecord> get(UUID id, Instant asOf, boolean includeDeleted);

    /** Current records by id; ids without a live record are absent from the result. */
    Map<UUID, VersionedRecord> getMany(Collection<UUID> ids);

    default List<VersionedRecord> list(Map<String, Object> filters, Integer limit) {
        return list(filters, limit, 0, false);
    }

    /** Current records whose columns equal {@code filters}, oldest first. */
    List<VersionedRecord> list(Map<String, Object> filters, Integer limit, Integer offset, boolean includeDeleted);

    long count(Map<String, Object> filters, boolean includeDeleted);

    default Optional<VersionedRecord> getVersion(UUID id, int version) {
        throw new UnsupportedOperationException(getStrategy() + " tables are not versioned");
    }

    default List<VersionedRecord> getVersionHistory(UUID id) {
        throw new UnsupportedOperationException(getStrategy() + " tables are not versioned");
    }

    default Map<String, FieldChange> compareVersions(UUID id, int version1, int version2) {
        throw new UnsupportedOperationException(getStrategy() + " tables are not versioned");
    }

    default List<AuditEntry> getAuditHistory(UUID id) {
        throw new UnsupportedOperationException(getStrategy() + " tables keep no audit trail");
    }

    default List<AuditEntry> getFieldHistory(UUID id, String fieldName) {
        throw new UnsupportedOperationException(getStrategy() + " tables keep no audit trail");
    }

    /** Copy of this repository whose transactions roll back once {@code timeout} has passed. */
    TemporalRepository withTimeout(Duration timeout);
}
