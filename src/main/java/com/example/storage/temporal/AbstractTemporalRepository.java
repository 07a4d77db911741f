package com.example.storage.temporal;

import com.example.storage.error.RecordNotFoundException;
import com.example.storage.error.TenantIsolationException;
import com.example.storage.model.TableDefinition;
import com.example.storage.model.TemporalStrategyType;
import com.example.storage.model.VersionedRecord;
import com.example.storage.schema.TemporalSchema;
import com.example.storage.sql.Condition;
import com.example.storage.sql.QueryBuilder;
import com.example.storage.sql.SqlStatement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
public abstract class AbstractTemporalRepository implements TemporalRepository {

    private static final List<String> LIST_ORDER = List.of(TemporalSchema.CREATED_AT, TemporalSchema.ID);

    protected final TableDefinition declared;
    protected final TableDefinition table;
    protected final UUID tenantId;
    protected final RepositoryContext context;
    protected final QueryBuilder queryBuilder;
    protected final JdbcTemplate jdbcTemplate;

    private final TransactionTemplate writeTransaction;
    private final TransactionTemplate readTransaction;
    private final RowMapper<VersionedRecord> rowMapper;

    protected AbstractTemporalRepository(TableDefinition declared, UUID tenantId, RepositoryContext context) {
        if (declared.isMultiTenant() && tenantId == null) {
            throw new IllegalArgumentException("Table " + declared.getQualifiedName()
                    + " is multi-tenant but no tenant id was given");
        }
        this.declared = declared;
        this.table = context.getTemporalSchema().expand(declared);
        this.tenantId = declared.isMultiTenant() ? tenantId : null;
        this.context = context;
        this.queryBuilder = context.getQueryBuilder();
        this.jdbcTemplate = context.getJdbcTemplate();
        this.writeTransaction = transactionTemplate(context, false);
        this.readTransaction = transactionTemplate(context, true);
        this.rowMapper = new RecordRowMapper(declared, table);
    }

    private static TransactionTemplate transactionTemplate(RepositoryContext context, boolean readOnly) {
        TransactionTemplate template = new TransactionTemplate(context.getTransactionManager());
        template.setReadOnly(readOnly);
        Duration timeout = context.getTimeout();
        if (timeout != null) {
            template.setTimeout((int) Math.max(1, (timeout.toMillis() + 999) / 1000));
        }
        return template;
    }

    /** Same table and tenant over different collaborators. */
    protected abstract TemporalRepository withContext(RepositoryContext context);

    @Override
    public TemporalRepository withTimeout(Duration timeout) {
        return withContext(context.toBuilder().timeout(timeout).build());
    }

    @Override
    public TableDefinition getTable() {
        return declared;
    }

    // ==================== Writes ====================

    @Override
    public VersionedRecord create(Map<String, Object> data, UUID actor) {
        return write(status -> insert(data, actor));
    }

    @Override
    public List<VersionedRecord> createMany(List<Map<String, Object>> rows, UUID actor) {
        return write(status -> rows.stream()
                .map(data -> insert(data, actor))
                .collect(Collectors.toList()));
    }

    private VersionedRecord insert(Map<String, Object> data, UUID actor) {
        requireUserFields(data);
        UUID id = UUID.randomUUID();
        Instant now = now();
        Map<String, Object> row = insertRow(id, data, actor, now);
        addInsertColumns(row, now);
        execute(queryBuilder.insert(table, row));
        VersionedRecord created = findCurrent(id, true, false)
                .orElseThrow(() -> new IllegalStateException("Inserted record " + id + " is not readable"));
        afterInsert(created, data, actor, now);
        log.debug("Created record {} in {}", id, table.getQualifiedName());
        return created;
    }

    /**
     * Updates the current row in place.
     */
    @Override
    public VersionedRecord update(UUID id, Map<String, Object> data, UUID actor) {
        requireUserFields(data);
        return write(status -> {
            VersionedRecord before = findCurrent(id, false, true)
                    .orElseThrow(() -> new RecordNotFoundException(table.getQualifiedName(), id));
            Instant now = now();
            Map<String, Object> values = new LinkedHashMap<>(data);
            values.put(TemporalSchema.UPDATED_AT, now);
            values.put(TemporalSchema.UPDATED_BY, actor);
            execute(queryBuilder.update(table, values, currentRow(id)));
            VersionedRecord after = requireCurrent(id);
            afterUpdate(before, after, data, actor, now);
            return after;
        });
    }

    @Override
    public boolean delete(UUID id, UUID actor, boolean force) {
        return write(status -> {
            Optional<VersionedRecord> current = findCurrent(id, true, true);
            if (current.isEmpty()) {
                return false;
            }
            Instant now = now();
            if (force || !declared.isSoftDelete()) {
                execute(queryBuilder.delete(table, scoped(Condition.eq(TemporalSchema.ID, id))));
                afterHardDelete(current.get(), actor, now);
                return true;
            }
            if (current.get().isDeleted()) {
                return false;
            }
            Map<String, Object> values = new LinkedHashMap<>();
            values.put(TemporalSchema.DELETED_AT, now);
            values.put(TemporalSchema.DELETED_BY, actor);
            execute(queryBuilder.update(table, values, currentRow(id)));
            afterSoftDelete(current.get(), actor, now);
            return true;
        });
    }

    @Override
    public VersionedRecord restore(UUID id, UUID actor) {
        if (!declared.isSoftDelete()) {
            throw new UnsupportedOperationException("Table " + declared.getQualifiedName() + " has no soft delete");
        }
        return write(status -> {
            VersionedRecord current = findCurrent(id, true, true)
                    .orElseThrow(() -> new RecordNotFoundException(table.getQualifiedName(), id));
            if (!current.isDeleted()) {
                return current;
            }
            Instant now = now();
            Map<String, Object> values = new LinkedHashMap<>();
            values.put(TemporalSchema.DELETED_AT, null);
            values.put(TemporalSchema.DELETED_BY, null);
            values.put(TemporalSchema.UPDATED_AT, now);
            values.put(TemporalSchema.UPDATED_BY, actor);
            execute(queryBuilder.update(table, values, currentRow(id)));
            afterRestore(current, actor, now);
            return requireCurrent(id);
        });
    }

    // ==================== Reads ====================

    @Override
    public Optional<VersionedRecord> get(UUID id, Instant asOf, boolean includeDeleted) {
        if (asOf != null && getStrategy() != TemporalStrategyType.SCD2) {
            throw new IllegalArgumentException("Point-in-time reads need an SCD2 table, "
                    + declared.getQualifiedName() + " is " + getStrategy());
        }
        return read(status -> {
            List<Condition> where = scoped(Condition.eq(TemporalSchema.ID, id));
            if (asOf != null) {
                where.add(Condition.validAt(asOf));
            } else {
                where.addAll(currentVersion());
            }
            if (declared.isSoftDelete() && !includeDeleted) {
                where.add(Condition.isNull(TemporalSchema.DELETED_AT));
            }
            return first(query(queryBuilder.select(table, where, null, null, null)));
        });
    }

    @Override
    public Map<UUID, VersionedRecord> getMany(Collection<UUID> ids) {
        return read(status -> {
            Map<UUID, VersionedRecord> found = new LinkedHashMap<>();
            for (UUID id : ids) {
                findCurrent(id, false, false).ifPresent(record -> found.put(id, record));
            }
            return found;
        });
    }

    @Override
    public List<VersionedRecord> list(Map<String, Object> filters, Integer limit, Integer offset,
                                      boolean includeDeleted) {
        List<Condition> where = listConditions(filters, includeDeleted);
        return read(status -> query(queryBuilder.select(table, where, LIST_ORDER, limit, offset)));
    }

    @Override
    public long count(Map<String, Object> filters, boolean includeDeleted) {
        SqlStatement statement = queryBuilder.count(table, listConditions(filters, includeDeleted));
        return read(status -> {
            log.debug("Count on {}: {}", table.getQualifiedName(), statement.getSql());
            Long count = jdbcTemplate.queryForObject(statement.getSql(), Long.class, statement.args());
            return count == null ? 0L : count;
        });
    }

    private List<Condition> listConditions(Map<String, Object> filters, boolean includeDeleted) {
        List<Condition> where = scoped();
        where.addAll(currentVersion());
        if (declared.isSoftDelete() && !includeDeleted) {
            where.add(Condition.isNull(TemporalSchema.DELETED_AT));
        }
        if (filters != null) {
            filters.forEach((column, value) -> where.add(Condition.eq(column, value)));
        }
        return where;
    }

    // ==================== Strategy hooks ====================

    /** Extra columns of a freshly created record. */
    protected void addInsertColumns(Map<String, Object> row, Instant now) {
    }

    /** Conditions selecting the current row among a record's rows. */
    protected List<Condition> currentVersion() {
        return List.of();
    }

    protected void afterInsert(VersionedRecord created, Map<String, Object> data, UUID actor, Instant now) {
    }

    protected void afterUpdate(VersionedRecord before, VersionedRecord after, Map<String, Object> data,
                               UUID actor, Instant now) {
    }

    protected void afterSoftDelete(VersionedRecord deleted, UUID actor, Instant now) {
    }

    protected void afterHardDelete(VersionedRecord deleted, UUID actor, Instant now) {
    }

    protected void afterRestore(VersionedRecord restored, UUID actor, Instant now) {
    }

    // ==================== Helpers ====================

    protected <T> T write(TransactionCallback<T> action) {
        return writeTransaction.execute(action);
    }

    protected <T> T read(TransactionCallback<T> action) {
        return readTransaction.execute(action);
    }

    /** Timestamps are stored with microsecond precision, so they are taken at that precision. */
    protected Instant now() {
        return context.getClock().instant().truncatedTo(ChronoUnit.MICROS);
    }

    /** Tenant condition (for multi-tenant tables) followed by {@code conditions}. */
    protected List<Condition> scoped(Condition... conditions) {
        List<Condition> where = new ArrayList<>();
        if (tenantId != null) {
            where.add(Condition.eq(TemporalSchema.TENANT_ID, tenantId));
        }
        where.addAll(Arrays.asList(conditions));
        return where;
    }

    protected List<Condition> currentRow(UUID id) {
        List<Condition> where = scoped(Condition.eq(TemporalSchema.ID, id));
        where.addAll(currentVersion());
        return where;
    }

    protected Optional<VersionedRecord> findCurrent(UUID id, boolean includeDeleted, boolean forUpdate) {
        List<Condition> where = currentRow(id);
        if (declared.isSoftDelete() && !includeDeleted) {
            where.add(Condition.isNull(TemporalSchema.DELETED_AT));
        }
        return first(query(queryBuilder.select(table, where, null, null, null, forUpdate)));
    }

    protected VersionedRecord requireCurrent(UUID id) {
        return findCurrent(id, true, false)
                .orElseThrow(() -> new RecordNotFoundException(table.getQualifiedName(), id));
    }

    protected List<VersionedRecord> query(SqlStatement statement) {
        log.debug("Query on {}: {}", table.getQualifiedName(), statement.getSql());
        List<VersionedRecord> rows = jdbcTemplate.query(statement.getSql(), rowMapper, statement.args());
        rows.forEach(this::checkTenant);
        return rows;
    }

    protected int execute(SqlStatement statement) {
        log.debug("Executing on {}: {}", table.getQualifiedName(), statement.getSql());
        return jdbcTemplate.update(statement.getSql(), statement.args());
    }

    protected void checkTenant(UUID rowTenantId) {
        if (tenantId != null && !tenantId.equals(rowTenantId)) {
            throw new TenantIsolationException(table.getQualifiedName(), tenantId, rowTenantId);
        }
    }

    private void checkTenant(VersionedRecord record) {
        checkTenant(record.getTenantId());
    }

    /** System columns of a new row followed by the caller's fields. */
    protected Map<String, Object> insertRow(UUID id, Map<String, Object> data, UUID actor, Instant now) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(TemporalSchema.ID, id);
        if (tenantId != null) {
            row.put(TemporalSchema.TENANT_ID, tenantId);
        }
        row.putAll(data);
        row.put(TemporalSchema.CREATED_AT, now);
        row.put(TemporalSchema.UPDATED_AT, now);
        row.put(TemporalSchema.CREATED_BY, actor);
        row.put(TemporalSchema.UPDATED_BY, actor);
        return row;
    }

    protected void requireUserFields(Map<String, Object> data) {
        for (String field : data.keySet()) {
            if (!declared.hasColumn(field)) {
                throw new IllegalArgumentException("Unknown field " + field + " for table "
                        + declared.getQualifiedName());
            }
        }
    }

    /** Field equality as stored: numbers by value regardless of scale, arrays by content. */
    protected static boolean sameValue(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b && isFinite(a) && isFinite(b)) {
            return ColumnReader.decimal(a).compareTo(ColumnReader.decimal(b)) == 0;
        }
        if (left instanceof byte[] a && right instanceof byte[] b) {
            return Arrays.equals(a, b);
        }
        return Objects.equals(left, right);
    }

    private static boolean isFinite(Number number) {
        return !(number instanceof Double || number instanceof Float) || Double.isFinite(number.doubleValue());
    }

    protected static <T> Optional<T> first(List<T> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }
}
