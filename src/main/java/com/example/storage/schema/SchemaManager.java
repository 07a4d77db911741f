package com.example.storage.schema;

import com.example.storage.dialect.DatabaseDialect;
import com.example.storage.error.DdlApplicationException;
import com.example.storage.error.SchemaConflictException;
import com.example.storage.model.ChangeType;
import com.example.storage.model.SchemaChange;
import com.example.storage.model.TableDefinition;
import com.example.storage.sql.QueryBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Brings the live schema in line with a set of declared tables.
 * <p>
 * Each model is expanded with its system columns (and audit table), compared
 * against one introspection pass, and the resulting changes are applied table by
 * table, each table inside its own transaction. Destructive changes only run when
 * allowed; alterations that need a data migration never run.
 */
@Slf4j
public class SchemaManager {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate tableTransaction;
    private final DatabaseDialect dialect;
    private final QueryBuilder queryBuilder;
    private final TemporalSchema temporalSchema;
    private final SchemaIntrospector introspector;
    private final SchemaDiffer differ;

    public SchemaManager(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager,
                         QueryBuilder queryBuilder, TemporalSchema temporalSchema,
                         List<String> ignoredTablePrefixes) {
        this.jdbcTemplate = jdbcTemplate;
        this.tableTransaction = new TransactionTemplate(transactionManager);
        this.tableTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.dialect = queryBuilder.getDialect();
        this.queryBuilder = queryBuilder;
        this.temporalSchema = temporalSchema;
        this.introspector = new SchemaIntrospector(jdbcTemplate, dialect, ignoredTablePrefixes);
        this.differ = new SchemaDiffer(dialect.normalizer());
    }

    public SyncReport syncSchema(List<TableDefinition> models, boolean allowDestructive, boolean dryRun) {
        return syncSchema(models, SyncOptions.of(allowDestructive, dryRun));
    }

    /**
     * Plans and, unless dry-run, applies the changes for {@code models}.
     *
     * @throws DdlApplicationException if a statement failed; the tables after it were still processed
     * @throws SchemaConflictException if blocked alterations remain after the safe changes were applied
     */
    public SyncReport syncSchema(List<TableDefinition> models, SyncOptions options) {
        List<SchemaChange> changes = planChanges(models);
        SyncReport.SyncReportBuilder report = SyncReport.builder()
                .dryRun(options.isDryRun())
                .planned(changes);

        Map<String, List<SchemaChange>> byTable = new LinkedHashMap<>();
        for (SchemaChange change : changes) {
            if (change.isBlocked()) {
                log.warn("Schema conflict on {}: {}", change.describe(), change.getBlockedReason());
                report.conflict(change);
            } else if (change.isDestructive() && !options.isAllowDestructive()) {
                log.warn("Skipping destructive change {} (destructive changes not allowed)", change.describe());
                report.skipped(change);
            } else {
                byTable.computeIfAbsent(change.getTable().key(), k -> new ArrayList<>()).add(change);
            }
        }

        DdlApplicationException failure = null;
        for (List<SchemaChange> tableChanges : byTable.values()) {
            if (options.isDryRun()) {
                tableChanges.forEach(c -> log.info("Dry run, would apply {}", c.describe()));
                report.applied(tableChanges);
                continue;
            }
            try {
                applyTable(tableChanges, options);
                report.applied(tableChanges);
            } catch (DdlApplicationException e) {
                log.error("{}; remaining changes of {} rolled back", e.getMessage(), e.getTableName());
                report.failedChange(e.getChange());
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }

        SyncReport result = report.build();
        log.info("Schema sync finished: {} changes {}, {} destructive skipped, {} conflicts",
                result.getChangeCount(), options.isDryRun() ? "planned" : "applied",
                result.getSkippedDestructive().size(), result.getConflicts().size());
        if (failure != null) {
            throw failure.withReport(result);
        }
        if (result.hasConflicts() && !options.isDryRun()) {
            throw new SchemaConflictException(result);
        }
        return result;
    }

    /**
     * The ordered changes that would bring the live schema in line with {@code models}.
     * Destructive and blocked changes are included.
     */
    public List<SchemaChange> planChanges(List<TableDefinition> models) {
        List<TableDefinition> declared = physicalTables(models);
        Set<String> schemas = declared.stream()
                .map(TableDefinition::getSchema)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return differ.diff(declared, introspector.introspect(schemas));
    }

    /**
     * Declared models with system columns, audit tables, native types and the
     * indexes this dialect can create.
     */
    public List<TableDefinition> physicalTables(List<TableDefinition> models) {
        List<TableDefinition> tables = new ArrayList<>();
        for (TableDefinition model : models) {
            for (TableDefinition table : temporalSchema.physicalTables(model)) {
                tables.add(table.toBuilder()
                        .clearColumns()
                        .columns(table.getColumns().stream()
                                .map(c -> dialect.resolve(table.getQualifiedName(), c))
                                .collect(Collectors.toList()))
                        .clearIndexes()
                        .indexes(dialect.supportedIndexes(table.getIndexes()))
                        .build());
            }
        }
        return tables;
    }

    private void applyTable(List<SchemaChange> changes, SyncOptions options) {
        String[] current = new String[1];
        SchemaChange[] currentChange = new SchemaChange[1];
        try {
            tableTransaction.executeWithoutResult(status -> {
                for (SchemaChange change : changes) {
                    currentChange[0] = change;
                    if (change.getType() == ChangeType.ADD_TABLE) {
                        log.info("Creating table {}", change.getTable().getQualifiedName());
                    }
                    if (change.isDestructive()) {
                        log.warn("Applying destructive change {} authorized by {}: {}",
                                change.describe(), options.getAuthorizedBy(), options.getReason());
                    }
                    for (String sql : queryBuilder.render(change)) {
                        current[0] = sql;
                        log.info("Executing DDL: {}", sql);
                        jdbcTemplate.execute(sql);
                    }
                }
            });
        } catch (DataAccessException e) {
            throw new DdlApplicationException(currentChange[0], current[0], e);
        }
    }
}
