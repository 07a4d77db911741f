package com.example.storage.temporal;

import com.example.storage.model.TableDefinition;

import java.util.UUID;

public class TemporalRepositoryFactory {

    private final RepositoryContext context;

    public TemporalRepositoryFactory(RepositoryContext context) {
        this.context = context;
    }

    /** Repository for a single-tenant table. */
    public TemporalRepository create(TableDefinition table) {
        return create(table, null);
    }

    /**
     * @param tenantId the tenant every statement is scoped to; required for multi-tenant tables
     */
    public TemporalRepository create(TableDefinition table, UUID tenantId) {
        return switch (table.getStrategy()) {
            case NONE -> new NoneRepository(table, tenantId, context);
            case COPY_ON_CHANGE -> new CopyOnChangeRepository(table, tenantId, context);
            case SCD2 -> new Scd2Repository(table, tenantId, context);
        };
    }
}
