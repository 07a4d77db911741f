package com.example.storage.temporal;

import com.example.storage.model.TableDefinition;
import com.example.storage.model.TemporalStrategyType;

import java.util.UUID;

public class NoneRepository extends AbstractTemporalRepository {

    public NoneRepository(TableDefinition table, UUID tenantId, RepositoryContext context) {
        super(table, tenantId, context);
    }

    @Override
    public TemporalStrategyType getStrategy() {
        return TemporalStrategyType.NONE;
    }

    @Override
    protected TemporalRepository withContext(RepositoryContext context) {
        return new NoneRepository(declared, tenantId, context);
    }
}
