package com.example.storage.error;

import java.util.UUID;

public class TenantIsolationException extends StorageException {

    private final UUID expectedTenantId;
    private final UUID actualTenantId;

    public TenantIsolationException(String table, UUID expectedTenantId, UUID actualTenantId) {
        super("Tenant mismatch on %s: context tenant '%s' cannot access row of tenant '%s'"
                .formatted(table, expectedTenantId, actualTenantId));
        this.expectedTenantId = expectedTenantId;
        this.actualTenantId = actualTenantId;
    }

    public UUID getExpectedTenantId() {
        return expectedTenantId;
    }

    public UUID getActualTenantId() {
        return actualTenantId;
    }
}
