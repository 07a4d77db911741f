package com.example.storage.error;

import java.util.UUID;

public class OptimisticConflictException extends StorageException {

    private final UUID recordId;
    private final Integer expectedVersion;

    public OptimisticConflictException(String table, UUID recordId, Integer expectedVersion) {
        super("Concurrent update detected on " + table + " record " + recordId
                + ": version " + expectedVersion + " is no longer current");
        this.recordId = recordId;
        this.expectedVersion = expectedVersion;
    }

    public UUID getRecordId() {
        return recordId;
    }

    public Integer getExpectedVersion() {
        return expectedVersion;
    }
}
