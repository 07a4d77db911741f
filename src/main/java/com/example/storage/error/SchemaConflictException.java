package com.example.storage.error;

import com.example.storage.model.SchemaChange;
import com.example.storage.schema.SyncReport;

import java.util.List;
import java.util.stream.Collectors;

public class SchemaConflictException extends StorageException {

    private final transient SyncReport report;

    public SchemaConflictException(SyncReport report) {
        super("Schema conflicts require manual migration: " + describe(report.getConflicts()));
        this.report = report;
    }

    public SyncReport getReport() {
        return report;
    }

    private static String describe(List<SchemaChange> conflicts) {
        return conflicts.stream()
                .map(c -> c.describe() + " (" + c.getBlockedReason() + ")")
                .collect(Collectors.joining(", "));
    }
}
