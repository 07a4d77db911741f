package com.example.storage.error;

import com.example.storage.model.SchemaChange;
import com.example.storage.schema.SyncReport;

public class DdlApplicationException extends StorageException {

    private final transient SchemaChange change;
    private final String sql;
    private final transient SyncReport report;

    public DdlApplicationException(SchemaChange change, String sql, Throwable cause) {
        this(change, sql, cause, null);
    }

    private DdlApplicationException(SchemaChange change, String sql, Throwable cause, SyncReport report) {
        super("Failed to apply " + change.describe() + " to table " + change.getTable().getQualifiedName()
                + (sql != null ? ": " + sql : ""), cause);
        this.change = change;
        this.sql = sql;
        this.report = report;
    }

    public DdlApplicationException withReport(SyncReport report) {
        DdlApplicationException copy = new DdlApplicationException(change, sql, getCause(), report);
        for (Throwable suppressed : getSuppressed()) {
            copy.addSuppressed(suppressed);
        }
        return copy;
    }

    public String getTableName() {
        return change.getTable().getQualifiedName();
    }

    public String getSql() {
        return sql;
    }

    public SchemaChange getChange() {
        return change;
    }

    public SyncReport getReport() {
        return report;
    }
}
