package com.example.storage.schema;

import com.example.storage.model.SchemaChange;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SyncReport {
    boolean dryRun;
    @Singular("plannedChange")
    List<SchemaChange> planned;
    @Singular("appliedChange")
    List<SchemaChange> applied;
    @Singular("skipped")
    List<SchemaChange> skippedDestructive;
    @Singular("conflict")
    List<SchemaChange> conflicts;
    @Singular("failedChange")
    List<SchemaChange> failed;

    /** Changes applied, or in a dry run the changes that would be applied. */
    public int getChangeCount() {
        return applied.size();
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
