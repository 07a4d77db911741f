package com.example.storage.schema;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SyncOptions {
    boolean allowDestructive;
    boolean dryRun;
    String authorizedBy;
    String reason;

    public static SyncOptions of(boolean allowDestructive, boolean dryRun) {
        return builder().allowDestructive(allowDestructive).dryRun(dryRun).build();
    }
}
