package com.example.storage.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AuditEntry {
    UUID auditId;
    UUID recordId;
    UUID tenantId;
    String fieldName;
    Object oldValue;
    Object newValue;
    AuditOperation operation;
    Instant changedAt;
    UUID changedBy;
    /** Shared by every entry written by the same mutation. */
    UUID transactionId;
    Object metadata;
}
