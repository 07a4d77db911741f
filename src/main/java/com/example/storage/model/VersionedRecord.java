package com.example.storage.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder(toBuilder = true)
public class VersionedRecord {
    UUID id;
    UUID tenantId;
    Integer version;
    Instant validFrom;
    Instant validTo;
    Instant createdAt;
    Instant updatedAt;
    UUID createdBy;
    UUID updatedBy;
    Instant deletedAt;
    UUID deletedBy;
    @Singular("field")
    Map<String, Object> data;

    public Object get(String field) {
        return data.get(field);
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public boolean isCurrent() {
        return validTo == null;
    }
}
