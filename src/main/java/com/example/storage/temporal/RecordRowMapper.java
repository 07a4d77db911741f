package com.example.storage.temporal;

import com.example.storage.model.ColumnDefinition;
import com.example.storage.model.TableDefinition;
import com.example.storage.model.VersionedRecord;
import com.example.storage.schema.TemporalSchema;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

class RecordRowMapper implements RowMapper<VersionedRecord> {

    private final TableDefinition declared;
    private final TableDefinition physical;

    RecordRowMapper(TableDefinition declared, TableDefinition physical) {
        this.declared = declared;
        this.physical = physical;
    }

    @Override
    public VersionedRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        VersionedRecord.VersionedRecordBuilder record = VersionedRecord.builder()
                .id(ColumnReader.uuid(rs, TemporalSchema.ID))
                .createdAt(ColumnReader.instant(rs, TemporalSchema.CREATED_AT))
                .updatedAt(ColumnReader.instant(rs, TemporalSchema.UPDATED_AT))
                .createdBy(ColumnReader.uuid(rs, TemporalSchema.CREATED_BY))
                .updatedBy(ColumnReader.uuid(rs, TemporalSchema.UPDATED_BY));
        if (physical.hasColumn(TemporalSchema.TENANT_ID)) {
            record.tenantId(ColumnReader.uuid(rs, TemporalSchema.TENANT_ID));
        }
        if (physical.hasColumn(TemporalSchema.VERSION)) {
            int version = rs.getInt(TemporalSchema.VERSION);
            record.version(rs.wasNull() ? null : version)
                    .validFrom(ColumnReader.instant(rs, TemporalSchema.VALID_FROM))
                    .validTo(ColumnReader.instant(rs, TemporalSchema.VALID_TO));
        }
        if (physical.hasColumn(TemporalSchema.DELETED_AT)) {
            record.deletedAt(ColumnReader.instant(rs, TemporalSchema.DELETED_AT))
                    .deletedBy(ColumnReader.uuid(rs, TemporalSchema.DELETED_BY));
        }
        Map<String, Object> data = new LinkedHashMap<>();
        for (ColumnDefinition column : declared.getColumns()) {
            data.put(column.getName(), ColumnReader.read(rs, column));
        }
        return record.data(data).build();
    }
}
