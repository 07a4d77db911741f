package com.example.storage.temporal;

import com.example.storage.model.ColumnDefinition;
import com.example.storage.util.JsonValues;

import java.math.BigDecimal;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

final class ColumnReader {

    private ColumnReader() {
    }

    static Object read(ResultSet rs, ColumnDefinition column) throws SQLException {
        String name = column.getName();
        return switch (column.getType()) {
            case SMALLINT, INTEGER -> {
                int value = rs.getInt(name);
                yield rs.wasNull() ? null : value;
            }
            case BIGINT -> {
                long value = rs.getLong(name);
                yield rs.wasNull() ? null : value;
            }
            case FLOAT -> {
                double value = rs.getDouble(name);
                yield rs.wasNull() ? null : value;
            }
            case DECIMAL -> rs.getBigDecimal(name);
            case BOOLEAN -> {
                boolean value = rs.getBoolean(name);
                yield rs.wasNull() ? null : value;
            }
            case STRING, TEXT -> rs.getString(name);
            case DATE -> rs.getObject(name, LocalDate.class);
            case TIMESTAMP -> instant(rs, name);
            case UUID -> uuid(rs, name);
            case JSON -> {
                String json = rs.getString(name);
                yield json == null ? null : JsonValues.fromJson(json);
            }
            case BINARY -> rs.getBytes(name);
            case ARRAY -> {
                Array array = rs.getArray(name);
                yield array == null ? null : array.getArray();
            }
        };
    }

    static Instant instant(ResultSet rs, String name) throws SQLException {
        OffsetDateTime value = rs.getObject(name, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    static UUID uuid(ResultSet rs, String name) throws SQLException {
        Object value = rs.getObject(name);
        if (value == null || value instanceof UUID) {
            return (UUID) value;
        }
        return UUID.fromString(value.toString());
    }

    static BigDecimal decimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        return new BigDecimal(value.toString());
    }
}
