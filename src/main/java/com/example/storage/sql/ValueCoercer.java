package com.example.storage.sql;

import com.example.storage.error.ValidationBypassException;
import com.example.storage.model.ColumnDefinition;
import com.example.storage.model.LogicalType;
import com.example.storage.util.JsonValues;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.UUID;

public class ValueCoercer {

    public Object coerce(String table, ColumnDefinition column, Object value) {
        if (value == null) {
            return null;
        }
        LogicalType type = column.getType();
        return switch (type) {
            case FLOAT -> toDouble(table, column, value);
            case SMALLINT, INTEGER, BIGINT -> requireIntegral(table, column, value);
            case DECIMAL -> toBigDecimal(table, column, value);
            case BOOLEAN -> require(table, column, value, value instanceof Boolean);
            case STRING, TEXT -> toText(table, column, value);
            case DATE -> toDate(table, column, value);
            case TIMESTAMP -> toTimestamp(table, column, value);
            case UUID -> toUuid(table, column, value);
            case JSON -> JsonValues.toJson(value);
            case BINARY -> require(table, column, value, value instanceof byte[]);
            case ARRAY -> require(table, column, value, value.getClass().isArray() || value instanceof Collection);
        };
    }

    private Object toDouble(String table, ColumnDefinition column, Object value) {
        if (value instanceof Double) {
            return value;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof CharSequence text) {
            try {
                return new BigDecimal(text.toString().trim()).doubleValue();
            } catch (NumberFormatException e) {
                throw new ValidationBypassException(table, column.getName(), column.getType(), value);
            }
        }
        throw new ValidationBypassException(table, column.getName(), column.getType(), value);
    }

    private Object requireIntegral(String table, ColumnDefinition column, Object value) {
        boolean integral = value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
        return require(table, column, value, integral);
    }

    private Object toBigDecimal(String table, ColumnDefinition column, Object value) {
        if (value instanceof BigDecimal) {
            return value;
        }
        if (value instanceof Double || value instanceof Float) {
            return BigDecimal.valueOf(((Number) value).doubleValue());
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        throw new ValidationBypassException(table, column.getName(), column.getType(), value);
    }

    private Object toText(String table, ColumnDefinition column, Object value) {
        if (value instanceof CharSequence) {
            return value.toString();
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        throw new ValidationBypassException(table, column.getName(), column.getType(), value);
    }

    private Object toDate(String table, ColumnDefinition column, Object value) {
        return require(table, column, value, value instanceof LocalDate || value instanceof java.sql.Date);
    }

    private Object toTimestamp(String table, ColumnDefinition column, Object value) {
        if (value instanceof Instant instant) {
            return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
        }
        if (value instanceof OffsetDateTime) {
            return value;
        }
        if (value instanceof ZonedDateTime zoned) {
            return zoned.toOffsetDateTime();
        }
        throw new ValidationBypassException(table, column.getName(), column.getType(), value);
    }

    private Object toUuid(String table, ColumnDefinition column, Object value) {
        if (value instanceof UUID) {
            return value;
        }
        if (value instanceof CharSequence text) {
            try {
                return UUID.fromString(text.toString());
            } catch (IllegalArgumentException e) {
                throw new ValidationBypassException(table, column.getName(), column.getType(), value);
            }
        }
        throw new ValidationBypassException(table, column.getName(), column.getType(), value);
    }

    private static Object require(String table, ColumnDefinition column, Object value, boolean valid) {
        if (!valid) {
            throw new ValidationBypassException(table, column.getName(), column.getType(), value);
        }
        return value;
    }
}
