package com.example.storage.sql;

import com.example.storage.error.ValidationBypassException;
import com.example.storage.model.ColumnDefinition;
import com.example.storage.model.LogicalType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ValueCoercerTest {

    private static final String TABLE = "public.readings";

    private final ValueCoercer coercer = new ValueCoercer();

    private Object coerce(LogicalType type, Object value) {
        return coercer.coerce(TABLE, ColumnDefinition.of("value", type), value);
    }

    @Test
    public void testDecimalIntoFloatColumnBecomesDouble() {
        assertThat(coerce(LogicalType.FLOAT, new BigDecimal("19.99"))).isEqualTo(19.99d);
        assertThat(coerce(LogicalType.FLOAT, 3)).isEqualTo(3.0d);
        assertThat(coerce(LogicalType.FLOAT, " 2.5 ")).isEqualTo(2.5d);
    }

    @Test
    public void testDecimalColumnKeepsPrecision() {
        assertThat(coerce(LogicalType.DECIMAL, 12L)).isEqualTo(new BigDecimal("12"));
        assertThat(coerce(LogicalType.DECIMAL, 0.1d)).isEqualTo(new BigDecimal("0.1"));
    }

    @Test
    public void testInstantBecomesUtcOffsetDateTime() {
        Instant instant = Instant.parse("2024-01-15T08:30:00Z");

        assertThat(coerce(LogicalType.TIMESTAMP, instant))
                .isEqualTo(OffsetDateTime.of(2024, 1, 15, 8, 30, 0, 0, ZoneOffset.UTC));
    }

    @Test
    public void testUuidFromText() {
        UUID id = UUID.randomUUID();

        assertThat(coerce(LogicalType.UUID, id.toString())).isEqualTo(id);
        assertThatThrownBy(() -> coerce(LogicalType.UUID, "not-a-uuid"))
                .isInstanceOf(ValidationBypassException.class);
    }

    @Test
    public void testJsonIsSerialized() {
        assertThat(coerce(LogicalType.JSON, List.of(1, 2))).isEqualTo("[1,2]");
    }

    @Test
    public void testNullPassesThrough() {
        assertThat(coerce(LogicalType.INTEGER, null)).isNull();
    }

    @Test
    public void testIncompatibleValuesAreRejected() {
        assertThatThrownBy(() -> coerce(LogicalType.INTEGER, "12"))
                .isInstanceOf(ValidationBypassException.class)
                .hasMessageContaining("value");
        assertThatThrownBy(() -> coerce(LogicalType.BOOLEAN, "true"))
                .isInstanceOf(ValidationBypassException.class);
        assertThatThrownBy(() -> coerce(LogicalType.STRING, 42))
                .isInstanceOf(ValidationBypassException.class);
    }
}
