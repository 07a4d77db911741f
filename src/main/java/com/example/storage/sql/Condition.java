package com.example.storage.sql;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Condition {

    public enum Operator {
        EQ,
        IS_NULL,
        /** {@code valid_from <= v AND (valid_to IS NULL OR valid_to > v)} */
        VALID_AT
    }

    public static final String VALID_FROM = "valid_from";
    public static final String VALID_TO = "valid_to";

    String column;
    Operator operator;
    Object value;

    /** Equality; a null value renders as {@code IS NULL}. */
    public static Condition eq(String column, Object value) {
        return value == null ? isNull(column) : new Condition(column, Operator.EQ, value);
    }

    public static Condition isNull(String column) {
        return new Condition(column, Operator.IS_NULL, null);
    }

    public static Condition validAt(Instant instant) {
        return new Condition(VALID_FROM, Operator.VALID_AT, instant);
    }
}
