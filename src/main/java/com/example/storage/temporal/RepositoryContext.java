package com.example.storage.temporal;

import com.example.storage.schema.TemporalSchema;
import com.example.storage.sql.QueryBuilder;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Duration;

@Value
@Builder(toBuilder = true)
public class RepositoryContext {
    @NonNull
    JdbcTemplate jdbcTemplate;
    @NonNull
    PlatformTransactionManager transactionManager;
    @NonNull
    QueryBuilder queryBuilder;
    @NonNull
    @Builder.Default
    TemporalSchema temporalSchema = new TemporalSchema();
    @NonNull
    @Builder.Default
    Clock clock = Clock.systemUTC();
    /** Per-transaction deadline; null means none. */
    Duration timeout;
}
