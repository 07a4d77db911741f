package com.example.storage.config;

import com.example.storage.dialect.DatabaseDialect;
import com.example.storage.dialect.H2Dialect;
import com.example.storage.dialect.PostgresDialect;
import com.example.storage.model.TableDefinition;
import com.example.storage.schema.SchemaManager;
import com.example.storage.schema.TemporalSchema;
import com.example.storage.sql.QueryBuilder;
import com.example.storage.step.SchemaSyncJobParameters;
import com.example.storage.step.SchemaSyncTasklet;
import com.example.storage.temporal.RepositoryContext;
import com.example.storage.temporal.TemporalRepositoryFactory;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.support.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.support.transaction.ResourcelessTransactionManager;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.util.Locale;

@Configuration
@EnableConfigurationProperties(StorageProperties.class)
public class BatchConfig {

    @Bean
    public DatabaseDialect databaseDialect(StorageProperties properties) {
        return switch (properties.getDatabase().getType().toLowerCase(Locale.ROOT)) {
            case "h2" -> new H2Dialect();
            default -> new PostgresDialect();
        };
    }

    @Bean
    public QueryBuilder queryBuilder(DatabaseDialect dialect) {
        return new QueryBuilder(dialect);
    }

    @Bean
    public TemporalSchema temporalSchema(StorageProperties properties) {
        return new TemporalSchema(properties.getSchema().getAuditTableSuffix());
    }

    @Bean
    public Clock storageClock() {
        return Clock.systemUTC();
    }

    @Bean
    public SchemaManager schemaManager(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager,
                                       QueryBuilder queryBuilder, TemporalSchema temporalSchema,
                                       StorageProperties properties) {
        return new SchemaManager(jdbcTemplate, transactionManager, queryBuilder, temporalSchema,
                properties.getSchema().getIgnoredTablePrefixes());
    }

    @Bean
    public TemporalRepositoryFactory temporalRepositoryFactory(JdbcTemplate jdbcTemplate,
                                                               PlatformTransactionManager transactionManager,
                                                               QueryBuilder queryBuilder,
                                                               TemporalSchema temporalSchema,
                                                               Clock storageClock,
                                                               StorageProperties properties) {
        return new TemporalRepositoryFactory(RepositoryContext.builder()
                .jdbcTemplate(jdbcTemplate)
                .transactionManager(transactionManager)
                .queryBuilder(queryBuilder)
                .temporalSchema(temporalSchema)
                .clock(storageClock)
                .timeout(properties.getRepository().getDefaultTimeout())
                .build());
    }

    @Bean
    public Job schemaSyncJob(JobRepository jobRepository, Step schemaSyncStep) {
        return new JobBuilder("schemaSyncJob", jobRepository)
                .incrementer(new RunIdIncrementer())
                .validator(new SchemaSyncJobParameters())
                .start(schemaSyncStep)
                .build();
    }

    /**
     * The step itself holds no transaction; the schema manager opens one per table.
     */
    @Bean
    public Step schemaSyncStep(JobRepository jobRepository, SchemaManager schemaManager,
                               ObjectProvider<TableDefinition> tableDefinitions) {
        return new StepBuilder("schemaSyncStep", jobRepository)
                .tasklet(new SchemaSyncTasklet(schemaManager, tableDefinitions.orderedStream().toList()),
                        new ResourcelessTransactionManager())
                .build();
    }
}
