package com.example.storage.step;

import com.example.storage.error.SchemaConflictException;
import com.example.storage.model.ColumnDefinition;
import com.example.storage.model.LogicalType;
import com.example.storage.model.TableDefinition;
import com.example.storage.model.TemporalStrategyType;
import org.junit.jupiter.api.Test;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.JobParametersInvalidException;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.test.JobLauncherTestUtils;
import org.springframework.batch.test.context.SpringBatchTest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@SpringBatchTest
@ActiveProfiles("test")
public class SchemaSyncJobIntegrationTest {

    private static final AtomicLong RUN = new AtomicLong(System.currentTimeMillis());

    @TestConfiguration
    static class Models {

        @Bean
        public TableDefinition invoices() {
            return TableDefinition.builder()
                    .schema("job_test")
                    .name("invoices")
                    .strategy(TemporalStrategyType.COPY_ON_CHANGE)
                    .softDelete(true)
                    .column(ColumnDefinition.builder().name("number").type(LogicalType.STRING).maxLength(32)
                            .nullable(false).build())
                    .column(ColumnDefinition.builder().name("amount").type(LogicalType.DECIMAL)
                            .precision(12).scale(2).build())
                    .build();
        }
    }

    @Autowired
    private JobLauncherTestUtils jobLauncherTestUtils;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private JobParametersBuilder parameters() {
        return new JobParametersBuilder().addLong("time", RUN.incrementAndGet());
    }

    private static ExecutionContext stepContext(JobExecution execution) {
        return execution.getStepExecutions().iterator().next().getExecutionContext();
    }

    private boolean tableExists(String table) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM information_schema.tables WHERE table_schema = 'job_test' AND table_name = ?",
                Long.class, table);
        return count != null && count > 0;
    }

    private boolean columnExists(String column) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM information_schema.columns"
                        + " WHERE table_schema = 'job_test' AND table_name = 'invoices' AND column_name = ?",
                Long.class, column);
        return count != null && count > 0;
    }

    @Test
    public void testDryRunThenSyncThenNothingLeft() throws Exception {
        JobParameters dryRun = parameters().addString(SchemaSyncJobParameters.DRY_RUN, "true").toJobParameters();
        JobExecution planned = jobLauncherTestUtils.launchJob(dryRun);

        assertThat(planned.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        if (!tableExists("invoices")) {
            assertThat(stepContext(planned).getInt(SchemaSyncTasklet.CHANGE_COUNT_KEY)).isPositive();
        }

        JobExecution applied = jobLauncherTestUtils.launchJob(parameters().toJobParameters());
        assertThat(applied.getExitStatus().getExitCode()).isEqualTo("COMPLETED");
        assertThat(tableExists("invoices")).isTrue();
        assertThat(tableExists("invoices_audit")).isTrue();

        JobExecution again = jobLauncherTestUtils.launchJob(parameters().toJobParameters());
        assertThat(again.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(stepContext(again).getInt(SchemaSyncTasklet.CHANGE_COUNT_KEY)).isZero();
        assertThat(stepContext(again).getInt(SchemaSyncTasklet.CONFLICTS_KEY)).isZero();
    }

    @Test
    public void testUndeclaredColumnIsOnlyDroppedWhenAuthorized() throws Exception {
        jobLauncherTestUtils.launchJob(parameters().toJobParameters());
        jdbcTemplate.execute("ALTER TABLE job_test.invoices ADD COLUMN legacy_code INTEGER");

        JobExecution kept = jobLauncherTestUtils.launchJob(parameters().toJobParameters());
        assertThat(kept.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(stepContext(kept).getInt(SchemaSyncTasklet.SKIPPED_KEY)).isEqualTo(1);
        assertThat(columnExists("legacy_code")).isTrue();

        JobExecution dropped = jobLauncherTestUtils.launchJob(parameters()
                .addString(SchemaSyncJobParameters.ALLOW_DESTRUCTIVE, "true")
                .addString(SchemaSyncJobParameters.AUTHORIZED_BY, "ops-oncall")
                .addString(SchemaSyncJobParameters.REASON, "column replaced by number")
                .toJobParameters());
        assertThat(dropped.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(stepContext(dropped).getInt(SchemaSyncTasklet.CHANGE_COUNT_KEY)).isEqualTo(1);
        assertThat(columnExists("legacy_code")).isFalse();
    }

    @Test
    public void testConflictFailsTheJob() throws Exception {
        jobLauncherTestUtils.launchJob(parameters().toJobParameters());
        jdbcTemplate.execute("ALTER TABLE job_test.invoices ALTER COLUMN number SET DATA TYPE VARCHAR(64)");
        try {
            JobExecution execution = jobLauncherTestUtils.launchJob(parameters().toJobParameters());

            assertThat(execution.getStatus()).isEqualTo(BatchStatus.FAILED);
            assertThat(execution.getAllFailureExceptions())
                    .anySatisfy(e -> assertThat(e).isInstanceOf(SchemaConflictException.class));
        } finally {
            jdbcTemplate.execute("ALTER TABLE job_test.invoices ALTER COLUMN number SET DATA TYPE VARCHAR(32)");
        }
    }

    @Test
    public void testDestructiveRunWithoutAuthorizationIsRejected() {
        JobParameters unauthorized = parameters()
                .addString(SchemaSyncJobParameters.ALLOW_DESTRUCTIVE, "true")
                .toJobParameters();

        assertThatThrownBy(() -> jobLauncherTestUtils.launchJob(unauthorized))
                .isInstanceOf(JobParametersInvalidException.class)
                .hasMessageContaining(SchemaSyncJobParameters.AUTHORIZED_BY);
    }
}
