package com.example.storage.step;

import com.example.storage.model.TableDefinition;
import com.example.storage.schema.SchemaManager;
import com.example.storage.schema.SyncOptions;
import com.example.storage.schema.SyncReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.repeat.RepeatStatus;

import java.util.List;
import java.util.Map;

@Slf4j
public class SchemaSyncTasklet implements Tasklet {

    public static final String CHANGE_COUNT_KEY = "schemaSync.changeCount";
    public static final String SKIPPED_KEY = "schemaSync.skippedDestructive";
    public static final String CONFLICTS_KEY = "schemaSync.conflicts";

    private final SchemaManager schemaManager;
    private final List<TableDefinition> models;

    public SchemaSyncTasklet(SchemaManager schemaManager, List<TableDefinition> models) {
        this.schemaManager = schemaManager;
        this.models = models;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        Map<String, Object> params = chunkContext.getStepContext().getJobParameters();
        SyncOptions options = SyncOptions.builder()
                .dryRun(flag(params.get(SchemaSyncJobParameters.DRY_RUN)))
                .allowDestructive(flag(params.get(SchemaSyncJobParameters.ALLOW_DESTRUCTIVE)))
                .authorizedBy(text(params.get(SchemaSyncJobParameters.AUTHORIZED_BY)))
                .reason(text(params.get(SchemaSyncJobParameters.REASON)))
                .build();

        log.info("Syncing {} declared tables (dryRun={}, allowDestructive={})",
                models.size(), options.isDryRun(), options.isAllowDestructive());
        SyncReport report = schemaManager.syncSchema(models, options);

        ExecutionContext context = chunkContext.getStepContext().getStepExecution().getExecutionContext();
        context.putInt(CHANGE_COUNT_KEY, report.getChangeCount());
        context.putInt(SKIPPED_KEY, report.getSkippedDestructive().size());
        context.putInt(CONFLICTS_KEY, report.getConflicts().size());
        contribution.incrementWriteCount(report.getChangeCount());
        return RepeatStatus.FINISHED;
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }

    private static boolean flag(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }
}
