package com.example.storage.step;

import org.springframework.batch.core.JobParameter;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersInvalidException;
import org.springframework.batch.core.JobParametersValidator;
import org.springframework.util.StringUtils;

public class SchemaSyncJobParameters implements JobParametersValidator {

    public static final String DRY_RUN = "dryRun";
    public static final String ALLOW_DESTRUCTIVE = "allowDestructive";
    public static final String AUTHORIZED_BY = "authorizedBy";
    public static final String REASON = "reason";

    @Override
    public void validate(JobParameters parameters) throws JobParametersInvalidException {
        if (parameters == null || !"true".equalsIgnoreCase(text(parameters, ALLOW_DESTRUCTIVE))) {
            return;
        }
        if (!StringUtils.hasText(text(parameters, AUTHORIZED_BY)) || !StringUtils.hasText(text(parameters, REASON))) {
            throw new JobParametersInvalidException(
                    ALLOW_DESTRUCTIVE + "=true requires the " + AUTHORIZED_BY + " and " + REASON + " parameters");
        }
    }

    /** Parameter value as text whatever type it was launched with. */
    static String text(JobParameters parameters, String key) {
        JobParameter<?> parameter = parameters.getParameter(key);
        return parameter == null || parameter.getValue() == null ? null : parameter.getValue().toString();
    }
}
