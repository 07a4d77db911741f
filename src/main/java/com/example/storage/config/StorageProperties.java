package com.example.storage.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "storage")
public class StorageProperties {

    @Valid
    private Database database = new Database();

    @Valid
    private Schema schema = new Schema();

    @Valid
    private Repository repository = new Repository();

    @Data
    public static class Database {
        /** {@code postgres} or {@code h2}. */
        @NotBlank
        @Pattern(regexp = "(?i)postgres|postgresql|h2")
        private String type = "postgres";
    }

    @Data
    public static class Schema {
        /** Tables starting with one of these are invisible to schema sync. */
        @NotNull
        private List<String> ignoredTablePrefixes = new ArrayList<>(List.of("batch_"));
        @NotBlank
        private String auditTableSuffix = "_audit";
    }

    @Data
    public static class Repository {
        /** Deadline of every repository transaction; unset means none. */
        private Duration defaultTimeout = Duration.ofSeconds(30);
    }
}
