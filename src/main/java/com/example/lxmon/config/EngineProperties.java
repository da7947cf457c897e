package com.example.lxmon.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Central configuration for the lxmon background engine.
 * Maps to the 'lxmon' prefix in application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "lxmon")
public class EngineProperties {

    @Valid
    private EngineConfig engine = new EngineConfig();
    @Valid
    private AggregatorConfig aggregator = new AggregatorConfig();
    @Valid
    private AlertsConfig alerts = new AlertsConfig();
    @Valid
    private LivenessConfig liveness = new LivenessConfig();
    @Valid
    private RetentionConfig retention = new RetentionConfig();
    @Valid
    private CommandsConfig commands = new CommandsConfig();
    @Valid
    private QueueConfig queue = new QueueConfig();

    @Data
    public static class EngineConfig {
        private boolean enabled = true;
        @Min(1)
        private int schedulerPoolSize = 4;
        @Min(1)
        private int shutdownTimeoutSeconds = 30;
    }

    @Data
    public static class AggregatorConfig {
        @Min(1)
        private int intervalSeconds = 60;
        @Min(1)
        private int recentWindowMinutes = 5;
        @Min(1)
        private int batchSize = 1000;
        /** Must outlive the pass interval so a missed pass does not blank the dashboard. */
        @Min(1)
        private int snapshotTtlSeconds = 300;
    }

    @Data
    public static class AlertsConfig {
        @Min(1)
        private int intervalSeconds = 30;
        @Min(1)
        private int lookbackMinutes = 10;
    }

    @Data
    public static class LivenessConfig {
        @Min(1)
        private int intervalSeconds = 60;
        @Min(1)
        private int staleAfterMinutes = 5;
    }

    @Data
    public static class RetentionConfig {
        @Min(1)
        private int intervalSeconds = 3600;
        @Min(1)
        private int retentionDays = 30;
    }

    @Data
    public static class CommandsConfig {
        @Min(1)
        private int maxLength = 1024;
        /** Executables an operator may queue. Empty means any executable. */
        private List<String> allowlist = new ArrayList<>(List.of(
                "systemctl", "service", "docker", "nginx", "apache2", "ps", "top",
                "df", "free", "uptime", "whoami", "hostname", "date", "echo"));
        @NotNull
        private List<String> denylist = new ArrayList<>();
    }

    @Data
    public static class QueueConfig {
        @Pattern(regexp = "redis|memory")
        private String backend = "memory";
    }
}
