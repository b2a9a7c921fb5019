package com.tradescheduler.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "scheduler")
@Data
@Validated
public class SchedulerProperties {

    /**
     * Zone used until a timezone has been stored through the API.
     */
    @NotBlank
    private String defaultTimezone = "America/New_York";

    @Valid
    private ReconcileProperties reconcile = new ReconcileProperties();

    @Valid
    private EngineProperties engine = new EngineProperties();

    @Valid
    private HistoryProperties history = new HistoryProperties();

    private SeedProperties seed = new SeedProperties();

    @Data
    public static class ReconcileProperties {
        private boolean enabled = true;

        @Min(1000)
        private long sweepIntervalMs = 60000;

        @Min(0)
        private long initialDelayMs = 30000;
    }

    @Data
    public static class EngineProperties {
        /**
         * Trigger group all job triggers are registered under.
         */
        @NotBlank
        private String namespace = "trade-jobs";

        @Min(100)
        private long timeoutMs = 5000;
    }

    @Data
    public static class HistoryProperties {
        @Min(1)
        private int defaultLimit = 50;

        @Min(1)
        @Max(5000)
        private int maxLimit = 500;
    }

    @Data
    public static class SeedProperties {
        /**
         * Optional JSON file with a list of jobs imported when the store is empty.
         */
        private String file;
    }
}
