package com.z254.butterfly.scout.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for SCOUT service.
 */
@Data
@Component
@ConfigurationProperties(prefix = "scout")
public class ScoutProperties {

    private OrchestratorProperties orchestrator = new OrchestratorProperties();
    private BrokerProperties broker = new BrokerProperties();
    private AnalysisProperties analysis = new AnalysisProperties();

    @Data
    public static class OrchestratorProperties {
        /**
         * Default bound on agents in Running state per run.
         */
        private int maxConcurrency = 4;

        /**
         * Threads in the shared agent worker pool.
         */
        private int workerPoolSize = 8;

        private Duration agentTimeout = Duration.ofMinutes(5);
        private Duration runTimeout = Duration.ofMinutes(30);

        /**
         * Failed agents after which the rest of the run is skipped; 0 disables the threshold.
         */
        private int maxFailures = 0;
    }

    @Data
    public static class BrokerProperties {
        private int historySize = 1000;
    }

    @Data
    public static class AnalysisProperties {
        private String workspaceDir = System.getProperty("java.io.tmpdir") + "/scout-workspace";
        private Duration cloneTimeout = Duration.ofMinutes(5);
        private long maxFileBytes = 512 * 1024;
        private int maxFilesScanned = 2000;
        private Duration retention = Duration.ofHours(24);
        private Duration evictionInterval = Duration.ofMinutes(10);
    }
}
