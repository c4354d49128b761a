package com.codeshift.converter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Run-level settings bound from {@code codeshift.*} in application.yml.
 */
@Component
@ConfigurationProperties(prefix = "codeshift")
public class ConverterProperties {

    // GITHUB_RUN_ID in CI, "local" on a workstation.
    private String runId = "local";

    private String promptsDir = "prompts";
    private String outputDir  = "src/generated";
    private String logDir     = "logs";

    // Finished REST runs kept for polling; older ones are forgotten.
    private int retainedRuns = 100;

    private final Retry retry = new Retry();

    public String getRunId()      { return runId; }
    public String getPromptsDir() { return promptsDir; }
    public String getOutputDir()  { return outputDir; }
    public String getLogDir()     { return logDir; }
    public Retry  getRetry()      { return retry; }
    public int    getRetainedRuns() { return retainedRuns; }

    public void setRunId(String runId)           { this.runId = runId; }
    public void setPromptsDir(String promptsDir) { this.promptsDir = promptsDir; }
    public void setOutputDir(String outputDir)   { this.outputDir = outputDir; }
    public void setLogDir(String logDir)         { this.logDir = logDir; }
    public void setRetainedRuns(int retainedRuns) { this.retainedRuns = retainedRuns; }

    /**
     * Gateway backoff: the n-th retry (n ≥ 1) waits min(maxDelay, baseDelay × 2^(n-1)).
     */
    public static class Retry {

        private int      maxRetries = 3;
        private Duration baseDelay  = Duration.ofSeconds(4);
        private Duration maxDelay   = Duration.ofSeconds(10);

        public int      getMaxRetries() { return maxRetries; }
        public Duration getBaseDelay()  { return baseDelay; }
        public Duration getMaxDelay()   { return maxDelay; }

        public void setMaxRetries(int maxRetries)     { this.maxRetries = maxRetries; }
        public void setBaseDelay(Duration baseDelay)  { this.baseDelay = baseDelay; }
        public void setMaxDelay(Duration maxDelay)    { this.maxDelay = maxDelay; }
    }
}
