package com.codeshift.converter.service;

import com.codeshift.converter.config.ConverterProperties;
import com.codeshift.converter.model.ConversionRequest;
import com.codeshift.converter.model.RunReport;
import com.codeshift.converter.model.TargetLanguage;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Queues runs submitted over HTTP and executes them on a single worker
 * thread, one run after another.
 *
 * One worker keeps the conversion discipline intact when the service is
 * shared: runs never interleave, each run's report is written by exactly
 * one thread, and the backend sees one request at a time.
 *
 * Only the newest {@code codeshift.retained-runs} finished runs stay
 * pollable. Queued and running runs are never evicted.
 */
@Service
public class RunService {

    private static final Logger log = LoggerFactory.getLogger(RunService.class);

    private final ConversionOrchestrator orchestrator;
    private final ConverterProperties    properties;
    private final Clock                  clock;
    private final ExecutorService        worker;

    private final Map<String, RunRecord> runs = new ConcurrentHashMap<>();

    // Finished run ids, oldest first. Touched only by the worker thread.
    private final Deque<String> finished = new ArrayDeque<>();

    @Autowired
    public RunService(ConversionOrchestrator orchestrator, ConverterProperties properties, Clock clock) {
        this(orchestrator, properties, clock, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "conversion-worker");
            t.setDaemon(true);
            return t;
        }));
    }

    RunService(ConversionOrchestrator orchestrator, ConverterProperties properties,
               Clock clock, ExecutorService worker) {
        this.orchestrator = orchestrator;
        this.properties   = properties;
        this.clock        = clock;
        this.worker       = worker;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Queue a run. Artifacts go to the configured output directory; the
     * run id is the pipeline run id plus a short suffix so that several
     * runs from one pipeline stay distinguishable.
     */
    public RunRecord submit(List<Path> sources, TargetLanguage targetLanguage, String model) {
        String runId = properties.getRunId() + "-" + UUID.randomUUID().toString().substring(0, 8);
        ConversionRequest request = new ConversionRequest(runId, sources, targetLanguage, model,
                null, Path.of(properties.getOutputDir()), null);

        RunRecord queued = RunRecord.queued(request, clock.instant());
        runs.put(runId, queued);
        worker.submit(() -> execute(runId));
        log.info("Run {} queued with {} file(s)", runId, sources.size());
        return queued;
    }

    public Optional<RunRecord> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    // ------------------------------------------------------------------
    // Worker
    // ------------------------------------------------------------------

    private void execute(String runId) {
        RunRecord record = runs.computeIfPresent(runId, (id, r) -> r.running());
        if (record == null) {
            return;
        }
        try {
            RunReport report = orchestrator.run(record.request());
            runs.put(runId, record.completed(report));
        } catch (RuntimeException e) {
            log.error("Run {} aborted: {}", runId, e.getMessage(), e);
            runs.put(runId, record.aborted(e.getMessage()));
        }
        retire(runId);
    }

    private void retire(String runId) {
        finished.addLast(runId);
        while (finished.size() > Math.max(properties.getRetainedRuns(), 0)) {
            String evicted = finished.removeFirst();
            runs.remove(evicted);
            log.debug("Run {} evicted from history", evicted);
        }
    }

    @PreDestroy
    void shutdown() {
        worker.shutdownNow();
    }
}
