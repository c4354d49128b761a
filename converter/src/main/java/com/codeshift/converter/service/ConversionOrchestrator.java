package com.codeshift.converter.service;

import com.codeshift.converter.extract.ResponseExtractor;
import com.codeshift.converter.governance.GovernanceStamper;
import com.codeshift.converter.llm.GatewayException;
import com.codeshift.converter.llm.ModelGateway;
import com.codeshift.converter.llm.RetryPolicy;
import com.codeshift.converter.model.*;
import com.codeshift.converter.prompt.PromptAssembler;
import com.codeshift.converter.prompt.PromptTemplateLoader;
import com.codeshift.converter.prompt.PromptTemplates;
import com.codeshift.converter.validate.StructuralValidator;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Drives every source file of a run through the conversion stages:
 *
 *   PENDING → ASSEMBLING → INVOKING → EXTRACTING → STAMPING → VALIDATING → VALIDATED
 *
 * Files are processed one at a time, in input order. A failure in any
 * stage moves that job to REJECTED (stage and reason recorded) and the run
 * carries on with the next file. Only configuration errors, detected
 * before the first job starts, abort the whole run.
 *
 * Validated artifacts are handed to the {@link ArtifactStager}; nothing
 * else ever is.
 */
@Service
public class ConversionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversionOrchestrator.class);

    private final PromptTemplateLoader templateLoader;
    private final PromptAssembler      assembler;
    private final ModelGateway         gateway;
    private final GovernanceStamper    stamper;
    private final StructuralValidator  validator;
    private final ArtifactStager       stager;
    private final MeterRegistry        meterRegistry;
    private final Clock                clock;

    public ConversionOrchestrator(PromptTemplateLoader templateLoader,
                                  PromptAssembler assembler,
                                  ModelGateway gateway,
                                  GovernanceStamper stamper,
                                  StructuralValidator validator,
                                  ArtifactStager stager,
                                  MeterRegistry meterRegistry,
                                  Clock clock) {
        this.templateLoader = templateLoader;
        this.assembler      = assembler;
        this.gateway        = gateway;
        this.stamper        = stamper;
        this.validator      = validator;
        this.stager         = stager;
        this.meterRegistry  = meterRegistry;
        this.clock          = clock;
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    /**
     * Convert every source in the request and return the run report.
     *
     * @throws com.codeshift.converter.config.ConfigurationException if templates or
     *         credentials are missing; no job is attempted in that case
     * @throws StagingException if an artifact or failure log cannot be written
     */
    public RunReport run(ConversionRequest request) {
        // Preflight: configuration errors must surface before any network call.
        PromptTemplates templates = templateLoader.load();
        assembler.requireComplete(templates);
        gateway.checkReady();
        RetryPolicy policy = request.maxRetries() == null
                ? gateway.policy()
                : gateway.policy().withMaxRetries(request.maxRetries());

        RunReport report = new RunReport(request.runId(), clock.instant(), request.sources().size());
        log.info("Run {} started: {} file(s) → {} with model {}",
                request.runId(), request.sources().size(), request.targetLanguage(), request.model());

        for (Path source : request.sources()) {
            ConversionJob job = new ConversionJob(source, request.targetLanguage(), request.model());
            MDC.put("runId",  request.runId());
            MDC.put("jobId",  job.getId().toString());
            MDC.put("source", source.toString());
            try {
                JobOutcome outcome = process(job, templates, policy, request);
                report.append(outcome);
                count(outcome);
            } finally {
                MDC.remove("runId");
                MDC.remove("jobId");
                MDC.remove("source");
            }
        }

        log.info("Run {} finished: {} validated, {} rejected",
                request.runId(), report.validatedCount(), report.rejectedCount());
        return report;
    }

    // ------------------------------------------------------------------
    // One job
    // ------------------------------------------------------------------

    private JobOutcome process(ConversionJob job, PromptTemplates templates,
                               RetryPolicy policy, ConversionRequest request) {
        job.advanceTo(JobState.ASSEMBLING);
        String sourceText;
        try {
            sourceText = Files.readString(job.getSourcePath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return reject(job, FailureReason.SOURCE_UNREADABLE,
                    "Could not read source file: " + e.getMessage(), List.of());
        }
        PromptBundle bundle = assembler.assemble(job, templates, sourceText);

        job.advanceTo(JobState.INVOKING);
        log.info("Calling model {} for {}", job.getModel(), job.getSourcePath());
        ModelResponse response;
        try {
            response = gateway.invoke(job, bundle, policy);
        } catch (GatewayException e) {
            FailureReason reason = e.getKind() == GatewayException.Kind.EXHAUSTED_RETRIES
                    ? FailureReason.EXHAUSTED_RETRIES
                    : FailureReason.REJECTED_REQUEST;
            return reject(job, reason, e.getMessage(), List.of());
        }

        job.advanceTo(JobState.EXTRACTING);
        Optional<ExtractedArtifact> extracted = ResponseExtractor.extract(response.body(), bundle.templateHash());
        if (extracted.isEmpty()) {
            return reject(job, FailureReason.NO_CODE_BLOCK_FOUND,
                    "Model response contained no fenced code block", List.of());
        }
        if (extracted.get().blockCount() > 1) {
            log.debug("Joined {} code blocks from the response", extracted.get().blockCount());
        }

        job.advanceTo(JobState.STAMPING);
        StampedArtifact stamped = stamper.stamp(extracted.get(), request.runId(), job);

        job.advanceTo(JobState.VALIDATING);
        ValidationOutcome validation = validator.validate(stamped, job.getTargetLanguage());
        if (!validation.passed()) {
            return reject(job, FailureReason.VALIDATION_FAILED,
                    validation.violations().size() + " structural check(s) failed",
                    validation.violations());
        }

        job.advanceTo(JobState.VALIDATED);
        Path staged = stager.stage(stamped, request.outputFor(job.getSourcePath()));
        log.info("Job {} VALIDATED → {}", job.getId(), staged);
        return new JobOutcome.Validated(job.getId(), job.getSourcePath().toString(),
                job.getTargetLanguage(), job.getModel(), job.getAttempts(),
                stamped, validation, staged.toString());
    }

    private JobOutcome.Rejected reject(ConversionJob job, FailureReason reason,
                                       String detail, List<Violation> violations) {
        JobState failedStage = job.getState();
        job.advanceTo(JobState.REJECTED);

        JobOutcome.Rejected rejected = new JobOutcome.Rejected(job.getId(),
                job.getSourcePath().toString(), job.getTargetLanguage(), job.getModel(),
                job.getAttempts(), failedStage, reason, detail, violations);
        log.warn("Job {} REJECTED at {}: {} ({})", job.getId(), failedStage, reason, detail);
        violations.forEach(v -> log.warn("  violation: {}", v));

        stager.recordRejection(rejected);
        return rejected;
    }

    private void count(JobOutcome outcome) {
        String stage = outcome instanceof JobOutcome.Rejected r
                ? r.failedStage().name().toLowerCase(Locale.ROOT)
                : "none";
        meterRegistry.counter("codeshift.jobs",
                "outcome", outcome.finalState().name().toLowerCase(Locale.ROOT),
                "stage", stage).increment();
    }
}
