package com.codeshift.converter.llm;

import com.codeshift.converter.model.ConversionJob;
import com.codeshift.converter.model.ModelResponse;
import com.codeshift.converter.model.PromptBundle;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Calls the generative backend for one job with bounded retry/backoff.
 *
 * Outcome per call:
 *   SUCCESS          → returned immediately
 *   TRANSIENT_ERROR  → sleep per {@link RetryPolicy}, retry while budget remains,
 *                      then {@link GatewayException.Kind#EXHAUSTED_RETRIES}
 *   PERMANENT_ERROR  → {@link GatewayException.Kind#REJECTED_REQUEST}, no retry
 *
 * The whole retry loop runs under a single lock, so there is never more
 * than one request in flight across the process, however many runs are
 * queued. Every call is counted and timed:
 * <pre>
 *   codeshift.gateway.calls{model, status="success|transient_error|permanent_error"}
 *   codeshift.gateway.duration{model}
 * </pre>
 */
@Component
public class ModelGateway {

    private static final Logger log = LoggerFactory.getLogger(ModelGateway.class);

    private final ModelTransport transport;
    private final RetryPolicy    policy;
    private final Sleeper        sleeper;
    private final MeterRegistry  meterRegistry;
    private final Duration       timeout;

    private final ReentrantLock inFlight = new ReentrantLock(true);

    public ModelGateway(ModelTransport transport,
                        RetryPolicy policy,
                        Sleeper sleeper,
                        MeterRegistry meterRegistry,
                        LlmProperties properties) {
        this.transport     = transport;
        this.policy        = policy;
        this.sleeper       = sleeper;
        this.meterRegistry = meterRegistry;
        this.timeout       = properties.getTimeout();
    }

    /** Delegates to the transport's own configuration check. */
    public void checkReady() {
        transport.checkConfigured();
    }

    public RetryPolicy policy() {
        return policy;
    }

    /**
     * Resolve the gateway stage for {@code job}: a successful response, or
     * a {@link GatewayException}. Retries are recorded on the job and never
     * exceed {@code policy.maxRetries()}.
     *
     * @throws CancellationException if the thread is interrupted while waiting
     */
    public ModelResponse invoke(ConversionJob job, PromptBundle bundle, RetryPolicy policy) {
        inFlight.lock();
        try {
            return invokeWithRetry(job, bundle, policy);
        } finally {
            inFlight.unlock();
        }
    }

    private ModelResponse invokeWithRetry(ConversionJob job, PromptBundle bundle, RetryPolicy policy) {
        while (true) {
            ModelResponse response = callOnce(job, bundle);

            switch (response.status()) {
                case SUCCESS -> {
                    log.info("Model {} answered in {} ms after {} retries",
                            job.getModel(), response.latency().toMillis(), job.getAttempts());
                    return response;
                }
                case PERMANENT_ERROR -> throw new GatewayException(GatewayException.Kind.REJECTED_REQUEST,
                        "Backend rejected the request (HTTP %d): %s"
                                .formatted(response.httpStatus(), response.body()),
                        job.getAttempts(), response.httpStatus());
                case TRANSIENT_ERROR -> {
                    if (job.getAttempts() >= policy.maxRetries()) {
                        throw new GatewayException(GatewayException.Kind.EXHAUSTED_RETRIES,
                                "Gave up after %d retries, last error (HTTP %d): %s"
                                        .formatted(job.getAttempts(), response.httpStatus(), response.body()),
                                job.getAttempts(), response.httpStatus());
                    }
                    job.incrementAttempts();
                    Duration delay = policy.delayBeforeRetry(job.getAttempts());
                    log.warn("Transient backend error (HTTP {}: {}), retry {}/{} in {} ms",
                            response.httpStatus(), response.body(),
                            job.getAttempts(), policy.maxRetries(), delay.toMillis());
                    pause(delay);
                }
            }
        }
    }

    private ModelResponse callOnce(ConversionJob job, PromptBundle bundle) {
        ModelResponse response = transport.send(bundle, job.getModel(), timeout);
        meterRegistry.timer("codeshift.gateway.duration", "model", job.getModel())
                .record(response.latency());
        meterRegistry.counter("codeshift.gateway.calls",
                "model", job.getModel(),
                "status", response.status().name().toLowerCase(Locale.ROOT)).increment();
        return response;
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted during backoff");
        }
    }
}
