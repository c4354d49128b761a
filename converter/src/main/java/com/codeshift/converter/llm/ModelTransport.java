package com.codeshift.converter.llm;

import com.codeshift.converter.model.ModelResponse;
import com.codeshift.converter.model.PromptBundle;

import java.time.Duration;

/**
 * A single round-trip to a generative backend.
 *
 * Implementations never throw for backend trouble: timeouts, refused
 * connections and HTTP errors all come back as a classified
 * {@link ModelResponse} so that {@link ModelGateway} alone decides what
 * gets retried.
 */
public interface ModelTransport {

    /** Short name used in logs and metrics, e.g. "openai". */
    String name();

    /**
     * Verify credentials and endpoint settings before a run starts.
     *
     * @throws com.codeshift.converter.config.ConfigurationException if the transport cannot work
     */
    default void checkConfigured() {}

    ModelResponse send(PromptBundle bundle, String model, Duration timeout);
}
