package com.codeshift.converter.llm;

import com.codeshift.converter.config.ConfigurationException;
import com.codeshift.converter.model.ModelResponse;
import com.codeshift.converter.model.PromptBundle;
import com.codeshift.converter.model.ResponseStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * Shared plumbing for JSON-over-HTTP model APIs.
 *
 * Uses java.net.http.HttpClient directly so the exact request on the wire
 * is visible and every failure mode can be classified here: subclasses
 * only describe the request body, the auth headers and where the text
 * sits in the reply.
 */
public abstract class HttpModelTransport implements ModelTransport {

    // Error bodies can be large HTML pages; keep log lines readable.
    private static final int MAX_ERROR_BODY = 500;

    protected final ObjectMapper  json;
    protected final LlmProperties properties;
    private final HttpClient      http;

    protected HttpModelTransport(LlmProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.json       = objectMapper;
        this.http       = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // Dialect hooks
    // ------------------------------------------------------------------

    /** Base URL used when no endpoint override is configured. */
    protected abstract String defaultBaseUrl();

    /** Path appended to the base URL, e.g. "/messages". */
    protected abstract String path();

    protected abstract Object requestBody(PromptBundle bundle, String model);

    protected abstract HttpRequest.Builder authenticate(HttpRequest.Builder request);

    /** Assistant text from a 2xx body, or null/blank if there is none. */
    protected abstract String extractText(String responseBody) throws JsonProcessingException;

    // ------------------------------------------------------------------
    // ModelTransport
    // ------------------------------------------------------------------

    @Override
    public void checkConfigured() {
        if (!properties.hasApiKey()) {
            throw new ConfigurationException(ConfigurationException.Kind.MISSING_CREDENTIAL,
                    "No API key configured for provider '%s' (set LLM_API_KEY)".formatted(name()));
        }
        endpoint();
    }

    @Override
    public ModelResponse send(PromptBundle bundle, String model, Duration timeout) {
        HttpRequest request = authenticate(HttpRequest.newBuilder())
                .uri(endpoint())
                .timeout(timeout)
                .header("content-type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(requestBody(bundle, model))))
                .build();

        long started = System.nanoTime();
        try {
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            Duration latency = Duration.ofNanos(System.nanoTime() - started);

            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                return ModelResponse.classify(response.statusCode(), abbreviate(response.body()), latency);
            }
            try {
                return ModelResponse.classify(response.statusCode(), extractText(response.body()), latency);
            } catch (JsonProcessingException e) {
                // The endpoint speaks a different dialect; retrying will not change that.
                return new ModelResponse("Unparseable response: " + e.getOriginalMessage(),
                        latency, response.statusCode(), ResponseStatus.PERMANENT_ERROR);
            }
        } catch (HttpTimeoutException e) {
            return ModelResponse.unreachable("Timed out after " + timeout,
                    Duration.ofNanos(System.nanoTime() - started));
        } catch (IOException e) {
            return ModelResponse.unreachable("Connection failed: " + e.getMessage(),
                    Duration.ofNanos(System.nanoTime() - started));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for " + name());
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    // HttpRequest.Builder only accepts absolute http(s) URIs.
    private URI endpoint() {
        String url = baseUrl() + path();
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(ConfigurationException.Kind.INVALID_ENDPOINT,
                    "Malformed endpoint '%s': %s".formatted(url, e.getMessage()));
        }
        String scheme = uri.getScheme();
        if ((!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) || uri.getHost() == null) {
            throw new ConfigurationException(ConfigurationException.Kind.INVALID_ENDPOINT,
                    "Endpoint '%s' must be an absolute http(s) URL (check LLM_ENDPOINT)".formatted(url));
        }
        return uri;
    }

    private String baseUrl() {
        String base = properties.hasEndpoint() ? properties.getEndpoint().strip() : defaultBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private String toJson(Object body) {
        try {
            return json.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize " + name() + " request", e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY) + "...";
    }
}
