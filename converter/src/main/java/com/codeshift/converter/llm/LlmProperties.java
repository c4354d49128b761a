package com.codeshift.converter.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Backend connection settings bound from {@code codeshift.llm.*}.
 *
 * apiKey and endpoint come from LLM_API_KEY / LLM_ENDPOINT. A blank
 * endpoint means the provider's public API.
 */
@Component
@ConfigurationProperties(prefix = "codeshift.llm")
public class LlmProperties {

    private String   provider    = "openai";
    private String   apiKey      = "";
    private String   endpoint    = "";
    private Duration timeout     = Duration.ofSeconds(120);
    private double   temperature = 0.2;
    private int      maxTokens   = 4000;

    public String   getProvider()    { return provider; }
    public String   getApiKey()      { return apiKey; }
    public String   getEndpoint()    { return endpoint; }
    public Duration getTimeout()     { return timeout; }
    public double   getTemperature() { return temperature; }
    public int      getMaxTokens()   { return maxTokens; }

    public void setProvider(String provider)         { this.provider = provider; }
    public void setApiKey(String apiKey)             { this.apiKey = apiKey; }
    public void setEndpoint(String endpoint)         { this.endpoint = endpoint; }
    public void setTimeout(Duration timeout)         { this.timeout = timeout; }
    public void setTemperature(double temperature)   { this.temperature = temperature; }
    public void setMaxTokens(int maxTokens)          { this.maxTokens = maxTokens; }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public boolean hasEndpoint() {
        return endpoint != null && !endpoint.isBlank();
    }
}
