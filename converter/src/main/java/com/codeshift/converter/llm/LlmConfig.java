package com.codeshift.converter.llm;

import com.codeshift.converter.config.ConfigurationException;
import com.codeshift.converter.config.ConverterProperties;
import com.codeshift.converter.model.ModelResponse;
import com.codeshift.converter.model.PromptBundle;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Locale;

/**
 * Wires the gateway's collaborators from configuration.
 */
@Configuration
public class LlmConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmConfig.class);

    @Bean
    ModelTransport modelTransport(LlmProperties properties, ObjectMapper objectMapper) {
        String provider = properties.getProvider() == null
                ? "" : properties.getProvider().strip().toLowerCase(Locale.ROOT);
        ModelTransport transport = switch (provider) {
            case "openai"    -> new OpenAiTransport(properties, objectMapper);
            case "anthropic" -> new AnthropicTransport(properties, objectMapper);
            // Reported at preflight, so the CLI can exit with its configuration code.
            default -> new UnsupportedProvider(provider);
        };
        log.info("Using {} transport{}", transport.name(),
                properties.hasEndpoint() ? " at " + properties.getEndpoint() : "");
        return transport;
    }

    @Bean
    RetryPolicy retryPolicy(ConverterProperties properties) {
        ConverterProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(retry.getMaxRetries(), retry.getBaseDelay(), retry.getMaxDelay());
    }

    @Bean
    Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    record UnsupportedProvider(String provider) implements ModelTransport {

        @Override
        public String name() {
            return provider;
        }

        @Override
        public void checkConfigured() {
            throw new ConfigurationException(ConfigurationException.Kind.UNSUPPORTED_PROVIDER,
                    "Unknown LLM provider '%s' (expected openai or anthropic)".formatted(provider));
        }

        @Override
        public ModelResponse send(PromptBundle bundle, String model, Duration timeout) {
            checkConfigured();
            return null;
        }
    }
}
