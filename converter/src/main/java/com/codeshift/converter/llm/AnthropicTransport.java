package com.codeshift.converter.llm;

import com.codeshift.converter.model.PromptBundle;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpRequest;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API: the persona goes in the top-level "system"
 * field, the task and source in a single user message.
 */
public class AnthropicTransport extends HttpModelTransport {

    private static final String API_VER = "2023-06-01";

    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Text of the first text block, or null when the reply has none. */
        public String firstText() {
            if (content == null) return null;
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElse(null);
        }
    }

    public AnthropicTransport(LlmProperties properties, ObjectMapper objectMapper) {
        super(properties, objectMapper);
    }

    @Override public String name()           { return "anthropic"; }
    @Override protected String defaultBaseUrl() { return "https://api.anthropic.com/v1"; }
    @Override protected String path()           { return "/messages"; }

    @Override
    protected Object requestBody(PromptBundle bundle, String model) {
        return Map.of(
                "model",       model,
                "max_tokens",  properties.getMaxTokens(),
                "temperature", properties.getTemperature(),
                "system",      bundle.persona(),
                "messages",    List.of(new Message("user", bundle.userMessage())));
    }

    @Override
    protected HttpRequest.Builder authenticate(HttpRequest.Builder request) {
        return request
                .header("x-api-key",         properties.getApiKey())
                .header("anthropic-version", API_VER);
    }

    @Override
    protected String extractText(String responseBody) throws JsonProcessingException {
        return json.readValue(responseBody, MessagesResponse.class).firstText();
    }
}
