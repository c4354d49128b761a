package com.codeshift.converter.llm;

import com.codeshift.converter.model.PromptBundle;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpRequest;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible Chat Completions API. Also covers Azure OpenAI and
 * self-hosted gateways through the endpoint override.
 */
public class OpenAiTransport extends HttpModelTransport {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChatResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Choice(Message message) {}

        public String firstText() {
            if (choices == null || choices.isEmpty() || choices.get(0).message() == null) return null;
            return choices.get(0).message().content();
        }
    }

    public OpenAiTransport(LlmProperties properties, ObjectMapper objectMapper) {
        super(properties, objectMapper);
    }

    @Override public String name()              { return "openai"; }
    @Override protected String defaultBaseUrl() { return "https://api.openai.com/v1"; }
    @Override protected String path()           { return "/chat/completions"; }

    @Override
    protected Object requestBody(PromptBundle bundle, String model) {
        return Map.of(
                "model",       model,
                "temperature", properties.getTemperature(),
                "max_tokens",  properties.getMaxTokens(),
                "messages",    List.of(
                        new Message("system", bundle.persona()),
                        new Message("user",   bundle.userMessage())));
    }

    @Override
    protected HttpRequest.Builder authenticate(HttpRequest.Builder request) {
        return request.header("authorization", "Bearer " + properties.getApiKey());
    }

    @Override
    protected String extractText(String responseBody) throws JsonProcessingException {
        return json.readValue(responseBody, ChatResponse.class).firstText();
    }
}
