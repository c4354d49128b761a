package com.codeshift.converter.api.dto;

import java.util.List;

/**
 * Request body for POST /runs.
 *
 * Required: sources, targetLang
 * Optional: model, defaults to gpt-4-turbo.
 */
public record SubmitRunRequest(List<String> sources, String targetLang, String model) {

    public static final String DEFAULT_MODEL = "gpt-4-turbo";

    public SubmitRunRequest {
        if (model == null || model.isBlank()) model = DEFAULT_MODEL;
    }
}
