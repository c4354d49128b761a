package com.codeshift.converter.model;

/**
 * The exact payload sent to the model for one job.
 *
 * templateHash is the SHA-256 of the persona and task templates as loaded
 * from disk; it ends up in the governance header so every generated file
 * can be traced back to the prompt version that produced it.
 */
public record PromptBundle(String persona, String task, String source, String templateHash) {

    /**
     * The user turn: task instructions first, then the source text.
     * The order is fixed because it changes model behaviour.
     */
    public String userMessage() {
        return task + "\n\n" + source;
    }
}
