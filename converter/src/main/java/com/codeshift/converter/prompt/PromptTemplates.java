package com.codeshift.converter.prompt;

/**
 * The raw persona and task templates for a run. Either may be null when
 * the file was not found; {@link PromptAssembler} turns that into a
 * configuration error.
 */
public record PromptTemplates(String persona, String task) {
}
