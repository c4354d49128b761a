package com.codeshift.converter.prompt;

import com.codeshift.converter.config.ConverterProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the persona and task templates from the prompts directory:
 *
 *   prompts/system_prompt.txt   persona (system turn)
 *   prompts/task_prompt.txt     task instructions (user turn)
 *
 * Templates are read once per run so every job in the run shares the
 * same prompt version and therefore the same template hash.
 */
@Component
public class PromptTemplateLoader {

    private static final Logger log = LoggerFactory.getLogger(PromptTemplateLoader.class);

    static final String PERSONA_FILE = "system_prompt.txt";
    static final String TASK_FILE    = "task_prompt.txt";

    private final Path promptsDir;

    public PromptTemplateLoader(ConverterProperties properties) {
        this(Path.of(properties.getPromptsDir()));
    }

    PromptTemplateLoader(Path promptsDir) {
        this.promptsDir = promptsDir;
    }

    public PromptTemplates load() {
        return new PromptTemplates(read(PERSONA_FILE), read(TASK_FILE));
    }

    /** Returns null when the template file does not exist. */
    private String read(String fileName) {
        Path path = promptsDir.resolve(fileName);
        if (!Files.isRegularFile(path)) {
            log.warn("Prompt template not found: {}", path);
            return null;
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read prompt template " + path, e);
        }
    }
}
