package com.codeshift.converter.prompt;

import com.codeshift.converter.config.ConfigurationException;
import com.codeshift.converter.model.ConversionJob;
import com.codeshift.converter.model.PromptBundle;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Builds the request payload for one job.
 *
 * The payload is always (persona, task, source) in that order. The task
 * template may reference two placeholders:
 *
 *   {{TARGET_LANG}}   the target language name, e.g. CSHARP
 *   {{SOURCE_FILE}}   the path of the legacy file
 *
 * The source text itself is appended after the task, never substituted
 * into it, so the order stays stable whatever the template looks like.
 */
@Component
public class PromptAssembler {

    static final String TARGET_LANG_PLACEHOLDER = "{{TARGET_LANG}}";
    static final String SOURCE_FILE_PLACEHOLDER = "{{SOURCE_FILE}}";

    /**
     * Fail fast before a run starts if a template is missing.
     *
     * @throws ConfigurationException of kind TEMPLATE_MISSING
     */
    public void requireComplete(PromptTemplates templates) {
        if (templates.persona() == null || templates.persona().isBlank()) {
            throw new ConfigurationException(ConfigurationException.Kind.TEMPLATE_MISSING,
                    "Persona template (system prompt) is missing or empty");
        }
        if (templates.task() == null || templates.task().isBlank()) {
            throw new ConfigurationException(ConfigurationException.Kind.TEMPLATE_MISSING,
                    "Task template is missing or empty");
        }
    }

    public PromptBundle assemble(ConversionJob job, PromptTemplates templates, String sourceText) {
        requireComplete(templates);

        String task = templates.task()
                .replace(TARGET_LANG_PLACEHOLDER, job.getTargetLanguage().name())
                .replace(SOURCE_FILE_PLACEHOLDER, job.getSourcePath().toString())
                .strip();

        return new PromptBundle(templates.persona().strip(), task, sourceText, templateHash(templates));
    }

    /**
     * SHA-256 over the raw templates (before placeholder substitution), so
     * the hash identifies the prompt version rather than the individual job.
     */
    public static String templateHash(PromptTemplates templates) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(templates.persona().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(templates.task().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
