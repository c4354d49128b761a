package com.codeshift.converter.governance;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Provenance fields stamped on top of every generated file.
 *
 * Rendered (for a "//" comment language) as:
 * <pre>
 *   // AUTO-GENERATED CODE
 *   // Pipeline Run ID: 8123456789
 *   // Source File: legacy/Calculator.vb
 *   // Model: gpt-4-turbo
 *   // Generated: 2026-01-15T09:30:00Z
 *   // Prompt Hash: 3f2a...
 *   // WARNING: Review required before production use
 * </pre>
 * The field order is fixed; {@link #parse} relies on it.
 */
public record GovernanceHeader(String runId,
                               String sourcePath,
                               String model,
                               Instant generatedAt,
                               String promptHash) {

    public static final String MARKER  = "AUTO-GENERATED CODE";
    public static final String WARNING = "WARNING: Review required before production use";

    public String render(String commentPrefix) {
        return line(commentPrefix, MARKER)
             + line(commentPrefix, "Pipeline Run ID: " + runId)
             + line(commentPrefix, "Source File: " + sourcePath)
             + line(commentPrefix, "Model: " + model)
             + line(commentPrefix, "Generated: " + generatedAt)
             + line(commentPrefix, "Prompt Hash: " + promptHash)
             + line(commentPrefix, WARNING);
    }

    /**
     * Find a complete header block in {@code text}. Returns empty if the
     * block is missing, truncated, or its fields are out of order.
     */
    public static Optional<GovernanceHeader> parse(String text, String commentPrefix) {
        Matcher m = pattern(commentPrefix).matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new GovernanceHeader(
                    m.group(1).strip(), m.group(2).strip(), m.group(3).strip(),
                    Instant.parse(m.group(4).strip()), m.group(5).strip()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Pattern pattern(String commentPrefix) {
        String p = "^[ \\t]*" + Pattern.quote(commentPrefix) + " ";
        return Pattern.compile(
                p + Pattern.quote(MARKER) + "[ \\t]*\\r?\\n"
              + p + "Pipeline Run ID: (.*)\\r?\\n"
              + p + "Source File: (.*)\\r?\\n"
              + p + "Model: (.*)\\r?\\n"
              + p + "Generated: (.*)\\r?\\n"
              + p + "Prompt Hash: (.*)\\r?\\n"
              + p + Pattern.quote(WARNING),
                Pattern.MULTILINE);
    }

    private static String line(String commentPrefix, String content) {
        return commentPrefix + " " + content + "\n";
    }
}
