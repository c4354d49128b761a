package com.codeshift.converter.model;

import com.codeshift.converter.config.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * The languages a legacy source file can be converted into.
 *
 * Each value knows the file extension of its artifacts and the tags a
 * model may put on a fenced code block (```csharp, ```cs, ...).
 */
public enum TargetLanguage {
    CSHARP(".cs",   Set.of("csharp", "cs", "c#")),
    JAVA  (".java", Set.of("java"));

    private final String      extension;
    private final Set<String> fenceTags;

    TargetLanguage(String extension, Set<String> fenceTags) {
        this.extension = extension;
        this.fenceTags = fenceTags;
    }

    public String extension() { return extension; }

    /**
     * Resolve a user-supplied language name ("JAVA", "csharp", "C#").
     *
     * @throws ConfigurationException of kind UNSUPPORTED_LANGUAGE for anything else
     */
    public static TargetLanguage parse(String value) {
        if (value != null) {
            String normalized = value.strip().toLowerCase(Locale.ROOT);
            for (TargetLanguage lang : values()) {
                if (lang.name().toLowerCase(Locale.ROOT).equals(normalized)
                        || lang.fenceTags.contains(normalized)) {
                    return lang;
                }
            }
        }
        throw new ConfigurationException(ConfigurationException.Kind.UNSUPPORTED_LANGUAGE,
                "Unsupported target language '%s' (expected one of %s)"
                        .formatted(value, Arrays.toString(values())));
    }

    /** The language whose artifacts use this file's extension, if any. */
    public static Optional<TargetLanguage> forFileName(String fileName) {
        return Arrays.stream(values())
                .filter(lang -> fileName.endsWith(lang.extension))
                .findFirst();
    }

    /** The language a fence tag belongs to, if it is one of ours. */
    public static Optional<TargetLanguage> forFenceTag(String tag) {
        String normalized = tag.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(lang -> lang.fenceTags.contains(normalized))
                .findFirst();
    }
}
