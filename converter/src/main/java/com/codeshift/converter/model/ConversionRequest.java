package com.codeshift.converter.model;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one run needs: which files, into what, with which model,
 * and where validated artifacts go.
 *
 * @param runId          pipeline run identifier stamped into every header
 * @param sources        legacy files, processed in this order
 * @param targetLanguage language to convert into
 * @param model          model identifier sent to the backend
 * @param outputOverride explicit artifact path; only allowed for a single source
 * @param outputDir      directory for artifacts when no override is given
 * @param maxRetries     per-run override of the gateway retry budget, or null
 */
public record ConversionRequest(String runId,
                                List<Path> sources,
                                TargetLanguage targetLanguage,
                                String model,
                                Path outputOverride,
                                Path outputDir,
                                Integer maxRetries) {

    public ConversionRequest {
        if (sources == null || sources.isEmpty()) {
            throw new IllegalArgumentException("At least one source file is required");
        }
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("A model identifier is required");
        }
        if (outputOverride != null && sources.size() > 1) {
            throw new IllegalArgumentException("An explicit output path needs exactly one source file");
        }
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        sources = List.copyOf(sources);
        requireDistinctStems(sources);
    }

    // Artifacts and failure logs are named after the stem, so two sources
    // sharing one would overwrite each other's output.
    private static void requireDistinctStems(List<Path> sources) {
        Map<String, Path> byStem = new HashMap<>();
        for (Path source : sources) {
            Path previous = byStem.putIfAbsent(stem(source), source);
            if (previous != null) {
                throw new IllegalArgumentException("Sources %s and %s would both be staged as '%s'"
                        .formatted(previous, source, stem(source)));
            }
        }
    }

    /** Where the artifact converted from {@code source} is staged. */
    public Path outputFor(Path source) {
        if (outputOverride != null) {
            return outputOverride;
        }
        return outputDir.resolve(stem(source) + targetLanguage.extension());
    }

    public static String stem(Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
