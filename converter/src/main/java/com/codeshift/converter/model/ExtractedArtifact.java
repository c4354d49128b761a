package com.codeshift.converter.model;

/**
 * Code isolated from a model reply.
 *
 * @param code       the fenced code, prose removed
 * @param promptHash hash of the prompt templates that produced it
 * @param blockCount how many fenced blocks were joined to form {@code code}
 */
public record ExtractedArtifact(String code, String promptHash, int blockCount) {}
