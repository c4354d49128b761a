package com.codeshift.converter.service;

import com.codeshift.converter.model.JobOutcome;
import com.codeshift.converter.model.StampedArtifact;

import java.nio.file.Path;

/**
 * Hand-off point to whatever stages artifacts for review (a working tree
 * that a later pipeline step commits to a staging branch).
 *
 * Only validated artifacts ever reach {@link #stage}; the orchestrator
 * guarantees it.
 *
 * @throws StagingException from either method when the target cannot be written
 */
public interface ArtifactStager {

    /** Write a validated artifact and return where it went. */
    Path stage(StampedArtifact artifact, Path target);

    /** Record a rejected job for later inspection. Nothing is staged. */
    void recordRejection(JobOutcome.Rejected rejection);
}
