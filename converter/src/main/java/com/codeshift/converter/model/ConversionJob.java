package com.codeshift.converter.model;

import java.nio.file.Path;
import java.util.UUID;

/**
 * One source file being converted within a run.
 *
 * Created by the orchestrator when it reaches the file, owned by it
 * for the whole conversion, and discarded once the outcome has been
 * appended to the RunReport. Not thread-safe: only the worker that
 * created it touches it.
 */
public class ConversionJob {

    private final UUID           id = UUID.randomUUID();
    private final Path           sourcePath;
    private final TargetLanguage targetLanguage;
    private final String         model;

    private JobState state = JobState.PENDING;

    // Gateway retries consumed so far (the first call is not a retry).
    private int attempts = 0;

    public ConversionJob(Path sourcePath, TargetLanguage targetLanguage, String model) {
        this.sourcePath     = sourcePath;
        this.targetLanguage = targetLanguage;
        this.model          = model;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID           getId()             { return id; }
    public Path           getSourcePath()     { return sourcePath; }
    public TargetLanguage getTargetLanguage() { return targetLanguage; }
    public String         getModel()          { return model; }
    public JobState       getState()          { return state; }
    public int            getAttempts()       { return attempts; }

    // ------------------------------------------------------------------
    // State machine
    // ------------------------------------------------------------------

    /**
     * Move to the next stage, or to REJECTED from any non-terminal stage.
     *
     * @throws IllegalStateException for any other transition
     */
    public void advanceTo(JobState target) {
        if (state.isTerminal()) {
            throw new IllegalStateException(
                    "Job %s is already %s, cannot move to %s".formatted(id, state, target));
        }
        if (target != JobState.REJECTED && target != state.next()) {
            throw new IllegalStateException(
                    "Illegal transition %s → %s for job %s".formatted(state, target, id));
        }
        this.state = target;
    }

    public void incrementAttempts() { this.attempts++; }
}
