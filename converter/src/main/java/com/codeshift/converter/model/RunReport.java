package com.codeshift.converter.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered record of every job outcome in one run.
 *
 * Append-only and written by a single thread (the orchestrator's worker),
 * so it needs no locking. Outcomes appear in input order. A report with
 * fewer outcomes than {@link #expectedJobs()} belongs to a run that was
 * aborted: the missing files were never attempted, not failed.
 */
public class RunReport {

    private final String          runId;
    private final Instant         startedAt;
    private final int             expectedJobs;
    private final List<JobOutcome> outcomes = new ArrayList<>();

    public RunReport(String runId, Instant startedAt, int expectedJobs) {
        this.runId        = runId;
        this.startedAt    = startedAt;
        this.expectedJobs = expectedJobs;
    }

    public String  runId()        { return runId; }
    public Instant startedAt()    { return startedAt; }
    public int     expectedJobs() { return expectedJobs; }

    public void append(JobOutcome outcome) {
        if (outcomes.size() >= expectedJobs) {
            throw new IllegalStateException(
                    "Run %s already holds %d outcomes".formatted(runId, expectedJobs));
        }
        outcomes.add(outcome);
    }

    public List<JobOutcome> outcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    public boolean isComplete() {
        return outcomes.size() == expectedJobs;
    }

    /** True only when the run finished and no job was rejected. */
    public boolean passed() {
        return isComplete() && rejectedCount() == 0;
    }

    public long validatedCount() {
        return outcomes.stream().filter(o -> o instanceof JobOutcome.Validated).count();
    }

    public long rejectedCount() {
        return outcomes.stream().filter(o -> o instanceof JobOutcome.Rejected).count();
    }

    public Optional<JobOutcome.Rejected> firstRejection() {
        return outcomes.stream()
                .filter(JobOutcome.Rejected.class::isInstance)
                .map(JobOutcome.Rejected.class::cast)
                .findFirst();
    }
}
