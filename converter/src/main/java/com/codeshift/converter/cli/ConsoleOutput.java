package com.codeshift.converter.cli;

import com.codeshift.converter.model.JobOutcome;
import com.codeshift.converter.model.RunReport;
import picocli.CommandLine.Help.Ansi;

/**
 * Terminal output for the CLI commands. Markup uses picocli's
 * {@code @|style text|@} syntax and falls back to plain text when the
 * terminal has no ANSI support (CI logs, redirected output).
 */
final class ConsoleOutput {

    private static final String RULE = "-".repeat(40);

    private ConsoleOutput() {
    }

    static void printBanner() {
        print("@|bold codeshift|@ @|faint 0.1.0|@  legacy source conversion");
        System.out.println(RULE);
    }

    static void info(String message) {
        print("@|cyan ..|@ " + message);
    }

    static void success(String message) {
        print("@|green ok|@ " + message);
    }

    static void error(String message) {
        print("@|red,bold !!|@ " + message);
    }

    /** One line per job, plus one indented line per failed structural check. */
    static void outcome(JobOutcome outcome) {
        if (outcome instanceof JobOutcome.Validated v) {
            success(v.sourcePath() + " -> " + v.stagedPath() + " (" + v.gatewayRetries() + " retries)");
            return;
        }
        JobOutcome.Rejected r = (JobOutcome.Rejected) outcome;
        error(r.sourcePath() + " rejected at " + r.failedStage() + ": " + r.reason() + ", " + r.detail());
        r.violations().forEach(v -> print("     @|red -|@ " + v));
    }

    static void summary(RunReport report) {
        System.out.println(RULE);
        String line = "run %s: %d validated, %d rejected"
                .formatted(report.runId(), report.validatedCount(), report.rejectedCount());
        if (report.passed()) {
            success(line);
        } else {
            error(line);
        }
    }

    private static void print(String markup) {
        System.out.println(Ansi.AUTO.string(markup));
    }
}
