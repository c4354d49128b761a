package com.codeshift.converter.cli;

import com.codeshift.converter.config.ConfigurationException;
import com.codeshift.converter.config.ConverterProperties;
import com.codeshift.converter.governance.GovernanceHeader;
import com.codeshift.converter.model.*;
import com.codeshift.converter.service.ConversionOrchestrator;
import com.codeshift.converter.validate.DirectoryValidator;
import com.codeshift.converter.validate.StructuralValidator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for the codeshift command line.
 * picocli is driven directly with a factory that supplies mocks, so no
 * Spring context is started.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    static final Instant NOW = Instant.parse("2026-01-15T09:30:00Z");

    @TempDir Path tmp;

    ConversionOrchestrator orchestrator;
    ConverterProperties    properties;
    ObjectMapper           mapper;

    @BeforeEach
    void setUp() {
        orchestrator = mock(ConversionOrchestrator.class);
        properties   = new ConverterProperties();
        properties.setRunId("8123456789");
        properties.setOutputDir(tmp.resolve("src/generated").toString());
        mapper = new ObjectMapper().findAndRegisterModules();
    }

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ConvertCommand.class) {
                    return (K) new ConvertCommand(orchestrator, properties, new RunReportWriter(mapper));
                }
                if (cls == ValidateCommand.class) {
                    return (K) new ValidateCommand(new DirectoryValidator(new StructuralValidator()), properties);
                }
                if (cls == ServeCommand.class) {
                    return (K) new ServeCommand();
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            int exitCode = new CommandLine(new CodeShiftCommand(), factory()).execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private Path source(String name) throws Exception {
        return Files.writeString(tmp.resolve(name), "Module " + name);
    }

    private static JobOutcome.Rejected rejectedAt(JobState stage, FailureReason reason) {
        return new JobOutcome.Rejected(UUID.randomUUID(), "A.vb", TargetLanguage.JAVA, "gpt-4-turbo", 0,
                stage, reason, "detail", List.of());
    }

    private static RunReport reportOf(JobOutcome... outcomes) {
        RunReport report = new RunReport("8123456789", NOW, outcomes.length);
        for (JobOutcome o : outcomes) {
            report.append(o);
        }
        return report;
    }

    // =====================================================================
    // Root command
    // =====================================================================

    @Test
    void noArgs_printsUsage() {
        CliResult result = execute();

        assertThat(result.exitCode()).isZero();
        assertThat(result.output()).contains("convert").contains("validate").contains("serve");
    }

    @Test
    void serveHelp_describesRunsApi() {
        CliResult result = execute("serve", "--help");

        assertThat(result.exitCode()).isZero();
        assertThat(result.output()).contains("/runs");
    }

    @Test
    void serveMode_onlyWhenServeIsTheSubcommand() {
        assertThat(CliRunner.isServeMode("serve")).isTrue();
        assertThat(CliRunner.isServeMode("serve", "--help")).isFalse();
        assertThat(CliRunner.isServeMode("convert", "--model", "serve", "-s", "A.vb", "-t", "JAVA")).isFalse();
        assertThat(CliRunner.isServeMode("convert", "-s", "serve", "-t", "JAVA")).isFalse();
        assertThat(CliRunner.isServeMode()).isFalse();
    }

    @Test
    void runner_modelNamedServe_stillConverts() throws Exception {
        Path a = source("A.vb");
        when(orchestrator.run(any())).thenReturn(reportOf());
        CliRunner runner = new CliRunner(new CodeShiftCommand(), factory());

        runner.run("convert", "-s", a.toString(), "-t", "JAVA", "--model", "serve");

        ArgumentCaptor<ConversionRequest> captor = ArgumentCaptor.forClass(ConversionRequest.class);
        verify(orchestrator).run(captor.capture());
        assertThat(captor.getValue().model()).isEqualTo("serve");
        assertThat(runner.getExitCode()).isZero();
    }

    // =====================================================================
    // convert
    // =====================================================================

    @Test
    void convert_sourcesSharingAStem_isUsageError() throws Exception {
        Path a = Files.writeString(Files.createDirectories(tmp.resolve("a")).resolve("Calc.vb"), "Module A");
        Path b = Files.writeString(Files.createDirectories(tmp.resolve("b")).resolve("Calc.vb"), "Module B");

        CliResult result = execute("convert", "-s", a.toString(), "-s", b.toString(), "-t", "JAVA");

        assertThat(result.exitCode()).isEqualTo(ExitCodes.CONFIGURATION);
        assertThat(result.output()).contains("'Calc'");
        verifyNoInteractions(orchestrator);
    }

    @Test
    void convert_missingSource_isUsageError() {
        CliResult result = execute("convert", "--target-lang", "JAVA");

        assertThat(result.exitCode()).isEqualTo(ExitCodes.CONFIGURATION);
        assertThat(result.output()).contains("--source");
        verifyNoInteractions(orchestrator);
    }

    @Test
    void convert_unsupportedLanguage_exitsWithConfigurationCode() throws Exception {
        Path a = source("A.vb");

        CliResult result = execute("convert", "--source", a.toString(), "--target-lang", "COBOL");

        assertThat(result.exitCode()).isEqualTo(ExitCodes.CONFIGURATION);
        assertThat(result.output()).contains("UNSUPPORTED_LANGUAGE");
        verifyNoInteractions(orchestrator);
    }

    @Test
    void convert_outputWithSeveralSources_isRejected() throws Exception {
        CliResult result = execute("convert", "-s", source("A.vb").toString(), "-s", source("B.vb").toString(),
                "-t", "JAVA", "--output", tmp.resolve("A.java").toString());

        assertThat(result.exitCode()).isEqualTo(ExitCodes.CONFIGURATION);
        verifyNoInteractions(orchestrator);
    }

    @Test
    void convert_configurationErrorDuringPreflight_exits2() throws Exception {
        when(orchestrator.run(any())).thenThrow(new ConfigurationException(
                ConfigurationException.Kind.MISSING_CREDENTIAL, "No API key configured"));

        CliResult result = execute("convert", "-s", source("A.vb").toString(), "-t", "JAVA");

        assertThat(result.exitCode()).isEqualTo(2);
        assertThat(result.output()).contains("MISSING_CREDENTIAL");
    }

    @Test
    void convert_allValidated_exits0AndPassesOptions() throws Exception {
        when(orchestrator.run(any())).thenReturn(reportOf());
        Path a = source("A.vb");

        CliResult result = execute("convert", "--source", a.toString(), "--target-lang", "csharp",
                "--max-retries", "1", "--output-dir", tmp.resolve("out").toString());

        assertThat(result.exitCode()).isEqualTo(ExitCodes.OK);
        ArgumentCaptor<ConversionRequest> captor = ArgumentCaptor.forClass(ConversionRequest.class);
        verify(orchestrator).run(captor.capture());
        ConversionRequest request = captor.getValue();
        assertThat(request.runId()).isEqualTo("8123456789");
        assertThat(request.model()).isEqualTo("gpt-4-turbo");
        assertThat(request.targetLanguage()).isEqualTo(TargetLanguage.CSHARP);
        assertThat(request.maxRetries()).isEqualTo(1);
        assertThat(request.outputFor(a)).isEqualTo(tmp.resolve("out").resolve("A.cs"));
    }

    @Test
    void convert_exitCodeFollowsFirstRejectedStage() throws Exception {
        Path a = source("A.vb");
        Object[][] cases = {
                {JobState.INVOKING,   FailureReason.EXHAUSTED_RETRIES,   3},
                {JobState.EXTRACTING, FailureReason.NO_CODE_BLOCK_FOUND, 4},
                {JobState.VALIDATING, FailureReason.VALIDATION_FAILED,   5},
                {JobState.ASSEMBLING, FailureReason.SOURCE_UNREADABLE,   6},
        };
        for (Object[] c : cases) {
            when(orchestrator.run(any())).thenReturn(reportOf(
                    rejectedAt((JobState) c[0], (FailureReason) c[1]),
                    rejectedAt(JobState.INVOKING, FailureReason.REJECTED_REQUEST)));

            CliResult result = execute("convert", "-s", a.toString(), "-s", a.toString(), "-t", "JAVA");

            assertThat(result.exitCode()).as("stage %s", c[0]).isEqualTo(c[2]);
        }
    }

    @Test
    void convert_reportOption_writesJsonReport() throws Exception {
        when(orchestrator.run(any())).thenReturn(reportOf(
                rejectedAt(JobState.EXTRACTING, FailureReason.NO_CODE_BLOCK_FOUND)));
        Path reportFile = tmp.resolve("reports/run.json");

        CliResult result = execute("convert", "-s", source("A.vb").toString(), "-t", "JAVA",
                "--report", reportFile.toString());

        assertThat(result.exitCode()).isEqualTo(ExitCodes.EXTRACTION);
        JsonNode json = mapper.readTree(reportFile.toFile());
        assertThat(json.get("runId").asText()).isEqualTo("8123456789");
        assertThat(json.get("verdict").asText()).isEqualTo("FAIL");
        assertThat(json.get("startedAt").asText()).isEqualTo("2026-01-15T09:30:00Z");
        assertThat(json.get("jobs").get(0).get("reason").asText()).isEqualTo("NO_CODE_BLOCK_FOUND");
    }

    // =====================================================================
    // validate
    // =====================================================================

    @Test
    void validate_missingDirectory_succeeds() {
        CliResult result = execute("validate", tmp.resolve("nowhere").toString());

        assertThat(result.exitCode()).isZero();
        assertThat(result.output()).contains("No converted files");
    }

    @Test
    void validate_brokenFile_exits1WithDiagnostic() throws Exception {
        Path dir = Files.createDirectories(tmp.resolve("src/generated"));
        String header = new GovernanceHeader("1", "A.vb", "m", NOW, "h").render("//");
        Files.writeString(dir.resolve("Good.java"), header + "\nclass Good {}\n");
        Files.writeString(dir.resolve("Bad.cs"), header + "\nclass Bad {\n");

        CliResult result = execute("validate");

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.output()).contains("FAIL").contains("Bad.cs").contains("BALANCED_DELIMITERS");
        assertThat(result.output()).contains("PASS").contains("Good.java");
    }
}
