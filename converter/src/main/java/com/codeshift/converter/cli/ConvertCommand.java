package com.codeshift.converter.cli;

import com.codeshift.converter.config.ConfigurationException;
import com.codeshift.converter.config.ConverterProperties;
import com.codeshift.converter.model.ConversionRequest;
import com.codeshift.converter.model.RunReport;
import com.codeshift.converter.model.TargetLanguage;
import com.codeshift.converter.service.ConversionOrchestrator;
import com.codeshift.converter.service.StagingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: codeshift convert --source a.vb --source b.vb --target-lang CSHARP
 * <p>
 * Runs every source through the conversion pipeline in order and exits
 * with {@link ExitCodes#OK} only when every job validated.
 */
@Command(name = "convert", mixinStandardHelpOptions = true,
        description = "Convert legacy source files into the target language")
@Component
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Option(names = {"--source", "-s"}, required = true,
            description = "Legacy source file; repeat for several files")
    private List<Path> sources;

    @Option(names = {"--target-lang", "-t"}, required = true,
            description = "Target language: CSHARP or JAVA")
    private String targetLang;

    @Option(names = {"--model", "-m"}, defaultValue = "gpt-4-turbo",
            description = "Model identifier (default: ${DEFAULT-VALUE})")
    private String model;

    @Option(names = {"--output", "-o"},
            description = "Artifact path; only valid with a single --source")
    private Path output;

    @Option(names = "--output-dir",
            description = "Directory for artifacts (default: codeshift.output-dir)")
    private Path outputDir;

    @Option(names = "--max-retries",
            description = "Gateway retry budget for this run (default: codeshift.retry.max-retries)")
    private Integer maxRetries;

    @Option(names = "--report", description = "Write the run report as JSON to this file")
    private Path reportFile;

    private final ConversionOrchestrator orchestrator;
    private final ConverterProperties    properties;
    private final RunReportWriter        reportWriter;

    public ConvertCommand(ConversionOrchestrator orchestrator,
                          ConverterProperties properties,
                          RunReportWriter reportWriter) {
        this.orchestrator = orchestrator;
        this.properties   = properties;
        this.reportWriter = reportWriter;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        ConversionRequest request;
        try {
            TargetLanguage language = TargetLanguage.parse(targetLang);
            request = new ConversionRequest(properties.getRunId(), sources, language, model, output,
                    outputDir != null ? outputDir : Path.of(properties.getOutputDir()), maxRetries);
        } catch (ConfigurationException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.CONFIGURATION;
        }

        ConsoleOutput.info("Converting " + sources.size() + " file(s) to " + request.targetLanguage()
                + " with " + model);

        RunReport report;
        try {
            report = orchestrator.run(request);
        } catch (ConfigurationException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.CONFIGURATION;
        } catch (StagingException e) {
            log.error("Run {} aborted", request.runId(), e);
            ConsoleOutput.error("Run aborted: " + e.getMessage());
            return ExitCodes.FAILURE;
        }

        report.outcomes().forEach(ConsoleOutput::outcome);
        ConsoleOutput.summary(report);

        if (reportFile != null) {
            try {
                reportWriter.write(report, reportFile);
                ConsoleOutput.info("Report written to " + reportFile);
            } catch (IOException e) {
                log.error("Could not write report {}", reportFile, e);
                ConsoleOutput.error("Could not write report: " + e.getMessage());
                return ExitCodes.FAILURE;
            }
        }
        return ExitCodes.forReport(report);
    }
}
