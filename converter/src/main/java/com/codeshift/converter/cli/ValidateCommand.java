package com.codeshift.converter.cli;

import com.codeshift.converter.config.ConverterProperties;
import com.codeshift.converter.validate.DirectoryValidator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: codeshift validate [dir]
 * <p>
 * Re-runs the structural checks over already staged artifacts. A missing
 * directory, or one without .cs/.java files, passes.
 */
@Command(name = "validate", mixinStandardHelpOptions = true,
        description = "Re-validate converted files in a directory")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1",
            description = "Directory to check (default: codeshift.output-dir)")
    private Path directory;

    private final DirectoryValidator  validator;
    private final ConverterProperties properties;

    public ValidateCommand(DirectoryValidator validator, ConverterProperties properties) {
        this.validator  = validator;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        Path dir = directory != null ? directory : Path.of(properties.getOutputDir());
        DirectoryValidator.Report report = validator.validate(dir);

        if (report.files().isEmpty()) {
            ConsoleOutput.info("No converted files found in " + dir);
            return ExitCodes.OK;
        }
        for (DirectoryValidator.FileResult result : report.files()) {
            if (result.passed()) {
                ConsoleOutput.success(result.diagnostic());
            } else {
                ConsoleOutput.error(result.diagnostic());
            }
        }
        if (report.passed()) {
            ConsoleOutput.success(report.files().size() + " file(s) passed");
            return ExitCodes.OK;
        }
        ConsoleOutput.error(report.failures().size() + " of " + report.files().size() + " file(s) failed");
        return ExitCodes.FAILURE;
    }
}
