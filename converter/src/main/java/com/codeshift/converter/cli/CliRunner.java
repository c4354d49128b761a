package com.codeshift.converter.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Runs one codeshift command per process. Serve mode is left alone: there
 * the embedded web server keeps the process alive and this runner does
 * nothing.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final List<String> HELP_FLAGS = List.of("-h", "--help");

    private final CodeShiftCommand rootCommand;
    private final IFactory         factory;
    private int exitCode;

    public CliRunner(CodeShiftCommand rootCommand, IFactory factory) {
        this.rootCommand = rootCommand;
        this.factory     = factory;
    }

    /**
     * True when the arguments start the REST server: {@code serve} in the
     * subcommand position, without a help flag. A later "serve" (an option
     * value or a file name) never counts.
     */
    public static boolean isServeMode(String... args) {
        return args.length > 0
                && "serve".equals(args[0])
                && Arrays.stream(args).noneMatch(HELP_FLAGS::contains);
    }

    @Override
    public void run(String... args) {
        if (isServeMode(args)) {
            return;
        }
        exitCode = new CommandLine(rootCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
