package com.codeshift.converter.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
        name = "codeshift",
        mixinStandardHelpOptions = true,
        version = "codeshift 0.1.0",
        description = "Converts legacy source files with a language model and validates the result",
        subcommands = {
                ConvertCommand.class,
                ValidateCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CodeShiftCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // Reuse the configured CommandLine so subcommands keep their injected dependencies.
        spec.commandLine().usage(System.out);
    }
}
