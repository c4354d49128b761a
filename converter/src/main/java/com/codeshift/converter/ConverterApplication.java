package com.codeshift.converter;

import com.codeshift.converter.cli.CliRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

/**
 * Entry point. {@code serve} starts the embedded web server for the run API;
 * every other command runs once through picocli and exits with its code.
 */
@SpringBootApplication
public class ConverterApplication {

    public static void main(String[] args) {
        boolean serveMode = CliRunner.isServeMode(args);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(ConverterApplication.class);
        builder.properties(
                "spring.main.web-application-type=" + (serveMode ? "servlet" : "none"),
                "spring.main.banner-mode=off"
        );

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            System.exit(SpringApplication.exit(ctx, exitCodeGen));
        }
    }
}
