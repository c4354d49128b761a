package com.codeshift.converter.cli;

import com.codeshift.converter.api.dto.RunReportResponse;
import com.codeshift.converter.model.RunReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Writes a run report as the JSON audit file requested with --report. */
@Component
public class RunReportWriter {

    private final ObjectMapper mapper;

    public RunReportWriter(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public void write(RunReport report, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(target.toFile(), RunReportResponse.from(report));
    }
}
