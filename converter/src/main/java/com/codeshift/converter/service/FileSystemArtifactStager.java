package com.codeshift.converter.service;

import com.codeshift.converter.config.ConverterProperties;
import com.codeshift.converter.model.ConversionRequest;
import com.codeshift.converter.model.JobOutcome;
import com.codeshift.converter.model.StampedArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes validated artifacts to the working tree and rejected jobs to
 * {@code <log-dir>/failed_<stem>.log}.
 */
@Component
public class FileSystemArtifactStager implements ArtifactStager {

    private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactStager.class);

    private final Path logDir;

    public FileSystemArtifactStager(ConverterProperties properties) {
        this(Path.of(properties.getLogDir()));
    }

    FileSystemArtifactStager(Path logDir) {
        this.logDir = logDir;
    }

    @Override
    public Path stage(StampedArtifact artifact, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, artifact.content(), StandardCharsets.UTF_8);
            log.info("Generated: {}", target);
            return target;
        } catch (IOException e) {
            throw new StagingException("Could not write artifact " + target, e);
        }
    }

    @Override
    public void recordRejection(JobOutcome.Rejected rejection) {
        Path logFile = logDir.resolve("failed_" + ConversionRequest.stem(Path.of(rejection.sourcePath())) + ".log");
        StringBuilder sb = new StringBuilder()
                .append("Conversion failed for ").append(rejection.sourcePath()).append('\n')
                .append("Stage: ").append(rejection.failedStage()).append('\n')
                .append("Reason: ").append(rejection.reason()).append('\n')
                .append("Detail: ").append(rejection.detail()).append('\n');
        rejection.violations().forEach(v -> sb.append("  - ").append(v).append('\n'));
        try {
            Files.createDirectories(logDir);
            Files.writeString(logFile, sb.toString(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StagingException("Could not write failure log " + logFile, e);
        }
    }
}
