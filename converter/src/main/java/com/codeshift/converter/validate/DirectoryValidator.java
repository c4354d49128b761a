package com.codeshift.converter.validate;

import com.codeshift.converter.model.TargetLanguage;
import com.codeshift.converter.model.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Re-runs the structural checks over a directory of staged artifacts,
 * e.g. as a pre-commit gate on src/generated.
 *
 * Only files with a recognized extension (.cs, .java) directly inside the
 * directory are checked. A missing directory, or one with no recognized
 * files, is a successful no-op.
 */
@Component
public class DirectoryValidator {

    private static final Logger log = LoggerFactory.getLogger(DirectoryValidator.class);

    private final StructuralValidator validator;

    public DirectoryValidator(StructuralValidator validator) {
        this.validator = validator;
    }

    /**
     * Verdict for one file. {@code readError} is set when the file could not
     * be read as UTF-8 text; {@code outcome} is null in that case.
     */
    public record FileResult(Path file, TargetLanguage language, ValidationOutcome outcome, String readError) {

        static FileResult checked(Path file, TargetLanguage language, ValidationOutcome outcome) {
            return new FileResult(file, language, outcome, null);
        }

        static FileResult unreadable(Path file, TargetLanguage language, IOException cause) {
            return new FileResult(file, language, null, cause.getClass().getSimpleName()
                    + (cause.getMessage() == null ? "" : ": " + cause.getMessage()));
        }

        public boolean passed() {
            return readError == null && outcome.passed();
        }

        /** One-line diagnostic, e.g. "FAIL src/generated/A.java: BALANCED_DELIMITERS: ..." */
        public String diagnostic() {
            if (readError != null) {
                return "FAIL " + file + ": unreadable: " + readError;
            }
            if (outcome.passed()) {
                return "PASS " + file;
            }
            return "FAIL " + file + ": " + outcome.violations().stream()
                    .map(Object::toString)
                    .collect(Collectors.joining("; "));
        }
    }

    public record Report(Path directory, List<FileResult> files) {

        public boolean passed() {
            return files.stream().allMatch(FileResult::passed);
        }

        public List<FileResult> failures() {
            return files.stream().filter(f -> !f.passed()).toList();
        }
    }

    public Report validate(Path directory) {
        if (!Files.isDirectory(directory)) {
            log.info("No generated code found at {}, skipping validation", directory);
            return new Report(directory, List.of());
        }

        List<FileResult> results = new ArrayList<>();
        try (Stream<Path> entries = Files.list(directory)) {
            for (Path file : entries.filter(Files::isRegularFile).sorted().toList()) {
                Optional<TargetLanguage> language = TargetLanguage.forFileName(file.getFileName().toString());
                if (language.isEmpty()) {
                    continue;
                }
                FileResult result = check(file, language.get());
                log.debug("{}", result.diagnostic());
                results.add(result);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list " + directory, e);
        }

        Report report = new Report(directory, results);
        log.info("Validated {} file(s) in {}: {} failed",
                results.size(), directory, report.failures().size());
        return report;
    }

    private FileResult check(Path file, TargetLanguage language) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.toString());
            return FileResult.unreadable(file, language, e);
        }
        return FileResult.checked(file, language, validator.validate(content, language));
    }
}
