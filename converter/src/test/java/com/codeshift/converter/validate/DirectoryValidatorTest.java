package com.codeshift.converter.validate;

import com.codeshift.converter.governance.GovernanceHeader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class DirectoryValidatorTest {

    final DirectoryValidator validator = new DirectoryValidator(new StructuralValidator());

    private static String stamped(String code) {
        return new GovernanceHeader("run-1", "Calc.vb", "gpt-4-turbo",
                Instant.parse("2026-01-15T09:30:00Z"), "hash").render("//") + "\n" + code + "\n";
    }

    @Test
    void validate_missingDirectory_isEmptySuccess(@TempDir Path tmp) {
        DirectoryValidator.Report report = validator.validate(tmp.resolve("src/generated"));

        assertThat(report.files()).isEmpty();
        assertThat(report.passed()).isTrue();
    }

    @Test
    void validate_onlyUnrecognizedFiles_isEmptySuccess(@TempDir Path tmp) throws Exception {
        Files.writeString(tmp.resolve("README.md"), "# generated");
        Files.writeString(tmp.resolve("Calc.vb"), "Module Calc");

        DirectoryValidator.Report report = validator.validate(tmp);

        assertThat(report.files()).isEmpty();
        assertThat(report.passed()).isTrue();
    }

    @Test
    void validate_mixedFiles_reportsOnlyFailures(@TempDir Path tmp) throws Exception {
        Files.writeString(tmp.resolve("Good.cs"), stamped("public class Good { }"));
        Files.writeString(tmp.resolve("Bad.java"), stamped("public class Bad {"));
        Files.writeString(tmp.resolve("NoHeader.java"), "public class NoHeader { }");

        DirectoryValidator.Report report = validator.validate(tmp);

        assertThat(report.files()).hasSize(3);
        assertThat(report.passed()).isFalse();
        assertThat(report.failures())
                .extracting(f -> f.file().getFileName().toString())
                .containsExactly("Bad.java", "NoHeader.java");
        assertThat(report.failures().get(0).diagnostic())
                .startsWith("FAIL ")
                .contains("BALANCED_DELIMITERS");
    }

    @Test
    void validate_fileNotUtf8_failsThatFileAndKeepsScanning(@TempDir Path tmp) throws Exception {
        Files.writeString(tmp.resolve("A.java"), stamped("public class A { }"));
        Files.write(tmp.resolve("B.java"), new byte[] {'c', 'l', 'a', 's', 's', ' ', (byte) 0xE9, '{', '}'});
        Files.writeString(tmp.resolve("C.java"), stamped("public class C { }"));

        DirectoryValidator.Report report = validator.validate(tmp);

        assertThat(report.files()).hasSize(3);
        assertThat(report.passed()).isFalse();
        assertThat(report.failures()).hasSize(1);
        DirectoryValidator.FileResult bad = report.failures().get(0);
        assertThat(bad.file().getFileName().toString()).isEqualTo("B.java");
        assertThat(bad.diagnostic()).startsWith("FAIL ").contains("unreadable");
        assertThat(report.files().get(2).passed()).isTrue();
    }

    @Test
    void validate_subdirectoriesAreNotScanned(@TempDir Path tmp) throws Exception {
        Path nested = Files.createDirectories(tmp.resolve("old"));
        Files.writeString(nested.resolve("Broken.cs"), "class Broken {");

        assertThat(validator.validate(tmp).files()).isEmpty();
    }
}
