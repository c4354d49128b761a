package com.codeshift.converter.extract;

import com.codeshift.converter.model.ExtractedArtifact;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ResponseExtractor.
 *
 * Static methods only, so no Spring context and no mocks.
 */
class ResponseExtractorTest {

    // ------------------------------------------------------------------
    // Single block
    // ------------------------------------------------------------------

    @Test
    void extract_singleTaggedBlock_stripsSurroundingProse() {
        String response = """
                Here is the converted class:
                ```csharp
                public class Calculator { }
                ```
                Let me know if you need anything else.
                """;

        Optional<ExtractedArtifact> artifact = ResponseExtractor.extract(response, "hash");

        assertThat(artifact).isPresent();
        assertThat(artifact.get().code()).isEqualTo("public class Calculator { }");
        assertThat(artifact.get().promptHash()).isEqualTo("hash");
        assertThat(artifact.get().blockCount()).isEqualTo(1);
    }

    @Test
    void extract_untaggedBlock_returnsCode() {
        String response = """
                ```
                class A {}
                ```
                """;
        assertThat(ResponseExtractor.extract(response, "h")).get()
                .extracting(ExtractedArtifact::code).isEqualTo("class A {}");
    }

    @Test
    void extract_noFence_returnsEmpty() {
        assertThat(ResponseExtractor.extract("public class A {}", "h")).isEmpty();
        assertThat(ResponseExtractor.extract("", "h")).isEmpty();
        assertThat(ResponseExtractor.extract(null, "h")).isEmpty();
    }

    @Test
    void extract_unterminatedFence_returnsEmpty() {
        String response = """
                ```java
                class Truncated {
                """;
        assertThat(ResponseExtractor.extract(response, "h")).isEmpty();
    }

    @Test
    void extract_emptyBlock_returnsEmpty() {
        String response = "```java\n\n```";
        assertThat(ResponseExtractor.extract(response, "h")).isEmpty();
    }

    // ------------------------------------------------------------------
    // Several blocks
    // ------------------------------------------------------------------

    @Test
    void extract_sameLanguageBlocks_joinedInDocumentOrder() {
        String response = """
                First the model:
                ```java
                record Point(int x, int y) {}
                ```
                Then the service:
                ```java
                class PointService {}
                ```
                """;

        ExtractedArtifact artifact = ResponseExtractor.extract(response, "h").orElseThrow();

        assertThat(artifact.blockCount()).isEqualTo(2);
        assertThat(artifact.code()).isEqualTo("record Point(int x, int y) {}\n\nclass PointService {}");
    }

    @Test
    void extract_languageAliases_countAsOneUnit() {
        String response = """
                ```cs
                namespace Legacy {
                ```
                ```c#
                }
                ```
                """;

        ExtractedArtifact artifact = ResponseExtractor.extract(response, "h").orElseThrow();

        assertThat(artifact.blockCount()).isEqualTo(2);
        assertThat(artifact.code()).contains("namespace Legacy {").endsWith("}");
    }

    @Test
    void extract_otherLanguageBlocks_areDropped() {
        String response = """
                ```csharp
                public class Calculator { }
                ```
                Build it with:
                ```bash
                dotnet build
                ```
                """;

        ExtractedArtifact artifact = ResponseExtractor.extract(response, "h").orElseThrow();

        assertThat(artifact.code()).doesNotContain("dotnet");
        assertThat(artifact.blockCount()).isEqualTo(1);
    }

    @Test
    void findBlocks_keepsTagsAndOrder() {
        String response = "```xml\n<a/>\n```\ntext\n```java\nclass A {}\n```";

        assertThat(ResponseExtractor.findBlocks(response))
                .extracting(ResponseExtractor.CodeBlock::tag)
                .containsExactly("xml", "java");
    }
}
