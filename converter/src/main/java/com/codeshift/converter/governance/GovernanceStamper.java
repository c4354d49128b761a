package com.codeshift.converter.governance;

import com.codeshift.converter.model.ConversionJob;
import com.codeshift.converter.model.ExtractedArtifact;
import com.codeshift.converter.model.StampedArtifact;
import com.codeshift.converter.model.TargetLanguage;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.Map;

/**
 * Prepends the governance header to extracted code.
 *
 * Pure apart from reading the clock: identical inputs produce identical
 * header fields except {@code Generated}. The comment syntax comes from
 * {@link #COMMENT_PREFIX}; adding a target language means adding a row.
 */
@Component
public class GovernanceStamper {

    private static final Map<TargetLanguage, String> COMMENT_PREFIX = new EnumMap<>(Map.of(
            TargetLanguage.CSHARP, "//",
            TargetLanguage.JAVA,   "//"
    ));

    private final Clock clock;

    public GovernanceStamper(Clock clock) {
        this.clock = clock;
    }

    public static String commentPrefix(TargetLanguage language) {
        return COMMENT_PREFIX.get(language);
    }

    public StampedArtifact stamp(ExtractedArtifact artifact, String runId, ConversionJob job) {
        GovernanceHeader header = new GovernanceHeader(
                runId,
                job.getSourcePath().toString(),
                job.getModel(),
                clock.instant().truncatedTo(ChronoUnit.SECONDS),
                artifact.promptHash());

        String headerBlock = header.render(commentPrefix(job.getTargetLanguage()));
        String content     = headerBlock + "\n" + artifact.code() + "\n";
        return new StampedArtifact(artifact, header, headerBlock, content);
    }
}
