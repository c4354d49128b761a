package com.codeshift.converter.extract;

import com.codeshift.converter.model.ExtractedArtifact;
import com.codeshift.converter.model.TargetLanguage;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Isolates the code payload from a model reply.
 *
 * Only fenced blocks count as code; prose before, between and after them
 * is dropped. When the model splits its answer over several blocks, the
 * blocks are joined in document order as long as they belong to the same
 * compilation unit as the first one, i.e. carry the same language tag
 * (aliases such as cs / csharp / c# count as the same tag). Blocks in any
 * other language (a shell snippet, an XML config) are discarded.
 */
public class ResponseExtractor {

    // ```lang (optional tag, anything else on the fence line ignored) ... ```
    private static final Pattern CODE_BLOCK = Pattern.compile(
            "```([\\w#+.-]*)[^\\n]*\\n(.*?)```",
            Pattern.DOTALL
    );

    private ResponseExtractor() {}

    public record CodeBlock(String tag, String code) {}

    /**
     * Extract the code artifact, or empty when the reply has no fenced block.
     */
    public static Optional<ExtractedArtifact> extract(String response, String promptHash) {
        List<CodeBlock> blocks = findBlocks(response);
        if (blocks.isEmpty()) {
            return Optional.empty();
        }

        String unit = normalizeTag(blocks.get(0).tag());
        List<String> parts = blocks.stream()
                .filter(b -> normalizeTag(b.tag()).equals(unit))
                .map(CodeBlock::code)
                .filter(code -> !code.isBlank())
                .toList();
        if (parts.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ExtractedArtifact(String.join("\n\n", parts), promptHash, parts.size()));
    }

    /** All fenced blocks in document order. */
    public static List<CodeBlock> findBlocks(String response) {
        List<CodeBlock> blocks = new ArrayList<>();
        if (response == null) {
            return blocks;
        }
        Matcher m = CODE_BLOCK.matcher(response);
        while (m.find()) {
            blocks.add(new CodeBlock(m.group(1), m.group(2).strip()));
        }
        return blocks;
    }

    private static String normalizeTag(String tag) {
        return TargetLanguage.forFenceTag(tag)
                .map(TargetLanguage::name)
                .orElse(tag.toLowerCase(Locale.ROOT));
    }
}
