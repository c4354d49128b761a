package com.codeshift.converter.validate;

import com.codeshift.converter.governance.GovernanceHeader;
import com.codeshift.converter.governance.GovernanceStamper;
import com.codeshift.converter.model.StampedArtifact;
import com.codeshift.converter.model.TargetLanguage;
import com.codeshift.converter.model.ValidationOutcome;
import com.codeshift.converter.model.Violation;
import com.codeshift.converter.model.Violation.Check;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Language-agnostic syntactic admission gate for generated code.
 *
 * Checks, always all three so every violation is reported:
 *   1. BALANCED_DELIMITERS         as many '{' as '}'
 *   2. DECLARATION_PRESENT         at least one type/module declaration keyword
 *   3. GOVERNANCE_HEADER_PRESENT   the header block is intact
 *
 * These are heuristics: they catch truncated or chatty model output, not
 * compile errors.
 */
@Component
public class StructuralValidator {

    private static final Map<TargetLanguage, Pattern> DECLARATION = new EnumMap<>(Map.of(
            TargetLanguage.JAVA,
            Pattern.compile("\\b(class|interface|enum|record)\\s+[A-Za-z_$][\\w$]*"),
            TargetLanguage.CSHARP,
            Pattern.compile("\\b(class|interface|struct|enum|record|namespace)\\s+[A-Za-z_@][\\w.]*")
    ));

    /**
     * Validate a freshly stamped artifact. The header check requires the
     * exact header block the stamper produced.
     */
    public ValidationOutcome validate(StampedArtifact artifact, TargetLanguage language) {
        List<Violation> violations = new ArrayList<>();
        checkDelimiters(artifact.content(), violations);
        checkDeclaration(artifact.content(), language, violations);
        if (!artifact.content().contains(artifact.headerBlock())) {
            violations.add(new Violation(Check.GOVERNANCE_HEADER_PRESENT,
                    "Stamped header block not found verbatim"));
        }
        return new ValidationOutcome(violations);
    }

    /**
     * Validate a staged file whose header values are unknown: any complete,
     * well-ordered header block satisfies the header check.
     */
    public ValidationOutcome validate(String content, TargetLanguage language) {
        List<Violation> violations = new ArrayList<>();
        checkDelimiters(content, violations);
        checkDeclaration(content, language, violations);
        if (GovernanceHeader.parse(content, GovernanceStamper.commentPrefix(language)).isEmpty()) {
            violations.add(new Violation(Check.GOVERNANCE_HEADER_PRESENT,
                    "No complete '" + GovernanceHeader.MARKER + "' header block"));
        }
        return new ValidationOutcome(violations);
    }

    // ------------------------------------------------------------------
    // Checks
    // ------------------------------------------------------------------

    private static void checkDelimiters(String content, List<Violation> violations) {
        long open  = content.chars().filter(c -> c == '{').count();
        long close = content.chars().filter(c -> c == '}').count();
        if (open != close) {
            violations.add(new Violation(Check.BALANCED_DELIMITERS,
                    "Unbalanced braces: %d '{' vs %d '}'".formatted(open, close)));
        }
    }

    private static void checkDeclaration(String content, TargetLanguage language, List<Violation> violations) {
        if (!DECLARATION.get(language).matcher(content).find()) {
            violations.add(new Violation(Check.DECLARATION_PRESENT,
                    "No " + language + " type or module declaration found"));
        }
    }
}
