package com.purchasingpower.autoreview.service;

import com.purchasingpower.autoreview.config.SuggestionFilterConfig;
import com.purchasingpower.autoreview.model.review.Suggestion;
import com.purchasingpower.autoreview.util.SequenceMatcher;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Drops suggestions a reviewer could not act on: praise, pure observations, and replacements
 * that change nothing.
 *
 * <p>Rules, first hit wins:
 * <ol>
 *   <li>empty comment</li>
 *   <li>no suggested code</li>
 *   <li>no existing code, when the policy is {@code DROP}</li>
 *   <li>suggested code identical to existing code after normalization</li>
 *   <li>praise without any criticism or actionable verb</li>
 *   <li>neither criticism nor an actionable verb</li>
 * </ol>
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SuggestionFilterService {

    private static final Pattern POSITIVE = anyOf(
            "\\b(good|great|excellent|nice|well done|perfect|correctly|properly)\\b",
            "\\b(looks good|lgtm|ship it|no issues|no problems)\\b",
            "\\b(appropriate|suitable|adequate|sufficient)\\b",
            "\\bthis is (a )?(good|great|correct|proper)\\b",
            "\\b(correctly (implemented|handled|used))\\b",
            "\\b(proper(ly)? (implemented|handled|used))\\b",
            "\\b(already|currently) (correct|good|proper|fine)\\b",
            "\\bno (changes?|improvements?|modifications?) (needed|required|necessary)\\b",
            "\\bkeep (it |this )?(as is|unchanged)\\b");

    private static final Pattern NEGATIVE = anyOf(
            "\\b(bug|error|issue|problem|flaw|vulnerability)\\b",
            "\\b(should|could|might|consider|recommend|suggest)\\b",
            "\\b(missing|lacks?|needs?|requires?)\\b",
            "\\b(incorrect|wrong|invalid|broken|fails?)\\b",
            "\\b(improve|fix|refactor|optimize|simplify)\\b",
            "\\b(avoid|don'?t|shouldn'?t|never)\\b",
            "\\b(instead|rather|better|prefer)\\b",
            "\\b(risk|dangerous|unsafe|insecure)\\b",
            "\\b(redundant|unnecessary|unused|dead)\\b",
            "\\b(inconsistent|confusing|unclear|ambiguous)\\b");

    private static final Pattern ACTIONABLE = anyOf(
            "\\b(add|guard|validate|handle|ensure|remove)\\b",
            "\\b(refactor|rename|extract|simplify|split|inline)\\b",
            "\\b(catch|raise|throw|document)\\b",
            "\\b(check|return|log|move)\\s+\\w+",
            "\\b(replace|reorder|restructure)\\b",
            "\\buse\\s+(a|an|the|\\w+ing)\\b",
            "\\bavoid\\s+\\w+");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final SuggestionFilterConfig config;

    public FilterOutcome filter(List<Suggestion> suggestions) {
        List<Suggestion> kept = new ArrayList<>();
        List<Removal> removed = new ArrayList<>();

        for (Suggestion suggestion : suggestions) {
            String reason = rejectionReason(suggestion);
            if (reason == null) {
                kept.add(suggestion);
            } else {
                log.info("Filtered out suggestion {}: {}", suggestion.describe(), reason);
                removed.add(new Removal(suggestion, reason));
            }
        }

        log.info("Suggestion filter: kept {}, removed {} of {}", kept.size(), removed.size(), suggestions.size());
        return new FilterOutcome(Collections.unmodifiableList(kept), Collections.unmodifiableList(removed));
    }

    /**
     * @return why the suggestion is not actionable, or null to keep it
     */
    String rejectionReason(Suggestion suggestion) {
        if (isBlank(suggestion.getComment())) {
            return "empty comment";
        }
        if (isBlank(suggestion.getSuggestedCode())) {
            return "no suggested code";
        }
        if (!suggestion.hasExistingCode()) {
            switch (config.getMissingExistingCode()) {
                case DROP:
                    return "missing existing code";
                case WARN:
                    log.warn("⚠️ Suggestion {} has no existing code; keeping it per policy", suggestion.describe());
                    break;
                default:
                    break;
            }
        } else if (isCodeIdentical(suggestion.getExistingCode(), suggestion.getSuggestedCode())) {
            return "suggested code identical to existing code";
        }

        String comment = suggestion.getComment();
        boolean critical = NEGATIVE.matcher(comment).find();
        boolean actionable = ACTIONABLE.matcher(comment).find();
        if (!critical && !actionable) {
            return POSITIVE.matcher(comment).find()
                    ? "positive-only comment without actionable feedback"
                    : "informational comment without actionable feedback";
        }
        return null;
    }

    boolean isCodeIdentical(String existing, String suggested) {
        String a = normalizeCode(existing);
        String b = normalizeCode(suggested);
        if (a.equals(b)) {
            return true;
        }
        return SequenceMatcher.ratio(a, b) > config.getIdenticalCodeThreshold();
    }

    private static String normalizeCode(String code) {
        List<String> lines = new ArrayList<>();
        for (String line : code.strip().split("\\R")) {
            if (!line.isEmpty() && (line.charAt(0) == '+' || line.charAt(0) == '-')) {
                line = line.substring(1);
            }
            String normalized = WHITESPACE.matcher(line.strip()).replaceAll(" ");
            if (!normalized.isEmpty()) {
                lines.add(normalized);
            }
        }
        return String.join("\n", lines);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static Pattern anyOf(String... patterns) {
        return Pattern.compile(String.join("|", patterns), Pattern.CASE_INSENSITIVE);
    }

    /**
     * Kept suggestions in input order, and removed ones with the reason.
     */
    @Value
    public static class FilterOutcome {
        List<Suggestion> kept;
        List<Removal> removed;
    }

    @Value
    public static class Removal {
        Suggestion suggestion;
        String reason;
    }
}
