package com.purchasingpower.autoreview.service;

import com.purchasingpower.autoreview.model.review.ExistingComment;
import com.purchasingpower.autoreview.model.review.Suggestion;
import com.purchasingpower.autoreview.util.TextSimilarity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes suggestions the bot already posted on a pull request, so re-reviews of a
 * new push do not repeat themselves.
 *
 * <p>A suggestion duplicates a comment on the same path when the line ranges overlap
 * (allowing {@value #LINE_TOLERANCE} lines of slack) and either the {@code suggestion}
 * blocks are similar or the comment texts are.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class DuplicateSuggestionDetector {

    static final int LINE_TOLERANCE = 3;
    static final double CODE_SIMILARITY_THRESHOLD = 85;
    static final double COMMENT_SIMILARITY_THRESHOLD = 70;
    static final double COMMENT_SIMILARITY_EXACT_RANGE = 60;

    private static final Pattern SUGGESTION_BLOCK = Pattern.compile("```suggestion\\s*\\n(.*?)```", Pattern.DOTALL);

    public List<Suggestion> removeDuplicates(List<Suggestion> suggestions, List<ExistingComment> existingComments) {
        if (existingComments == null || existingComments.isEmpty()) {
            return suggestions;
        }
        List<Suggestion> result = new ArrayList<>(suggestions.size());
        for (Suggestion suggestion : suggestions) {
            if (isDuplicate(suggestion, existingComments)) {
                log.info("Skipping suggestion already posted on {}", suggestion.describe());
            } else {
                result.add(suggestion);
            }
        }
        return result;
    }

    public boolean isDuplicate(Suggestion suggestion, List<ExistingComment> existingComments) {
        if (suggestion.getEndLine() == null) {
            return false;
        }
        int end = suggestion.getEndLine();
        int start = suggestion.getStartLine() != null ? suggestion.getStartLine() : end;

        for (ExistingComment comment : existingComments) {
            if (comment.getLine() == null || !Objects.equals(stripPrefix(comment.getPath()), stripPrefix(suggestion.getFileName()))) {
                continue;
            }
            int commentEnd = comment.getLine();
            int commentStart = comment.getStartLine() != null ? comment.getStartLine() : commentEnd;

            if (!overlaps(start, end, commentStart, commentEnd, LINE_TOLERANCE)) {
                continue;
            }

            String body = comment.getBody() == null ? "" : comment.getBody();
            String postedCode = extractSuggestionCode(body);
            if (postedCode != null && suggestion.getSuggestedCode() != null
                    && TextSimilarity.score(suggestion.getSuggestedCode(), postedCode) >= CODE_SIMILARITY_THRESHOLD) {
                return true;
            }

            double commentSimilarity = TextSimilarity.score(suggestion.getComment(), stripSuggestionBlock(body));
            if (overlaps(start, end, commentStart, commentEnd, 0)
                    && commentSimilarity >= COMMENT_SIMILARITY_EXACT_RANGE) {
                return true;
            }
            if (commentSimilarity >= COMMENT_SIMILARITY_THRESHOLD) {
                return true;
            }
        }
        return false;
    }

    static boolean overlaps(int start, int end, int otherStart, int otherEnd, int tolerance) {
        return start - tolerance <= otherEnd && end + tolerance >= otherStart;
    }

    static String extractSuggestionCode(String body) {
        Matcher m = SUGGESTION_BLOCK.matcher(body);
        return m.find() ? m.group(1).strip() : null;
    }

    private static String stripSuggestionBlock(String body) {
        return SUGGESTION_BLOCK.matcher(body).replaceAll("").strip();
    }

    private static String stripPrefix(String path) {
        if (path == null) {
            return null;
        }
        return path.startsWith("a/") || path.startsWith("b/") ? path.substring(2) : path;
    }
}
