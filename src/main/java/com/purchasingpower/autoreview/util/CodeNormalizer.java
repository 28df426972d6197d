package com.purchasingpower.autoreview.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Normalizes code text so that snippets quoted by the model can be compared with diff lines.
 *
 * @since 1.0.0
 */
public final class CodeNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // "...", "…" and comment lines made only of them, e.g. "// ..." or "# …"
    private static final Pattern ELLIPSIS_ONLY_LINE =
            Pattern.compile("^(?:(?://|#|/\\*|\\*|--)\\s*)?(?:\\.{3,}|…)+\\s*(?:\\*/)?$");

    private CodeNormalizer() {
    }

    /**
     * Drops the single leading diff marker ({@code +}, {@code -} or space) of a raw diff line,
     * then trims and collapses whitespace.
     */
    public static String normalizeDiffLine(String rawLine) {
        if (rawLine == null || rawLine.isEmpty()) {
            return "";
        }
        char first = rawLine.charAt(0);
        String body = (first == '+' || first == '-' || first == ' ') ? rawLine.substring(1) : rawLine;
        return collapse(body);
    }

    /**
     * Normalizes one line of code, from a diff line's content or from a quoted snippet.
     * Lines made only of an ellipsis, optionally inside a comment, normalize to the empty string.
     */
    public static String normalizeContent(String content) {
        if (content == null) {
            return "";
        }
        String collapsed = collapse(content);
        return ELLIPSIS_ONLY_LINE.matcher(collapsed).matches() ? "" : collapsed;
    }

    /**
     * Splits a model-quoted snippet into normalized, non-blank lines, each normalized exactly
     * like a diff line's content.
     */
    public static List<String> normalizeSnippet(String snippet) {
        List<String> result = new ArrayList<>();
        if (snippet == null) {
            return result;
        }
        for (String line : snippet.split("\\R")) {
            String normalized = normalizeContent(line);
            if (!normalized.isEmpty()) {
                result.add(normalized);
            }
        }
        return result;
    }

    /**
     * The ways a snippet may be read: verbatim first, then without a leading {@code +}/{@code -}
     * when every code line of the snippet starts with one, as when diff lines are copied with
     * their markers.
     *
     * @return empty when the snippet has no code lines
     */
    public static List<List<String>> snippetVariants(String snippet) {
        List<List<String>> variants = new ArrayList<>();
        List<String> verbatim = normalizeSnippet(snippet);
        if (verbatim.isEmpty()) {
            return variants;
        }
        variants.add(verbatim);

        List<String> unmarked = new ArrayList<>();
        for (String line : snippet.split("\\R")) {
            if (normalizeContent(line).isEmpty()) {
                continue;
            }
            String code = line.stripLeading();
            if (code.charAt(0) != '+' && code.charAt(0) != '-') {
                return variants;
            }
            String normalized = normalizeContent(code.substring(1));
            if (!normalized.isEmpty()) {
                unmarked.add(normalized);
            }
        }
        if (!unmarked.isEmpty() && !unmarked.equals(verbatim)) {
            variants.add(unmarked);
        }
        return variants;
    }

    /**
     * Lower-cased, whitespace-collapsed text for comparing free-form comments and code.
     */
    public static String normalizeText(String text) {
        return text == null ? "" : collapse(text).toLowerCase();
    }

    private static String collapse(String text) {
        return WHITESPACE.matcher(text.strip()).replaceAll(" ");
    }
}
