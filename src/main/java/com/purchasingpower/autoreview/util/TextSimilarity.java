package com.purchasingpower.autoreview.util;

import java.util.Arrays;

/**
 * Percentage similarity of free-form text, used when comparing suggestions with
 * already-posted comments.
 *
 * @since 1.0.0
 */
public final class TextSimilarity {

    private TextSimilarity() {
    }

    /**
     * @return 0..100, the better of the plain ratio and the token-sort ratio of the
     *         normalized inputs; 0 when either side is blank
     */
    public static double score(String first, String second) {
        String a = CodeNormalizer.normalizeText(first);
        String b = CodeNormalizer.normalizeText(second);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 100.0;
        }
        double plain = SequenceMatcher.ratio(a, b);
        double sorted = SequenceMatcher.ratio(sortTokens(a), sortTokens(b));
        return Math.max(plain, sorted) * 100.0;
    }

    static String sortTokens(String text) {
        String[] tokens = text.split(" ");
        Arrays.sort(tokens);
        return String.join(" ", tokens);
    }
}
