package com.purchasingpower.autoreview.service.mapping;

import com.purchasingpower.autoreview.model.diff.DiffLine;
import com.purchasingpower.autoreview.model.diff.LineRef;
import com.purchasingpower.autoreview.model.diff.ParsedFileDiff;
import com.purchasingpower.autoreview.util.CodeNormalizer;
import com.purchasingpower.autoreview.util.SequenceMatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the block of diff lines that best matches a quoted code snippet.
 *
 * <p>A window as tall as the snippet slides over every line of the file's diff, context lines
 * and hunk boundaries included. Each window is normalized like the snippet and scored with
 * {@link SequenceMatcher#ratio(String, String)}. The first best-scoring window wins ties.
 */
final class FuzzyBlockMatcher {

    private final double threshold;

    FuzzyBlockMatcher(double threshold) {
        this.threshold = threshold;
    }

    /**
     * @param snippetLines normalized, non-blank snippet lines
     * @return the best window scoring at least the threshold
     */
    Optional<BlockMatch> findBestBlock(ParsedFileDiff file, List<String> snippetLines) {
        List<DiffLine> lines = file.getAllLines();
        int height = snippetLines.size();
        if (height == 0 || lines.size() < height) {
            return Optional.empty();
        }
        String needle = String.join("\n", snippetLines);

        int bestStart = -1;
        double bestScore = -1.0;
        for (int start = 0; start + height <= lines.size(); start++) {
            double score = SequenceMatcher.ratio(window(lines, start, height), needle);
            if (score > bestScore) {
                bestScore = score;
                bestStart = start;
            }
        }
        if (bestStart < 0 || bestScore < threshold) {
            return Optional.empty();
        }
        return Optional.of(new BlockMatch(
                lines.get(bestStart),
                lines.get(bestStart + height - 1),
                bestScore,
                lastCommentable(lines, bestStart, height)));
    }

    private static String window(List<DiffLine> lines, int start, int height) {
        List<String> normalized = new ArrayList<>(height);
        for (int i = start; i < start + height; i++) {
            String text = CodeNormalizer.normalizeContent(lines.get(i).getContent());
            if (!text.isEmpty()) {
                normalized.add(text);
            }
        }
        return String.join("\n", normalized);
    }

    private static LineRef lastCommentable(List<DiffLine> lines, int start, int height) {
        for (int i = start + height - 1; i >= start; i--) {
            DiffLine line = lines.get(i);
            if (line.isCommentable()) {
                return line.getAnchorRef();
            }
        }
        return null;
    }

    /**
     * @param lastCommentable last added/removed line of the block, null when the block is
     *                        context only
     */
    record BlockMatch(
            DiffLine first,
            DiffLine last,
            double score,
            LineRef lastCommentable
    ) {
    }
}
