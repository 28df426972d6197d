package com.purchasingpower.autoreview.service.mapping;

import com.google.common.base.Preconditions;
import com.purchasingpower.autoreview.config.LineMappingConfig;
import com.purchasingpower.autoreview.model.diff.DiffLine;
import com.purchasingpower.autoreview.model.diff.LineRef;
import com.purchasingpower.autoreview.model.diff.ParsedFileDiff;
import com.purchasingpower.autoreview.model.diff.Side;
import com.purchasingpower.autoreview.model.review.AnchorProvenance;
import com.purchasingpower.autoreview.model.review.ResolvedAnchor;
import com.purchasingpower.autoreview.model.review.Suggestion;
import com.purchasingpower.autoreview.service.format.LineMappingReportGenerator;
import com.purchasingpower.autoreview.util.CodeNormalizer;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves model suggestions to commentable diff positions of one review.
 *
 * <p>Resolution order, first success wins:
 * <ol>
 *   <li>claimed line is commentable and the first line of the existing code matches it:
 *       {@link AnchorProvenance#EXACT_MATCH}</li>
 *   <li>existing code found by fuzzy block search: the anchor moves to the last
 *       added/removed line of the best block</li>
 *   <li>the (possibly moved) line is commentable: {@link AnchorProvenance#LINE_NUMBER_MATCH}
 *       or {@link AnchorProvenance#CONTENT_CORRECTED}</li>
 *   <li>strict resolution stops here</li>
 *   <li>nearest commentable line on the same side within the configured radius, preceding
 *       line first, then the same line number on the other side: {@link AnchorProvenance#ADJUSTED}</li>
 * </ol>
 *
 * <p>Instances never change after construction and may be shared by concurrent callers.
 * Obtain one from {@link LineMapperFactory}.
 *
 * @since 1.0.0
 */
public class LineMapper {

    private final Map<String, ParsedFileDiff> files;
    private final double similarityThreshold;
    private final int nearestLineRadius;
    private final Side defaultSide;
    private final boolean strictByDefault;
    private final FuzzyBlockMatcher blockMatcher;
    private final LineMappingReportGenerator reportGenerator;
    private final Logger log;

    public LineMapper(List<ParsedFileDiff> parsedFiles, LineMappingConfig config,
                      LineMappingReportGenerator reportGenerator, Logger log) {
        Preconditions.checkNotNull(parsedFiles, "parsedFiles");
        Preconditions.checkNotNull(config, "config");
        Preconditions.checkNotNull(log, "log");

        Map<String, ParsedFileDiff> byPath = new LinkedHashMap<>();
        for (ParsedFileDiff file : parsedFiles) {
            byPath.putIfAbsent(file.getFilePath(), file);
        }
        this.files = Collections.unmodifiableMap(byPath);
        this.similarityThreshold = config.getSimilarityThreshold();
        this.nearestLineRadius = config.getNearestLineRadius();
        this.defaultSide = config.getDefaultSide();
        this.strictByDefault = config.isStrict();
        this.blockMatcher = new FuzzyBlockMatcher(similarityThreshold);
        this.reportGenerator = reportGenerator;
        this.log = log;
    }

    public Optional<ResolvedAnchor> resolve(Suggestion suggestion) {
        return resolve(suggestion, strictByDefault);
    }

    /**
     * @param strict when true, never fall back to a nearby line
     * @return the anchor, or empty when the suggestion cannot be placed and should be dropped
     */
    public Optional<ResolvedAnchor> resolve(Suggestion suggestion, boolean strict) {
        if (suggestion == null || suggestion.getFileName() == null || suggestion.getFileName().isBlank()
                || suggestion.getEndLine() == null) {
            log.warn("Suggestion missing file name or end line, dropping: {}", suggestion);
            return Optional.empty();
        }

        String path = normalizePath(suggestion.getFileName());
        ParsedFileDiff file = files.get(path);
        if (file == null) {
            log.warn("File '{}' not in diff, dropping suggestion. Files in diff: {}", path, files.keySet());
            return Optional.empty();
        }

        int claimedLine = suggestion.getEndLine();
        Side side = suggestion.getSide() != null ? suggestion.getSide() : defaultSide;
        LineRef claimed = new LineRef(claimedLine, side);
        List<List<String>> snippets = CodeNormalizer.snippetVariants(suggestion.getExistingCode());

        // exact line, content verified
        if (file.isCommentable(claimed) && !snippets.isEmpty()) {
            DiffLine line = file.lineAt(file.positionOf(claimed));
            String content = CodeNormalizer.normalizeContent(line.getContent());
            if (snippets.stream().anyMatch(snippet -> snippet.get(0).equals(content))) {
                log.info("✅ {}:{} exact match, content verified", path, claimed);
                return Optional.of(anchor(file, claimed, AnchorProvenance.EXACT_MATCH, claimedLine,
                        "content verified at line " + claimedLine));
            }
            log.debug("{}:{} is commentable but existing code differs from '{}'", path, claimed, line.getContent());
        } else if (snippets.isEmpty()) {
            log.debug("{}:{} has no existing code, cannot verify content", path, claimed);
        }

        // content correction
        LineRef working = claimed;
        String correctionDetail = null;
        if (!snippets.isEmpty()) {
            Optional<FuzzyBlockMatcher.BlockMatch> match = bestBlock(file, snippets);
            if (match.isEmpty()) {
                log.warn("⚠️ {}:{} existing code not found in diff (threshold {}), keeping claimed line",
                        path, claimed, similarityThreshold);
            } else if (match.get().lastCommentable() == null) {
                log.warn("⚠️ {}:{} existing code only matches context lines (score {}), keeping claimed line",
                        path, claimed, String.format(Locale.ROOT, "%.2f", match.get().score()));
            } else if (!match.get().lastCommentable().equals(claimed)) {
                working = match.get().lastCommentable();
                correctionDetail = "corrected from " + claimedLine + " to " + working.line()
                        + " (similarity " + String.format(Locale.ROOT, "%.2f", match.get().score()) + ")";
                log.warn("⚠️ {}: anchor {} by content search", path, correctionDetail);
            }
        }

        if (file.isCommentable(working)) {
            if (correctionDetail != null) {
                return Optional.of(anchor(file, working, AnchorProvenance.CONTENT_CORRECTED, claimedLine,
                        correctionDetail));
            }
            log.info("{}:{} matched by line number", path, working);
            return Optional.of(anchor(file, working, AnchorProvenance.LINE_NUMBER_MATCH, claimedLine,
                    "line " + claimedLine));
        }

        if (strict) {
            log.warn("❌ Strict resolution: {}:{} is not commentable, dropping suggestion", path, claimed);
            return Optional.empty();
        }

        Optional<LineRef> nearest = findNearest(file, working);
        if (nearest.isPresent()) {
            LineRef adjusted = nearest.get();
            String detail = "adjusted from " + working.line() + " to " + adjusted.line()
                    + (adjusted.side() != working.side() ? " (" + adjusted.side() + ")" : "");
            log.warn("⚠️ {}: {}", path, detail);
            return Optional.of(anchor(file, adjusted, AnchorProvenance.ADJUSTED, claimedLine, detail));
        }

        log.error("❌ Cannot map suggestion to a commentable line: {}:{} ({})", path, claimedLine, side);
        if (log.isDebugEnabled()) {
            log.debug("Commentable lines of {}: {}", path, file.getCommentableLines());
        }
        return Optional.empty();
    }

    // verbatim reading wins ties
    private Optional<FuzzyBlockMatcher.BlockMatch> bestBlock(ParsedFileDiff file, List<List<String>> snippets) {
        Optional<FuzzyBlockMatcher.BlockMatch> best = Optional.empty();
        for (List<String> snippet : snippets) {
            Optional<FuzzyBlockMatcher.BlockMatch> match = blockMatcher.findBestBlock(file, snippet);
            if (match.isPresent() && (best.isEmpty() || match.get().score() > best.get().score())) {
                best = match;
            }
        }
        return best;
    }

    /**
     * Same side within the radius, the preceding line before the following one at each offset,
     * then the same line number on the other side.
     */
    private Optional<LineRef> findNearest(ParsedFileDiff file, LineRef origin) {
        for (int offset = 1; offset <= nearestLineRadius; offset++) {
            LineRef before = new LineRef(origin.line() - offset, origin.side());
            if (file.isCommentable(before)) {
                return Optional.of(before);
            }
            LineRef after = new LineRef(origin.line() + offset, origin.side());
            if (file.isCommentable(after)) {
                return Optional.of(after);
            }
        }
        LineRef otherSide = new LineRef(origin.line(), origin.side().opposite());
        return file.isCommentable(otherSide) ? Optional.of(otherSide) : Optional.empty();
    }

    private static ResolvedAnchor anchor(ParsedFileDiff file, LineRef ref, AnchorProvenance provenance,
                                         int originalLine, String detail) {
        return ResolvedAnchor.builder()
                .filePath(file.getFilePath())
                .position(file.positionOf(ref))
                .line(ref.line())
                .side(ref.side())
                .provenance(provenance)
                .originalLine(originalLine)
                .detail(detail)
                .build();
    }

    /**
     * Strips a leading {@code a/}, {@code b/} or {@code /} the model may copy from diff headers.
     */
    static String normalizePath(String fileName) {
        String path = fileName.strip();
        if (path.startsWith("a/") || path.startsWith("b/")) {
            return path.substring(2);
        }
        if (path.startsWith("/")) {
            return path.substring(1);
        }
        return path;
    }

    public Optional<ParsedFileDiff> getParsedFile(String fileName) {
        return fileName == null ? Optional.empty() : Optional.ofNullable(files.get(normalizePath(fileName)));
    }

    public List<ParsedFileDiff> getParsedFiles() {
        return new ArrayList<>(files.values());
    }

    public Side getDefaultSide() {
        return defaultSide;
    }

    /**
     * Markdown diagnostics of every file this mapper knows, for debugging failed mappings.
     */
    public String generateLineMappingReport() {
        return reportGenerator.generate(getParsedFiles());
    }
}
