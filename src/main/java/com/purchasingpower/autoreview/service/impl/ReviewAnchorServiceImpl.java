package com.purchasingpower.autoreview.service.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.autoreview.config.LineMappingConfig;
import com.purchasingpower.autoreview.config.SuggestionFilterConfig;
import com.purchasingpower.autoreview.model.diff.LineRef;
import com.purchasingpower.autoreview.model.diff.ParsedFileDiff;
import com.purchasingpower.autoreview.model.review.AnchorProvenance;
import com.purchasingpower.autoreview.model.review.AnchoredComment;
import com.purchasingpower.autoreview.model.review.AnchoringResult;
import com.purchasingpower.autoreview.model.review.ExistingComment;
import com.purchasingpower.autoreview.model.review.ResolvedAnchor;
import com.purchasingpower.autoreview.model.review.ReviewContext;
import com.purchasingpower.autoreview.model.review.ReviewVerdict;
import com.purchasingpower.autoreview.model.review.Suggestion;
import com.purchasingpower.autoreview.service.DiffParserService;
import com.purchasingpower.autoreview.service.DuplicateSuggestionDetector;
import com.purchasingpower.autoreview.service.PromptLibraryService;
import com.purchasingpower.autoreview.service.ReviewAnchorService;
import com.purchasingpower.autoreview.service.SuggestionFilterService;
import com.purchasingpower.autoreview.service.format.DecoupledDiffFormatter;
import com.purchasingpower.autoreview.service.mapping.LineMapper;
import com.purchasingpower.autoreview.service.mapping.LineMapperFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReviewAnchorServiceImpl implements ReviewAnchorService {

    static final String REVIEW_PROMPT = "code-review";

    private static final List<String> SECURITY_KEYWORDS = List.of("vulnerability", "exploit", "injection");

    private final DiffParserService diffParser;
    private final LineMapperFactory lineMapperFactory;
    private final SuggestionFilterService suggestionFilter;
    private final DuplicateSuggestionDetector duplicateDetector;
    private final DecoupledDiffFormatter diffFormatter;
    private final PromptLibraryService promptLibrary;
    private final LineMappingConfig lineMappingConfig;
    private final SuggestionFilterConfig filterConfig;

    @Override
    public AnchoringResult anchor(String diff, List<Suggestion> suggestions, List<ExistingComment> existingComments) {
        return anchor(diff, suggestions, existingComments, lineMappingConfig.isStrict());
    }

    @Override
    public AnchoringResult anchor(String diff, List<Suggestion> suggestions, List<ExistingComment> existingComments,
                                  boolean strict) {
        Preconditions.checkNotNull(diff, "diff must not be null");
        List<Suggestion> received = suggestions == null ? Collections.emptyList() : suggestions;
        List<ExistingComment> posted = existingComments == null ? Collections.emptyList() : existingComments;

        List<ParsedFileDiff> files = diffParser.parse(diff);
        LineMapper mapper = lineMapperFactory.create(files);

        List<Suggestion> kept = suggestionFilter.filter(received).getKept();
        List<Suggestion> candidates = filterConfig.isDuplicateDetection()
                ? duplicateDetector.removeDuplicates(kept, posted)
                : kept;

        Map<AnchorProvenance, Integer> provenanceCounts = new EnumMap<>(AnchorProvenance.class);
        List<AnchoredComment> comments = new ArrayList<>();
        List<Suggestion> anchored = new ArrayList<>();
        int unresolved = 0;

        for (Suggestion suggestion : candidates) {
            try {
                Optional<ResolvedAnchor> anchor = mapper.resolve(suggestion, strict);
                if (anchor.isPresent()) {
                    comments.add(toComment(suggestion, anchor.get(), mapper));
                    anchored.add(suggestion);
                    provenanceCounts.merge(anchor.get().getProvenance(), 1, Integer::sum);
                } else {
                    unresolved++;
                    provenanceCounts.merge(AnchorProvenance.UNRESOLVED, 1, Integer::sum);
                }
            } catch (RuntimeException e) {
                log.error("Failed to anchor suggestion {}, skipping it", suggestion.describe(), e);
                unresolved++;
                provenanceCounts.merge(AnchorProvenance.UNRESOLVED, 1, Integer::sum);
            }
        }

        AnchoringResult result = AnchoringResult.builder()
                .comments(comments)
                .verdict(determineVerdict(anchored))
                .filesParsed(files.size())
                .received(received.size())
                .filtered(received.size() - kept.size())
                .duplicates(kept.size() - candidates.size())
                .unresolved(unresolved)
                .provenanceCounts(provenanceCounts)
                .build();

        log.info("Anchored {} of {} suggestion(s) across {} file(s): {} (correction ratio {}), verdict {}",
                comments.size(), received.size(), files.size(), provenanceCounts,
                String.format(Locale.ROOT, "%.2f", result.getCorrectionRatio()), result.getVerdict());
        return result;
    }

    private AnchoredComment toComment(Suggestion suggestion, ResolvedAnchor anchor, LineMapper mapper) {
        return AnchoredComment.builder()
                .path(anchor.getFilePath())
                .position(anchor.getPosition())
                .line(anchor.getLine())
                .side(anchor.getSide())
                .startLine(startLine(suggestion, anchor, mapper))
                .body(buildBody(suggestion))
                .category(suggestion.getCategory())
                .provenance(anchor.getProvenance())
                .build();
    }

    /**
     * Start line of a multi-line comment: only when it is commentable on the anchor's side
     * and lies before the anchor.
     */
    private static Integer startLine(Suggestion suggestion, ResolvedAnchor anchor, LineMapper mapper) {
        Integer start = suggestion.getStartLine();
        if (start == null || start >= anchor.getLine()) {
            return null;
        }
        LineRef ref = new LineRef(start, anchor.getSide());
        return mapper.getParsedFile(anchor.getFilePath())
                .filter(file -> file.isCommentable(ref))
                .map(file -> start)
                .orElse(null);
    }

    static String buildBody(Suggestion suggestion) {
        StringBuilder body = new StringBuilder(suggestion.getComment() == null ? "" : suggestion.getComment().strip());
        if (suggestion.getSuggestedCode() != null && !suggestion.getSuggestedCode().isBlank()) {
            body.append("\n\n```suggestion\n").append(suggestion.getSuggestedCode().stripTrailing()).append("\n```");
        }
        return body.toString();
    }

    static ReviewVerdict determineVerdict(List<Suggestion> suggestions) {
        if (suggestions.isEmpty()) {
            return ReviewVerdict.APPROVE;
        }
        for (Suggestion suggestion : suggestions) {
            if (suggestion.getCategory() != null && suggestion.getCategory().isCritical()) {
                return ReviewVerdict.REQUEST_CHANGES;
            }
            String comment = suggestion.getComment() == null ? "" : suggestion.getComment().toLowerCase(Locale.ROOT);
            if (SECURITY_KEYWORDS.stream().anyMatch(comment::contains)) {
                return ReviewVerdict.REQUEST_CHANGES;
            }
        }
        return ReviewVerdict.COMMENT;
    }

    @Override
    public String mappingReport(String diff) {
        Preconditions.checkNotNull(diff, "diff must not be null");
        return lineMapperFactory.fromDiff(diff).generateLineMappingReport();
    }

    @Override
    public String reviewPrompt(String diff, ReviewContext context) {
        Preconditions.checkNotNull(diff, "diff must not be null");
        List<ParsedFileDiff> files = diffParser.parse(diff);

        Map<String, Object> variables = new HashMap<>();
        variables.put("title", context != null && context.getTitle() != null ? context.getTitle() : "");
        variables.put("description", context != null && context.getDescription() != null ? context.getDescription() : "");
        variables.put("fileCount", files.size());
        variables.put("diff", diffFormatter.format(files));
        return promptLibrary.render(REVIEW_PROMPT, variables);
    }
}
