package com.purchasingpower.autoreview.service.format;

import com.purchasingpower.autoreview.model.diff.DiffLine;
import com.purchasingpower.autoreview.model.diff.HunkRange;
import com.purchasingpower.autoreview.model.diff.LineRef;
import com.purchasingpower.autoreview.model.diff.ParsedFileDiff;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Markdown report of how diff lines map to positions. Meant for debugging failed
 * mappings and for test fixtures.
 *
 * @since 1.0.0
 */
@Component
public class LineMappingReportGenerator {

    private static final Comparator<LineRef> BY_LINE_THEN_SIDE =
            Comparator.comparingInt(LineRef::line).thenComparing(ref -> ref.side().name());

    public String generate(List<ParsedFileDiff> files) {
        List<String> report = new ArrayList<>();
        report.add("# Line Mapping Report");
        report.add("");

        for (ParsedFileDiff file : files) {
            report.add("## File: " + file.getFilePath());
            report.add("- Commentable lines: " + file.getChangedLineCount());
            report.add("- Total lines in diff: " + file.getAllLines().size());
            report.add("- Hunks: " + file.getHunks().size());
            List<HunkRange> ranges = file.getHunkRanges();
            for (int i = 0; i < ranges.size(); i++) {
                report.add("  - Hunk " + (i + 1) + ": " + ranges.get(i));
            }

            if (!file.getCommentableLines().isEmpty()) {
                report.add("### Commentable Lines:");
                List<LineRef> sorted = new ArrayList<>(file.getCommentableLines());
                sorted.sort(BY_LINE_THEN_SIDE);
                for (LineRef ref : sorted) {
                    int position = file.positionOf(ref);
                    report.add("- Line " + ref + " -> Position " + position + ": `"
                            + file.lineAt(position).getRawText().stripTrailing() + "`");
                }
            }

            report.add("");
            report.add("### Raw Diff Lines:");
            for (DiffLine line : file.getAllLines()) {
                report.add("P" + line.getPosition() + ": `" + line.getRawText().stripTrailing() + "`");
            }
            report.add("");
        }
        return String.join("\n", report);
    }
}
