package com.purchasingpower.autoreview.model.diff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Parsed diff of a single changed file.
 *
 * <p>Lines are kept once, in diff order, in an arena list. Two index maps point into it:
 * one keyed by (line, side), one keyed by diff position. The public views
 * ({@link #getLineToPosition()}, {@link #getPositionToLine()}, {@link #getCommentableLines()},
 * {@link #getAllLinePositions()}) are derived from those indexes once, at construction.
 *
 * <p>Invariants:
 * <ul>
 *   <li>only ADDED and REMOVED lines are commentable; CONTEXT lines never are</li>
 *   <li>every commentable (line, side) has exactly one position</li>
 *   <li>positions strictly increase in diff order</li>
 *   <li>a context line maps back to its RIGHT line number</li>
 * </ul>
 *
 * <p>Instances are immutable and safe to share between threads.
 *
 * @since 1.0.0
 */
public final class ParsedFileDiff {

    private final String filePath;
    private final String rawDiffText;
    private final List<Hunk> hunks;
    private final List<DiffLine> lines;

    // (line, side) -> arena index, commentable lines only
    private final Map<LineRef, Integer> commentableIndex;
    // (line, side) -> arena index, every line including both sides of context lines
    private final Map<LineRef, Integer> allLineIndex;
    // position -> arena index
    private final Map<Integer, Integer> positionIndex;

    private final Map<LineRef, Integer> lineToPosition;
    private final Map<Integer, LineRef> positionToLine;
    private final Map<LineRef, Integer> allLinePositions;
    private final Set<LineRef> commentableLines;

    public ParsedFileDiff(String filePath, String rawDiffText, List<Hunk> hunks, List<DiffLine> lines) {
        this.filePath = Objects.requireNonNull(filePath, "filePath");
        this.rawDiffText = rawDiffText == null ? "" : rawDiffText;
        this.hunks = List.copyOf(hunks);
        this.lines = List.copyOf(lines);

        Map<LineRef, Integer> commentable = new LinkedHashMap<>();
        Map<LineRef, Integer> all = new LinkedHashMap<>();
        Map<Integer, Integer> byPosition = new HashMap<>();

        int previousPosition = 0;
        for (int i = 0; i < this.lines.size(); i++) {
            DiffLine line = this.lines.get(i);
            if (line.getPosition() <= previousPosition) {
                throw new IllegalArgumentException("Diff positions must strictly increase: "
                        + line.getPosition() + " after " + previousPosition + " in " + filePath);
            }
            previousPosition = line.getPosition();
            byPosition.put(line.getPosition(), i);

            switch (line.getType()) {
                case ADDED -> {
                    LineRef ref = LineRef.right(line.getTargetLineNo());
                    commentable.putIfAbsent(ref, i);
                    all.putIfAbsent(ref, i);
                }
                case REMOVED -> {
                    LineRef ref = LineRef.left(line.getSourceLineNo());
                    commentable.putIfAbsent(ref, i);
                    all.putIfAbsent(ref, i);
                }
                case CONTEXT -> {
                    all.putIfAbsent(LineRef.left(line.getSourceLineNo()), i);
                    all.putIfAbsent(LineRef.right(line.getTargetLineNo()), i);
                }
            }
        }

        this.commentableIndex = Collections.unmodifiableMap(commentable);
        this.allLineIndex = Collections.unmodifiableMap(all);
        this.positionIndex = Collections.unmodifiableMap(byPosition);

        Map<LineRef, Integer> toPosition = new LinkedHashMap<>();
        commentable.forEach((ref, index) -> toPosition.put(ref, this.lines.get(index).getPosition()));
        this.lineToPosition = Collections.unmodifiableMap(toPosition);
        this.commentableLines = Collections.unmodifiableSet(new LinkedHashSet<>(commentable.keySet()));

        Map<LineRef, Integer> allPositions = new LinkedHashMap<>();
        all.forEach((ref, index) -> allPositions.put(ref, this.lines.get(index).getPosition()));
        this.allLinePositions = Collections.unmodifiableMap(allPositions);

        Map<Integer, LineRef> toLine = new LinkedHashMap<>();
        for (DiffLine line : this.lines) {
            toLine.put(line.getPosition(), line.getAnchorRef());
        }
        this.positionToLine = Collections.unmodifiableMap(toLine);
    }

    public String getFilePath() {
        return filePath;
    }

    public String getRawDiffText() {
        return rawDiffText;
    }

    public List<Hunk> getHunks() {
        return hunks;
    }

    public List<HunkRange> getHunkRanges() {
        List<HunkRange> ranges = new ArrayList<>(hunks.size());
        for (Hunk hunk : hunks) {
            ranges.add(hunk.toRange());
        }
        return Collections.unmodifiableList(ranges);
    }

    /**
     * Every hunk line in diff order, context lines included. For searching only:
     * context lines are never valid comment anchors.
     */
    public List<DiffLine> getAllLines() {
        return lines;
    }

    public Map<LineRef, Integer> getLineToPosition() {
        return lineToPosition;
    }

    public Map<Integer, LineRef> getPositionToLine() {
        return positionToLine;
    }

    public Set<LineRef> getCommentableLines() {
        return commentableLines;
    }

    public Map<LineRef, Integer> getAllLinePositions() {
        return allLinePositions;
    }

    public int getChangedLineCount() {
        return commentableIndex.size();
    }

    public boolean isCommentable(LineRef ref) {
        return commentableIndex.containsKey(ref);
    }

    /**
     * @return diff position of a commentable line, or null when the line is not commentable
     */
    public Integer positionOf(LineRef ref) {
        return lineToPosition.get(ref);
    }

    /**
     * @return the line at a diff position, or null if no line has that position
     */
    public DiffLine lineAt(int position) {
        Integer index = positionIndex.get(position);
        return index == null ? null : lines.get(index);
    }

    /**
     * @return the line shown under (line, side), context lines included, or null
     */
    public DiffLine findLine(LineRef ref) {
        Integer index = allLineIndex.get(ref);
        return index == null ? null : lines.get(index);
    }

    @Override
    public String toString() {
        return "ParsedFileDiff{" + filePath + ", hunks=" + hunks.size()
                + ", lines=" + lines.size() + ", commentable=" + commentableIndex.size() + "}";
    }
}
