package com.purchasingpower.autoreview.service.impl;

import com.purchasingpower.autoreview.config.DiffParsingConfig;
import com.purchasingpower.autoreview.exception.DiffParseException;
import com.purchasingpower.autoreview.model.diff.DiffLine;
import com.purchasingpower.autoreview.model.diff.DiffLineType;
import com.purchasingpower.autoreview.model.diff.Hunk;
import com.purchasingpower.autoreview.model.diff.ParsedFileDiff;
import com.purchasingpower.autoreview.service.DiffParserService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented unified diff parser.
 *
 * <p>Outside a hunk only file headers ({@code diff --git}, {@code ---}/{@code +++},
 * {@code rename to}) and hunk headers matter; {@code index}, mode, similarity and
 * {@code Binary files} lines are kept in the raw text but otherwise ignored. Inside a hunk
 * the declared lengths decide where the hunk ends, so {@code ---} and {@code +++} lines there
 * are ordinary removed/added lines.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class DiffParserServiceImpl implements DiffParserService {

    private static final Pattern HUNK_HEADER =
            Pattern.compile("^@@ -(\\d+)(?:,(\\d+))? \\+(\\d+)(?:,(\\d+))? @@ ?(.*)$");

    private static final String DEV_NULL = "/dev/null";

    private final DiffParsingConfig config;

    public DiffParserServiceImpl(DiffParsingConfig config) {
        this.config = config;
    }

    @Override
    public List<ParsedFileDiff> parse(String diffText) {
        if (diffText == null || diffText.isBlank()) {
            log.debug("Empty diff, nothing to parse");
            return Collections.emptyList();
        }
        try {
            List<ParsedFileDiff> files = new Parser(splitLines(diffText), config.isCountHunkHeaders()).run();
            if (log.isInfoEnabled()) {
                int commentable = files.stream().mapToInt(ParsedFileDiff::getChangedLineCount).sum();
                log.info("Parsed diff: {} file(s), {} commentable line(s)", files.size(), commentable);
            }
            return files;
        } catch (DiffParseException e) {
            log.warn("⚠️ Malformed diff, treating as zero files: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    private static List<String> splitLines(String text) {
        String[] parts = text.split("\\r?\\n", -1);
        int count = parts.length;
        if (count > 0 && parts[count - 1].isEmpty()) {
            count--;
        }
        List<String> lines = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            lines.add(parts[i]);
        }
        return lines;
    }

    static String stripPathPrefix(String path) {
        if (path.startsWith("a/") || path.startsWith("b/")) {
            return path.substring(2);
        }
        return path;
    }

    /**
     * Path of a {@code ---} / {@code +++} header: timestamp after a tab cut off,
     * surrounding quotes and the {@code a/}/{@code b/} prefix removed.
     */
    static String headerPath(String headerLine) {
        String path = headerLine.substring(4);
        int tab = path.indexOf('\t');
        if (tab >= 0) {
            path = path.substring(0, tab);
        }
        path = path.strip();
        if (path.length() >= 2 && path.startsWith("\"") && path.endsWith("\"")) {
            path = path.substring(1, path.length() - 1);
        }
        return DEV_NULL.equals(path) ? path : stripPathPrefix(path);
    }

    /**
     * Target path of a {@code diff --git a/x b/y} line, or null when it cannot be split.
     */
    static String gitHeaderPath(String headerLine) {
        String rest = headerLine.substring("diff --git ".length()).strip();
        int split = rest.lastIndexOf(" b/");
        if (split < 0) {
            return null;
        }
        return rest.substring(split + 3);
    }

    /**
     * Single-use parse state.
     */
    private static final class Parser {

        private final List<String> lines;
        private final boolean countHunkHeaders;
        private final List<ParsedFileDiff> files = new ArrayList<>();

        private FileState file;

        // remaining counts of the active hunk
        private int sourceRemaining;
        private int targetRemaining;
        private int sourceLineNo;
        private int targetLineNo;

        Parser(List<String> lines, boolean countHunkHeaders) {
            this.lines = lines;
            this.countHunkHeaders = countHunkHeaders;
        }

        List<ParsedFileDiff> run() {
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                int lineNumber = i + 1;
                if (inHunk()) {
                    hunkLine(line, lineNumber);
                } else {
                    headerLine(line, i);
                }
            }
            if (inHunk()) {
                throw new DiffParseException("Hunk shorter than declared at end of diff", lines.size());
            }
            finishFile();
            return files;
        }

        private boolean inHunk() {
            return sourceRemaining > 0 || targetRemaining > 0;
        }

        private void hunkLine(String line, int lineNumber) {
            file.raw.add(line);
            if (line.startsWith("\\")) {
                return; // "\ No newline at end of file"
            }
            char marker = line.isEmpty() ? ' ' : line.charAt(0);
            String content = line.isEmpty() ? "" : line.substring(1);
            switch (marker) {
                case '+' -> {
                    if (targetRemaining == 0) {
                        throw new DiffParseException("More added lines than the hunk declares", lineNumber);
                    }
                    file.add(DiffLineType.ADDED, null, targetLineNo++, content);
                    targetRemaining--;
                }
                case '-' -> {
                    if (sourceRemaining == 0) {
                        throw new DiffParseException("More removed lines than the hunk declares", lineNumber);
                    }
                    file.add(DiffLineType.REMOVED, sourceLineNo++, null, content);
                    sourceRemaining--;
                }
                case ' ' -> {
                    if (sourceRemaining == 0 || targetRemaining == 0) {
                        throw new DiffParseException("More context lines than the hunk declares", lineNumber);
                    }
                    file.add(DiffLineType.CONTEXT, sourceLineNo++, targetLineNo++, content);
                    sourceRemaining--;
                    targetRemaining--;
                }
                default -> {
                    if (line.startsWith("@@") || line.startsWith("diff ")) {
                        throw new DiffParseException("Hunk shorter than declared", lineNumber);
                    }
                    throw new DiffParseException("Unexpected line marker '" + marker + "' inside hunk", lineNumber);
                }
            }
        }

        private void headerLine(String line, int index) {
            int lineNumber = index + 1;
            if (line.startsWith("diff --git ")) {
                finishFile();
                file = new FileState();
                file.gitPath = gitHeaderPath(line);
                file.raw.add(line);
            } else if (line.startsWith("--- ") && nextStartsWith(index, "+++ ")) {
                if (file == null || file.sourcePath != null || !file.hunks.isEmpty()) {
                    finishFile();
                    file = new FileState();
                }
                file.sourcePath = headerPath(line);
                file.raw.add(line);
            } else if (line.startsWith("+++ ") && file != null && file.sourcePath != null && file.targetPath == null) {
                file.targetPath = headerPath(line);
                file.raw.add(line);
            } else if (line.startsWith("@@")) {
                if (file == null) {
                    throw new DiffParseException("Hunk header before any file header", lineNumber);
                }
                startHunk(line, lineNumber);
            } else if (file != null) {
                if (line.startsWith("rename to ")) {
                    file.renamedTo = line.substring("rename to ".length()).strip();
                }
                file.raw.add(line);
            }
            // anything before the first file header is preamble
        }

        private boolean nextStartsWith(int index, String prefix) {
            return index + 1 < lines.size() && lines.get(index + 1).startsWith(prefix);
        }

        private void startHunk(String line, int lineNumber) {
            Matcher m = HUNK_HEADER.matcher(line);
            if (!m.matches()) {
                throw new DiffParseException("Unparsable hunk header: " + line, lineNumber);
            }
            Hunk hunk;
            try {
                hunk = Hunk.builder()
                        .sourceStart(Integer.parseInt(m.group(1)))
                        .sourceLength(m.group(2) == null ? 1 : Integer.parseInt(m.group(2)))
                        .targetStart(Integer.parseInt(m.group(3)))
                        .targetLength(m.group(4) == null ? 1 : Integer.parseInt(m.group(4)))
                        .section(m.group(5).strip())
                        .build();
            } catch (NumberFormatException e) {
                throw new DiffParseException("Hunk numbers out of range: " + line, lineNumber, e);
            }
            if (countHunkHeaders && !file.hunks.isEmpty()) {
                file.position++;
            }
            file.hunks.add(hunk);
            file.raw.add(line);
            sourceRemaining = hunk.getSourceLength();
            targetRemaining = hunk.getTargetLength();
            sourceLineNo = hunk.getSourceStart();
            targetLineNo = hunk.getTargetStart();
        }

        private void finishFile() {
            if (file == null) {
                return;
            }
            files.add(new ParsedFileDiff(file.path(), String.join("\n", file.raw) + "\n", file.hunks, file.lines));
            file = null;
        }
    }

    private static final class FileState {

        private String gitPath;
        private String renamedTo;
        private String sourcePath;
        private String targetPath;
        private int position;

        private final List<String> raw = new ArrayList<>();
        private final List<Hunk> hunks = new ArrayList<>();
        private final List<DiffLine> lines = new ArrayList<>();

        void add(DiffLineType type, Integer sourceLineNo, Integer targetLineNo, String content) {
            lines.add(DiffLine.builder()
                    .type(type)
                    .sourceLineNo(sourceLineNo)
                    .targetLineNo(targetLineNo)
                    .content(content)
                    .position(++position)
                    .hunkIndex(hunks.size() - 1)
                    .build());
        }

        String path() {
            if (targetPath != null && !DEV_NULL.equals(targetPath)) {
                return targetPath;
            }
            if (sourcePath != null && !DEV_NULL.equals(sourcePath)) {
                return sourcePath;
            }
            if (renamedTo != null) {
                return renamedTo;
            }
            return gitPath != null ? gitPath : "";
        }
    }
}
