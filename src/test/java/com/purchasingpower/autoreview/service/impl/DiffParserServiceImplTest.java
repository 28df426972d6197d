package com.purchasingpower.autoreview.service.impl;

import com.purchasingpower.autoreview.DiffFixtures;
import com.purchasingpower.autoreview.config.DiffParsingConfig;
import com.purchasingpower.autoreview.model.diff.DiffLine;
import com.purchasingpower.autoreview.model.diff.DiffLineType;
import com.purchasingpower.autoreview.model.diff.HunkRange;
import com.purchasingpower.autoreview.model.diff.LineRef;
import com.purchasingpower.autoreview.model.diff.ParsedFileDiff;
import com.purchasingpower.autoreview.model.diff.Side;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

@DisplayName("Diff Parser Service Tests")
class DiffParserServiceImplTest {

    private DiffParserServiceImpl parser;

    @BeforeEach
    void setUp() {
        parser = new DiffParserServiceImpl(new DiffParsingConfig());
    }

    @Test
    @DisplayName("Single added line after two unchanged lines gives one RIGHT commentable line")
    void singleAddedLine() {
        // Given
        String diff = DiffFixtures.unifiedDiff("hello.py",
                List.of("def hello():", "    print(\"hello\")"),
                List.of("def hello():", "    print(\"hello\")", "    print(\"world\")"));

        // When
        List<ParsedFileDiff> files = parser.parse(diff);

        // Then
        assertThat(files).hasSize(1);
        ParsedFileDiff file = files.get(0);
        assertThat(file.getFilePath()).isEqualTo("hello.py");
        assertThat(file.getCommentableLines()).containsExactly(LineRef.right(3));
        assertThat(file.getLineToPosition()).containsExactly(entry(LineRef.right(3), 3));
    }

    @Test
    @DisplayName("Changing one line counts one removed and one added line")
    void changedLineCountsBothSides() {
        String diff = DiffFixtures.unifiedDiff("vars.py",
                List.of("a = 1", "b = 2", "c = 3"),
                List.of("a = 1", "b = 20", "c = 3"));

        ParsedFileDiff file = parser.parse(diff).get(0);

        assertThat(file.getChangedLineCount()).isEqualTo(2);
        assertThat(file.getCommentableLines()).containsExactlyInAnyOrder(LineRef.left(2), LineRef.right(2));
    }

    @Test
    @DisplayName("Two changed lines give four commentable lines")
    void twoChangedLines() {
        String diff = DiffFixtures.unifiedDiff("vars.py",
                List.of("a = 1", "b = 2", "c = 3"),
                List.of("a = 1", "b = 20", "c = 30"));

        assertThat(parser.parse(diff).get(0).getChangedLineCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("Distant changes produce separate hunks with positions continuing across them")
    void multipleHunksShareOnePositionCounter() {
        List<String> before = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            before.add("line " + i);
        }
        List<String> after = new ArrayList<>(before);
        after.set(2, "CHANGED line 2");
        after.set(17, "CHANGED line 17");

        ParsedFileDiff file = parser.parse(DiffFixtures.unifiedDiff("lines.txt", before, after)).get(0);

        assertThat(file.getHunks()).hasSize(2);
        assertThat(file.getChangedLineCount()).isEqualTo(4);
        int firstHunkEnd = file.getPositionToLine().keySet().stream()
                .filter(p -> file.lineAt(p).getHunkIndex() == 0)
                .mapToInt(Integer::intValue).max().orElseThrow();
        assertThat(file.positionOf(LineRef.right(18))).isGreaterThan(firstHunkEnd);
    }

    @Test
    @DisplayName("Identical versions produce no files")
    void identicalVersionsProduceNoFiles() {
        String diff = DiffFixtures.unifiedDiff("same.py", List.of("a = 1"), List.of("a = 1"));

        assertThat(parser.parse(diff)).isEmpty();
    }

    @Test
    @DisplayName("Null, empty and blank input produce no files")
    void blankInput() {
        assertThat(parser.parse(null)).isEmpty();
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse("  \n\n")).isEmpty();
    }

    @Test
    @DisplayName("Git diff with several files: positions, sides and paths")
    void gitDiffWithSeveralFiles() {
        // When
        List<ParsedFileDiff> files = parser.parse(DiffFixtures.load("multi_file.diff"));

        // Then
        assertThat(files).extracting(ParsedFileDiff::getFilePath)
                .containsExactly("src/app.py", "README.md", "old.txt", "img.png");

        ParsedFileDiff app = files.get(0);
        assertThat(app.getLineToPosition()).containsExactly(
                entry(LineRef.left(2), 2),
                entry(LineRef.right(2), 3),
                entry(LineRef.right(3), 4),
                entry(LineRef.left(11), 8),
                entry(LineRef.right(12), 9));
        assertThat(app.getHunkRanges()).containsExactly(
                new HunkRange(1, 4, 1, 5),
                new HunkRange(10, 12, 11, 13));
        assertThat(app.getHunks().get(1).getSection()).isEqualTo("def main():");
        assertThat(app.getAllLines()).hasSize(10);
    }

    @Test
    @DisplayName("Context lines map to their RIGHT line and are never commentable")
    void contextLinesAreNotCommentable() {
        ParsedFileDiff app = parser.parse(DiffFixtures.load("multi_file.diff")).get(0);

        // position 5 is the blank context line: old line 3, new line 4
        assertThat(app.getPositionToLine().get(5)).isEqualTo(LineRef.right(4));
        assertThat(app.isCommentable(LineRef.right(4))).isFalse();
        assertThat(app.isCommentable(LineRef.left(3))).isFalse();
        assertThat(app.getAllLinePositions())
                .containsEntry(LineRef.left(3), 5)
                .containsEntry(LineRef.right(4), 5);

        for (ParsedFileDiff file : parser.parse(DiffFixtures.load("multi_file.diff"))) {
            for (DiffLine line : file.getAllLines()) {
                if (line.getType() == DiffLineType.CONTEXT) {
                    assertThat(file.getCommentableLines())
                            .doesNotContain(LineRef.left(line.getSourceLineNo()), LineRef.right(line.getTargetLineNo()));
                }
            }
        }
    }

    @Test
    @DisplayName("Positions strictly increase in diff order")
    void positionsIncrease() {
        for (ParsedFileDiff file : parser.parse(DiffFixtures.load("multi_file.diff"))) {
            int previous = 0;
            for (DiffLine line : file.getAllLines()) {
                assertThat(line.getPosition()).isGreaterThan(previous);
                previous = line.getPosition();
            }
        }
    }

    @Test
    @DisplayName("Every commentable line survives the position round trip")
    void positionRoundTrip() {
        for (ParsedFileDiff file : parser.parse(DiffFixtures.load("multi_file.diff"))) {
            for (Map.Entry<LineRef, Integer> e : file.getLineToPosition().entrySet()) {
                assertThat(file.getPositionToLine().get(e.getValue())).isEqualTo(e.getKey());
            }
        }
    }

    @Test
    @DisplayName("New, deleted and binary files")
    void newDeletedAndBinaryFiles() {
        List<ParsedFileDiff> files = parser.parse(DiffFixtures.load("multi_file.diff"));

        assertThat(files.get(1).getCommentableLines()).containsExactly(LineRef.right(1), LineRef.right(2));
        assertThat(files.get(2).getCommentableLines()).containsExactly(LineRef.left(1), LineRef.left(2));
        assertThat(files.get(2).getHunkRanges()).containsExactly(new HunkRange(1, 2, 0, 0));

        ParsedFileDiff binary = files.get(3);
        assertThat(binary.getHunks()).isEmpty();
        assertThat(binary.getCommentableLines()).isEmpty();
        assertThat(binary.getRawDiffText()).contains("Binary files");
    }

    @Test
    @DisplayName("Plain diff -u headers: timestamps are cut from the path")
    void plainDiffHeaders() {
        List<ParsedFileDiff> files = parser.parse(DiffFixtures.load("service.diff"));

        assertThat(files).hasSize(1);
        ParsedFileDiff file = files.get(0);
        assertThat(file.getFilePath()).isEqualTo("service.py");
        assertThat(file.positionOf(LineRef.left(81))).isEqualTo(4);
        assertThat(file.positionOf(LineRef.right(81))).isEqualTo(5);
        assertThat(file.positionOf(LineRef.right(82))).isEqualTo(6);
        assertThat(file.lineAt(8).getContent()).isEmpty();
    }

    @Test
    @DisplayName("CRLF line endings and omitted hunk lengths")
    void crlfAndDefaultLengths() {
        String diff = "--- a/one.txt\r\n+++ b/one.txt\r\n@@ -3 +3 @@\r\n-old\r\n+new\r\n";

        ParsedFileDiff file = parser.parse(diff).get(0);

        assertThat(file.getHunks().get(0).getSourceLength()).isEqualTo(1);
        assertThat(file.getHunks().get(0).getTargetLength()).isEqualTo(1);
        assertThat(file.getLineToPosition()).containsExactly(
                entry(LineRef.left(3), 1),
                entry(LineRef.right(3), 2));
        assertThat(file.lineAt(2).getContent()).isEqualTo("new");
    }

    @Test
    @DisplayName("'No newline at end of file' markers take no position")
    void noNewlineMarker() {
        String diff = String.join("\n",
                "--- a/end.txt",
                "+++ b/end.txt",
                "@@ -1,2 +1,2 @@",
                " first",
                "-last",
                "\\ No newline at end of file",
                "+last line",
                "\\ No newline at end of file",
                "");

        ParsedFileDiff file = parser.parse(diff).get(0);

        assertThat(file.getAllLines()).hasSize(3);
        assertThat(file.positionOf(LineRef.right(2))).isEqualTo(3);
    }

    @Test
    @DisplayName("Removed lines that look like file headers stay inside the hunk")
    void headerLookalikesInsideHunk() {
        String diff = String.join("\n",
                "--- a/notes.md",
                "+++ b/notes.md",
                "@@ -1,2 +1,2 @@",
                "--- a/separator",
                "+++ b/separator",
                " tail",
                "");

        List<ParsedFileDiff> files = parser.parse(diff);

        assertThat(files).hasSize(1);
        assertThat(files.get(0).findLine(LineRef.left(1)).getContent()).isEqualTo("-- a/separator");
        assertThat(files.get(0).findLine(LineRef.right(1)).getContent()).isEqualTo("++ b/separator");
    }

    @Test
    @DisplayName("Counting hunk headers shifts positions of later hunks")
    void countHunkHeaders() {
        DiffParsingConfig config = new DiffParsingConfig();
        config.setCountHunkHeaders(true);
        DiffParserServiceImpl legacyParser = new DiffParserServiceImpl(config);

        ParsedFileDiff app = legacyParser.parse(DiffFixtures.load("multi_file.diff")).get(0);

        assertThat(app.positionOf(LineRef.left(2))).isEqualTo(2);
        assertThat(app.positionOf(LineRef.left(11))).isEqualTo(9);
        assertThat(app.positionOf(LineRef.right(12))).isEqualTo(10);
    }

    @Test
    @DisplayName("Malformed diffs produce no files instead of throwing")
    void malformedInput() {
        // hunk before any file header
        assertThat(parser.parse("@@ -1,1 +1,1 @@\n-a\n+b\n")).isEmpty();
        // unparsable hunk numbers
        assertThat(parser.parse("--- a/x\n+++ b/x\n@@ -one +1 @@\n+b\n")).isEmpty();
        assertThat(parser.parse("--- a/x\n+++ b/x\n@@ -1,1 +99999999999,1 @@\n-a\n+b\n")).isEmpty();
        // hunk shorter than declared
        assertThat(parser.parse("--- a/x\n+++ b/x\n@@ -1,3 +1,3 @@\n a\n-b\n+c\n")).isEmpty();
        // unexpected marker inside a hunk
        assertThat(parser.parse("--- a/x\n+++ b/x\n@@ -1,2 +1,2 @@\n a\n*b\n")).isEmpty();
    }

    @Test
    @DisplayName("Text without any diff produces no files")
    void notADiff() {
        assertThat(parser.parse("Just some commit message\nwith two lines\n")).isEmpty();
    }

    @Test
    @DisplayName("Removed-only file is keyed by its source path")
    void deletedFileUsesSourcePath() {
        ParsedFileDiff deleted = parser.parse(DiffFixtures.load("multi_file.diff")).get(2);

        assertThat(deleted.getFilePath()).isEqualTo("old.txt");
        assertThat(deleted.getPositionToLine().values()).allMatch(ref -> ref.side() == Side.LEFT);
    }
}
