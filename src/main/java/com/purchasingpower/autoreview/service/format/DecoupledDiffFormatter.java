package com.purchasingpower.autoreview.service.format;

import com.purchasingpower.autoreview.model.diff.DiffLine;
import com.purchasingpower.autoreview.model.diff.DiffLineType;
import com.purchasingpower.autoreview.model.diff.Hunk;
import com.purchasingpower.autoreview.model.diff.ParsedFileDiff;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders parsed diffs in the "decoupled" layout used in review prompts: each hunk is split
 * into the new version, with target line numbers the model can cite, and the old version.
 *
 * <pre>
 * ## File: 'src/app.py'
 *
 * &#64;&#64; -1,2 +1,3 &#64;&#64; def hello():
 * __new hunk__
 * 1  def hello():
 * 2  print("hello")
 * 3 +print("world")
 * </pre>
 *
 * @since 1.0.0
 */
@Component
public class DecoupledDiffFormatter {

    public String format(List<ParsedFileDiff> files) {
        List<String> blocks = new ArrayList<>(files.size());
        for (ParsedFileDiff file : files) {
            blocks.add(format(file));
        }
        return String.join("\n", blocks);
    }

    public String format(ParsedFileDiff file) {
        StringBuilder out = new StringBuilder();
        out.append("## File: '").append(file.getFilePath()).append("'\n");

        List<Hunk> hunks = file.getHunks();
        for (int index = 0; index < hunks.size(); index++) {
            List<DiffLine> hunkLines = linesOf(file, index);
            out.append('\n').append(hunks.get(index).header()).append('\n');

            boolean hasNew = hunkLines.stream().anyMatch(l -> l.getType() != DiffLineType.REMOVED);
            boolean hasOld = hunkLines.stream().anyMatch(l -> l.getType() == DiffLineType.REMOVED);

            if (hasNew) {
                out.append("__new hunk__\n");
                for (DiffLine line : hunkLines) {
                    if (line.getType() != DiffLineType.REMOVED) {
                        out.append(line.getTargetLineNo()).append(' ').append(line.getRawText()).append('\n');
                    }
                }
            }
            if (hasOld) {
                out.append("__old hunk__\n");
                for (DiffLine line : hunkLines) {
                    if (line.getType() != DiffLineType.ADDED) {
                        out.append(line.getRawText()).append('\n');
                    }
                }
            }
        }
        return out.toString();
    }

    private static List<DiffLine> linesOf(ParsedFileDiff file, int hunkIndex) {
        List<DiffLine> result = new ArrayList<>();
        for (DiffLine line : file.getAllLines()) {
            if (line.getHunkIndex() == hunkIndex) {
                result.add(line);
            }
        }
        return result;
    }
}
