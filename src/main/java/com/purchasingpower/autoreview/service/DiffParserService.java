package com.purchasingpower.autoreview.service;

import com.purchasingpower.autoreview.model.diff.ParsedFileDiff;

import java.util.List;

/**
 * Parses unified diffs into per-file structures with line and position indexes.
 */
public interface DiffParserService {

    /**
     * Parses git-style or plain {@code diff -u} text.
     *
     * <p>Every hunk line (added, removed and context) takes the next diff position of its file,
     * starting at 1. Files without hunks (binary, pure rename, mode change) are returned with
     * empty indexes.
     *
     * @param diffText unified diff, possibly empty
     * @return one entry per changed file in diff order; empty for blank or malformed input.
     *         Never throws for bad input.
     */
    List<ParsedFileDiff> parse(String diffText);
}
