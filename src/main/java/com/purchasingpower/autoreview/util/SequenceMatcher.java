package com.purchasingpower.autoreview.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Longest-matching-block similarity over code points, scoring like Python's
 * {@code difflib.SequenceMatcher(None, a, b).ratio()}.
 *
 * <p>The popularity heuristic applies: when {@code b} has at least 200 code points, every
 * element occurring more than {@code len(b) / 100 + 1} times is not used to seed a match
 * (matches may still be extended across it).
 *
 * <p>Stateless; all methods are static.
 *
 * @since 1.0.0
 */
public final class SequenceMatcher {

    private static final int AUTOJUNK_MIN_LENGTH = 200;

    private SequenceMatcher() {
    }

    /**
     * @return similarity in [0, 1]; two empty strings score 1.0
     */
    public static double ratio(String a, String b) {
        int[] left = (a == null ? "" : a).codePoints().toArray();
        int[] right = (b == null ? "" : b).codePoints().toArray();
        int total = left.length + right.length;
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(left, right) / total;
    }

    /**
     * Sum of the sizes of all matching blocks.
     */
    static int matchingCharacters(int[] a, int[] b) {
        Map<Integer, List<Integer>> b2j = indexOf(b);
        int matches = 0;

        Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[]{0, a.length, 0, b.length});
        while (!queue.isEmpty()) {
            int[] range = queue.pop();
            int alo = range[0];
            int ahi = range[1];
            int blo = range[2];
            int bhi = range[3];

            int[] match = findLongestMatch(a, b, b2j, alo, ahi, blo, bhi);
            int i = match[0];
            int j = match[1];
            int k = match[2];
            if (k > 0) {
                matches += k;
                if (alo < i && blo < j) {
                    queue.push(new int[]{alo, i, blo, j});
                }
                if (i + k < ahi && j + k < bhi) {
                    queue.push(new int[]{i + k, ahi, j + k, bhi});
                }
            }
        }
        return matches;
    }

    private static Map<Integer, List<Integer>> indexOf(int[] b) {
        Map<Integer, List<Integer>> b2j = new HashMap<>();
        for (int j = 0; j < b.length; j++) {
            b2j.computeIfAbsent(b[j], key -> new ArrayList<>()).add(j);
        }
        if (b.length >= AUTOJUNK_MIN_LENGTH) {
            int limit = b.length / 100 + 1;
            b2j.values().removeIf(positions -> positions.size() > limit);
        }
        return b2j;
    }

    /**
     * Longest block a[i..i+k) == b[j..j+k) inside the given ranges, earliest in {@code a}
     * (then earliest in {@code b}) on ties.
     */
    private static int[] findLongestMatch(int[] a, int[] b, Map<Integer, List<Integer>> b2j,
                                          int alo, int ahi, int blo, int bhi) {
        int besti = alo;
        int bestj = blo;
        int bestsize = 0;

        Map<Integer, Integer> j2len = new HashMap<>();
        for (int i = alo; i < ahi; i++) {
            Map<Integer, Integer> newj2len = new HashMap<>();
            for (int j : b2j.getOrDefault(a[i], Collections.emptyList())) {
                if (j < blo) {
                    continue;
                }
                if (j >= bhi) {
                    break;
                }
                int k = j2len.getOrDefault(j - 1, 0) + 1;
                newj2len.put(j, k);
                if (k > bestsize) {
                    besti = i - k + 1;
                    bestj = j - k + 1;
                    bestsize = k;
                }
            }
            j2len = newj2len;
        }

        // extend over elements dropped by the popularity heuristic
        while (besti > alo && bestj > blo && a[besti - 1] == b[bestj - 1]) {
            besti--;
            bestj--;
            bestsize++;
        }
        while (besti + bestsize < ahi && bestj + bestsize < bhi
                && a[besti + bestsize] == b[bestj + bestsize]) {
            bestsize++;
        }
        return new int[]{besti, bestj, bestsize};
    }
}
