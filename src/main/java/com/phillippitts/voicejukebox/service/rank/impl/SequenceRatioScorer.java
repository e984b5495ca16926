package com.phillippitts.voicejukebox.service.rank.impl;

import com.phillippitts.voicejukebox.service.rank.AbstractSimilarityScorer;

/**
 * Ratcliff/Obershelp similarity: {@code 2 * M / T}, where {@code M} is the number of characters in
 * recursively found longest common substrings and {@code T} the total length of both strings.
 *
 * <p>Tolerant of small misspellings ("qeen" vs "queen" scores 0.89), which suits speech transcripts.
 */
public final class SequenceRatioScorer extends AbstractSimilarityScorer {

    @Override
    protected double doScore(String a, String b) {
        int matches = matchingCharacters(a, 0, a.length(), b, 0, b.length());
        return 2.0 * matches / (a.length() + b.length());
    }

    private static int matchingCharacters(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        if (aLo >= aHi || bLo >= bHi) {
            return 0;
        }
        int[] match = longestMatch(a, aLo, aHi, b, bLo, bHi);
        int size = match[2];
        if (size == 0) {
            return 0;
        }
        int i = match[0];
        int j = match[1];
        return size
                + matchingCharacters(a, aLo, i, b, bLo, j)
                + matchingCharacters(a, i + size, aHi, b, j + size, bHi);
    }

    /**
     * Finds the longest common substring; ties resolve to the earliest start in {@code a}, then in {@code b}.
     *
     * @return {start in a, start in b, length}
     */
    private static int[] longestMatch(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        int bestI = aLo;
        int bestJ = bLo;
        int bestSize = 0;
        int[] prev = new int[bHi - bLo + 1];
        int[] curr = new int[bHi - bLo + 1];
        for (int i = aLo; i < aHi; i++) {
            for (int j = bLo; j < bHi; j++) {
                int k = j - bLo + 1;
                if (a.charAt(i) == b.charAt(j)) {
                    curr[k] = prev[k - 1] + 1;
                    if (curr[k] > bestSize) {
                        bestSize = curr[k];
                        bestI = i - bestSize + 1;
                        bestJ = j - bestSize + 1;
                    }
                } else {
                    curr[k] = 0;
                }
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return new int[] {bestI, bestJ, bestSize};
    }
}
