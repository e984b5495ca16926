package com.phillippitts.voicejukebox.service.rank.impl;

import com.phillippitts.voicejukebox.service.rank.AbstractSimilarityScorer;
import com.phillippitts.voicejukebox.service.rank.TextNormalizer;

import java.util.HashSet;
import java.util.Set;

/**
 * Scores by Jaccard word-overlap similarity.
 *
 * <p>Jaccard similarity = |A ∩ B| / |A ∪ B|
 *
 * <p>Insensitive to word order ("greatest hits queen" equals "queen greatest hits") but gives no
 * credit to misspelled words.
 */
public final class TokenOverlapScorer extends AbstractSimilarityScorer {

    @Override
    protected double doScore(String a, String b) {
        Set<String> tokensA = new HashSet<>(TextNormalizer.tokens(a));
        Set<String> tokensB = new HashSet<>(TextNormalizer.tokens(b));
        Set<String> union = new HashSet<>(tokensA);
        union.addAll(tokensB);
        if (union.isEmpty()) {
            return 0.0;
        }
        tokensA.retainAll(tokensB); // Set intersection
        return tokensA.size() / (double) union.size();
    }
}
