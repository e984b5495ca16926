package com.phillippitts.voicejukebox.service.rank;

/**
 * Template for scorers: normalizes both inputs and handles the exact and empty cases, so
 * subclasses only compare two distinct, non-empty normalized strings.
 */
public abstract class AbstractSimilarityScorer implements SimilarityScorer {

    @Override
    public final double score(String query, String candidate) {
        String a = TextNormalizer.normalize(query);
        String b = TextNormalizer.normalize(candidate);
        if (a.equals(b)) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        double s = doScore(a, b);
        return Math.max(0.0, Math.min(1.0, s));
    }

    /**
     * Scores two different, non-empty normalized strings.
     *
     * @param a normalized query
     * @param b normalized candidate
     * @return similarity in [0,1]
     */
    protected abstract double doScore(String a, String b);
}
