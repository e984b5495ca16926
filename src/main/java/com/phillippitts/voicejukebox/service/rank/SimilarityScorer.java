package com.phillippitts.voicejukebox.service.rank;

/**
 * Strategy interface for scoring how closely a catalog name matches a spoken query.
 *
 * <p><b>Available Strategies:</b>
 * <ul>
 *   <li>{@link com.phillippitts.voicejukebox.service.rank.impl.SequenceRatioScorer} -
 *       Ratcliff/Obershelp ratio over characters (default)</li>
 *   <li>{@link com.phillippitts.voicejukebox.service.rank.impl.TokenOverlapScorer} -
 *       Jaccard similarity over word tokens</li>
 * </ul>
 *
 * <p><b>Contract:</b> scores are in [0,1]; equal normalized inputs score exactly 1.0. Implementations
 * must be stateless and thread-safe.
 *
 * @see AbstractSimilarityScorer
 */
public interface SimilarityScorer {

    /**
     * Scores two raw strings. Both are normalized with {@link TextNormalizer} first.
     *
     * @param query    spoken query or reference name (may be null)
     * @param candidate catalog name (may be null)
     * @return similarity in [0,1]
     */
    double score(String query, String candidate);
}
