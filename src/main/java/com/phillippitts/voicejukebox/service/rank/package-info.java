/**
 * Similarity scoring, acceptance filtering and cross-backend deduplication of resolved candidates.
 *
 * <p>The scorer is selected by {@code jukebox.ranking.scorer} in
 * {@link com.phillippitts.voicejukebox.config.ranking.RankingConfig}.
 */
package com.phillippitts.voicejukebox.service.rank;
