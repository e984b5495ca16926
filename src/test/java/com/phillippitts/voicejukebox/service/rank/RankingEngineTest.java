package com.phillippitts.voicejukebox.service.rank;

import com.phillippitts.voicejukebox.config.properties.RankingProperties;
import com.phillippitts.voicejukebox.domain.Track;
import com.phillippitts.voicejukebox.service.rank.impl.SequenceRatioScorer;
import com.phillippitts.voicejukebox.service.resolve.ResolvedCandidate;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.phillippitts.voicejukebox.testutil.TestTracks.byArtist;
import static com.phillippitts.voicejukebox.testutil.TestTracks.byTitle;
import static com.phillippitts.voicejukebox.testutil.TestTracks.track;
import static org.assertj.core.api.Assertions.assertThat;

class RankingEngineTest {

    private static final String QUERY = "query";

    private static RankingProperties props(List<String> priority, boolean preferHighBitrate) {
        return new RankingProperties(RankingProperties.Scorer.SEQUENCE, 0.6, 0.9, priority, preferHighBitrate);
    }

    /**
     * Returns a fixed score per candidate name for {@link #QUERY}; other comparisons are exact-match only.
     */
    static final class FixedScorer implements SimilarityScorer {
        private final Map<String, Double> scores;

        FixedScorer(Map<String, Double> scores) {
            this.scores = scores;
        }

        @Override
        public double score(String query, String candidate) {
            if (QUERY.equals(query)) {
                return scores.getOrDefault(candidate, 0.0);
            }
            return TextNormalizer.normalize(query).equals(TextNormalizer.normalize(candidate)) ? 1.0 : 0.0;
        }
    }

    @Test
    void candidatesBelowThresholdAreDiscarded() {
        RankingEngine engine = new RankingEngine(
                new FixedScorer(Map.of("Low", 0.59, "High", 0.61, "Edge", 0.6)), props(null, false), List.of("a"));

        List<ScoredTrack> ranked = engine.rank(QUERY, List.of(
                byTitle(track("a", "1", "Low", "X")),
                byTitle(track("a", "2", "High", "Y")),
                byTitle(track("a", "3", "Edge", "Z"))));

        assertThat(ranked).extracting(ScoredTrack::matchName).containsExactly("High", "Edge");
    }

    @Test
    void nothingAcceptedYieldsEmptyResult() {
        RankingEngine engine = new RankingEngine(new FixedScorer(Map.of("Low", 0.2)), props(null, false), List.of("a"));

        assertThat(engine.rank(QUERY, List.of(byTitle(track("a", "1", "Low", "X"))))).isEmpty();
        assertThat(engine.best(QUERY, List.of())).isEmpty();
    }

    @Test
    void equalScoresKeepFirstSeenOrder() {
        RankingEngine engine = new RankingEngine(
                new FixedScorer(Map.of("A", 0.8, "B", 0.8, "C", 0.9)), props(null, false), List.of("a"));

        List<ScoredTrack> ranked = engine.rank(QUERY, List.of(
                byTitle(track("a", "1", "A", "X")),
                byTitle(track("a", "2", "B", "Y")),
                byTitle(track("a", "3", "C", "Z"))));

        assertThat(ranked).extracting(ScoredTrack::matchName).containsExactly("C", "A", "B");
    }

    @Test
    void duplicateScoreIsBestOfItsMembers() {
        RankingEngine engine = new RankingEngine(
                new FixedScorer(Map.of("Bohemian Rhapsody", 0.9, "bohemian rhapsody", 0.95)),
                props(null, false), List.of("a", "b"));

        List<ScoredTrack> ranked = engine.rank(QUERY, List.of(
                byTitle(track("a", "1", "Bohemian Rhapsody", "Queen")),
                byTitle(track("b", "7", "bohemian rhapsody", "Queen"))));

        assertThat(ranked).hasSize(1);
        assertThat(ranked.get(0).score()).isEqualTo(0.95);
        assertThat(ranked.get(0).duplicates()).hasSize(1);
    }

    @Test
    void duplicatesPreferHigherBitrateWhenNoPriorityConfigured() {
        RankingEngine engine = new RankingEngine(new SequenceRatioScorer(), props(null, true), List.of("nav", "plex"));
        Track lowRate = track("nav", "1", "Bohemian Rhapsody", "Queen", "A Night at the Opera", 192);
        Track highRate = track("plex", "9", "Bohemian Rhapsody", "Queen", "A Night at the Opera", 320);

        ScoredTrack best = engine.best("bohemian rhapsody", List.of(byTitle(lowRate), byTitle(highRate))).orElseThrow();

        assertThat(best.track()).isEqualTo(highRate);
        assertThat(best.duplicates()).containsExactly(lowRate);
    }

    @Test
    void backendPriorityWinsOverBitrate() {
        RankingEngine engine = new RankingEngine(
                new SequenceRatioScorer(), props(List.of("nav", "plex"), true), List.of("plex", "nav"));
        Track lowRate = track("nav", "1", "Bohemian Rhapsody", "Queen", "", 192);
        Track highRate = track("plex", "9", "Bohemian Rhapsody", "Queen", "", 320);

        ScoredTrack best = engine.best("bohemian rhapsody", List.of(byTitle(highRate), byTitle(lowRate))).orElseThrow();

        assertThat(best.track()).isEqualTo(lowRate);
    }

    @Test
    void enableOrderBreaksRemainingTies() {
        Track fromNav = track("nav", "1", "Heroes", "David Bowie");
        Track fromPlex = track("plex", "5", "Heroes", "David Bowie");

        RankingEngine plexFirst = new RankingEngine(new SequenceRatioScorer(), props(null, false), List.of("plex", "nav"));
        RankingEngine navFirst = new RankingEngine(new SequenceRatioScorer(), props(null, false), List.of("nav", "plex"));

        List<ResolvedCandidate> candidates = List.of(byTitle(fromNav), byTitle(fromPlex));
        assertThat(plexFirst.best("heroes", candidates).orElseThrow().track()).isEqualTo(fromPlex);
        assertThat(navFirst.best("heroes", candidates).orElseThrow().track()).isEqualTo(fromNav);
    }

    @Test
    void sameTitleByDifferentArtistsIsNotADuplicate() {
        RankingEngine engine = new RankingEngine(new SequenceRatioScorer(), props(null, false), List.of("a"));

        List<ScoredTrack> ranked = engine.rank("hurt", List.of(
                byTitle(track("a", "1", "Hurt", "Nine Inch Nails")),
                byTitle(track("a", "2", "Hurt", "Johnny Cash"))));

        assertThat(ranked).hasSize(2);
        assertThat(engine.isDuplicate(ranked.get(0).track(), ranked.get(1).track())).isFalse();
    }

    @Test
    void misspelledArtistQueryFindsArtistAndSkipsUnrelated() {
        RankingEngine engine = new RankingEngine(new SequenceRatioScorer(), props(null, false), List.of("b"));

        List<ScoredTrack> ranked = engine.rank("qeen", List.of(
                byArtist(track("b", "1", "Bohemian Rhapsody", "Queen")),
                byArtist(track("b", "2", "Everlong", "Foo Fighters")),
                byArtist(track("b", "3", "Killer Queen", "Queen"))));

        assertThat(ranked).extracting(st -> st.track().id()).containsExactly("1", "3");
        assertThat(ranked.get(0).score()).isGreaterThan(0.8);
    }
}
