package com.phillippitts.voicejukebox.service.rank;

import com.phillippitts.voicejukebox.config.properties.RankingProperties;
import com.phillippitts.voicejukebox.domain.Track;
import com.phillippitts.voicejukebox.service.resolve.ResolvedCandidate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Scores resolved candidates against a query, discards weak matches and merges candidates that denote
 * the same logical track across backends.
 *
 * <p><b>Pipeline:</b>
 * <ol>
 *   <li>Score each candidate's match name against the query; drop anything below the acceptance threshold</li>
 *   <li>Group candidates whose title and artist both reach the duplicate tolerance</li>
 *   <li>Pick one representative per group (backend priority, then bitrate if preferred, then enable order)</li>
 *   <li>Sort groups by their best score, descending; equal scores keep first-seen order</li>
 * </ol>
 *
 * <p>Input order matters: the resolver emits candidates in backend enable order and, within a backend,
 * in the backend's own result order (e.g. album track order), which the stable sort preserves.
 *
 * <p><b>Thread Safety:</b> immutable and thread-safe.
 */
public final class RankingEngine {

    private static final Logger LOG = LogManager.getLogger(RankingEngine.class);

    private final SimilarityScorer scorer;
    private final double acceptanceThreshold;
    private final double duplicateTolerance;
    private final List<String> backendPriority;
    private final boolean preferHighBitrate;
    private final List<String> enableOrder;

    /**
     * @param scorer      similarity strategy
     * @param props       thresholds and tie-break configuration
     * @param enableOrder enabled backend names in configured order (final tie-break)
     */
    public RankingEngine(SimilarityScorer scorer, RankingProperties props, List<String> enableOrder) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        Objects.requireNonNull(props, "props");
        this.acceptanceThreshold = props.getAcceptanceThreshold();
        this.duplicateTolerance = props.getDuplicateTolerance();
        this.backendPriority = props.getBackendPriority();
        this.preferHighBitrate = props.isPreferHighBitrate();
        this.enableOrder = enableOrder == null ? List.of() : List.copyOf(enableOrder);
    }

    /**
     * Ranks all accepted duplicate sets by descending score.
     *
     * @param query      spoken query text
     * @param candidates resolved candidates in resolver order
     * @return ranked tracks; empty when nothing reaches the acceptance threshold
     */
    public List<ScoredTrack> rank(String query, List<ResolvedCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        List<Group> groups = new ArrayList<>();
        int seen = 0;
        for (ResolvedCandidate candidate : candidates) {
            double score = scorer.score(query, candidate.matchName());
            if (score < acceptanceThreshold) {
                continue;
            }
            Member member = new Member(candidate, score, seen++);
            Group group = findGroup(groups, candidate.track());
            if (group == null) {
                groups.add(new Group(member));
            } else {
                group.members.add(member);
            }
        }

        List<ScoredTrack> ranked = new ArrayList<>(groups.size());
        for (Group group : groups) {
            ranked.add(group.toScoredTrack());
        }
        // List.sort is stable; groups were created in first-seen order
        ranked.sort(Comparator.comparingDouble(ScoredTrack::score).reversed());
        LOG.debug("Ranked {} candidates into {} tracks ({} accepted)", candidates.size(), ranked.size(), seen);
        return List.copyOf(ranked);
    }

    /**
     * Returns the single best match.
     *
     * @param query      spoken query text
     * @param candidates resolved candidates in resolver order
     * @return best track, or empty when nothing reaches the acceptance threshold
     */
    public Optional<ScoredTrack> best(String query, List<ResolvedCandidate> candidates) {
        List<ScoredTrack> ranked = rank(query, candidates);
        return ranked.isEmpty() ? Optional.empty() : Optional.of(ranked.get(0));
    }

    /**
     * True when two tracks denote the same logical recording.
     */
    boolean isDuplicate(Track a, Track b) {
        return scorer.score(a.title(), b.title()) >= duplicateTolerance
                && scorer.score(a.artist(), b.artist()) >= duplicateTolerance;
    }

    private Group findGroup(List<Group> groups, Track track) {
        for (Group group : groups) {
            if (isDuplicate(group.members.get(0).candidate.track(), track)) {
                return group;
            }
        }
        return null;
    }

    private Comparator<Member> representativeOrder() {
        Comparator<Member> order = Comparator.comparingInt(m -> 0);
        if (!backendPriority.isEmpty()) {
            order = order.thenComparingInt(m -> rankOf(backendPriority, m.backend()));
        } else if (preferHighBitrate) {
            order = order.thenComparing(
                    Comparator.comparingInt((Member m) -> m.candidate.track().bitrateKbps()).reversed());
        }
        return order
                .thenComparingInt(m -> rankOf(enableOrder, m.backend()))
                .thenComparingInt(m -> m.seen);
    }

    private static int rankOf(List<String> order, String backend) {
        int idx = order.indexOf(backend);
        return idx < 0 ? Integer.MAX_VALUE : idx;
    }

    private record Member(ResolvedCandidate candidate, double score, int seen) {
        String backend() {
            return candidate.track().backend();
        }
    }

    private final class Group {
        private final List<Member> members = new ArrayList<>();

        Group(Member first) {
            members.add(first);
        }

        ScoredTrack toScoredTrack() {
            double best = 0.0;
            for (Member m : members) {
                best = Math.max(best, m.score);
            }
            Member rep = members.stream().min(representativeOrder()).orElseThrow();
            List<Track> others = new ArrayList<>(members.size() - 1);
            for (Member m : members) {
                if (m != rep) {
                    others.add(m.candidate.track());
                }
            }
            return new ScoredTrack(rep.candidate.track(), best, rep.candidate.matchName(), others);
        }
    }
}
