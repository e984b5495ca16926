package com.phillippitts.voicejukebox.service.orchestration;

import com.phillippitts.voicejukebox.config.properties.QueueProperties;
import com.phillippitts.voicejukebox.domain.LibrarySource;
import com.phillippitts.voicejukebox.domain.MatchStatus;
import com.phillippitts.voicejukebox.domain.PlaybackMode;
import com.phillippitts.voicejukebox.domain.QueryType;
import com.phillippitts.voicejukebox.domain.Track;
import com.phillippitts.voicejukebox.domain.TrackRef;
import com.phillippitts.voicejukebox.exception.TrackResolutionException;
import com.phillippitts.voicejukebox.service.metrics.PlaybackMetrics;
import com.phillippitts.voicejukebox.service.populator.PopulatorJobSpec;
import com.phillippitts.voicejukebox.service.populator.SessionSupervisor;
import com.phillippitts.voicejukebox.service.queue.PlaybackQueue;
import com.phillippitts.voicejukebox.service.rank.RankingEngine;
import com.phillippitts.voicejukebox.service.rank.ScoredTrack;
import com.phillippitts.voicejukebox.service.rank.TextNormalizer;
import com.phillippitts.voicejukebox.service.resolve.LibraryListing;
import com.phillippitts.voicejukebox.service.resolve.ResolutionResult;
import com.phillippitts.voicejukebox.service.resolve.TrackResolver;
import com.phillippitts.voicejukebox.util.LogSanitizer;
import com.phillippitts.voicejukebox.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Default implementation of {@link PlaybackOrchestrator}.
 *
 * <p><b>Selection:</b> a TRACK query plays the single best match. ARTIST, ALBUM, GENRE and PLAYLIST
 * queries play every accepted track whose match name equals the best match's name (after
 * normalization), in ranking order, so "play Queen" does not mix in a similarly named artist.
 * Library selections are shuffled across backends before the head slice is taken.
 *
 * <p><b>Error Handling:</b> backend outages arrive as {@link MatchStatus} values, never exceptions.
 */
@Service
public class DefaultPlaybackOrchestrator implements PlaybackOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultPlaybackOrchestrator.class);

    private final TrackResolver resolver;
    private final RankingEngine ranking;
    private final PlaybackQueue queue;
    private final SessionSupervisor supervisor;
    private final PlaybackMetrics metrics;
    private final int headSliceSize;
    private final int maxTracks;
    private final Random random;

    @Autowired
    public DefaultPlaybackOrchestrator(TrackResolver resolver,
                                       RankingEngine ranking,
                                       PlaybackQueue queue,
                                       SessionSupervisor supervisor,
                                       PlaybackMetrics metrics,
                                       QueueProperties props) {
        this(resolver, ranking, queue, supervisor, metrics, props, new Random());
    }

    public DefaultPlaybackOrchestrator(TrackResolver resolver,
                                       RankingEngine ranking,
                                       PlaybackQueue queue,
                                       SessionSupervisor supervisor,
                                       PlaybackMetrics metrics,
                                       QueueProperties props,
                                       Random random) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.ranking = Objects.requireNonNull(ranking, "ranking must not be null");
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.headSliceSize = props.getHeadSliceSize();
        this.maxTracks = props.getMaxTracks();
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    @Override
    public EnqueueOutcome resolveAndEnqueue(QueryType type, String freeText, PlaybackMode requestedMode) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(freeText, "freeText");
        long t0 = System.nanoTime();

        // A populator from the previous intent must not keep appending to the queue we are about to replace
        supervisor.stopPopulator();

        ResolutionResult result = resolver.resolve(type, freeText);
        if (result.allSourcesUnreachable()) {
            LOG.warn("No backend answered {} query '{}' (failed: {})",
                    type, LogSanitizer.queryPreview(freeText), result.failedBackends().keySet());
            metrics.recordMatch(type.name(), MatchStatus.ALL_SOURCES_UNREACHABLE);
            return EnqueueOutcome.unmatched(MatchStatus.ALL_SOURCES_UNREACHABLE);
        }

        List<Track> selected = select(type, ranking.rank(freeText, result.candidates()));
        if (selected.isEmpty()) {
            LOG.info("No match for {} query '{}'", type, LogSanitizer.queryPreview(freeText));
            metrics.recordMatch(type.name(), MatchStatus.NOT_FOUND);
            return EnqueueOutcome.unmatched(MatchStatus.NOT_FOUND);
        }

        List<Track> capped = selected.size() > maxTracks ? selected.subList(0, maxTracks) : selected;
        List<Track> head = List.copyOf(capped.subList(0, Math.min(headSliceSize, capped.size())));
        List<TrackRef> rest = new ArrayList<>(capped.size() - head.size());
        for (Track t : capped.subList(head.size(), capped.size())) {
            rest.add(t.ref());
        }
        PopulatorJobSpec remainder = PopulatorJobSpec.of(rest);

        queue.clear();
        queue.enqueue(head);
        if (requestedMode != null) {
            queue.setMode(requestedMode);
        }
        queue.play();
        supervisor.replacePopulator(remainder);

        metrics.recordMatch(type.name(), MatchStatus.FOUND);
        LOG.info("Enqueued {} of {} tracks for {} query '{}' in {} ms ({} backends failed)",
                head.size(), capped.size(), type, LogSanitizer.queryPreview(freeText),
                TimeUtils.elapsedMillis(t0), result.failedBackends().size());
        return new EnqueueOutcome(head, remainder, MatchStatus.FOUND);
    }

    @Override
    public EnqueueOutcome playLibrary(LibrarySource source, PlaybackMode requestedMode) {
        Objects.requireNonNull(source, "source");
        long t0 = System.nanoTime();
        supervisor.stopPopulator();

        LibraryListing listing = resolver.listLibrary(source, maxTracks);
        if (listing.allSourcesUnreachable()) {
            LOG.warn("No backend answered {} listing (failed: {})", source, listing.failedBackends().keySet());
            metrics.recordMatch(source.name(), MatchStatus.ALL_SOURCES_UNREACHABLE);
            return EnqueueOutcome.unmatched(MatchStatus.ALL_SOURCES_UNREACHABLE);
        }

        List<TrackRef> refs = new ArrayList<>(listing.refs());
        Collections.shuffle(refs, random);
        if (refs.size() > maxTracks) {
            refs = refs.subList(0, maxTracks);
        }

        // Each head candidate costs a backend round trip on the request thread, so attempts are bounded
        List<Track> head = new ArrayList<>(headSliceSize);
        int next = 0;
        int attempts = Math.min(refs.size(), headSliceSize * 2);
        while (head.size() < headSliceSize && next < attempts) {
            TrackRef ref = refs.get(next++);
            try {
                head.add(resolver.resolveById(ref));
            } catch (TrackResolutionException e) {
                LOG.warn("Dropping {} from {} selection: {}", ref, source, e.getMessage());
            }
        }
        if (head.isEmpty()) {
            LOG.info("No playable track in {} selection ({} listed)", source, refs.size());
            metrics.recordMatch(source.name(), MatchStatus.NOT_FOUND);
            return EnqueueOutcome.unmatched(MatchStatus.NOT_FOUND);
        }
        PopulatorJobSpec remainder = PopulatorJobSpec.of(refs.subList(next, refs.size()));

        queue.clear();
        queue.enqueue(head);
        if (requestedMode != null) {
            queue.setMode(requestedMode);
        }
        queue.play();
        supervisor.replacePopulator(remainder);

        metrics.recordMatch(source.name(), MatchStatus.FOUND);
        LOG.info("Enqueued {} of {} tracks for {} selection in {} ms ({} backends failed)",
                head.size(), refs.size(), source, TimeUtils.elapsedMillis(t0), listing.failedBackends().size());
        return new EnqueueOutcome(head, remainder, MatchStatus.FOUND);
    }

    @Override
    public SearchOutcome search(QueryType type, String freeText) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(freeText, "freeText");
        ResolutionResult result = resolver.resolve(type, freeText);
        if (result.allSourcesUnreachable()) {
            metrics.recordMatch(type.name(), MatchStatus.ALL_SOURCES_UNREACHABLE);
            return new SearchOutcome(MatchStatus.ALL_SOURCES_UNREACHABLE, List.of(), result.failedBackends());
        }
        List<ScoredTrack> ranked = ranking.rank(freeText, result.candidates());
        MatchStatus status = ranked.isEmpty() ? MatchStatus.NOT_FOUND : MatchStatus.FOUND;
        metrics.recordMatch(type.name(), status);
        return new SearchOutcome(status, ranked, result.failedBackends());
    }

    private static List<Track> select(QueryType type, List<ScoredTrack> ranked) {
        if (ranked.isEmpty()) {
            return List.of();
        }
        ScoredTrack best = ranked.get(0);
        if (type == QueryType.TRACK) {
            return List.of(best.track());
        }
        String bestName = TextNormalizer.normalize(best.matchName());
        List<Track> out = new ArrayList<>();
        for (ScoredTrack st : ranked) {
            if (TextNormalizer.normalize(st.matchName()).equals(bestName)) {
                out.add(st.track());
            }
        }
        return out;
    }
}
