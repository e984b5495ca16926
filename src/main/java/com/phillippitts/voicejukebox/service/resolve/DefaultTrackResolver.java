package com.phillippitts.voicejukebox.service.resolve;

import com.phillippitts.voicejukebox.config.properties.ResolverProperties;
import com.phillippitts.voicejukebox.domain.LibrarySource;
import com.phillippitts.voicejukebox.domain.QueryType;
import com.phillippitts.voicejukebox.domain.Track;
import com.phillippitts.voicejukebox.domain.TrackRef;
import com.phillippitts.voicejukebox.exception.SourceUnreachableException;
import com.phillippitts.voicejukebox.exception.TrackResolutionException;
import com.phillippitts.voicejukebox.service.backend.BackendCandidate;
import com.phillippitts.voicejukebox.service.backend.BackendProvider;
import com.phillippitts.voicejukebox.service.backend.BackendRegistry;
import com.phillippitts.voicejukebox.service.backend.CandidateNormalizer;
import com.phillippitts.voicejukebox.service.metrics.PlaybackMetrics;
import com.phillippitts.voicejukebox.service.resolve.event.SourceUnreachableEvent;
import com.phillippitts.voicejukebox.util.LogSanitizer;
import com.phillippitts.voicejukebox.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Default implementation of {@link TrackResolver} that queries every enabled backend in parallel.
 *
 * <p>Key features:
 * <ul>
 *   <li><b>Parallel Execution:</b> one search task per enabled backend on the {@code searchExecutor}</li>
 *   <li><b>Timeout Protection:</b> {@code jukebox.resolver.search-timeout-ms} bounds the whole fan-out;
 *       late searches are interrupted and a saturated pool fails the backend instead of running it
 *       on the caller</li>
 *   <li><b>Graceful Degradation:</b> a failing backend is recorded in the result, never thrown</li>
 *   <li><b>Normalization:</b> raw candidates become {@link Track}s through {@link CandidateNormalizer}</li>
 * </ul>
 *
 * <p><b>Error Handling:</b> every failed backend publishes a {@link SourceUnreachableEvent} and is
 * listed in {@link ResolutionResult#failedBackends()}. Callers distinguish "nothing matched" from
 * "nobody answered" via {@link ResolutionResult#allSourcesUnreachable()}.
 */
@Service
public class DefaultTrackResolver implements TrackResolver {

    private static final Logger LOG = LogManager.getLogger(DefaultTrackResolver.class);

    static final String REASON_TIMEOUT = "timeout";
    static final String REASON_UNREACHABLE = "unreachable";
    static final String REASON_ERROR = "error";
    static final String REASON_REJECTED = "rejected";

    private final BackendRegistry registry;
    private final CandidateNormalizer normalizer;
    private final Executor executor;
    private final long timeoutMs;
    private final ApplicationEventPublisher publisher;
    private final PlaybackMetrics metrics;

    public DefaultTrackResolver(BackendRegistry registry,
                                CandidateNormalizer normalizer,
                                @Qualifier("searchExecutor") Executor executor,
                                ResolverProperties props,
                                ApplicationEventPublisher publisher,
                                PlaybackMetrics metrics) {
        this.registry = Objects.requireNonNull(registry);
        this.normalizer = Objects.requireNonNull(normalizer);
        this.executor = Objects.requireNonNull(executor);
        this.timeoutMs = props.getSearchTimeoutMs();
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = Objects.requireNonNull(metrics);
    }

    @Override
    public ResolutionResult resolve(QueryType type, String freeText) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(freeText, "freeText");
        FanOut<ResolvedCandidate> fanOut = fanOut(provider -> searchOne(provider, type, freeText));
        LOG.debug("Resolved {} '{}' -> {} candidates from {} backends ({} failed)",
                type, LogSanitizer.queryPreview(freeText), fanOut.items().size(), fanOut.queried().size(),
                fanOut.failed().size());
        return new ResolutionResult(fanOut.items(), fanOut.queried(), fanOut.failed());
    }

    @Override
    public LibraryListing listLibrary(LibrarySource source, int limitPerBackend) {
        Objects.requireNonNull(source, "source");
        FanOut<TrackRef> fanOut = fanOut(provider -> listOne(provider, source, limitPerBackend));
        LOG.debug("Listed {} -> {} tracks from {} backends ({} failed)",
                source, fanOut.items().size(), fanOut.queried().size(), fanOut.failed().size());
        return new LibraryListing(fanOut.items(), fanOut.queried(), fanOut.failed());
    }

    /**
     * Runs one call per enabled backend on the search pool and collects the answers that arrive before
     * the shared deadline, in enable order.
     */
    private <T> FanOut<T> fanOut(Function<BackendProvider, BackendOutcome<T>> call) {
        List<BackendProvider> providers = registry.enabledProviders();
        List<String> queried = new ArrayList<>(providers.size());
        // null marks a backend whose call the pool refused
        List<FutureTask<BackendOutcome<T>>> tasks = new ArrayList<>(providers.size());
        for (BackendProvider provider : providers) {
            queried.add(provider.getBackendName());
            tasks.add(submit(provider, call));
        }

        long deadline = TimeUtils.deadlineAfter(timeoutMs);
        List<T> items = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (int i = 0; i < tasks.size(); i++) {
            String backend = queried.get(i);
            FutureTask<BackendOutcome<T>> task = tasks.get(i);
            BackendOutcome<T> outcome = task == null
                    ? BackendOutcome.failed(REASON_REJECTED)
                    : awaitOutcome(backend, task, deadline);
            if (outcome.failure() != null) {
                recordFailure(failed, backend, outcome.failure());
            } else {
                items.addAll(outcome.items());
            }
        }
        return new FanOut<>(items, queried, failed);
    }

    @Override
    public Track resolveById(TrackRef ref) {
        Objects.requireNonNull(ref, "ref");
        BackendProvider provider = registry.find(ref.backend())
                .orElseThrow(() -> new TrackResolutionException("Backend not enabled", ref));
        try {
            Track track = provider.resolveById(ref.id());
            if (track == null) {
                throw new TrackResolutionException("Backend returned no track", ref);
            }
            if (!ref.equals(track.ref())) {
                throw new TrackResolutionException("Backend returned a different track " + track.ref(), ref);
            }
            return track;
        } catch (TrackResolutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TrackResolutionException("Failed to resolve track: " + e.getMessage(), ref, e);
        }
    }

    @Override
    public String streamLocatorFor(Track track) {
        Objects.requireNonNull(track, "track");
        if (track.streamLocator() != null && !track.streamLocator().isBlank()) {
            return track.streamLocator();
        }
        TrackRef ref = track.ref();
        BackendProvider provider = registry.find(track.backend())
                .orElseThrow(() -> new TrackResolutionException("Backend not enabled", ref));
        try {
            String locator = provider.streamLocatorFor(track);
            if (locator == null || locator.isBlank()) {
                throw new TrackResolutionException("Backend produced no stream locator", ref);
            }
            return locator;
        } catch (TrackResolutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TrackResolutionException("Failed to resolve stream locator: " + e.getMessage(), ref, e);
        }
    }

    private BackendOutcome<ResolvedCandidate> searchOne(BackendProvider provider, QueryType type, String text) {
        String backend = provider.getBackendName();
        long t0 = System.nanoTime();
        try {
            List<BackendCandidate> raw = provider.search(type, text);
            metrics.recordSearchLatency(backend, System.nanoTime() - t0);
            return BackendOutcome.success(normalize(backend, type, raw));
        } catch (SourceUnreachableException e) {
            LOG.warn("Backend {} unreachable: {}", backend, e.getMessage());
            return BackendOutcome.failed(REASON_UNREACHABLE);
        } catch (RuntimeException e) {
            LOG.error("Backend {} unexpected search error", backend, e);
            return BackendOutcome.failed(REASON_ERROR);
        }
    }

    private BackendOutcome<TrackRef> listOne(BackendProvider provider, LibrarySource source, int limit) {
        String backend = provider.getBackendName();
        try {
            List<String> ids = provider.listTrackIds(source, limit);
            List<TrackRef> refs = new ArrayList<>();
            if (ids != null) {
                for (String id : ids) {
                    if (refs.size() == limit) {
                        break;
                    }
                    if (id != null && !id.isBlank()) {
                        refs.add(new TrackRef(backend, id));
                    }
                }
            }
            return BackendOutcome.success(refs);
        } catch (SourceUnreachableException e) {
            LOG.warn("Backend {} unreachable: {}", backend, e.getMessage());
            return BackendOutcome.failed(REASON_UNREACHABLE);
        } catch (RuntimeException e) {
            LOG.error("Backend {} unexpected listing error", backend, e);
            return BackendOutcome.failed(REASON_ERROR);
        }
    }

    private List<ResolvedCandidate> normalize(String backend, QueryType type, List<BackendCandidate> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        CandidateNormalizer.TrackField matchField = CandidateNormalizer.matchField(type);
        List<ResolvedCandidate> out = new ArrayList<>(raw.size());
        for (BackendCandidate candidate : raw) {
            if (!backend.equals(candidate.backend())) {
                LOG.warn("Dropping candidate tagged '{}' returned by backend '{}'", candidate.backend(), backend);
                continue;
            }
            Optional<String> matchName = normalizer.extract(candidate, matchField);
            if (matchName.isEmpty()) {
                continue;
            }
            normalizer.toTrack(candidate)
                    .ifPresent(track -> out.add(new ResolvedCandidate(track, matchName.get())));
        }
        return out;
    }

    private void recordFailure(Map<String, String> failed, String backend, String reason) {
        failed.put(backend, reason);
        metrics.incrementBackendFailure(backend, reason);
        publisher.publishEvent(new SourceUnreachableEvent(backend, reason, null));
    }

    private <T> FutureTask<BackendOutcome<T>> submit(BackendProvider provider,
                                                     Function<BackendProvider, BackendOutcome<T>> call) {
        FutureTask<BackendOutcome<T>> task = new FutureTask<>(() -> call.apply(provider));
        try {
            executor.execute(task);
            return task;
        } catch (RejectedExecutionException e) {
            LOG.warn("Search pool saturated; not querying backend {}", provider.getBackendName());
            return null;
        }
    }

    /**
     * Waits for one backend until the shared deadline. A search still running at the deadline is
     * cancelled with an interrupt so it releases its pool thread.
     */
    private <T> BackendOutcome<T> awaitOutcome(String backend, FutureTask<BackendOutcome<T>> task, long deadline) {
        try {
            return task.get(TimeUtils.remainingMillis(deadline), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            task.cancel(true);
            LOG.warn("Backend {} did not answer within {} ms", backend, timeoutMs);
            return BackendOutcome.failed(REASON_TIMEOUT);
        } catch (InterruptedException ie) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            return BackendOutcome.failed(REASON_TIMEOUT);
        } catch (ExecutionException | CancellationException e) {
            LOG.debug("Backend {} outcome unavailable: {}", backend, e.toString());
            return BackendOutcome.failed(REASON_ERROR);
        }
    }

    private record BackendOutcome<T>(List<T> items, String failure) {
        static <T> BackendOutcome<T> success(List<T> items) {
            return new BackendOutcome<>(items, null);
        }

        static <T> BackendOutcome<T> failed(String reason) {
            return new BackendOutcome<>(List.of(), reason);
        }
    }

    private record FanOut<T>(List<T> items, List<String> queried, Map<String, String> failed) {
    }
}
