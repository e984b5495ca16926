package com.phillippitts.voicejukebox.service.metrics;

import com.phillippitts.voicejukebox.domain.MatchStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for resolution and queue population.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Search latency per backend</li>
 *   <li>Backend failures per backend and reason</li>
 *   <li>Match status counts per query type</li>
 *   <li>Populator outcomes and skipped identifiers</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class PlaybackMetrics {

    private static final String METRIC_PREFIX = "jukebox";

    private final MeterRegistry registry;

    public PlaybackMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records search latency for a specific backend.
     *
     * @param backend backend name
     * @param durationNanos duration in nanoseconds
     */
    public void recordSearchLatency(String backend, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".search.latency")
                .description("Time taken by a backend to answer a search")
                .tag("backend", backend)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Increments the failure counter for a backend.
     *
     * @param backend backend name
     * @param reason failure reason (timeout, unreachable, error)
     */
    public void incrementBackendFailure(String backend, String reason) {
        Counter.builder(METRIC_PREFIX + ".backend.failure")
                .description("Number of failed backend searches")
                .tag("backend", backend)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records the match status of one voice query.
     *
     * @param queryType query type name
     * @param status match status
     */
    public void recordMatch(String queryType, MatchStatus status) {
        Counter.builder(METRIC_PREFIX + ".match")
                .description("Number of resolved voice queries by outcome")
                .tag("type", queryType)
                .tag("status", status.name())
                .register(registry)
                .increment();
    }

    /**
     * Records the final state of a populator job.
     *
     * @param state final job state
     */
    public void recordPopulatorOutcome(String state) {
        Counter.builder(METRIC_PREFIX + ".populator.outcome")
                .description("Number of populator jobs by final state")
                .tag("state", state)
                .register(registry)
                .increment();
    }

    /**
     * Increments the counter of identifiers a populator skipped because they failed to resolve.
     *
     * @param backend backend that owns the identifier
     */
    public void incrementSkippedTrack(String backend) {
        Counter.builder(METRIC_PREFIX + ".populator.skipped")
                .description("Number of track ids skipped by populators after a resolution failure")
                .tag("backend", backend)
                .register(registry)
                .increment();
    }
}
