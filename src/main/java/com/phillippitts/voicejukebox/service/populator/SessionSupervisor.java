package com.phillippitts.voicejukebox.service.populator;

import com.phillippitts.voicejukebox.config.properties.PopulatorProperties;
import com.phillippitts.voicejukebox.service.metrics.PlaybackMetrics;
import com.phillippitts.voicejukebox.service.queue.PlaybackQueue;
import com.phillippitts.voicejukebox.service.queue.WriteLease;
import com.phillippitts.voicejukebox.service.resolve.TrackResolver;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single live populator handle.
 *
 * <p><b>Replacement protocol</b> (all under the supervisor lock):
 * <ol>
 *   <li>Cancel the live job: set its flag and interrupt its worker</li>
 *   <li>Revoke its queue lease, so none of its later writes can land</li>
 *   <li>Wait up to {@code jukebox.populator.join-timeout-ms} for it to stop</li>
 *   <li>If the new spec has pending identifiers, open a lease and submit the new job</li>
 * </ol>
 * A join timeout is logged but does not endanger the queue: step 2 already fenced the old job.
 *
 * <p><b>Thread Safety:</b> all public methods are thread-safe; concurrent replacements are serialized.
 */
@Service
public class SessionSupervisor {

    private static final Logger LOG = LogManager.getLogger(SessionSupervisor.class);

    private final PlaybackQueue queue;
    private final TrackResolver resolver;
    private final Executor executor;
    private final long joinTimeoutMs;
    private final ApplicationEventPublisher publisher;
    private final PlaybackMetrics metrics;

    private final Lock lock = new ReentrantLock();
    private final AtomicLong sequence = new AtomicLong();
    private PopulatorJob live;

    public SessionSupervisor(PlaybackQueue queue,
                             TrackResolver resolver,
                             @Qualifier("populatorExecutor") Executor executor,
                             PopulatorProperties props,
                             ApplicationEventPublisher publisher,
                             PlaybackMetrics metrics) {
        this.queue = Objects.requireNonNull(queue);
        this.resolver = Objects.requireNonNull(resolver);
        this.executor = Objects.requireNonNull(executor);
        this.joinTimeoutMs = props.getJoinTimeoutMs();
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * Stops the live populator, if any, and starts a new one for the given work.
     *
     * @param spec identifiers still to enqueue
     * @return the new job, or empty when the spec has nothing pending or the executor rejected it
     */
    public Optional<PopulatorJob> replacePopulator(PopulatorJobSpec spec) {
        Objects.requireNonNull(spec, "spec");
        lock.lock();
        try {
            stopLive();
            if (!spec.hasPending()) {
                return Optional.empty();
            }
            String id = "populator-" + sequence.incrementAndGet();
            WriteLease lease = queue.openLease(id);
            PopulatorJob job = new PopulatorJob(id, spec, resolver, queue, lease, publisher, metrics);
            try {
                executor.execute(job);
            } catch (RejectedExecutionException e) {
                LOG.error("Populator {} rejected by executor; {} ids will not be enqueued", id, spec.size());
                queue.revokeLease(lease);
                job.abandon(PopulatorState.ABORTED);
                return Optional.empty();
            }
            live = job;
            LOG.debug("Populator {} submitted with {} ids", id, spec.size());
            return Optional.of(job);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the live populator, if any.
     *
     * @return {@code true} if a live job was stopped
     */
    public boolean stopPopulator() {
        lock.lock();
        try {
            return stopLive();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the most recently started job, live or finished.
     */
    public Optional<PopulatorJob> currentJob() {
        lock.lock();
        try {
            return Optional.ofNullable(live);
        } finally {
            lock.unlock();
        }
    }

    public boolean isPopulatorLive() {
        lock.lock();
        try {
            return live != null && live.isLive();
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        if (stopPopulator()) {
            LOG.info("Stopped live populator on shutdown");
        }
    }

    private boolean stopLive() {
        PopulatorJob job = live;
        if (job == null || !job.isLive()) {
            return false;
        }
        job.cancel();
        queue.revokeLease(job.getLease());
        job.abandon(PopulatorState.CANCELLED);
        try {
            if (!job.awaitTermination(joinTimeoutMs)) {
                LOG.warn("Populator {} did not stop within {} ms; its lease is revoked", job.getId(), joinTimeoutMs);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for populator {} to stop", job.getId());
        }
        return true;
    }
}
