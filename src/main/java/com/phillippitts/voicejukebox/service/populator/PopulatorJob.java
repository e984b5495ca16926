package com.phillippitts.voicejukebox.service.populator;

import com.phillippitts.voicejukebox.domain.Track;
import com.phillippitts.voicejukebox.domain.TrackRef;
import com.phillippitts.voicejukebox.exception.PopulatorProtocolException;
import com.phillippitts.voicejukebox.exception.TrackResolutionException;
import com.phillippitts.voicejukebox.service.metrics.PlaybackMetrics;
import com.phillippitts.voicejukebox.service.populator.event.PopulatorFinishedEvent;
import com.phillippitts.voicejukebox.service.queue.PlaybackQueue;
import com.phillippitts.voicejukebox.service.queue.WriteLease;
import com.phillippitts.voicejukebox.service.resolve.TrackResolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Background job that resolves a batch of track identifiers and appends them to the queue in order.
 *
 * <p>Cancellation is cooperative: the flag is checked before every identifier, and
 * {@link #cancel()} also interrupts the worker thread to cut short a blocking backend call. A job
 * never relies on either for queue safety: writes go through its {@link WriteLease}, which the
 * supervisor revokes before starting a replacement.
 *
 * <p>A job runs at most once. Instances are created and scheduled by {@link SessionSupervisor}.
 */
public final class PopulatorJob implements Runnable {

    private static final Logger LOG = LogManager.getLogger(PopulatorJob.class);

    static final String MDC_KEY = "populatorJob";

    private final String id;
    private final PopulatorJobSpec spec;
    private final TrackResolver resolver;
    private final PlaybackQueue queue;
    private final WriteLease lease;
    private final ApplicationEventPublisher publisher;
    private final PlaybackMetrics metrics;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CountDownLatch done = new CountDownLatch(1);
    private final Lock workerLock = new ReentrantLock();
    private Thread worker;

    private volatile PopulatorState state = PopulatorState.PENDING;
    private volatile int appended;
    private volatile int skipped;

    PopulatorJob(String id,
                 PopulatorJobSpec spec,
                 TrackResolver resolver,
                 PlaybackQueue queue,
                 WriteLease lease,
                 ApplicationEventPublisher publisher,
                 PlaybackMetrics metrics) {
        this.id = Objects.requireNonNull(id, "id");
        this.spec = Objects.requireNonNull(spec, "spec");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.lease = Objects.requireNonNull(lease, "lease");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public void run() {
        if (!started.compareAndSet(false, true)) {
            LOG.warn("Populator {} already ran; ignoring second start", id);
            return;
        }
        workerLock.lock();
        try {
            worker = Thread.currentThread();
        } finally {
            workerLock.unlock();
        }
        ThreadContext.put(MDC_KEY, id);
        PopulatorState outcome;
        try {
            state = PopulatorState.RUNNING;
            outcome = populate();
        } catch (PopulatorProtocolException e) {
            LOG.error("Populator {} aborted: {}", id, e.getMessage());
            outcome = PopulatorState.ABORTED;
        } catch (RuntimeException e) {
            LOG.error("Populator {} failed unexpectedly", id, e);
            outcome = PopulatorState.ABORTED;
        } finally {
            workerLock.lock();
            try {
                worker = null;
                // Do not leak a cancellation interrupt into the next pooled task
                Thread.interrupted();
            } finally {
                workerLock.unlock();
            }
            ThreadContext.remove(MDC_KEY);
        }
        finish(outcome);
    }

    private PopulatorState populate() {
        LOG.info("Populator {} started: {} ids from {}", id, spec.size(), spec.originBackend());
        for (TrackRef ref : spec.refs()) {
            if (isCancelRequested()) {
                return PopulatorState.CANCELLED;
            }
            Track track;
            try {
                track = resolver.resolveById(ref);
            } catch (TrackResolutionException e) {
                if (isCancelRequested()) {
                    return PopulatorState.CANCELLED;
                }
                skipped++;
                metrics.incrementSkippedTrack(ref.backend());
                LOG.warn("Populator {} skipping {}: {}", id, ref, e.getMessage());
                continue;
            }
            if (!queue.append(lease, track)) {
                if (cancelled.get()) {
                    return PopulatorState.CANCELLED;
                }
                throw new PopulatorProtocolException(
                        "Queue rejected append of " + ref + " from a job that was not cancelled", id);
            }
            appended++;
        }
        if (spec.hasPending() && skipped == spec.size()) {
            return PopulatorState.FAILED;
        }
        return PopulatorState.COMPLETED;
    }

    /**
     * Requests cancellation and interrupts the worker if the job is running.
     */
    public void cancel() {
        cancelled.set(true);
        workerLock.lock();
        try {
            if (worker != null) {
                worker.interrupt();
            }
        } finally {
            workerLock.unlock();
        }
    }

    /**
     * Terminates a job that never ran, because it was cancelled first or the executor rejected it.
     */
    void abandon(PopulatorState terminal) {
        if (started.compareAndSet(false, true)) {
            finish(terminal);
        }
    }

    /**
     * Waits for the job to reach a terminal state.
     *
     * @return {@code true} if the job finished within the timeout
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean awaitTermination(long timeoutMs) throws InterruptedException {
        return done.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    private boolean isCancelRequested() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    private void finish(PopulatorState outcome) {
        state = outcome;
        done.countDown();
        LOG.info("Populator {} finished {}: appended={}, skipped={}, total={}",
                id, outcome, appended, skipped, spec.size());
        metrics.recordPopulatorOutcome(outcome.name());
        publisher.publishEvent(new PopulatorFinishedEvent(id, spec.originBackend(), outcome,
                spec.size(), appended, skipped, null));
    }

    public String getId() {
        return id;
    }

    public PopulatorJobSpec getSpec() {
        return spec;
    }

    public PopulatorState getState() {
        return state;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isLive() {
        return !state.isTerminal();
    }

    public int getAppended() {
        return appended;
    }

    public int getSkipped() {
        return skipped;
    }

    WriteLease getLease() {
        return lease;
    }
}
