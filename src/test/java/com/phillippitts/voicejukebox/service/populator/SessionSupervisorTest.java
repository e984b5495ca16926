package com.phillippitts.voicejukebox.service.populator;

import com.phillippitts.voicejukebox.config.properties.PopulatorProperties;
import com.phillippitts.voicejukebox.config.properties.QueueProperties;
import com.phillippitts.voicejukebox.domain.QueueEntry;
import com.phillippitts.voicejukebox.domain.Track;
import com.phillippitts.voicejukebox.domain.TrackRef;
import com.phillippitts.voicejukebox.exception.TrackResolutionException;
import com.phillippitts.voicejukebox.service.metrics.PlaybackMetrics;
import com.phillippitts.voicejukebox.service.populator.event.PopulatorFinishedEvent;
import com.phillippitts.voicejukebox.service.queue.PlaybackQueue;
import com.phillippitts.voicejukebox.service.resolve.TrackResolver;
import com.phillippitts.voicejukebox.testutil.EventCapturingPublisher;
import com.phillippitts.voicejukebox.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static com.phillippitts.voicejukebox.testutil.TestTracks.track;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SessionSupervisorTest {

    private PlaybackQueue queue;
    private TrackResolver resolver;
    private EventCapturingPublisher publisher;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        queue = new PlaybackQueue(new QueueProperties(null, null, null, null), new Random(3));
        resolver = mock(TrackResolver.class);
        publisher = new EventCapturingPublisher();
        pool = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private SessionSupervisor supervisor(Executor executor, long joinTimeoutMs) {
        PopulatorProperties props = new PopulatorProperties();
        props.setJoinTimeoutMs(joinTimeoutMs);
        return new SessionSupervisor(queue, resolver, executor, props, publisher,
                new PlaybackMetrics(new SimpleMeterRegistry()));
    }

    /** Creates tracks on one backend and teaches the resolver to return them. */
    private List<Track> stubTracks(String backend, String prefix, int count) {
        List<Track> tracks = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Track t = track(backend, prefix + i, "Song " + prefix + i, "Artist " + prefix);
            when(resolver.resolveById(t.ref())).thenReturn(t);
            tracks.add(t);
        }
        return tracks;
    }

    private static PopulatorJobSpec specOf(List<Track> tracks) {
        return PopulatorJobSpec.of(tracks.stream().map(Track::ref).toList());
    }

    private List<Track> queuedTracks() {
        return queue.snapshot().entries().stream().map(QueueEntry::track).toList();
    }

    @Test
    void emptySpecStartsNothing() {
        SessionSupervisor supervisor = supervisor(new SyncExecutor(), 500);

        Optional<PopulatorJob> job = supervisor.replacePopulator(PopulatorJobSpec.empty());

        assertThat(job).isEmpty();
        assertThat(supervisor.currentJob()).isEmpty();
        assertThat(supervisor.stopPopulator()).isFalse();
    }

    @Test
    void replaceRunsJobThatAppendsInOrder() {
        List<Track> tracks = stubTracks("nav", "a", 3);
        SessionSupervisor supervisor = supervisor(new SyncExecutor(), 500);

        PopulatorJob job = supervisor.replacePopulator(specOf(tracks)).orElseThrow();

        assertThat(job.getId()).isEqualTo("populator-1");
        assertThat(job.getState()).isEqualTo(PopulatorState.COMPLETED);
        assertThat(queuedTracks()).containsExactlyElementsOf(tracks);
        assertThat(supervisor.isPopulatorLive()).isFalse();
    }

    @Test
    void jobIdsAreSequential() {
        SessionSupervisor supervisor = supervisor(new SyncExecutor(), 500);

        String first = supervisor.replacePopulator(specOf(stubTracks("nav", "a", 1))).orElseThrow().getId();
        String second = supervisor.replacePopulator(specOf(stubTracks("nav", "b", 1))).orElseThrow().getId();

        assertThat(first).isEqualTo("populator-1");
        assertThat(second).isEqualTo("populator-2");
    }

    @Test
    void replacingCancelsPreviousJobBeforeNewOneWrites() {
        CountDownLatch firstWrote = new CountDownLatch(1);
        Track a0 = track("slow", "a0", "First", "Old Intent");
        when(resolver.resolveById(a0.ref())).thenReturn(a0);
        List<TrackRef> oldRefs = new ArrayList<>(List.of(a0.ref()));
        for (int i = 1; i < 20; i++) {
            TrackRef ref = new TrackRef("slow", "a" + i);
            oldRefs.add(ref);
            when(resolver.resolveById(ref)).thenAnswer(inv -> {
                firstWrote.countDown();
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new TrackResolutionException("Interrupted", ref);
                }
                return track("slow", ref.id(), "Late " + ref.id(), "Old Intent");
            });
        }
        List<Track> newTracks = stubTracks("nav", "b", 3);
        SessionSupervisor supervisor = supervisor(pool, 2_000);

        PopulatorJob oldJob = supervisor.replacePopulator(PopulatorJobSpec.of(oldRefs)).orElseThrow();
        await().atMost(Duration.ofSeconds(5)).until(() -> firstWrote.getCount() == 0);

        PopulatorJob newJob = supervisor.replacePopulator(specOf(newTracks)).orElseThrow();

        assertThat(oldJob.getState()).isEqualTo(PopulatorState.CANCELLED);
        await().atMost(Duration.ofSeconds(5)).until(() -> !newJob.isLive());
        assertThat(newJob.getState()).isEqualTo(PopulatorState.COMPLETED);
        List<Track> expected = new ArrayList<>();
        expected.add(a0);
        expected.addAll(newTracks);
        assertThat(queuedTracks()).containsExactlyElementsOf(expected);
    }

    @Test
    void hungJobIsFencedEvenWhenJoinTimesOut() throws InterruptedException {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        TrackRef stuck = new TrackRef("slow", "stuck");
        when(resolver.resolveById(stuck)).thenAnswer(inv -> {
            entered.countDown();
            // Ignores interrupts, like a blocking socket read would
            while (true) {
                try {
                    if (release.await(50, TimeUnit.MILLISECONDS)) {
                        break;
                    }
                } catch (InterruptedException ignored) {
                    // keep waiting
                }
            }
            return track("slow", "stuck", "Stale", "Old Intent");
        });
        List<Track> newTracks = stubTracks("nav", "b", 2);
        SessionSupervisor supervisor = supervisor(pool, 100);

        PopulatorJob oldJob = supervisor.replacePopulator(PopulatorJobSpec.of(List.of(stuck))).orElseThrow();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        long t0 = System.nanoTime();
        PopulatorJob newJob = supervisor.replacePopulator(specOf(newTracks)).orElseThrow();
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000;
        await().atMost(Duration.ofSeconds(5)).until(() -> !newJob.isLive());

        release.countDown();
        await().atMost(Duration.ofSeconds(5)).until(() -> !oldJob.isLive());

        assertThat(elapsedMs).isLessThan(2_000);
        assertThat(oldJob.getState()).isEqualTo(PopulatorState.CANCELLED);
        assertThat(queuedTracks()).containsExactlyElementsOf(newTracks);
    }

    @Test
    void rejectedSubmissionReturnsEmptyAndPublishesAborted() {
        Executor full = command -> {
            throw new RejectedExecutionException("pool saturated");
        };
        SessionSupervisor supervisor = supervisor(full, 500);

        Optional<PopulatorJob> job = supervisor.replacePopulator(specOf(stubTracks("nav", "a", 2)));

        assertThat(job).isEmpty();
        assertThat(supervisor.isPopulatorLive()).isFalse();
        assertThat(publisher.eventsOf(PopulatorFinishedEvent.class))
                .extracting(PopulatorFinishedEvent::state)
                .containsExactly(PopulatorState.ABORTED);
    }

    @Test
    void stopPopulatorCancelsLiveJob() {
        CountDownLatch entered = new CountDownLatch(1);
        TrackRef slow = new TrackRef("slow", "s1");
        when(resolver.resolveById(any())).thenAnswer(inv -> {
            entered.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TrackResolutionException("Interrupted", slow);
            }
            return track("slow", "s1", "Never", "Nobody");
        });
        SessionSupervisor supervisor = supervisor(pool, 2_000);
        PopulatorJob job = supervisor.replacePopulator(PopulatorJobSpec.of(List.of(slow))).orElseThrow();
        await().atMost(Duration.ofSeconds(5)).until(() -> entered.getCount() == 0);

        assertThat(supervisor.isPopulatorLive()).isTrue();
        assertThat(supervisor.stopPopulator()).isTrue();

        assertThat(job.getState()).isEqualTo(PopulatorState.CANCELLED);
        assertThat(supervisor.isPopulatorLive()).isFalse();
        assertThat(queue.size()).isZero();
    }

    @Test
    void shutdownStopsLiveJob() {
        CountDownLatch entered = new CountDownLatch(1);
        TrackRef slow = new TrackRef("slow", "s1");
        when(resolver.resolveById(slow)).thenAnswer(inv -> {
            entered.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TrackResolutionException("Interrupted", slow);
            }
            return track("slow", "s1", "Never", "Nobody");
        });
        SessionSupervisor supervisor = supervisor(pool, 2_000);
        PopulatorJob job = supervisor.replacePopulator(PopulatorJobSpec.of(List.of(slow))).orElseThrow();
        await().atMost(Duration.ofSeconds(5)).until(() -> entered.getCount() == 0);

        supervisor.shutdown();

        assertThat(job.isLive()).isFalse();
    }
}
