package com.phillippitts.voicejukebox.service.queue;

import com.phillippitts.voicejukebox.config.properties.QueueProperties;
import com.phillippitts.voicejukebox.domain.QueueEntry;
import com.phillippitts.voicejukebox.domain.Track;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.phillippitts.voicejukebox.testutil.TestTracks.track;
import static org.assertj.core.api.Assertions.assertThat;

class PlaybackQueueConcurrencyTest {

    @Test
    void noAppendLandsAfterRevokeReturns() throws InterruptedException {
        PlaybackQueue queue = new PlaybackQueue(new QueueProperties(null, null, null, false), new Random(1));
        WriteLease lease = queue.openLease("populator-1");
        CountDownLatch writing = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();

        Thread writer = new Thread(() -> {
            int i = 0;
            while (queue.append(lease, track("nav", "w" + i, "Song " + i, "Writer"))) {
                accepted.incrementAndGet();
                i++;
                writing.countDown();
            }
        });
        writer.start();
        assertThat(writing.await(5, TimeUnit.SECONDS)).isTrue();

        queue.revokeLease(lease);
        int sizeAtRevoke = queue.size();
        writer.join(5_000);

        assertThat(writer.isAlive()).isFalse();
        assertThat(queue.size()).isEqualTo(sizeAtRevoke).isEqualTo(accepted.get());
    }

    @Test
    void concurrentNavigationAndAppendsKeepQueueConsistent() throws InterruptedException {
        PlaybackQueue queue = new PlaybackQueue(new QueueProperties(null, null, null, false), new Random(2));
        queue.enqueue(List.of(track("nav", "h", "Head", "Artist")));
        WriteLease lease = queue.openLease("populator-1");

        Thread writer = new Thread(() -> {
            for (int i = 0; i < 200; i++) {
                queue.append(lease, track("nav", "p" + i, "Song " + i, "Artist"));
            }
        });
        Thread navigator = new Thread(() -> {
            for (int i = 0; i < 200; i++) {
                queue.skip();
                queue.peekUpcoming(3);
            }
        });
        writer.start();
        navigator.start();
        writer.join(5_000);
        navigator.join(5_000);

        QueueSnapshot snapshot = queue.snapshot();
        assertThat(snapshot.size()).isEqualTo(201);
        int accounted = snapshot.history().size() + snapshot.upcoming().size() + (snapshot.current() == null ? 0 : 1);
        assertThat(accounted).isEqualTo(201);
        assertThat(snapshot.entries()).extracting(QueueEntry::track).doesNotContainNull();
    }

    @Test
    void foregroundEnqueueLandsAheadOfLivePopulatorBatch() {
        PlaybackQueue queue = new PlaybackQueue(new QueueProperties(null, null, null, false), new Random(3));
        Track a = track("nav", "a", "Existing", "Artist");
        Track p1 = track("nav", "p1", "Batch One", "Artist");
        Track p2 = track("nav", "p2", "Batch Two", "Artist");
        Track f1 = track("nav", "f1", "Requested", "Artist");
        queue.enqueue(List.of(a));
        WriteLease lease = queue.openLease("populator-1");

        queue.append(lease, p1);
        queue.enqueue(List.of(f1));
        queue.append(lease, p2);

        assertThat(queue.snapshot().entries()).extracting(QueueEntry::track).containsExactly(a, f1, p1, p2);
    }

    @Test
    void enqueueGoesToTailOnceLeaseIsRevoked() {
        PlaybackQueue queue = new PlaybackQueue(new QueueProperties(null, null, null, false), new Random(4));
        Track a = track("nav", "a", "Existing", "Artist");
        Track p1 = track("nav", "p1", "Batch One", "Artist");
        Track f1 = track("nav", "f1", "Requested", "Artist");
        queue.enqueue(List.of(a));
        WriteLease lease = queue.openLease("populator-1");
        queue.append(lease, p1);

        queue.revokeLease(lease);
        queue.enqueue(List.of(f1));

        assertThat(queue.snapshot().entries()).extracting(QueueEntry::track).containsExactly(a, p1, f1);
    }

    @Test
    void enqueueNeverLandsBehindCurrentEntryInsideBatch() {
        PlaybackQueue queue = new PlaybackQueue(new QueueProperties(null, null, null, false), new Random(5));
        Track a = track("nav", "a", "Existing", "Artist");
        Track p1 = track("nav", "p1", "Batch One", "Artist");
        Track p2 = track("nav", "p2", "Batch Two", "Artist");
        Track f1 = track("nav", "f1", "Requested", "Artist");
        queue.enqueue(List.of(a));
        WriteLease lease = queue.openLease("populator-1");
        queue.append(lease, p1);
        queue.append(lease, p2);
        queue.advance();

        queue.enqueue(List.of(f1));

        assertThat(queue.snapshot().entries()).extracting(QueueEntry::track).containsExactly(a, p1, f1, p2);
        assertThat(queue.advance().entry().track()).isEqualTo(f1);
    }

    @Test
    void concurrentForegroundEnqueuesStayAheadOfPopulatorWrites() throws InterruptedException {
        PlaybackQueue queue = new PlaybackQueue(new QueueProperties(null, null, null, false), new Random(6));
        Track head = track("nav", "h", "Head", "Artist");
        queue.enqueue(List.of(head));
        WriteLease lease = queue.openLease("populator-1");
        List<Track> batch = new ArrayList<>();
        List<Track> requested = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            batch.add(track("nav", "p" + i, "Batch " + i, "Artist"));
            requested.add(track("nav", "f" + i, "Request " + i, "Artist"));
        }
        queue.append(lease, batch.get(0));

        Thread writer = new Thread(() -> batch.subList(1, batch.size()).forEach(t -> queue.append(lease, t)));
        Thread foreground = new Thread(() -> requested.forEach(t -> queue.enqueue(List.of(t))));
        writer.start();
        foreground.start();
        writer.join(5_000);
        foreground.join(5_000);

        List<Track> expected = new ArrayList<>();
        expected.add(head);
        expected.addAll(requested);
        expected.addAll(batch);
        assertThat(queue.snapshot().entries()).extracting(QueueEntry::track).containsExactlyElementsOf(expected);
    }
}
