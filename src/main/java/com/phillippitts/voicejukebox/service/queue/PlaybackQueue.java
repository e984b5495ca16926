package com.phillippitts.voicejukebox.service.queue;

import com.phillippitts.voicejukebox.config.properties.QueueProperties;
import com.phillippitts.voicejukebox.domain.PlaybackMode;
import com.phillippitts.voicejukebox.domain.PlaybackStatus;
import com.phillippitts.voicejukebox.domain.QueueEntry;
import com.phillippitts.voicejukebox.domain.Track;
import com.phillippitts.voicejukebox.exception.InvalidQueueOperationException;
import com.phillippitts.voicejukebox.service.rank.TextNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The single shared playback queue: an ordered list of entries, a play order over them, and the
 * position of the current entry in that order.
 *
 * <p><b>Play order:</b> in linear, repeat-one and repeat-all modes the play order is the enqueue order.
 * Switching to shuffle keeps the already played entries and the current entry in place and shuffles
 * the rest; the permutation stays fixed until the queue changes. Entries enqueued under shuffle are
 * inserted at random positions of the not-yet-played tail, so planned upcoming entries keep their
 * relative order and played entries are never replayed.
 *
 * <p><b>Cursor:</b> the position ranges over {@code [0, size]}; {@code size} means exhausted. Appending
 * to an exhausted queue makes the first appended entry current.
 *
 * <p><b>Populator region:</b> from a lease's first write until it is revoked, tail enqueues from the
 * foreground land before that populator's entries, so the queue reads pre-existing entries, then
 * foreground entries, then the populator batch. Outside shuffle a tail enqueue never lands behind the
 * current entry; once playback has reached the populator entries it goes after the current one.
 *
 * <p><b>Failed entries:</b> an entry the player could not play is flagged by
 * {@link #markCurrentFailed()}. Forward navigation and {@link #peekUpcoming(int)} pass over flagged
 * entries, so repeat-all never wraps back onto them; rewind can still reach them.
 *
 * <p><b>Thread Safety:</b> every read and mutation runs under one {@link ReentrantLock}, shared with
 * lease revocation. Reads return immutable copies.
 */
@Component
public class PlaybackQueue {

    private static final Logger LOG = LogManager.getLogger(PlaybackQueue.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Random random;
    private final long rewindRestartThresholdMs;
    private final boolean skipDuplicates;

    private final List<QueueEntry> entries = new ArrayList<>();
    // Indices into entries, in play order
    private final List<Integer> order = new ArrayList<>();
    private int position;
    private PlaybackMode mode = PlaybackMode.LINEAR;
    private PlaybackStatus status = PlaybackStatus.STOPPED;
    // Lease whose writes start at regionStart; null when no populator region is open
    private WriteLease regionLease;
    private int regionStart;

    @Autowired
    public PlaybackQueue(QueueProperties props) {
        this(props, new Random());
    }

    /**
     * @param props  queue configuration
     * @param random source for shuffle permutations (seeded in tests)
     */
    public PlaybackQueue(QueueProperties props, Random random) {
        Objects.requireNonNull(props, "props");
        this.random = Objects.requireNonNull(random, "random");
        this.rewindRestartThresholdMs = props.getRewindRestartThresholdMs();
        this.skipDuplicates = props.isSkipDuplicates();
    }

    /**
     * Appends tracks at the tail, or ahead of the live populator's entries while it is writing.
     *
     * @param tracks tracks to append, in order
     * @return number of entries added (duplicates may be dropped)
     */
    public int enqueue(List<Track> tracks) {
        lock.lock();
        try {
            if (regionLease == null) {
                return insert(entries.size(), tracks);
            }
            int at = regionStart;
            if (mode != PlaybackMode.SHUFFLE) {
                at = Math.max(at, isExhausted() ? entries.size() : order.get(position) + 1);
            }
            int added = insert(at, tracks);
            if (at <= regionStart) {
                regionStart += added;
            }
            return added;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Inserts tracks before the entry at {@code index} ({@code index == size()} appends).
     *
     * @param tracks tracks to insert, in order
     * @param index  insertion index in enqueue order
     * @return number of entries added
     * @throws InvalidQueueOperationException if index is outside {@code [0, size()]}
     */
    public int enqueue(List<Track> tracks, int index) {
        lock.lock();
        try {
            if (index < 0 || index > entries.size()) {
                throw new InvalidQueueOperationException(
                        "Insert position " + index + " outside [0, " + entries.size() + "]");
            }
            int added = insert(index, tracks);
            if (regionLease != null && index <= regionStart) {
                regionStart += added;
            }
            return added;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Opens a write lease for a background writer.
     *
     * @param holder writer id, used in logs
     * @return new lease
     */
    public WriteLease openLease(String holder) {
        return new WriteLease(holder, this);
    }

    /**
     * Revokes a lease. Once this returns, no append through the lease can succeed.
     */
    public void revokeLease(WriteLease lease) {
        Objects.requireNonNull(lease, "lease");
        lock.lock();
        try {
            lease.revoke();
            if (lease == regionLease) {
                regionLease = null;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends one track through a lease.
     *
     * @param lease writer's lease
     * @param track track to append
     * @return {@code false} if the lease is revoked or was not issued by this queue; {@code true}
     *         otherwise, including when the track was dropped as a duplicate
     */
    public boolean append(WriteLease lease, Track track) {
        Objects.requireNonNull(lease, "lease");
        Objects.requireNonNull(track, "track");
        lock.lock();
        try {
            if (lease.isRevoked() || !lease.issuedBy(this)) {
                LOG.debug("Rejected append from {}", lease);
                return false;
            }
            if (lease != regionLease) {
                regionLease = lease;
                regionStart = entries.size();
            }
            insert(entries.size(), List.of(track));
            return true;
        } finally {
            lock.unlock();
        }
    }

    public QueueStep currentEntry() {
        lock.lock();
        try {
            return step(false);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves to the next entry according to the playback mode.
     *
     * <ul>
     *   <li>LINEAR, SHUFFLE: next in play order; past-the-end after the last</li>
     *   <li>REPEAT_ONE: same entry from offset 0</li>
     *   <li>REPEAT_ALL: next, wrapping to the first after the last or from past-the-end</li>
     * </ul>
     */
    public QueueStep advance() {
        lock.lock();
        try {
            return moveNext(mode);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #advance()}, but repeat-one moves on as linear does.
     */
    public QueueStep skip() {
        lock.lock();
        try {
            return moveNext(mode == PlaybackMode.REPEAT_ONE ? PlaybackMode.LINEAR : mode);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Flags the current entry as unplayable and moves on, ignoring repeat-one. Under repeat-all the
     * wrap skips every flagged entry; when all entries are flagged the queue becomes exhausted.
     */
    public QueueStep markCurrentFailed() {
        lock.lock();
        try {
            if (entries.isEmpty() || isExhausted()) {
                return step(false);
            }
            int index = order.get(position);
            entries.set(index, entries.get(index).markFailed());
            LOG.info("Playback failed for {}; skipping", entries.get(index).track().ref());
            return moveNext(mode == PlaybackMode.REPEAT_ONE ? PlaybackMode.LINEAR : mode);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Restarts the current entry when it has played past the restart threshold, otherwise moves back
     * one entry in play order (clamped at the first; from past-the-end to the last).
     */
    public QueueStep rewind() {
        lock.lock();
        try {
            if (entries.isEmpty()) {
                return QueueStep.empty();
            }
            if (!isExhausted()) {
                QueueEntry current = entries.get(order.get(position));
                if (current.offsetMs() > rewindRestartThresholdMs) {
                    resetOffset(position);
                    return step(true);
                }
                position = Math.max(0, position - 1);
            } else {
                position = order.size() - 1;
            }
            resetOffset(position);
            return step(false);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Starts over from the first entry in play order.
     */
    public QueueStep restart() {
        lock.lock();
        try {
            if (entries.isEmpty()) {
                return QueueStep.empty();
            }
            position = 0;
            resetOffset(position);
            return step(true);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Switches the playback mode. Entering shuffle materializes a permutation of the entries not yet
     * played; leaving shuffle returns to enqueue order at the current entry.
     */
    public void setMode(PlaybackMode newMode) {
        Objects.requireNonNull(newMode, "mode");
        lock.lock();
        try {
            if (newMode == mode) {
                return;
            }
            if (newMode == PlaybackMode.SHUFFLE) {
                shuffleTail();
            } else if (mode == PlaybackMode.SHUFFLE) {
                int currentIndex = isExhausted() ? -1 : order.get(position);
                resetOrder();
                position = currentIndex < 0 ? entries.size() : currentIndex;
            }
            LOG.debug("Playback mode {} -> {}", mode, newMode);
            mode = newMode;
        } finally {
            lock.unlock();
        }
    }

    public PlaybackMode getMode() {
        lock.lock();
        try {
            return mode;
        } finally {
            lock.unlock();
        }
    }

    public PlaybackStatus getStatus() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every entry and stops playback. The mode is kept.
     */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            order.clear();
            position = 0;
            regionLease = null;
            status = PlaybackStatus.STOPPED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns up to {@code n} entries that successive {@link #advance()} calls would produce.
     *
     * @throws InvalidQueueOperationException if n is negative
     */
    public List<QueueEntry> peekUpcoming(int n) {
        if (n < 0) {
            throw new InvalidQueueOperationException("peek count must be >= 0, got: " + n);
        }
        lock.lock();
        try {
            List<QueueEntry> out = new ArrayList<>(Math.min(n, entries.size()));
            if (entries.isEmpty() || n == 0) {
                return List.of();
            }
            switch (mode) {
                case REPEAT_ONE -> {
                    if (!isExhausted()) {
                        QueueEntry current = entries.get(order.get(position)).withOffset(0);
                        for (int i = 0; i < n; i++) {
                            out.add(current);
                        }
                    }
                }
                case REPEAT_ALL -> {
                    // One lap of playable entries, starting after the current one
                    int start = isExhausted() ? -1 : position;
                    List<QueueEntry> lap = new ArrayList<>();
                    for (int k = 1; k <= order.size(); k++) {
                        QueueEntry e = entries.get(order.get(Math.floorMod(start + k, order.size())));
                        if (!e.failed()) {
                            lap.add(e);
                        }
                    }
                    for (int i = 0; i < n && !lap.isEmpty(); i++) {
                        out.add(lap.get(i % lap.size()));
                    }
                }
                default -> {
                    for (int p = position + 1; p < order.size() && out.size() < n; p++) {
                        QueueEntry e = entries.get(order.get(p));
                        if (!e.failed()) {
                            out.add(e);
                        }
                    }
                }
            }
            return List.copyOf(out);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records the resume offset of the current entry.
     *
     * @throws InvalidQueueOperationException if offsetMs is negative
     */
    public QueueStep setOffset(long offsetMs) {
        if (offsetMs < 0) {
            throw new InvalidQueueOperationException("offset must be >= 0, got: " + offsetMs);
        }
        lock.lock();
        try {
            if (entries.isEmpty() || isExhausted()) {
                return step(false);
            }
            int index = order.get(position);
            entries.set(index, entries.get(index).withOffset(offsetMs));
            return step(false);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the current entry as playing. No-op (status unchanged) when there is no current entry.
     */
    public QueueStep play() {
        lock.lock();
        try {
            QueueStep step = step(false);
            if (step.hasEntry()) {
                status = PlaybackStatus.PLAYING;
            }
            return step;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pauses at the given offset of the current entry.
     *
     * @throws InvalidQueueOperationException if offsetMs is negative
     */
    public QueueStep pause(long offsetMs) {
        lock.lock();
        try {
            QueueStep step = setOffset(offsetMs);
            if (step.hasEntry()) {
                status = PlaybackStatus.PAUSED;
            }
            return step;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops playback; cursor and offsets are kept.
     */
    public void stop() {
        lock.lock();
        try {
            status = PlaybackStatus.STOPPED;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public QueueSnapshot snapshot() {
        lock.lock();
        try {
            List<QueueEntry> history = new ArrayList<>();
            for (int p = 0; p < Math.min(position, order.size()); p++) {
                history.add(entries.get(order.get(p)));
            }
            List<QueueEntry> upcoming = new ArrayList<>();
            for (int p = position + 1; p < order.size(); p++) {
                QueueEntry e = entries.get(order.get(p));
                if (!e.failed()) {
                    upcoming.add(e);
                }
            }
            QueueEntry current = isExhausted() ? null : entries.get(order.get(position));
            return new QueueSnapshot(entries, history, current, upcoming, cursor(), mode, status);
        } finally {
            lock.unlock();
        }
    }

    // --- internals; callers hold the lock ---

    private int insert(int at, List<Track> tracks) {
        Objects.requireNonNull(tracks, "tracks");
        List<QueueEntry> added = new ArrayList<>(tracks.size());
        Set<String> keys = skipDuplicates ? existingKeys() : Set.of();
        for (Track track : tracks) {
            Objects.requireNonNull(track, "track");
            if (skipDuplicates && !keys.add(duplicateKey(track))) {
                LOG.debug("Skipping duplicate track {}", track.ref());
                continue;
            }
            added.add(QueueEntry.of(track));
        }
        if (added.isEmpty()) {
            return 0;
        }

        int oldSize = entries.size();
        int count = added.size();
        boolean wasExhausted = isExhausted();
        int currentIndex = wasExhausted ? -1 : order.get(position);
        entries.addAll(at, added);

        if (mode == PlaybackMode.SHUFFLE) {
            for (int p = 0; p < order.size(); p++) {
                int idx = order.get(p);
                if (idx >= at) {
                    order.set(p, idx + count);
                }
            }
            int lower = wasExhausted ? position : position + 1;
            for (int i = 0; i < count; i++) {
                int slot = lower + random.nextInt(order.size() - lower + 1);
                order.add(slot, at + i);
            }
            if (wasExhausted) {
                // New entries were placed at or after the old end; the earliest becomes current
                position = lower;
            }
        } else {
            resetOrder();
            if (currentIndex >= 0) {
                position = currentIndex >= at ? currentIndex + count : currentIndex;
            } else {
                position = at == oldSize ? oldSize : entries.size();
            }
        }
        return count;
    }

    private QueueStep moveNext(PlaybackMode effective) {
        if (entries.isEmpty()) {
            return QueueStep.empty();
        }
        boolean restarted = false;
        switch (effective) {
            case REPEAT_ONE -> {
                if (isExhausted()) {
                    return QueueStep.exhausted(entries.size());
                }
                restarted = true;
            }
            case REPEAT_ALL -> {
                int start = isExhausted() ? -1 : position;
                int next = order.size();
                for (int k = 1; k <= order.size(); k++) {
                    int p = Math.floorMod(start + k, order.size());
                    if (!entries.get(order.get(p)).failed()) {
                        next = p;
                        break;
                    }
                }
                restarted = start < 0 || next <= start;
                position = next;
            }
            default -> {
                if (!isExhausted()) {
                    position++;
                    while (position < order.size() && entries.get(order.get(position)).failed()) {
                        position++;
                    }
                }
            }
        }
        if (isExhausted()) {
            status = PlaybackStatus.STOPPED;
            return QueueStep.exhausted(entries.size());
        }
        resetOffset(position);
        return step(restarted);
    }

    private QueueStep step(boolean restarted) {
        if (entries.isEmpty()) {
            return QueueStep.empty();
        }
        if (isExhausted()) {
            return QueueStep.exhausted(entries.size());
        }
        int index = order.get(position);
        return QueueStep.current(entries.get(index), index, restarted);
    }

    private boolean isExhausted() {
        return position >= order.size();
    }

    private int cursor() {
        return isExhausted() ? entries.size() : order.get(position);
    }

    private void resetOffset(int playPosition) {
        int index = order.get(playPosition);
        QueueEntry entry = entries.get(index);
        if (entry.offsetMs() != 0) {
            entries.set(index, entry.withOffset(0));
        }
    }

    private void resetOrder() {
        order.clear();
        for (int i = 0; i < entries.size(); i++) {
            order.add(i);
        }
    }

    private void shuffleTail() {
        if (isExhausted()) {
            return;
        }
        List<Integer> tail = new ArrayList<>(order.subList(position + 1, order.size()));
        Collections.shuffle(tail, random);
        order.subList(position + 1, order.size()).clear();
        order.addAll(tail);
    }

    private Set<String> existingKeys() {
        Set<String> keys = new HashSet<>();
        for (QueueEntry entry : entries) {
            keys.add(duplicateKey(entry.track()));
        }
        return keys;
    }

    private static String duplicateKey(Track track) {
        return TextNormalizer.normalize(track.title())
                + '\u0000' + TextNormalizer.normalize(track.artist())
                + '\u0000' + TextNormalizer.normalize(track.album());
    }
}
