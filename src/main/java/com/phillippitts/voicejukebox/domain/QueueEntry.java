package com.phillippitts.voicejukebox.domain;

import java.util.Objects;

/**
 * A track in the playback queue plus its transient resume offset.
 *
 * <p>Entries are immutable; the queue replaces the active entry with {@link #withOffset(long)} when
 * its offset changes, and with {@link #markFailed()} when the player could not play it.
 *
 * @param track    the resolved track
 * @param offsetMs resume offset in milliseconds (never negative)
 * @param failed   whether playback of this entry failed; repeat-all never returns to failed entries
 */
public record QueueEntry(Track track, long offsetMs, boolean failed) {

    public QueueEntry {
        Objects.requireNonNull(track, "track");
        if (offsetMs < 0) {
            throw new IllegalArgumentException("offsetMs must be >= 0, got: " + offsetMs);
        }
    }

    public QueueEntry(Track track, long offsetMs) {
        this(track, offsetMs, false);
    }

    public static QueueEntry of(Track track) {
        return new QueueEntry(track, 0L);
    }

    public QueueEntry withOffset(long newOffsetMs) {
        return newOffsetMs == offsetMs ? this : new QueueEntry(track, newOffsetMs, failed);
    }

    public QueueEntry markFailed() {
        return failed ? this : new QueueEntry(track, offsetMs, true);
    }
}
