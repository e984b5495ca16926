package com.phillippitts.voicejukebox.service.queue;

import com.phillippitts.voicejukebox.domain.PlaybackMode;
import com.phillippitts.voicejukebox.domain.PlaybackStatus;
import com.phillippitts.voicejukebox.domain.QueueEntry;

import java.util.List;

/**
 * Immutable, consistent view of the queue taken under its lock.
 *
 * @param entries  all entries in enqueue order
 * @param history  entries already played, in play order
 * @param current  current entry, or {@code null} when empty or exhausted
 * @param upcoming entries still to play, in play order (the shuffle permutation under shuffle),
 *                 leaving out failed entries
 * @param cursor   index of the current entry in {@code entries}, or {@code entries.size()} when exhausted
 * @param mode     playback mode
 * @param status   playback status
 */
public record QueueSnapshot(
        List<QueueEntry> entries,
        List<QueueEntry> history,
        QueueEntry current,
        List<QueueEntry> upcoming,
        int cursor,
        PlaybackMode mode,
        PlaybackStatus status
) {
    public QueueSnapshot {
        entries = List.copyOf(entries);
        history = List.copyOf(history);
        upcoming = List.copyOf(upcoming);
    }

    public int size() {
        return entries.size();
    }
}
