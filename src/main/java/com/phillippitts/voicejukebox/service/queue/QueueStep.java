package com.phillippitts.voicejukebox.service.queue;

import com.phillippitts.voicejukebox.domain.QueueEntry;

/**
 * Outcome of a queue navigation or read. Navigation never throws for an empty or exhausted queue;
 * callers switch on {@link #state()} instead.
 *
 * @param state     what the queue looked like after the operation
 * @param entry     the current entry when {@code state == CURRENT}, otherwise {@code null}
 * @param cursor    index of the current entry, or the queue size when exhausted, or 0 when empty
 * @param restarted true when the operation moved back to the start of a track or the queue
 *                  (repeat-one replay, repeat-all wrap, rewind restart, start over)
 */
public record QueueStep(State state, QueueEntry entry, int cursor, boolean restarted) {

    public enum State {
        /** A current entry exists. */
        CURRENT,
        /** Entries exist but the cursor is past the end. */
        EXHAUSTED,
        /** No entries at all. */
        EMPTY
    }

    public static QueueStep current(QueueEntry entry, int cursor, boolean restarted) {
        return new QueueStep(State.CURRENT, entry, cursor, restarted);
    }

    public static QueueStep exhausted(int size) {
        return new QueueStep(State.EXHAUSTED, null, size, false);
    }

    public static QueueStep empty() {
        return new QueueStep(State.EMPTY, null, 0, false);
    }

    public boolean hasEntry() {
        return state == State.CURRENT;
    }
}
