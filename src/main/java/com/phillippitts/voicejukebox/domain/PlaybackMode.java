package com.phillippitts.voicejukebox.domain;

/**
 * Policy deciding what {@code advance()} and {@code rewind()} do on the playback queue.
 */
public enum PlaybackMode {
    /** Move forward one entry, stopping past the end. */
    LINEAR,
    /** Replay the current entry from the start. */
    REPEAT_ONE,
    /** Wrap to the first entry after the last one. */
    REPEAT_ALL,
    /** Follow a random permutation of the entries not yet played. */
    SHUFFLE
}
