package com.phillippitts.voicejukebox.domain;

/**
 * Library-wide selections that are played without a search query.
 */
public enum LibrarySource {
    /** A random sample of each backend's library. */
    RANDOM,
    /** Tracks the listener starred on their media server. */
    FAVOURITES
}
