package com.phillippitts.voicejukebox.domain;

/**
 * Outcome of resolving a voice query across all enabled backends.
 *
 * <p>{@link #NOT_FOUND} and {@link #ALL_SOURCES_UNREACHABLE} are kept distinct so the intent layer can
 * answer "no such artist" differently from "your music servers are unreachable".
 */
public enum MatchStatus {
    FOUND,
    NOT_FOUND,
    ALL_SOURCES_UNREACHABLE
}
