package com.phillippitts.voicejukebox.exception;

import com.phillippitts.voicejukebox.domain.TrackRef;

/**
 * Thrown when a single track cannot be resolved by id or its stream locator cannot be produced.
 */
public class TrackResolutionException extends VoiceJukeboxException {

    private final TrackRef ref;

    public TrackResolutionException(String message, TrackRef ref) {
        super(message + " (track: " + ref + ")");
        this.ref = ref;
    }

    public TrackResolutionException(String message, TrackRef ref, Throwable cause) {
        super(message + " (track: " + ref + ")", cause);
        this.ref = ref;
    }

    public TrackRef getRef() {
        return ref;
    }
}
