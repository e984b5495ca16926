package com.phillippitts.voicejukebox.exception;

/**
 * Thrown by a backend provider when its media server cannot be reached or refuses the request
 * (network error, authentication error, server error).
 *
 * <p>Never propagates past the track resolver: the resolver converts it into a failed-backend record.
 */
public class SourceUnreachableException extends VoiceJukeboxException {

    private final String backend;

    public SourceUnreachableException(String message, String backend) {
        super(message + " (backend: " + backend + ")");
        this.backend = backend;
    }

    public SourceUnreachableException(String message, String backend, Throwable cause) {
        super(message + " (backend: " + backend + ")", cause);
        this.backend = backend;
    }

    public String getBackend() {
        return backend;
    }
}
