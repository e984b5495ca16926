package com.phillippitts.voicejukebox.exception;

/**
 * Base exception for all voice-jukebox application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class VoiceJukeboxException extends RuntimeException {

    public VoiceJukeboxException(String message) {
        super(message);
    }

    public VoiceJukeboxException(String message, Throwable cause) {
        super(message, cause);
    }

    public VoiceJukeboxException(Throwable cause) {
        super(cause);
    }
}
