package com.phillippitts.voicejukebox.exception;

/**
 * Thrown when a queue operation receives an invalid argument (negative offset, position out of range).
 * An empty queue is not an error and never raises this exception.
 */
public class InvalidQueueOperationException extends VoiceJukeboxException {

    public InvalidQueueOperationException(String message) {
        super(message);
    }
}
