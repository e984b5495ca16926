package com.phillippitts.voicejukebox.exception;

/**
 * Signals a broken populator protocol: a job whose queue lease was revoked kept writing
 * without having been cancelled. Fatal for the job that observes it.
 */
public class PopulatorProtocolException extends VoiceJukeboxException {

    private final String jobId;

    public PopulatorProtocolException(String message, String jobId) {
        super(message + " (job: " + jobId + ")");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
