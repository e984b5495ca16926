package com.phillippitts.voicejukebox.service.populator;

/**
 * Lifecycle of a {@link PopulatorJob}.
 *
 * <pre>
 * PENDING → RUNNING → COMPLETED | FAILED | CANCELLED | ABORTED
 * PENDING → CANCELLED | ABORTED (cancelled or rejected before it ran)
 * </pre>
 */
public enum PopulatorState {
    PENDING,
    RUNNING,
    /** Every identifier was processed and at least one was appended (or the batch was all duplicates). */
    COMPLETED,
    /** Every identifier failed to resolve. */
    FAILED,
    /** Stopped by the supervisor or by interruption. */
    CANCELLED,
    /** The queue rejected a write the job was entitled to make, or the job could not be scheduled. */
    ABORTED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}
