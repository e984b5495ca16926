package com.phillippitts.voicejukebox.service.populator.event;

import com.phillippitts.voicejukebox.service.populator.PopulatorState;

import java.time.Instant;

/**
 * Published once when a populator job reaches a terminal state.
 *
 * @param jobId         job identifier
 * @param originBackend backend tag of the job's identifiers
 * @param state         terminal state
 * @param total         identifiers in the job
 * @param appended      identifiers resolved and accepted by the queue (duplicates included)
 * @param skipped       identifiers that failed to resolve
 * @param at            completion time
 */
public record PopulatorFinishedEvent(
        String jobId,
        String originBackend,
        PopulatorState state,
        int total,
        int appended,
        int skipped,
        Instant at
) {
    public PopulatorFinishedEvent {
        if (at == null) at = Instant.now();
    }
}
