package com.phillippitts.voicejukebox.presentation.controller;

import com.phillippitts.voicejukebox.domain.PlaybackStatus;
import com.phillippitts.voicejukebox.domain.QueueEntry;
import com.phillippitts.voicejukebox.service.queue.QueueStep;

/**
 * Navigation result as returned to the intent layer: the step plus what the player needs to play it.
 */
record StepResponse(
        QueueStep.State state,
        QueueEntry entry,
        int cursor,
        boolean restarted,
        String streamUrl,
        PlaybackStatus status
) {
    static StepResponse of(QueueStep step, String streamUrl, PlaybackStatus status) {
        return new StepResponse(step.state(), step.entry(), step.cursor(), step.restarted(), streamUrl, status);
    }
}
