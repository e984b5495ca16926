package com.phillippitts.voicejukebox.service.orchestration;

import com.phillippitts.voicejukebox.domain.MatchStatus;
import com.phillippitts.voicejukebox.domain.Track;
import com.phillippitts.voicejukebox.service.populator.PopulatorJobSpec;

import java.util.List;
import java.util.Objects;

/**
 * Result of {@link PlaybackOrchestrator#resolveAndEnqueue}.
 *
 * @param headSlice tracks enqueued synchronously (empty unless {@code FOUND})
 * @param remainder identifiers handed to the background populator
 * @param status    match status
 */
public record EnqueueOutcome(List<Track> headSlice, PopulatorJobSpec remainder, MatchStatus status) {

    public EnqueueOutcome {
        headSlice = headSlice == null ? List.of() : List.copyOf(headSlice);
        remainder = remainder == null ? PopulatorJobSpec.empty() : remainder;
        Objects.requireNonNull(status, "status");
    }

    public static EnqueueOutcome unmatched(MatchStatus status) {
        return new EnqueueOutcome(List.of(), PopulatorJobSpec.empty(), status);
    }

    /** Total number of tracks this intent will enqueue once the populator drains. */
    public int plannedTracks() {
        return headSlice.size() + remainder.size();
    }
}
