package com.phillippitts.voicejukebox.service.orchestration;

import com.phillippitts.voicejukebox.domain.MatchStatus;
import com.phillippitts.voicejukebox.service.rank.ScoredTrack;

import java.util.List;
import java.util.Map;

/**
 * Ranked, deduplicated candidates for a query, without touching the queue.
 *
 * @param status         match status
 * @param tracks         accepted tracks by descending score
 * @param failedBackends backends that did not answer, with reason
 */
public record SearchOutcome(MatchStatus status, List<ScoredTrack> tracks, Map<String, String> failedBackends) {
    public SearchOutcome {
        tracks = tracks == null ? List.of() : List.copyOf(tracks);
        failedBackends = failedBackends == null ? Map.of() : Map.copyOf(failedBackends);
    }
}
