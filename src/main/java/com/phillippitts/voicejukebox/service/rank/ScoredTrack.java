package com.phillippitts.voicejukebox.service.rank;

import com.phillippitts.voicejukebox.domain.Track;

import java.util.List;
import java.util.Objects;

/**
 * One logical track after ranking: the representative chosen among duplicates, the best score of
 * the duplicate set, and the members that were merged into it.
 *
 * @param track      representative track
 * @param score      maximum similarity score of any member
 * @param matchName  name the representative was matched on
 * @param duplicates other members of the set (other backends or versions), never containing {@code track}
 */
public record ScoredTrack(Track track, double score, String matchName, List<Track> duplicates) {
    public ScoredTrack {
        Objects.requireNonNull(track, "track");
        duplicates = duplicates == null ? List.of() : List.copyOf(duplicates);
    }
}
