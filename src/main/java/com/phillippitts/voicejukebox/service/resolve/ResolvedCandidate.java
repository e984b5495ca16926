package com.phillippitts.voicejukebox.service.resolve;

import com.phillippitts.voicejukebox.domain.Track;

import java.util.Objects;

/**
 * A normalized track together with the value its query is matched against
 * (title, artist, album, genre or playlist name, depending on the query type).
 */
public record ResolvedCandidate(Track track, String matchName) {
    public ResolvedCandidate {
        Objects.requireNonNull(track, "track");
        Objects.requireNonNull(matchName, "matchName");
    }
}
