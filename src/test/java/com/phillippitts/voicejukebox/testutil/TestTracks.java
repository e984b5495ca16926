package com.phillippitts.voicejukebox.testutil;

import com.phillippitts.voicejukebox.domain.Track;
import com.phillippitts.voicejukebox.service.backend.BackendCandidate;
import com.phillippitts.voicejukebox.service.resolve.ResolvedCandidate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factories for tracks and raw candidates used across tests.
 */
public final class TestTracks {

    private TestTracks() {
    }

    public static Track track(String backend, String id, String title, String artist) {
        return new Track(id, title, artist, "", "", 200, null, null, backend, 0);
    }

    public static Track track(String backend, String id, String title, String artist, String album, int bitrate) {
        return new Track(id, title, artist, album, "", 200, null, null, backend, bitrate);
    }

    /** Candidate matched on its artist, as an ARTIST query produces. */
    public static ResolvedCandidate byArtist(Track track) {
        return new ResolvedCandidate(track, track.artist());
    }

    /** Candidate matched on its title, as a TRACK query produces. */
    public static ResolvedCandidate byTitle(Track track) {
        return new ResolvedCandidate(track, track.title());
    }

    public static BackendCandidate candidate(String backend, String id, String title, String artist) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", id);
        fields.put("title", title);
        fields.put("artist", artist);
        return new BackendCandidate(backend, fields);
    }
}
