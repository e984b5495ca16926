package com.phillippitts.voicejukebox.service.backend.library;

import com.phillippitts.voicejukebox.domain.LibrarySource;
import com.phillippitts.voicejukebox.domain.QueryType;
import com.phillippitts.voicejukebox.domain.Track;
import com.phillippitts.voicejukebox.domain.TrackRef;
import com.phillippitts.voicejukebox.exception.TrackResolutionException;
import com.phillippitts.voicejukebox.service.backend.BackendCandidate;
import com.phillippitts.voicejukebox.service.backend.BackendProvider;
import com.phillippitts.voicejukebox.service.backend.CandidateNormalizer;
import com.phillippitts.voicejukebox.service.backend.CandidateNormalizer.TrackField;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only backend serving tracks from a JSON catalog.
 *
 * <p>Catalog shape:
 * <pre>{@code
 * { "tracks": [
 *     { "id": "t1", "title": "Bohemian Rhapsody", "artist": "Queen", "album": "A Night at the Opera",
 *       "genre": "Rock", "duration": 354, "bitRate": 320, "playlists": ["Road Trip"] },
 *     { "ratingKey": "t2", "title": "Heroes", "grandparentTitle": "David Bowie",
 *       "parentTitle": "Heroes", "Media": [ { "bitrate": 256 } ] }
 * ] }
 * }</pre>
 * Entries may use any of the field spellings understood by {@link CandidateNormalizer}, which makes the
 * catalog a convenient stand-in for mixed Subsonic/Plex exports.
 *
 * <p>The catalog is small and local, so {@link #search} does no server-side filtering: every entry with a
 * value for the query's match field is a candidate and the ranking engine applies the cutoff.
 *
 * <p>Entries with a {@code starred} value are the favourites; a random listing samples the whole catalog.
 */
public class JsonLibraryBackend implements BackendProvider {

    private static final Logger LOG = LogManager.getLogger(JsonLibraryBackend.class);

    private final String name;
    private final String streamBaseUrl;
    private final CandidateNormalizer normalizer;
    private final List<Map<String, Object>> entries;
    private final Map<String, Map<String, Object>> entriesById;

    /**
     * Parses a catalog document.
     *
     * @param name          backend tag for produced tracks
     * @param catalogJson   catalog JSON text
     * @param streamBaseUrl prefix for stream locators of entries without one
     * @param normalizer    field normalizer shared with the resolver
     * @throws IllegalArgumentException if the document is not a valid catalog
     */
    public JsonLibraryBackend(String name, String catalogJson, String streamBaseUrl,
                              CandidateNormalizer normalizer) {
        this.name = Objects.requireNonNull(name, "name");
        this.streamBaseUrl = streamBaseUrl == null ? "" : streamBaseUrl;
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        List<Map<String, Object>> parsed = new ArrayList<>();
        Map<String, Map<String, Object>> byId = new LinkedHashMap<>();
        try {
            JSONArray tracks = new JSONObject(catalogJson).getJSONArray("tracks");
            for (int i = 0; i < tracks.length(); i++) {
                Map<String, Object> entry = tracks.getJSONObject(i).toMap();
                BackendCandidate raw = new BackendCandidate(name, entry);
                String id = normalizer.extract(raw, TrackField.ID).orElse(null);
                if (id == null) {
                    LOG.warn("Catalog '{}' entry #{} has no id; skipped", name, i);
                    continue;
                }
                parsed.add(entry);
                byId.put(id, entry);
            }
        } catch (JSONException e) {
            throw new IllegalArgumentException("Invalid catalog JSON for backend " + name, e);
        }
        this.entries = Collections.unmodifiableList(parsed);
        this.entriesById = Collections.unmodifiableMap(byId);
        LOG.info("Catalog backend '{}' loaded {} tracks", name, entries.size());
    }

    @Override
    public String getBackendName() {
        return name;
    }

    @Override
    public List<BackendCandidate> search(QueryType type, String freeText) {
        List<BackendCandidate> out = new ArrayList<>();
        for (Map<String, Object> entry : entries) {
            if (type == QueryType.PLAYLIST) {
                // One candidate per playlist membership so each carries a single playlist name
                for (String playlist : playlists(entry)) {
                    Map<String, Object> withPlaylist = new LinkedHashMap<>(entry);
                    withPlaylist.put("playlist", playlist);
                    out.add(new BackendCandidate(name, withPlaylist));
                }
                continue;
            }
            BackendCandidate candidate = new BackendCandidate(name, entry);
            if (normalizer.extract(candidate, CandidateNormalizer.matchField(type)).isPresent()) {
                out.add(candidate);
            }
        }
        return out;
    }

    @Override
    public List<String> listTrackIds(LibrarySource source, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        for (Map.Entry<String, Map<String, Object>> e : entriesById.entrySet()) {
            if (source == LibrarySource.RANDOM
                    || normalizer.extract(new BackendCandidate(name, e.getValue()), TrackField.STARRED).isPresent()) {
                ids.add(e.getKey());
            }
        }
        if (source == LibrarySource.RANDOM) {
            Collections.shuffle(ids);
        }
        return ids.size() > limit ? List.copyOf(ids.subList(0, limit)) : ids;
    }

    @Override
    public Track resolveById(String id) {
        Map<String, Object> entry = entriesById.get(id);
        if (entry == null) {
            throw new TrackResolutionException("Unknown track id", new TrackRef(name, id));
        }
        Track track = normalizer.toTrack(new BackendCandidate(name, entry))
                .orElseThrow(() -> new TrackResolutionException("Catalog entry has no title",
                        new TrackRef(name, id)));
        return track.streamLocator() == null ? track.withStreamLocator(streamBaseUrl + id) : track;
    }

    @Override
    public String streamLocatorFor(Track track) {
        if (track.streamLocator() != null) {
            return track.streamLocator();
        }
        if (!entriesById.containsKey(track.id())) {
            throw new TrackResolutionException("Unknown track id", track.ref());
        }
        return streamBaseUrl + track.id();
    }

    @Override
    public boolean isHealthy() {
        return !entries.isEmpty();
    }

    private static List<String> playlists(Map<String, Object> entry) {
        Object raw = entry.get("playlists");
        if (raw instanceof List<?> list) {
            List<String> names = new ArrayList<>();
            for (Object o : list) {
                if (o != null && !String.valueOf(o).isBlank()) {
                    names.add(String.valueOf(o).strip());
                }
            }
            return names;
        }
        return List.of();
    }
}
