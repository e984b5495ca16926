package com.phillippitts.voicejukebox.service.backend;

import com.phillippitts.voicejukebox.domain.QueryType;
import com.phillippitts.voicejukebox.domain.Track;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Normalizes heterogeneous {@link BackendCandidate}s into {@link Track}s.
 *
 * <p>Each semantic field is read through an ordered list of fallback property names; the first
 * non-blank value wins. Backend SDK versions expose the same datum under different names
 * ({@code bitRate} vs {@code Media.bitrate}, {@code artist} vs {@code grandparentTitle}), so the
 * order encodes which spelling is trusted most.
 *
 * <p><b>Thread Safety:</b> stateless and thread-safe.
 */
public final class CandidateNormalizer {

    private static final Logger LOG = LogManager.getLogger(CandidateNormalizer.class);

    /**
     * Semantic track fields with their fallback property names, most trusted first.
     */
    public enum TrackField {
        ID("id", "ratingKey", "key"),
        TITLE("title", "name", "raw.title"),
        ARTIST("artist", "originalTitle", "grandparentTitle", "artistName"),
        ALBUM("album", "parentTitle", "albumName"),
        GENRE("genre", "genreName", "Genre.tag"),
        DURATION("duration", "durationSeconds"),
        /** Media-server duration, reported in milliseconds. */
        DURATION_MILLIS("Media.duration"),
        BITRATE("bitRate", "bitrate", "Media.bitrate"),
        STREAM_LOCATOR("streamUrl", "uri", "url"),
        COVER_ART("coverArtUrl", "coverPosterUrl", "thumb"),
        PLAYLIST("playlist", "playlistName"),
        /** Star timestamp set by Subsonic-style servers on favourite tracks. */
        STARRED("starred", "starredAt");

        private final List<String> names;

        TrackField(String... names) {
            this.names = List.of(names);
        }

        public List<String> names() {
            return names;
        }
    }

    /**
     * Returns the first non-blank value for the given field, trimmed.
     *
     * @param candidate raw candidate
     * @param field     semantic field
     * @return value, or empty when no fallback name yields one
     */
    public Optional<String> extract(BackendCandidate candidate, TrackField field) {
        for (String name : field.names()) {
            Object value = candidate.field(name);
            if (value == null) {
                continue;
            }
            String text = String.valueOf(value).strip();
            if (!text.isEmpty()) {
                return Optional.of(text);
            }
        }
        return Optional.empty();
    }

    /**
     * Maps a query type to the track field its free text is matched against.
     */
    public static TrackField matchField(QueryType type) {
        return switch (type) {
            case TRACK -> TrackField.TITLE;
            case ARTIST -> TrackField.ARTIST;
            case ALBUM -> TrackField.ALBUM;
            case GENRE -> TrackField.GENRE;
            case PLAYLIST -> TrackField.PLAYLIST;
        };
    }

    /**
     * Normalizes a candidate into a track.
     *
     * @param candidate raw candidate
     * @return track, or empty when the candidate has no id or no title
     */
    public Optional<Track> toTrack(BackendCandidate candidate) {
        Optional<String> id = extract(candidate, TrackField.ID);
        Optional<String> title = extract(candidate, TrackField.TITLE);
        if (id.isEmpty() || title.isEmpty()) {
            LOG.debug("Dropping candidate from {} without id/title: keys={}",
                    candidate.backend(), candidate.fields().keySet());
            return Optional.empty();
        }
        return Optional.of(new Track(
                id.get(),
                title.get(),
                extract(candidate, TrackField.ARTIST).orElse(""),
                extract(candidate, TrackField.ALBUM).orElse(""),
                extract(candidate, TrackField.GENRE).orElse(""),
                durationSeconds(candidate),
                extract(candidate, TrackField.STREAM_LOCATOR).orElse(null),
                extract(candidate, TrackField.COVER_ART).orElse(null),
                candidate.backend(),
                extractInt(candidate, TrackField.BITRATE)
        ));
    }

    private int durationSeconds(BackendCandidate candidate) {
        if (extract(candidate, TrackField.DURATION).isPresent()) {
            return extractInt(candidate, TrackField.DURATION);
        }
        return (int) Math.round(extractInt(candidate, TrackField.DURATION_MILLIS) / 1000.0);
    }

    private int extractInt(BackendCandidate candidate, TrackField field) {
        return extract(candidate, field).map(v -> parseNonNegative(v, field)).orElse(0);
    }

    private static int parseNonNegative(String value, TrackField field) {
        try {
            // Some servers report numbers as "320.0"
            int parsed = (int) Double.parseDouble(value);
            return Math.max(parsed, 0);
        } catch (NumberFormatException e) {
            LOG.debug("Ignoring non-numeric {} value '{}'", field, value);
            return 0;
        }
    }
}
