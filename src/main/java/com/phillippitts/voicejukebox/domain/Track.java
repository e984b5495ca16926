package com.phillippitts.voicejukebox.domain;

import java.util.Objects;

/**
 * Immutable, backend-tagged playable unit produced by normalizing a backend search result.
 *
 * <p>The stream locator may be {@code null}: resolving it can be expensive for some backends, so it is
 * deferred until playback time through
 * {@link com.phillippitts.voicejukebox.service.resolve.TrackResolver#streamLocatorFor(Track)}.
 *
 * @param id              backend-native identifier (must not be blank)
 * @param title           display title
 * @param artist          artist name (empty when unknown)
 * @param album           album name (empty when unknown)
 * @param genre           genre name (empty when unknown)
 * @param durationSeconds duration in seconds (0 when unknown)
 * @param streamLocator   backend-specific stream URL, or {@code null} if not yet resolved
 * @param coverArtLocator cover art URL, or {@code null}
 * @param backend         name of the originating backend
 * @param bitrateKbps     declared bitrate in kbps (0 when unknown)
 */
public record Track(
        String id,
        String title,
        String artist,
        String album,
        String genre,
        int durationSeconds,
        String streamLocator,
        String coverArtLocator,
        String backend,
        int bitrateKbps
) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if id is blank or a numeric field is negative
     * @throws NullPointerException if id, title or backend is null
     */
    public Track {
        Objects.requireNonNull(id, "Track id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Track id must not be blank");
        }
        Objects.requireNonNull(title, "Track title must not be null");
        Objects.requireNonNull(backend, "Track backend must not be null");
        artist = artist == null ? "" : artist;
        album = album == null ? "" : album;
        genre = genre == null ? "" : genre;
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("durationSeconds must be >= 0, got: " + durationSeconds);
        }
        if (bitrateKbps < 0) {
            throw new IllegalArgumentException("bitrateKbps must be >= 0, got: " + bitrateKbps);
        }
    }

    /**
     * Reference to this track for later re-resolution by id.
     *
     * @return track reference carrying backend and id
     */
    public TrackRef ref() {
        return new TrackRef(backend, id);
    }

    /**
     * Returns a copy of this track with the given stream locator.
     *
     * @param locator resolved stream URL
     * @return new track instance
     */
    public Track withStreamLocator(String locator) {
        return new Track(id, title, artist, album, genre, durationSeconds, locator, coverArtLocator,
                backend, bitrateKbps);
    }
}
