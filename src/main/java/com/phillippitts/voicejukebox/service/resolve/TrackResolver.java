package com.phillippitts.voicejukebox.service.resolve;

import com.phillippitts.voicejukebox.domain.LibrarySource;
import com.phillippitts.voicejukebox.domain.QueryType;
import com.phillippitts.voicejukebox.domain.Track;
import com.phillippitts.voicejukebox.domain.TrackRef;
import com.phillippitts.voicejukebox.exception.TrackResolutionException;

/**
 * Resolves voice queries and track references against every enabled backend.
 *
 * <p>Backend failures never propagate from {@link #resolve}; they are reported in the
 * {@link ResolutionResult}. Implementations must be thread-safe.
 */
public interface TrackResolver {

    /**
     * Fans the query out to every enabled backend and normalizes the answers.
     *
     * @param type     kind of query
     * @param freeText spoken query text
     * @return candidates plus per-backend failures
     */
    ResolutionResult resolve(QueryType type, String freeText);

    /**
     * Asks every enabled backend for its track ids in a library-wide selection. Like {@link #resolve},
     * backend failures are reported in the result.
     *
     * @param source           selection to list
     * @param limitPerBackend  maximum ids taken from each backend
     * @return references plus per-backend failures
     */
    LibraryListing listLibrary(LibrarySource source, int limitPerBackend);

    /**
     * Resolves one track by id through the backend that owns it.
     *
     * @throws TrackResolutionException if the backend is not enabled, unreachable, or rejects the id
     */
    Track resolveById(TrackRef ref);

    /**
     * Returns the stream URL for a track, asking its backend when the track carries none.
     *
     * @throws TrackResolutionException if no locator can be produced
     */
    String streamLocatorFor(Track track);
}
