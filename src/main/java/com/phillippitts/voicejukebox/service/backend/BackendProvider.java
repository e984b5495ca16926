package com.phillippitts.voicejukebox.service.backend;

import com.phillippitts.voicejukebox.domain.LibrarySource;
import com.phillippitts.voicejukebox.domain.QueryType;
import com.phillippitts.voicejukebox.domain.Track;
import com.phillippitts.voicejukebox.exception.SourceUnreachableException;
import com.phillippitts.voicejukebox.exception.TrackResolutionException;

import java.util.List;

/**
 * Contract for media backend implementations (Subsonic-protocol servers, media-library servers,
 * local catalogs). The resolver treats all providers polymorphically over this capability set.
 *
 * <p>Lifecycle: providers are constructed by Spring with their configuration and must be usable
 * immediately. Credential handling and transport are the provider's own concern.
 *
 * <p>Thread Safety: implementations must be thread-safe; the resolver calls {@link #search} from the
 * search pool while a background populator calls {@link #resolveById} concurrently.
 *
 * <p>Interruption: long-running calls should honour thread interruption so a cancelled populator
 * stops promptly; the supervisor does not rely on it.
 *
 * @see CandidateNormalizer
 * @see com.phillippitts.voicejukebox.service.resolve.TrackResolver
 */
public interface BackendProvider {

    /**
     * Returns the backend tag carried by every track this provider produces (e.g. "navidrome").
     *
     * @return backend name, unique among configured providers
     */
    String getBackendName();

    /**
     * Searches the backend for candidates matching the query.
     *
     * <p>An empty library or no hit is an empty list, not an exception.
     *
     * @param type     kind of query
     * @param freeText spoken query text
     * @return raw candidates, in backend order
     * @throws SourceUnreachableException if the backend cannot be queried
     */
    List<BackendCandidate> search(QueryType type, String freeText);

    /**
     * Lists track ids for a library-wide selection. Backends that cannot serve a source return an
     * empty list.
     *
     * @param source selection to list
     * @param limit  maximum number of ids to return
     * @return backend-native track ids, at most {@code limit}
     * @throws SourceUnreachableException if the backend cannot be queried
     */
    default List<String> listTrackIds(LibrarySource source, int limit) {
        return List.of();
    }

    /**
     * Resolves a full track record by its backend-native id.
     *
     * @param id backend-native track id
     * @return resolved track tagged with this provider's backend name
     * @throws TrackResolutionException if the id is unknown or the record is unusable
     * @throws SourceUnreachableException if the backend cannot be queried
     */
    Track resolveById(String id);

    /**
     * Produces the URL a device can stream the track from.
     *
     * @param track track owned by this backend
     * @return stream URL
     * @throws TrackResolutionException if no locator can be produced
     */
    String streamLocatorFor(Track track);

    /**
     * Checks if the backend is currently reachable and usable.
     *
     * @return true if operational, false otherwise
     */
    default boolean isHealthy() {
        return true;
    }
}
