package com.phillippitts.voicejukebox.service.resolve;

import com.phillippitts.voicejukebox.domain.TrackRef;

import java.util.List;
import java.util.Map;

/**
 * Track references listed by every backend for a library-wide selection.
 *
 * @param refs            references from backends that answered, grouped by backend in enable order
 * @param queriedBackends backends asked, in enable order
 * @param failedBackends  backend name to short failure reason
 */
public record LibraryListing(
        List<TrackRef> refs,
        List<String> queriedBackends,
        Map<String, String> failedBackends
) {
    public LibraryListing {
        refs = refs == null ? List.of() : List.copyOf(refs);
        queriedBackends = queriedBackends == null ? List.of() : List.copyOf(queriedBackends);
        failedBackends = failedBackends == null ? Map.of() : Map.copyOf(failedBackends);
    }

    public boolean allSourcesUnreachable() {
        return failedBackends.size() >= queriedBackends.size();
    }
}
