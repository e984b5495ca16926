package com.phillippitts.voicejukebox.service.populator;

import com.phillippitts.voicejukebox.domain.TrackRef;

import java.util.List;
import java.util.Objects;

/**
 * Immutable description of the work handed to a populator: the identifiers still to enqueue, in order.
 *
 * @param originBackend backend tag the remainder came from, or {@code "mixed"} when the refs span backends
 * @param refs          identifiers to resolve and append, in play order
 */
public record PopulatorJobSpec(String originBackend, List<TrackRef> refs) {

    public static final String MIXED_ORIGIN = "mixed";

    public PopulatorJobSpec {
        Objects.requireNonNull(originBackend, "originBackend");
        refs = refs == null ? List.of() : List.copyOf(refs);
    }

    /**
     * Builds a spec, tagging it with the single backend the refs share, or {@link #MIXED_ORIGIN}.
     */
    public static PopulatorJobSpec of(List<TrackRef> refs) {
        String origin = refs.stream().map(TrackRef::backend).distinct().count() == 1
                ? refs.get(0).backend()
                : MIXED_ORIGIN;
        return new PopulatorJobSpec(origin, refs);
    }

    public static PopulatorJobSpec empty() {
        return new PopulatorJobSpec(MIXED_ORIGIN, List.of());
    }

    public boolean hasPending() {
        return !refs.isEmpty();
    }

    public int size() {
        return refs.size();
    }
}
