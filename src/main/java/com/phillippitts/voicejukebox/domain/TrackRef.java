package com.phillippitts.voicejukebox.domain;

import java.util.Objects;

/**
 * Identifies a not-yet-resolved track: the backend that owns it and its backend-native id.
 */
public record TrackRef(String backend, String id) {
    public TrackRef {
        Objects.requireNonNull(backend, "backend");
        Objects.requireNonNull(id, "id");
    }

    @Override
    public String toString() {
        return backend + ':' + id;
    }
}
