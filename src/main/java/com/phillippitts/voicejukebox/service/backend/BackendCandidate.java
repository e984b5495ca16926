package com.phillippitts.voicejukebox.service.backend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Single, unvalidated search result from one backend, before normalization into a
 * {@link com.phillippitts.voicejukebox.domain.Track}.
 *
 * <p>Field names vary by backend and SDK version, so values are kept in a raw map and read through
 * {@link #field(String)} with dotted paths such as {@code "Media.bitrate"}.
 *
 * @param backend name of the backend that produced the candidate
 * @param fields  raw fields; nested maps and lists allowed
 */
public record BackendCandidate(String backend, Map<String, Object> fields) {

    public BackendCandidate {
        Objects.requireNonNull(backend, "backend");
        Map<String, Object> copy = new LinkedHashMap<>();
        if (fields != null) {
            // JSON nulls arrive as null values; treat them as absent
            fields.forEach((k, v) -> {
                if (k != null && v != null) {
                    copy.put(k, v);
                }
            });
        }
        fields = Collections.unmodifiableMap(copy);
    }

    /**
     * Looks up a raw value by property name or dotted path.
     *
     * <p>Each path segment descends into a nested map; a list encountered on the way is replaced by
     * its first element.
     *
     * @param path property name, e.g. {@code "title"} or {@code "Media.bitrate"}
     * @return raw value, or {@code null} when any segment is missing
     */
    public Object field(String path) {
        Object current = fields;
        for (String part : path.split("\\.")) {
            current = firstIfList(current);
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(part);
            if (current == null) {
                return null;
            }
        }
        return firstIfList(current);
    }

    private static Object firstIfList(Object value) {
        if (value instanceof List<?> list) {
            return list.isEmpty() ? null : list.get(0);
        }
        return value;
    }
}
