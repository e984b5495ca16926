package com.phillippitts.voicejukebox.service.resolve.event;

import java.time.Instant;

/**
 * Published when a backend fails to answer a search (unreachable, timeout, unexpected error).
 *
 * <p>PII note: do not include the spoken query. Restrict to technical diagnostics.
 */
public record SourceUnreachableEvent(
        String backend,
        String reason,
        Instant at
) {
    public SourceUnreachableEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
