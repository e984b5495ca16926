package com.phillippitts.voicejukebox.service.resolve;

import java.util.List;
import java.util.Map;

/**
 * Unified result of a fan-out search: candidates from every backend that answered, plus which
 * backends failed and why. No ordering between backends is implied.
 *
 * @param candidates       normalized candidates from backends that answered
 * @param queriedBackends  backends the query was sent to, in enable order
 * @param failedBackends   backend name to short failure reason (timeout, unreachable, error)
 */
public record ResolutionResult(
        List<ResolvedCandidate> candidates,
        List<String> queriedBackends,
        Map<String, String> failedBackends
) {
    public ResolutionResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        queriedBackends = queriedBackends == null ? List.of() : List.copyOf(queriedBackends);
        failedBackends = failedBackends == null ? Map.of() : Map.copyOf(failedBackends);
    }

    /**
     * True when no backend answered: every queried backend failed, or none was enabled.
     */
    public boolean allSourcesUnreachable() {
        return failedBackends.size() >= queriedBackends.size();
    }

    /**
     * True when at least one, but not every, backend failed.
     */
    public boolean isPartial() {
        return !failedBackends.isEmpty() && !allSourcesUnreachable();
    }
}
