package com.phillippitts.voicejukebox.service.events;

import com.phillippitts.voicejukebox.service.populator.PopulatorState;
import com.phillippitts.voicejukebox.service.populator.event.PopulatorFinishedEvent;
import com.phillippitts.voicejukebox.service.resolve.event.SourceUnreachableEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized operator-facing logging for backend outages and failed populators. Privacy-safe (no
 * query text) and throttled to avoid log spam while a backend stays down.
 */
@Component
class ResolutionEventsListener {
    private static final Logger LOG = LogManager.getLogger(ResolutionEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onSourceUnreachable(SourceUnreachableEvent e) {
        String key = "source-" + e.backend() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Backend '{}' did not answer ({}). Check the server and jukebox.resolver.search-timeout-ms.",
                    e.backend(), e.reason());
        }
    }

    @EventListener
    void onPopulatorFinished(PopulatorFinishedEvent e) {
        if (e.state() == PopulatorState.FAILED && shouldLog("populator-failed-" + e.originBackend())) {
            LOG.warn("Populator {} resolved none of its {} tracks from '{}'; only the first tracks will play.",
                    e.jobId(), e.total(), e.originBackend());
        } else if (e.state() == PopulatorState.ABORTED) {
            LOG.error("Populator {} aborted after {} of {} tracks", e.jobId(), e.appended(), e.total());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
