package com.phillippitts.voicejukebox.service.health;

import com.phillippitts.voicejukebox.service.backend.BackendProvider;
import com.phillippitts.voicejukebox.service.backend.BackendRegistry;
import com.phillippitts.voicejukebox.service.resolve.event.SourceUnreachableEvent;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Health indicator for the enabled media backends.
 *
 * <p>A backend is ready when its provider reports healthy and it has not failed a search within the
 * last minute. Reports:
 * <ul>
 *   <li>UP: every enabled backend ready</li>
 *   <li>DEGRADED: at least one backend ready</li>
 *   <li>DOWN: no backend ready, or none enabled</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class BackendHealthIndicator implements HealthIndicator {

    static final Duration RECENT_FAILURE_WINDOW = Duration.ofMinutes(1);

    private final BackendRegistry registry;
    private final Clock clock;
    private final Map<String, Instant> lastFailure = new ConcurrentHashMap<>();

    @Autowired
    public BackendHealthIndicator(BackendRegistry registry) {
        this(registry, Clock.systemUTC());
    }

    BackendHealthIndicator(BackendRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    @EventListener
    void onSourceUnreachable(SourceUnreachableEvent e) {
        lastFailure.put(e.backend(), e.at());
    }

    @Override
    public Health health() {
        Map<String, String> details = new LinkedHashMap<>();
        int ready = 0;
        for (BackendProvider provider : registry.enabledProviders()) {
            String status = backendStatus(provider);
            details.put(provider.getBackendName(), status);
            if ("ready".equals(status)) {
                ready++;
            }
        }
        int total = details.size();

        Health.Builder builder = new Health.Builder();
        if (total > 0 && ready == total) {
            builder.up().withDetail("status", "All backends operational");
        } else if (ready > 0) {
            builder.status("DEGRADED").withDetail("status", "Partial backend availability");
        } else {
            builder.down().withDetail("status", "No backends available");
        }
        return builder.withDetail("backends", details).build();
    }

    private String backendStatus(BackendProvider provider) {
        if (!provider.isHealthy()) {
            return "unhealthy";
        }
        Instant failedAt = lastFailure.get(provider.getBackendName());
        if (failedAt != null && Duration.between(failedAt, clock.instant()).compareTo(RECENT_FAILURE_WINDOW) < 0) {
            return "recently-failed";
        }
        return "ready";
    }
}
