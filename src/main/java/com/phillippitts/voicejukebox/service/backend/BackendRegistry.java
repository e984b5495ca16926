package com.phillippitts.voicejukebox.service.backend;

import com.phillippitts.voicejukebox.config.properties.ResolverProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the backend providers enabled by {@code jukebox.resolver.enabled-backends}, in enable order.
 *
 * <p>Providers present as beans but not enabled are ignored; enabled names without a provider bean are
 * logged and skipped. Immutable after construction.
 */
@Component
public class BackendRegistry {

    private static final Logger LOG = LogManager.getLogger(BackendRegistry.class);

    private final Map<String, BackendProvider> enabled;

    public BackendRegistry(List<BackendProvider> providers, ResolverProperties props) {
        Map<String, BackendProvider> byName = new LinkedHashMap<>();
        for (BackendProvider p : providers) {
            BackendProvider previous = byName.put(p.getBackendName(), p);
            if (previous != null) {
                throw new IllegalStateException("Duplicate backend provider name: " + p.getBackendName());
            }
        }
        Map<String, BackendProvider> ordered = new LinkedHashMap<>();
        for (String name : props.getEnabledBackends()) {
            BackendProvider p = byName.get(name);
            if (p == null) {
                LOG.warn("Backend '{}' is enabled but no provider is configured; ignoring it", name);
                continue;
            }
            ordered.put(name, p);
        }
        this.enabled = Collections.unmodifiableMap(ordered);
        LOG.info("Backends enabled (in tie-break order): {}", enabled.keySet());
    }

    /**
     * Returns the enabled providers in configured enable order.
     */
    public List<BackendProvider> enabledProviders() {
        return new ArrayList<>(enabled.values());
    }

    /**
     * Returns the enabled backend names in configured enable order.
     */
    public List<String> enabledNames() {
        return new ArrayList<>(enabled.keySet());
    }

    public Optional<BackendProvider> find(String backend) {
        return Optional.ofNullable(enabled.get(backend));
    }

    public boolean isEnabled(String backend) {
        return enabled.containsKey(backend);
    }
}
