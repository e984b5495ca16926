package com.phillippitts.voicejukebox.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed properties for cross-backend track resolution.
 */
@Validated
@ConfigurationProperties(prefix = "jukebox.resolver")
public class ResolverProperties {

    /** Backends queried for every voice intent, in enable order (last-resort tie-break). */
    @NotEmpty
    private final List<String> enabledBackends;

    /** Upper bound for the whole fan-out search on the foreground path. */
    @Min(1)
    private final long searchTimeoutMs;

    @ConstructorBinding
    public ResolverProperties(List<String> enabledBackends, Long searchTimeoutMs) {
        if (enabledBackends == null || enabledBackends.isEmpty()) {
            throw new IllegalArgumentException("jukebox.resolver.enabled-backends must name at least one backend");
        }
        this.enabledBackends = List.copyOf(enabledBackends);
        long t = searchTimeoutMs == null ? 4000L : searchTimeoutMs;
        if (t <= 0) {
            throw new IllegalArgumentException("jukebox.resolver.search-timeout-ms must be > 0");
        }
        this.searchTimeoutMs = t;
    }

    public List<String> getEnabledBackends() {
        return enabledBackends;
    }

    public long getSearchTimeoutMs() {
        return searchTimeoutMs;
    }
}
