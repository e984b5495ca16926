package com.phillippitts.voicejukebox.service.backend;

import com.phillippitts.voicejukebox.config.properties.ResolverProperties;
import com.phillippitts.voicejukebox.testutil.FakeBackendProvider;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendRegistryTest {

    @Test
    void keepsConfiguredEnableOrder() {
        BackendRegistry registry = new BackendRegistry(
                List.of(new FakeBackendProvider("plex"), new FakeBackendProvider("navidrome")),
                new ResolverProperties(List.of("navidrome", "plex"), null));

        assertThat(registry.enabledNames()).containsExactly("navidrome", "plex");
        assertThat(registry.enabledProviders()).extracting(BackendProvider::getBackendName)
                .containsExactly("navidrome", "plex");
    }

    @Test
    void providersNotEnabledAreIgnored() {
        BackendRegistry registry = new BackendRegistry(
                List.of(new FakeBackendProvider("plex"), new FakeBackendProvider("navidrome")),
                new ResolverProperties(List.of("plex"), null));

        assertThat(registry.isEnabled("navidrome")).isFalse();
        assertThat(registry.find("navidrome")).isEmpty();
        assertThat(registry.find("plex")).isPresent();
    }

    @Test
    void enabledNameWithoutProviderIsSkipped() {
        BackendRegistry registry = new BackendRegistry(
                List.of(new FakeBackendProvider("plex")),
                new ResolverProperties(List.of("jellyfin", "plex"), null));

        assertThat(registry.enabledNames()).containsExactly("plex");
    }

    @Test
    void duplicateProviderNamesAreRejected() {
        assertThatThrownBy(() -> new BackendRegistry(
                List.of(new FakeBackendProvider("plex"), new FakeBackendProvider("plex")),
                new ResolverProperties(List.of("plex"), null)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("plex");
    }
}
