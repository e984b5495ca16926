package com.phillippitts.voicejukebox.config;

import com.phillippitts.voicejukebox.config.properties.LibraryBackendProperties;
import com.phillippitts.voicejukebox.service.backend.CandidateNormalizer;
import com.phillippitts.voicejukebox.service.backend.library.JsonLibraryBackend;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Wires backend providers. Every {@link com.phillippitts.voicejukebox.service.backend.BackendProvider}
 * bean is collected by {@link com.phillippitts.voicejukebox.service.backend.BackendRegistry}, which
 * keeps only those listed in {@code jukebox.resolver.enabled-backends}.
 */
@Configuration
public class BackendConfig {

    /**
     * Field normalizer shared by the resolver and catalog backends.
     */
    @Bean
    public CandidateNormalizer candidateNormalizer() {
        return new CandidateNormalizer();
    }

    /**
     * Bundled JSON catalog backend.
     * Active unless {@code jukebox.backends.library.enabled=false}.
     *
     * @throws UncheckedIOException if the catalog resource cannot be read
     */
    @Bean
    @ConditionalOnProperty(prefix = "jukebox.backends.library", name = "enabled", havingValue = "true",
            matchIfMissing = true)
    public JsonLibraryBackend libraryBackend(LibraryBackendProperties props,
                                             CandidateNormalizer normalizer,
                                             ResourceLoader resourceLoader) {
        Resource resource = resourceLoader.getResource(props.getCatalog());
        try (InputStream in = resource.getInputStream()) {
            String json = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return new JsonLibraryBackend(props.getName(), json, props.getStreamBaseUrl(), normalizer);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read library catalog: " + props.getCatalog(), e);
        }
    }
}
