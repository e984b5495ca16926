package com.phillippitts.voicejukebox.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the bundled JSON catalog backend ({@code jukebox.backends.library.*}).
 */
@Validated
@ConfigurationProperties(prefix = "jukebox.backends.library")
public class LibraryBackendProperties {

    private boolean enabled = true;

    /** Backend tag carried by every track of this catalog. */
    @NotBlank
    private String name = "library";

    /** Spring resource location of the JSON catalog. */
    @NotBlank
    private String catalog = "classpath:library/catalog.json";

    /** Base URL used to build stream locators for catalog entries without one. */
    private String streamBaseUrl = "http://localhost:4533/stream/";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getCatalog() {
        return catalog;
    }

    public void setCatalog(String catalog) {
        this.catalog = catalog;
    }

    public String getStreamBaseUrl() {
        return streamBaseUrl;
    }

    public void setStreamBaseUrl(String streamBaseUrl) {
        this.streamBaseUrl = streamBaseUrl;
    }
}
