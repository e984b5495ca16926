package com.phillippitts.voicejukebox.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the background populator and its supervisor.
 */
@Validated
@ConfigurationProperties(prefix = "jukebox.populator")
public class PopulatorProperties {

    /**
     * Maximum time {@code replacePopulator} waits for a cancelled job to stop.
     * Must stay well below the voice platform's response deadline.
     */
    @Min(0)
    private long joinTimeoutMs = 1500;

    public long getJoinTimeoutMs() {
        return joinTimeoutMs;
    }

    public void setJoinTimeoutMs(long joinTimeoutMs) {
        this.joinTimeoutMs = joinTimeoutMs;
    }
}
