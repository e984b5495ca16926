package com.phillippitts.voicejukebox.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the playback queue and the foreground enqueue path.
 */
@Validated
@ConfigurationProperties(prefix = "jukebox.queue")
public class QueueProperties {

    /** Tracks enqueued synchronously before the intent response is returned. */
    @Min(1)
    private final int headSliceSize;

    /** Cap on tracks enqueued for a single intent (head slice plus populator remainder). */
    @Min(1)
    private final int maxTracks;

    /** A rewind past this offset restarts the current track instead of moving back. */
    @Min(0)
    private final long rewindRestartThresholdMs;

    /** Drop tracks whose title, artist and album equal an entry already queued. */
    private final boolean skipDuplicates;

    @ConstructorBinding
    public QueueProperties(Integer headSliceSize, Integer maxTracks, Long rewindRestartThresholdMs,
                           Boolean skipDuplicates) {
        this.headSliceSize = headSliceSize == null ? 2 : headSliceSize;
        this.maxTracks = maxTracks == null ? 50 : maxTracks;
        this.rewindRestartThresholdMs = rewindRestartThresholdMs == null ? 5000L : rewindRestartThresholdMs;
        this.skipDuplicates = skipDuplicates == null || skipDuplicates;
        if (this.headSliceSize < 1) {
            throw new IllegalArgumentException("jukebox.queue.head-slice-size must be >= 1");
        }
        if (this.maxTracks < this.headSliceSize) {
            throw new IllegalArgumentException("jukebox.queue.max-tracks must be >= head-slice-size");
        }
        if (this.rewindRestartThresholdMs < 0) {
            throw new IllegalArgumentException("jukebox.queue.rewind-restart-threshold-ms must be >= 0");
        }
    }

    public int getHeadSliceSize() {
        return headSliceSize;
    }

    public int getMaxTracks() {
        return maxTracks;
    }

    public long getRewindRestartThresholdMs() {
        return rewindRestartThresholdMs;
    }

    public boolean isSkipDuplicates() {
        return skipDuplicates;
    }
}
