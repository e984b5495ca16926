package com.phillippitts.voicejukebox.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@Validated
@ConfigurationProperties(prefix = "jukebox.ranking")
public class RankingProperties {

    public enum Scorer { SEQUENCE, TOKEN_OVERLAP }

    /** Similarity function used to score candidates against the query. */
    @NotNull
    private final Scorer scorer;

    /** Hard cutoff (0..1); candidates scoring below it are discarded. */
    @Min(0)
    @Max(1)
    private final double acceptanceThreshold;

    /** Minimum title and artist similarity (0..1) for two candidates to count as the same track. */
    @Min(0)
    @Max(1)
    private final double duplicateTolerance;

    /** Explicit backend preference for duplicates; empty means "not configured". */
    private final List<String> backendPriority;

    /** Prefer the higher declared bitrate between duplicates when no priority is configured. */
    private final boolean preferHighBitrate;

    @ConstructorBinding
    public RankingProperties(Scorer scorer, Double acceptanceThreshold, Double duplicateTolerance,
                             List<String> backendPriority, Boolean preferHighBitrate) {
        this.scorer = scorer == null ? Scorer.SEQUENCE : scorer;
        double t = acceptanceThreshold == null ? 0.6 : acceptanceThreshold;
        if (t < 0.0 || t > 1.0) {
            throw new IllegalArgumentException("jukebox.ranking.acceptance-threshold must be in [0,1]");
        }
        this.acceptanceThreshold = t;
        double d = duplicateTolerance == null ? 0.9 : duplicateTolerance;
        if (d < 0.0 || d > 1.0) {
            throw new IllegalArgumentException("jukebox.ranking.duplicate-tolerance must be in [0,1]");
        }
        this.duplicateTolerance = d;
        this.backendPriority = backendPriority == null ? List.of() : List.copyOf(backendPriority);
        this.preferHighBitrate = preferHighBitrate != null && preferHighBitrate;
    }

    public Scorer getScorer() {
        return scorer;
    }

    public double getAcceptanceThreshold() {
        return acceptanceThreshold;
    }

    public double getDuplicateTolerance() {
        return duplicateTolerance;
    }

    public List<String> getBackendPriority() {
        return backendPriority;
    }

    public boolean isPreferHighBitrate() {
        return preferHighBitrate;
    }
}
