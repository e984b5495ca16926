package com.phillippitts.voicejukebox.config.ranking;

import com.phillippitts.voicejukebox.config.properties.RankingProperties;
import com.phillippitts.voicejukebox.service.backend.BackendRegistry;
import com.phillippitts.voicejukebox.service.rank.RankingEngine;
import com.phillippitts.voicejukebox.service.rank.SimilarityScorer;
import com.phillippitts.voicejukebox.service.rank.impl.SequenceRatioScorer;
import com.phillippitts.voicejukebox.service.rank.impl.TokenOverlapScorer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RankingConfig {

    @Bean
    public SimilarityScorer similarityScorer(RankingProperties props) {
        return switch (props.getScorer()) {
            case SEQUENCE -> new SequenceRatioScorer();
            case TOKEN_OVERLAP -> new TokenOverlapScorer();
        };
    }

    @Bean
    public RankingEngine rankingEngine(SimilarityScorer scorer, RankingProperties props, BackendRegistry registry) {
        return new RankingEngine(scorer, props, registry.enabledNames());
    }
}
