package com.rankbox.api.config;

import com.rankbox.engine.config.RankingConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfiguration {

    private final RankingProperties properties;

    public EngineConfiguration(RankingProperties properties) {
        this.properties = properties;
    }

    @Bean
    public RankingConfig rankingConfig() {
        return RankingConfig.builder()
                .seed(properties.getSeed())
                .baseLearningRate(properties.getBaseLearningRate())
                .momentumFactor(properties.getMomentumFactor())
                .auditInterval(properties.getAuditInterval())
                .minProgressToFinish(properties.getMinProgressToFinish())
                .minComparisonsPerItem(properties.getMinComparisonsPerItem())
                .minConfidence(properties.getMinConfidence())
                .build();
    }
}
