package com.rankbox.engine.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RankingConfigTest {

    @Test
    void defaultsMatchDocumentedTuning() {
        RankingConfig config = RankingConfig.defaults();

        assertThat(config.getBroadGroupsUntil()).isEqualTo(0.35);
        assertThat(config.getNarrowGroupsUntil()).isEqualTo(0.75);
        assertThat(config.getBaseLearningRate()).isEqualTo(0.1);
        assertThat(config.getAuditInterval()).isEqualTo(10);
        assertThat(config.getMinProgressToFinish()).isEqualTo(0.4);
        assertThat(config.getSeed()).isEqualTo(42L);
        assertThat(config.getMaxCycleComponentSize()).isEqualTo(40);
        assertThat(config.recentChangesCapacity()).isEqualTo(20);
    }

    @Test
    void toBuilderCopiesEverySetting() {
        RankingConfig original = RankingConfig.builder().seed(7).auditInterval(4).minConfidence(0.6).build();

        RankingConfig copy = original.toBuilder().build();

        assertThat(copy).usingRecursiveComparison().isEqualTo(original);
    }

    @Test
    void rejectsInconsistentBounds() {
        assertThatThrownBy(() -> RankingConfig.builder().minLearningRate(0.3).maxLearningRate(0.2).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RankingConfig.builder().broadGroupsUntil(0.8).narrowGroupsUntil(0.5).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RankingConfig.builder().volatilityHigh(0.01).volatilityLow(0.05).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void clampsDegenerateWindows() {
        RankingConfig config = RankingConfig.builder().auditInterval(0).maxCycleLength(2).maxCycleComponentSize(1).build();

        assertThat(config.getAuditInterval()).isEqualTo(1);
        assertThat(config.getMaxCycleLength()).isEqualTo(3);
        assertThat(config.getMaxCycleComponentSize()).isEqualTo(3);
    }
}
