package com.rankbox.engine.convergence;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AdaptiveThresholdsTest {

    @Test
    void smallDatasetMidSessionUsesBaseThreshold() {
        AdaptiveThresholds t = AdaptiveThresholds.forSession(10, 0.5);

        assertThat(t.confidence()).isCloseTo(0.7, within(1e-12));
        assertThat(t.stability()).isCloseTo(0.56, within(1e-12));
        assertThat(t.transitivity()).isCloseTo(0.63, within(1e-12));
        assertThat(t.rankChange()).isCloseTo(0.05, within(1e-12));
    }

    @Test
    void thresholdsLoosenEarlyAndTightenLate() {
        assertThat(AdaptiveThresholds.forSession(10, 0.1).confidence()).isCloseTo(0.56, within(1e-12));
        assertThat(AdaptiveThresholds.forSession(10, 0.9).confidence()).isCloseTo(0.84, within(1e-12));
    }

    @Test
    void largeDatasetsAreClampedToTheMinimum() {
        AdaptiveThresholds t = AdaptiveThresholds.forSession(2000, 0.5);

        assertThat(t.confidence()).isEqualTo(0.5);
        assertThat(t.rankChange()).isEqualTo(0.02);
        assertThat(AdaptiveThresholds.forSession(500, 0.5)).isEqualTo(t);
    }
}
