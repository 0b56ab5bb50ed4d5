package com.rankbox.engine.update;

import com.rankbox.engine.config.RankingConfig;
import com.rankbox.engine.model.ComparisonEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class UpdateBatcherTest {

    private RankingConfig config;
    private UpdateBatcher batcher;

    @BeforeEach
    void setUp() {
        config = RankingConfig.defaults();
        batcher = new UpdateBatcher(config);
    }

    private static ComparisonEvent event(String winner, String loser, boolean highImpact) {
        return new ComparisonEvent(winner, loser, null, 0, highImpact);
    }

    private RatingChangeWindow window(double each) {
        RatingChangeWindow changes = new RatingChangeWindow(config.recentChangesCapacity());
        for (int i = 0; i < config.getVolatilityWindow(); i++) {
            changes.add(each);
        }
        return changes;
    }

    @Test
    void drainsHighImpactThenUncertainThenOldest() {
        batcher.enqueue(event("a", "b", false), 0.3);
        batcher.enqueue(event("c", "d", false), 0.9);
        batcher.enqueue(event("e", "f", true), 0.1);
        batcher.enqueue(event("g", "h", false), 0.3);

        List<ComparisonEvent> drained = batcher.drain();

        assertThat(drained).extracting(ComparisonEvent::label).containsExactly("e>f", "c>d", "a>b", "g>h");
        assertThat(batcher.isEmpty()).isTrue();
    }

    @Test
    void restoreBringsBackSnapshot() {
        batcher.enqueue(event("a", "b", false), 0.5);
        List<PendingOutcome> snapshot = batcher.snapshot();
        batcher.enqueue(event("c", "d", false), 0.5);

        batcher.restore(snapshot);
        batcher.enqueue(event("e", "f", false), 0.5);

        assertThat(batcher.drain()).extracting(ComparisonEvent::label).containsExactly("a>b", "e>f");
    }

    @Test
    void smallSessionsUseTheMinimumBatch() {
        RatingChangeWindow empty = new RatingChangeWindow(config.recentChangesCapacity());

        assertThat(batcher.targetSize(4, 0.0, 0.2, empty)).isEqualTo(2);
        assertThat(batcher.targetSize(4, 0.5, 0.9, empty)).isEqualTo(3);
    }

    @Test
    void largeSessionsScaleBatchWithPhaseAndConfidence() {
        RatingChangeWindow empty = new RatingChangeWindow(config.recentChangesCapacity());

        assertThat(batcher.targetSize(1000, 0.0, 0.9, empty)).isEqualTo(8);
        assertThat(batcher.targetSize(1000, 0.5, 0.9, empty)).isEqualTo(12);
        assertThat(batcher.targetSize(1000, 0.5, 0.3, empty)).isEqualTo(8);
        assertThat(batcher.targetSize(1000, 0.95, 0.9, empty)).isEqualTo(8);
    }

    @Test
    void volatilityShrinksOrGrowsBatches() {
        assertThat(batcher.targetSize(1000, 0.5, 0.9, window(0.2))).isEqualTo(6);
        assertThat(batcher.targetSize(1000, 0.5, 0.9, window(0.001))).isEqualTo(18);
    }

    @Test
    void volatilityFactorInterpolatesBetweenThresholds() {
        assertThat(batcher.volatilityFactor(new RatingChangeWindow(20))).isEqualTo(1.0);
        assertThat(batcher.volatilityFactor(window(0.03))).isCloseTo(1.0, within(1e-9));
        assertThat(batcher.volatilityFactor(window(-0.2))).isEqualTo(0.5);
    }
}
