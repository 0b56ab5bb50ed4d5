package com.rankbox.engine.update;

import com.rankbox.engine.config.RankingConfig;
import com.rankbox.engine.model.ComparisonEvent;
import com.rankbox.engine.model.Item;
import com.rankbox.engine.model.RatingRecord;
import com.rankbox.engine.model.RecentResult;
import com.rankbox.engine.store.RatingStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.ToDoubleFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RatingUpdaterTest {

    private static final ToDoubleFunction<String> FLOOR_CONFIDENCE = id -> 0.2;

    private RankingConfig config;
    private RatingUpdater updater;
    private RatingStore store;
    private RatingChangeWindow changes;
    private int sequence;

    @BeforeEach
    void setUp() {
        config = RankingConfig.defaults();
        updater = new RatingUpdater(config);
        store = new RatingStore(List.of(new Item("a", "Amadeus"), new Item("b", "Ben-Hur"), new Item("c", "Cabaret")));
        changes = new RatingChangeWindow(config.recentChangesCapacity());
    }

    private ComparisonEvent event(String winner, String loser) {
        return new ComparisonEvent(winner, loser, null, sequence++, false);
    }

    @Test
    void firstOutcomeMovesRatingsSymmetrically() {
        BatchResult result = updater.applyBatch(store, List.of(event("a", "b")), 0.0, FLOOR_CONFIDENCE, changes);

        RatingRecord a = store.require("a");
        RatingRecord b = store.require("b");
        assertThat(a.getRating()).isPositive();
        assertThat(b.getRating()).isCloseTo(-a.getRating(), within(1e-12));
        assertThat(result.touchedIds()).containsExactly("a", "b");
        assertThat(result.appliedPairs()).isEqualTo(1);
        assertThat(changes.size()).isEqualTo(1);
    }

    @Test
    void firstOutcomeUsesTheDampedLearningRate() {
        BatchResult result = updater.applyBatch(store, List.of(event("a", "b")), 0.0, FLOOR_CONFIDENCE, changes);

        // base 0.1, early boost 1.2, closeness 1 + 1/(1+e^5), confidence 0.9,
        // inconsistent history 0.6, unsurprising 0.7
        double expectedRate = 0.1 * 1.2 * (1 + 1 / (1 + Math.exp(5))) * 0.9 * 0.6 * 0.7;
        assertThat(result.lastLearningRate()).isCloseTo(expectedRate, within(1e-12));
        assertThat(result.deltas().get(0)).isCloseTo(expectedRate * 0.5, within(1e-12));
    }

    @Test
    void momentumIsAppliedOncePerItemAndBatch() {
        BatchResult result = updater.applyBatch(store, List.of(event("a", "b"), event("a", "c")),
                0.0, FLOOR_CONFIDENCE, changes);

        double sum = result.deltas().get(0) + result.deltas().get(1);
        RatingRecord a = store.require("a");
        assertThat(a.getMomentum()).isCloseTo(sum * 0.6, within(1e-12));
        assertThat(a.getRating()).isCloseTo(sum * 1.6, within(1e-12));
        assertThat(a.getRecentResults()).extracting(RecentResult::getOpponentId).containsExactly("b", "c");
    }

    @Test
    void pairsWhoseIdsShareSeparatorsStayDistinct() {
        RatingStore tricky = new RatingStore(List.of(
                new Item("x>y", "X over Y"), new Item("z", "Zodiac"), new Item("x", "X"), new Item("y>z", "Y over Z")));

        BatchResult result = updater.applyBatch(tricky, List.of(event("x>y", "z"), event("x", "y>z")),
                0.0, FLOOR_CONFIDENCE, changes);

        assertThat(result.appliedPairs()).isEqualTo(2);
        assertThat(tricky.require("x>y").getRating()).isPositive();
        assertThat(tricky.require("z").getRating()).isNegative();
        assertThat(tricky.require("x").getRating()).isPositive();
        assertThat(tricky.require("y>z").getRating()).isNegative();
        assertThat(tricky.require("x>y").getRecentResults()).extracting(RecentResult::getOpponentId).containsExactly("z");
        assertThat(tricky.require("z").getRecentResults()).extracting(RecentResult::getOpponentId).containsExactly("x>y");
        assertThat(tricky.require("x").getRecentResults()).extracting(RecentResult::getOpponentId).containsExactly("y>z");
        assertThat(tricky.require("y>z").getRecentResults()).extracting(RecentResult::getOpponentId).containsExactly("x");
    }

    @Test
    void duplicatePairsShareOneDeltaButRecordEveryResult() {
        BatchResult result = updater.applyBatch(store, List.of(event("a", "b"), event("a", "b")),
                0.0, FLOOR_CONFIDENCE, changes);

        assertThat(result.appliedPairs()).isEqualTo(1);
        assertThat(result.appliedEvents()).isEqualTo(2);
        assertThat(result.deltas()).hasSize(1);
        assertThat(store.require("a").getRecentResults()).hasSize(2);
        assertThat(store.require("b").getRecentResults()).allMatch(r -> !r.isWon());
    }

    @Test
    void eventsForUnknownItemsAreSkipped() {
        BatchResult result = updater.applyBatch(store, List.of(event("a", "ghost"), event("b", "c")),
                0.0, FLOOR_CONFIDENCE, changes);

        assertThat(result.skippedEvents()).isEqualTo(1);
        assertThat(result.appliedEvents()).isEqualTo(1);
        assertThat(store.require("a").getRating()).isZero();
    }

    @Test
    void countersAreLeftToTheCaller() {
        updater.applyBatch(store, List.of(event("a", "b")), 0.0, FLOOR_CONFIDENCE, changes);

        assertThat(store.require("a").getComparisons()).isZero();
        assertThat(store.require("a").getWins()).isZero();
    }

    @Test
    void uncertaintyNeverIncreases() {
        double previousA = store.require("a").getRatingUncertainty();
        for (int i = 0; i < 40; i++) {
            ComparisonEvent e = i % 3 == 0 ? event("b", "a") : event("a", "b");
            updater.applyBatch(store, List.of(e), i / 40.0, FLOOR_CONFIDENCE, changes);

            double current = store.require("a").getRatingUncertainty();
            assertThat(current).isLessThanOrEqualTo(previousA).isGreaterThanOrEqualTo(RatingRecord.UNCERTAINTY_FLOOR);
            previousA = current;
        }
    }

    @Test
    void learningRateStaysWithinBounds() {
        RatingRecord underdog = store.require("a");
        RatingRecord favourite = store.require("b");
        RatingRecord outsider = store.require("c");
        underdog.setRating(-3);
        favourite.setRating(3);
        outsider.setRating(-3);
        underdog.setMomentum(2);

        double upset = updater.learningRate(underdog, favourite, 0.0, 0.2, 0.2, 1.5, 1.5, 1.5);
        double expected = updater.learningRate(favourite, outsider, 1.0, 1.0, 1.0, 0.5, 0.6, 0.7);

        assertThat(upset).isEqualTo(config.getMaxLearningRate());
        assertThat(expected).isEqualTo(config.getMinLearningRate());
    }

    @Test
    void expectedWinProbabilityIsLogistic() {
        assertThat(RatingUpdater.expectedWinProbability(0, 0)).isEqualTo(0.5);
        assertThat(RatingUpdater.expectedWinProbability(1, 0)).isCloseTo(1 / (1 + Math.exp(-1)), within(1e-12));
        assertThat(RatingUpdater.expectedWinProbability(1000, -1000)).isEqualTo(1.0);
        assertThat(RatingUpdater.expectedWinProbability(-1000, 1000)).isZero();
    }

    @Test
    void volatilityFactorIsNeutralUntilWindowFills() {
        for (int i = 0; i < config.getAdaptationWindow() - 1; i++) {
            changes.add(0.5);
        }
        assertThat(updater.volatilityFactor(changes)).isEqualTo(1.0);

        changes.add(0.5);
        assertThat(updater.volatilityFactor(changes)).isEqualTo(1.5);
    }
}
