package com.rankbox.engine.convergence;

import com.rankbox.engine.config.RankingConfig;
import com.rankbox.engine.model.Item;
import com.rankbox.engine.model.RatingRecord;
import com.rankbox.engine.store.PreferenceGraph;
import com.rankbox.engine.store.PreferenceGraphs;
import com.rankbox.engine.store.RatingStore;
import com.rankbox.engine.update.RatingChangeWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConvergenceMonitorTest {

    private static final List<String> ORDER = List.of("a", "b", "c", "d");

    private ConvergenceMonitor monitor;
    private RatingStore store;
    private RatingChangeWindow calm;
    private PreferenceGraph consistent;

    @BeforeEach
    void setUp() {
        monitor = new ConvergenceMonitor(RankingConfig.defaults());
        store = new RatingStore(ORDER.stream().map(id -> new Item(id, id.toUpperCase())).toList());
        double rating = 3;
        for (String id : ORDER) {
            RatingRecord record = store.require(id);
            record.setRating(rating--);
            for (int i = 0; i < 5; i++) {
                record.recordOutcome(i % 2 == 0);
            }
        }
        calm = new RatingChangeWindow(20);
        for (int i = 0; i < 15; i++) {
            calm.add(0.001);
        }
        consistent = PreferenceGraphs.of("a>b", "b>c", "c>d", "a>c");
    }

    @Test
    void nothingIsDecidedBeforeMinimumProgress() {
        ConvergenceReport report = monitor.evaluate(store, 10, 100, () -> 1.0, calm, consistent, ORDER);

        assertThat(report.converged()).isFalse();
        assertThat(report.blocker()).isEqualTo("progress");
    }

    @Test
    void everyItemNeedsEnoughComparisons() {
        RatingStore fresh = new RatingStore(List.of(new Item("a", "A"), new Item("b", "B")));

        ConvergenceReport report = monitor.evaluate(fresh, 50, 100, () -> 1.0, calm, consistent, ORDER);

        assertThat(report.blocker()).isEqualTo("comparisonsPerItem");
    }

    @Test
    void lowConfidenceBlocks() {
        ConvergenceReport report = monitor.evaluate(store, 50, 100, () -> 0.5, calm, consistent, ORDER);

        assertThat(report.blocker()).isEqualTo("confidence");
        assertThat(report.avgConfidence()).isEqualTo(0.5);
    }

    @Test
    void largeOrTooFewRecentChangesBlock() {
        RatingChangeWindow shaky = calm.copy();
        shaky.add(0.2);

        assertThat(monitor.evaluate(store, 50, 100, () -> 0.95, new RatingChangeWindow(20), consistent, ORDER).blocker())
                .isEqualTo("ratingChanges");
        assertThat(monitor.evaluate(store, 50, 100, () -> 0.95, shaky, consistent, ORDER).blocker())
                .isEqualTo("ratingChanges");
    }

    @Test
    void contradictedPreferencesBlock() {
        PreferenceGraph reversed = PreferenceGraphs.of("b>a", "c>b", "d>c", "c>a");

        ConvergenceReport report = monitor.evaluate(store, 50, 100, () -> 0.95, calm, reversed, ORDER);

        assertThat(report.blocker()).isEqualTo("transitivity");
        assertThat(report.transitivityScore()).isZero();
    }

    @Test
    void unstableRankingBlocks() {
        ConvergenceReport report = monitor.evaluate(store, 50, 100, () -> 0.95, calm, consistent, List.of("d", "c", "b", "a"));

        assertThat(report.blocker()).isEqualTo("rankStability");
    }

    @Test
    void convergesWhenEveryCriterionHolds() {
        ConvergenceReport report = monitor.evaluate(store, 50, 100, () -> 0.95, calm, consistent, ORDER);

        assertThat(report.converged()).isTrue();
        assertThat(report.blocker()).isNull();
        assertThat(report.transitivityScore()).isEqualTo(1.0);
        assertThat(report.rankStability()).isEqualTo(1.0);
    }

    @Test
    void rankStabilityWeighsTopPositionsMore() {
        assertThat(monitor.rankStability(ORDER, ORDER)).isEqualTo(1.0);
        assertThat(monitor.rankStability(List.of("d", "c", "b", "a"), ORDER)).isCloseTo(1.0 / 3, within(1e-12));
        assertThat(monitor.rankStability(ORDER, null)).isZero();

        double topSwap = monitor.rankStability(List.of("b", "a", "c", "d"), ORDER);
        double bottomSwap = monitor.rankStability(List.of("a", "b", "d", "c"), ORDER);
        assertThat(topSwap).isLessThan(bottomSwap);
    }

    @Test
    void transitivityIsPerfectWithoutEvidence() {
        assertThat(monitor.transitivityScore(store, PreferenceGraphs.of(), new Random(1))).isEqualTo(1.0);
    }
}
