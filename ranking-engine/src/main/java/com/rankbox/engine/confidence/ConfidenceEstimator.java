package com.rankbox.engine.confidence;

import com.rankbox.engine.config.RankingConfig;
import com.rankbox.engine.model.RatingRecord;
import com.rankbox.engine.model.RecentResult;
import com.rankbox.engine.store.RatingStore;
import com.rankbox.engine.store.Standings;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Scores how settled an item's position is, as a weighted blend of seven factors.
 *
 * Pure function of the store and its current standings. The ids of every record read while
 * scoring are reported through {@code reads} so the caller can invalidate selectively.
 */
public class ConfidenceEstimator {

    public static final double FLOOR = 0.2;

    private static final int RECENT_SPLIT = 5;
    private static final double RECENT_WEIGHT = 0.6;
    private static final double HISTORICAL_WEIGHT = 0.4;

    private static final double EDGE_WEIGHT = 0.8;
    private static final double MIDDLE_WEIGHT = 0.5;

    private final RankingConfig config;

    public ConfidenceEstimator(RankingConfig config) {
        this.config = config;
    }

    public double estimate(String itemId, RatingStore store, Standings standings, Set<String> reads) {
        return breakdown(itemId, store, standings, reads).total();
    }

    public ConfidenceBreakdown breakdown(String itemId, RatingStore store, Standings standings, Set<String> reads) {
        RatingRecord record = store.require(itemId);
        reads.add(itemId);

        int position = standings.positionOf(itemId);

        double sufficiency = Math.min((double) record.getComparisons() / config.getOptimalComparisons(), 1.0) * 0.8 + 0.2;
        double bayesian = 1.0 - Math.min(record.getRatingUncertainty(), 1.0);
        double positional = positionalConsistency(record, position, standings.size());
        double local = localConsistency(record, position, standings, reads);
        double selection = selectionRatio(record);
        double temporal = temporalConsistency(record.getRecentResults());
        double transitivity = localTransitivity(position, standings, reads);

        boolean belowMinimum = record.getComparisons() < config.getMinComparisonsForConfidence();
        double total;
        if (belowMinimum) {
            total = FLOOR;
        } else {
            double blended = sufficiency * ConfidenceBreakdown.W_SUFFICIENCY
                    + bayesian * ConfidenceBreakdown.W_BAYESIAN
                    + positional * ConfidenceBreakdown.W_POSITIONAL
                    + local * ConfidenceBreakdown.W_LOCAL
                    + selection * ConfidenceBreakdown.W_SELECTION
                    + temporal * ConfidenceBreakdown.W_TEMPORAL
                    + transitivity * ConfidenceBreakdown.W_TRANSITIVITY;
            total = Math.min(Math.max(blended, FLOOR), 1.0);
        }

        return new ConfidenceBreakdown(itemId, belowMinimum, sufficiency, bayesian, positional,
                local, selection, temporal, transitivity, total);
    }

    // ============ FACTORS ============

    /**
     * Top quarter should win about 75% of the time, bottom quarter about 25%, the middle half.
     */
    double positionalConsistency(RatingRecord record, int position, int itemCount) {
        double relative = itemCount > 0 ? (double) position / itemCount : 0.5;
        double expected;
        double weight;
        if (relative <= 0.25) {
            expected = 0.75;
            weight = EDGE_WEIGHT;
        } else if (relative >= 0.75) {
            expected = 0.25;
            weight = EDGE_WEIGHT;
        } else {
            expected = 0.5;
            weight = MIDDLE_WEIGHT;
        }
        return (1.0 - Math.abs(record.getWinRate() - expected)) * weight;
    }

    /**
     * Share of recent results against nearby items that agree with the current rating order.
     */
    double localConsistency(RatingRecord record, int position, Standings standings, Set<String> reads) {
        Set<String> neighbours = new HashSet<>();
        for (RatingRecord r : standings.window(position, config.getLocalConsistencyRange())) {
            if (!r.getItemId().equals(record.getItemId())) {
                neighbours.add(r.getItemId());
            }
        }
        reads.addAll(neighbours);

        int local = 0;
        int consistent = 0;
        for (RecentResult result : record.getRecentResults()) {
            if (!neighbours.contains(result.getOpponentId())) continue;
            RatingRecord opponent = standings.at(standings.positionOf(result.getOpponentId()));
            int expected = opponent.getRating() < record.getRating() ? 1 : 0;
            local++;
            if (result.getOutcome() == expected) consistent++;
        }
        return local > 0 ? (double) consistent / local : 0.5;
    }

    /**
     * Chosen/appearances over group presentations. Items never offered in a group fall back to
     * their pairwise win rate.
     */
    double selectionRatio(RatingRecord record) {
        if (record.getGroupSelections().getAppearances() > 0) {
            return record.getGroupSelections().getChosenRatio();
        }
        return record.getComparisons() > 0 ? record.getWinRate() : 0.5;
    }

    double temporalConsistency(List<RecentResult> results) {
        int split = Math.max(0, results.size() - RECENT_SPLIT);
        double recent = flipConsistency(results.subList(split, results.size()));
        double historical = flipConsistency(results.subList(0, split));
        return recent * RECENT_WEIGHT + historical * HISTORICAL_WEIGHT;
    }

    static double flipConsistency(List<RecentResult> results) {
        if (results.size() < 2) return 0.5;
        int flips = 0;
        for (int i = 1; i < results.size(); i++) {
            if (results.get(i).getOutcome() != results.get(i - 1).getOutcome()) flips++;
        }
        return 1.0 - (double) flips / (results.size() - 1);
    }

    /**
     * Weighted share of nearby triads with recorded evidence whose ratings are strictly ordered.
     * Triads closer to the item and with tighter ratings weigh more.
     */
    double localTransitivity(int position, Standings standings, Set<String> reads) {
        int range = config.getLocalTransitivityRange();
        int from = Math.max(0, position - range);
        List<RatingRecord> window = standings.window(position, range);
        window.forEach(r -> reads.add(r.getItemId()));

        double weighted = 0;
        double totalWeight = 0;
        for (int i = 0; i < window.size() - 2; i++) {
            for (int j = i + 1; j < window.size() - 1; j++) {
                for (int k = j + 1; k < window.size(); k++) {
                    RatingRecord a = window.get(i);
                    RatingRecord b = window.get(j);
                    RatingRecord c = window.get(k);

                    boolean evidenced = (a.hasRecentlyFaced(b.getItemId()) || a.hasRecentlyFaced(c.getItemId()))
                            && b.hasRecentlyFaced(c.getItemId());
                    if (!evidenced) continue;

                    double posWeight = 1.0 / (Math.abs(position - (from + i)) + 1);
                    double diffs = Math.abs(a.getRating() - b.getRating())
                            + Math.abs(b.getRating() - c.getRating())
                            + Math.abs(a.getRating() - c.getRating());
                    double weight = posWeight / (1.0 + diffs);

                    totalWeight += weight;
                    if (a.getRating() > b.getRating() && b.getRating() > c.getRating()) {
                        weighted += weight;
                    }
                }
            }
        }
        return totalWeight > 0 ? weighted / totalWeight : 0.5;
    }
}
