package com.rankbox.engine.convergence;

import com.rankbox.engine.config.RankingConfig;
import com.rankbox.engine.model.RatingRecord;
import com.rankbox.engine.store.PreferenceGraph;
import com.rankbox.engine.store.RatingStore;
import com.rankbox.engine.update.RatingChangeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.DoubleSupplier;

/**
 * Decides whether a session may stop before its comparison budget is spent.
 *
 * Nothing is decided before the minimum progress and per-item comparison count are reached.
 * After that four criteria must hold together: average confidence, small recent rating
 * changes, transitivity of the evidenced triads and stability of rank positions against the
 * ranking one stability window ago.
 */
public class ConvergenceMonitor {

    private static final Logger log = LoggerFactory.getLogger(ConvergenceMonitor.class);

    private static final int TRANSITIVITY_SAMPLE = 1000;

    private final RankingConfig config;

    public ConvergenceMonitor(RankingConfig config) {
        this.config = config;
    }

    /**
     * @param averageConfidence evaluated lazily, only once the cheap criteria pass
     * @param previousOrder     item ids by rating one stability window ago, or null when the
     *                          history is not that long yet
     */
    public ConvergenceReport evaluate(RatingStore store, int comparisons, int maxComparisons,
                                      DoubleSupplier averageConfidence, RatingChangeWindow changes,
                                      PreferenceGraph graph, List<String> previousOrder) {
        double progress = maxComparisons > 0 ? (double) comparisons / maxComparisons : 0.0;
        AdaptiveThresholds thresholds = AdaptiveThresholds.forSession(store.size(), progress);

        if (progress < config.getMinProgressToFinish()) {
            return ConvergenceReport.blocked("progress", progress, thresholds);
        }
        if (store.minComparisons() < config.getMinComparisonsPerItem()) {
            return ConvergenceReport.blocked("comparisonsPerItem", progress, thresholds);
        }

        double avgConfidence = averageConfidence.getAsDouble();
        if (avgConfidence < Math.max(thresholds.confidence(), config.getMinConfidence())) {
            return new ConvergenceReport(false, "confidence", progress, avgConfidence, 0, 0, thresholds);
        }

        int window = config.getStabilityWindow();
        double maxChange = Math.min(thresholds.rankChange(), config.getStabilityThreshold());
        if (changes.size() < window || changes.last(window).stream().anyMatch(c -> Math.abs(c) > maxChange)) {
            return new ConvergenceReport(false, "ratingChanges", progress, avgConfidence, 0, 0, thresholds);
        }

        double transitivity = transitivityScore(store, graph, new Random(config.getSeed() + comparisons));
        if (transitivity < Math.max(thresholds.transitivity(), config.getMinTransitivityScore())) {
            return new ConvergenceReport(false, "transitivity", progress, avgConfidence, transitivity, 0, thresholds);
        }

        double stability = rankStability(store.sortedByRating().stream().map(RatingRecord::getItemId).toList(), previousOrder);
        if (stability < Math.max(thresholds.stability(), config.getMinRankStability())) {
            return new ConvergenceReport(false, "rankStability", progress, avgConfidence, transitivity, stability, thresholds);
        }

        log.info("Ranking converged at {}/{} comparisons (confidence {}, transitivity {}, stability {})",
                comparisons, maxComparisons, String.format("%.2f", avgConfidence),
                String.format("%.2f", transitivity), String.format("%.2f", stability));
        return new ConvergenceReport(true, null, progress, avgConfidence, transitivity, stability, thresholds);
    }

    /**
     * Share of evidenced triads whose recorded outcomes all agree with the rating order.
     * A triad counts as evidenced when at least one of its pairs was compared. 1.0 when no
     * triad carries evidence.
     */
    public double transitivityScore(RatingStore store, PreferenceGraph graph, Random random) {
        List<RatingRecord> ordered = store.sortedByRating();
        int n = ordered.size();
        if (n < 3) return 1.0;

        int evidenced = 0;
        int agreeing = 0;
        long triadCount = (long) n * (n - 1) * (n - 2) / 6;
        if (triadCount <= TRANSITIVITY_SAMPLE) {
            for (int i = 0; i < n - 2; i++) {
                for (int j = i + 1; j < n - 1; j++) {
                    for (int k = j + 1; k < n; k++) {
                        int verdict = triadVerdict(ordered.get(i), ordered.get(j), ordered.get(k), graph);
                        if (verdict >= 0) {
                            evidenced++;
                            agreeing += verdict;
                        }
                    }
                }
            }
        } else {
            for (int s = 0; s < TRANSITIVITY_SAMPLE; s++) {
                int[] idx = distinctSorted(random, n);
                int verdict = triadVerdict(ordered.get(idx[0]), ordered.get(idx[1]), ordered.get(idx[2]), graph);
                if (verdict >= 0) {
                    evidenced++;
                    agreeing += verdict;
                }
            }
        }
        return evidenced == 0 ? 1.0 : (double) agreeing / evidenced;
    }

    // -1 no evidence, 0 contradicted, 1 agrees. Records are in rating order.
    private static int triadVerdict(RatingRecord a, RatingRecord b, RatingRecord c, PreferenceGraph graph) {
        boolean any = false;
        RatingRecord[][] pairs = {{a, b}, {b, c}, {a, c}};
        for (RatingRecord[] pair : pairs) {
            String higher = pair[0].getItemId();
            String lower = pair[1].getItemId();
            if (graph.beats(lower, higher) && pair[0].getRating() > pair[1].getRating()) {
                return 0;
            }
            if (graph.hasEvidence(higher, lower)) any = true;
        }
        return any ? 1 : -1;
    }

    private static int[] distinctSorted(Random random, int n) {
        int i = random.nextInt(n);
        int j;
        do {
            j = random.nextInt(n);
        } while (j == i);
        int k;
        do {
            k = random.nextInt(n);
        } while (k == i || k == j);
        int[] idx = {i, j, k};
        Arrays.sort(idx);
        return idx;
    }

    /**
     * Position stability between two orderings, top positions weighted more heavily.
     * 1.0 when nothing moved; 0 when there is no earlier ordering.
     */
    public double rankStability(List<String> current, List<String> previous) {
        if (previous == null || previous.size() != current.size() || current.size() < 2) {
            return 0.0;
        }
        Map<String, Integer> previousIndex = new HashMap<>();
        for (int i = 0; i < previous.size(); i++) {
            previousIndex.put(previous.get(i), i);
        }

        int n = current.size();
        double score = 0;
        double totalWeight = 0;
        for (int i = 0; i < n; i++) {
            Integer before = previousIndex.get(current.get(i));
            if (before == null) continue;
            double weight = 1 - (double) i / n;
            score += (1 - (double) Math.abs(i - before) / (n - 1)) * weight;
            totalWeight += weight;
        }
        return totalWeight > 0 ? score / totalWeight : 0.0;
    }
}
