package com.rankbox.engine.audit;

import com.rankbox.engine.config.RankingConfig;
import com.rankbox.engine.model.RatingRecord;
import com.rankbox.engine.store.PreferenceGraph;
import com.rankbox.engine.store.RatingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic repair of ratings that contradict recorded preferences.
 *
 * <ol>
 *   <li>Direct violations: a recorded winner rated at or below its loser.</li>
 *   <li>Triad violations: three items ordered by rating where the record says otherwise.</li>
 *   <li>Preference cycles found through strongly connected components.</li>
 *   <li>Z-score normalisation, then one nudge for any direct violation it reintroduced.</li>
 * </ol>
 *
 * Corrections are applied to the store passed in, which should be a working copy; the caller
 * commits it only when {@link AuditReport#committed()} is true.
 */
public class ConsistencyAuditor {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyAuditor.class);

    private static final double DIRECT_MARGIN = 0.1;
    private static final double WINNER_SHARE = 0.6;
    private static final double LOSER_SHARE = 0.4;
    private static final double TRIAD_MARGIN = 0.1;
    private static final double CYCLE_MARGIN = 0.05;
    private static final double POST_NORMALIZATION_NUDGE = 0.05;

    private final RankingConfig config;
    private final Random random;
    private final CycleFinder cycleFinder;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ConsistencyAuditor(RankingConfig config, Random random) {
        this.config = config;
        this.random = random;
        this.cycleFinder = new CycleFinder(config.getMaxCycleLength(), config.getCycleSampleSize(),
                config.getMaxCycleComponentSize());
    }

    public boolean isDue(int comparisons, int lastAuditComparison) {
        return comparisons >= config.getAuditMinComparisons()
                && comparisons - lastAuditComparison >= config.getAuditInterval();
    }

    public boolean isRunning() {
        return running.get();
    }

    public AuditReport audit(RatingStore store, PreferenceGraph graph) {
        if (!running.compareAndSet(false, true)) {
            log.debug("Consistency audit already running, skipping");
            return AuditReport.skippedRun();
        }
        try {
            return runAudit(store, graph);
        } finally {
            running.set(false);
        }
    }

    private AuditReport runAudit(RatingStore store, PreferenceGraph graph) {
        Map<String, Double> before = ratingsOf(store);
        Map<String, Double> ratings = new LinkedHashMap<>(before);

        List<String[]> direct = directViolations(graph, ratings);
        List<String[]> triads = triadViolations(graph, ratings);
        List<List<String>> cycles = cycleFinder.findCycles(graph, ratings);

        int corrections = 0;
        int transitivityFixed = 0;

        for (String[] edge : direct) {
            double gap = ratings.get(edge[1]) - ratings.get(edge[0]);
            double adjustment = (gap + DIRECT_MARGIN) * config.getDirectCorrectionStrength();
            ratings.merge(edge[0], adjustment * WINNER_SHARE, Double::sum);
            ratings.merge(edge[1], -adjustment * LOSER_SHARE, Double::sum);
            corrections++;
        }

        for (String[] triad : triads) {
            correctTriad(store, ratings, triad);
            corrections++;
            transitivityFixed++;
        }

        for (List<String> cycle : cycles) {
            corrections += correctCycle(ratings, cycle);
            transitivityFixed++;
        }

        normalize(ratings);

        int postNormalization = 0;
        for (String[] edge : graph.edges()) {
            if (ratings.get(edge[0]) <= ratings.get(edge[1])) {
                ratings.merge(edge[0], POST_NORMALIZATION_NUDGE, Double::sum);
                ratings.merge(edge[1], -POST_NORMALIZATION_NUDGE, Double::sum);
                postNormalization++;
            }
        }
        corrections += postNormalization;

        if (corrections == 0) {
            log.debug("Consistency audit found nothing to correct");
            return new AuditReport(false, false, 0, 0, 0, 0, cycles.size(), Set.of());
        }

        Set<String> changed = new LinkedHashSet<>();
        for (Map.Entry<String, Double> entry : ratings.entrySet()) {
            if (Double.compare(entry.getValue(), before.get(entry.getKey())) != 0) {
                store.require(entry.getKey()).setRating(entry.getValue());
                changed.add(entry.getKey());
            }
        }

        log.info("Consistency audit applied {} corrections ({} direct, {} transitivity, {} after normalisation)",
                corrections, direct.size(), transitivityFixed, postNormalization);
        return new AuditReport(false, true, corrections, direct.size(), transitivityFixed,
                postNormalization, cycles.size(), changed);
    }

    // ============ DETECTION ============

    List<String[]> directViolations(PreferenceGraph graph, Map<String, Double> ratings) {
        List<String[]> violations = new ArrayList<>();
        for (String[] edge : graph.edges()) {
            Double winner = ratings.get(edge[0]);
            Double loser = ratings.get(edge[1]);
            if (winner != null && loser != null && winner <= loser) {
                violations.add(edge);
            }
        }
        return violations;
    }

    /**
     * Triads {a, b, c} with a > b > c by rating where c beat a, or b beat a and c beat b.
     * All triads are checked while their number stays within the sample size; beyond that a
     * seeded random sample is drawn.
     */
    List<String[]> triadViolations(PreferenceGraph graph, Map<String, Double> ratings) {
        List<String> ids = new ArrayList<>(ratings.keySet());
        int n = ids.size();
        List<String[]> violations = new ArrayList<>();
        if (n < 3 || graph.isEmpty()) return violations;

        long triadCount = (long) n * (n - 1) * (n - 2) / 6;
        int sample = config.getTriadSampleSize();
        if (triadCount <= sample) {
            for (int i = 0; i < n - 2; i++) {
                for (int j = i + 1; j < n - 1; j++) {
                    for (int k = j + 1; k < n; k++) {
                        checkTriad(ids.get(i), ids.get(j), ids.get(k), graph, ratings, violations);
                    }
                }
            }
        } else {
            for (int s = 0; s < sample; s++) {
                int i = random.nextInt(n);
                int j = random.nextInt(n - 1);
                if (j >= i) j++;
                int k;
                do {
                    k = random.nextInt(n);
                } while (k == i || k == j);
                checkTriad(ids.get(i), ids.get(j), ids.get(k), graph, ratings, violations);
            }
        }
        return violations;
    }

    private static void checkTriad(String x, String y, String z, PreferenceGraph graph,
                                   Map<String, Double> ratings, List<String[]> out) {
        String[] t = {x, y, z};
        // order by rating descending
        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 2 - i; j++) {
                if (ratings.get(t[j]) < ratings.get(t[j + 1])) {
                    String tmp = t[j];
                    t[j] = t[j + 1];
                    t[j + 1] = tmp;
                }
            }
        }
        String a = t[0];
        String b = t[1];
        String c = t[2];
        if (!(ratings.get(a) > ratings.get(b) && ratings.get(b) > ratings.get(c))) return;

        if (graph.beats(c, a) || (graph.beats(b, a) && graph.beats(c, b))) {
            out.add(t);
        }
    }

    // ============ CORRECTION ============

    /**
     * Moves the most uncertain member of the triad part of the way toward a rating that
     * restores the order, capped at the maximum correction.
     */
    private void correctTriad(RatingStore store, Map<String, Double> ratings, String[] triad) {
        int target = 0;
        double maxUncertainty = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < 3; i++) {
            RatingRecord record = store.require(triad[i]);
            if (record.getRatingUncertainty() > maxUncertainty) {
                maxUncertainty = record.getRatingUncertainty();
                target = i;
            }
        }

        double a = ratings.get(triad[0]);
        double b = ratings.get(triad[1]);
        double c = ratings.get(triad[2]);
        double goal = switch (target) {
            case 0 -> b + TRIAD_MARGIN;
            case 1 -> (a + c) / 2;
            default -> b - TRIAD_MARGIN;
        };

        double current = ratings.get(triad[target]);
        double adjustment = (goal - current) * config.getIncrementalAdjustment();
        double capped = Math.min(Math.abs(adjustment), config.getMaxCorrection()) * Math.signum(adjustment);
        ratings.put(triad[target], current + capped);
    }

    /**
     * Pushes apart every edge of the cycle whose ratings disagree with it.
     *
     * @return number of edges adjusted
     */
    private int correctCycle(Map<String, Double> ratings, List<String> cycle) {
        int adjusted = 0;
        for (int i = 0; i < cycle.size(); i++) {
            String id = cycle.get(i);
            String next = cycle.get((i + 1) % cycle.size());
            double current = ratings.get(id);
            double following = ratings.get(next);
            if (current <= following) {
                double adjustment = Math.min((following - current + CYCLE_MARGIN) * config.getIncrementalAdjustment(),
                        config.getMaxCorrection());
                ratings.put(id, current + adjustment);
                ratings.put(next, following - adjustment);
                adjusted++;
            }
        }
        return adjusted;
    }

    static void normalize(Map<String, Double> ratings) {
        if (ratings.isEmpty()) return;
        double mean = 0;
        for (double r : ratings.values()) mean += r;
        mean /= ratings.size();

        double variance = 0;
        for (double r : ratings.values()) variance += (r - mean) * (r - mean);
        double stdDev = Math.sqrt(variance / ratings.size());
        if (stdDev <= 1e-12) return;

        final double m = mean;
        ratings.replaceAll((id, r) -> (r - m) / stdDev);
    }

    private static Map<String, Double> ratingsOf(RatingStore store) {
        Map<String, Double> ratings = new LinkedHashMap<>();
        for (RatingRecord record : store.records()) {
            ratings.put(record.getItemId(), record.getRating());
        }
        return ratings;
    }
}
