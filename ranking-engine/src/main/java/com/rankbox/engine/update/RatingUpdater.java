package com.rankbox.engine.update;

import com.rankbox.engine.config.RankingConfig;
import com.rankbox.engine.model.ComparisonEvent;
import com.rankbox.engine.model.RatingRecord;
import com.rankbox.engine.model.RecentResult;
import com.rankbox.engine.store.RatingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * ELO-style rating updates with momentum, an adaptive learning rate and a Bayesian shadow.
 *
 * Every pair in a batch is evaluated against the state the batch started from. Per-item
 * contributions are accumulated and written once at the end, momentum included, so an item
 * that appears in several pairs never has its momentum applied more than once.
 *
 * Win/loss counters are not touched here; the engine counts each resolution when it is
 * submitted.
 */
public class RatingUpdater {

    private static final Logger log = LoggerFactory.getLogger(RatingUpdater.class);

    // ============ LEARNING RATE CONSTANTS ============
    private static final double PROGRESS_DECAY = 0.5;
    private static final double EARLY_PHASE_BOOST = 1.2;
    private static final double LATE_PHASE_DAMPING = 0.8;
    private static final double CONSISTENCY_SCALING = 1.5;
    private static final double INCONSISTENCY_SCALING = 0.6;
    private static final double CONSISTENCY_THRESHOLD = 0.7;
    private static final double SURPRISE_BOOST = 1.5;
    private static final double EXPECTED_RESULT_DAMPING = 0.7;
    private static final double TYPICAL_CHANGE = 0.1;

    // ============ BAYESIAN CONSTANTS ============
    private static final double UNCERTAINTY_REDUCTION = 0.1;
    private static final double GROUP_OBSERVATION_STRENGTH = 0.8;

    private final RankingConfig config;

    public RatingUpdater(RankingConfig config) {
        this.config = config;
    }

    /**
     * Applies a batch to {@code store}.
     *
     * @param events     events in processing order; duplicates of a winner/loser pair produce
     *                   one rating delta but one recent result each
     * @param progress   comparisons / maxComparisons at the time of the flush
     * @param confidence confidence lookup against the pre-batch state
     * @param changes    recent rating deltas; receives one entry per applied pair
     */
    public BatchResult applyBatch(RatingStore store, List<ComparisonEvent> events, double progress,
                                  ToDoubleFunction<String> confidence, RatingChangeWindow changes) {
        if (events.isEmpty()) {
            return BatchResult.empty();
        }

        Map<ComparisonEvent.Pair, List<ComparisonEvent>> byPair = new LinkedHashMap<>();
        int skipped = 0;
        for (ComparisonEvent event : events) {
            if (store.find(event.winnerId()) == null || store.find(event.loserId()) == null) {
                log.warn("Skipping comparison {}: no rating record for one of its items", event.label());
                skipped++;
                continue;
            }
            byPair.computeIfAbsent(event.pair(), k -> new ArrayList<>()).add(event);
        }

        double volatility = volatilityFactor(changes);
        Map<String, Accumulator> acc = new LinkedHashMap<>();
        List<Double> deltas = new ArrayList<>();
        double lastRate = 0.0;
        int applied = 0;

        for (List<ComparisonEvent> occurrences : byPair.values()) {
            ComparisonEvent event = occurrences.get(0);
            RatingRecord winner = store.require(event.winnerId());
            RatingRecord loser = store.require(event.loserId());

            double consistency = consistencyFactor(winner, loser);
            double rate = learningRate(winner, loser, progress,
                    confidence.applyAsDouble(winner.getItemId()), confidence.applyAsDouble(loser.getItemId()),
                    volatility, consistency, surpriseFactor(store, winner, loser));

            double expected = expectedWinProbability(winner.getRating(), loser.getRating());
            double delta = rate * (1 - expected);
            double momentumScaling = volatility * consistency;

            boolean group = occurrences.stream().anyMatch(ComparisonEvent::isGroupChoice);
            double strength = (group ? GROUP_OBSERVATION_STRENGTH : 1.0) * volatility;
            double reduction = uncertaintyReductionRate(progress) * consistency;

            Accumulator w = acc.computeIfAbsent(winner.getItemId(), k -> new Accumulator());
            Accumulator l = acc.computeIfAbsent(loser.getItemId(), k -> new Accumulator());

            w.ratingDelta += delta;
            l.ratingDelta -= delta;
            w.momentumContribution += delta * momentumScaling;
            l.momentumContribution -= delta * momentumScaling;
            w.meanDelta += delta * (1 + winner.getRatingUncertainty()) * strength;
            l.meanDelta -= delta * (1 + loser.getRatingUncertainty()) * strength;
            w.uncertaintyFactor *= 1 - reduction * strength;
            l.uncertaintyFactor *= 1 - reduction * strength;

            double diff = Math.abs(winner.getRating() - loser.getRating());
            for (ComparisonEvent occurrence : occurrences) {
                w.results.add(new TimedResult(occurrence.sequenceIndex(), RecentResult.builder()
                        .opponentId(loser.getItemId()).won(true).ratingDiffAtTime(diff).learningRateUsed(rate).build()));
                l.results.add(new TimedResult(occurrence.sequenceIndex(), RecentResult.builder()
                        .opponentId(winner.getItemId()).won(false).ratingDiffAtTime(diff).learningRateUsed(rate).build()));
            }

            changes.add(delta);
            deltas.add(delta);
            lastRate = rate;
            applied += occurrences.size();

            log.debug("{} beat {}: p={} lr={} delta={}", winner.getItemId(), loser.getItemId(),
                    String.format("%.3f", expected), String.format("%.4f", rate), String.format("%.4f", delta));
        }

        Set<String> touched = new LinkedHashSet<>();
        for (Map.Entry<String, Accumulator> entry : acc.entrySet()) {
            RatingRecord record = store.require(entry.getKey());
            Accumulator a = entry.getValue();

            double momentum = record.getMomentum() * config.getMomentumFactor() + a.momentumContribution;
            record.setMomentum(momentum);
            record.setRating(record.getRating() + a.ratingDelta + momentum);
            record.setRatingMean(record.getRatingMean() + a.meanDelta);
            record.reduceUncertainty(record.getRatingUncertainty() * a.uncertaintyFactor);

            a.results.sort(Comparator.comparingInt(TimedResult::sequence));
            a.results.forEach(t -> record.addRecentResult(t.result()));
            touched.add(entry.getKey());
        }

        return new BatchResult(touched, byPair.size(), applied, skipped, lastRate, deltas);
    }

    // ============ LEARNING RATE ============

    public static double expectedWinProbability(double winnerRating, double loserRating) {
        // exp(rw) / (exp(rw) + exp(rl)) without overflow
        return 1.0 / (1.0 + Math.exp(loserRating - winnerRating));
    }

    double learningRate(RatingRecord winner, RatingRecord loser, double progress,
                        double winnerConfidence, double loserConfidence,
                        double volatility, double consistency, double surprise) {
        double rate = config.getBaseLearningRate();

        double phase = progress < 0.3 ? EARLY_PHASE_BOOST : progress > 0.7 ? LATE_PHASE_DAMPING : 1.0;
        rate *= (1 - progress * PROGRESS_DECAY) * phase;

        double ratingDiff = Math.abs(winner.getRating() - loser.getRating());
        rate *= 1 + 1.0 / (1.0 + Math.exp(-5 * (1 - ratingDiff)));

        rate *= 1 - (winnerConfidence + loserConfidence) / 4;

        if (winner.getRating() < loser.getRating()) {
            rate *= config.getViolationBoost();
        }

        double avgMomentum = (Math.abs(winner.getMomentum()) + Math.abs(loser.getMomentum())) / 2;
        rate *= 1 + avgMomentum * config.getMomentumFactor();

        rate *= volatility * consistency * surprise;

        return Math.max(config.getMinLearningRate(), Math.min(config.getMaxLearningRate(), rate));
    }

    /**
     * Log-scaled mean absolute change over the adaptation window, in [0.5, 1.5].
     * Neutral until the window has filled.
     */
    double volatilityFactor(RatingChangeWindow changes) {
        int window = config.getAdaptationWindow();
        if (changes.size() < window) return 1.0;
        double normalized = changes.meanAbs(window) / TYPICAL_CHANGE;
        return Math.max(0.5, Math.min(1.5, Math.log(normalized + 1)));
    }

    static double consistencyFactor(RatingRecord winner, RatingRecord loser) {
        double avg = (flipConsistency(winner.getRecentResults()) + flipConsistency(loser.getRecentResults())) / 2;
        return avg > CONSISTENCY_THRESHOLD ? CONSISTENCY_SCALING : INCONSISTENCY_SCALING;
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
     * 1.5 when the latest result of either item contradicts the current rating order, else 0.7.
     */
    static double surpriseFactor(RatingStore store, RatingRecord winner, RatingRecord loser) {
        boolean surprised = contradictsRatings(store, winner) || contradictsRatings(store, loser);
        return surprised ? SURPRISE_BOOST : EXPECTED_RESULT_DAMPING;
    }

    private static boolean contradictsRatings(RatingStore store, RatingRecord record) {
        List<RecentResult> results = record.getRecentResults();
        if (results.isEmpty()) return false;
        RecentResult latest = results.get(results.size() - 1);
        RatingRecord opponent = store.find(latest.getOpponentId());
        double opponentRating = opponent == null ? 0.0 : opponent.getRating();
        int expected = record.getRating() > opponentRating ? 1 : 0;
        return latest.getOutcome() != expected;
    }

    static double uncertaintyReductionRate(double progress) {
        double phase = progress < 0.3 ? 0.8 : progress > 0.7 ? 1.2 : 1.0;
        return UNCERTAINTY_REDUCTION * phase;
    }

    // ============ ACCUMULATION ============

    private static final class Accumulator {
        double ratingDelta;
        double momentumContribution;
        double meanDelta;
        double uncertaintyFactor = 1.0;
        final List<TimedResult> results = new ArrayList<>();
    }

    private record TimedResult(int sequence, RecentResult result) {}
}
