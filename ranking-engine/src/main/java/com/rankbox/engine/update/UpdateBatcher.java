package com.rankbox.engine.update;

import com.rankbox.engine.config.RankingConfig;
import com.rankbox.engine.model.ComparisonEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Holds resolved outcomes until a dynamically sized batch is ready.
 *
 * Batches scale with log(item count), stay small early and late in a session and grow in the
 * middle once average confidence allows it. Recent rating volatility shrinks or grows them
 * further. The queue is owned by one engine instance.
 */
public class UpdateBatcher {

    private static final double LOG2_100 = Math.log(100) / Math.log(2);

    private final RankingConfig config;
    private final PriorityQueue<PendingOutcome> queue = new PriorityQueue<>(PendingOutcome.PRIORITY);
    private long nextOrder;

    public UpdateBatcher(RankingConfig config) {
        this.config = config;
    }

    public void enqueue(ComparisonEvent event, double uncertainty) {
        queue.add(new PendingOutcome(event, uncertainty, nextOrder++));
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    /**
     * Empties the queue and returns its events in priority order.
     */
    public List<ComparisonEvent> drain() {
        List<ComparisonEvent> batch = new ArrayList<>(queue.size());
        while (!queue.isEmpty()) {
            batch.add(queue.poll().event());
        }
        return batch;
    }

    public List<PendingOutcome> snapshot() {
        List<PendingOutcome> pending = new ArrayList<>(queue);
        pending.sort(PendingOutcome.PRIORITY);
        return pending;
    }

    public void restore(List<PendingOutcome> pending) {
        queue.clear();
        queue.addAll(pending);
        long maxOrder = -1;
        for (PendingOutcome p : pending) {
            maxOrder = Math.max(maxOrder, p.order());
        }
        nextOrder = Math.max(nextOrder, maxOrder + 1);
    }

    public void clear() {
        queue.clear();
    }

    // ============ BATCH SIZING ============

    public int targetSize(int itemCount, double progress, double avgConfidence, RatingChangeWindow changes) {
        double scaling = Math.log(Math.max(2, itemCount)) / Math.log(2) / LOG2_100;

        int early = clamp((int) Math.floor(itemCount * 0.03 * scaling), 2, 8);
        int mid = clamp((int) Math.floor(itemCount * 0.06 * scaling), 3, 12);
        double earlyThreshold = 0.15 + 0.05 * (1 - scaling);
        double lateThreshold = 0.65 + 0.1 * scaling;
        double minConfidence = 0.35 + 0.1 * scaling;

        double volatility = volatilityFactor(changes);
        int earlySized = Math.max(2, (int) Math.round(early * volatility));

        if (progress < earlyThreshold || progress > lateThreshold) {
            return earlySized;
        }
        if (avgConfidence < minConfidence) {
            return earlySized;
        }
        return Math.max(3, (int) Math.round(mid * volatility));
    }

    /**
     * 0.5 when recent changes are large, 1.5 when they are small, linear in between.
     * Neutral until the volatility window has filled.
     */
    public double volatilityFactor(RatingChangeWindow changes) {
        int window = config.getVolatilityWindow();
        if (changes.size() < window) return 1.0;

        double volatility = changes.meanAbs(window);
        double high = config.getVolatilityHigh();
        double low = config.getVolatilityLow();
        if (volatility > high) return 0.5;
        if (volatility < low) return 1.5;
        return 0.5 + (high - volatility) / (high - low);
    }

    private static int clamp(int value, int min, int max) {
        return Math.min(max, Math.max(min, value));
    }
}
