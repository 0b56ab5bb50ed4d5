package com.rankbox.engine.selection;

import com.rankbox.engine.model.RatingRecord;

/**
 * Flags comparisons that are expected to be especially informative: closely rated items, few
 * comparisons so far, and the middle of the session.
 */
public final class ImpactEstimator {

    static final double MIN_PROGRESS = 0.2;
    static final double THRESHOLD = 0.7;

    private ImpactEstimator() {}

    public static double impactScore(RatingRecord a, RatingRecord b, double progress) {
        double ratingDiff = Math.abs(a.getRating() - b.getRating());
        double avgComparisons = (a.getComparisons() + b.getComparisons()) / 2.0;

        double proximity = 1.0 / (1.0 + Math.exp(5 * (ratingDiff - 0.5)));
        double scarcity = 1.0 / (avgComparisons + 1);
        double phase = 1 - Math.abs(progress - 0.5) * 2;

        return proximity * 0.5 + scarcity * 0.3 + phase * 0.2;
    }

    public static boolean isHighImpact(RatingRecord a, RatingRecord b, double progress) {
        return progress >= MIN_PROGRESS && impactScore(a, b, progress) > THRESHOLD;
    }
}
