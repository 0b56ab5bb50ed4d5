package com.rankbox.engine.convergence;

/**
 * Early-termination thresholds for one dataset size and progress level.
 * Smaller datasets demand more; late in a session everything tightens.
 */
public record AdaptiveThresholds(
        double confidence,
        double stability,
        double transitivity,
        double rankChange
) {
    private static final double BASE_THRESHOLD = 0.7;
    private static final int MIN_DATASET = 10;
    private static final int MAX_DATASET = 500;
    private static final double EARLY_MULTIPLIER = 0.8;
    private static final double LATE_MULTIPLIER = 1.2;
    private static final double MIN_ALLOWED = 0.5;
    private static final double MAX_ALLOWED = 0.9;

    public static AdaptiveThresholds forSession(int itemCount, double progress) {
        double sizeFactor = Math.min(Math.max((double) (itemCount - MIN_DATASET) / (MAX_DATASET - MIN_DATASET), 0), 1);
        double base = BASE_THRESHOLD * (1 - sizeFactor * 0.3);
        double multiplier = progress < 0.3 ? EARLY_MULTIPLIER : progress > 0.7 ? LATE_MULTIPLIER : 1.0;
        double threshold = Math.min(Math.max(base * multiplier, MIN_ALLOWED), MAX_ALLOWED);

        return new AdaptiveThresholds(
                threshold,
                threshold * 0.8,
                threshold * 0.9,
                Math.max(0.02, 0.05 * (1 - sizeFactor))
        );
    }
}
