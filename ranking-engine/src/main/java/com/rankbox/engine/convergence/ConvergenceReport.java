package com.rankbox.engine.convergence;

/**
 * Result of one convergence check. {@code blocker} names the first criterion that failed,
 * or is null when the ranking converged.
 */
public record ConvergenceReport(
        boolean converged,
        String blocker,
        double progress,
        double avgConfidence,
        double transitivityScore,
        double rankStability,
        AdaptiveThresholds thresholds
) {
    static ConvergenceReport blocked(String blocker, double progress, AdaptiveThresholds thresholds) {
        return new ConvergenceReport(false, blocker, progress, 0, 0, 0, thresholds);
    }
}
