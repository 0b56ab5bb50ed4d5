package com.rankbox.engine.model;

/**
 * Snapshot of session progress for status displays.
 */
public record ProgressStats(
        int comparisons,
        int maxComparisons,
        double avgConfidence,
        double stabilityScore,
        double currentLearningRate,
        int pendingUpdates,
        Phase phase,
        EngineState state,
        OptimizationStats optimizationStats
) {
    public double getProgress() {
        return maxComparisons > 0 ? Math.min(1.0, (double) comparisons / maxComparisons) : 0.0;
    }

    public String getProgressFormatted() {
        return String.format("%.0f%%", getProgress() * 100);
    }

    public String getAvgConfidenceFormatted() {
        return String.format("%.0f%%", avgConfidence * 100);
    }

    /**
     * Rough minutes left, assuming about five seconds per remaining comparison.
     */
    public int getEstimatedMinutesLeft() {
        int remaining = Math.max(0, maxComparisons - comparisons);
        if (remaining == 0) return 0;
        return (int) Math.ceil(remaining * 0.08 * (1 - Math.log10(remaining) / 20));
    }
}
