package com.rankbox.engine.model;

import java.util.List;

/**
 * One row of the final (or current) standings, sorted by rating descending.
 */
public record RankedResult(
        int rank,
        Item item,
        double rating,
        int wins,
        int losses,
        int comparisons,
        List<RecentResult> recentResults,
        double confidence,
        double ratingUncertainty,
        GroupSelections groupSelections
) {
    public String getRatingFormatted() {
        return String.format("%.3f", rating);
    }

    public String getConfidenceFormatted() {
        return String.format("%.0f%%", confidence * 100);
    }

    public String getWinLossRecord() {
        return wins + "-" + losses;
    }
}
