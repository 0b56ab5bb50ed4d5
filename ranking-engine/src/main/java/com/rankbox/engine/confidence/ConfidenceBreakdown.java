package com.rankbox.engine.confidence;

/**
 * The seven factors behind an item's confidence, each in [0, 1], and their blended total.
 * When the item has fewer comparisons than the minimum the total is pinned to the floor.
 */
public record ConfidenceBreakdown(
        String itemId,
        boolean belowMinimum,
        double sufficiency,
        double bayesian,
        double positional,
        double local,
        double selection,
        double temporal,
        double transitivity,
        double total
) {
    static final double W_SUFFICIENCY = 0.15;
    static final double W_BAYESIAN = 0.20;
    static final double W_POSITIONAL = 0.15;
    static final double W_LOCAL = 0.15;
    static final double W_SELECTION = 0.10;
    static final double W_TEMPORAL = 0.15;
    static final double W_TRANSITIVITY = 0.10;

    public String getTotalFormatted() {
        return String.format("%.0f%%", total * 100);
    }
}
