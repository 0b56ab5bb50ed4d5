package com.rankbox.engine.update;

import com.rankbox.engine.model.ComparisonEvent;

import java.util.Comparator;

/**
 * A resolved comparison waiting for the next batch.
 *
 * @param uncertainty mean rating uncertainty of the two items when the outcome was queued
 * @param order       insertion counter, the final tie-break
 */
public record PendingOutcome(
        ComparisonEvent event,
        double uncertainty,
        long order
) {
    /**
     * High-impact first, then the more uncertain pair, then first in.
     */
    public static final Comparator<PendingOutcome> PRIORITY = Comparator
            .comparing((PendingOutcome p) -> !p.event().highImpact())
            .thenComparing(Comparator.comparingDouble(PendingOutcome::uncertainty).reversed())
            .thenComparingLong(PendingOutcome::order);
}
