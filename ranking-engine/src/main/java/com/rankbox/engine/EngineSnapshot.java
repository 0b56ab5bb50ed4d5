package com.rankbox.engine;

import com.rankbox.engine.model.OptimizationStats;
import com.rankbox.engine.store.RatingStore;
import com.rankbox.engine.update.PendingOutcome;
import com.rankbox.engine.update.RatingChangeWindow;

import java.util.List;

/**
 * Value copy of everything a single undo has to put back. Shares no mutable state with the
 * live engine.
 */
record EngineSnapshot(
        RatingStore store,
        List<PendingOutcome> pending,
        RatingChangeWindow changes,
        OptimizationStats optimizationStats,
        double learningRate,
        OpenDecision openDecision,
        int comparisons
) {
    EngineSnapshot {
        pending = List.copyOf(pending);
    }
}
