package com.rankbox.engine.update;

import java.util.List;
import java.util.Set;

/**
 * Outcome of applying one batch.
 *
 * @param touchedIds        items whose rating state changed
 * @param appliedPairs      distinct winner/loser pairs that produced a rating delta
 * @param appliedEvents     events applied, duplicates included
 * @param skippedEvents     events dropped because a record was missing
 * @param lastLearningRate  learning rate of the last pair processed, 0 when nothing applied
 * @param deltas            base rating delta per applied pair, in processing order
 */
public record BatchResult(
        Set<String> touchedIds,
        int appliedPairs,
        int appliedEvents,
        int skippedEvents,
        double lastLearningRate,
        List<Double> deltas
) {
    public static BatchResult empty() {
        return new BatchResult(Set.of(), 0, 0, 0, 0.0, List.of());
    }

    public boolean isEmpty() {
        return appliedEvents == 0;
    }
}
