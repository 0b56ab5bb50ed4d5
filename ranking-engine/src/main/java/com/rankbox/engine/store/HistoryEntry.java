package com.rankbox.engine.store;

import com.rankbox.engine.model.ComparisonEvent;
import com.rankbox.engine.model.Item;

import java.util.List;

/**
 * One resolved pairwise outcome plus the engine state captured just before it was applied.
 *
 * @param decisionId groups the events produced by a single choice; a pick from a group of
 *                   four yields three entries with the same id
 * @param presented  the pair or group the caller was looking at, re-presented on undo
 */
public record HistoryEntry<S>(
        ComparisonEvent event,
        int decisionId,
        List<Item> presented,
        S snapshot
) {
    public HistoryEntry {
        presented = List.copyOf(presented);
    }
}
