package com.rankbox.engine.model;

import java.util.List;

/**
 * A pair or group handed to the caller for a decision.
 */
public record Selection(
        List<Item> items,
        Phase phase,
        int sequenceIndex,
        boolean highImpact
) {
    public Selection {
        items = List.copyOf(items);
    }

    public boolean isPair() {
        return items.size() == 2;
    }

    public List<String> itemIds() {
        return items.stream().map(Item::id).toList();
    }
}
