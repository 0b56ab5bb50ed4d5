package com.rankbox.engine.store;

import com.rankbox.engine.model.RatingRecord;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rating order at one instant: records sorted by rating descending plus a position index.
 */
public class Standings {

    private final List<RatingRecord> ordered;
    private final Map<String, Integer> positions = new HashMap<>();

    Standings(List<RatingRecord> ordered) {
        this.ordered = List.copyOf(ordered);
        for (int i = 0; i < this.ordered.size(); i++) {
            positions.put(this.ordered.get(i).getItemId(), i);
        }
    }

    public List<RatingRecord> ordered() {
        return ordered;
    }

    public int size() {
        return ordered.size();
    }

    public RatingRecord at(int position) {
        return ordered.get(position);
    }

    /**
     * Zero-based position of the item, or -1 when unknown.
     */
    public int positionOf(String itemId) {
        Integer position = positions.get(itemId);
        return position == null ? -1 : position;
    }

    /**
     * Records within {@code range} positions of {@code position}, the centre included.
     */
    public List<RatingRecord> window(int position, int range) {
        int from = Math.max(0, position - range);
        int to = Math.min(ordered.size(), position + range + 1);
        return ordered.subList(from, to);
    }

    public List<String> idsInOrder() {
        return ordered.stream().map(RatingRecord::getItemId).toList();
    }
}
