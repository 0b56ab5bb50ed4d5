package com.rankbox.engine.store;

import com.rankbox.engine.exception.MissingRecordException;
import com.rankbox.engine.model.Item;
import com.rankbox.engine.model.RatingRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Authoritative map from item id to its {@link RatingRecord}.
 *
 * The item set is fixed when the store is created. Iteration follows the order in which
 * items were supplied, which keeps every tie-break in the engine deterministic.
 */
public class RatingStore {

    private final Map<String, RatingRecord> records;

    public RatingStore(List<Item> items) {
        this.records = new LinkedHashMap<>();
        for (Item item : items) {
            if (item == null) {
                throw new IllegalArgumentException("Items must not be null");
            }
            if (records.containsKey(item.id())) {
                throw new IllegalArgumentException("Duplicate item id: " + item.id());
            }
            records.put(item.id(), new RatingRecord(item));
        }
    }

    private RatingStore(Map<String, RatingRecord> records) {
        this.records = records;
    }

    /**
     * Deep value copy. Nothing is shared with this store, so the copy can sit in a history entry
     * or serve as a working copy for a batch.
     */
    public RatingStore copy() {
        Map<String, RatingRecord> copied = new LinkedHashMap<>();
        records.forEach((id, record) -> copied.put(id, record.copy()));
        return new RatingStore(copied);
    }

    /**
     * Replaces every record with the one held by {@code other}. Used to commit a working copy
     * and to restore an undo snapshot; the item sets must match.
     */
    public void replaceWith(RatingStore other) {
        if (!records.keySet().equals(other.records.keySet())) {
            throw new IllegalArgumentException("Cannot replace records of a different item set");
        }
        other.records.forEach((id, record) -> records.put(id, record.copy()));
    }

    public RatingRecord require(String itemId) {
        RatingRecord record = records.get(itemId);
        if (record == null) {
            throw new MissingRecordException(itemId);
        }
        return record;
    }

    public RatingRecord find(String itemId) {
        return records.get(itemId);
    }

    public boolean contains(String itemId) {
        return records.containsKey(itemId);
    }

    public int size() {
        return records.size();
    }

    public Collection<RatingRecord> records() {
        return Collections.unmodifiableCollection(records.values());
    }

    public List<String> ids() {
        return new ArrayList<>(records.keySet());
    }

    /**
     * Records sorted by rating descending; equal ratings keep insertion order.
     */
    public List<RatingRecord> sortedByRating() {
        List<RatingRecord> sorted = new ArrayList<>(records.values());
        sorted.sort(Comparator.comparingDouble(RatingRecord::getRating).reversed());
        return sorted;
    }

    public Standings standings() {
        return new Standings(sortedByRating());
    }

    public int totalComparisons() {
        int total = 0;
        for (RatingRecord r : records.values()) {
            total += r.getComparisons();
        }
        return total;
    }

    public double averageComparisons() {
        return records.isEmpty() ? 0.0 : (double) totalComparisons() / records.size();
    }

    public int minComparisons() {
        int min = Integer.MAX_VALUE;
        for (RatingRecord r : records.values()) {
            min = Math.min(min, r.getComparisons());
        }
        return records.isEmpty() ? 0 : min;
    }
}
