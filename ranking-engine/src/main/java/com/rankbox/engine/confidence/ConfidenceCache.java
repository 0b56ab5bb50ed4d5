package com.rankbox.engine.confidence;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Memoised confidence values keyed by item id.
 *
 * Each entry remembers which records it read. Invalidating an item drops its own entry and
 * every entry that depends on it; nothing else is touched.
 */
public class ConfidenceCache {

    private final Map<String, Double> values = new HashMap<>();
    private final Map<String, Set<String>> dependents = new HashMap<>();

    public Double get(String itemId) {
        return values.get(itemId);
    }

    public void put(String itemId, double value, Set<String> reads) {
        values.put(itemId, value);
        for (String read : reads) {
            dependents.computeIfAbsent(read, k -> new HashSet<>()).add(itemId);
        }
    }

    /**
     * Drops the entries of the changed items and of everything that read them.
     *
     * @return number of entries removed
     */
    public int invalidate(Collection<String> changedIds) {
        int removed = 0;
        for (String changed : changedIds) {
            if (values.remove(changed) != null) removed++;
            Set<String> keys = dependents.remove(changed);
            if (keys == null) continue;
            for (String key : keys) {
                if (values.remove(key) != null) removed++;
            }
        }
        return removed;
    }

    public void clear() {
        values.clear();
        dependents.clear();
    }

    public int size() {
        return values.size();
    }

    public boolean contains(String itemId) {
        return values.containsKey(itemId);
    }
}
