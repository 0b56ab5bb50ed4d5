package com.rankbox.engine.confidence;

import com.rankbox.engine.model.RatingRecord;
import com.rankbox.engine.store.RatingStore;
import com.rankbox.engine.store.Standings;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Cached confidence lookups over one live {@link RatingStore}.
 *
 * Callers must report every mutation of the store through {@link #invalidate} or
 * {@link #invalidateAll}; reads between mutations return identical values.
 */
public class ConfidenceTracker {

    private final ConfidenceEstimator estimator;
    private final RatingStore store;
    private final ConfidenceCache cache = new ConfidenceCache();

    private Standings standings;

    public ConfidenceTracker(ConfidenceEstimator estimator, RatingStore store) {
        this.estimator = estimator;
        this.store = store;
    }

    public double confidence(String itemId) {
        Double cached = cache.get(itemId);
        if (cached != null) return cached;

        Set<String> reads = new HashSet<>();
        double value = estimator.estimate(itemId, store, standings(), reads);
        cache.put(itemId, value, reads);
        return value;
    }

    public ConfidenceBreakdown breakdown(String itemId) {
        return estimator.breakdown(itemId, store, standings(), new HashSet<>());
    }

    public double averageConfidence() {
        if (store.size() == 0) return 0.0;
        double sum = 0;
        for (RatingRecord record : store.records()) {
            sum += confidence(record.getItemId());
        }
        return sum / store.size();
    }

    public Standings standings() {
        if (standings == null) {
            standings = store.standings();
        }
        return standings;
    }

    public void invalidate(Collection<String> changedIds) {
        if (changedIds.isEmpty()) return;
        standings = null;
        cache.invalidate(changedIds);
    }

    public void invalidateAll() {
        standings = null;
        cache.clear();
    }

    int cachedEntries() {
        return cache.size();
    }
}
