package com.rankbox.engine.update;

import java.util.ArrayList;
import java.util.List;

/**
 * The most recent rating deltas, newest last, bounded to a fixed capacity.
 */
public class RatingChangeWindow {

    private final int capacity;
    private final List<Double> changes;

    public RatingChangeWindow(int capacity) {
        this(capacity, new ArrayList<>());
    }

    private RatingChangeWindow(int capacity, List<Double> changes) {
        this.capacity = capacity;
        this.changes = changes;
    }

    public void add(double change) {
        changes.add(change);
        if (changes.size() > capacity) {
            changes.remove(0);
        }
    }

    public int size() {
        return changes.size();
    }

    /**
     * The last {@code n} changes, oldest first.
     */
    public List<Double> last(int n) {
        int from = Math.max(0, changes.size() - n);
        return List.copyOf(changes.subList(from, changes.size()));
    }

    public double meanAbs(int n) {
        List<Double> window = last(n);
        if (window.isEmpty()) return 0.0;
        double sum = 0;
        for (double change : window) {
            sum += Math.abs(change);
        }
        return sum / window.size();
    }

    public RatingChangeWindow copy() {
        return new RatingChangeWindow(capacity, new ArrayList<>(changes));
    }

    public void restore(RatingChangeWindow other) {
        changes.clear();
        changes.addAll(other.changes);
    }

    public void clear() {
        changes.clear();
    }
}
