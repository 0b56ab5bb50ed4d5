package com.rankbox.engine.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph with an edge winner to loser for every distinct pair resolved so far.
 *
 * Maintained incrementally by {@link ComparisonHistory}: each resolution adds one to the
 * edge count and each undo removes one, so an edge disappears when its last supporting
 * event is undone.
 */
public class PreferenceGraph {

    private final Map<String, Map<String, Integer>> outgoing = new LinkedHashMap<>();

    void add(String winnerId, String loserId) {
        outgoing.computeIfAbsent(winnerId, k -> new LinkedHashMap<>()).merge(loserId, 1, Integer::sum);
    }

    void remove(String winnerId, String loserId) {
        Map<String, Integer> targets = outgoing.get(winnerId);
        if (targets == null) return;
        Integer count = targets.get(loserId);
        if (count == null) return;
        if (count <= 1) {
            targets.remove(loserId);
            if (targets.isEmpty()) outgoing.remove(winnerId);
        } else {
            targets.put(loserId, count - 1);
        }
    }

    void clear() {
        outgoing.clear();
    }

    public boolean beats(String winnerId, String loserId) {
        Map<String, Integer> targets = outgoing.get(winnerId);
        return targets != null && targets.containsKey(loserId);
    }

    public boolean hasEvidence(String a, String b) {
        return beats(a, b) || beats(b, a);
    }

    public Set<String> successors(String id) {
        Map<String, Integer> targets = outgoing.get(id);
        return targets == null ? Collections.emptySet() : Collections.unmodifiableSet(targets.keySet());
    }

    public Set<String> nodes() {
        Set<String> nodes = new LinkedHashSet<>(outgoing.keySet());
        outgoing.values().forEach(t -> nodes.addAll(t.keySet()));
        return nodes;
    }

    /**
     * Distinct edges in insertion order, each as {winnerId, loserId}.
     */
    public List<String[]> edges() {
        List<String[]> edges = new ArrayList<>();
        outgoing.forEach((winner, targets) -> targets.keySet().forEach(loser -> edges.add(new String[]{winner, loser})));
        return edges;
    }

    public int edgeCount() {
        int count = 0;
        for (Map<String, Integer> targets : outgoing.values()) {
            count += targets.size();
        }
        return count;
    }

    public boolean isEmpty() {
        return outgoing.isEmpty();
    }
}
