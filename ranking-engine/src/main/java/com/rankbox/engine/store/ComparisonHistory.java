package com.rankbox.engine.store;

import com.rankbox.engine.model.ComparisonEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only log of resolved comparisons, popped from the end by undo.
 *
 * @param <S> snapshot type stored with every entry
 */
public class ComparisonHistory<S> {

    private final List<HistoryEntry<S>> entries = new ArrayList<>();
    private final PreferenceGraph graph = new PreferenceGraph();

    public void push(HistoryEntry<S> entry) {
        entries.add(entry);
        graph.add(entry.event().winnerId(), entry.event().loserId());
    }

    /**
     * Removes and returns the latest entry, or null when the history is empty.
     */
    public HistoryEntry<S> pop() {
        if (entries.isEmpty()) return null;
        HistoryEntry<S> entry = entries.remove(entries.size() - 1);
        graph.remove(entry.event().winnerId(), entry.event().loserId());
        return entry;
    }

    public HistoryEntry<S> peek() {
        return entries.isEmpty() ? null : entries.get(entries.size() - 1);
    }

    /**
     * The entry {@code back} positions before the end; {@code back == 1} is the latest.
     * Null when the history is shorter than that.
     */
    public HistoryEntry<S> entryBack(int back) {
        int index = entries.size() - back;
        return index >= 0 && index < entries.size() ? entries.get(index) : null;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<HistoryEntry<S>> entries() {
        return Collections.unmodifiableList(entries);
    }

    public List<ComparisonEvent> events() {
        return entries.stream().map(HistoryEntry::event).toList();
    }

    public PreferenceGraph graph() {
        return graph;
    }

    public void clear() {
        entries.clear();
        graph.clear();
    }
}
