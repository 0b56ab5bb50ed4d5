package com.rankbox.engine.audit;

import com.rankbox.engine.store.PreferenceGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds preference cycles: strongly connected components first (Tarjan), then bounded
 * elementary-cycle search inside each component.
 *
 * Components larger than {@code maxComponentSize} are cut down to the nodes carrying the most
 * rating-contradicting edges before the search, which keeps the cost bounded on dense graphs.
 */
public class CycleFinder {

    private final int maxCycleLength;
    private final int maxCycles;
    private final int maxComponentSize;

    public CycleFinder(int maxCycleLength, int maxCycles, int maxComponentSize) {
        this.maxCycleLength = maxCycleLength;
        this.maxCycles = maxCycles;
        this.maxComponentSize = maxComponentSize;
    }

    /**
     * Cycles as node lists where each node beat the next and the last beat the first.
     */
    public List<List<String>> findCycles(PreferenceGraph graph, Map<String, Double> ratings) {
        List<List<String>> cycles = new ArrayList<>();
        for (List<String> component : stronglyConnectedComponents(graph)) {
            if (component.size() < 3) continue;
            List<String> nodes = component.size() > maxComponentSize
                    ? highConflictNodes(component, graph, ratings)
                    : component;
            collectCycles(nodes, graph, cycles);
            if (cycles.size() >= maxCycles) break;
        }
        return cycles.size() > maxCycles ? cycles.subList(0, maxCycles) : cycles;
    }

    // ============ TARJAN ============

    public List<List<String>> stronglyConnectedComponents(PreferenceGraph graph) {
        Tarjan tarjan = new Tarjan(graph);
        for (String node : graph.nodes()) {
            if (!tarjan.index.containsKey(node)) {
                tarjan.strongConnect(node);
            }
        }
        return tarjan.components;
    }

    private static final class Tarjan {
        private final PreferenceGraph graph;
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private final List<List<String>> components = new ArrayList<>();
        private int counter;

        Tarjan(PreferenceGraph graph) {
            this.graph = graph;
        }

        void strongConnect(String node) {
            index.put(node, counter);
            lowLink.put(node, counter);
            counter++;
            stack.push(node);
            onStack.add(node);

            for (String next : graph.successors(node)) {
                if (!index.containsKey(next)) {
                    strongConnect(next);
                    lowLink.put(node, Math.min(lowLink.get(node), lowLink.get(next)));
                } else if (onStack.contains(next)) {
                    lowLink.put(node, Math.min(lowLink.get(node), index.get(next)));
                }
            }

            if (lowLink.get(node).equals(index.get(node))) {
                List<String> component = new ArrayList<>();
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    component.add(member);
                } while (!member.equals(node));
                components.add(component);
            }
        }
    }

    // ============ CYCLE SEARCH ============

    /**
     * Nodes of the component ordered by how many of their edges disagree with the ratings,
     * keeping the top {@code maxComponentSize}.
     */
    List<String> highConflictNodes(List<String> component, PreferenceGraph graph, Map<String, Double> ratings) {
        Set<String> members = new HashSet<>(component);
        Map<String, Integer> conflicts = new HashMap<>();
        for (String winner : component) {
            for (String loser : graph.successors(winner)) {
                if (!members.contains(loser)) continue;
                if (ratings.getOrDefault(winner, 0.0) <= ratings.getOrDefault(loser, 0.0)) {
                    conflicts.merge(winner, 1, Integer::sum);
                    conflicts.merge(loser, 1, Integer::sum);
                }
            }
        }
        List<String> ordered = new ArrayList<>(component);
        ordered.sort(Comparator.comparingInt((String id) -> conflicts.getOrDefault(id, 0)).reversed());
        return ordered.subList(0, maxComponentSize);
    }

    private void collectCycles(List<String> nodes, PreferenceGraph graph, List<List<String>> out) {
        Map<String, Integer> order = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            order.put(nodes.get(i), i);
        }
        for (String start : nodes) {
            List<String> path = new ArrayList<>();
            path.add(start);
            Set<String> onPath = new LinkedHashSet<>(path);
            search(start, start, order, graph, path, onPath, out);
            if (out.size() >= maxCycles) return;
        }
    }

    // Each cycle is reported once, from its lowest-ordered node.
    private void search(String start, String node, Map<String, Integer> order, PreferenceGraph graph,
                        List<String> path, Set<String> onPath, List<List<String>> out) {
        if (out.size() >= maxCycles) return;
        int startOrder = order.get(start);
        for (String next : graph.successors(node)) {
            Integer nextOrder = order.get(next);
            if (nextOrder == null) continue;
            if (next.equals(start)) {
                if (path.size() >= 3) {
                    out.add(List.copyOf(path));
                    if (out.size() >= maxCycles) return;
                }
                continue;
            }
            if (nextOrder <= startOrder || onPath.contains(next) || path.size() >= maxCycleLength) continue;
            path.add(next);
            onPath.add(next);
            search(start, next, order, graph, path, onPath, out);
            path.remove(path.size() - 1);
            onPath.remove(next);
        }
    }
}
