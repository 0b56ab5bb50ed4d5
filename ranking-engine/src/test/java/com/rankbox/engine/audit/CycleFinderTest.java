package com.rankbox.engine.audit;

import com.rankbox.engine.store.PreferenceGraph;
import com.rankbox.engine.store.PreferenceGraphs;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CycleFinderTest {

    private final CycleFinder finder = new CycleFinder(5, 300, 5);

    private static void assertIsCycle(List<String> cycle, PreferenceGraph graph) {
        for (int i = 0; i < cycle.size(); i++) {
            String from = cycle.get(i);
            String to = cycle.get((i + 1) % cycle.size());
            assertThat(graph.beats(from, to)).as("%s beat %s", from, to).isTrue();
        }
    }

    @Test
    void findsThreeCycle() {
        PreferenceGraph graph = PreferenceGraphs.of("a>b", "b>c", "c>a");

        List<List<String>> cycles = finder.findCycles(graph, Map.of());

        assertThat(cycles).hasSize(1);
        assertThat(cycles.get(0)).containsExactlyInAnyOrder("a", "b", "c");
        assertIsCycle(cycles.get(0), graph);
    }

    @Test
    void acyclicGraphHasOnlySingletonComponents() {
        PreferenceGraph graph = PreferenceGraphs.of("a>b", "b>c", "a>c", "c>d");

        assertThat(finder.findCycles(graph, Map.of())).isEmpty();
        assertThat(finder.stronglyConnectedComponents(graph)).allMatch(c -> c.size() == 1).hasSize(4);
    }

    @Test
    void mutualPreferenceIsNotACycle() {
        PreferenceGraph graph = PreferenceGraphs.of("a>b", "b>a");

        assertThat(finder.stronglyConnectedComponents(graph)).hasSize(1);
        assertThat(finder.findCycles(graph, Map.of())).isEmpty();
    }

    @Test
    void reportsEveryElementaryCycleOnce() {
        PreferenceGraph graph = PreferenceGraphs.of("a>b", "b>c", "c>d", "d>a", "a>c");

        List<List<String>> cycles = finder.findCycles(graph, Map.of());

        assertThat(cycles).hasSize(2);
        assertThat(cycles).extracting(List::size).containsExactlyInAnyOrder(3, 4);
        cycles.forEach(c -> assertIsCycle(c, graph));
    }

    @Test
    void respectsLengthAndCountLimits() {
        PreferenceGraph square = PreferenceGraphs.of("a>b", "b>c", "c>d", "d>a");
        PreferenceGraph chorded = PreferenceGraphs.of("a>b", "b>c", "c>d", "d>a", "a>c");

        assertThat(new CycleFinder(3, 300, 5).findCycles(square, Map.of())).isEmpty();
        assertThat(new CycleFinder(5, 1, 5).findCycles(chorded, Map.of())).hasSize(1);
    }

    @Test
    void largeComponentsAreCutToConflictingNodes() {
        PreferenceGraph graph = PreferenceGraphs.of("a>b", "b>c", "c>d", "d>e", "e>a", "c>a");
        Map<String, Double> ratings = Map.of("a", 2.0, "b", 1.0, "c", 0.0, "d", -1.0, "e", -2.0);

        List<String> kept = new CycleFinder(5, 300, 3)
                .highConflictNodes(List.of("a", "b", "c", "d", "e"), graph, ratings);

        // e>a and c>a contradict the ratings
        assertThat(kept).hasSize(3).contains("a", "c", "e");
    }
}
