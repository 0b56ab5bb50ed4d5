package com.rankbox.engine.store;

import com.rankbox.engine.model.ComparisonEvent;
import com.rankbox.engine.model.Item;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ComparisonHistoryTest {

    private ComparisonHistory<String> history;

    @BeforeEach
    void setUp() {
        history = new ComparisonHistory<>();
    }

    private HistoryEntry<String> entry(String winner, String loser, int decisionId) {
        ComparisonEvent event = new ComparisonEvent(winner, loser, null, history.size(), false);
        return new HistoryEntry<>(event, decisionId, List.of(new Item(winner, winner), new Item(loser, loser)),
                "before " + winner + ">" + loser);
    }

    @Test
    void pushRecordsPreferenceEdge() {
        history.push(entry("a", "b", 0));

        PreferenceGraph graph = history.graph();
        assertThat(graph.beats("a", "b")).isTrue();
        assertThat(graph.beats("b", "a")).isFalse();
        assertThat(graph.hasEvidence("b", "a")).isTrue();
        assertThat(graph.successors("a")).containsExactly("b");
        assertThat(graph.nodes()).containsExactly("a", "b");
    }

    @Test
    void popRemovesOnlyOneSupportingOutcome() {
        history.push(entry("a", "b", 0));
        history.push(entry("a", "b", 1));

        assertThat(history.graph().edgeCount()).isEqualTo(1);

        history.pop();
        assertThat(history.graph().beats("a", "b")).isTrue();

        history.pop();
        assertThat(history.graph().beats("a", "b")).isFalse();
        assertThat(history.graph().isEmpty()).isTrue();
    }

    @Test
    void popOnEmptyHistoryReturnsNull() {
        assertThat(history.pop()).isNull();
        assertThat(history.peek()).isNull();
    }

    @Test
    void entryBackCountsFromTheLatest() {
        history.push(entry("a", "b", 0));
        history.push(entry("b", "c", 1));
        history.push(entry("c", "d", 2));

        assertThat(history.entryBack(1).event().winnerId()).isEqualTo("c");
        assertThat(history.entryBack(3).event().winnerId()).isEqualTo("a");
        assertThat(history.entryBack(4)).isNull();
        assertThat(history.events()).extracting(ComparisonEvent::label)
                .containsExactly("a>b", "b>c", "c>d");
    }

    @Test
    void snapshotTravelsWithEntry() {
        history.push(entry("a", "b", 7));

        HistoryEntry<String> popped = history.pop();

        assertThat(popped.snapshot()).isEqualTo("before a>b");
        assertThat(popped.decisionId()).isEqualTo(7);
        assertThat(popped.presented()).extracting(Item::id).containsExactly("a", "b");
    }

    @Test
    void clearEmptiesHistoryAndGraph() {
        history.push(entry("a", "b", 0));
        history.push(entry("c", "a", 1));

        history.clear();

        assertThat(history.isEmpty()).isTrue();
        assertThat(history.graph().edges()).isEmpty();
    }

    @Test
    void edgesKeepInsertionOrder() {
        PreferenceGraph graph = PreferenceGraphs.of("c>a", "a>b", "c>b");

        assertThat(graph.edges()).extracting(e -> e[0] + ">" + e[1])
                .containsExactly("c>a", "c>b", "a>b");
    }
}
