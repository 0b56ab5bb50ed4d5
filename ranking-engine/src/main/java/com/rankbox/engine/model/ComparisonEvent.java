package com.rankbox.engine.model;

import java.util.List;

/**
 * One resolved pairwise outcome. A choice made from a group of three or more produces one
 * event per loser, all sharing the same {@code groupMembers}.
 */
public record ComparisonEvent(
        String winnerId,
        String loserId,
        List<String> groupMembers,
        int sequenceIndex,
        boolean highImpact
) {
    public ComparisonEvent {
        groupMembers = groupMembers == null ? List.of(winnerId, loserId) : List.copyOf(groupMembers);
    }

    public boolean isGroupChoice() {
        return groupMembers.size() > 2;
    }

    /**
     * Identity of the winner/loser pair. Repeated outcomes of the same pair compare equal.
     */
    public Pair pair() {
        return new Pair(winnerId, loserId);
    }

    /**
     * Human-readable form for logs, not unique since ids may contain any character.
     */
    public String label() {
        return winnerId + ">" + loserId;
    }

    public record Pair(String winnerId, String loserId) {}
}
