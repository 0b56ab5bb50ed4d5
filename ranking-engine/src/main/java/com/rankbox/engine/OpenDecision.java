package com.rankbox.engine;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A group choice whose losers are still being resolved one pairwise outcome at a time.
 */
final class OpenDecision {

    private final int decisionId;
    private final String winnerId;
    private final List<String> members;
    private final Set<String> resolvedLosers;

    OpenDecision(int decisionId, String winnerId, List<String> members) {
        this(decisionId, winnerId, members, new HashSet<>());
    }

    private OpenDecision(int decisionId, String winnerId, List<String> members, Set<String> resolvedLosers) {
        this.decisionId = decisionId;
        this.winnerId = winnerId;
        this.members = List.copyOf(members);
        this.resolvedLosers = resolvedLosers;
    }

    /**
     * True for the same group, whatever the winner: the presentation this decision was opened
     * for is still on screen.
     */
    boolean presents(List<String> members) {
        return Set.copyOf(this.members).equals(Set.copyOf(members));
    }

    /**
     * The same presentation with a different winner. Losers resolved under the old winner are
     * not carried over.
     */
    OpenDecision withWinner(String winnerId) {
        return new OpenDecision(decisionId, winnerId, members);
    }

    boolean isResolved(String loserId) {
        return resolvedLosers.contains(loserId);
    }

    void markResolved(String loserId) {
        resolvedLosers.add(loserId);
    }

    boolean isComplete() {
        return resolvedLosers.size() >= members.size() - 1;
    }

    OpenDecision copy() {
        return new OpenDecision(decisionId, winnerId, members, new HashSet<>(resolvedLosers));
    }

    int decisionId() { return decisionId; }

    String winnerId() { return winnerId; }
}
