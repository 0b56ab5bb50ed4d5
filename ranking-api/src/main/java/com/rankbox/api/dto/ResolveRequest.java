package com.rankbox.api.dto;

import java.util.List;

/**
 * One choice. With a {@code loserId} it records a single pairwise outcome; without one the
 * winner beats every other member of {@code groupMembers}.
 */
public record ResolveRequest(
        String winnerId,
        String loserId,
        List<String> groupMembers
) {
    public boolean isGroupChoice() {
        return loserId == null || loserId.isBlank();
    }
}
