package com.rankbox.api.dto;

import java.time.Instant;

public record SessionResponse(
        String sessionId,
        int itemCount,
        int maxComparisons,
        String mode,
        int estimatedMinutes,
        Instant startedAt
) {}
