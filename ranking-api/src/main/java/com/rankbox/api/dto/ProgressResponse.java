package com.rankbox.api.dto;

import com.rankbox.engine.model.ProgressStats;

/**
 * @param convergenceBlocker first early-termination criterion still unmet, null once converged
 *                           or before the first outcome
 */
public record ProgressResponse(
        ProgressStats stats,
        boolean finished,
        String progress,
        String averageConfidence,
        int estimatedMinutesLeft,
        String convergenceBlocker
) {}
