package com.rankbox.api.dto;

import com.rankbox.engine.model.Item;
import com.rankbox.engine.model.Phase;

import java.util.List;

public record SelectionResponse(
        List<Item> items,
        Phase phase,
        boolean highImpact,
        boolean finished,
        int comparisons,
        int maxComparisons
) {}
