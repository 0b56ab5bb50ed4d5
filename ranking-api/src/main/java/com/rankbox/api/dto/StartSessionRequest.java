package com.rankbox.api.dto;

import com.rankbox.engine.model.Item;

import java.util.List;

/**
 * Items to rank plus either a budget preset ({@code quick}, {@code balanced},
 * {@code thorough}) or an explicit comparison budget, which wins when both are given.
 */
public record StartSessionRequest(
        List<Item> items,
        String mode,
        Integer maxComparisons
) {}
