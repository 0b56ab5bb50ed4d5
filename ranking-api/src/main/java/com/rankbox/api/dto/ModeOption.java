package com.rankbox.api.dto;

public record ModeOption(
        String id,
        String title,
        String description,
        int comparisons,
        int estimatedMinutes
) {}
