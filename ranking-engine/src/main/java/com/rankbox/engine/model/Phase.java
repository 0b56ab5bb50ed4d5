package com.rankbox.engine.model;

/**
 * Selection phase derived from session progress. Early phases offer larger groups for broad
 * coverage, the last phase resolves single pairs.
 */
public enum Phase {
    BROAD_GROUPS(5),
    NARROW_GROUPS(3),
    PAIRS(2);

    private final int groupSize;

    Phase(int groupSize) {
        this.groupSize = groupSize;
    }

    public int getGroupSize() {
        return groupSize;
    }

    public boolean isPair() {
        return this == PAIRS;
    }

    public static Phase forProgress(double progress, double broadUntil, double narrowUntil) {
        if (progress < broadUntil) return BROAD_GROUPS;
        if (progress < narrowUntil) return NARROW_GROUPS;
        return PAIRS;
    }
}
