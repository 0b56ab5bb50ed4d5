package com.rankbox.engine.model;

/**
 * A single entry in an item's recent-results ring buffer.
 * Immutable, so ring buffers can be copied by reference.
 */
public final class RecentResult {

    private final String opponentId;
    private final int outcome;              // 1 = won, 0 = lost
    private final double ratingDiffAtTime;  // |own rating - opponent rating| before the update
    private final double learningRateUsed;

    private RecentResult(Builder builder) {
        this.opponentId = builder.opponentId;
        this.outcome = builder.outcome;
        this.ratingDiffAtTime = builder.ratingDiffAtTime;
        this.learningRateUsed = builder.learningRateUsed;
    }

    // ============ BUILDER PATTERN ============

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String opponentId;
        private int outcome;
        private double ratingDiffAtTime;
        private double learningRateUsed;

        public Builder opponentId(String opponentId) { this.opponentId = opponentId; return this; }
        public Builder won(boolean won) { this.outcome = won ? 1 : 0; return this; }
        public Builder ratingDiffAtTime(double diff) { this.ratingDiffAtTime = diff; return this; }
        public Builder learningRateUsed(double rate) { this.learningRateUsed = rate; return this; }

        public RecentResult build() { return new RecentResult(this); }
    }

    // ============ HELPER METHODS ============

    public boolean isWon() {
        return outcome == 1;
    }

    public String getResult() {
        return isWon() ? "W" : "L";
    }

    // ============ GETTERS ============

    public String getOpponentId() { return opponentId; }

    public int getOutcome() { return outcome; }

    public double getRatingDiffAtTime() { return ratingDiffAtTime; }

    public double getLearningRateUsed() { return learningRateUsed; }

    @Override
    public String toString() {
        return getResult() + " vs " + opponentId;
    }
}
