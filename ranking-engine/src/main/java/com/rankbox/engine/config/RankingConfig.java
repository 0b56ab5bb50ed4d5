package com.rankbox.engine.config;

/**
 * Tunables for one ranking engine. Immutable; build with {@link #builder()}.
 *
 * By default sessions offer five-item groups until 35% progress and three-item groups until
 * 75%, then pairs. The learning rate stays in [0.01, 0.2], an audit runs every ten
 * comparisons and early termination is never considered before 40% progress.
 */
public final class RankingConfig {

    // Selection
    private final double broadGroupsUntil;
    private final double narrowGroupsUntil;
    private final double previousSelectionPenalty;
    private final double recentOpponentPenalty;
    private final int pairRecencyWindow;
    private final int veryRecentPairWindow;
    private final double ratingBucketSplit;

    // Rating update
    private final double baseLearningRate;
    private final double minLearningRate;
    private final double maxLearningRate;
    private final double momentumFactor;
    private final double violationBoost;
    private final int adaptationWindow;

    // Batching
    private final int volatilityWindow;
    private final double volatilityHigh;
    private final double volatilityLow;

    // Confidence
    private final int minComparisonsForConfidence;
    private final int optimalComparisons;
    private final int localConsistencyRange;
    private final int localTransitivityRange;

    // Audit
    private final int auditInterval;
    private final int auditMinComparisons;
    private final double maxCorrection;
    private final double incrementalAdjustment;
    private final double directCorrectionStrength;
    private final int triadSampleSize;
    private final int cycleSampleSize;
    private final int maxCycleLength;
    private final int maxCycleComponentSize;

    // Convergence
    private final double minProgressToFinish;
    private final int minComparisonsPerItem;
    private final double minConfidence;
    private final int stabilityWindow;
    private final double stabilityThreshold;
    private final double minTransitivityScore;
    private final double minRankStability;

    private final long seed;

    private RankingConfig(Builder b) {
        this.broadGroupsUntil = b.broadGroupsUntil;
        this.narrowGroupsUntil = b.narrowGroupsUntil;
        this.previousSelectionPenalty = b.previousSelectionPenalty;
        this.recentOpponentPenalty = b.recentOpponentPenalty;
        this.pairRecencyWindow = b.pairRecencyWindow;
        this.veryRecentPairWindow = b.veryRecentPairWindow;
        this.ratingBucketSplit = b.ratingBucketSplit;
        this.baseLearningRate = b.baseLearningRate;
        this.minLearningRate = b.minLearningRate;
        this.maxLearningRate = b.maxLearningRate;
        this.momentumFactor = b.momentumFactor;
        this.violationBoost = b.violationBoost;
        this.adaptationWindow = b.adaptationWindow;
        this.volatilityWindow = b.volatilityWindow;
        this.volatilityHigh = b.volatilityHigh;
        this.volatilityLow = b.volatilityLow;
        this.minComparisonsForConfidence = b.minComparisonsForConfidence;
        this.optimalComparisons = b.optimalComparisons;
        this.localConsistencyRange = b.localConsistencyRange;
        this.localTransitivityRange = b.localTransitivityRange;
        this.auditInterval = b.auditInterval;
        this.auditMinComparisons = b.auditMinComparisons;
        this.maxCorrection = b.maxCorrection;
        this.incrementalAdjustment = b.incrementalAdjustment;
        this.directCorrectionStrength = b.directCorrectionStrength;
        this.triadSampleSize = b.triadSampleSize;
        this.cycleSampleSize = b.cycleSampleSize;
        this.maxCycleLength = b.maxCycleLength;
        this.maxCycleComponentSize = b.maxCycleComponentSize;
        this.minProgressToFinish = b.minProgressToFinish;
        this.minComparisonsPerItem = b.minComparisonsPerItem;
        this.minConfidence = b.minConfidence;
        this.stabilityWindow = b.stabilityWindow;
        this.stabilityThreshold = b.stabilityThreshold;
        this.minTransitivityScore = b.minTransitivityScore;
        this.minRankStability = b.minRankStability;
        this.seed = b.seed;
    }

    public static RankingConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Number of rating changes to retain; the largest of the windows that read them.
     */
    public int recentChangesCapacity() {
        return Math.max(volatilityWindow, Math.max(stabilityWindow, adaptationWindow));
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.broadGroupsUntil = broadGroupsUntil;
        b.narrowGroupsUntil = narrowGroupsUntil;
        b.previousSelectionPenalty = previousSelectionPenalty;
        b.recentOpponentPenalty = recentOpponentPenalty;
        b.pairRecencyWindow = pairRecencyWindow;
        b.veryRecentPairWindow = veryRecentPairWindow;
        b.ratingBucketSplit = ratingBucketSplit;
        b.baseLearningRate = baseLearningRate;
        b.minLearningRate = minLearningRate;
        b.maxLearningRate = maxLearningRate;
        b.momentumFactor = momentumFactor;
        b.violationBoost = violationBoost;
        b.adaptationWindow = adaptationWindow;
        b.volatilityWindow = volatilityWindow;
        b.volatilityHigh = volatilityHigh;
        b.volatilityLow = volatilityLow;
        b.minComparisonsForConfidence = minComparisonsForConfidence;
        b.optimalComparisons = optimalComparisons;
        b.localConsistencyRange = localConsistencyRange;
        b.localTransitivityRange = localTransitivityRange;
        b.auditInterval = auditInterval;
        b.auditMinComparisons = auditMinComparisons;
        b.maxCorrection = maxCorrection;
        b.incrementalAdjustment = incrementalAdjustment;
        b.directCorrectionStrength = directCorrectionStrength;
        b.triadSampleSize = triadSampleSize;
        b.cycleSampleSize = cycleSampleSize;
        b.maxCycleLength = maxCycleLength;
        b.maxCycleComponentSize = maxCycleComponentSize;
        b.minProgressToFinish = minProgressToFinish;
        b.minComparisonsPerItem = minComparisonsPerItem;
        b.minConfidence = minConfidence;
        b.stabilityWindow = stabilityWindow;
        b.stabilityThreshold = stabilityThreshold;
        b.minTransitivityScore = minTransitivityScore;
        b.minRankStability = minRankStability;
        b.seed = seed;
        return b;
    }

    // ============ BUILDER PATTERN ============

    public static class Builder {
        private double broadGroupsUntil = 0.35;
        private double narrowGroupsUntil = 0.75;
        private double previousSelectionPenalty = 0.7;
        private double recentOpponentPenalty = 0.2;
        private int pairRecencyWindow = 50;
        private int veryRecentPairWindow = 10;
        private double ratingBucketSplit = 0.5;

        private double baseLearningRate = 0.1;
        private double minLearningRate = 0.01;
        private double maxLearningRate = 0.2;
        private double momentumFactor = 0.9;
        private double violationBoost = 1.5;
        private int adaptationWindow = 15;

        private int volatilityWindow = 20;
        private double volatilityHigh = 0.05;
        private double volatilityLow = 0.01;

        private int minComparisonsForConfidence = 3;
        private int optimalComparisons = 5;
        private int localConsistencyRange = 5;
        private int localTransitivityRange = 3;

        private int auditInterval = 10;
        private int auditMinComparisons = 5;
        private double maxCorrection = 0.5;
        private double incrementalAdjustment = 0.6;
        private double directCorrectionStrength = 0.8;
        private int triadSampleSize = 300;
        private int cycleSampleSize = 300;
        private int maxCycleLength = 5;
        private int maxCycleComponentSize = 40;

        private double minProgressToFinish = 0.4;
        private int minComparisonsPerItem = 5;
        private double minConfidence = 0.7;
        private int stabilityWindow = 15;
        private double stabilityThreshold = 0.03;
        private double minTransitivityScore = 0.85;
        private double minRankStability = 0.9;

        private long seed = 42L;

        public Builder broadGroupsUntil(double v) { this.broadGroupsUntil = v; return this; }
        public Builder narrowGroupsUntil(double v) { this.narrowGroupsUntil = v; return this; }
        public Builder previousSelectionPenalty(double v) { this.previousSelectionPenalty = v; return this; }
        public Builder recentOpponentPenalty(double v) { this.recentOpponentPenalty = v; return this; }
        public Builder pairRecencyWindow(int v) { this.pairRecencyWindow = v; return this; }
        public Builder veryRecentPairWindow(int v) { this.veryRecentPairWindow = v; return this; }
        public Builder ratingBucketSplit(double v) { this.ratingBucketSplit = v; return this; }
        public Builder baseLearningRate(double v) { this.baseLearningRate = v; return this; }
        public Builder minLearningRate(double v) { this.minLearningRate = v; return this; }
        public Builder maxLearningRate(double v) { this.maxLearningRate = v; return this; }
        public Builder momentumFactor(double v) { this.momentumFactor = v; return this; }
        public Builder violationBoost(double v) { this.violationBoost = v; return this; }
        public Builder adaptationWindow(int v) { this.adaptationWindow = v; return this; }
        public Builder volatilityWindow(int v) { this.volatilityWindow = v; return this; }
        public Builder volatilityHigh(double v) { this.volatilityHigh = v; return this; }
        public Builder volatilityLow(double v) { this.volatilityLow = v; return this; }
        public Builder minComparisonsForConfidence(int v) { this.minComparisonsForConfidence = v; return this; }
        public Builder optimalComparisons(int v) { this.optimalComparisons = v; return this; }
        public Builder localConsistencyRange(int v) { this.localConsistencyRange = v; return this; }
        public Builder localTransitivityRange(int v) { this.localTransitivityRange = v; return this; }
        public Builder auditInterval(int v) { this.auditInterval = v; return this; }
        public Builder auditMinComparisons(int v) { this.auditMinComparisons = v; return this; }
        public Builder maxCorrection(double v) { this.maxCorrection = v; return this; }
        public Builder incrementalAdjustment(double v) { this.incrementalAdjustment = v; return this; }
        public Builder directCorrectionStrength(double v) { this.directCorrectionStrength = v; return this; }
        public Builder triadSampleSize(int v) { this.triadSampleSize = v; return this; }
        public Builder cycleSampleSize(int v) { this.cycleSampleSize = v; return this; }
        public Builder maxCycleLength(int v) { this.maxCycleLength = v; return this; }
        public Builder maxCycleComponentSize(int v) { this.maxCycleComponentSize = v; return this; }
        public Builder minProgressToFinish(double v) { this.minProgressToFinish = v; return this; }
        public Builder minComparisonsPerItem(int v) { this.minComparisonsPerItem = v; return this; }
        public Builder minConfidence(double v) { this.minConfidence = v; return this; }
        public Builder stabilityWindow(int v) { this.stabilityWindow = v; return this; }
        public Builder stabilityThreshold(double v) { this.stabilityThreshold = v; return this; }
        public Builder minTransitivityScore(double v) { this.minTransitivityScore = v; return this; }
        public Builder minRankStability(double v) { this.minRankStability = v; return this; }
        public Builder seed(long v) { this.seed = v; return this; }

        public RankingConfig build() {
            if (!(broadGroupsUntil >= 0 && broadGroupsUntil <= narrowGroupsUntil && narrowGroupsUntil <= 1)) {
                throw new IllegalArgumentException("Phase boundaries must satisfy 0 <= broad <= narrow <= 1");
            }
            if (!(minLearningRate > 0 && minLearningRate <= maxLearningRate)) {
                throw new IllegalArgumentException("Learning rate bounds must satisfy 0 < min <= max");
            }
            if (auditInterval < 1) auditInterval = 1;
            if (auditMinComparisons < 0) auditMinComparisons = 0;
            if (maxCycleLength < 3) maxCycleLength = 3;
            if (maxCycleComponentSize < maxCycleLength) maxCycleComponentSize = maxCycleLength;
            if (stabilityWindow < 1) stabilityWindow = 1;
            if (volatilityWindow < 1) volatilityWindow = 1;
            if (adaptationWindow < 1) adaptationWindow = 1;
            if (volatilityHigh <= volatilityLow) {
                throw new IllegalArgumentException("volatilityHigh must exceed volatilityLow");
            }
            return new RankingConfig(this);
        }
    }

    // ============ GETTERS ============

    public double getBroadGroupsUntil() { return broadGroupsUntil; }
    public double getNarrowGroupsUntil() { return narrowGroupsUntil; }
    public double getPreviousSelectionPenalty() { return previousSelectionPenalty; }
    public double getRecentOpponentPenalty() { return recentOpponentPenalty; }
    public int getPairRecencyWindow() { return pairRecencyWindow; }
    public int getVeryRecentPairWindow() { return veryRecentPairWindow; }
    public double getRatingBucketSplit() { return ratingBucketSplit; }
    public double getBaseLearningRate() { return baseLearningRate; }
    public double getMinLearningRate() { return minLearningRate; }
    public double getMaxLearningRate() { return maxLearningRate; }
    public double getMomentumFactor() { return momentumFactor; }
    public double getViolationBoost() { return violationBoost; }
    public int getAdaptationWindow() { return adaptationWindow; }
    public int getVolatilityWindow() { return volatilityWindow; }
    public double getVolatilityHigh() { return volatilityHigh; }
    public double getVolatilityLow() { return volatilityLow; }
    public int getMinComparisonsForConfidence() { return minComparisonsForConfidence; }
    public int getOptimalComparisons() { return optimalComparisons; }
    public int getLocalConsistencyRange() { return localConsistencyRange; }
    public int getLocalTransitivityRange() { return localTransitivityRange; }
    public int getAuditInterval() { return auditInterval; }
    public int getAuditMinComparisons() { return auditMinComparisons; }
    public double getMaxCorrection() { return maxCorrection; }
    public double getIncrementalAdjustment() { return incrementalAdjustment; }
    public double getDirectCorrectionStrength() { return directCorrectionStrength; }
    public int getTriadSampleSize() { return triadSampleSize; }
    public int getCycleSampleSize() { return cycleSampleSize; }
    public int getMaxCycleLength() { return maxCycleLength; }
    public int getMaxCycleComponentSize() { return maxCycleComponentSize; }
    public double getMinProgressToFinish() { return minProgressToFinish; }
    public int getMinComparisonsPerItem() { return minComparisonsPerItem; }
    public double getMinConfidence() { return minConfidence; }
    public int getStabilityWindow() { return stabilityWindow; }
    public double getStabilityThreshold() { return stabilityThreshold; }
    public double getMinTransitivityScore() { return minTransitivityScore; }
    public double getMinRankStability() { return minRankStability; }
    public long getSeed() { return seed; }
}
