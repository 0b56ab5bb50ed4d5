package com.rankbox.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine tuning exposed through {@code rankbox.ranking.*}. Anything not listed here keeps the
 * engine default.
 */
@ConfigurationProperties(prefix = "rankbox.ranking")
public class RankingProperties {

    private long seed = 42;
    private String defaultMode = "balanced";
    private double baseLearningRate = 0.1;
    private double momentumFactor = 0.9;
    private int auditInterval = 10;
    private double minProgressToFinish = 0.4;
    private int minComparisonsPerItem = 5;
    private double minConfidence = 0.7;

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    public String getDefaultMode() {
        return defaultMode;
    }

    public void setDefaultMode(String defaultMode) {
        this.defaultMode = defaultMode;
    }

    public double getBaseLearningRate() {
        return baseLearningRate;
    }

    public void setBaseLearningRate(double baseLearningRate) {
        this.baseLearningRate = baseLearningRate;
    }

    public double getMomentumFactor() {
        return momentumFactor;
    }

    public void setMomentumFactor(double momentumFactor) {
        this.momentumFactor = momentumFactor;
    }

    public int getAuditInterval() {
        return auditInterval;
    }

    public void setAuditInterval(int auditInterval) {
        this.auditInterval = auditInterval;
    }

    public double getMinProgressToFinish() {
        return minProgressToFinish;
    }

    public void setMinProgressToFinish(double minProgressToFinish) {
        this.minProgressToFinish = minProgressToFinish;
    }

    public int getMinComparisonsPerItem() {
        return minComparisonsPerItem;
    }

    public void setMinComparisonsPerItem(int minComparisonsPerItem) {
        this.minComparisonsPerItem = minComparisonsPerItem;
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(double minConfidence) {
        this.minConfidence = minConfidence;
    }
}
