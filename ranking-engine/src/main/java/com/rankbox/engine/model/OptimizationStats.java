package com.rankbox.engine.model;

/**
 * Running totals of the consistency auditor's work within a session.
 */
public record OptimizationStats(
        int lastAuditComparison,
        int audits,
        int totalCorrections,
        int directViolationsFixed,
        int transitivityViolationsFixed,
        int normalizationFixes
) {
    public static OptimizationStats empty() {
        return new OptimizationStats(0, 0, 0, 0, 0, 0);
    }

    public OptimizationStats withoutCorrections(int comparison) {
        return new OptimizationStats(comparison, audits + 1, totalCorrections,
                directViolationsFixed, transitivityViolationsFixed, normalizationFixes);
    }

    public OptimizationStats plus(int comparison, int corrections, int direct, int transitivity, int normalization) {
        return new OptimizationStats(
                comparison,
                audits + 1,
                totalCorrections + corrections,
                directViolationsFixed + direct,
                transitivityViolationsFixed + transitivity,
                normalizationFixes + normalization
        );
    }
}
