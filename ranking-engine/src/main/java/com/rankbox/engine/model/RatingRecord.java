package com.rankbox.engine.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Current standing of one item within a ranking session.
 *
 * Created when a session starts and mutated only by the rating updater and the consistency
 * auditor. {@link #copy()} produces an independent value copy for history snapshots.
 */
public class RatingRecord {

    public static final int RECENT_RESULTS_CAPACITY = 10;
    public static final double INITIAL_UNCERTAINTY = 1.0;
    public static final double UNCERTAINTY_FLOOR = 0.1;

    private final Item item;

    private double rating;              // log-strength used in the expected-outcome formula
    private double ratingMean;          // Bayesian shadow of rating
    private double ratingUncertainty;   // only decreases, floored at UNCERTAINTY_FLOOR

    private int wins;
    private int losses;
    private int comparisons;

    private double momentum;

    // Oldest first, never longer than RECENT_RESULTS_CAPACITY
    private List<RecentResult> recentResults = new ArrayList<>();

    private GroupSelections groupSelections = new GroupSelections();

    public RatingRecord(Item item) {
        this.item = item;
        this.ratingUncertainty = INITIAL_UNCERTAINTY;
    }

    private RatingRecord(RatingRecord other) {
        this.item = other.item;
        this.rating = other.rating;
        this.ratingMean = other.ratingMean;
        this.ratingUncertainty = other.ratingUncertainty;
        this.wins = other.wins;
        this.losses = other.losses;
        this.comparisons = other.comparisons;
        this.momentum = other.momentum;
        this.recentResults = new ArrayList<>(other.recentResults);
        this.groupSelections = other.groupSelections.copy();
    }

    // ============ HELPER METHODS ============

    public RatingRecord copy() {
        return new RatingRecord(this);
    }

    public void addRecentResult(RecentResult result) {
        recentResults.add(result);
        if (recentResults.size() > RECENT_RESULTS_CAPACITY) {
            recentResults = new ArrayList<>(
                    recentResults.subList(recentResults.size() - RECENT_RESULTS_CAPACITY, recentResults.size()));
        }
    }

    public void recordOutcome(boolean won) {
        comparisons++;
        if (won) {
            wins++;
        } else {
            losses++;
        }
    }

    /**
     * Lowers the uncertainty to {@code candidate}, never raising it and never going below the floor.
     */
    public void reduceUncertainty(double candidate) {
        double next = Math.max(UNCERTAINTY_FLOOR, candidate);
        if (next < ratingUncertainty) {
            ratingUncertainty = next;
        }
    }

    public boolean hasRecentlyFaced(String opponentId) {
        for (RecentResult r : recentResults) {
            if (r.getOpponentId().equals(opponentId)) return true;
        }
        return false;
    }

    /**
     * Fraction of consecutive recent results that flip between win and loss.
     * 1.0 (maximally uncertain) with fewer than two results.
     */
    public double getResultVolatility() {
        if (recentResults.size() < 2) return 1.0;
        int flips = 0;
        for (int i = 1; i < recentResults.size(); i++) {
            if (recentResults.get(i).getOutcome() != recentResults.get(i - 1).getOutcome()) flips++;
        }
        return (double) flips / (recentResults.size() - 1);
    }

    public double getWinRate() {
        return comparisons > 0 ? (double) wins / comparisons : 0.0;
    }

    public String getWinLossRecord() {
        return wins + "-" + losses;
    }

    // ============ GETTERS AND SETTERS ============

    public Item getItem() { return item; }

    public String getItemId() { return item.id(); }

    public double getRating() { return rating; }
    public void setRating(double rating) { this.rating = rating; }

    public double getRatingMean() { return ratingMean; }
    public void setRatingMean(double ratingMean) { this.ratingMean = ratingMean; }

    public double getRatingUncertainty() { return ratingUncertainty; }

    public int getWins() { return wins; }

    public int getLosses() { return losses; }

    public int getComparisons() { return comparisons; }

    public double getMomentum() { return momentum; }
    public void setMomentum(double momentum) { this.momentum = momentum; }

    public List<RecentResult> getRecentResults() { return Collections.unmodifiableList(recentResults); }

    public GroupSelections getGroupSelections() { return groupSelections; }
}
