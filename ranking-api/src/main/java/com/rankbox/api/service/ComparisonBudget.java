package com.rankbox.api.service;

import com.rankbox.api.dto.ModeOption;

import java.util.Locale;

/**
 * Budget presets offered before a session starts. Budgets grow with n·log2(n) and are
 * bounded below so tiny lists still get a meaningful number of comparisons.
 */
public enum ComparisonBudget {

    QUICK("Quick Mode", "Get a rough ranking quickly. Best for casual sorting or when time is limited.") {
        @Override
        public int comparisonsFor(int itemCount) {
            return Math.max((int) Math.ceil(itemCount * 1.5), 20);
        }
    },
    BALANCED("Balanced Mode", "A good balance between accuracy and time investment. Recommended for most lists.") {
        @Override
        public int comparisonsFor(int itemCount) {
            return Math.min(Math.max(3 * itemCount + extra(itemCount), 30), 1500);
        }
    },
    THOROUGH("Thorough Mode", "Maximum accuracy with more comparisons. Ideal for definitive rankings.") {
        @Override
        public int comparisonsFor(int itemCount) {
            return Math.min(Math.max(5 * itemCount + extra(itemCount), 40), 2000);
        }
    };

    private static final double MINUTES_PER_COMPARISON = 0.1;

    private final String title;
    private final String description;

    ComparisonBudget(String title, String description) {
        this.title = title;
        this.description = description;
    }

    public abstract int comparisonsFor(int itemCount);

    public static int estimatedMinutes(int comparisons) {
        return (int) Math.ceil(comparisons * MINUTES_PER_COMPARISON);
    }

    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    public ModeOption toOption(int itemCount) {
        int comparisons = comparisonsFor(itemCount);
        return new ModeOption(getId(), title, description, comparisons, estimatedMinutes(comparisons));
    }

    /**
     * @throws IllegalArgumentException for an unknown mode id
     */
    public static ComparisonBudget fromId(String id) {
        if (id != null) {
            for (ComparisonBudget budget : values()) {
                if (budget.getId().equalsIgnoreCase(id.trim())) {
                    return budget;
                }
            }
        }
        throw new IllegalArgumentException("Unknown ranking mode: " + id);
    }

    private static int extra(int itemCount) {
        if (itemCount < 2) return 0;
        return (int) Math.ceil(itemCount * (Math.log(itemCount) / Math.log(2)));
    }
}
