package com.rankbox.engine.selection;

import com.rankbox.engine.config.RankingConfig;
import com.rankbox.engine.exception.SelectionFailureException;
import com.rankbox.engine.model.RatingRecord;
import com.rankbox.engine.model.RecentResult;
import com.rankbox.engine.store.RatingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Picks the next pair or group to present.
 *
 * <p>Pairs are anchored on the least-compared item and completed by the candidate with the
 * highest information value, discounted for pairs that were shown recently. Groups are the
 * best of three candidate groups built by different heuristics, scored by
 * {@link #groupValue}.</p>
 *
 * <p>Items shown in the current cycle are kept out of later selections until too few remain,
 * at which point the pool resets. The memory of the previous selection and of presented pairs
 * survives a reset.</p>
 */
public class ComparisonSelector {

    private static final Logger log = LoggerFactory.getLogger(ComparisonSelector.class);

    private static final double CLOSENESS_EPSILON = 0.1;
    private static final int VERY_RECENT_MIN_POOL = 10;

    private final RankingConfig config;
    private final Random random;

    private final Set<String> used = new LinkedHashSet<>();
    private final Map<List<String>, Integer> pairLastPresented = new HashMap<>();
    private Set<String> previousSelection = Set.of();
    private boolean firstSelection = true;
    private int poolResets;

    public ComparisonSelector(RankingConfig config, Random random) {
        this.config = config;
        this.random = random;
    }

    /**
     * Selects up to {@code groupSize} items, never fewer than two.
     *
     * @param comparisons resolved comparisons so far, used to age presented pairs
     * @throws SelectionFailureException when the store holds fewer than two items
     */
    public List<RatingRecord> select(RatingStore store, ToDoubleFunction<String> confidence,
                                     int groupSize, int comparisons) {
        if (store.size() < 2) {
            throw SelectionFailureException.notEnoughItems(store.size());
        }
        int size = Math.max(2, Math.min(groupSize, store.size()));

        List<RatingRecord> available = new ArrayList<>();
        for (RatingRecord record : store.records()) {
            if (!used.contains(record.getItemId())) {
                available.add(record);
            }
        }
        if (available.size() < size) {
            log.debug("Resetting used pool ({} available, {} needed)", available.size(), size);
            used.clear();
            available = new ArrayList<>(store.records());
            poolResets++;
        }

        if (firstSelection) {
            Collections.shuffle(available, random);
            firstSelection = false;
        }

        List<RatingRecord> selected = size == 2
                ? selectPair(available, confidence, comparisons)
                : selectGroup(available, confidence, size);

        Set<String> ids = new LinkedHashSet<>();
        selected.forEach(r -> ids.add(r.getItemId()));
        used.addAll(ids);
        previousSelection = ids;
        if (selected.size() == 2) {
            pairLastPresented.put(pairKey(selected.get(0).getItemId(), selected.get(1).getItemId()), comparisons);
        }
        return selected;
    }

    // ============ PAIRS ============

    private List<RatingRecord> selectPair(List<RatingRecord> available, ToDoubleFunction<String> confidence, int comparisons) {
        List<RatingRecord> byComparisons = new ArrayList<>(available);
        byComparisons.sort(Comparator.comparingInt(RatingRecord::getComparisons));

        RatingRecord anchor = byComparisons.get(0);
        RatingRecord partner = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (RatingRecord candidate : byComparisons.subList(1, byComparisons.size())) {
            double score = value(candidate, confidence)
                    * recencyMultiplier(anchor, candidate, comparisons)
                    * (facedRecently(anchor, candidate) ? config.getRecentOpponentPenalty() : 1.0);
            if (score > bestScore) {
                bestScore = score;
                partner = candidate;
            }
        }
        if (partner == null) {
            partner = byComparisons.get(1);
        }

        if (isVeryRecent(anchor, partner, comparisons)
                && available.size() > VERY_RECENT_MIN_POOL
                && byComparisons.size() > 2) {
            RatingRecord alternateAnchor = byComparisons.get(1);
            RatingRecord alternatePartner = null;
            double alternateBest = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < byComparisons.size(); i++) {
                if (i == 1) continue;
                RatingRecord candidate = byComparisons.get(i);
                if (isVeryRecent(alternateAnchor, candidate, comparisons)) continue;
                double score = value(candidate, confidence);
                if (score > alternateBest) {
                    alternateBest = score;
                    alternatePartner = candidate;
                }
            }
            if (alternatePartner != null) {
                log.debug("Avoiding very recent pair {} / {}", anchor.getItemId(), partner.getItemId());
                return List.of(alternateAnchor, alternatePartner);
            }
        }
        return List.of(anchor, partner);
    }

    /**
     * 0.1 for a pair presented at this very comparison, rising linearly to 1.0 once the pair
     * is a full recency window old. Pairs never presented are not discounted.
     */
    double recencyMultiplier(RatingRecord a, RatingRecord b, int comparisons) {
        Integer last = pairLastPresented.get(pairKey(a.getItemId(), b.getItemId()));
        if (last == null) return 1.0;
        double age = comparisons - last;
        return 0.1 + 0.9 * Math.min(1.0, age / config.getPairRecencyWindow());
    }

    private boolean isVeryRecent(RatingRecord a, RatingRecord b, int comparisons) {
        Integer last = pairLastPresented.get(pairKey(a.getItemId(), b.getItemId()));
        return last != null && comparisons - last < config.getVeryRecentPairWindow();
    }

    private static boolean facedRecently(RatingRecord a, RatingRecord b) {
        return a.hasRecentlyFaced(b.getItemId()) || b.hasRecentlyFaced(a.getItemId());
    }

    // ============ GROUPS ============

    private List<RatingRecord> selectGroup(List<RatingRecord> available, ToDoubleFunction<String> confidence, int size) {
        List<List<RatingRecord>> candidates = List.of(
                uncertaintySpreadGroup(available, size),
                leastComparedGroup(available, size),
                similarRatingGroup(available, size)
        );

        List<RatingRecord> best = null;
        double bestValue = Double.NEGATIVE_INFINITY;
        for (List<RatingRecord> group : candidates) {
            double groupValue = groupValue(group, confidence);
            if (groupValue > bestValue) {
                bestValue = groupValue;
                best = group;
            }
        }

        List<RatingRecord> selected = new ArrayList<>(best);
        if (selected.size() < size) {
            Set<String> taken = idsOf(selected);
            for (RatingRecord record : available) {
                if (selected.size() >= size) break;
                if (taken.add(record.getItemId())) {
                    selected.add(record);
                }
            }
        }
        return selected;
    }

    /**
     * Most volatile item plus one item from each rating bucket, topped up by volatility.
     */
    List<RatingRecord> uncertaintySpreadGroup(List<RatingRecord> available, int size) {
        List<RatingRecord> byVolatility = new ArrayList<>(available);
        byVolatility.sort(Comparator.comparingDouble(RatingRecord::getResultVolatility).reversed());

        RatingRecord anchor = byVolatility.get(0);
        Set<String> recent = recentOpponents(anchor);

        List<RatingRecord> ordered = new ArrayList<>();
        ordered.add(anchor);
        for (RatingRecord record : byVolatility) {
            if (record != anchor && !recent.contains(record.getItemId())) {
                ordered.add(record);
            }
        }

        double split = config.getRatingBucketSplit();
        RatingRecord low = null;
        RatingRecord mid = null;
        RatingRecord high = null;
        for (RatingRecord record : ordered.subList(1, ordered.size())) {
            double rating = record.getRating();
            if (rating < -split) {
                if (low == null) low = record;
            } else if (rating > split) {
                if (high == null) high = record;
            } else if (mid == null) {
                mid = record;
            }
        }

        List<RatingRecord> group = new ArrayList<>();
        group.add(anchor);
        for (RatingRecord pick : new RatingRecord[]{low, mid, high}) {
            if (pick != null && group.size() < size) group.add(pick);
        }
        Set<String> taken = idsOf(group);
        for (RatingRecord record : ordered) {
            if (group.size() >= size) break;
            if (taken.add(record.getItemId())) group.add(record);
        }
        return group;
    }

    /**
     * Least-compared item plus the next least-compared items it has not faced recently.
     */
    List<RatingRecord> leastComparedGroup(List<RatingRecord> available, int size) {
        List<RatingRecord> byComparisons = new ArrayList<>(available);
        byComparisons.sort(Comparator.comparingInt(RatingRecord::getComparisons));

        RatingRecord first = byComparisons.get(0);
        Set<String> recent = recentOpponents(first);
        List<RatingRecord> rest = byComparisons.subList(1, byComparisons.size());
        List<RatingRecord> fresh = rest.stream().filter(r -> !recent.contains(r.getItemId())).toList();
        List<RatingRecord> pool = fresh.isEmpty() ? rest : fresh;

        List<RatingRecord> group = new ArrayList<>();
        group.add(first);
        group.addAll(pool.subList(0, Math.min(size - 1, pool.size())));
        return group;
    }

    /**
     * Random anchor plus its nearest neighbours by rating, recent opponents last.
     */
    List<RatingRecord> similarRatingGroup(List<RatingRecord> available, int size) {
        RatingRecord anchor = available.get(random.nextInt(available.size()));
        Set<String> recent = recentOpponents(anchor);
        double anchorRating = anchor.getRating();

        List<RatingRecord> others = new ArrayList<>();
        for (RatingRecord record : available) {
            if (record != anchor) others.add(record);
        }
        others.sort(Comparator
                .comparingInt((RatingRecord r) -> recent.contains(r.getItemId()) ? 1 : 0)
                .thenComparingDouble(r -> Math.abs(r.getRating() - anchorRating)));

        List<RatingRecord> group = new ArrayList<>();
        group.add(anchor);
        group.addAll(others.subList(0, Math.min(size - 1, others.size())));
        return group;
    }

    // ============ VALUE FUNCTIONS ============

    /**
     * Expected information from showing this item: high for uncertain, volatile, rarely
     * compared items; discounted when the item was in the previous selection.
     */
    double value(RatingRecord record, ToDoubleFunction<String> confidence) {
        double value = (1 - confidence.applyAsDouble(record.getItemId()))
                * (1 + record.getResultVolatility())
                / (record.getComparisons() + 1);
        if (previousSelection.contains(record.getItemId())) {
            value *= config.getPreviousSelectionPenalty();
        }
        return value;
    }

    double groupValue(List<RatingRecord> group, ToDoubleFunction<String> confidence) {
        double total = 0;
        for (RatingRecord record : group) {
            total += value(record, confidence);
        }
        for (int i = 0; i < group.size() - 1; i++) {
            for (int j = i + 1; j < group.size(); j++) {
                total += 1.0 / (Math.abs(group.get(i).getRating() - group.get(j).getRating()) + CLOSENESS_EPSILON);
            }
        }
        return total;
    }

    // ============ HELPERS ============

    private static Set<String> recentOpponents(RatingRecord record) {
        Set<String> opponents = new HashSet<>();
        for (RecentResult result : record.getRecentResults()) {
            opponents.add(result.getOpponentId());
        }
        return opponents;
    }

    private static Set<String> idsOf(List<RatingRecord> records) {
        Set<String> ids = new HashSet<>();
        records.forEach(r -> ids.add(r.getItemId()));
        return ids;
    }

    static List<String> pairKey(String a, String b) {
        return a.compareTo(b) <= 0 ? List.of(a, b) : List.of(b, a);
    }

    public int getPoolResets() { return poolResets; }

    public int getUsedCount() { return used.size(); }

    public Set<String> getPreviousSelection() { return Collections.unmodifiableSet(previousSelection); }
}
