package com.rankbox.engine;

import com.rankbox.engine.audit.AuditReport;
import com.rankbox.engine.audit.ConsistencyAuditor;
import com.rankbox.engine.confidence.ConfidenceBreakdown;
import com.rankbox.engine.confidence.ConfidenceEstimator;
import com.rankbox.engine.confidence.ConfidenceTracker;
import com.rankbox.engine.config.RankingConfig;
import com.rankbox.engine.convergence.ConvergenceMonitor;
import com.rankbox.engine.convergence.ConvergenceReport;
import com.rankbox.engine.exception.MissingRecordException;
import com.rankbox.engine.exception.SelectionFailureException;
import com.rankbox.engine.exception.SessionStateException;
import com.rankbox.engine.model.ComparisonEvent;
import com.rankbox.engine.model.EngineState;
import com.rankbox.engine.model.Item;
import com.rankbox.engine.model.OptimizationStats;
import com.rankbox.engine.model.Phase;
import com.rankbox.engine.model.ProgressStats;
import com.rankbox.engine.model.RankedResult;
import com.rankbox.engine.model.RatingRecord;
import com.rankbox.engine.model.Selection;
import com.rankbox.engine.selection.ComparisonSelector;
import com.rankbox.engine.selection.ImpactEstimator;
import com.rankbox.engine.store.ComparisonHistory;
import com.rankbox.engine.store.HistoryEntry;
import com.rankbox.engine.store.RatingStore;
import com.rankbox.engine.update.BatchResult;
import com.rankbox.engine.update.RatingChangeWindow;
import com.rankbox.engine.update.RatingUpdater;
import com.rankbox.engine.update.UpdateBatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Adaptive pairwise ranking engine: one session at a time, one writer at a time.
 *
 * <p>Typical loop: {@link #start}, then {@link #getCurrentSelection} and {@link #resolve}
 * (or {@link #resolveGroup}) until {@link #isFinished}, then {@link #getRankedResults}.
 * Outcomes are counted immediately and their rating updates applied in batches; a
 * consistency audit runs every few comparisons and the convergence check after every one.</p>
 *
 * <p>All mutators are synchronized. Reads return values, never live records.</p>
 */
public class RankingEngine {

    private static final Logger log = LoggerFactory.getLogger(RankingEngine.class);

    private final RankingConfig config;

    // ============ SESSION STATE ============
    private RatingStore store;
    private ComparisonHistory<EngineSnapshot> history;
    private ConfidenceTracker confidence;
    private ComparisonSelector selector;
    private UpdateBatcher batcher;
    private RatingUpdater updater;
    private ConsistencyAuditor auditor;
    private ConvergenceMonitor convergence;
    private RatingChangeWindow changes;

    private int maxComparisons;
    private int comparisons;
    private int nextDecisionId;
    private double currentLearningRate;
    private OptimizationStats optimizationStats = OptimizationStats.empty();
    private ConvergenceReport lastConvergence;
    private OpenDecision openDecision;
    private Selection currentSelection;
    private EngineState state = EngineState.IDLE;

    public RankingEngine() {
        this(RankingConfig.defaults());
    }

    public RankingEngine(RankingConfig config) {
        this.config = config;
    }

    // ============ SESSION LIFECYCLE ============

    /**
     * Starts a new session, discarding any previous one.
     *
     * @throws SelectionFailureException when fewer than two items are supplied
     * @throws IllegalArgumentException  for a non-positive budget or duplicate item ids
     */
    public synchronized void start(List<Item> items, int maxComparisons) {
        if (items == null || items.size() < 2) {
            throw SelectionFailureException.notEnoughItems(items == null ? 0 : items.size());
        }
        if (maxComparisons < 1) {
            throw new IllegalArgumentException("maxComparisons must be positive, got " + maxComparisons);
        }

        Random random = new Random(config.getSeed());
        this.store = new RatingStore(items);
        this.history = new ComparisonHistory<>();
        this.confidence = new ConfidenceTracker(new ConfidenceEstimator(config), store);
        this.selector = new ComparisonSelector(config, random);
        this.batcher = new UpdateBatcher(config);
        this.updater = new RatingUpdater(config);
        this.auditor = new ConsistencyAuditor(config, random);
        this.convergence = new ConvergenceMonitor(config);
        this.changes = new RatingChangeWindow(config.recentChangesCapacity());

        this.maxComparisons = maxComparisons;
        this.comparisons = 0;
        this.nextDecisionId = 0;
        this.currentLearningRate = config.getBaseLearningRate();
        this.optimizationStats = OptimizationStats.empty();
        this.lastConvergence = null;
        this.openDecision = null;
        this.currentSelection = null;
        this.state = EngineState.SELECTING;

        log.info("Started ranking session: {} items, budget {} comparisons", items.size(), maxComparisons);
    }

    /**
     * Applies any pending outcomes and ends the session.
     *
     * @return the final standings
     */
    public synchronized List<RankedResult> finish() {
        requireStarted();
        flush();
        currentSelection = null;
        if (state != EngineState.CONVERGED) {
            state = EngineState.FINISHED;
        }
        log.info("Ranking session finished after {} comparisons", comparisons);
        return getRankedResults();
    }

    /**
     * True once the budget is spent, the ranking converged or the caller finished it.
     */
    public synchronized boolean isFinished() {
        return store != null && (state.isTerminal() || comparisons >= maxComparisons);
    }

    // ============ SELECTION ============

    /**
     * Items to present next: a pair, or a group of three to five early in a session.
     * The same selection is returned until it has been resolved. Empty once the session is
     * finished.
     */
    public synchronized List<Item> getCurrentSelection() {
        Selection selection = currentSelectionDetail();
        return selection == null ? List.of() : selection.items();
    }

    /**
     * Like {@link #getCurrentSelection} with the phase and impact flag; null once finished.
     */
    public synchronized Selection currentSelectionDetail() {
        requireStarted();
        if (isFinished()) return null;
        if (currentSelection != null) return currentSelection;

        state = EngineState.SELECTING;
        Phase phase = currentPhase();
        int size = Math.min(phase.getGroupSize(), store.size());
        List<RatingRecord> records = selector.select(store, confidence::confidence, size, comparisons);

        boolean highImpact = records.size() == 2
                && ImpactEstimator.isHighImpact(records.get(0), records.get(1), progress());
        currentSelection = new Selection(records.stream().map(RatingRecord::getItem).toList(),
                phase, comparisons, highImpact);
        state = EngineState.AWAITING_OUTCOME;

        log.debug("Presenting {} (phase {}, high impact {})", currentSelection.itemIds(), phase, highImpact);
        return currentSelection;
    }

    // ============ OUTCOMES ============

    /**
     * Records one pairwise outcome.
     *
     * @param groupMembers the pair or group the choice was made from; null or two members for a
     *                     pair. For a group, call once per loser or use {@link #resolveGroup}.
     * @throws MissingRecordException   when an id is not part of the session
     * @throws SessionStateException    when no session is running or it has finished
     * @throws IllegalArgumentException when winner and loser are equal or not in the group
     */
    public synchronized void resolve(String winnerId, String loserId, List<String> groupMembers) {
        requireActive();
        List<String> members = groupMembers == null || groupMembers.isEmpty()
                ? List.of(winnerId, loserId)
                : List.copyOf(groupMembers);
        validateOutcome(winnerId, loserId, members);

        applyOutcome(winnerId, loserId, members);
        afterOutcome();
    }

    /**
     * Records a choice from a group: the winner beats every other member. Losers of an earlier
     * partial resolution of the same choice are not counted twice.
     */
    public synchronized void resolveGroup(String winnerId, List<String> groupMembers) {
        requireActive();
        if (groupMembers == null || groupMembers.size() < 2) {
            throw new IllegalArgumentException("A group choice needs at least two members");
        }
        List<String> members = List.copyOf(groupMembers);
        if (Set.copyOf(members).size() != members.size()) {
            throw new IllegalArgumentException("Group members must be distinct");
        }
        for (String member : members) {
            store.require(member);
        }
        if (!members.contains(winnerId)) {
            throw new IllegalArgumentException("Winner " + winnerId + " is not in the group");
        }

        for (String loserId : members) {
            if (loserId.equals(winnerId)) continue;
            if (openDecision != null && openDecision.presents(members)
                    && openDecision.winnerId().equals(winnerId) && openDecision.isResolved(loserId)) {
                continue;
            }
            if (isFinished()) break;
            applyOutcome(winnerId, loserId, members);
            afterOutcome();
        }
    }

    private void validateOutcome(String winnerId, String loserId, List<String> members) {
        store.require(winnerId);
        store.require(loserId);
        if (winnerId.equals(loserId)) {
            throw new IllegalArgumentException("An item cannot beat itself: " + winnerId);
        }
        if (!members.contains(winnerId) || !members.contains(loserId)) {
            throw new IllegalArgumentException("Winner and loser must both be group members");
        }
        for (String member : members) {
            store.require(member);
        }
    }

    private void applyOutcome(String winnerId, String loserId, List<String> members) {
        EngineSnapshot snapshot = captureSnapshot();

        int decisionId;
        List<String> credited = new ArrayList<>();
        if (members.size() > 2) {
            if (openDecision != null && openDecision.presents(members)) {
                // group still presented: count it once, only the pick may move
                String previousWinner = openDecision.winnerId();
                if (!previousWinner.equals(winnerId)) {
                    store.require(previousWinner).getGroupSelections().changeChoice(false);
                    store.require(winnerId).getGroupSelections().changeChoice(true);
                    credited.add(previousWinner);
                    openDecision = openDecision.withWinner(winnerId);
                }
            } else {
                openDecision = new OpenDecision(nextDecisionId++, winnerId, members);
                for (String member : members) {
                    store.require(member).getGroupSelections().recordAppearance(member.equals(winnerId));
                    credited.add(member);
                }
            }
            openDecision.markResolved(loserId);
            decisionId = openDecision.decisionId();
        } else {
            openDecision = null;
            decisionId = nextDecisionId++;
        }

        RatingRecord winner = store.require(winnerId);
        RatingRecord loser = store.require(loserId);
        boolean highImpact = ImpactEstimator.isHighImpact(winner, loser, progress());
        ComparisonEvent event = new ComparisonEvent(winnerId, loserId, members, comparisons, highImpact);

        history.push(new HistoryEntry<>(event, decisionId, presentedItems(members), snapshot));

        winner.recordOutcome(true);
        loser.recordOutcome(false);
        comparisons++;

        batcher.enqueue(event, (winner.getRatingUncertainty() + loser.getRatingUncertainty()) / 2);

        credited.add(winnerId);
        credited.add(loserId);
        confidence.invalidate(credited);

        boolean decisionOpen = openDecision != null && !openDecision.isComplete();
        if (!decisionOpen) {
            openDecision = null;
            currentSelection = null;
        }
        state = EngineState.BATCHING;

        log.debug("Resolved {} (comparison {}/{}, {} pending)", event.label(), comparisons, maxComparisons, batcher.size());
    }

    private void afterOutcome() {
        boolean budgetSpent = comparisons >= maxComparisons;
        int target = batcher.targetSize(store.size(), progress(), confidence.averageConfidence(), changes);
        if (batcher.size() >= target || budgetSpent) {
            flush();
        }

        if (auditor.isDue(comparisons, optimizationStats.lastAuditComparison())) {
            runAudit();
        }

        lastConvergence = evaluateConvergence();
        if (lastConvergence.converged()) {
            flush();
            state = EngineState.CONVERGED;
            currentSelection = null;
        } else if (budgetSpent) {
            state = EngineState.FINISHED;
            currentSelection = null;
            log.info("Comparison budget of {} reached", maxComparisons);
        } else {
            state = currentSelection != null ? EngineState.AWAITING_OUTCOME : EngineState.SELECTING;
        }
    }

    // ============ UNDO ============

    /**
     * Rolls back the latest pairwise outcome.
     *
     * @return the pair or group that outcome was chosen from, presented again; null when there
     * is nothing to undo
     */
    public synchronized List<Item> undo() {
        requireStarted();
        HistoryEntry<EngineSnapshot> entry = history.pop();
        if (entry == null) return null;
        restore(entry);
        return entry.presented();
    }

    /**
     * Rolls back every pairwise outcome of the latest choice, so a pick from a group of five is
     * undone as a whole.
     */
    public synchronized List<Item> undoLastDecision() {
        requireStarted();
        HistoryEntry<EngineSnapshot> entry = history.pop();
        if (entry == null) return null;
        while (history.peek() != null && history.peek().decisionId() == entry.decisionId()) {
            entry = history.pop();
        }
        restore(entry);
        return entry.presented();
    }

    private void restore(HistoryEntry<EngineSnapshot> entry) {
        EngineSnapshot snapshot = entry.snapshot();
        store.replaceWith(snapshot.store());
        batcher.restore(snapshot.pending());
        changes.restore(snapshot.changes());
        optimizationStats = snapshot.optimizationStats();
        currentLearningRate = snapshot.learningRate();
        openDecision = snapshot.openDecision() == null ? null : snapshot.openDecision().copy();
        comparisons = snapshot.comparisons();
        lastConvergence = null;
        confidence.invalidateAll();

        ComparisonEvent event = entry.event();
        currentSelection = new Selection(entry.presented(), currentPhase(), comparisons, event.highImpact());
        state = EngineState.AWAITING_OUTCOME;

        log.debug("Undid {} (back to {} comparisons)", event.label(), comparisons);
    }

    private EngineSnapshot captureSnapshot() {
        return new EngineSnapshot(
                store.copy(),
                batcher.snapshot(),
                changes.copy(),
                optimizationStats,
                currentLearningRate,
                openDecision == null ? null : openDecision.copy(),
                comparisons
        );
    }

    private List<Item> presentedItems(List<String> members) {
        if (currentSelection != null && Set.copyOf(currentSelection.itemIds()).equals(Set.copyOf(members))) {
            return currentSelection.items();
        }
        return members.stream().map(id -> store.require(id).getItem()).toList();
    }

    // ============ BATCHING AND AUDITING ============

    private void flush() {
        if (batcher.isEmpty()) return;
        List<ComparisonEvent> batch = batcher.drain();
        RatingStore working = store.copy();
        BatchResult result = updater.applyBatch(working, batch, progress(), confidence::confidence, changes);
        store.replaceWith(working);
        confidence.invalidate(result.touchedIds());
        if (result.appliedPairs() > 0) {
            currentLearningRate = result.lastLearningRate();
        }
        log.debug("Applied batch of {} outcomes ({} distinct pairs, {} skipped)",
                result.appliedEvents(), result.appliedPairs(), result.skippedEvents());
    }

    private void runAudit() {
        flush();
        EngineState previous = state;
        state = EngineState.AUDITING;
        RatingStore working = store.copy();
        AuditReport report = auditor.audit(working, history.graph());
        state = previous;
        if (report.skipped()) return;

        if (report.committed()) {
            store.replaceWith(working);
            confidence.invalidate(report.changedIds());
            optimizationStats = optimizationStats.plus(comparisons, report.corrections(),
                    report.directViolationsFixed(), report.transitivityViolationsFixed(), report.normalizationFixes());
        } else {
            optimizationStats = optimizationStats.withoutCorrections(comparisons);
        }
    }

    private ConvergenceReport evaluateConvergence() {
        return convergence.evaluate(store, comparisons, maxComparisons, confidence::averageConfidence,
                changes, history.graph(), orderStabilityWindowAgo());
    }

    private List<String> orderStabilityWindowAgo() {
        HistoryEntry<EngineSnapshot> back = history.entryBack(config.getStabilityWindow());
        if (back == null) return null;
        return back.snapshot().store().sortedByRating().stream().map(RatingRecord::getItemId).toList();
    }

    // ============ READS ============

    /**
     * Confidence in [0.2, 1] for one item. Repeated calls without an intervening mutation
     * return the same value.
     */
    public synchronized double getConfidence(String itemId) {
        requireStarted();
        store.require(itemId);
        return confidence.confidence(itemId);
    }

    public synchronized ConfidenceBreakdown getConfidenceBreakdown(String itemId) {
        requireStarted();
        store.require(itemId);
        return confidence.breakdown(itemId);
    }

    /**
     * Current standings, best first. Outcomes still waiting for a batch are counted in the
     * win/loss columns but not yet in the ratings.
     */
    public synchronized List<RankedResult> getRankedResults() {
        requireStarted();
        List<RatingRecord> ordered = store.sortedByRating();
        List<RankedResult> results = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            RatingRecord r = ordered.get(i);
            results.add(new RankedResult(
                    i + 1,
                    r.getItem(),
                    r.getRating(),
                    r.getWins(),
                    r.getLosses(),
                    r.getComparisons(),
                    List.copyOf(r.getRecentResults()),
                    confidence.confidence(r.getItemId()),
                    r.getRatingUncertainty(),
                    r.getGroupSelections().copy()
            ));
        }
        return results;
    }

    public synchronized ProgressStats getProgressStats() {
        requireStarted();
        List<String> current = store.sortedByRating().stream().map(RatingRecord::getItemId).toList();
        double stability = convergence.rankStability(current, orderStabilityWindowAgo());
        return new ProgressStats(
                comparisons,
                maxComparisons,
                confidence.averageConfidence(),
                stability,
                currentLearningRate,
                batcher.size(),
                currentPhase(),
                state,
                optimizationStats
        );
    }

    public synchronized ConvergenceReport getLastConvergenceReport() {
        return lastConvergence;
    }

    public synchronized EngineState getState() {
        return state;
    }

    public synchronized int getComparisons() {
        return comparisons;
    }

    public synchronized int getMaxComparisons() {
        return maxComparisons;
    }

    public synchronized int getHistorySize() {
        return history == null ? 0 : history.size();
    }

    public synchronized boolean hasSession() {
        return store != null;
    }

    public RankingConfig getConfig() {
        return config;
    }

    // ============ HELPERS ============

    private double progress() {
        return maxComparisons > 0 ? Math.min(1.0, (double) comparisons / maxComparisons) : 0.0;
    }

    private Phase currentPhase() {
        return Phase.forProgress(progress(), config.getBroadGroupsUntil(), config.getNarrowGroupsUntil());
    }

    private void requireStarted() {
        if (store == null) {
            throw new SessionStateException("No ranking session has been started");
        }
    }

    private void requireActive() {
        requireStarted();
        if (isFinished()) {
            throw new SessionStateException("The ranking session has finished");
        }
    }
}
