package com.rankbox.api.service;

import com.rankbox.api.config.RankingProperties;
import com.rankbox.api.dto.ModeOption;
import com.rankbox.api.dto.ProgressResponse;
import com.rankbox.api.dto.ResolveRequest;
import com.rankbox.api.dto.SelectionResponse;
import com.rankbox.api.dto.SessionResponse;
import com.rankbox.api.exception.NoActiveSessionException;
import com.rankbox.engine.RankingEngine;
import com.rankbox.engine.confidence.ConfidenceBreakdown;
import com.rankbox.engine.config.RankingConfig;
import com.rankbox.engine.convergence.ConvergenceReport;
import com.rankbox.engine.model.Item;
import com.rankbox.engine.model.ProgressStats;
import com.rankbox.engine.model.RankedResult;
import com.rankbox.engine.model.Selection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the single ranking session served by this process.
 *
 * Starting a session replaces the previous one. Every call is serialised on this service, so
 * the engine only ever sees one caller at a time.
 */
@Service
public class RankingSessionService {

    private static final Logger log = LoggerFactory.getLogger(RankingSessionService.class);

    private final RankingConfig config;
    private final RankingProperties properties;

    private RankingEngine engine;
    private SessionResponse session;

    public RankingSessionService(RankingConfig config, RankingProperties properties) {
        this.config = config;
        this.properties = properties;
    }

    // ============ SESSION ============

    public synchronized SessionResponse startSession(List<Item> items, String mode, Integer maxComparisons) {
        if (items == null || items.size() < 2) {
            throw new IllegalArgumentException("At least two items are required");
        }

        String modeId = null;
        int budget;
        if (maxComparisons != null) {
            budget = maxComparisons;
        } else {
            ComparisonBudget preset = ComparisonBudget.fromId(mode != null ? mode : properties.getDefaultMode());
            modeId = preset.getId();
            budget = preset.comparisonsFor(items.size());
        }

        RankingEngine next = new RankingEngine(config);
        next.start(items, budget);

        this.engine = next;
        this.session = new SessionResponse(
                UUID.randomUUID().toString(),
                items.size(),
                budget,
                modeId,
                ComparisonBudget.estimatedMinutes(budget),
                Instant.now()
        );
        log.info("Session {} started: {} items, mode {}, {} comparisons",
                session.sessionId(), items.size(), modeId != null ? modeId : "custom", budget);
        return session;
    }

    public synchronized SessionResponse getSession() {
        requireEngine();
        return session;
    }

    public synchronized void endSession() {
        if (engine != null) {
            log.info("Session {} discarded after {} comparisons", session.sessionId(), engine.getComparisons());
        }
        engine = null;
        session = null;
    }

    public synchronized boolean hasSession() {
        return engine != null;
    }

    // ============ COMPARISONS ============

    public synchronized SelectionResponse currentSelection() {
        RankingEngine e = requireEngine();
        Selection selection = e.currentSelectionDetail();
        if (selection == null) {
            return new SelectionResponse(List.of(), null, false, true, e.getComparisons(), e.getMaxComparisons());
        }
        return new SelectionResponse(selection.items(), selection.phase(), selection.highImpact(), false,
                e.getComparisons(), e.getMaxComparisons());
    }

    /**
     * Records the choice and returns what to show next.
     */
    public synchronized SelectionResponse resolve(ResolveRequest request) {
        RankingEngine e = requireEngine();
        if (request == null || request.winnerId() == null || request.winnerId().isBlank()) {
            throw new IllegalArgumentException("winnerId is required");
        }
        if (request.isGroupChoice()) {
            if (request.groupMembers() == null || request.groupMembers().size() < 2) {
                throw new IllegalArgumentException("Either loserId or at least two groupMembers are required");
            }
            e.resolveGroup(request.winnerId(), request.groupMembers());
        } else {
            e.resolve(request.winnerId(), request.loserId(), request.groupMembers());
        }
        return currentSelection();
    }

    public synchronized Optional<SelectionResponse> undo() {
        RankingEngine e = requireEngine();
        return Optional.ofNullable(e.undo()).map(items -> currentSelection());
    }

    public synchronized Optional<SelectionResponse> undoLastDecision() {
        RankingEngine e = requireEngine();
        return Optional.ofNullable(e.undoLastDecision()).map(items -> currentSelection());
    }

    public synchronized List<RankedResult> finish() {
        RankingEngine e = requireEngine();
        List<RankedResult> results = e.finish();
        log.info("Session {} finished with {} comparisons", session.sessionId(), e.getComparisons());
        return results;
    }

    // ============ READS ============

    public synchronized List<RankedResult> results() {
        return requireEngine().getRankedResults();
    }

    public synchronized ProgressResponse progress() {
        RankingEngine e = requireEngine();
        ProgressStats stats = e.getProgressStats();
        ConvergenceReport convergence = e.getLastConvergenceReport();
        return new ProgressResponse(
                stats,
                e.isFinished(),
                stats.getProgressFormatted(),
                stats.getAvgConfidenceFormatted(),
                stats.getEstimatedMinutesLeft(),
                convergence != null ? convergence.blocker() : null
        );
    }

    public synchronized ConfidenceBreakdown confidence(String itemId) {
        return requireEngine().getConfidenceBreakdown(itemId);
    }

    public List<ModeOption> modes(int itemCount) {
        if (itemCount < 2) {
            throw new IllegalArgumentException("itemCount must be at least 2");
        }
        return Arrays.stream(ComparisonBudget.values()).map(b -> b.toOption(itemCount)).toList();
    }

    public synchronized int getComparisons() {
        return engine == null ? 0 : engine.getComparisons();
    }

    private RankingEngine requireEngine() {
        if (engine == null) {
            throw new NoActiveSessionException();
        }
        return engine;
    }
}
