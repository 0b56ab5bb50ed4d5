package com.rankbox.api.controller;

import com.rankbox.api.dto.ModeOption;
import com.rankbox.api.dto.ProgressResponse;
import com.rankbox.api.dto.ResolveRequest;
import com.rankbox.api.dto.SelectionResponse;
import com.rankbox.api.dto.SessionResponse;
import com.rankbox.api.dto.StartSessionRequest;
import com.rankbox.api.service.RankingSessionService;
import com.rankbox.engine.confidence.ConfidenceBreakdown;
import com.rankbox.engine.model.RankedResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/ranking")
@Tag(name = "Ranking", description = "Pairwise ranking session endpoints")
public class RankingController {

    private final RankingSessionService sessionService;

    public RankingController(RankingSessionService sessionService) {
        this.sessionService = sessionService;
    }

    // ============ SESSION ============

    @PostMapping("/session")
    @Operation(summary = "Start a session", description = "Start ranking the given items, replacing any running session")
    public ResponseEntity<SessionResponse> startSession(@RequestBody StartSessionRequest request) {
        SessionResponse session = sessionService.startSession(request.items(), request.mode(), request.maxComparisons());
        return ResponseEntity.status(HttpStatus.CREATED).body(session);
    }

    @GetMapping("/session")
    @Operation(summary = "Get the session", description = "Describe the running session")
    public SessionResponse getSession() {
        return sessionService.getSession();
    }

    @DeleteMapping("/session")
    @Operation(summary = "Discard the session", description = "Drop the running session and all of its outcomes")
    public ResponseEntity<Void> endSession() {
        sessionService.endSession();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/modes")
    @Operation(summary = "List budget presets", description = "Comparison budgets offered for a list of the given size")
    public List<ModeOption> getModes(@RequestParam int itemCount) {
        return sessionService.modes(itemCount);
    }

    // ============ COMPARISONS ============

    @GetMapping("/selection")
    @Operation(summary = "Get the current selection", description = "Pair or group to decide next; repeated until it is resolved")
    public SelectionResponse getSelection() {
        return sessionService.currentSelection();
    }

    @PostMapping("/resolve")
    @Operation(summary = "Record a choice",
            description = "Record a pairwise outcome, or a group choice when loserId is omitted, and return the next selection")
    public SelectionResponse resolve(@RequestBody ResolveRequest request) {
        return sessionService.resolve(request);
    }

    @PostMapping("/undo")
    @Operation(summary = "Undo one outcome", description = "Roll back the latest pairwise outcome and present its selection again")
    public ResponseEntity<SelectionResponse> undo() {
        return sessionService.undo()
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.noContent().build());
    }

    @PostMapping("/undo-decision")
    @Operation(summary = "Undo one choice", description = "Roll back every outcome recorded by the latest choice")
    public ResponseEntity<SelectionResponse> undoDecision() {
        return sessionService.undoLastDecision()
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.noContent().build());
    }

    @PostMapping("/finish")
    @Operation(summary = "Finish the session", description = "Apply pending outcomes and return the final standings")
    public List<RankedResult> finish() {
        return sessionService.finish();
    }

    // ============ RESULTS ============

    @GetMapping("/results")
    @Operation(summary = "Get standings", description = "Current standings, best first")
    public List<RankedResult> getResults() {
        return sessionService.results();
    }

    @GetMapping("/progress")
    @Operation(summary = "Get progress", description = "Progress, confidence and the criterion still blocking early termination")
    public ProgressResponse getProgress() {
        return sessionService.progress();
    }

    @GetMapping("/items/{itemId}/confidence")
    @Operation(summary = "Explain an item's confidence", description = "The factors behind an item's confidence score")
    public ConfidenceBreakdown getConfidence(@PathVariable String itemId) {
        return sessionService.confidence(itemId);
    }
}
