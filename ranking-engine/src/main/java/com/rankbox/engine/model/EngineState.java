package com.rankbox.engine.model;

/**
 * Lifecycle of a ranking session.
 * IDLE, SELECTING, AWAITING_OUTCOME, BATCHING, then back to SELECTING or through AUDITING,
 * ending in CONVERGED (early stop) or FINISHED (budget spent or finished by the caller).
 */
public enum EngineState {
    IDLE,
    SELECTING,
    AWAITING_OUTCOME,
    BATCHING,
    AUDITING,
    CONVERGED,
    FINISHED;

    public boolean isTerminal() {
        return this == CONVERGED || this == FINISHED;
    }
}
