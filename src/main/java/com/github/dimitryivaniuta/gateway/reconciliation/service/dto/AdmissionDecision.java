package com.github.dimitryivaniuta.gateway.reconciliation.service.dto;

/**
 * What the caller of {@code IdempotencyCoordinator.admit} must do with an event.
 */
public enum AdmissionDecision {
    /** First sight of the event: run the side effect. */
    EXECUTE,
    /** A prior execution failed: run the side effect again on the same row. */
    RETRY,
    /** Already processed, in flight elsewhere, or lost a concurrent insert: do nothing. */
    SKIP;

    /**
     * @return true for {@link #EXECUTE} and {@link #RETRY}
     */
    public boolean runsSideEffect() {
        return this != SKIP;
    }
}
