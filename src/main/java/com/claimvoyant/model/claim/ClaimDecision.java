package com.claimvoyant.model.claim;

/**
 * Outcome of the Decision stage.
 *
 * <p>APPROVED, DENIED and PENDING come from the reasoning engine. ERROR is the
 * fallback written when the engine fails or answers outside the schema; it is
 * still a committed, terminal decision.
 */
public enum ClaimDecision {
    APPROVED,
    DENIED,
    PENDING,
    ERROR;

    /**
     * True for the values the reasoning engine is allowed to return.
     */
    public boolean isReasoned() {
        return this != ERROR;
    }
}
