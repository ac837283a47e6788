package com.claimvoyant.model;

import com.claimvoyant.model.audit.AuditStatus;

/**
 * Pipeline-level state of one claim execution.
 *
 * <p>State Transitions:
 * <pre>
 * INTAKE → POLICY → DAMAGE → VALUATION → DECISION → TERMINAL_DECIDED
 *    ↓        ↓        ↓          ↓           ↓
 *                  TERMINAL_FAILED
 * </pre>
 * A stage reporting {@code success} or {@code not_found} moves forward; a stage
 * reporting {@code error} fails the run. Decision succeeding, including with the
 * ERROR fallback decision, ends in TERMINAL_DECIDED.
 */
public enum PipelineState {

    INTAKE,
    POLICY,
    DAMAGE,
    VALUATION,
    DECISION,
    TERMINAL_DECIDED,
    TERMINAL_FAILED;

    public static PipelineState initial() {
        return INTAKE;
    }

    /**
     * Stage executed in this state.
     *
     * @throws IllegalStateException for terminal states
     */
    public PipelineStage stage() {
        if (isTerminal()) {
            throw new IllegalStateException("No stage runs in terminal state " + this);
        }
        return PipelineStage.valueOf(name());
    }

    /**
     * Next state given the audit status the current stage reported.
     */
    public PipelineState advance(AuditStatus outcome) {
        if (isTerminal()) {
            throw new IllegalStateException("Cannot advance from terminal state " + this);
        }
        if (outcome == AuditStatus.ERROR) {
            return TERMINAL_FAILED;
        }
        return switch (this) {
            case INTAKE -> POLICY;
            case POLICY -> DAMAGE;
            case DAMAGE -> VALUATION;
            case VALUATION -> DECISION;
            case DECISION -> TERMINAL_DECIDED;
            default -> throw new IllegalStateException("Unexpected state " + this);
        };
    }

    public boolean isTerminal() {
        return this == TERMINAL_DECIDED || this == TERMINAL_FAILED;
    }
}
