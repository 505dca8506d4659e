package com.chimera.orchestrator.model;

/**
 * Phases of the Chimera pipeline for a WorkflowTask.
 *
 * Transitions (happy path):
 *   E2E_TEST_GENERATION → CODE_IMPLEMENTATION → REVIEW → STAGING_DEPLOYMENT
 *     → E2E_VALIDATION → COMPLETE
 *
 * Any non-terminal phase can transition to FAILED (review rejected,
 * retries exhausted, contract violation). Declaration order is pipeline order.
 */
public enum ChimeraPhase {
    E2E_TEST_GENERATION,
    CODE_IMPLEMENTATION,
    REVIEW,
    STAGING_DEPLOYMENT,
    E2E_VALIDATION,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }

    /** Pipeline successor, or null for terminal phases. */
    public ChimeraPhase next() {
        return switch (this) {
            case E2E_TEST_GENERATION -> CODE_IMPLEMENTATION;
            case CODE_IMPLEMENTATION -> REVIEW;
            case REVIEW              -> STAGING_DEPLOYMENT;
            case STAGING_DEPLOYMENT  -> E2E_VALIDATION;
            case E2E_VALIDATION      -> COMPLETE;
            case COMPLETE, FAILED    -> null;
        };
    }

    /** True if {@code target} is the immediate successor, or FAILED from a non-terminal phase. */
    public boolean canTransitionTo(ChimeraPhase target) {
        if (isTerminal() || target == null) {
            return false;
        }
        return target == FAILED || target == next();
    }
}
