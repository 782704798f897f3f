package com.agentcrew.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Worker-side lifecycle state.
 *
 * Implementer side:
 *   IDLE → IMPLEMENTING → AWAITING_REVIEW → COMMITTING → IDLE
 *                              ↕
 *                      ADDRESSING_FEEDBACK
 *
 * Reviewer side:
 *   IDLE → REVIEWING → IDLE
 *
 * The full table of allowed moves lives in {@link com.agentcrew.orchestrator.workflow.WorkflowTransitions}.
 */
public enum WorkerPhase {
    IDLE,
    IMPLEMENTING,
    AWAITING_REVIEW,
    REVIEWING,
    ADDRESSING_FEEDBACK,
    COMMITTING;

    private static final Set<WorkerPhase> IMPLEMENTER_PHASES =
            EnumSet.of(IMPLEMENTING, AWAITING_REVIEW, ADDRESSING_FEEDBACK, COMMITTING);

    /**
     * Whether this phase may be held by a worker with the given role.
     * IDLE allows no role at all; REVIEWING is reviewer-only.
     */
    public boolean allows(WorkerRole role) {
        if (this == IDLE) return role == null;
        if (this == REVIEWING) return role == WorkerRole.REVIEWER;
        return role == WorkerRole.IMPLEMENTER && IMPLEMENTER_PHASES.contains(this);
    }
}
