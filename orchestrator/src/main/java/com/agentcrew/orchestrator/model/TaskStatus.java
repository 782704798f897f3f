package com.agentcrew.orchestrator.model;

/**
 * Task-side workflow state.
 *
 * Transitions (happy path):
 *   IMPLEMENTING → IN_REVIEW → APPROVED → COMMITTING → COMPLETED
 *
 * Review denial loops back:  IN_REVIEW → DENIED → IMPLEMENTING
 * A failed commit retries:   COMMITTING → IMPLEMENTING
 *
 * COMPLETED is terminal.
 */
public enum TaskStatus {
    IMPLEMENTING,
    IN_REVIEW,
    APPROVED,
    DENIED,
    COMMITTING,
    COMPLETED
}
