package com.agentcrew.orchestrator.model;

import java.time.Instant;

/**
 * The task a single worker currently holds.
 *
 * Immutable: the assignment store replaces the whole value on every transition, so a
 * copy handed to a caller can never change underneath them.
 *
 * @param taskId        Task held by the worker; empty string when idle
 * @param role          IMPLEMENTER or REVIEWER; null when idle
 * @param phase         Worker-side phase
 * @param assignedAt    When the current task was assigned; drives stuck-worker detection
 * @param implementerId Counterpart implementer (set on a reviewer's assignment)
 * @param reviewerId    Counterpart reviewer (set on an implementer's assignment while in review)
 */
public record WorkerAssignment(
        String       taskId,
        WorkerRole   role,
        WorkerPhase  phase,
        Instant      assignedAt,
        String       implementerId,
        String       reviewerId) {

    public WorkerAssignment {
        if (taskId == null) taskId = "";
        if (phase == null)  phase  = WorkerPhase.IDLE;
        if (implementerId == null) implementerId = "";
        if (reviewerId == null)    reviewerId    = "";
    }

    /** The cleared assignment a worker returns to when its part of the workflow ends. */
    public static WorkerAssignment idle() {
        return new WorkerAssignment("", null, WorkerPhase.IDLE, null, "", "");
    }

    public static WorkerAssignment implementing(String taskId, Instant now) {
        return new WorkerAssignment(taskId, WorkerRole.IMPLEMENTER, WorkerPhase.IMPLEMENTING, now, "", "");
    }

    public static WorkerAssignment reviewing(String taskId, String implementerId, Instant now) {
        return new WorkerAssignment(taskId, WorkerRole.REVIEWER, WorkerPhase.REVIEWING, now, implementerId, "");
    }

    public boolean hasTask() { return !taskId.isEmpty(); }

    public WorkerAssignment withPhase(WorkerPhase newPhase) {
        return new WorkerAssignment(taskId, role, newPhase, assignedAt, implementerId, reviewerId);
    }

    public WorkerAssignment withReviewer(String newReviewerId) {
        return new WorkerAssignment(taskId, role, phase, assignedAt, implementerId, newReviewerId);
    }
}
