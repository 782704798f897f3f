package com.agentcrew.orchestrator.model;

import java.time.Instant;

/**
 * Orchestration record for one task.
 *
 * Created on first assignment and never deleted: finished and abandoned tasks stay in the
 * store so the consistency monitor can still see who last held them.
 *
 * @param taskId          Tracker task ID (e.g. "perles-abc.1")
 * @param implementer     Worker that owns the implementation; always set
 * @param reviewer        Worker reviewing the change; empty until a review is assigned
 * @param status          Task-side workflow state
 * @param startedAt       When the implementer was assigned
 * @param reviewStartedAt When the current review began; null before the first review
 */
public record TaskAssignment(
        String     taskId,
        String     implementer,
        String     reviewer,
        TaskStatus status,
        Instant    startedAt,
        Instant    reviewStartedAt) {

    public TaskAssignment {
        if (reviewer == null) reviewer = "";
    }

    public static TaskAssignment started(String taskId, String implementer, Instant now) {
        return new TaskAssignment(taskId, implementer, "", TaskStatus.IMPLEMENTING, now, null);
    }

    public boolean hasReviewer() { return !reviewer.isEmpty(); }

    public TaskAssignment withStatus(TaskStatus newStatus) {
        return new TaskAssignment(taskId, implementer, reviewer, newStatus, startedAt, reviewStartedAt);
    }

    public TaskAssignment withReviewer(String newReviewer, Instant reviewStart) {
        return new TaskAssignment(taskId, implementer, newReviewer, status, startedAt, reviewStart);
    }
}
