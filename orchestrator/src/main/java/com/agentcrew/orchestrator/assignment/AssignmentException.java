package com.agentcrew.orchestrator.assignment;

/**
 * Thrown when an assignment or transition would break a workflow invariant.
 *
 * The message is shown to the caller verbatim and always names the conflicting
 * entity (current holder, current task, current phase or status).
 */
public class AssignmentException extends RuntimeException {

    public enum Kind {
        ALREADY_ASSIGNED,
        WORKER_BUSY,
        NOT_FOUND,
        NOT_READY,
        SELF_REVIEW,
        TASK_MISMATCH,
        NOT_AWAITING_REVIEW,
        REVIEWER_ALREADY_SET,
        REVIEWER_NOT_READY,
        INVALID_TRANSITION,
        INVALID_STATE
    }

    private final Kind kind;

    public AssignmentException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
