package com.agentcrew.orchestrator.command;

/**
 * One value per command variant; the processor routes on this.
 */
public enum CommandType {
    SPAWN_WORKER,
    ASSIGN_TASK,
    REPLACE_WORKER,
    RETIRE_WORKER,
    SEND_TO_WORKER,
    BROADCAST,
    DELIVER_QUEUED,
    ASSIGN_REVIEW,
    ASSIGN_REVIEW_FEEDBACK,
    REPORT_COMPLETE,
    REPORT_VERDICT,
    MARK_TASK_COMPLETE,
    MARK_TASK_FAILED,
    APPROVE_COMMIT,
    STOP_WORKER,
    SIGNAL_WORKFLOW_COMPLETE;

    /** Tool-style name used in logs and metric tags, e.g. "assign_task". */
    public String toolName() {
        return name().toLowerCase();
    }
}
