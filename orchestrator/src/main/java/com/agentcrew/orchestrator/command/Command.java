package com.agentcrew.orchestrator.command;

import com.agentcrew.orchestrator.workflow.WorkflowOutcome;

import java.util.Objects;

/**
 * A typed, immutable request to change orchestration state.
 *
 * One record per operation; each carries every argument its handler needs. Arguments
 * have already passed input validation by the time a command is built, so the
 * constructors only reject nulls in required fields.
 */
public sealed interface Command permits
        Command.SpawnWorker,
        Command.AssignTask,
        Command.ReplaceWorker,
        Command.RetireWorker,
        Command.SendToWorker,
        Command.Broadcast,
        Command.DeliverQueued,
        Command.AssignReview,
        Command.AssignReviewFeedback,
        Command.ReportComplete,
        Command.ReportVerdict,
        Command.MarkTaskComplete,
        Command.MarkTaskFailed,
        Command.ApproveCommit,
        Command.StopWorker,
        Command.SignalWorkflowComplete {

    CommandType type();

    /** @param agentType client to start; null for the runtime default */
    record SpawnWorker(String agentType) implements Command {
        public CommandType type() { return CommandType.SPAWN_WORKER; }
    }

    record AssignTask(String workerId, String taskId, String summary) implements Command {
        public AssignTask {
            Objects.requireNonNull(workerId, "workerId");
            Objects.requireNonNull(taskId, "taskId");
        }
        public CommandType type() { return CommandType.ASSIGN_TASK; }
    }

    record ReplaceWorker(String workerId, String reason) implements Command {
        public ReplaceWorker {
            Objects.requireNonNull(workerId, "workerId");
        }
        public CommandType type() { return CommandType.REPLACE_WORKER; }
    }

    record RetireWorker(String workerId, String reason) implements Command {
        public RetireWorker {
            Objects.requireNonNull(workerId, "workerId");
        }
        public CommandType type() { return CommandType.RETIRE_WORKER; }
    }

    record SendToWorker(String workerId, String message) implements Command {
        public SendToWorker {
            Objects.requireNonNull(workerId, "workerId");
            Objects.requireNonNull(message, "message");
        }
        public CommandType type() { return CommandType.SEND_TO_WORKER; }
    }

    record Broadcast(String message) implements Command {
        public Broadcast {
            Objects.requireNonNull(message, "message");
        }
        public CommandType type() { return CommandType.BROADCAST; }
    }

    /** Hand the worker its oldest pending message if it is ready for one. */
    record DeliverQueued(String workerId) implements Command {
        public DeliverQueued {
            Objects.requireNonNull(workerId, "workerId");
        }
        public CommandType type() { return CommandType.DELIVER_QUEUED; }
    }

    record AssignReview(String reviewerId, String taskId, String implementerId,
                        String summary, ReviewType reviewType) implements Command {
        public AssignReview {
            Objects.requireNonNull(reviewerId, "reviewerId");
            Objects.requireNonNull(taskId, "taskId");
            Objects.requireNonNull(implementerId, "implementerId");
            if (reviewType == null) reviewType = ReviewType.COMPLEX;
        }
        public CommandType type() { return CommandType.ASSIGN_REVIEW; }
    }

    record AssignReviewFeedback(String implementerId, String taskId, String feedback) implements Command {
        public AssignReviewFeedback {
            Objects.requireNonNull(implementerId, "implementerId");
            Objects.requireNonNull(taskId, "taskId");
            Objects.requireNonNull(feedback, "feedback");
        }
        public CommandType type() { return CommandType.ASSIGN_REVIEW_FEEDBACK; }
    }

    record ReportComplete(String workerId, String summary) implements Command {
        public ReportComplete {
            Objects.requireNonNull(workerId, "workerId");
        }
        public CommandType type() { return CommandType.REPORT_COMPLETE; }
    }

    record ReportVerdict(String workerId, Verdict verdict, String comments) implements Command {
        public ReportVerdict {
            Objects.requireNonNull(workerId, "workerId");
            Objects.requireNonNull(verdict, "verdict");
        }
        public CommandType type() { return CommandType.REPORT_VERDICT; }
    }

    record MarkTaskComplete(String taskId) implements Command {
        public MarkTaskComplete {
            Objects.requireNonNull(taskId, "taskId");
        }
        public CommandType type() { return CommandType.MARK_TASK_COMPLETE; }
    }

    record MarkTaskFailed(String taskId, String reason) implements Command {
        public MarkTaskFailed {
            Objects.requireNonNull(taskId, "taskId");
            Objects.requireNonNull(reason, "reason");
        }
        public CommandType type() { return CommandType.MARK_TASK_FAILED; }
    }

    record ApproveCommit(String implementerId, String taskId, String commitMessage) implements Command {
        public ApproveCommit {
            Objects.requireNonNull(implementerId, "implementerId");
            Objects.requireNonNull(taskId, "taskId");
        }
        public CommandType type() { return CommandType.APPROVE_COMMIT; }
    }

    /**
     * @param force  skip the runtime's grace period and the committing-phase guard
     * @param reason free text kept for the audit log
     */
    record StopWorker(String workerId, boolean force, String reason) implements Command {
        public StopWorker {
            Objects.requireNonNull(workerId, "workerId");
        }
        public CommandType type() { return CommandType.STOP_WORKER; }
    }

    record SignalWorkflowComplete(WorkflowOutcome outcome, String summary) implements Command {
        public SignalWorkflowComplete {
            Objects.requireNonNull(outcome, "outcome");
        }
        public CommandType type() { return CommandType.SIGNAL_WORKFLOW_COMPLETE; }
    }
}
