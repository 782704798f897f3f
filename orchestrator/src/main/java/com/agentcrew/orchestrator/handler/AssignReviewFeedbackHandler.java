package com.agentcrew.orchestrator.handler;

import com.agentcrew.orchestrator.assignment.AssignmentException;
import com.agentcrew.orchestrator.assignment.AssignmentStore;
import com.agentcrew.orchestrator.command.Command.AssignReviewFeedback;
import com.agentcrew.orchestrator.command.CommandHandler;
import com.agentcrew.orchestrator.command.CommandResult;
import com.agentcrew.orchestrator.command.CommandType;
import com.agentcrew.orchestrator.model.TaskAssignment;
import com.agentcrew.orchestrator.model.TaskStatus;
import com.agentcrew.orchestrator.model.WorkerAssignment;
import com.agentcrew.orchestrator.model.WorkerPhase;
import com.agentcrew.orchestrator.runtime.ProcessRuntime;
import org.springframework.stereotype.Component;

/**
 * Sends a denied task back to its implementer with the reviewer's feedback.
 */
@Component
public class AssignReviewFeedbackHandler implements CommandHandler<AssignReviewFeedback> {

    private final AssignmentStore    store;
    private final ProcessRuntime     runtime;
    private final WorkerInstructions instructions;

    public AssignReviewFeedbackHandler(AssignmentStore store, ProcessRuntime runtime, WorkerInstructions instructions) {
        this.store        = store;
        this.runtime      = runtime;
        this.instructions = instructions;
    }

    @Override
    public CommandType type() {
        return CommandType.ASSIGN_REVIEW_FEEDBACK;
    }

    @Override
    public CommandResult handle(AssignReviewFeedback command) {
        String taskId        = command.taskId();
        String implementerId = command.implementerId();

        TaskAssignment task = Lookups.task(store, taskId);
        if (task.status() != TaskStatus.DENIED) {
            throw new AssignmentException(AssignmentException.Kind.INVALID_STATE,
                    "task %s must be denied to send feedback (status: %s)".formatted(taskId, task.status()));
        }
        Lookups.requireImplementer(task, implementerId);
        WorkerAssignment implementer = store.getWorkerAssignment(implementerId).orElse(WorkerAssignment.idle());
        if (implementer.phase() != WorkerPhase.AWAITING_REVIEW) {
            throw new AssignmentException(AssignmentException.Kind.NOT_AWAITING_REVIEW,
                    "implementer %s is not awaiting review (phase: %s)".formatted(implementerId, implementer.phase()));
        }

        runtime.resume(implementerId, instructions.feedback(taskId, command.feedback()));

        WorkerAssignment updated = store.update(m -> {
            m.moveTask(taskId, TaskStatus.IMPLEMENTING);
            return m.moveWorker(implementerId, WorkerPhase.ADDRESSING_FEEDBACK);
        });
        return CommandResult.success("sent review feedback for %s to %s".formatted(taskId, implementerId), updated);
    }
}
