package com.agentcrew.orchestrator.handler;

import com.agentcrew.orchestrator.assignment.AssignmentException;
import com.agentcrew.orchestrator.assignment.AssignmentStore;
import com.agentcrew.orchestrator.command.Command.ApproveCommit;
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
 * Tells the implementer of an approved task to commit.
 */
@Component
public class ApproveCommitHandler implements CommandHandler<ApproveCommit> {

    private final AssignmentStore    store;
    private final ProcessRuntime     runtime;
    private final WorkerInstructions instructions;

    public ApproveCommitHandler(AssignmentStore store, ProcessRuntime runtime, WorkerInstructions instructions) {
        this.store        = store;
        this.runtime      = runtime;
        this.instructions = instructions;
    }

    @Override
    public CommandType type() {
        return CommandType.APPROVE_COMMIT;
    }

    @Override
    public CommandResult handle(ApproveCommit command) {
        String taskId        = command.taskId();
        String implementerId = command.implementerId();

        TaskAssignment task = Lookups.task(store, taskId);
        if (task.status() != TaskStatus.APPROVED) {
            throw new AssignmentException(AssignmentException.Kind.INVALID_STATE,
                    "task %s must be approved before commit (status: %s)".formatted(taskId, task.status()));
        }
        Lookups.requireImplementer(task, implementerId);
        WorkerAssignment implementer = store.getWorkerAssignment(implementerId).orElse(WorkerAssignment.idle());
        if (implementer.phase() != WorkerPhase.AWAITING_REVIEW) {
            throw new AssignmentException(AssignmentException.Kind.NOT_AWAITING_REVIEW,
                    "implementer %s is not awaiting review (phase: %s)".formatted(implementerId, implementer.phase()));
        }

        runtime.resume(implementerId, instructions.commit(taskId, command.commitMessage()));

        WorkerAssignment updated = store.update(m -> {
            m.moveTask(taskId, TaskStatus.COMMITTING);
            return m.moveWorker(implementerId, WorkerPhase.COMMITTING);
        });
        return CommandResult.success("%s is committing task %s".formatted(implementerId, taskId), updated);
    }
}
