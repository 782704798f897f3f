package com.agentcrew.orchestrator.handler;

import com.agentcrew.orchestrator.assignment.AssignmentException;
import com.agentcrew.orchestrator.assignment.AssignmentStore;
import com.agentcrew.orchestrator.command.Command.ReportComplete;
import com.agentcrew.orchestrator.command.CommandHandler;
import com.agentcrew.orchestrator.command.CommandResult;
import com.agentcrew.orchestrator.command.CommandType;
import com.agentcrew.orchestrator.model.TaskAssignment;
import com.agentcrew.orchestrator.model.WorkerAssignment;
import com.agentcrew.orchestrator.model.WorkerPhase;
import com.agentcrew.orchestrator.tracker.TaskTracker;
import org.springframework.stereotype.Component;

/**
 * An implementer reports that its change is ready for review.
 */
@Component
public class ReportCompleteHandler implements CommandHandler<ReportComplete> {

    private final AssignmentStore store;
    private final TaskTracker     tracker;

    public ReportCompleteHandler(AssignmentStore store, TaskTracker tracker) {
        this.store   = store;
        this.tracker = tracker;
    }

    @Override
    public CommandType type() {
        return CommandType.REPORT_COMPLETE;
    }

    @Override
    public CommandResult handle(ReportComplete command) {
        String workerId = command.workerId();
        WorkerAssignment wa = Lookups.assignedWorker(store, workerId);
        if (wa.phase() != WorkerPhase.IMPLEMENTING && wa.phase() != WorkerPhase.ADDRESSING_FEEDBACK) {
            throw new AssignmentException(AssignmentException.Kind.INVALID_STATE,
                    "worker %s cannot report completion in phase %s".formatted(workerId, wa.phase()));
        }
        TaskAssignment task = Lookups.task(store, wa.taskId());
        Lookups.requireImplementer(task, workerId);

        if (command.summary() != null && !command.summary().isBlank()) {
            tracker.addComment(task.taskId(), workerId, "Implementation complete: " + command.summary());
        }

        WorkerAssignment updated = store.update(m -> m.moveWorker(workerId, WorkerPhase.AWAITING_REVIEW));
        return CommandResult.success("task %s is awaiting review".formatted(task.taskId()), updated);
    }
}
