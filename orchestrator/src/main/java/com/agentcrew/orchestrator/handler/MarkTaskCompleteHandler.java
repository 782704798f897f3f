package com.agentcrew.orchestrator.handler;

import com.agentcrew.orchestrator.assignment.AssignmentException;
import com.agentcrew.orchestrator.assignment.AssignmentStore;
import com.agentcrew.orchestrator.command.Command.MarkTaskComplete;
import com.agentcrew.orchestrator.command.CommandHandler;
import com.agentcrew.orchestrator.command.CommandResult;
import com.agentcrew.orchestrator.command.CommandType;
import com.agentcrew.orchestrator.model.TaskAssignment;
import com.agentcrew.orchestrator.model.TaskStatus;
import com.agentcrew.orchestrator.model.WorkerPhase;
import com.agentcrew.orchestrator.tracker.TaskTracker;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Closes a committed task in the tracker and frees its implementer.
 *
 * A task with no orchestration record is closed in the tracker only; marking an
 * already completed task again does nothing.
 */
@Component
public class MarkTaskCompleteHandler implements CommandHandler<MarkTaskComplete> {

    private final AssignmentStore store;
    private final TaskTracker     tracker;

    public MarkTaskCompleteHandler(AssignmentStore store, TaskTracker tracker) {
        this.store   = store;
        this.tracker = tracker;
    }

    @Override
    public CommandType type() {
        return CommandType.MARK_TASK_COMPLETE;
    }

    @Override
    public CommandResult handle(MarkTaskComplete command) {
        String taskId = command.taskId();
        Optional<TaskAssignment> existing = store.getTaskAssignment(taskId);

        if (existing.isEmpty()) {
            tracker.markComplete(taskId);
            return CommandResult.success("task %s marked complete".formatted(taskId));
        }
        TaskAssignment task = existing.get();
        if (task.status() == TaskStatus.COMPLETED) {
            return CommandResult.success("task %s is already complete".formatted(taskId), task);
        }
        if (task.status() != TaskStatus.COMMITTING) {
            throw new AssignmentException(AssignmentException.Kind.INVALID_STATE,
                    "task %s cannot be completed from status %s".formatted(taskId, task.status()));
        }

        tracker.markComplete(taskId);

        TaskAssignment completed = store.update(m -> {
            TaskAssignment moved = m.moveTask(taskId, TaskStatus.COMPLETED);
            m.worker(task.implementer())
                    .filter(wa -> wa.taskId().equals(taskId))
                    .ifPresent(wa -> m.moveWorker(task.implementer(), WorkerPhase.IDLE));
            return moved;
        });
        return CommandResult.success("task %s marked complete".formatted(taskId), completed);
    }
}
