package com.agentcrew.orchestrator.handler;

import com.agentcrew.orchestrator.assignment.AssignmentStore;
import com.agentcrew.orchestrator.command.Command.MarkTaskFailed;
import com.agentcrew.orchestrator.command.CommandHandler;
import com.agentcrew.orchestrator.command.CommandResult;
import com.agentcrew.orchestrator.command.CommandType;
import com.agentcrew.orchestrator.model.TaskAssignment;
import com.agentcrew.orchestrator.model.WorkerPhase;
import com.agentcrew.orchestrator.tracker.TaskTracker;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Records a task as failed in the tracker and releases every worker still holding it.
 * The task's orchestration record is kept.
 */
@Component
public class MarkTaskFailedHandler implements CommandHandler<MarkTaskFailed> {

    static final String AUTHOR = "orchestrator";

    private final AssignmentStore store;
    private final TaskTracker     tracker;

    public MarkTaskFailedHandler(AssignmentStore store, TaskTracker tracker) {
        this.store   = store;
        this.tracker = tracker;
    }

    @Override
    public CommandType type() {
        return CommandType.MARK_TASK_FAILED;
    }

    @Override
    public CommandResult handle(MarkTaskFailed command) {
        String taskId = command.taskId();
        if (command.reason().isBlank()) {
            throw new IllegalArgumentException("reason is required to mark a task failed");
        }

        tracker.addComment(taskId, AUTHOR, "Task failed: " + command.reason());
        tracker.markFailed(taskId, command.reason());

        List<String> released = store.update(m -> {
            List<String> holders = m.holdersOf(taskId);
            holders.forEach(id -> m.moveWorker(id, WorkerPhase.IDLE));
            // a reviewer slot must not outlive the reviewer's assignment
            m.task(taskId)
                    .filter(TaskAssignment::hasReviewer)
                    .ifPresent(ta -> m.putTask(ta.withReviewer("", ta.reviewStartedAt())));
            return holders;
        });
        return CommandResult.success("task %s marked failed".formatted(taskId), released);
    }
}
