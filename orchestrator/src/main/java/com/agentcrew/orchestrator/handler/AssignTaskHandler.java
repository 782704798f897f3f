package com.agentcrew.orchestrator.handler;

import com.agentcrew.orchestrator.assignment.AssignmentException;
import com.agentcrew.orchestrator.assignment.AssignmentStore;
import com.agentcrew.orchestrator.assignment.AssignmentValidator;
import com.agentcrew.orchestrator.command.Command.AssignTask;
import com.agentcrew.orchestrator.command.CommandHandler;
import com.agentcrew.orchestrator.command.CommandResult;
import com.agentcrew.orchestrator.command.CommandType;
import com.agentcrew.orchestrator.model.WorkerAssignment;
import com.agentcrew.orchestrator.runtime.ProcessRuntime;
import com.agentcrew.orchestrator.tracker.TaskTracker;
import com.agentcrew.orchestrator.tracker.TrackerIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Hands a tracker task to an idle worker as its implementer.
 *
 * The tracker issue moves to in-progress and the worker is told about the task before
 * the store records it, so a collaborator failure leaves no assignment behind. A task
 * whose previous implementer has vanished or retired may be taken over: every other
 * worker still holding the task, a live reviewer included, is released in the same
 * store change that records the new implementer.
 */
@Component
public class AssignTaskHandler implements CommandHandler<AssignTask> {

    private static final Logger log = LoggerFactory.getLogger(AssignTaskHandler.class);

    private final AssignmentStore     store;
    private final AssignmentValidator validator;
    private final ProcessRuntime      runtime;
    private final TaskTracker         tracker;
    private final WorkerInstructions  instructions;
    private final Clock               clock;

    public AssignTaskHandler(AssignmentStore store,
                             AssignmentValidator validator,
                             ProcessRuntime runtime,
                             TaskTracker tracker,
                             WorkerInstructions instructions,
                             Clock clock) {
        this.store        = store;
        this.validator    = validator;
        this.runtime      = runtime;
        this.tracker      = tracker;
        this.instructions = instructions;
        this.clock        = clock;
    }

    @Override
    public CommandType type() {
        return CommandType.ASSIGN_TASK;
    }

    @Override
    public CommandResult handle(AssignTask command) {
        String workerId = command.workerId();
        String taskId   = command.taskId();

        validator.validateTaskAssignment(workerId, taskId);
        TrackerIssue issue = tracker.showIssue(taskId).orElseThrow(() ->
                new AssignmentException(AssignmentException.Kind.NOT_FOUND,
                        "task %s not found in tracker; did you mean to use send_to_worker?".formatted(taskId)));

        tracker.markInProgress(taskId);
        runtime.resume(workerId, instructions.implement(issue, command.summary()));

        WorkerAssignment assigned = store.update(m -> {
            boolean takeover = m.task(taskId).map(t -> !t.implementer().equals(workerId)).orElse(false);
            if (takeover) {
                for (String holder : m.holdersOf(taskId)) {
                    if (!holder.equals(workerId)) {
                        log.warn("Task {} taken over by {}: releasing {}", taskId, workerId, holder);
                        m.clearWorker(holder);
                    }
                }
            }
            return m.assignImplementer(workerId, taskId, clock.instant());
        });
        return CommandResult.success("assigned task %s to %s".formatted(taskId, workerId), assigned);
    }
}
