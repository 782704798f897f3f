package com.agentcrew.orchestrator.handler;

import com.agentcrew.orchestrator.assignment.AssignmentException;
import com.agentcrew.orchestrator.assignment.AssignmentStore;
import com.agentcrew.orchestrator.command.Command.ReportVerdict;
import com.agentcrew.orchestrator.command.CommandHandler;
import com.agentcrew.orchestrator.command.CommandResult;
import com.agentcrew.orchestrator.command.CommandType;
import com.agentcrew.orchestrator.command.Verdict;
import com.agentcrew.orchestrator.model.TaskAssignment;
import com.agentcrew.orchestrator.model.TaskStatus;
import com.agentcrew.orchestrator.model.WorkerAssignment;
import com.agentcrew.orchestrator.model.WorkerPhase;
import com.agentcrew.orchestrator.tracker.TaskTracker;
import org.springframework.stereotype.Component;

/**
 * A reviewer delivers its verdict. The reviewer is released either way; on denial the
 * task's reviewer slot is freed as well so a fresh review can be assigned later.
 */
@Component
public class ReportVerdictHandler implements CommandHandler<ReportVerdict> {

    private final AssignmentStore store;
    private final TaskTracker     tracker;

    public ReportVerdictHandler(AssignmentStore store, TaskTracker tracker) {
        this.store   = store;
        this.tracker = tracker;
    }

    @Override
    public CommandType type() {
        return CommandType.REPORT_VERDICT;
    }

    @Override
    public CommandResult handle(ReportVerdict command) {
        String reviewerId = command.workerId();
        WorkerAssignment wa = Lookups.assignedWorker(store, reviewerId);
        if (wa.phase() != WorkerPhase.REVIEWING) {
            throw new AssignmentException(AssignmentException.Kind.INVALID_STATE,
                    "worker %s is not reviewing (phase: %s)".formatted(reviewerId, wa.phase()));
        }
        TaskAssignment task = Lookups.task(store, wa.taskId());
        if (!task.reviewer().equals(reviewerId)) {
            throw new AssignmentException(AssignmentException.Kind.TASK_MISMATCH,
                    "task %s is reviewed by %s, not %s".formatted(task.taskId(), task.reviewer(), reviewerId));
        }

        String comments = command.comments() == null ? "" : command.comments();
        tracker.addComment(task.taskId(), reviewerId, "Review " + command.verdict() + ": " + comments);

        boolean approved = command.verdict() == Verdict.APPROVED;
        TaskAssignment updated = store.update(m -> {
            TaskAssignment moved = m.moveTask(task.taskId(), approved ? TaskStatus.APPROVED : TaskStatus.DENIED);
            if (!approved) {
                moved = moved.withReviewer("", moved.reviewStartedAt());
                m.putTask(moved);
                m.worker(task.implementer())
                        .filter(impl -> impl.taskId().equals(task.taskId()))
                        .ifPresent(impl -> m.putWorker(task.implementer(), impl.withReviewer("")));
            }
            m.moveWorker(reviewerId, WorkerPhase.IDLE);
            return moved;
        });
        return CommandResult.success("task %s %s by %s".formatted(
                task.taskId(), command.verdict().name().toLowerCase(), reviewerId), updated);
    }
}
