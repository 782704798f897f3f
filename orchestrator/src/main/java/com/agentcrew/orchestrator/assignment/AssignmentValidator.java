package com.agentcrew.orchestrator.assignment;

import com.agentcrew.orchestrator.model.ProcessInfo;
import com.agentcrew.orchestrator.model.TaskAssignment;
import com.agentcrew.orchestrator.model.TaskStatus;
import com.agentcrew.orchestrator.model.WorkerAssignment;
import com.agentcrew.orchestrator.model.WorkerPhase;
import com.agentcrew.orchestrator.runtime.ProcessRuntime;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.agentcrew.orchestrator.assignment.AssignmentException.Kind.*;

/**
 * Pure checks run before an assignment is written.
 *
 * Nothing here mutates the store. The tool layer calls these before building a
 * command (cheap rejection of obvious conflicts), and handlers call them again on
 * the processor thread, where the answer is authoritative because no other handler
 * can run in between.
 */
@Component
public class AssignmentValidator {

    private final AssignmentStore store;
    private final ProcessRuntime  runtime;

    public AssignmentValidator(AssignmentStore store, ProcessRuntime runtime) {
        this.store   = store;
        this.runtime = runtime;
    }

    /**
     * Can {@code workerId} start implementing {@code taskId}?
     *
     * A task whose recorded implementer has vanished from the live process set or
     * retired is orphaned and may be handed to a new worker.
     *
     * @throws AssignmentException ALREADY_ASSIGNED, INVALID_STATE, WORKER_BUSY, NOT_FOUND or NOT_READY
     */
    public void validateTaskAssignment(String workerId, String taskId) {
        Optional<TaskAssignment> task = store.getTaskAssignment(taskId);
        if (task.isPresent() && !task.get().implementer().equals(workerId)) {
            String holder = task.get().implementer();
            if (!isGone(holder)) {
                throw new AssignmentException(ALREADY_ASSIGNED,
                        "task %s already assigned to %s".formatted(taskId, holder));
            }
        }

        if (task.isPresent() && task.get().status() == TaskStatus.COMPLETED) {
            throw new AssignmentException(INVALID_STATE, "task %s is already completed".formatted(taskId));
        }

        Optional<WorkerAssignment> worker = store.getWorkerAssignment(workerId);
        if (worker.isPresent() && worker.get().hasTask()) {
            throw new AssignmentException(WORKER_BUSY,
                    "worker %s already assigned to task %s".formatted(workerId, worker.get().taskId()));
        }

        ProcessInfo process = runtime.find(workerId).orElseThrow(() ->
                new AssignmentException(NOT_FOUND, "worker %s not found".formatted(workerId)));
        if (!process.isReady()) {
            throw new AssignmentException(NOT_READY,
                    "worker %s is not ready (status: %s)".formatted(workerId, process.status()));
        }
    }

    /**
     * Can {@code reviewerId} review {@code implementerId}'s work on {@code taskId}?
     *
     * @throws AssignmentException SELF_REVIEW, TASK_MISMATCH, NOT_AWAITING_REVIEW,
     *                             REVIEWER_ALREADY_SET, WORKER_BUSY or REVIEWER_NOT_READY
     */
    public void validateReviewAssignment(String reviewerId, String taskId, String implementerId) {
        if (reviewerId.equals(implementerId)) {
            throw new AssignmentException(SELF_REVIEW, "reviewer cannot be the same as implementer");
        }

        TaskAssignment task = store.getTaskAssignment(taskId).orElseThrow(() ->
                new AssignmentException(TASK_MISMATCH, "task %s not found".formatted(taskId)));
        if (!task.implementer().equals(implementerId)) {
            throw new AssignmentException(TASK_MISMATCH,
                    "task %s is implemented by %s, not %s".formatted(taskId, task.implementer(), implementerId));
        }

        WorkerPhase implementerPhase = store.getWorkerAssignment(implementerId)
                .map(WorkerAssignment::phase)
                .orElse(WorkerPhase.IDLE);
        if (implementerPhase != WorkerPhase.AWAITING_REVIEW) {
            throw new AssignmentException(NOT_AWAITING_REVIEW,
                    "implementer %s is not awaiting review (phase: %s)".formatted(implementerId, implementerPhase));
        }

        if (task.hasReviewer()) {
            throw new AssignmentException(REVIEWER_ALREADY_SET,
                    "task %s already has reviewer %s".formatted(taskId, task.reviewer()));
        }

        Optional<WorkerAssignment> reviewer = store.getWorkerAssignment(reviewerId);
        if (reviewer.isPresent() && reviewer.get().hasTask()) {
            throw new AssignmentException(WORKER_BUSY,
                    "worker %s already assigned to task %s".formatted(reviewerId, reviewer.get().taskId()));
        }

        ProcessInfo process = runtime.find(reviewerId).orElseThrow(() ->
                new AssignmentException(REVIEWER_NOT_READY, "reviewer %s not found".formatted(reviewerId)));
        if (!process.isReady()) {
            throw new AssignmentException(REVIEWER_NOT_READY,
                    "reviewer %s is not ready (status: %s)".formatted(reviewerId, process.status()));
        }
    }

    /** A worker is gone when the runtime no longer lists it or lists it as retired. */
    public boolean isGone(String workerId) {
        return runtime.find(workerId).map(ProcessInfo::isRetired).orElse(true);
    }
}
