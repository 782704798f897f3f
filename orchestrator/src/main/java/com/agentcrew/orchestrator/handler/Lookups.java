package com.agentcrew.orchestrator.handler;

import com.agentcrew.orchestrator.assignment.AssignmentException;
import com.agentcrew.orchestrator.assignment.AssignmentStore;
import com.agentcrew.orchestrator.model.ProcessInfo;
import com.agentcrew.orchestrator.model.TaskAssignment;
import com.agentcrew.orchestrator.model.WorkerAssignment;
import com.agentcrew.orchestrator.runtime.ProcessRuntime;

import static com.agentcrew.orchestrator.assignment.AssignmentException.Kind.*;

/** Lookups shared by handlers that fail with the same messages. */
final class Lookups {

    private Lookups() {}

    static ProcessInfo liveWorker(ProcessRuntime runtime, String workerId) {
        return runtime.find(workerId)
                .orElseThrow(() -> new AssignmentException(NOT_FOUND, "worker %s not found".formatted(workerId)));
    }

    static ProcessInfo activeWorker(ProcessRuntime runtime, String workerId) {
        ProcessInfo info = liveWorker(runtime, workerId);
        if (info.isRetired()) {
            throw new AssignmentException(NOT_READY, "worker %s is retired".formatted(workerId));
        }
        return info;
    }

    static TaskAssignment task(AssignmentStore store, String taskId) {
        return store.getTaskAssignment(taskId)
                .orElseThrow(() -> new AssignmentException(TASK_MISMATCH, "task %s not found".formatted(taskId)));
    }

    /** The worker's current assignment; fails if it holds no task. */
    static WorkerAssignment assignedWorker(AssignmentStore store, String workerId) {
        return store.getWorkerAssignment(workerId)
                .filter(WorkerAssignment::hasTask)
                .orElseThrow(() -> new AssignmentException(INVALID_STATE,
                        "worker %s has no assigned task".formatted(workerId)));
    }

    static void requireImplementer(TaskAssignment task, String workerId) {
        if (!task.implementer().equals(workerId)) {
            throw new AssignmentException(TASK_MISMATCH,
                    "task %s is implemented by %s, not %s".formatted(task.taskId(), task.implementer(), workerId));
        }
    }
}
