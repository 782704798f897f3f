package com.agentcrew.orchestrator.service;

import com.agentcrew.orchestrator.model.ProcessStatus;
import com.agentcrew.orchestrator.model.TaskAssignment;
import com.agentcrew.orchestrator.model.WorkerAssignment;

import java.util.List;

/**
 * Read-only view returned by {@code query_worker_state}.
 */
public record WorkerStateSnapshot(List<Worker> workers, List<TaskAssignment> tasks) {

    /**
     * @param status process status from the runtime; null when the runtime no longer lists the worker
     */
    public record Worker(String workerId, ProcessStatus status, WorkerAssignment assignment) {}
}
