package com.agentcrew.orchestrator.model;

/**
 * One entry of the live process set, as reported by the process runtime.
 *
 * @param id        Worker ID (e.g. "worker-1")
 * @param status    Liveness status
 * @param phase     Phase the runtime last saw; may lag behind the assignment store
 * @param taskId    Task the runtime last saw; empty when none
 * @param sessionId AI session the process resumes into; null until the process has started
 */
public record ProcessInfo(
        String        id,
        ProcessStatus status,
        WorkerPhase   phase,
        String        taskId,
        String        sessionId) {

    public boolean isRetired() { return status == ProcessStatus.RETIRED; }
    public boolean isReady()   { return status == ProcessStatus.READY; }
}
