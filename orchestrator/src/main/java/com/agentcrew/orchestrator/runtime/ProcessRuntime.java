package com.agentcrew.orchestrator.runtime;

import com.agentcrew.orchestrator.model.ProcessInfo;
import com.agentcrew.orchestrator.runtime.dto.SpawnRequest;
import com.agentcrew.orchestrator.runtime.dto.SpawnedProcess;

import java.util.List;
import java.util.Optional;

/**
 * The layer that actually starts, resumes and stops AI worker processes.
 *
 * The orchestrator never touches OS processes itself; it only calls this contract.
 * Mutating calls are made exclusively from command handlers, i.e. from the single
 * command-processor thread. Queries may come from any thread.
 *
 * @throws ProcessRuntimeException from every method on transport or runtime failure
 */
public interface ProcessRuntime {

    /** Start a new worker process and return its IDs. */
    SpawnedProcess spawn(SpawnRequest request);

    /** Deliver a message to an existing process, starting a new AI turn. */
    void resume(String processId, String message);

    /**
     * Terminate a process. With {@code force=false} the runtime allows a grace period
     * for the current turn to finish; with {@code force=true} it kills immediately.
     * The process is reported as RETIRED afterwards.
     */
    void stop(String processId, boolean force);

    /** Look up one process in the live process set. */
    Optional<ProcessInfo> find(String processId);

    /** Snapshot of the live process set, retired processes included. */
    List<ProcessInfo> list();
}
