package com.agentcrew.orchestrator.handler;

import com.agentcrew.orchestrator.assignment.AssignmentStore;
import com.agentcrew.orchestrator.command.Command.ReplaceWorker;
import com.agentcrew.orchestrator.command.CommandHandler;
import com.agentcrew.orchestrator.command.CommandResult;
import com.agentcrew.orchestrator.command.CommandType;
import com.agentcrew.orchestrator.model.ProcessInfo;
import com.agentcrew.orchestrator.runtime.ProcessRuntime;
import com.agentcrew.orchestrator.runtime.dto.SpawnRequest;
import com.agentcrew.orchestrator.runtime.dto.SpawnedProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Retires a worker and starts a fresh one in its place.
 *
 * The old worker's assignment is cleared before the spawn is attempted, so a failed
 * spawn never leaves a stale assignment behind. Its task assignment is left as is
 * for the consistency monitor to report.
 */
@Component
public class ReplaceWorkerHandler implements CommandHandler<ReplaceWorker> {

    private static final Logger log = LoggerFactory.getLogger(ReplaceWorkerHandler.class);

    private final AssignmentStore store;
    private final ProcessRuntime  runtime;

    public ReplaceWorkerHandler(AssignmentStore store, ProcessRuntime runtime) {
        this.store   = store;
        this.runtime = runtime;
    }

    @Override
    public CommandType type() {
        return CommandType.REPLACE_WORKER;
    }

    @Override
    public CommandResult handle(ReplaceWorker command) {
        String workerId = command.workerId();
        ProcessInfo old = Lookups.liveWorker(runtime, workerId);
        if (!old.isRetired()) {
            runtime.stop(workerId, false);
        }
        store.clearWorkerAssignment(workerId);
        log.info("Retired worker {} for replacement (reason: {})", workerId, command.reason());

        SpawnedProcess spawned = runtime.spawn(SpawnRequest.worker(null));
        return CommandResult.success("replaced %s with %s".formatted(workerId, spawned.processId()),
                Map.of("retired", workerId, "workerId", spawned.processId()));
    }
}
