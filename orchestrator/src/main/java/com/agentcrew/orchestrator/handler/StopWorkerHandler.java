package com.agentcrew.orchestrator.handler;

import com.agentcrew.orchestrator.assignment.AssignmentStore;
import com.agentcrew.orchestrator.command.Command.StopWorker;
import com.agentcrew.orchestrator.command.CommandHandler;
import com.agentcrew.orchestrator.command.CommandResult;
import com.agentcrew.orchestrator.command.CommandType;
import com.agentcrew.orchestrator.model.WorkerAssignment;
import com.agentcrew.orchestrator.model.WorkerPhase;
import com.agentcrew.orchestrator.runtime.ProcessRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Terminates a worker process.
 *
 * A worker in the middle of a commit is left alone unless {@code force} is set, so a
 * half-written commit is not abandoned by accident.
 */
@Component
public class StopWorkerHandler implements CommandHandler<StopWorker> {

    private static final Logger log = LoggerFactory.getLogger(StopWorkerHandler.class);

    private final AssignmentStore store;
    private final ProcessRuntime  runtime;

    public StopWorkerHandler(AssignmentStore store, ProcessRuntime runtime) {
        this.store   = store;
        this.runtime = runtime;
    }

    @Override
    public CommandType type() {
        return CommandType.STOP_WORKER;
    }

    @Override
    public CommandResult handle(StopWorker command) {
        String workerId = command.workerId();
        if (Lookups.liveWorker(runtime, workerId).isRetired()) {
            return CommandResult.success("worker %s is already stopped".formatted(workerId), Map.of("stopped", false));
        }
        WorkerPhase phase = store.getWorkerAssignment(workerId).map(WorkerAssignment::phase).orElse(WorkerPhase.IDLE);
        if (phase == WorkerPhase.COMMITTING && !command.force()) {
            log.warn("Refusing to stop {} during commit without force", workerId);
            return CommandResult.success(("warning: worker %s is committing; use force to terminate during commit, "
                    + "or wait for the commit to complete").formatted(workerId), Map.of("stopped", false));
        }

        runtime.stop(workerId, command.force());
        store.clearWorkerAssignment(workerId);
        log.info("Stopped worker {} (force={}, reason: {})", workerId, command.force(), command.reason());
        return CommandResult.success("stopped " + workerId, Map.of("stopped", true));
    }
}
