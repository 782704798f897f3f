package com.agentcrew.orchestrator.handler;

import com.agentcrew.orchestrator.assignment.AssignmentException;
import com.agentcrew.orchestrator.assignment.AssignmentStore;
import com.agentcrew.orchestrator.command.Command.RetireWorker;
import com.agentcrew.orchestrator.command.CommandHandler;
import com.agentcrew.orchestrator.command.CommandResult;
import com.agentcrew.orchestrator.command.CommandType;
import com.agentcrew.orchestrator.runtime.ProcessRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class RetireWorkerHandler implements CommandHandler<RetireWorker> {

    private static final Logger log = LoggerFactory.getLogger(RetireWorkerHandler.class);

    private final AssignmentStore store;
    private final ProcessRuntime  runtime;

    public RetireWorkerHandler(AssignmentStore store, ProcessRuntime runtime) {
        this.store   = store;
        this.runtime = runtime;
    }

    @Override
    public CommandType type() {
        return CommandType.RETIRE_WORKER;
    }

    @Override
    public CommandResult handle(RetireWorker command) {
        String workerId = command.workerId();
        if (Lookups.liveWorker(runtime, workerId).isRetired()) {
            throw new AssignmentException(AssignmentException.Kind.INVALID_STATE,
                    "worker %s is already retired".formatted(workerId));
        }
        runtime.stop(workerId, false);
        store.clearWorkerAssignment(workerId);
        log.info("Retired worker {} (reason: {})", workerId, command.reason());
        return CommandResult.success("retired " + workerId);
    }
}
