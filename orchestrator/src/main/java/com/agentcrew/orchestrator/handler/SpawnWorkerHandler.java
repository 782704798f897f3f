package com.agentcrew.orchestrator.handler;

import com.agentcrew.orchestrator.command.Command.SpawnWorker;
import com.agentcrew.orchestrator.command.CommandHandler;
import com.agentcrew.orchestrator.command.CommandResult;
import com.agentcrew.orchestrator.command.CommandType;
import com.agentcrew.orchestrator.runtime.ProcessRuntime;
import com.agentcrew.orchestrator.runtime.dto.SpawnRequest;
import com.agentcrew.orchestrator.runtime.dto.SpawnedProcess;
import org.springframework.stereotype.Component;

@Component
public class SpawnWorkerHandler implements CommandHandler<SpawnWorker> {

    private final ProcessRuntime runtime;

    public SpawnWorkerHandler(ProcessRuntime runtime) {
        this.runtime = runtime;
    }

    @Override
    public CommandType type() {
        return CommandType.SPAWN_WORKER;
    }

    @Override
    public CommandResult handle(SpawnWorker command) {
        SpawnedProcess spawned = runtime.spawn(SpawnRequest.worker(command.agentType()));
        return CommandResult.success("spawned worker " + spawned.processId(), spawned);
    }
}
