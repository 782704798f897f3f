package com.agentcrew.orchestrator.handler;

import com.agentcrew.orchestrator.command.Command.SignalWorkflowComplete;
import com.agentcrew.orchestrator.command.CommandHandler;
import com.agentcrew.orchestrator.command.CommandResult;
import com.agentcrew.orchestrator.command.CommandType;
import com.agentcrew.orchestrator.workflow.WorkflowLifecycle;
import org.springframework.stereotype.Component;

@Component
public class SignalWorkflowCompleteHandler implements CommandHandler<SignalWorkflowComplete> {

    private final WorkflowLifecycle lifecycle;

    public SignalWorkflowCompleteHandler(WorkflowLifecycle lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public CommandType type() {
        return CommandType.SIGNAL_WORKFLOW_COMPLETE;
    }

    @Override
    public CommandResult handle(SignalWorkflowComplete command) {
        return lifecycle.complete(command.outcome(), command.summary())
                .map(c -> CommandResult.success("workflow completed: " + c.outcome(), c))
                .orElseGet(() -> CommandResult.failure("ALREADY_SIGNALLED",
                        "workflow already signalled complete (" + lifecycle.completion().map(c -> c.outcome().name()).orElse("?") + ")"));
    }
}
