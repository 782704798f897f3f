package com.agentcrew.orchestrator.handler;

import com.agentcrew.orchestrator.command.Command.SendToWorker;
import com.agentcrew.orchestrator.command.CommandHandler;
import com.agentcrew.orchestrator.command.CommandResult;
import com.agentcrew.orchestrator.command.CommandType;
import com.agentcrew.orchestrator.messaging.WorkerMailbox;
import com.agentcrew.orchestrator.model.ProcessInfo;
import com.agentcrew.orchestrator.runtime.ProcessRuntime;
import com.agentcrew.orchestrator.runtime.ProcessRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Queues a message for a worker and delivers it at once if the worker is ready.
 * A busy worker gets it when its current turn ends.
 */
@Component
public class SendToWorkerHandler implements CommandHandler<SendToWorker> {

    private static final Logger log = LoggerFactory.getLogger(SendToWorkerHandler.class);

    private final ProcessRuntime runtime;
    private final WorkerMailbox  mailbox;

    public SendToWorkerHandler(ProcessRuntime runtime, WorkerMailbox mailbox) {
        this.runtime = runtime;
        this.mailbox = mailbox;
    }

    @Override
    public CommandType type() {
        return CommandType.SEND_TO_WORKER;
    }

    @Override
    public CommandResult handle(SendToWorker command) {
        String workerId = command.workerId();
        ProcessInfo worker = Lookups.activeWorker(runtime, workerId);
        if (!mailbox.offer(workerId, command.message())) {
            return CommandResult.failure("MAILBOX_FULL",
                    "message queue for %s is full (%d pending)".formatted(workerId, mailbox.pending(workerId)));
        }

        try {
            QueuedDelivery.deliverNext(mailbox, runtime, worker);
        } catch (ProcessRuntimeException e) {
            log.warn("Delivery to {} deferred: {}", workerId, e.getMessage());
        }

        int pending = mailbox.pending(workerId);
        if (pending == 0) {
            return CommandResult.success("message sent to " + workerId);
        }
        return CommandResult.success("message queued for %s (%d pending)".formatted(workerId, pending),
                Map.of("queued", true, "pending", pending));
    }
}
