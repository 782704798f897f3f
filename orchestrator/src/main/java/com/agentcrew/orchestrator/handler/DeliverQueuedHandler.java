package com.agentcrew.orchestrator.handler;

import com.agentcrew.orchestrator.command.Command.DeliverQueued;
import com.agentcrew.orchestrator.command.CommandHandler;
import com.agentcrew.orchestrator.command.CommandResult;
import com.agentcrew.orchestrator.command.CommandType;
import com.agentcrew.orchestrator.messaging.WorkerMailbox;
import com.agentcrew.orchestrator.model.ProcessInfo;
import com.agentcrew.orchestrator.runtime.ProcessRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Delivers the oldest pending message to a worker that has become ready. Messages
 * for a worker that has gone or retired are dropped.
 */
@Component
public class DeliverQueuedHandler implements CommandHandler<DeliverQueued> {

    private static final Logger log = LoggerFactory.getLogger(DeliverQueuedHandler.class);

    private final ProcessRuntime runtime;
    private final WorkerMailbox  mailbox;

    public DeliverQueuedHandler(ProcessRuntime runtime, WorkerMailbox mailbox) {
        this.runtime = runtime;
        this.mailbox = mailbox;
    }

    @Override
    public CommandType type() {
        return CommandType.DELIVER_QUEUED;
    }

    @Override
    public CommandResult handle(DeliverQueued command) {
        String workerId = command.workerId();
        Optional<ProcessInfo> worker = runtime.find(workerId);
        if (worker.isEmpty() || worker.get().isRetired()) {
            List<String> dropped = mailbox.discard(workerId);
            if (!dropped.isEmpty()) {
                log.warn("Dropped {} pending messages for departed worker {}", dropped.size(), workerId);
            }
            return CommandResult.success("dropped %d pending messages for %s".formatted(dropped.size(), workerId),
                    Map.of("delivered", false, "dropped", dropped.size()));
        }

        boolean delivered = QueuedDelivery.deliverNext(mailbox, runtime, worker.get());
        int pending = mailbox.pending(workerId);
        String message = delivered
                ? "delivered queued message to %s (%d pending)".formatted(workerId, pending)
                : "%s not ready; %d pending".formatted(workerId, pending);
        return CommandResult.success(message, Map.of("delivered", delivered, "pending", pending));
    }
}
