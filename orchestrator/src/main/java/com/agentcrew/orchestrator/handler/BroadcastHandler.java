package com.agentcrew.orchestrator.handler;

import com.agentcrew.orchestrator.command.Command.Broadcast;
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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Queues one message for every worker that is not retired and delivers it at once to
 * those that are ready.
 *
 * A worker whose mailbox is full is reported as a failure and does not stop delivery
 * to the others; the command succeeds if at least one worker accepted the message.
 */
@Component
public class BroadcastHandler implements CommandHandler<Broadcast> {

    private static final Logger log = LoggerFactory.getLogger(BroadcastHandler.class);

    public record Report(List<String> recipients, Map<String, String> failures) {}

    private final ProcessRuntime runtime;
    private final WorkerMailbox  mailbox;

    public BroadcastHandler(ProcessRuntime runtime, WorkerMailbox mailbox) {
        this.runtime = runtime;
        this.mailbox = mailbox;
    }

    @Override
    public CommandType type() {
        return CommandType.BROADCAST;
    }

    @Override
    public CommandResult handle(Broadcast command) {
        List<ProcessInfo> targets = runtime.list().stream()
                .filter(p -> !p.isRetired())
                .sorted(Comparator.comparing(ProcessInfo::id))
                .toList();
        if (targets.isEmpty()) {
            return CommandResult.failure("NO_WORKERS", "no active workers to broadcast to");
        }

        List<String> recipients = new ArrayList<>();
        Map<String, String> failures = new TreeMap<>();
        for (ProcessInfo worker : targets) {
            String workerId = worker.id();
            if (!mailbox.offer(workerId, command.message())) {
                log.warn("Broadcast to {} dropped: mailbox full", workerId);
                failures.put(workerId, "message queue full");
                continue;
            }
            recipients.add(workerId);
            try {
                QueuedDelivery.deliverNext(mailbox, runtime, worker);
            } catch (ProcessRuntimeException e) {
                log.warn("Broadcast delivery to {} deferred: {}", workerId, e.getMessage());
            }
        }

        Report report = new Report(List.copyOf(recipients), failures);
        if (recipients.isEmpty()) {
            return new CommandResult(false, "broadcast reached no workers", report, "BROADCAST_FAILED");
        }
        String message = failures.isEmpty()
                ? "broadcast sent to %d workers".formatted(recipients.size())
                : "broadcast sent to %d workers, %d failed".formatted(recipients.size(), failures.size());
        return CommandResult.success(message, report);
    }
}
