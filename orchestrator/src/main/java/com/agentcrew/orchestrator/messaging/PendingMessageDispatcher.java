package com.agentcrew.orchestrator.messaging;

import com.agentcrew.orchestrator.command.Command;
import com.agentcrew.orchestrator.command.CommandProcessingException;
import com.agentcrew.orchestrator.command.CommandProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically queues a delivery attempt for every worker with pending messages.
 *
 * The attempt itself runs on the command processor, which checks that the worker is
 * ready before handing anything over; this class only decides when to ask.
 */
@Component
@EnableScheduling
public class PendingMessageDispatcher {

    private static final Logger log = LoggerFactory.getLogger(PendingMessageDispatcher.class);

    private final WorkerMailbox    mailbox;
    private final CommandProcessor processor;

    public PendingMessageDispatcher(WorkerMailbox mailbox, CommandProcessor processor) {
        this.mailbox   = mailbox;
        this.processor = processor;
    }

    @Scheduled(fixedDelayString = "${agentcrew.messaging.delivery-interval-ms:1000}")
    public void dispatch() {
        for (String workerId : mailbox.workersWithPending()) {
            try {
                processor.submit(new Command.DeliverQueued(workerId));
            } catch (CommandProcessingException e) {
                // queue full or shutting down: retry on the next tick
                log.warn("Could not queue delivery for {}: {}", workerId, e.getMessage());
                return;
            }
        }
    }
}
