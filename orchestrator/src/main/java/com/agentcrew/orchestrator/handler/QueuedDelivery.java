package com.agentcrew.orchestrator.handler;

import com.agentcrew.orchestrator.messaging.WorkerMailbox;
import com.agentcrew.orchestrator.model.ProcessInfo;
import com.agentcrew.orchestrator.runtime.ProcessRuntime;
import com.agentcrew.orchestrator.runtime.ProcessRuntimeException;

import java.util.Optional;

/** Hands a ready worker the head of its mailbox. */
final class QueuedDelivery {

    private QueuedDelivery() {}

    /**
     * @return true if a message was delivered; false if the worker is busy or has
     *         nothing pending
     * @throws ProcessRuntimeException if the resume fails; the message is back at the
     *                                 head of the mailbox
     */
    static boolean deliverNext(WorkerMailbox mailbox, ProcessRuntime runtime, ProcessInfo worker) {
        if (!worker.isReady()) {
            return false;
        }
        Optional<String> next = mailbox.poll(worker.id());
        if (next.isEmpty()) {
            return false;
        }
        try {
            runtime.resume(worker.id(), next.get());
            return true;
        } catch (ProcessRuntimeException e) {
            mailbox.pushBack(worker.id(), next.get());
            throw e;
        }
    }
}
