package com.agentcrew.orchestrator.messaging;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-worker FIFO of messages waiting for the worker to finish its current turn.
 *
 * Every message to a worker goes through here first; it is handed over only while
 * the worker is ready, one message per turn. Queues are created on first use and
 * removed once empty.
 */
@Component
public class WorkerMailbox {

    private final Object lock = new Object();
    private final Map<String, Deque<String>> queues = new HashMap<>();

    private final int maxPending;

    public WorkerMailbox(@Value("${agentcrew.messaging.max-pending:1000}") int maxPending,
                         MeterRegistry meterRegistry) {
        this.maxPending = maxPending;
        Gauge.builder("agentcrew.messaging.pending", this, WorkerMailbox::totalPending)
                .description("Messages waiting for a worker to become ready")
                .register(meterRegistry);
    }

    /** @return false if the worker already has {@code max-pending} messages waiting */
    public boolean offer(String workerId, String message) {
        synchronized (lock) {
            Deque<String> queue = queues.computeIfAbsent(workerId, id -> new ArrayDeque<>());
            if (queue.size() >= maxPending) {
                return false;
            }
            queue.addLast(message);
            return true;
        }
    }

    public Optional<String> poll(String workerId) {
        synchronized (lock) {
            Deque<String> queue = queues.get(workerId);
            if (queue == null) {
                return Optional.empty();
            }
            String next = queue.pollFirst();
            if (queue.isEmpty()) {
                queues.remove(workerId);
            }
            return Optional.ofNullable(next);
        }
    }

    /** Put a message that could not be delivered back at the head of the queue. */
    public void pushBack(String workerId, String message) {
        synchronized (lock) {
            queues.computeIfAbsent(workerId, id -> new ArrayDeque<>()).addFirst(message);
        }
    }

    public int pending(String workerId) {
        synchronized (lock) {
            Deque<String> queue = queues.get(workerId);
            return queue == null ? 0 : queue.size();
        }
    }

    public int totalPending() {
        synchronized (lock) {
            return queues.values().stream().mapToInt(Deque::size).sum();
        }
    }

    /** Workers with at least one message waiting, sorted by ID. */
    public List<String> workersWithPending() {
        synchronized (lock) {
            List<String> ids = new ArrayList<>(queues.keySet());
            ids.sort(null);
            return ids;
        }
    }

    /** Drop everything queued for a worker that will never be ready again. */
    public List<String> discard(String workerId) {
        synchronized (lock) {
            Deque<String> queue = queues.remove(workerId);
            return queue == null ? List.of() : List.copyOf(queue);
        }
    }
}
