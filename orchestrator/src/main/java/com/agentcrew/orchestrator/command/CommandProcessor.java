package com.agentcrew.orchestrator.command;

import com.agentcrew.orchestrator.assignment.AssignmentException;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

import static com.agentcrew.orchestrator.command.CommandProcessingException.Kind.*;

/**
 * Single-consumer command processor.
 *
 * Producers (HTTP threads, schedulers) enqueue commands into a bounded FIFO queue; one
 * dedicated thread dequeues and runs them one at a time through the handler registered
 * for their {@link CommandType}. Every state change the orchestrator makes passes
 * through here, so handlers never race each other.
 *
 * <p>Each processed command is timed and counted:
 * <pre>
 *   agentcrew.command.duration{type}
 *   agentcrew.command.calls{type, status="success|failure|error"}
 *   agentcrew.command.queue.size
 * </pre>
 *
 * <p>A caller that gives up waiting in {@link #submitAndWait} does not cancel the
 * command: it still executes in order and its result is dropped.
 *
 * <p>{@link #shutdown} lets the command currently executing finish, then fails every
 * command still queued with {@code SHUTDOWN}. Nothing queued is started after that.
 */
public class CommandProcessor {

    private static final Logger log = LoggerFactory.getLogger(CommandProcessor.class);

    public static final int DEFAULT_QUEUE_CAPACITY = 100;

    private static final long POLL_MILLIS = 100;

    private final Map<CommandType, CommandHandler<?>> handlers = new EnumMap<>(CommandType.class);
    private final BlockingQueue<Envelope> queue;
    private final Duration enqueueTimeout;
    private final Duration shutdownTimeout;
    private final MeterRegistry meterRegistry;

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong errors    = new AtomicLong();

    private final Object stateLock = new Object();
    private volatile boolean running;
    private ExecutorService consumer;

    public CommandProcessor(List<CommandHandler<?>> allHandlers,
                            MeterRegistry meterRegistry,
                            int queueCapacity,
                            Duration enqueueTimeout,
                            Duration shutdownTimeout) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queue capacity must be positive: " + queueCapacity);
        }
        this.meterRegistry   = meterRegistry;
        this.queue           = new ArrayBlockingQueue<>(queueCapacity);
        this.enqueueTimeout  = enqueueTimeout;
        this.shutdownTimeout = shutdownTimeout;

        for (CommandHandler<?> handler : allHandlers) {
            CommandHandler<?> previous = handlers.put(handler.type(), handler);
            if (previous != null) {
                throw new IllegalStateException("duplicate handler for " + handler.type() + ": "
                        + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
            }
            log.info("Registered handler {} for {}", handler.getClass().getSimpleName(), handler.type());
        }
        Gauge.builder("agentcrew.command.queue.size", queue, BlockingQueue::size)
                .description("Commands waiting for the processor thread")
                .register(meterRegistry);
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /** Start the consumer thread. Calling start on a running processor does nothing. */
    public void start() {
        synchronized (stateLock) {
            if (running) return;
            running  = true;
            consumer = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "command-processor");
                t.setDaemon(true);
                return t;
            });
            consumer.submit(this::consumeLoop);
            log.info("Command processor started (capacity={}, handlers={})",
                    queue.remainingCapacity() + queue.size(), handlers.size());
        }
    }

    /**
     * Stop accepting commands, wait for the in-flight command to finish, and fail the rest.
     */
    public void shutdown() {
        ExecutorService toStop;
        synchronized (stateLock) {
            if (!running) return;
            running = false;
            toStop  = consumer;
            consumer = null;
        }
        toStop.shutdown();
        try {
            if (!toStop.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("In-flight command did not finish within {}; abandoning it", shutdownTimeout);
                toStop.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            toStop.shutdownNow();
        }

        List<Envelope> pending = new ArrayList<>();
        queue.drainTo(pending);
        for (Envelope envelope : pending) {
            envelope.result.completeExceptionally(new CommandProcessingException(SHUTDOWN,
                    "processor shut down before command " + envelope.id + " ran"));
        }
        log.info("Command processor stopped ({} processed, {} errors, {} pending commands dropped)",
                processed.get(), errors.get(), pending.size());
    }

    public boolean isRunning() {
        return running;
    }

    // ------------------------------------------------------------------
    // Producers
    // ------------------------------------------------------------------

    /**
     * Enqueue a command without waiting for its result.
     *
     * @return the ID assigned to the command
     * @throws CommandProcessingException NOT_RUNNING, QUEUE_FULL or INTERRUPTED
     */
    public String submit(Command command) {
        return enqueue(command).id;
    }

    /**
     * Enqueue a command and wait up to {@code timeout} for its result.
     *
     * @throws CommandProcessingException NOT_RUNNING, QUEUE_FULL, TIMEOUT, SHUTDOWN or INTERRUPTED
     */
    public CommandResult submitAndWait(Command command, Duration timeout) {
        Envelope envelope = enqueue(command);
        try {
            return envelope.result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            envelope.abandoned = true;
            throw new CommandProcessingException(TIMEOUT,
                    "no result for %s %s within %s; query worker state before retrying".formatted(command.type().toolName(), envelope.id, timeout));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            envelope.abandoned = true;
            throw new CommandProcessingException(INTERRUPTED, "interrupted waiting for " + envelope.id, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CommandProcessingException cpe) {
                throw cpe;
            }
            throw new CommandProcessingException(SHUTDOWN, "command " + envelope.id + " failed", e.getCause());
        }
    }

    private Envelope enqueue(Command command) {
        if (!running) {
            throw new CommandProcessingException(NOT_RUNNING, "command processor is not running");
        }
        Envelope envelope = new Envelope(UUID.randomUUID().toString(), command);
        boolean accepted;
        try {
            accepted = queue.offer(envelope, enqueueTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CommandProcessingException(INTERRUPTED, "interrupted while enqueueing", e);
        }
        if (!accepted) {
            throw new CommandProcessingException(QUEUE_FULL,
                    "command queue full (%d pending)".formatted(queue.size()));
        }
        // shutdown may have drained the queue while this offer was blocked
        if (!running && queue.remove(envelope)) {
            throw new CommandProcessingException(SHUTDOWN,
                    "processor shut down before command " + envelope.id + " ran");
        }
        log.debug("Queued {} {}", command.type().toolName(), envelope.id);
        return envelope;
    }

    // ------------------------------------------------------------------
    // Consumer
    // ------------------------------------------------------------------

    private void consumeLoop() {
        while (running) {
            Envelope envelope;
            try {
                envelope = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (envelope == null) continue;

            CommandResult result = process(envelope);
            envelope.result.complete(result);
            if (envelope.abandoned) {
                log.debug("Result of {} discarded; caller stopped waiting", envelope.id);
            }
        }
    }

    CommandResult process(Envelope envelope) {
        Command command = envelope.command;
        String typeTag = command.type().toolName();
        MDC.put("commandId", envelope.id);
        MDC.put("commandType", typeTag);

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            CommandResult result = dispatch(command);
            if (!result.success()) {
                status = "failure";
                errors.incrementAndGet();
                log.info("Command {} failed: {}", typeTag, result.message());
            } else {
                log.info("Command {} succeeded: {}", typeTag, result.message());
            }
            return result;
        } catch (Exception e) {
            status = "error";
            errors.incrementAndGet();
            log.error("Handler for {} threw: {}", typeTag, e.getMessage(), e);
            return CommandResult.failure(CommandResult.HANDLER_ERROR,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            processed.incrementAndGet();
            sample.stop(meterRegistry.timer("agentcrew.command.duration", "type", typeTag));
            meterRegistry.counter("agentcrew.command.calls", "type", typeTag, "status", status).increment();
            MDC.remove("commandId");
            MDC.remove("commandType");
        }
    }

    @SuppressWarnings("unchecked")
    private CommandResult dispatch(Command command) {
        CommandHandler<Command> handler = (CommandHandler<Command>) handlers.get(command.type());
        if (handler == null) {
            return CommandResult.failure(CommandResult.UNKNOWN_COMMAND,
                    "no handler registered for command type " + command.type());
        }
        try {
            return handler.handle(command);
        } catch (AssignmentException e) {
            return CommandResult.failure(e.getKind().name(), e.getMessage());
        } catch (IllegalArgumentException e) {
            return CommandResult.failure(CommandResult.INVALID_ARGUMENT, e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Introspection
    // ------------------------------------------------------------------

    public Set<CommandType> registeredTypes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    public int queueSize() {
        return queue.size();
    }

    public long processedCount() {
        return processed.get();
    }

    public long errorCount() {
        return errors.get();
    }

    static final class Envelope {
        final String id;
        final Command command;
        final CompletableFuture<CommandResult> result = new CompletableFuture<>();
        volatile boolean abandoned;

        Envelope(String id, Command command) {
            this.id = id;
            this.command = command;
        }
    }
}
