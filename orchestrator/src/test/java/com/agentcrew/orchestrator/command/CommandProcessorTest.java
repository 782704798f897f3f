package com.agentcrew.orchestrator.command;

import com.agentcrew.orchestrator.assignment.AssignmentException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Exercises the processor with small in-test handlers; no Spring context.
 */
class CommandProcessorTest {

    SimpleMeterRegistry meters = new SimpleMeterRegistry();
    CommandProcessor processor;

    @AfterEach
    void tearDown() {
        if (processor != null) processor.shutdown();
    }

    // ------------------------------------------------------------------
    // Dispatch
    // ------------------------------------------------------------------

    @Test
    void submitAndWait_returnsHandlerResult() {
        processor = started(handler(CommandType.SEND_TO_WORKER,
                c -> CommandResult.success("sent to " + ((Command.SendToWorker) c).workerId())));

        CommandResult result = processor.submitAndWait(new Command.SendToWorker("worker-1", "hi"), Duration.ofSeconds(5));

        assertThat(result.success()).isTrue();
        assertThat(result.message()).isEqualTo("sent to worker-1");
    }

    @Test
    void unregisteredType_synthesizesFailure() {
        processor = started();

        CommandResult result = processor.submitAndWait(new Command.Broadcast("hi"), Duration.ofSeconds(5));

        assertThat(result.success()).isFalse();
        assertThat(result.errorCode()).isEqualTo(CommandResult.UNKNOWN_COMMAND);
        assertThat(result.message()).contains("BROADCAST");
    }

    @Test
    void assignmentFailure_becomesResultWithKind() {
        processor = started(handler(CommandType.ASSIGN_TASK, c -> {
            throw new AssignmentException(AssignmentException.Kind.ALREADY_ASSIGNED,
                    "task perles-abc.1 already assigned to worker-1");
        }));

        CommandResult result = processor.submitAndWait(
                new Command.AssignTask("worker-2", "perles-abc.1", null), Duration.ofSeconds(5));

        assertThat(result.success()).isFalse();
        assertThat(result.errorCode()).isEqualTo("ALREADY_ASSIGNED");
        assertThat(result.message()).isEqualTo("task perles-abc.1 already assigned to worker-1");
    }

    @Test
    void crashingHandler_doesNotStopTheLoop() {
        AtomicInteger calls = new AtomicInteger();
        processor = started(handler(CommandType.BROADCAST, c -> {
            if (calls.incrementAndGet() == 1) throw new IllegalStateException("boom");
            return CommandResult.success("ok");
        }));

        CommandResult first  = processor.submitAndWait(new Command.Broadcast("a"), Duration.ofSeconds(5));
        CommandResult second = processor.submitAndWait(new Command.Broadcast("b"), Duration.ofSeconds(5));

        assertThat(first.success()).isFalse();
        assertThat(first.errorCode()).isEqualTo(CommandResult.HANDLER_ERROR);
        assertThat(first.message()).isEqualTo("boom");
        assertThat(second.success()).isTrue();
        assertThat(processor.errorCount()).isEqualTo(1);
        assertThat(meters.counter("agentcrew.command.calls", "type", "broadcast", "status", "error").count()).isEqualTo(1.0);
        assertThat(meters.counter("agentcrew.command.calls", "type", "broadcast", "status", "success").count()).isEqualTo(1.0);
    }

    @Test
    void commands_runInSubmissionOrder_oneAtATime() throws Exception {
        List<String> seen = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(20);
        processor = started(handler(CommandType.SEND_TO_WORKER, c -> {
            int now = concurrent.incrementAndGet();
            maxConcurrent.accumulateAndGet(now, Math::max);
            seen.add(((Command.SendToWorker) c).message());
            concurrent.decrementAndGet();
            done.countDown();
            return CommandResult.success("ok");
        }));

        for (int i = 0; i < 20; i++) {
            processor.submit(new Command.SendToWorker("worker-1", "m" + i));
        }

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 20; i++) expected.add("m" + i);
        assertThat(seen).containsExactlyElementsOf(expected);
        assertThat(maxConcurrent.get()).isEqualTo(1);
    }

    @Test
    void handler_seesCommandContextInMdc() {
        processor = started(handler(CommandType.SPAWN_WORKER,
                c -> CommandResult.success(MDC.get("commandType") + "|" + (MDC.get("commandId") != null))));

        CommandResult result = processor.submitAndWait(new Command.SpawnWorker(null), Duration.ofSeconds(5));

        assertThat(result.message()).isEqualTo("spawn_worker|true");
    }

    // ------------------------------------------------------------------
    // Timeouts, backpressure, lifecycle
    // ------------------------------------------------------------------

    @Test
    void timedOutCommand_stillExecutes() throws Exception {
        CountDownLatch release  = new CountDownLatch(1);
        CountDownLatch executed = new CountDownLatch(1);
        processor = started(handler(CommandType.SEND_TO_WORKER, c -> {
            await(release);
            executed.countDown();
            return CommandResult.success("late");
        }));

        assertThatThrownBy(() -> processor.submitAndWait(new Command.SendToWorker("worker-1", "x"), Duration.ofMillis(100)))
                .isInstanceOf(CommandProcessingException.class)
                .matches(e -> ((CommandProcessingException) e).getKind() == CommandProcessingException.Kind.TIMEOUT);

        release.countDown();
        assertThat(executed.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void fullQueue_rejectsWithQueueFull() {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        processor = new CommandProcessor(List.of(handler(CommandType.SEND_TO_WORKER, c -> {
            started.countDown();
            await(release);
            return CommandResult.success("ok");
        })), meters, 2, Duration.ofMillis(50), Duration.ofSeconds(5));
        processor.start();

        try {
            processor.submit(new Command.SendToWorker("worker-1", "in-flight"));
            await(started);
            processor.submit(new Command.SendToWorker("worker-1", "q1"));
            processor.submit(new Command.SendToWorker("worker-1", "q2"));

            assertThatThrownBy(() -> processor.submit(new Command.SendToWorker("worker-1", "q3")))
                    .isInstanceOf(CommandProcessingException.class)
                    .hasMessageContaining("QUEUE_FULL");
            assertThat(processor.queueSize()).isEqualTo(2);
            assertThat(meters.get("agentcrew.command.queue.size").gauge().value()).isEqualTo(2.0);
        } finally {
            release.countDown();
        }
    }

    @Test
    void notStarted_rejectsWithNotRunning() {
        processor = new CommandProcessor(List.of(), meters, 10, Duration.ofMillis(50), Duration.ofSeconds(1));

        assertThatThrownBy(() -> processor.submit(new Command.Broadcast("x")))
                .isInstanceOf(CommandProcessingException.class)
                .matches(e -> ((CommandProcessingException) e).getKind() == CommandProcessingException.Kind.NOT_RUNNING);
    }

    @Test
    void shutdown_finishesInFlight_andFailsPending() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        AtomicInteger executed = new AtomicInteger();
        processor = started(handler(CommandType.SEND_TO_WORKER, c -> {
            started.countDown();
            await(release);
            executed.incrementAndGet();
            return CommandResult.success("ok");
        }));

        processor.submit(new Command.SendToWorker("worker-1", "in-flight"));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        List<Throwable> pendingFailures = Collections.synchronizedList(new ArrayList<>());
        Thread waiter = new Thread(() -> {
            try {
                processor.submitAndWait(new Command.SendToWorker("worker-1", "pending"), Duration.ofSeconds(10));
            } catch (CommandProcessingException e) {
                pendingFailures.add(e);
            }
        });
        waiter.start();
        while (processor.queueSize() == 0) Thread.sleep(5);

        Thread stopper = new Thread(processor::shutdown);
        stopper.start();
        Thread.sleep(50);
        release.countDown();
        stopper.join(5000);
        waiter.join(5000);

        assertThat(executed.get()).isEqualTo(1);
        assertThat(pendingFailures).singleElement()
                .matches(e -> ((CommandProcessingException) e).getKind() == CommandProcessingException.Kind.SHUTDOWN);
        assertThat(processor.isRunning()).isFalse();
        assertThatThrownBy(() -> processor.submit(new Command.Broadcast("late")))
                .hasMessageContaining("NOT_RUNNING");
    }

    @Test
    void offerUnblockedByShutdownDrain_failsWithShutdown() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        processor = new CommandProcessor(List.of(handler(CommandType.SEND_TO_WORKER, c -> {
            started.countDown();
            await(release);
            return CommandResult.success("ok");
        })), meters, 1, Duration.ofSeconds(5), Duration.ofSeconds(5));
        processor.start();

        processor.submit(new Command.SendToWorker("worker-1", "in-flight"));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        processor.submit(new Command.SendToWorker("worker-1", "fills the queue"));

        // blocks in offer: the queue holds one command
        List<Throwable> failures = Collections.synchronizedList(new ArrayList<>());
        Thread blocked = new Thread(() -> {
            try {
                processor.submitAndWait(new Command.SendToWorker("worker-1", "late"), Duration.ofSeconds(10));
            } catch (CommandProcessingException e) {
                failures.add(e);
            }
        });
        blocked.start();
        while (blocked.getState() != Thread.State.TIMED_WAITING) Thread.sleep(5);

        Thread stopper = new Thread(processor::shutdown);
        stopper.start();
        while (processor.isRunning()) Thread.sleep(5);
        release.countDown();
        stopper.join(5000);
        blocked.join(5000);

        assertThat(blocked.isAlive()).isFalse();
        assertThat(failures).singleElement()
                .matches(e -> ((CommandProcessingException) e).getKind() == CommandProcessingException.Kind.SHUTDOWN);
        assertThat(processor.queueSize()).isZero();
    }

    @Test
    void duplicateHandlerRegistration_failsFast() {
        assertThatThrownBy(() -> new CommandProcessor(List.of(
                handler(CommandType.BROADCAST, c -> CommandResult.success("a")),
                handler(CommandType.BROADCAST, c -> CommandResult.success("b"))),
                meters, 10, Duration.ofMillis(50), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("duplicate handler for BROADCAST");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private CommandProcessor started(CommandHandler<?>... handlers) {
        CommandProcessor p = new CommandProcessor(List.of(handlers), meters, 100,
                Duration.ofMillis(200), Duration.ofSeconds(5));
        p.start();
        return p;
    }

    private static CommandHandler<Command> handler(CommandType type, Function<Command, CommandResult> body) {
        return new CommandHandler<>() {
            @Override public CommandType type() { return type; }
            @Override public CommandResult handle(Command command) { return body.apply(command); }
        };
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) throw new IllegalStateException("latch timed out");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
