package com.agentcrew.orchestrator.handler;

import com.agentcrew.orchestrator.TestClock;
import com.agentcrew.orchestrator.assignment.AssignmentException;
import com.agentcrew.orchestrator.assignment.AssignmentStore;
import com.agentcrew.orchestrator.command.Command;
import com.agentcrew.orchestrator.command.CommandResult;
import com.agentcrew.orchestrator.messaging.WorkerMailbox;
import com.agentcrew.orchestrator.model.ProcessInfo;
import com.agentcrew.orchestrator.model.ProcessStatus;
import com.agentcrew.orchestrator.model.WorkerAssignment;
import com.agentcrew.orchestrator.model.WorkerPhase;
import com.agentcrew.orchestrator.runtime.ProcessRuntime;
import com.agentcrew.orchestrator.runtime.ProcessRuntimeException;
import com.agentcrew.orchestrator.runtime.dto.SpawnRequest;
import com.agentcrew.orchestrator.runtime.dto.SpawnedProcess;
import com.agentcrew.orchestrator.workflow.WorkflowLifecycle;
import com.agentcrew.orchestrator.workflow.WorkflowOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WorkerLifecycleHandlersTest {

    static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    @Mock ProcessRuntime runtime;

    AssignmentStore store;
    WorkerMailbox mailbox;

    @BeforeEach
    void setUp() {
        store   = new AssignmentStore();
        mailbox = new WorkerMailbox(1000, new SimpleMeterRegistry());
    }

    // ------------------------------------------------------------------
    // stop_worker
    // ------------------------------------------------------------------

    @Test
    void stop_activeWorker_stopsAndClearsAssignment() {
        live("worker-1", ProcessStatus.WORKING);
        store.assignImplementer("worker-1", "perles-abc.1", NOW);

        CommandResult result = new StopWorkerHandler(store, runtime)
                .handle(new Command.StopWorker("worker-1", false, "done"));

        assertThat(result.success()).isTrue();
        assertThat(result.data()).isEqualTo(Map.of("stopped", true));
        verify(runtime).stop("worker-1", false);
        assertThat(store.getWorkerAssignment("worker-1").orElseThrow().hasTask()).isFalse();
        assertThat(store.getTaskAssignment("perles-abc.1")).isPresent();
    }

    @Test
    void stop_alreadyRetired_isNoOp() {
        live("worker-1", ProcessStatus.RETIRED);

        CommandResult result = new StopWorkerHandler(store, runtime)
                .handle(new Command.StopWorker("worker-1", true, null));

        assertThat(result.success()).isTrue();
        verify(runtime, never()).stop(anyString(), anyBoolean());
    }

    @Test
    void stop_duringCommitWithoutForce_warnsAndKeepsWorker() {
        live("worker-1", ProcessStatus.WORKING);
        store.putWorkerAssignment("worker-1",
                WorkerAssignment.implementing("perles-abc.1", NOW).withPhase(WorkerPhase.COMMITTING));

        CommandResult result = new StopWorkerHandler(store, runtime)
                .handle(new Command.StopWorker("worker-1", false, null));

        assertThat(result.message()).startsWith("warning: worker worker-1 is committing");
        assertThat(result.data()).isEqualTo(Map.of("stopped", false));
        verify(runtime, never()).stop(anyString(), anyBoolean());
        assertThat(store.getWorkerAssignment("worker-1").orElseThrow().phase()).isEqualTo(WorkerPhase.COMMITTING);
    }

    @Test
    void stop_duringCommitWithForce_stops() {
        live("worker-1", ProcessStatus.WORKING);
        store.putWorkerAssignment("worker-1",
                WorkerAssignment.implementing("perles-abc.1", NOW).withPhase(WorkerPhase.COMMITTING));

        new StopWorkerHandler(store, runtime).handle(new Command.StopWorker("worker-1", true, "hung"));

        verify(runtime).stop("worker-1", true);
    }

    @Test
    void stop_unknownWorker_isNotFound() {
        when(runtime.find("worker-9")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> new StopWorkerHandler(store, runtime)
                .handle(new Command.StopWorker("worker-9", false, null)))
                .isInstanceOf(AssignmentException.class)
                .hasMessage("worker worker-9 not found");
    }

    // ------------------------------------------------------------------
    // replace_worker / retire_worker
    // ------------------------------------------------------------------

    @Test
    void replace_clearsAssignmentBeforeSpawning() {
        live("worker-1", ProcessStatus.WORKING);
        store.assignImplementer("worker-1", "perles-abc.1", NOW);
        when(runtime.spawn(any())).thenAnswer(inv -> {
            assertThat(store.getWorkerAssignment("worker-1").orElseThrow().hasTask()).isFalse();
            return new SpawnedProcess("worker-7", "session-7");
        });

        CommandResult result = new ReplaceWorkerHandler(store, runtime)
                .handle(new Command.ReplaceWorker("worker-1", "context full"));

        InOrder order = inOrder(runtime);
        order.verify(runtime).stop("worker-1", false);
        order.verify(runtime).spawn(SpawnRequest.worker(null));
        assertThat(result.data()).isEqualTo(Map.of("retired", "worker-1", "workerId", "worker-7"));
        assertThat(store.getTaskAssignment("perles-abc.1").orElseThrow().implementer()).isEqualTo("worker-1");
    }

    @Test
    void replace_spawnFailure_leavesNoStaleAssignment() {
        live("worker-1", ProcessStatus.WORKING);
        store.assignImplementer("worker-1", "perles-abc.1", NOW);
        when(runtime.spawn(any())).thenThrow(new ProcessRuntimeException("no capacity"));

        assertThatThrownBy(() -> new ReplaceWorkerHandler(store, runtime)
                .handle(new Command.ReplaceWorker("worker-1", null)))
                .isInstanceOf(ProcessRuntimeException.class);
        assertThat(store.getWorkerAssignment("worker-1").orElseThrow().hasTask()).isFalse();
    }

    @Test
    void retire_alreadyRetired_isRejected() {
        live("worker-1", ProcessStatus.RETIRED);

        assertThatThrownBy(() -> new RetireWorkerHandler(store, runtime)
                .handle(new Command.RetireWorker("worker-1", null)))
                .hasMessage("worker worker-1 is already retired");
    }

    @Test
    void retire_activeWorker_stopsGracefully() {
        live("worker-1", ProcessStatus.READY);

        new RetireWorkerHandler(store, runtime).handle(new Command.RetireWorker("worker-1", "idle too long"));

        verify(runtime).stop("worker-1", false);
        assertThat(store.getWorkerAssignment("worker-1")).contains(WorkerAssignment.idle());
    }

    // ------------------------------------------------------------------
    // spawn / send / broadcast
    // ------------------------------------------------------------------

    @Test
    void spawn_returnsNewIds() {
        when(runtime.spawn(SpawnRequest.worker("codex"))).thenReturn(new SpawnedProcess("worker-3", "s-3"));

        CommandResult result = new SpawnWorkerHandler(runtime).handle(new Command.SpawnWorker("codex"));

        assertThat(result.message()).isEqualTo("spawned worker worker-3");
        assertThat(result.data()).isEqualTo(new SpawnedProcess("worker-3", "s-3"));
    }

    @Test
    void send_toRetiredWorker_isRejected() {
        live("worker-1", ProcessStatus.RETIRED);

        assertThatThrownBy(() -> new SendToWorkerHandler(runtime, mailbox)
                .handle(new Command.SendToWorker("worker-1", "hello")))
                .hasMessage("worker worker-1 is retired");
        verify(runtime, never()).resume(anyString(), anyString());
        assertThat(mailbox.pending("worker-1")).isZero();
    }

    @Test
    void send_toReadyWorker_resumesAtOnce() {
        live("worker-1", ProcessStatus.READY);

        CommandResult result = new SendToWorkerHandler(runtime, mailbox)
                .handle(new Command.SendToWorker("worker-1", "hello"));

        assertThat(result.message()).isEqualTo("message sent to worker-1");
        verify(runtime).resume("worker-1", "hello");
        assertThat(mailbox.pending("worker-1")).isZero();
    }

    @Test
    void send_toBusyWorker_isQueuedNotResumed() {
        live("worker-1", ProcessStatus.WORKING);

        CommandResult result = new SendToWorkerHandler(runtime, mailbox)
                .handle(new Command.SendToWorker("worker-1", "when you are done"));

        assertThat(result.success()).isTrue();
        assertThat(result.message()).isEqualTo("message queued for worker-1 (1 pending)");
        assertThat(result.data()).isEqualTo(Map.of("queued", true, "pending", 1));
        verify(runtime, never()).resume(anyString(), anyString());
    }

    @Test
    void send_resumeFailure_keepsMessageQueued() {
        live("worker-1", ProcessStatus.READY);
        doThrow(new ProcessRuntimeException("HTTP 500")).when(runtime).resume("worker-1", "hello");

        CommandResult result = new SendToWorkerHandler(runtime, mailbox)
                .handle(new Command.SendToWorker("worker-1", "hello"));

        assertThat(result.message()).isEqualTo("message queued for worker-1 (1 pending)");
        assertThat(mailbox.poll("worker-1")).contains("hello");
    }

    @Test
    void send_fullMailbox_isRejected() {
        mailbox = new WorkerMailbox(1, new SimpleMeterRegistry());
        live("worker-1", ProcessStatus.WORKING);
        SendToWorkerHandler handler = new SendToWorkerHandler(runtime, mailbox);
        handler.handle(new Command.SendToWorker("worker-1", "first"));

        CommandResult result = handler.handle(new Command.SendToWorker("worker-1", "second"));

        assertThat(result.success()).isFalse();
        assertThat(result.errorCode()).isEqualTo("MAILBOX_FULL");
        assertThat(result.message()).isEqualTo("message queue for worker-1 is full (1 pending)");
    }

    @Test
    void deliverQueued_readyWorker_getsOldestMessageOnly() {
        live("worker-1", ProcessStatus.READY);
        mailbox.offer("worker-1", "first");
        mailbox.offer("worker-1", "second");

        CommandResult result = new DeliverQueuedHandler(runtime, mailbox)
                .handle(new Command.DeliverQueued("worker-1"));

        verify(runtime).resume("worker-1", "first");
        verify(runtime, never()).resume("worker-1", "second");
        assertThat(result.message()).isEqualTo("delivered queued message to worker-1 (1 pending)");
        assertThat(result.data()).isEqualTo(Map.of("delivered", true, "pending", 1));
    }

    @Test
    void deliverQueued_busyWorker_waits() {
        live("worker-1", ProcessStatus.WORKING);
        mailbox.offer("worker-1", "first");

        CommandResult result = new DeliverQueuedHandler(runtime, mailbox)
                .handle(new Command.DeliverQueued("worker-1"));

        assertThat(result.data()).isEqualTo(Map.of("delivered", false, "pending", 1));
        verify(runtime, never()).resume(anyString(), anyString());
    }

    @Test
    void deliverQueued_retiredWorker_dropsPending() {
        live("worker-1", ProcessStatus.RETIRED);
        mailbox.offer("worker-1", "first");
        mailbox.offer("worker-1", "second");

        CommandResult result = new DeliverQueuedHandler(runtime, mailbox)
                .handle(new Command.DeliverQueued("worker-1"));

        assertThat(result.message()).isEqualTo("dropped 2 pending messages for worker-1");
        assertThat(mailbox.totalPending()).isZero();
        verify(runtime, never()).resume(anyString(), anyString());
    }

    @Test
    void broadcast_skipsRetired_queuesForBusy() {
        when(runtime.list()).thenReturn(List.of(
                info("worker-1", ProcessStatus.READY),
                info("worker-2", ProcessStatus.WORKING),
                info("worker-3", ProcessStatus.RETIRED)));

        CommandResult result = new BroadcastHandler(runtime, mailbox).handle(new Command.Broadcast("heads up"));

        assertThat(result.success()).isTrue();
        BroadcastHandler.Report report = (BroadcastHandler.Report) result.data();
        assertThat(report.recipients()).containsExactly("worker-1", "worker-2");
        assertThat(report.failures()).isEmpty();
        verify(runtime).resume("worker-1", "heads up");
        verify(runtime, never()).resume(eq("worker-2"), anyString());
        verify(runtime, never()).resume(eq("worker-3"), anyString());
        assertThat(mailbox.pending("worker-2")).isEqualTo(1);
        assertThat(mailbox.pending("worker-3")).isZero();
    }

    @Test
    void broadcast_fullMailbox_isReportedAsFailure() {
        mailbox = new WorkerMailbox(1, new SimpleMeterRegistry());
        mailbox.offer("worker-2", "earlier");
        when(runtime.list()).thenReturn(List.of(
                info("worker-1", ProcessStatus.READY),
                info("worker-2", ProcessStatus.WORKING)));

        CommandResult result = new BroadcastHandler(runtime, mailbox).handle(new Command.Broadcast("heads up"));

        BroadcastHandler.Report report = (BroadcastHandler.Report) result.data();
        assertThat(result.message()).isEqualTo("broadcast sent to 1 workers, 1 failed");
        assertThat(report.recipients()).containsExactly("worker-1");
        assertThat(report.failures()).containsEntry("worker-2", "message queue full");
    }

    @Test
    void broadcast_noActiveWorkers_fails() {
        when(runtime.list()).thenReturn(List.of(info("worker-1", ProcessStatus.RETIRED)));

        CommandResult result = new BroadcastHandler(runtime, mailbox).handle(new Command.Broadcast("x"));

        assertThat(result.success()).isFalse();
        assertThat(result.message()).isEqualTo("no active workers to broadcast to");
    }

    // ------------------------------------------------------------------
    // signal_workflow_complete
    // ------------------------------------------------------------------

    @Test
    void signal_acceptedOnce() {
        SignalWorkflowCompleteHandler handler =
                new SignalWorkflowCompleteHandler(new WorkflowLifecycle(new TestClock(NOW)));

        CommandResult first  = handler.handle(new Command.SignalWorkflowComplete(WorkflowOutcome.SUCCESS, "all done"));
        CommandResult second = handler.handle(new Command.SignalWorkflowComplete(WorkflowOutcome.ABORTED, "oops"));

        assertThat(first.success()).isTrue();
        assertThat(((WorkflowLifecycle.Completion) first.data()).completedAt()).isEqualTo(NOW);
        assertThat(second.success()).isFalse();
        assertThat(second.message()).contains("SUCCESS");
    }

    private void live(String id, ProcessStatus status) {
        when(runtime.find(id)).thenReturn(Optional.of(info(id, status)));
    }

    private static ProcessInfo info(String id, ProcessStatus status) {
        return new ProcessInfo(id, status, null, null, null);
    }
}
