package com.agentcrew.orchestrator.service;

import com.agentcrew.orchestrator.assignment.AssignmentException;
import com.agentcrew.orchestrator.assignment.AssignmentStore;
import com.agentcrew.orchestrator.assignment.AssignmentValidator;
import com.agentcrew.orchestrator.command.Command;
import com.agentcrew.orchestrator.command.CommandProcessingException;
import com.agentcrew.orchestrator.command.CommandProcessor;
import com.agentcrew.orchestrator.command.CommandResult;
import com.agentcrew.orchestrator.command.ReviewType;
import com.agentcrew.orchestrator.command.Verdict;
import com.agentcrew.orchestrator.dedup.MessageDeduplicator;
import com.agentcrew.orchestrator.model.ProcessInfo;
import com.agentcrew.orchestrator.model.ProcessStatus;
import com.agentcrew.orchestrator.model.TaskAssignment;
import com.agentcrew.orchestrator.model.WorkerAssignment;
import com.agentcrew.orchestrator.runtime.ProcessRuntime;
import com.agentcrew.orchestrator.runtime.ProcessRuntimeException;
import com.agentcrew.orchestrator.tracker.TaskTrackerException;
import com.agentcrew.orchestrator.workflow.WorkflowOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Entry point for every coordinator and worker tool call.
 *
 * Each mutating call follows the same path:
 * <ol>
 *   <li>Input validation (required fields, task ID format). Failures never reach the queue.</li>
 *   <li>Provisional assignment check against the store. A pass here can still lose a race;
 *       the handler repeats the check before writing.</li>
 *   <li>Build the command and submit it: {@code stop_worker} is fire-and-forget, everything
 *       else waits for its result up to the configured timeout.</li>
 * </ol>
 *
 * {@code query_worker_state} reads the store directly and never queues anything.
 */
@Service
public class OrchestrationService {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationService.class);

    static final String BROADCAST_KEY = "*broadcast*";

    private final AssignmentStore     store;
    private final AssignmentValidator validator;
    private final CommandProcessor    processor;
    private final MessageDeduplicator deduplicator;
    private final ProcessRuntime      runtime;
    private final Duration            submitTimeout;

    public OrchestrationService(AssignmentStore store,
                                AssignmentValidator validator,
                                CommandProcessor processor,
                                MessageDeduplicator deduplicator,
                                ProcessRuntime runtime,
                                @Value("${agentcrew.processor.submit-timeout:30s}") Duration submitTimeout) {
        this.store         = store;
        this.validator     = validator;
        this.processor     = processor;
        this.deduplicator  = deduplicator;
        this.runtime       = runtime;
        this.submitTimeout = submitTimeout;
    }

    // ------------------------------------------------------------------
    // Worker lifecycle
    // ------------------------------------------------------------------

    public ToolResult spawnWorker(String agentType) {
        return guarded(() -> await(new Command.SpawnWorker(blankToNull(agentType))));
    }

    public ToolResult replaceWorker(String workerId, String reason) {
        return guarded(() -> await(new Command.ReplaceWorker(required(workerId, "worker_id"), reason)));
    }

    public ToolResult retireWorker(String workerId, String reason) {
        return guarded(() -> await(new Command.RetireWorker(required(workerId, "worker_id"), reason)));
    }

    /** Fire-and-forget: the returned result only says the stop was queued. */
    public ToolResult stopWorker(String workerId, boolean force, String reason) {
        return guarded(() -> {
            String id = required(workerId, "worker_id");
            String commandId = processor.submit(new Command.StopWorker(id, force, reason));
            return ToolResult.ok("stop requested for " + id, Map.of("commandId", commandId));
        });
    }

    // ------------------------------------------------------------------
    // Messaging
    // ------------------------------------------------------------------

    /**
     * Deliver a message to one worker. An identical message to the same worker inside
     * the dedup window is reported as sent without resuming the worker again.
     */
    public ToolResult sendToWorker(String workerId, String message) {
        return guarded(() -> {
            String id   = required(workerId, "worker_id");
            String body = required(message, "message");
            if (deduplicator.isDuplicate(id, body)) {
                return ToolResult.ok("message sent to " + id + " (duplicate suppressed)");
            }
            ToolResult result = await(new Command.SendToWorker(id, body));
            if (!result.success()) {
                deduplicator.forget(id, body);
            }
            return result;
        });
    }

    public ToolResult broadcast(String message) {
        return guarded(() -> {
            String body = required(message, "message");
            if (deduplicator.isDuplicate(BROADCAST_KEY, body)) {
                return ToolResult.ok("broadcast sent (duplicate suppressed)");
            }
            ToolResult result = await(new Command.Broadcast(body));
            if (!result.success()) {
                deduplicator.forget(BROADCAST_KEY, body);
            }
            return result;
        });
    }

    // ------------------------------------------------------------------
    // Task workflow
    // ------------------------------------------------------------------

    public ToolResult assignTask(String workerId, String taskId, String summary) {
        return guarded(() -> {
            String worker = required(workerId, "worker_id");
            String task   = TaskIds.requireValid(taskId);
            validator.validateTaskAssignment(worker, task);
            return await(new Command.AssignTask(worker, task, summary));
        });
    }

    public ToolResult assignTaskReview(String reviewerId, String taskId, String implementerId,
                                       String summary, ReviewType reviewType) {
        return guarded(() -> {
            String reviewer    = required(reviewerId, "reviewer_id");
            String task        = TaskIds.requireValid(taskId);
            String implementer = required(implementerId, "implementer_id");
            validator.validateReviewAssignment(reviewer, task, implementer);
            return await(new Command.AssignReview(reviewer, task, implementer, summary, reviewType));
        });
    }

    public ToolResult assignReviewFeedback(String implementerId, String taskId, String feedback) {
        return guarded(() -> await(new Command.AssignReviewFeedback(
                required(implementerId, "implementer_id"),
                TaskIds.requireValid(taskId),
                required(feedback, "feedback"))));
    }

    public ToolResult approveCommit(String implementerId, String taskId, String commitMessage) {
        return guarded(() -> await(new Command.ApproveCommit(
                required(implementerId, "implementer_id"),
                TaskIds.requireValid(taskId),
                commitMessage)));
    }

    public ToolResult markTaskComplete(String taskId) {
        return guarded(() -> await(new Command.MarkTaskComplete(TaskIds.requireValid(taskId))));
    }

    public ToolResult markTaskFailed(String taskId, String reason) {
        return guarded(() -> await(new Command.MarkTaskFailed(
                TaskIds.requireValid(taskId),
                required(reason, "reason"))));
    }

    public ToolResult reportImplementationComplete(String workerId, String summary) {
        return guarded(() -> await(new Command.ReportComplete(required(workerId, "worker_id"), summary)));
    }

    public ToolResult reportReviewVerdict(String workerId, Verdict verdict, String comments) {
        return guarded(() -> {
            if (verdict == null) {
                throw new IllegalArgumentException("verdict is required (APPROVED or DENIED)");
            }
            return await(new Command.ReportVerdict(required(workerId, "worker_id"), verdict, comments));
        });
    }

    public ToolResult signalWorkflowComplete(WorkflowOutcome outcome, String summary) {
        return guarded(() -> {
            if (outcome == null) {
                throw new IllegalArgumentException("status is required (SUCCESS, PARTIAL or ABORTED)");
            }
            return await(new Command.SignalWorkflowComplete(outcome, summary));
        });
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /**
     * Current workers and task assignments, optionally narrowed to one worker and/or
     * one task. Reads the store directly.
     */
    public ToolResult queryWorkerState(String workerId, String taskId) {
        return guarded(() -> {
            String workerFilter = blankToNull(workerId);
            String taskFilter   = taskId == null || taskId.isBlank() ? null : TaskIds.requireValid(taskId);

            Map<String, ProcessStatus> statuses = new TreeMap<>();
            for (ProcessInfo p : runtime.list()) {
                statuses.put(p.id(), p.status());
            }
            Map<String, WorkerAssignment> assignments = store.workerAssignments();

            TreeSet<String> ids = new TreeSet<>(statuses.keySet());
            ids.addAll(assignments.keySet());

            List<WorkerStateSnapshot.Worker> workers = new ArrayList<>();
            for (String id : ids) {
                WorkerAssignment wa = assignments.getOrDefault(id, WorkerAssignment.idle());
                if (workerFilter != null && !workerFilter.equals(id)) continue;
                if (taskFilter != null && !taskFilter.equals(wa.taskId())) continue;
                workers.add(new WorkerStateSnapshot.Worker(id, statuses.get(id), wa));
            }
            List<TaskAssignment> tasks = store.taskAssignments().values().stream()
                    .filter(t -> taskFilter == null || taskFilter.equals(t.taskId()))
                    .filter(t -> workerFilter == null
                            || workerFilter.equals(t.implementer()) || workerFilter.equals(t.reviewer()))
                    .toList();

            return ToolResult.ok("%d workers, %d tasks".formatted(workers.size(), tasks.size()),
                    new WorkerStateSnapshot(workers, tasks));
        });
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ToolResult await(Command command) {
        CommandResult result = processor.submitAndWait(command, submitTimeout);
        return ToolResult.from(result);
    }

    /** Converts the expected failure classes into results; anything else propagates. */
    private ToolResult guarded(Supplier<ToolResult> call) {
        try {
            return call.get();
        } catch (AssignmentException e) {
            return ToolResult.error(e.getKind().name(), e.getMessage());
        } catch (CommandProcessingException e) {
            log.warn("Command not completed: {}", e.getMessage());
            return ToolResult.error(e.getKind().name(), e.getMessage());
        } catch (ProcessRuntimeException | TaskTrackerException e) {
            log.warn("Collaborator call failed: {}", e.getMessage());
            return ToolResult.error(ToolResult.RUNTIME_ERROR, e.getMessage());
        } catch (IllegalArgumentException e) {
            return ToolResult.error(ToolResult.INVALID_ARGUMENT, e.getMessage());
        }
    }

    private static String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
