package com.agentcrew.orchestrator.workflow;

import com.agentcrew.orchestrator.model.TaskStatus;
import com.agentcrew.orchestrator.model.WorkerPhase;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.agentcrew.orchestrator.model.WorkerPhase.*;

/**
 * Canonical transition tables for worker phases and task statuses.
 *
 * Every handler consults these tables before writing the assignment store, so a
 * pair missing from a table can never be recorded.
 *
 * <pre>
 *   From                 Valid to (event)
 *   IDLE                 IMPLEMENTING (assign_task), REVIEWING (assign_task_review), IDLE (noop)
 *   IMPLEMENTING         AWAITING_REVIEW (report_implementation_complete), IDLE (task_failed), IMPLEMENTING (working)
 *   AWAITING_REVIEW      ADDRESSING_FEEDBACK (review_denied), COMMITTING (review_approved), IDLE (task_failed), AWAITING_REVIEW (waiting)
 *   REVIEWING            IDLE (report_review_verdict), REVIEWING (reviewing)
 *   ADDRESSING_FEEDBACK  AWAITING_REVIEW (report_implementation_complete), IDLE (task_failed), ADDRESSING_FEEDBACK (working)
 *   COMMITTING           IDLE (mark_task_complete), ADDRESSING_FEEDBACK (commit_failed), COMMITTING (committing)
 * </pre>
 */
public final class WorkflowTransitions {

    private static final Map<WorkerPhase, Map<WorkerPhase, String>> PHASES = new EnumMap<>(WorkerPhase.class);
    private static final Map<TaskStatus, Set<TaskStatus>> STATUSES = new EnumMap<>(TaskStatus.class);

    static {
        phase(IDLE,                IMPLEMENTING,        "assign_task");
        phase(IDLE,                REVIEWING,           "assign_task_review");
        phase(IDLE,                IDLE,                "noop");

        phase(IMPLEMENTING,        AWAITING_REVIEW,     "report_implementation_complete");
        phase(IMPLEMENTING,        IDLE,                "task_failed");
        phase(IMPLEMENTING,        IMPLEMENTING,        "working");

        phase(AWAITING_REVIEW,     ADDRESSING_FEEDBACK, "review_denied");
        phase(AWAITING_REVIEW,     COMMITTING,          "review_approved");
        phase(AWAITING_REVIEW,     IDLE,                "task_failed");
        phase(AWAITING_REVIEW,     AWAITING_REVIEW,     "waiting");

        phase(REVIEWING,           IDLE,                "report_review_verdict");
        phase(REVIEWING,           REVIEWING,           "reviewing");

        phase(ADDRESSING_FEEDBACK, AWAITING_REVIEW,     "report_implementation_complete");
        phase(ADDRESSING_FEEDBACK, IDLE,                "task_failed");
        phase(ADDRESSING_FEEDBACK, ADDRESSING_FEEDBACK, "working");

        phase(COMMITTING,          IDLE,                "mark_task_complete");
        phase(COMMITTING,          ADDRESSING_FEEDBACK, "commit_failed");
        phase(COMMITTING,          COMMITTING,          "committing");

        STATUSES.put(TaskStatus.IMPLEMENTING, Set.of(TaskStatus.IN_REVIEW));
        STATUSES.put(TaskStatus.IN_REVIEW,    Set.of(TaskStatus.APPROVED, TaskStatus.DENIED));
        STATUSES.put(TaskStatus.APPROVED,     Set.of(TaskStatus.COMMITTING));
        STATUSES.put(TaskStatus.DENIED,       Set.of(TaskStatus.IMPLEMENTING));
        STATUSES.put(TaskStatus.COMMITTING,   Set.of(TaskStatus.COMPLETED, TaskStatus.IMPLEMENTING));
        STATUSES.put(TaskStatus.COMPLETED,    Set.of());
    }

    private WorkflowTransitions() {}

    private static void phase(WorkerPhase from, WorkerPhase to, String event) {
        PHASES.computeIfAbsent(from, k -> new LinkedHashMap<>()).put(to, event);
    }

    // ------------------------------------------------------------------
    // Worker phases
    // ------------------------------------------------------------------

    public static boolean isValidPhaseTransition(WorkerPhase from, WorkerPhase to) {
        return PHASES.getOrDefault(from, Map.of()).containsKey(to);
    }

    /** The event name that drives {@code from → to}, if the move is allowed. */
    public static Optional<String> phaseEvent(WorkerPhase from, WorkerPhase to) {
        return Optional.ofNullable(PHASES.getOrDefault(from, Map.of()).get(to));
    }

    /** Allowed targets from a phase, in table order. */
    public static Set<WorkerPhase> validPhaseTargets(WorkerPhase from) {
        return Collections.unmodifiableSet(PHASES.getOrDefault(from, Map.of()).keySet());
    }

    // ------------------------------------------------------------------
    // Task statuses
    // ------------------------------------------------------------------

    /**
     * Self-transitions are accepted as no-ops for every status, including COMPLETED;
     * any other move out of COMPLETED is rejected.
     */
    public static boolean isValidStatusTransition(TaskStatus from, TaskStatus to) {
        if (from == to) return true;
        return STATUSES.getOrDefault(from, Set.of()).contains(to);
    }

    public static boolean isTerminal(TaskStatus status) {
        return STATUSES.getOrDefault(status, Set.of()).isEmpty();
    }
}
