package com.agentcrew.orchestrator.monitor;

import com.agentcrew.orchestrator.assignment.AssignmentStore;
import com.agentcrew.orchestrator.model.ProcessInfo;
import com.agentcrew.orchestrator.model.TaskAssignment;
import com.agentcrew.orchestrator.model.TaskStatus;
import com.agentcrew.orchestrator.model.WorkerAssignment;
import com.agentcrew.orchestrator.runtime.ProcessRuntime;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Compares the assignment store against the live process set.
 *
 * Both checks only read: findings are advisory and it is up to the coordinator (or a
 * human) to reassign, replace or fail the affected work.
 */
@Component
public class ConsistencyChecker {

    public static final Duration DEFAULT_MAX_TASK_DURATION = Duration.ofMinutes(30);

    private final AssignmentStore store;
    private final ProcessRuntime  runtime;
    private final Clock           clock;
    private final Duration        maxTaskDuration;

    public ConsistencyChecker(AssignmentStore store,
                              ProcessRuntime runtime,
                              Clock clock,
                              @Value("${agentcrew.monitor.max-task-duration:30m}") Duration maxTaskDuration) {
        this.store           = store;
        this.runtime         = runtime;
        this.clock           = clock;
        this.maxTaskDuration = maxTaskDuration;
    }

    /**
     * Tasks whose implementer, or reviewer when one is set, is missing from the live
     * process set or retired. Completed tasks are skipped.
     *
     * @return orphaned task IDs, sorted
     */
    public List<String> detectOrphanedTasks() {
        Map<String, ProcessInfo> live = runtime.list().stream()
                .collect(Collectors.toMap(ProcessInfo::id, Function.identity(), (a, b) -> b));

        return store.taskAssignments().values().stream()
                .filter(t -> t.status() != TaskStatus.COMPLETED)
                .filter(t -> isGone(live, t.implementer()) || (t.hasReviewer() && isGone(live, t.reviewer())))
                .map(TaskAssignment::taskId)
                .sorted()
                .toList();
    }

    /**
     * Workers that have held their current task longer than the configured maximum.
     * Idle workers are never stuck.
     *
     * @return stuck worker IDs, sorted
     */
    public List<String> checkStuckWorkers() {
        Instant cutoff = clock.instant().minus(maxTaskDuration);
        return store.workerAssignments().entrySet().stream()
                .filter(e -> isStuck(e.getValue(), cutoff))
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    public Duration maxTaskDuration() {
        return maxTaskDuration;
    }

    private static boolean isStuck(WorkerAssignment wa, Instant cutoff) {
        return wa.hasTask() && wa.assignedAt() != null && wa.assignedAt().isBefore(cutoff);
    }

    private static boolean isGone(Map<String, ProcessInfo> live, String workerId) {
        ProcessInfo info = live.get(workerId);
        return info == null || info.isRetired();
    }
}
