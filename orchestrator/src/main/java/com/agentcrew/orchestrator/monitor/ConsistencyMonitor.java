package com.agentcrew.orchestrator.monitor;

import com.agentcrew.orchestrator.assignment.AssignmentStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodic consistency sweep.
 *
 * Runs on the scheduler thread, independently of the command processor, and never
 * changes state. Findings go to the log at WARN and to two gauges:
 * <pre>
 *   agentcrew.monitor.orphaned.tasks
 *   agentcrew.monitor.stuck.workers
 * </pre>
 */
@Component
@EnableScheduling
public class ConsistencyMonitor {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyMonitor.class);

    private final ConsistencyChecker checker;
    private final AssignmentStore    store;

    private final AtomicInteger orphaned = new AtomicInteger();
    private final AtomicInteger stuck    = new AtomicInteger();

    public ConsistencyMonitor(ConsistencyChecker checker, AssignmentStore store, MeterRegistry meterRegistry) {
        this.checker = checker;
        this.store   = store;
        Gauge.builder("agentcrew.monitor.orphaned.tasks", orphaned, AtomicInteger::get)
                .description("Tasks whose implementer or reviewer is gone")
                .register(meterRegistry);
        Gauge.builder("agentcrew.monitor.stuck.workers", stuck, AtomicInteger::get)
                .description("Workers holding a task longer than the maximum task duration")
                .register(meterRegistry);
        Gauge.builder("agentcrew.assignment.tasks", store, AssignmentStore::taskAssignmentCount)
                .description("Task assignments on record, finished ones included")
                .register(meterRegistry);
    }

    /**
     * fixedDelay so a slow runtime listing never causes overlapping sweeps.
     */
    @Scheduled(fixedDelayString = "${agentcrew.monitor.sweep-interval-ms:60000}",
               initialDelayString = "${agentcrew.monitor.sweep-interval-ms:60000}")
    public void sweep() {
        try {
            report(checker.detectOrphanedTasks(), checker.checkStuckWorkers());
        } catch (Exception e) {
            log.error("Consistency sweep failed: {}", e.getMessage(), e);
        }
    }

    void report(List<String> orphanedTasks, List<String> stuckWorkers) {
        orphaned.set(orphanedTasks.size());
        stuck.set(stuckWorkers.size());

        for (String taskId : orphanedTasks) {
            log.warn("Orphaned task {}: {}", taskId, store.getTaskAssignment(taskId).orElse(null));
        }
        for (String workerId : stuckWorkers) {
            log.warn("Worker {} exceeded {} on its task: {}", workerId, checker.maxTaskDuration(),
                    store.getWorkerAssignment(workerId).orElse(null));
        }
        for (String violation : store.invariantViolations()) {
            log.warn("Assignment invariant violated: {}", violation);
        }
        if (orphanedTasks.isEmpty() && stuckWorkers.isEmpty()) {
            log.debug("Consistency sweep clean ({} task assignments on record)", store.taskAssignmentCount());
        }
    }

    public int lastOrphanedCount() {
        return orphaned.get();
    }

    public int lastStuckCount() {
        return stuck.get();
    }
}
