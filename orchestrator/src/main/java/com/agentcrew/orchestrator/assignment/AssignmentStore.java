package com.agentcrew.orchestrator.assignment;

import com.agentcrew.orchestrator.model.TaskAssignment;
import com.agentcrew.orchestrator.model.TaskStatus;
import com.agentcrew.orchestrator.model.WorkerAssignment;
import com.agentcrew.orchestrator.model.WorkerPhase;
import com.agentcrew.orchestrator.model.WorkerRole;
import com.agentcrew.orchestrator.workflow.WorkflowTransitions;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

import static com.agentcrew.orchestrator.assignment.AssignmentException.Kind.*;

/**
 * Owner of the worker→assignment and task→assignment maps.
 *
 * Reads take the shared lock and may run on any number of threads; writes take the
 * exclusive lock. The maps themselves never leave this class: lookups return the
 * immutable records, snapshots return copies.
 *
 * <p>Multi-entry changes go through {@link #update}: the change is staged against an
 * overlay and only copied into the real maps if it returns normally, so a change that
 * throws halfway leaves the store exactly as it was.
 */
@Component
public class AssignmentStore {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, WorkerAssignment> workers = new HashMap<>();
    private final Map<String, TaskAssignment>   tasks   = new HashMap<>();

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    public Optional<WorkerAssignment> getWorkerAssignment(String workerId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(workers.get(workerId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<TaskAssignment> getTaskAssignment(String taskId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(tasks.get(taskId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Copy of all worker assignments, sorted by worker ID. */
    public Map<String, WorkerAssignment> workerAssignments() {
        lock.readLock().lock();
        try {
            return new TreeMap<>(workers);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Copy of all task assignments, sorted by task ID. */
    public Map<String, TaskAssignment> taskAssignments() {
        lock.readLock().lock();
        try {
            return new TreeMap<>(tasks);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Task assignments are retained forever; this makes their growth observable. */
    public int taskAssignmentCount() {
        lock.readLock().lock();
        try {
            return tasks.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Check the five workflow invariants against the current maps.
     *
     * @return one human-readable line per violation; empty when consistent
     */
    public List<String> invariantViolations() {
        lock.readLock().lock();
        try {
            List<String> violations = new ArrayList<>();
            Map<String, List<String>> implementersByTask = new LinkedHashMap<>();
            Map<String, List<String>> reviewersByTask    = new LinkedHashMap<>();

            for (Map.Entry<String, WorkerAssignment> e : workers.entrySet()) {
                WorkerAssignment wa = e.getValue();
                if (!wa.phase().allows(wa.role())) {
                    violations.add("worker %s has role %s in phase %s".formatted(e.getKey(), wa.role(), wa.phase()));
                }
                if (!wa.hasTask()) continue;
                if (wa.role() == WorkerRole.IMPLEMENTER) {
                    implementersByTask.computeIfAbsent(wa.taskId(), k -> new ArrayList<>()).add(e.getKey());
                } else if (wa.role() == WorkerRole.REVIEWER) {
                    reviewersByTask.computeIfAbsent(wa.taskId(), k -> new ArrayList<>()).add(e.getKey());
                }
            }
            implementersByTask.forEach((task, ids) -> {
                if (ids.size() > 1) violations.add("task %s has %d implementers: %s".formatted(task, ids.size(), ids));
            });
            reviewersByTask.forEach((task, ids) -> {
                if (ids.size() > 1) violations.add("task %s has %d reviewers: %s".formatted(task, ids.size(), ids));
            });

            for (TaskAssignment ta : tasks.values()) {
                if (ta.status() != TaskStatus.IN_REVIEW) continue;
                if (ta.reviewer().equals(ta.implementer())) {
                    violations.add("task %s is reviewed by its implementer %s".formatted(ta.taskId(), ta.implementer()));
                }
                if (ta.hasReviewer()) {
                    WorkerAssignment reviewer = workers.get(ta.reviewer());
                    if (reviewer == null || reviewer.phase() != WorkerPhase.REVIEWING) {
                        violations.add("task %s is in review but reviewer %s is in phase %s".formatted(
                                ta.taskId(), ta.reviewer(), reviewer == null ? null : reviewer.phase()));
                    }
                }
            }
            return violations;
        } finally {
            lock.readLock().unlock();
        }
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    /**
     * Apply a multi-entry change atomically.
     *
     * The function sees a consistent view (no other writer can interleave) and its
     * writes become visible together when it returns. If it throws, nothing is applied.
     */
    public <T> T update(Function<Mutation, T> change) {
        lock.writeLock().lock();
        try {
            Mutation m = new Mutation();
            T result = change.apply(m);
            workers.putAll(m.stagedWorkers);
            tasks.putAll(m.stagedTasks);
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Overwrite one worker assignment without transition checks. */
    public void putWorkerAssignment(String workerId, WorkerAssignment assignment) {
        update(m -> { m.putWorker(workerId, assignment); return null; });
    }

    /** Overwrite one task assignment without transition checks. */
    public void putTaskAssignment(TaskAssignment assignment) {
        update(m -> { m.putTask(assignment); return null; });
    }

    /** Return a worker to {@code {taskId:"", phase:IDLE}}; its task assignment is left untouched. */
    public void clearWorkerAssignment(String workerId) {
        update(m -> { m.clearWorker(workerId); return null; });
    }

    /**
     * Record {@code workerId} as the implementer of {@code taskId}.
     *
     * Re-checks, under the write lock, that the worker is free and that no other
     * worker currently holds the task as implementer. A previous task record for the
     * same ID (e.g. one orphaned by a retired worker) is replaced by a fresh one.
     *
     * @throws AssignmentException WORKER_BUSY, ALREADY_ASSIGNED or INVALID_STATE
     */
    public WorkerAssignment assignImplementer(String workerId, String taskId, Instant now) {
        return update(m -> m.assignImplementer(workerId, taskId, now));
    }

    /**
     * Record {@code reviewerId} as the reviewer of {@code taskId}: the reviewer moves to
     * REVIEWING, the task to IN_REVIEW, and the implementer's assignment learns its reviewer.
     *
     * @throws AssignmentException SELF_REVIEW, TASK_MISMATCH, NOT_AWAITING_REVIEW,
     *                             REVIEWER_ALREADY_SET, WORKER_BUSY or INVALID_TRANSITION
     */
    public TaskAssignment assignReviewer(String reviewerId, String taskId, String implementerId, Instant now) {
        return update(m -> {
            if (reviewerId.equals(implementerId)) {
                throw new AssignmentException(SELF_REVIEW, "reviewer cannot be the same as implementer");
            }
            TaskAssignment task = m.task(taskId)
                    .filter(t -> t.implementer().equals(implementerId))
                    .orElseThrow(() -> new AssignmentException(TASK_MISMATCH,
                            "task %s is not implemented by %s".formatted(taskId, implementerId)));
            WorkerAssignment implementer = m.worker(implementerId).orElse(WorkerAssignment.idle());
            if (implementer.phase() != WorkerPhase.AWAITING_REVIEW) {
                throw new AssignmentException(NOT_AWAITING_REVIEW,
                        "implementer %s is not awaiting review (phase: %s)".formatted(implementerId, implementer.phase()));
            }
            if (task.hasReviewer()) {
                throw new AssignmentException(REVIEWER_ALREADY_SET,
                        "task %s already has reviewer %s".formatted(taskId, task.reviewer()));
            }
            WorkerAssignment reviewer = m.worker(reviewerId).orElse(WorkerAssignment.idle());
            if (reviewer.hasTask()) {
                throw new AssignmentException(WORKER_BUSY,
                        "worker %s already assigned to task %s".formatted(reviewerId, reviewer.taskId()));
            }
            requirePhaseTransition(reviewerId, reviewer.phase(), WorkerPhase.REVIEWING);

            m.moveTask(taskId, TaskStatus.IN_REVIEW);
            TaskAssignment inReview = m.task(taskId).orElseThrow().withReviewer(reviewerId, now);
            m.putTask(inReview);
            m.putWorker(reviewerId, WorkerAssignment.reviewing(taskId, implementerId, now));
            m.putWorker(implementerId, implementer.withReviewer(reviewerId));
            return inReview;
        });
    }

    /**
     * A staged view of both maps, valid only inside {@link #update}.
     *
     * Getters read staged values first, then committed ones. The {@code move*}
     * methods enforce the transition tables; the {@code put*} methods do not.
     */
    public final class Mutation {

        private final Map<String, WorkerAssignment> stagedWorkers = new HashMap<>();
        private final Map<String, TaskAssignment>   stagedTasks   = new HashMap<>();

        private Mutation() {}

        public Optional<WorkerAssignment> worker(String workerId) {
            WorkerAssignment staged = stagedWorkers.get(workerId);
            return Optional.ofNullable(staged != null ? staged : workers.get(workerId));
        }

        public Optional<TaskAssignment> task(String taskId) {
            TaskAssignment staged = stagedTasks.get(taskId);
            return Optional.ofNullable(staged != null ? staged : tasks.get(taskId));
        }

        /** All workers currently holding {@code taskId}, staged values included, sorted by ID. */
        public List<String> holdersOf(String taskId) {
            Map<String, WorkerAssignment> view = new HashMap<>(workers);
            view.putAll(stagedWorkers);
            List<String> holders = new ArrayList<>();
            view.forEach((id, wa) -> { if (taskId.equals(wa.taskId())) holders.add(id); });
            holders.sort(null);
            return holders;
        }

        public void putWorker(String workerId, WorkerAssignment assignment) {
            stagedWorkers.put(workerId, assignment);
        }

        public void putTask(TaskAssignment assignment) {
            stagedTasks.put(assignment.taskId(), assignment);
        }

        public void clearWorker(String workerId) {
            stagedWorkers.put(workerId, WorkerAssignment.idle());
        }

        /**
         * Staged form of {@link AssignmentStore#assignImplementer}, for callers that must
         * release other holders of the task in the same change.
         */
        public WorkerAssignment assignImplementer(String workerId, String taskId, Instant now) {
            WorkerAssignment current = worker(workerId).orElse(WorkerAssignment.idle());
            if (current.hasTask()) {
                throw new AssignmentException(WORKER_BUSY,
                        "worker %s already assigned to task %s".formatted(workerId, current.taskId()));
            }
            Optional<TaskAssignment> existing = task(taskId);
            if (existing.isPresent() && existing.get().status() == TaskStatus.COMPLETED) {
                throw new AssignmentException(INVALID_STATE, "task %s is already completed".formatted(taskId));
            }
            for (String holder : holdersOf(taskId)) {
                if (!holder.equals(workerId) && worker(holder).map(WorkerAssignment::role).orElse(null) == WorkerRole.IMPLEMENTER) {
                    throw new AssignmentException(ALREADY_ASSIGNED,
                            "task %s already assigned to %s".formatted(taskId, holder));
                }
            }
            requirePhaseTransition(workerId, current.phase(), WorkerPhase.IMPLEMENTING);

            WorkerAssignment assigned = WorkerAssignment.implementing(taskId, now);
            stagedWorkers.put(workerId, assigned);
            stagedTasks.put(taskId, TaskAssignment.started(taskId, workerId, now));
            return assigned;
        }

        /**
         * Move a worker to a new phase, keeping task and role.
         *
         * @throws AssignmentException INVALID_TRANSITION if the table forbids the move
         */
        public WorkerAssignment moveWorker(String workerId, WorkerPhase to) {
            WorkerAssignment current = worker(workerId).orElse(WorkerAssignment.idle());
            requirePhaseTransition(workerId, current.phase(), to);
            WorkerAssignment next = to == WorkerPhase.IDLE ? WorkerAssignment.idle() : current.withPhase(to);
            stagedWorkers.put(workerId, next);
            return next;
        }

        /**
         * Move a task to a new status.
         *
         * @throws AssignmentException TASK_MISMATCH if the task is unknown,
         *                             INVALID_TRANSITION if the table forbids the move
         */
        public TaskAssignment moveTask(String taskId, TaskStatus to) {
            TaskAssignment current = task(taskId).orElseThrow(() ->
                    new AssignmentException(TASK_MISMATCH, "task %s not found".formatted(taskId)));
            if (!WorkflowTransitions.isValidStatusTransition(current.status(), to)) {
                throw new AssignmentException(INVALID_TRANSITION,
                        "invalid status transition for task %s: %s -> %s".formatted(taskId, current.status(), to));
            }
            TaskAssignment next = current.withStatus(to);
            stagedTasks.put(taskId, next);
            return next;
        }
    }

    static void requirePhaseTransition(String workerId, WorkerPhase from, WorkerPhase to) {
        if (!WorkflowTransitions.isValidPhaseTransition(from, to)) {
            throw new AssignmentException(INVALID_TRANSITION,
                    "invalid phase transition for worker %s: %s -> %s".formatted(workerId, from, to));
        }
    }
}
