package com.agentcrew.orchestrator.model;

/**
 * The part a worker plays on the task it currently holds.
 *
 * An idle worker has no role (its assignment carries {@code null}).
 * A task has exactly one IMPLEMENTER and, once review starts, at most one REVIEWER.
 */
public enum WorkerRole {
    IMPLEMENTER,    // Writes the change, addresses feedback, commits
    REVIEWER        // Reads the change and reports APPROVED or DENIED
}
