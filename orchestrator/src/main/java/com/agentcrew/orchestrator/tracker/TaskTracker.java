package com.agentcrew.orchestrator.tracker;

import java.util.Optional;

/**
 * External issue tracker holding the tasks workers implement.
 *
 * How the tracker persists tasks is its own business; the orchestrator only needs
 * these operations.
 */
public interface TaskTracker {

    /** Fetch an issue; empty when the tracker does not know the ID. */
    Optional<TrackerIssue> showIssue(String taskId);

    /** Move an open issue to in-progress when a worker starts on it. */
    void markInProgress(String taskId);

    void addComment(String taskId, String author, String text);

    void markComplete(String taskId);

    void markFailed(String taskId, String reason);
}
