package com.agentcrew.orchestrator.tracker;

/**
 * Thrown when the issue tracker rejects a call or cannot be reached.
 */
public class TaskTrackerException extends RuntimeException {

    public TaskTrackerException(String message) {
        super(message);
    }

    public TaskTrackerException(String message, Throwable cause) {
        super(message, cause);
    }
}
