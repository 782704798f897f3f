package com.agentcrew.orchestrator.service;

/**
 * A task ID failed format validation; nothing was looked up or queued.
 */
public class TaskIdFormatException extends IllegalArgumentException {

    public TaskIdFormatException(String message) {
        super(message);
    }
}
