package com.agentcrew.orchestrator.command;

/**
 * Thrown by the processor's submit methods when a command cannot be queued or its
 * result cannot be delivered. Handler failures never surface this way; they come
 * back as a failed {@link CommandResult}.
 */
public class CommandProcessingException extends RuntimeException {

    public enum Kind { QUEUE_FULL, NOT_RUNNING, TIMEOUT, SHUTDOWN, INTERRUPTED }

    private final Kind kind;

    public CommandProcessingException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public CommandProcessingException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
