package com.agentcrew.orchestrator.runtime;

/**
 * Thrown when the process runtime returns an error or is unreachable.
 */
public class ProcessRuntimeException extends RuntimeException {

    public ProcessRuntimeException(String message) {
        super(message);
    }

    public ProcessRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
