package com.agentcrew.orchestrator.command;

/**
 * Outcome of one processed command. Produced exactly once per accepted command.
 *
 * @param success   whether the handler applied the change
 * @param message   human-readable summary (success) or error text (failure)
 * @param data      handler-specific payload; null on failure
 * @param errorCode machine-readable failure class, e.g. "ALREADY_ASSIGNED"; null on success
 */
public record CommandResult(boolean success, String message, Object data, String errorCode) {

    public static final String UNKNOWN_COMMAND = "UNKNOWN_COMMAND";
    public static final String HANDLER_ERROR   = "HANDLER_ERROR";
    public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";

    public static CommandResult success(String message, Object data) {
        return new CommandResult(true, message, data, null);
    }

    public static CommandResult success(String message) {
        return new CommandResult(true, message, null, null);
    }

    public static CommandResult failure(String errorCode, String message) {
        return new CommandResult(false, message, null, errorCode);
    }
}
