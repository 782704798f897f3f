package com.agentcrew.orchestrator.service;

import com.agentcrew.orchestrator.command.CommandResult;

/**
 * What a tool call returns to the coordinator.
 *
 * @param errorCode null on success; otherwise the failure class, e.g. "ALREADY_ASSIGNED",
 *                  "INVALID_ARGUMENT" or "TIMEOUT"
 */
public record ToolResult(boolean success, String message, Object data, String errorCode) {

    public static final String INVALID_ARGUMENT = CommandResult.INVALID_ARGUMENT;
    public static final String RUNTIME_ERROR    = "RUNTIME_ERROR";

    public static ToolResult ok(String message, Object data) {
        return new ToolResult(true, message, data, null);
    }

    public static ToolResult ok(String message) {
        return new ToolResult(true, message, null, null);
    }

    public static ToolResult error(String errorCode, String message) {
        return new ToolResult(false, message, null, errorCode);
    }

    public static ToolResult from(CommandResult result) {
        return new ToolResult(result.success(), result.message(), result.data(), result.errorCode());
    }
}
