package com.agentcrew.orchestrator.service;

import java.util.regex.Pattern;

/**
 * Task ID format check, applied before an ID reaches the store, the queue or the
 * tracker (which may pass it to a shell).
 *
 * Accepted: {@code <letters>-<2..10 alphanumerics>} with an optional {@code .<digits>}
 * subtask suffix, e.g. {@code perles-abc} or {@code perles-abc.1}. The pattern is
 * anchored and whitelists characters, so whitespace, shell metacharacters, path
 * separators, a leading {@code --} and {@code ..} can never match.
 */
public final class TaskIds {

    private static final Pattern TASK_ID = Pattern.compile("[a-zA-Z]+-[a-zA-Z0-9]{2,10}(\\.\\d+)?");

    private TaskIds() {}

    public static boolean isValid(String taskId) {
        return taskId != null && TASK_ID.matcher(taskId).matches();
    }

    /**
     * @throws TaskIdFormatException if the ID is missing or malformed
     */
    public static String requireValid(String taskId) {
        if (taskId == null || taskId.isEmpty()) {
            throw new TaskIdFormatException("task_id is required");
        }
        if (!isValid(taskId)) {
            throw new TaskIdFormatException("invalid task_id format: " + taskId);
        }
        return taskId;
    }
}
