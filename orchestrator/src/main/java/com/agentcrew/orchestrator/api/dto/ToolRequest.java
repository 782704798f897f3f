package com.agentcrew.orchestrator.api.dto;

import com.agentcrew.orchestrator.command.ReviewType;
import com.agentcrew.orchestrator.command.Verdict;
import com.agentcrew.orchestrator.workflow.WorkflowOutcome;

/**
 * Request body shared by all POST /api/tools endpoints.
 *
 * Each tool reads only the fields it needs; the rest are ignored. Which fields are
 * required is decided by the service, not here.
 */
public record ToolRequest(String workerId,
                          String taskId,
                          String reviewerId,
                          String implementerId,
                          String agentType,
                          String summary,
                          String reason,
                          String message,
                          String feedback,
                          String commitMessage,
                          String comments,
                          ReviewType reviewType,
                          Verdict verdict,
                          WorkflowOutcome status,
                          Boolean force) {

    public boolean forceOrDefault() {
        return Boolean.TRUE.equals(force);
    }
}
