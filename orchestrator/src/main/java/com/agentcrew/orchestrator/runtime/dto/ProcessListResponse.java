package com.agentcrew.orchestrator.runtime.dto;

import com.agentcrew.orchestrator.model.ProcessInfo;

import java.util.List;

/**
 * Response body for GET /processes.
 */
public record ProcessListResponse(List<ProcessInfo> processes) {

    public ProcessListResponse {
        if (processes == null) processes = List.of();
    }
}
