package com.agentcrew.orchestrator.runtime.dto;

/**
 * Response body for POST /processes.
 */
public record SpawnedProcess(String processId, String sessionId) {}
