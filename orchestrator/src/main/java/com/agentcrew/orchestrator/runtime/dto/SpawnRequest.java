package com.agentcrew.orchestrator.runtime.dto;

/**
 * Request body for POST /processes.
 *
 * @param agentType Which agent client to start (e.g. "claude", "codex"); null lets the runtime pick its default
 * @param role      Always "worker" for processes started by the orchestrator
 */
public record SpawnRequest(String agentType, String role) {

    public static SpawnRequest worker(String agentType) {
        return new SpawnRequest(agentType, "worker");
    }
}
