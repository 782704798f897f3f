package com.agentcrew.orchestrator.model;

/**
 * Liveness state reported by the process runtime for one worker process.
 *
 * READY   — idle between turns; may be given new work
 * WORKING — currently running an AI turn
 * RETIRED — terminated; will never accept input again
 */
public enum ProcessStatus {
    READY,
    WORKING,
    RETIRED
}
