package com.agentcrew.orchestrator.workflow;

/**
 * Final outcome the coordinator reports when it ends a workflow.
 */
public enum WorkflowOutcome {
    SUCCESS,
    PARTIAL,
    ABORTED
}
