package com.agentcrew.orchestrator.command;

/**
 * A reviewer's decision on an implementation.
 */
public enum Verdict {
    APPROVED,
    DENIED
}
