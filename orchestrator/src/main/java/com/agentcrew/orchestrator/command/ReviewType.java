package com.agentcrew.orchestrator.command;

/**
 * How thorough a review should be; forwarded to the reviewer's instructions.
 */
public enum ReviewType {
    SIMPLE,
    COMPLEX
}
