package com.agentcrew.orchestrator.tracker;

/**
 * The subset of a tracker issue the orchestrator reads.
 */
public record TrackerIssue(String id, String title, String status, String description) {}
