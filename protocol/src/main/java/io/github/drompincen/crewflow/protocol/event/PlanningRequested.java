package io.github.drompincen.crewflow.protocol.event;

/**
 * Application event asking for a full planning cycle of one project.
 */
public record PlanningRequested(String projectId, String initiatedBy) {}
