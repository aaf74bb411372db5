package io.github.drompincen.crewflow.protocol.api;

/**
 * A project member as seen by agent provisioning; {@code admin} marks the project owner.
 */
public record ProjectMember(String userId, boolean admin) {}
