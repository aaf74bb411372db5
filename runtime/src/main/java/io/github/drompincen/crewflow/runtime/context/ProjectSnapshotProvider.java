package io.github.drompincen.crewflow.runtime.context;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Supplies the project data an agent reasons about (tasks, capacity, sprint state). The core
 * treats it as opaque; behaviors read the fields they recognise, such as {@code teamCapacity}
 * and {@code deliveryConfidence}.
 */
@FunctionalInterface
public interface ProjectSnapshotProvider {

    JsonNode snapshot(String projectId, String agentId);
}
