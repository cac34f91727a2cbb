package org.swimlane.bpmn.layout.models;

/**
 * Identifies an edge by its endpoints. Parallel edges between the same pair share a key.
 */
public record EdgeKey(String sourceId, String targetId) {
}
