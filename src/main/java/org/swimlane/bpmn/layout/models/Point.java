package org.swimlane.bpmn.layout.models;

/**
 * A waypoint or anchor in absolute diagram coordinates.
 */
public record Point(double x, double y) {
}
