package org.swimlane.bpmn.layout.models;

import lombok.Builder;

import java.util.List;

/**
 * An edge with its orthogonal route.
 *
 * @param sourceId    source node id
 * @param index       position of the edge in the source's outgoing list
 * @param targetId    target node id
 * @param label       condition text, may be null
 * @param exitSide    side of the source shape the route leaves from
 * @param waypoints   ordered route, first point on the source shape, last on the target
 * @param labelBounds label box, null when the edge has no label
 * @param corridor    whether the edge was routed through a corridor channel
 * @param backward    whether the edge runs against the rank order
 */
@Builder
public record RoutedEdge(
        String sourceId,
        int index,
        String targetId,
        String label,
        ExitSide exitSide,
        List<Point> waypoints,
        Bounds labelBounds,
        boolean corridor,
        boolean backward
) {
    public boolean hasLabel() {
        return label != null && !label.isEmpty();
    }
}
