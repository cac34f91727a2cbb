package org.swimlane.bpmn.layout.models;

import java.util.Map;

/**
 * Absolute placement of every lane band and node box.
 *
 * @param lanes lane bands keyed by lane name, in sequence order
 * @param nodes node boxes keyed by node id, in node order
 * @param pool  the pool box, header included
 */
public record Geometry(Map<String, LaneBand> lanes, Map<String, Bounds> nodes, Bounds pool) {

    public Bounds node(String nodeId) {
        return nodes.get(nodeId);
    }

    public LaneBand lane(String lane) {
        return lanes.get(lane);
    }
}
