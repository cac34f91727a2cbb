package org.swimlane.bpmn.layout.models;

import lombok.Builder;
import org.swimlane.bpmn.graph.models.ProcessNode;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Complete result of one layout run: the normalized nodes with their final lanes, ranks,
 * geometry and routed edges. Everything the serializer needs.
 */
@Builder
public record DiagramLayout(
        String processName,
        String goal,
        List<String> laneOrder,
        List<ProcessNode> nodes,
        Map<String, Integer> ranks,
        Set<EdgeKey> corridorEdges,
        Geometry geometry,
        List<RoutedEdge> edges
) {
    public int rank(String nodeId) {
        return ranks.get(nodeId);
    }

    public List<ProcessNode> nodesInLane(String lane) {
        return nodes.stream()
                .filter(n -> lane.equals(n.lane))
                .collect(Collectors.toList());
    }

    public List<RoutedEdge> incoming(String nodeId) {
        return edges.stream()
                .filter(e -> e.targetId().equals(nodeId))
                .collect(Collectors.toList());
    }

    public List<RoutedEdge> outgoing(String nodeId) {
        return edges.stream()
                .filter(e -> e.sourceId().equals(nodeId))
                .collect(Collectors.toList());
    }
}
