package org.swimlane.bpmn.layout;

import lombok.extern.slf4j.Slf4j;
import org.swimlane.bpmn.graph.models.NodeKind;
import org.swimlane.bpmn.graph.models.ProcessNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lane reassignments the layout makes on its own: decision gateways follow their branches,
 * end events follow the step that leads into them. Nodes only ever change lanes here; none
 * is removed.
 */
@Slf4j
public class LaneAssigner {

    /**
     * Moves every gateway with more than one successor into the lane that holds the strict
     * majority of those successors. Gateways whose successor lanes tie stay where they are.
     */
    public void optimizeGatewayLanes(LayoutGraph graph) {
        for (ProcessNode node : graph.nodes()) {
            if (!node.isGateway()) {
                continue;
            }
            List<String> successors = graph.successors(node.id);
            if (successors.size() <= 1) {
                continue;
            }

            Map<String, Integer> laneCounts = new LinkedHashMap<>();
            for (String successor : successors) {
                laneCounts.merge(graph.laneOf(successor), 1, Integer::sum);
            }
            int maxCount = Collections.max(laneCounts.values());
            List<String> bestLanes = laneCounts.entrySet().stream()
                    .filter(e -> e.getValue() == maxCount)
                    .map(Map.Entry::getKey)
                    .toList();
            if (bestLanes.size() > 1) {
                continue;
            }

            String bestLane = bestLanes.get(0);
            if (!bestLane.equals(node.lane)) {
                log.debug("Moving gateway {} from lane '{}' to '{}'", node.id, node.lane, bestLane);
                graph.moveToLane(node.id, bestLane);
            }
        }
    }

    /**
     * Places every end event in the lane of its first predecessor.
     */
    public void enforceEndEventLanes(LayoutGraph graph) {
        for (ProcessNode node : graph.nodes()) {
            if (node.kind != NodeKind.END_EVENT) {
                continue;
            }
            List<String> predecessors = graph.predecessors(node.id);
            if (predecessors.isEmpty()) {
                continue;
            }
            String predecessorLane = graph.laneOf(predecessors.get(0));
            if (!predecessorLane.equals(node.lane)) {
                log.debug("Moving end event {} from lane '{}' to '{}'", node.id, node.lane, predecessorLane);
                graph.moveToLane(node.id, predecessorLane);
            }
        }
    }
}
