package org.swimlane.bpmn.layout;

import lombok.extern.slf4j.Slf4j;
import org.swimlane.bpmn.graph.models.NodeKind;
import org.swimlane.bpmn.graph.models.ProcessNode;
import org.swimlane.bpmn.layout.models.EdgeKey;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orders lanes top to bottom so that lanes exchanging many flows sit next to each other.
 * Greedy, not optimal: starting from the lane of the start event, always append the unplaced
 * lane with the best score {@code 2 * votes(current -> candidate) - votes(candidate -> current)}.
 * Ties go to the lane declared first.
 */
@Slf4j
public class LaneSequencer {

    public List<String> sequence(LayoutGraph graph, List<String> declaredLanes) {
        Map<EdgeKey, Integer> votes = countLaneVotes(graph);

        Set<String> remaining = new LinkedHashSet<>(declaredLanes);
        String startLane = findStartLane(graph, declaredLanes);

        List<String> ordered = new ArrayList<>();
        ordered.add(startLane);
        remaining.remove(startLane);

        String current = startLane;
        while (!remaining.isEmpty()) {
            String best = null;
            int bestScore = Integer.MIN_VALUE;
            for (String candidate : remaining) {
                int score = 2 * votes.getOrDefault(new EdgeKey(current, candidate), 0)
                        - votes.getOrDefault(new EdgeKey(candidate, current), 0);
                if (score > bestScore) {
                    bestScore = score;
                    best = candidate;
                }
            }
            ordered.add(best);
            remaining.remove(best);
            current = best;
        }

        if (!ordered.get(0).equals(startLane)) {
            ordered.remove(startLane);
            ordered.add(0, startLane);
        }

        log.debug("Lane sequence: {}", ordered);
        return ordered;
    }

    /**
     * One vote per edge between different lanes, keyed by (source lane, target lane).
     */
    private Map<EdgeKey, Integer> countLaneVotes(LayoutGraph graph) {
        Map<EdgeKey, Integer> votes = new HashMap<>();
        for (ProcessNode node : graph.nodes()) {
            for (String target : graph.successors(node.id)) {
                String targetLane = graph.laneOf(target);
                if (!node.lane.equals(targetLane)) {
                    votes.merge(new EdgeKey(node.lane, targetLane), 1, Integer::sum);
                }
            }
        }
        return votes;
    }

    private String findStartLane(LayoutGraph graph, List<String> declaredLanes) {
        return graph.nodes().stream()
                .filter(n -> n.kind == NodeKind.START_EVENT)
                .map(n -> n.lane)
                .findFirst()
                .orElse(declaredLanes.get(0));
    }
}
