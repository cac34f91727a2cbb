package org.swimlane.bpmn.layout;

import lombok.extern.slf4j.Slf4j;
import org.swimlane.bpmn.LayoutException;
import org.swimlane.bpmn.graph.models.ProcessNode;

import java.util.LinkedHashSet;

/**
 * Pushes back the targets of edges that would cut through occupied columns of unrelated lanes.
 * <p>
 * An edge u -> v whose lanes are more than one position apart collides with every node n in a
 * lane strictly between them with {@code rank(u) <= rank(n) < rank(v)}. Such an edge becomes a
 * corridor edge and v moves to two columns past the furthest obstruction. Any change restarts the
 * scan; the number of scans is capped at nodeCount squared.
 */
@Slf4j
public class CollisionResolver {

    public void resolve(LayoutGraph graph) {
        int ceiling = Math.max(1, graph.nodeCount() * graph.nodeCount());
        RankPropagator propagator = new RankPropagator(graph);

        int passes = 0;
        boolean adjusted = true;
        while (adjusted) {
            if (passes == ceiling) {
                throw new LayoutException(LayoutException.Reason.LAYOUT_NOT_CONVERGED, null,
                        "Cross-lane collision resolution did not converge after " + ceiling
                                + " passes for process '" + graph.graph().processName + "'.");
            }
            passes++;
            adjusted = scan(graph, propagator);
        }
        log.debug("Collision resolution finished after {} passes, {} corridor edges",
                passes, graph.corridorEdges().size());
    }

    /**
     * @return true if a rank was raised, in which case the caller must scan again
     */
    private boolean scan(LayoutGraph graph, RankPropagator propagator) {
        for (ProcessNode source : graph.nodes()) {
            for (String targetId : new LinkedHashSet<>(graph.forwardSuccessors(source.id))) {
                int sourceLane = graph.laneIndexOf(source.id);
                int targetLane = graph.laneIndexOf(targetId);
                if (Math.abs(sourceLane - targetLane) <= 1) {
                    continue;
                }

                int maxObstructionRank = maxObstructionRank(graph, source.id, targetId,
                        Math.min(sourceLane, targetLane), Math.max(sourceLane, targetLane));
                if (maxObstructionRank < 0) {
                    continue;
                }

                graph.markCorridor(source.id, targetId);
                int required = maxObstructionRank + 2;
                if (graph.rank(targetId) < required) {
                    log.debug("Edge {} -> {} crosses occupied lanes; raising {} from rank {} to {}",
                            source.id, targetId, targetId, graph.rank(targetId), required);
                    propagator.raise(targetId, required);
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * @return the highest rank among obstructing nodes, or -1 if nothing is in the way
     */
    private int maxObstructionRank(LayoutGraph graph, String sourceId, String targetId,
                                   int minLane, int maxLane) {
        int sourceRank = graph.rank(sourceId);
        int targetRank = graph.rank(targetId);
        int max = -1;
        for (ProcessNode node : graph.nodes()) {
            if (node.id.equals(sourceId) || node.id.equals(targetId)) {
                continue;
            }
            int lane = graph.laneIndexOf(node.id);
            int rank = graph.rank(node.id);
            boolean laneBetween = minLane < lane && lane < maxLane;
            boolean rankBetween = sourceRank <= rank && rank < targetRank;
            if (laneBetween && rankBetween) {
                max = Math.max(max, rank);
            }
        }
        return max;
    }
}
