package org.swimlane.bpmn.layout;

import org.swimlane.bpmn.LayoutException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Raises ranks while keeping two constraints: rank(v) >= rank(u) + 1 for every forward edge,
 * and equal ranks inside every gateway synchronization group. Ranks only ever grow.
 * <p>
 * Work-list relaxation in FIFO order; a node is re-queued only when its rank changed. The
 * number of relaxation steps is capped, and hitting the cap means the constraints contradict
 * each other.
 */
class RankPropagator {
    private final LayoutGraph graph;
    private final Map<String, List<List<String>>> groupsByMember = new LinkedHashMap<>();
    private final long ceiling;

    RankPropagator(LayoutGraph graph) {
        this.graph = graph;
        for (List<String> group : graph.syncGroups().values()) {
            for (String member : group) {
                groupsByMember.computeIfAbsent(member, k -> new ArrayList<>()).add(group);
            }
        }
        long n = graph.nodeCount();
        this.ceiling = 2 * n * (n + 1) + graph.edgeCount();
    }

    /**
     * Raises the node to at least {@code rank} and propagates the change.
     *
     * @return true if any rank changed
     * @throws LayoutException with reason LAYOUT_NOT_CONVERGED if propagation does not settle
     */
    boolean raise(String nodeId, int rank) {
        if (graph.rank(nodeId) >= rank) {
            return false;
        }
        graph.setRank(nodeId, rank);

        Deque<String> queue = new ArrayDeque<>();
        Set<String> queued = new HashSet<>();
        queue.add(nodeId);
        queued.add(nodeId);
        long steps = 0;

        while (!queue.isEmpty()) {
            if (++steps > ceiling) {
                throw new LayoutException(LayoutException.Reason.LAYOUT_NOT_CONVERGED, nodeId,
                        "Rank propagation from node '" + nodeId + "' did not settle after " + ceiling
                                + " steps; gateway alignment and flow order contradict each other.");
            }
            String current = queue.poll();
            queued.remove(current);
            int currentRank = graph.rank(current);

            for (String next : graph.forwardSuccessors(current)) {
                if (graph.rank(next) <= currentRank) {
                    graph.setRank(next, currentRank + 1);
                    if (queued.add(next)) {
                        queue.add(next);
                    }
                }
            }
            for (List<String> group : groupsByMember.getOrDefault(current, List.of())) {
                for (String sibling : group) {
                    if (graph.rank(sibling) < currentRank) {
                        graph.setRank(sibling, currentRank);
                        if (queued.add(sibling)) {
                            queue.add(sibling);
                        }
                    }
                }
            }
        }
        return true;
    }
}
