package org.swimlane.bpmn.layout;

import lombok.extern.slf4j.Slf4j;
import org.swimlane.bpmn.graph.models.ProcessNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assigns every node a rank (layout column) by longest-path layering over the forward edges,
 * then aligns the branches leaving each diverging gateway on one column.
 */
@Slf4j
public class RankAssigner {

    public void assignRanks(LayoutGraph graph) {
        layer(graph);
        graph.setSyncGroups(collectSyncGroups(graph));
        synchronizeGatewayBranches(graph);
        log.debug("Assigned ranks {}", graph.ranks());
    }

    /**
     * Kahn-style topological pass: each node ends up one column right of its furthest predecessor.
     */
    private void layer(LayoutGraph graph) {
        Map<String, Integer> pendingInDegree = new LinkedHashMap<>();
        for (ProcessNode node : graph.nodes()) {
            graph.setRank(node.id, 0);
            pendingInDegree.putIfAbsent(node.id, 0);
            for (String target : graph.forwardSuccessors(node.id)) {
                pendingInDegree.merge(target, 1, Integer::sum);
            }
        }

        Deque<String> queue = new ArrayDeque<>();
        pendingInDegree.forEach((nodeId, degree) -> {
            if (degree == 0) {
                queue.add(nodeId);
            }
        });

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : graph.forwardSuccessors(current)) {
                graph.setRank(next, Math.max(graph.rank(next), graph.rank(current) + 1));
                if (pendingInDegree.merge(next, -1, Integer::sum) == 0) {
                    queue.add(next);
                }
            }
        }
    }

    /**
     * For every diverging gateway, the successors that get aligned. A successor that itself
     * leads to another successor of the same gateway is left out, since it has to stay left of it.
     * Members are admitted one by one; a member whose alignment together with the groups accepted
     * so far would force a node right of itself is left out as well.
     */
    private Map<String, List<String>> collectSyncGroups(LayoutGraph graph) {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        Map<String, String> alignedWith = new HashMap<>();
        for (ProcessNode node : graph.nodes()) {
            if (!node.isGateway() || graph.successors(node.id).size() <= 1) {
                continue;
            }
            List<String> branches = new ArrayList<>(new LinkedHashSet<>(graph.forwardSuccessors(node.id)));
            List<String> group = new ArrayList<>();
            for (String branch : branches) {
                boolean leadsToSibling = branches.stream()
                        .anyMatch(other -> !other.equals(branch) && graph.reaches(branch, other));
                if (leadsToSibling) {
                    continue;
                }
                if (group.isEmpty()) {
                    group.add(branch);
                    continue;
                }
                Map<String, String> candidate = new HashMap<>(alignedWith);
                union(candidate, group.get(0), branch);
                if (isOrderable(graph, candidate)) {
                    alignedWith.clear();
                    alignedWith.putAll(candidate);
                    group.add(branch);
                } else {
                    log.debug("Not aligning {} with the other branches of gateway {}; "
                            + "it conflicts with the flow order of another gateway", branch, node.id);
                }
            }
            if (group.size() > 1) {
                groups.put(node.id, group);
            }
        }
        return groups;
    }

    private static String representative(Map<String, String> alignedWith, String nodeId) {
        String current = nodeId;
        String parent = alignedWith.get(current);
        while (parent != null && !parent.equals(current)) {
            current = parent;
            parent = alignedWith.get(current);
        }
        return current;
    }

    private static void union(Map<String, String> alignedWith, String first, String second) {
        String a = representative(alignedWith, first);
        String b = representative(alignedWith, second);
        if (!a.equals(b)) {
            alignedWith.put(b, a);
        }
    }

    /**
     * True if ranks exist that put every forward edge left to right while aligned nodes share a
     * column, i.e. the forward edges between alignment classes form no cycle.
     */
    private static boolean isOrderable(LayoutGraph graph, Map<String, String> alignedWith) {
        Map<String, Set<String>> successors = new LinkedHashMap<>();
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (ProcessNode node : graph.nodes()) {
            inDegree.putIfAbsent(representative(alignedWith, node.id), 0);
        }
        for (ProcessNode node : graph.nodes()) {
            String from = representative(alignedWith, node.id);
            for (String next : graph.forwardSuccessors(node.id)) {
                String to = representative(alignedWith, next);
                if (from.equals(to)) {
                    return false;
                }
                if (successors.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to)) {
                    inDegree.merge(to, 1, Integer::sum);
                }
            }
        }

        Deque<String> queue = new ArrayDeque<>();
        inDegree.forEach((classId, degree) -> {
            if (degree == 0) {
                queue.add(classId);
            }
        });
        int visited = 0;
        while (!queue.isEmpty()) {
            String current = queue.poll();
            visited++;
            for (String next : successors.getOrDefault(current, Set.of())) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    queue.add(next);
                }
            }
        }
        return visited == inDegree.size();
    }

    private void synchronizeGatewayBranches(LayoutGraph graph) {
        RankPropagator propagator = new RankPropagator(graph);
        for (List<String> group : graph.syncGroups().values()) {
            int target = group.stream().mapToInt(graph::rank).max().orElse(0);
            for (String member : group) {
                propagator.raise(member, target);
            }
        }
    }
}
