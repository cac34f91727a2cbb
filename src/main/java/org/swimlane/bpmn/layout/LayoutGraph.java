package org.swimlane.bpmn.layout;

import org.swimlane.bpmn.graph.models.Edge;
import org.swimlane.bpmn.graph.models.ProcessGraph;
import org.swimlane.bpmn.graph.models.ProcessNode;
import org.swimlane.bpmn.layout.models.EdgeKey;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Working state of one layout run: the normalized nodes indexed by id, adjacency in both
 * directions, the back edges that close cycles, ranks, gateway synchronization groups, the
 * lane sequence and the corridor edges. Built once per run and never shared.
 */
public class LayoutGraph {
    private static final int ON_PATH = 1;
    private static final int DONE = 2;

    private final ProcessGraph graph;
    private final Map<String, ProcessNode> nodesById = new LinkedHashMap<>();
    private final Map<String, List<String>> successors = new LinkedHashMap<>();
    private final Map<String, List<String>> predecessors = new LinkedHashMap<>();
    private final Set<EdgeKey> backEdges = new LinkedHashSet<>();
    private final Map<String, Integer> ranks = new LinkedHashMap<>();
    private final Map<String, List<String>> syncGroups = new LinkedHashMap<>();
    private final Set<EdgeKey> corridorEdges = new LinkedHashSet<>();
    private final Map<String, Integer> laneIndex = new HashMap<>();
    private List<String> laneOrder = List.of();

    /**
     * @param graph a normalized graph owned by this run
     */
    public LayoutGraph(ProcessGraph graph) {
        this.graph = graph;
        for (ProcessNode node : graph.nodes) {
            nodesById.put(node.id, node);
            successors.put(node.id, new ArrayList<>());
            predecessors.put(node.id, new ArrayList<>());
            ranks.put(node.id, 0);
        }
        for (ProcessNode node : graph.nodes) {
            for (Edge edge : node.outgoing) {
                if (nodesById.containsKey(edge.targetId)) {
                    successors.get(node.id).add(edge.targetId);
                    predecessors.get(edge.targetId).add(node.id);
                }
            }
        }
        detectBackEdges();
    }

    public ProcessGraph graph() {
        return graph;
    }

    public Collection<ProcessNode> nodes() {
        return nodesById.values();
    }

    public ProcessNode node(String nodeId) {
        return nodesById.get(nodeId);
    }

    public int nodeCount() {
        return nodesById.size();
    }

    public int edgeCount() {
        return successors.values().stream().mapToInt(List::size).sum();
    }

    /**
     * All successors in edge order, one entry per edge.
     */
    public List<String> successors(String nodeId) {
        return successors.get(nodeId);
    }

    /**
     * All predecessors in node order, one entry per edge.
     */
    public List<String> predecessors(String nodeId) {
        return predecessors.get(nodeId);
    }

    /**
     * Successors reached over edges that do not close a cycle.
     */
    public List<String> forwardSuccessors(String nodeId) {
        List<String> result = new ArrayList<>();
        for (String target : successors.get(nodeId)) {
            if (!isBackEdge(nodeId, target)) {
                result.add(target);
            }
        }
        return result;
    }

    public boolean isBackEdge(String sourceId, String targetId) {
        return backEdges.contains(new EdgeKey(sourceId, targetId));
    }

    public Set<EdgeKey> backEdges() {
        return Collections.unmodifiableSet(backEdges);
    }

    // ------ Lanes

    public String laneOf(String nodeId) {
        return nodesById.get(nodeId).lane;
    }

    public void moveToLane(String nodeId, String lane) {
        nodesById.get(nodeId).lane = lane;
    }

    public List<String> laneOrder() {
        return laneOrder;
    }

    public void setLaneOrder(List<String> laneOrder) {
        this.laneOrder = List.copyOf(laneOrder);
        laneIndex.clear();
        for (int i = 0; i < laneOrder.size(); i++) {
            laneIndex.put(laneOrder.get(i), i);
        }
    }

    /**
     * @return position of the node's lane in the lane sequence
     */
    public int laneIndexOf(String nodeId) {
        Integer index = laneIndex.get(laneOf(nodeId));
        if (index == null) {
            throw new IllegalStateException("Lane '" + laneOf(nodeId) + "' of node '" + nodeId
                    + "' is not part of the lane sequence " + laneOrder);
        }
        return index;
    }

    // ------ Ranks

    public int rank(String nodeId) {
        return ranks.get(nodeId);
    }

    public void setRank(String nodeId, int rank) {
        ranks.put(nodeId, rank);
    }

    public Map<String, Integer> ranks() {
        return Collections.unmodifiableMap(ranks);
    }

    public int maxRank() {
        return ranks.values().stream().mapToInt(Integer::intValue).max().orElse(0);
    }

    /**
     * Successor groups of diverging gateways whose ranks are kept aligned, keyed by gateway id.
     */
    public Map<String, List<String>> syncGroups() {
        return Collections.unmodifiableMap(syncGroups);
    }

    public void setSyncGroups(Map<String, List<String>> groups) {
        syncGroups.clear();
        syncGroups.putAll(groups);
    }

    // ------ Corridors

    public void markCorridor(String sourceId, String targetId) {
        corridorEdges.add(new EdgeKey(sourceId, targetId));
    }

    public boolean isCorridor(String sourceId, String targetId) {
        return corridorEdges.contains(new EdgeKey(sourceId, targetId));
    }

    public Set<EdgeKey> corridorEdges() {
        return Collections.unmodifiableSet(corridorEdges);
    }

    /**
     * Whether {@code to} can be reached from {@code from} over forward edges.
     */
    public boolean reaches(String from, String to) {
        Deque<String> queue = new ArrayDeque<>();
        Set<String> visited = new LinkedHashSet<>();
        queue.add(from);
        visited.add(from);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : forwardSuccessors(current)) {
                if (next.equals(to)) {
                    return true;
                }
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return false;
    }

    /**
     * Depth-first search from the in-degree-zero nodes (then any node not yet seen), in node
     * order. An edge into a node on the current search path closes a cycle.
     */
    private void detectBackEdges() {
        List<String> roots = new ArrayList<>();
        for (String nodeId : nodesById.keySet()) {
            if (predecessors.get(nodeId).isEmpty()) {
                roots.add(nodeId);
            }
        }
        roots.addAll(nodesById.keySet());

        Map<String, Integer> state = new HashMap<>();
        for (String root : roots) {
            if (state.containsKey(root)) {
                continue;
            }
            Deque<String> path = new ArrayDeque<>();
            Deque<Iterator<String>> pending = new ArrayDeque<>();
            state.put(root, ON_PATH);
            path.push(root);
            pending.push(successors.get(root).iterator());

            while (!pending.isEmpty()) {
                Iterator<String> it = pending.peek();
                if (it.hasNext()) {
                    String next = it.next();
                    Integer nextState = state.get(next);
                    if (nextState == null) {
                        state.put(next, ON_PATH);
                        path.push(next);
                        pending.push(successors.get(next).iterator());
                    } else if (nextState == ON_PATH) {
                        backEdges.add(new EdgeKey(path.peek(), next));
                    }
                } else {
                    pending.pop();
                    state.put(path.pop(), DONE);
                }
            }
        }
    }
}
