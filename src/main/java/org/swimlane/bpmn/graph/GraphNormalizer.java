package org.swimlane.bpmn.graph;

import lombok.extern.slf4j.Slf4j;
import org.swimlane.bpmn.graph.models.Edge;
import org.swimlane.bpmn.graph.models.NodeKind;
import org.swimlane.bpmn.graph.models.ProcessGraph;
import org.swimlane.bpmn.graph.models.ProcessNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Repairs structural violations before layout.
 * <p>
 * A plain task or event may have at most one incoming flow. Every merge point into such a node
 * gets a converging exclusive gateway in front of it, and all of the node's predecessors are
 * rerouted onto that gateway. Edges pointing to unknown nodes are dropped.
 */
@Slf4j
public class GraphNormalizer {

    static final String MERGE_GATEWAY_PREFIX = "Gateway_merge_";

    /**
     * Returns a normalized copy of the graph. The argument is not modified.
     *
     * @param graph the graph to normalize
     * @return a copy in which every non-gateway node has in-degree of at most one
     */
    public ProcessGraph normalize(ProcessGraph graph) {
        ProcessGraph copy = graph.copy();
        dropDanglingEdges(copy);
        insertMergeGateways(copy);
        return copy;
    }

    private void dropDanglingEdges(ProcessGraph graph) {
        Set<String> knownIds = new HashSet<>();
        graph.nodes.forEach(n -> knownIds.add(n.id));

        for (ProcessNode node : graph.nodes) {
            Iterator<Edge> it = node.outgoing.iterator();
            while (it.hasNext()) {
                Edge edge = it.next();
                if (edge.targetId == null || !knownIds.contains(edge.targetId)) {
                    log.warn("Dropping edge {} -> {}: target node does not exist", node.id, edge.targetId);
                    it.remove();
                }
            }
        }
    }

    private void insertMergeGateways(ProcessGraph graph) {
        // predecessors per target, in node order
        Map<String, Set<String>> predecessors = new LinkedHashMap<>();
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (ProcessNode node : graph.nodes) {
            for (Edge edge : node.outgoing) {
                predecessors.computeIfAbsent(edge.targetId, k -> new LinkedHashSet<>()).add(node.id);
                inDegree.merge(edge.targetId, 1, Integer::sum);
            }
        }

        Set<String> usedIds = new HashSet<>();
        graph.nodes.forEach(n -> usedIds.add(n.id));

        List<ProcessNode> mergeGateways = new ArrayList<>();
        for (ProcessNode node : graph.nodes) {
            if (node.isGateway() || inDegree.getOrDefault(node.id, 0) <= 1) {
                continue;
            }

            String gatewayId = freshId(MERGE_GATEWAY_PREFIX + node.id, usedIds);
            ProcessNode gateway = new ProcessNode(gatewayId, NodeKind.EXCLUSIVE_GATEWAY, "", node.lane);
            gateway.connectTo(node.id);

            Set<String> sources = predecessors.get(node.id);
            for (ProcessNode source : graph.nodes) {
                if (!sources.contains(source.id)) {
                    continue;
                }
                for (Edge edge : source.outgoing) {
                    if (node.id.equals(edge.targetId)) {
                        edge.targetId = gatewayId;
                    }
                }
            }

            log.debug("Inserted converging gateway {} in front of {} ({} incoming flows)",
                    gatewayId, node.id, inDegree.get(node.id));
            mergeGateways.add(gateway);
        }

        graph.nodes.addAll(mergeGateways);
    }

    private static String freshId(String base, Set<String> usedIds) {
        String candidate = base;
        int suffix = 1;
        while (usedIds.contains(candidate)) {
            candidate = base + "_" + suffix++;
        }
        usedIds.add(candidate);
        return candidate;
    }
}
