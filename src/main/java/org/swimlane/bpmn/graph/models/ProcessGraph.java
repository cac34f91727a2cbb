package org.swimlane.bpmn.graph.models;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the layout input: one process with its lanes and nodes.
 * Property names of the upstream German-language producer ("prozessname", "prozessziel", "akteure")
 * are accepted as aliases.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProcessGraph {

    @JsonAlias("prozessname")
    public String processName;

    @JsonAlias("prozessziel")
    public String goal;

    /**
     * Declared lanes (actor pools), in declaration order.
     */
    @JsonAlias("akteure")
    public List<String> lanes = new ArrayList<>();

    public List<ProcessNode> nodes = new ArrayList<>();

    public ProcessGraph() {
    }

    public ProcessGraph(String processName, String goal, List<String> lanes) {
        this.processName = processName;
        this.goal = goal;
        this.lanes = new ArrayList<>(lanes);
    }

    public ProcessNode addNode(String id, NodeKind kind, String label, String lane) {
        ProcessNode node = new ProcessNode(id, kind, label, lane);
        nodes.add(node);
        return node;
    }

    public ProcessNode findNode(String id) {
        if (nodes == null) {
            return null;
        }
        return nodes.stream()
                .filter(n -> n != null && n.id != null && n.id.equals(id))
                .findFirst()
                .orElse(null);
    }

    public int edgeCount() {
        return nodes == null ? 0 : nodes.stream()
                .filter(n -> n != null && n.outgoing != null)
                .mapToInt(n -> n.outgoing.size())
                .sum();
    }

    /**
     * Deep copy; the layout pipeline only ever mutates copies.
     */
    public ProcessGraph copy() {
        ProcessGraph copy = new ProcessGraph(processName, goal, lanes == null ? List.of() : lanes);
        if (nodes != null) {
            for (ProcessNode node : nodes) {
                if (node != null) {
                    copy.nodes.add(node.copy());
                }
            }
        }
        return copy;
    }
}
