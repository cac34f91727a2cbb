package org.swimlane.bpmn.graph.models;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * A flow node (event, task or gateway) of the input process graph.
 * <p>
 * Example:
 * {
 * "id": "node_3",
 * "kind": "exclusiveGateway",
 * "label": "Amount < 100€?",
 * "lane": "Accounting",
 * "outgoing": [{"targetId": "node_4", "label": "Yes"}, {"targetId": "node_6", "label": "No"}]
 * }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProcessNode {

    public String id;

    @JsonAlias("type")
    public NodeKind kind;

    public String label;

    /**
     * Name of the lane (actor) this node belongs to. Must be one of the declared lanes.
     */
    public String lane;

    @JsonAlias("next_nodes")
    public List<Edge> outgoing = new ArrayList<>();

    public ProcessNode() {
    }

    public ProcessNode(String id, NodeKind kind, String label, String lane) {
        this.id = id;
        this.kind = kind;
        this.label = label;
        this.lane = lane;
    }

    public ProcessNode connectTo(String targetId) {
        return connectTo(targetId, null);
    }

    public ProcessNode connectTo(String targetId, String label) {
        outgoing.add(Edge.to(targetId, label));
        return this;
    }

    public boolean isGateway() {
        return kind != null && kind.isGateway();
    }

    public boolean hasLabel() {
        return label != null && !label.isEmpty();
    }

    public ProcessNode copy() {
        ProcessNode copy = new ProcessNode(id, kind, label, lane);
        if (outgoing != null) {
            for (Edge edge : outgoing) {
                if (edge != null) {
                    copy.outgoing.add(edge.copy());
                }
            }
        }
        return copy;
    }

    @Override
    public String toString() {
        return "ProcessNode{id='" + id + "', kind=" + kind + ", lane='" + lane + "', outgoing=" + outgoing + "}";
    }
}
