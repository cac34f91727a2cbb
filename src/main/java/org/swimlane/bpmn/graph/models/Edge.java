package org.swimlane.bpmn.graph.models;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Outgoing control flow of a process node.
 * <p>
 * Example:
 * {
 * "targetId": "node_4",
 * "label": "Yes (< 100€)"
 * }
 * A bare string ("node_4") is accepted as well and means an unlabeled edge.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Edge {

    /**
     * Id of the node this edge points to.
     * Producers also send it as "target_id" or "id".
     */
    @JsonAlias({"target_id", "id"})
    public String targetId;

    /**
     * Condition text, usually only set on edges leaving a gateway.
     */
    public String label;

    public Edge() {
    }

    // used by Jackson for plain string entries
    public Edge(String targetId) {
        this.targetId = targetId;
    }

    public static Edge to(String targetId, String label) {
        Edge edge = new Edge(targetId);
        edge.label = label;
        return edge;
    }

    public boolean hasLabel() {
        return label != null && !label.isEmpty();
    }

    public Edge copy() {
        return Edge.to(targetId, label);
    }

    @Override
    public String toString() {
        return "Edge{targetId='" + targetId + "', label='" + label + "'}";
    }
}
