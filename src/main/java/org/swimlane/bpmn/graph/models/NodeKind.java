package org.swimlane.bpmn.graph.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of flow node kinds the layout engine understands.
 * Each kind maps to the BPMN element it is serialized as and to the shape family
 * used for sizing and routing.
 */
public enum NodeKind {
    START_EVENT("startEvent", Shape.EVENT),
    END_EVENT("endEvent", Shape.EVENT),
    INTERMEDIATE_EVENT("intermediateThrowEvent", Shape.EVENT),
    TASK("task", Shape.TASK),
    USER_TASK("userTask", Shape.TASK),
    SERVICE_TASK("serviceTask", Shape.TASK),
    MANUAL_TASK("manualTask", Shape.TASK),
    EXCLUSIVE_GATEWAY("exclusiveGateway", Shape.GATEWAY),
    PARALLEL_GATEWAY("parallelGateway", Shape.GATEWAY),
    INCLUSIVE_GATEWAY("inclusiveGateway", Shape.GATEWAY);

    public enum Shape {
        TASK, GATEWAY, EVENT
    }

    private final String elementName;
    private final Shape shape;

    NodeKind(String elementName, Shape shape) {
        this.elementName = elementName;
        this.shape = shape;
    }

    /**
     * @return the local name of the BPMN element, e.g. "exclusiveGateway"
     */
    @JsonValue
    public String elementName() {
        return elementName;
    }

    public Shape shape() {
        return shape;
    }

    public boolean isGateway() {
        return shape == Shape.GATEWAY;
    }

    /**
     * Resolves a kind from its BPMN element name ("startEvent"), its constant name
     * ("START_EVENT") or a dashed form ("start-event"). Matching ignores case.
     *
     * @param value the raw kind string
     * @return the matching kind, or null for null input
     * @throws IllegalArgumentException if nothing matches
     */
    @JsonCreator
    public static NodeKind fromValue(String value) {
        if (value == null) {
            return null;
        }
        String wanted = simplify(value);
        for (NodeKind kind : values()) {
            if (simplify(kind.elementName).equals(wanted) || simplify(kind.name()).equals(wanted)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown node kind: '" + value + "'");
    }

    private static String simplify(String value) {
        return value.replace("_", "").replace("-", "").trim().toLowerCase(Locale.ROOT);
    }
}
