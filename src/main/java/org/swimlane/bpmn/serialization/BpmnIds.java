package org.swimlane.bpmn.serialization;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.UUID;

/**
 * Deterministic element ids. Every id is a name-based UUID derived from the process name and the
 * role of the element, so the same input always yields the same document. Input node ids are not
 * reused because they need not be valid XML ids.
 */
public final class BpmnIds {
    private static final String PREFIX = "sid-";
    private static final String SHAPE_SUFFIX = "_gui";

    private final String scope;

    public BpmnIds(String processName) {
        this.scope = processName == null ? "" : processName;
    }

    public String definitions() {
        return id("definitions");
    }

    public String collaboration() {
        return id("collaboration");
    }

    public String participant() {
        return id("participant");
    }

    public String process() {
        return id("process");
    }

    public String laneSet() {
        return id("laneSet");
    }

    public String lane(String laneName) {
        return id("lane#" + laneName);
    }

    public String node(String nodeId) {
        return id("node#" + nodeId);
    }

    public String flow(String sourceId, int index) {
        return id("flow#" + sourceId + "#" + index);
    }

    public String diagram() {
        return id("diagram");
    }

    public String plane() {
        return id("plane");
    }

    public String labelStyle() {
        return id("labelStyle");
    }

    public static String shape(String elementId) {
        return elementId + SHAPE_SUFFIX;
    }

    private String id(String role) {
        UUID uuid = UUID.nameUUIDFromBytes((scope + "#" + role).getBytes(StandardCharsets.UTF_8));
        return PREFIX + uuid.toString().toUpperCase(Locale.ROOT);
    }
}
