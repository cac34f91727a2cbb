package org.swimlane.bpmn;

/**
 * Raised when a process graph cannot be laid out. Carries the reason and, where one
 * exists, the id of the offending node or edge source.
 */
public class LayoutException extends RuntimeException {

    public enum Reason {
        /** The graph has no nodes. */
        EMPTY_GRAPH,
        /** A node references a lane that is not declared. */
        UNKNOWN_LANE,
        /** Structural contract violation: missing id, kind or lane, duplicate ids, no lanes. */
        INVALID_GRAPH,
        /** The JSON input could not be read or does not match the input schema. */
        INVALID_INPUT,
        /** Rank propagation or collision resolution hit its iteration ceiling. */
        LAYOUT_NOT_CONVERGED
    }

    private final Reason reason;
    private final String elementId;

    public LayoutException(Reason reason, String elementId, String message) {
        super(message);
        this.reason = reason;
        this.elementId = elementId;
    }

    public LayoutException(Reason reason, String elementId, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.elementId = elementId;
    }

    public Reason getReason() {
        return reason;
    }

    public String getElementId() {
        return elementId;
    }
}
