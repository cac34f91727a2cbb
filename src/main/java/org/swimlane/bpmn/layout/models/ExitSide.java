package org.swimlane.bpmn.layout.models;

public enum ExitSide {
    TOP, RIGHT, BOTTOM
}
