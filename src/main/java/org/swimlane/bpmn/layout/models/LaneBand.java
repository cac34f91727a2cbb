package org.swimlane.bpmn.layout.models;

/**
 * Vertical band a lane occupies inside the pool.
 *
 * @param lane   lane name
 * @param order  position in the lane sequence, 0 is the topmost lane
 * @param bounds the band, excluding the pool header
 */
public record LaneBand(String lane, int order, Bounds bounds) {
}
