package org.swimlane.bpmn.layout;

import org.swimlane.bpmn.graph.models.NodeKind;
import org.swimlane.bpmn.graph.models.ProcessNode;
import org.swimlane.bpmn.layout.models.Bounds;
import org.swimlane.bpmn.layout.models.Geometry;
import org.swimlane.bpmn.layout.models.LaneBand;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns (lane, rank) into absolute boxes. Lanes are stacked top to bottom in sequence order,
 * each tall enough for its most crowded column; columns are a fixed pitch apart.
 */
public class GeometryEngine {
    private final LayoutConfig config;

    public GeometryEngine(LayoutConfig config) {
        this.config = config;
    }

    public Geometry compute(LayoutGraph graph) {
        double pitch = config.columnPitch();
        double contentLeft = config.poolPaddingX + config.laneHeaderWidth + config.laneContentPaddingX;
        // one spare column on the right
        double poolWidth = config.laneHeaderWidth + config.laneContentPaddingX + (graph.maxRank() + 2) * pitch;

        Map<String, LaneBand> lanes = new LinkedHashMap<>();
        Map<String, Bounds> boxes = new LinkedHashMap<>();
        double laneY = config.poolPaddingY;

        List<String> laneOrder = graph.laneOrder();
        for (int order = 0; order < laneOrder.size(); order++) {
            String lane = laneOrder.get(order);

            TreeMap<Integer, List<String>> columns = new TreeMap<>();
            for (ProcessNode node : graph.nodes()) {
                if (lane.equals(node.lane)) {
                    columns.computeIfAbsent(graph.rank(node.id), k -> new ArrayList<>()).add(node.id);
                }
            }
            int crowded = columns.values().stream().mapToInt(List::size).max().orElse(1);
            double laneHeight = crowded * (config.taskHeight + config.verticalSpacing)
                    + config.lanePaddingTop + config.lanePaddingBottom;

            for (Map.Entry<Integer, List<String>> column : columns.entrySet()) {
                List<String> ids = column.getValue();
                ids.sort(null);
                double slot = laneHeight / (ids.size() + 1);
                for (int j = 0; j < ids.size(); j++) {
                    ProcessNode node = graph.node(ids.get(j));
                    double width = widthOf(node.kind);
                    double height = heightOf(node.kind);
                    double x = contentLeft + column.getKey() * pitch;
                    double y = laneY + slot * (j + 1) - height / 2;
                    boxes.put(node.id, new Bounds(x, y, width, height));
                }
            }

            Bounds band = new Bounds(config.poolPaddingX + config.laneHeaderWidth, laneY,
                    poolWidth - config.laneHeaderWidth, laneHeight);
            lanes.put(lane, new LaneBand(lane, order, band));
            laneY += laneHeight;
        }

        // keep node order for the serializer
        Map<String, Bounds> ordered = new LinkedHashMap<>();
        for (ProcessNode node : graph.nodes()) {
            ordered.put(node.id, boxes.get(node.id));
        }

        Bounds pool = new Bounds(config.poolPaddingX, config.poolPaddingY, poolWidth, laneY - config.poolPaddingY);
        return new Geometry(lanes, ordered, pool);
    }

    double widthOf(NodeKind kind) {
        return switch (kind.shape()) {
            case TASK -> config.taskWidth;
            case GATEWAY -> config.gatewayWidth;
            case EVENT -> config.eventWidth;
        };
    }

    double heightOf(NodeKind kind) {
        return switch (kind.shape()) {
            case TASK -> config.taskHeight;
            case GATEWAY -> config.gatewayHeight;
            case EVENT -> config.eventHeight;
        };
    }
}
