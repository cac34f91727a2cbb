package org.swimlane.bpmn.layout;

import org.swimlane.bpmn.graph.models.Edge;
import org.swimlane.bpmn.graph.models.ProcessNode;
import org.swimlane.bpmn.layout.models.Bounds;
import org.swimlane.bpmn.layout.models.ExitSide;
import org.swimlane.bpmn.layout.models.Geometry;
import org.swimlane.bpmn.layout.models.Point;
import org.swimlane.bpmn.layout.models.RoutedEdge;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes orthogonal routes and label boxes for every edge.
 * <p>
 * Exit side: a gateway sends branches into other lanes out of its top or bottom (towards the
 * target lane) and spreads two or more same-lane branches over its sides; everything else leaves
 * on the right. Shape of the route depends on the column distance:
 * <ul>
 *     <li>corridor edges run through a vertical channel halfway between source and target,</li>
 *     <li>one column: a short vertical jog,</li>
 *     <li>several columns: a detour above both endpoints,</li>
 *     <li>backward edges: around the right side of the diagram.</li>
 * </ul>
 */
public class EdgeRouter {
    private final LayoutConfig config;

    public EdgeRouter(LayoutConfig config) {
        this.config = config;
    }

    public List<RoutedEdge> route(LayoutGraph graph, Geometry geometry) {
        List<RoutedEdge> routes = new ArrayList<>();
        for (ProcessNode source : graph.nodes()) {
            List<String> sameLaneBranches = sameLaneBranches(graph, source);
            for (int i = 0; i < source.outgoing.size(); i++) {
                Edge edge = source.outgoing.get(i);
                if (graph.node(edge.targetId) == null) {
                    continue;
                }
                routes.add(routeEdge(graph, geometry, source, i, edge, sameLaneBranches));
            }
        }
        return routes;
    }

    private RoutedEdge routeEdge(LayoutGraph graph, Geometry geometry, ProcessNode source, int index,
                                 Edge edge, List<String> sameLaneBranches) {
        ProcessNode target = graph.node(edge.targetId);
        Bounds from = geometry.node(source.id);
        Bounds to = geometry.node(target.id);
        int rankDiff = graph.rank(target.id) - graph.rank(source.id);
        boolean corridor = graph.isCorridor(source.id, target.id);
        boolean backward = rankDiff <= 0;

        ExitSide exit = exitSide(graph, source, target, sameLaneBranches);
        Point start = exitPoint(from, exit);
        Point end = new Point(to.x(), to.centerY());

        List<Point> points = new ArrayList<>();
        points.add(start);

        if (backward) {
            double farRight = geometry.pool().right();
            points.add(new Point(farRight, start.y()));
            points.add(new Point(farRight, end.y()));
        } else if (corridor) {
            double channelX = start.x() + (to.x() - start.x()) / 2;
            points.add(new Point(channelX, start.y()));
            points.add(new Point(channelX, end.y()));
        } else if (rankDiff == 1) {
            if (exit == ExitSide.RIGHT) {
                double jogX = start.x() + config.routingMargin * 2;
                points.add(new Point(jogX, start.y()));
                points.add(new Point(jogX, end.y()));
            } else {
                points.add(new Point(start.x(), end.y()));
            }
        } else {
            if (target.isGateway()) {
                // enter gateways from the top
                end = new Point(to.centerX(), to.y());
            }
            double detourY = Math.min(start.y(), end.y()) - config.verticalSpacing;
            double stubX = start.x() + config.routingMargin;
            points.add(new Point(stubX, start.y()));
            points.add(new Point(stubX, detourY));
            points.add(new Point(end.x(), detourY));
        }
        points.add(end);

        List<Point> waypoints = collapseDuplicates(points);
        return RoutedEdge.builder()
                .sourceId(source.id)
                .index(index)
                .targetId(target.id)
                .label(edge.label)
                .exitSide(exit)
                .waypoints(waypoints)
                .labelBounds(edge.hasLabel() ? labelBounds(source, edge.label, waypoints) : null)
                .corridor(corridor)
                .backward(backward)
                .build();
    }

    private ExitSide exitSide(LayoutGraph graph, ProcessNode source, ProcessNode target,
                              List<String> sameLaneBranches) {
        switch (source.kind.shape()) {
            case GATEWAY:
                int sourceLane = graph.laneIndexOf(source.id);
                int targetLane = graph.laneIndexOf(target.id);
                if (sourceLane != targetLane) {
                    return targetLane < sourceLane ? ExitSide.TOP : ExitSide.BOTTOM;
                }
                if (sameLaneBranches.size() >= 2) {
                    return branchSide(sameLaneBranches.indexOf(target.id), sameLaneBranches.size());
                }
                return ExitSide.RIGHT;
            case TASK:
            case EVENT:
            default:
                return ExitSide.RIGHT;
        }
    }

    /**
     * Two branches: top, bottom. Three: top, right, bottom. More: alternate top and bottom.
     */
    private static ExitSide branchSide(int branchIndex, int branchCount) {
        if (branchCount == 3) {
            return switch (branchIndex) {
                case 0 -> ExitSide.TOP;
                case 1 -> ExitSide.RIGHT;
                default -> ExitSide.BOTTOM;
            };
        }
        return branchIndex % 2 == 0 ? ExitSide.TOP : ExitSide.BOTTOM;
    }

    private static Point exitPoint(Bounds box, ExitSide side) {
        return switch (side) {
            case TOP -> new Point(box.centerX(), box.y());
            case BOTTOM -> new Point(box.centerX(), box.bottom());
            case RIGHT -> new Point(box.right(), box.centerY());
        };
    }

    /**
     * Targets of a gateway's edges that stay in the gateway's lane, in edge order.
     */
    private static List<String> sameLaneBranches(LayoutGraph graph, ProcessNode source) {
        List<String> branches = new ArrayList<>();
        if (!source.isGateway()) {
            return branches;
        }
        for (Edge edge : source.outgoing) {
            ProcessNode target = graph.node(edge.targetId);
            if (target != null && target.lane.equals(source.lane)) {
                branches.add(edge.targetId);
            }
        }
        return branches;
    }

    /**
     * Label box next to the first bend, pushed off the first segment. Width grows with the text.
     */
    private Bounds labelBounds(ProcessNode source, String label, List<Point> waypoints) {
        double width = label.length() * config.labelCharWidth;
        double height = config.labelHeight;
        Point start = waypoints.get(0);
        if (waypoints.size() < 2) {
            return new Bounds(start.x() + 5, start.y() - 25, width, height);
        }
        Point bend = waypoints.get(1);

        double x;
        double y;
        if (source.isGateway()) {
            if (start.x() == bend.x()) {
                x = bend.x() + 8;
                y = start.y() < bend.y() ? bend.y() + 15 : bend.y() - 15;
            } else {
                x = start.x() + (bend.x() - start.x()) / 2;
                y = bend.y() - 20;
            }
        } else {
            x = start.x() + 5;
            y = start.y() - 25;
        }
        return new Bounds(x, y, width, height);
    }

    private static List<Point> collapseDuplicates(List<Point> points) {
        List<Point> result = new ArrayList<>();
        for (Point point : points) {
            if (result.isEmpty() || !result.get(result.size() - 1).equals(point)) {
                result.add(point);
            }
        }
        return result;
    }
}
