package org.swimlane.bpmn.layout;

import org.junit.jupiter.api.Test;
import org.swimlane.bpmn.graph.models.NodeKind;
import org.swimlane.bpmn.graph.models.ProcessGraph;
import org.swimlane.bpmn.layout.models.Bounds;
import org.swimlane.bpmn.layout.models.ExitSide;
import org.swimlane.bpmn.layout.models.Geometry;
import org.swimlane.bpmn.layout.models.Point;
import org.swimlane.bpmn.layout.models.RoutedEdge;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EdgeRouterTest {
    private final LayoutConfig config = LayoutConfig.defaults();

    private record Routed(LayoutGraph graph, Geometry geometry, List<RoutedEdge> edges) {
        RoutedEdge edge(String sourceId, String targetId) {
            return edges.stream()
                    .filter(e -> e.sourceId().equals(sourceId) && e.targetId().equals(targetId))
                    .findFirst()
                    .orElseThrow();
        }
    }

    private Routed route(ProcessGraph graph) {
        LayoutGraph layoutGraph = new LayoutGraph(graph);
        layoutGraph.setLaneOrder(graph.lanes);
        new RankAssigner().assignRanks(layoutGraph);
        new CollisionResolver().resolve(layoutGraph);
        Geometry geometry = new GeometryEngine(config).compute(layoutGraph);
        return new Routed(layoutGraph, geometry, new EdgeRouter(config).route(layoutGraph, geometry));
    }

    private static void assertOrthogonal(RoutedEdge edge) {
        List<Point> points = edge.waypoints();
        assertTrue(points.size() >= 2, "Route of " + edge.sourceId() + " -> " + edge.targetId() + " is too short");
        for (int i = 1; i < points.size(); i++) {
            Point a = points.get(i - 1);
            Point b = points.get(i);
            assertTrue(a.x() == b.x() || a.y() == b.y(),
                    "Diagonal segment " + a + " -> " + b + " in " + edge.sourceId() + " -> " + edge.targetId());
            assertNotEquals(a, b);
        }
    }

    private static boolean onBorder(Bounds box, Point point) {
        boolean onVertical = (point.x() == box.x() || point.x() == box.right())
                && point.y() >= box.y() && point.y() <= box.bottom();
        boolean onHorizontal = (point.y() == box.y() || point.y() == box.bottom())
                && point.x() >= box.x() && point.x() <= box.right();
        return onVertical || onHorizontal;
    }

    private static ProcessGraph decisionGraph() {
        ProcessGraph graph = new ProcessGraph("Decision", null, List.of("A"));
        graph.addNode("s", NodeKind.START_EVENT, "Start", "A").connectTo("g");
        graph.addNode("g", NodeKind.EXCLUSIVE_GATEWAY, "Approved?", "A")
                .connectTo("a", "yes")
                .connectTo("b", "no");
        graph.addNode("a", NodeKind.TASK, "Pay", "A").connectTo("e1");
        graph.addNode("b", NodeKind.TASK, "Reject", "A").connectTo("e2");
        graph.addNode("e1", NodeKind.END_EVENT, "Paid", "A");
        graph.addNode("e2", NodeKind.END_EVENT, "Rejected", "A");
        return graph;
    }

    @Test
    void shouldRouteEveryEdgeOrthogonallyBetweenShapeBorders() {
        Routed routed = route(decisionGraph());

        assertEquals(6, routed.edges().size());
        for (RoutedEdge edge : routed.edges()) {
            assertOrthogonal(edge);
            List<Point> points = edge.waypoints();
            assertTrue(onBorder(routed.geometry().node(edge.sourceId()), points.get(0)));
            assertTrue(onBorder(routed.geometry().node(edge.targetId()), points.get(points.size() - 1)));
        }
    }

    @Test
    void shouldSplitTwoSameLaneBranchesOverTopAndBottom() {
        Routed routed = route(decisionGraph());

        RoutedEdge yes = routed.edge("g", "a");
        RoutedEdge no = routed.edge("g", "b");
        assertEquals(ExitSide.TOP, yes.exitSide());
        assertEquals(ExitSide.BOTTOM, no.exitSide());

        Bounds gateway = routed.geometry().node("g");
        assertEquals(new Point(gateway.centerX(), gateway.y()), yes.waypoints().get(0));
        assertEquals(new Point(gateway.centerX(), gateway.bottom()), no.waypoints().get(0));
        // one column apart: straight up, then right into the target
        assertEquals(3, yes.waypoints().size());
        assertEquals(ExitSide.RIGHT, routed.edge("s", "g").exitSide());
    }

    @Test
    void shouldUseTopRightBottomForThreeBranches() {
        ProcessGraph graph = new ProcessGraph("Three", null, List.of("A"));
        graph.addNode("g", NodeKind.INCLUSIVE_GATEWAY, "", "A").connectTo("x").connectTo("y").connectTo("z");
        graph.addNode("x", NodeKind.TASK, "X", "A");
        graph.addNode("y", NodeKind.TASK, "Y", "A");
        graph.addNode("z", NodeKind.TASK, "Z", "A");

        Routed routed = route(graph);

        assertEquals(ExitSide.TOP, routed.edge("g", "x").exitSide());
        assertEquals(ExitSide.RIGHT, routed.edge("g", "y").exitSide());
        assertEquals(ExitSide.BOTTOM, routed.edge("g", "z").exitSide());
        routed.edges().forEach(EdgeRouterTest::assertOrthogonal);
    }

    @Test
    void shouldLeaveGatewayTowardsOtherLane() {
        ProcessGraph graph = new ProcessGraph("Lanes", null, List.of("Up", "Middle", "Down"));
        graph.addNode("g", NodeKind.EXCLUSIVE_GATEWAY, "", "Middle").connectTo("u").connectTo("d");
        graph.addNode("u", NodeKind.TASK, "Up", "Up");
        graph.addNode("d", NodeKind.TASK, "Down", "Down");

        Routed routed = route(graph);

        assertEquals(ExitSide.TOP, routed.edge("g", "u").exitSide());
        assertEquals(ExitSide.BOTTOM, routed.edge("g", "d").exitSide());
    }

    @Test
    void shouldJogRightOfTaskWhenTargetIsNextColumn() {
        ProcessGraph graph = new ProcessGraph("Chain", null, List.of("A"));
        graph.addNode("t1", NodeKind.TASK, "One", "A").connectTo("t2");
        graph.addNode("t2", NodeKind.TASK, "Two", "A");

        Routed routed = route(graph);
        RoutedEdge edge = routed.edge("t1", "t2");

        Bounds from = routed.geometry().node("t1");
        Bounds to = routed.geometry().node("t2");
        assertEquals(ExitSide.RIGHT, edge.exitSide());
        assertEquals(List.of(
                new Point(from.right(), from.centerY()),
                new Point(from.right() + 2 * config.routingMargin, from.centerY()),
                new Point(to.x(), to.centerY())), edge.waypoints());
    }

    @Test
    void shouldDetourAboveWhenSkippingColumns() {
        ProcessGraph graph = new ProcessGraph("Skip", null, List.of("A"));
        graph.addNode("s", NodeKind.START_EVENT, "Start", "A").connectTo("t1").connectTo("j");
        graph.addNode("t1", NodeKind.TASK, "One", "A").connectTo("t2");
        graph.addNode("t2", NodeKind.TASK, "Two", "A").connectTo("j");
        graph.addNode("j", NodeKind.EXCLUSIVE_GATEWAY, "", "A");

        Routed routed = route(graph);
        RoutedEdge skip = routed.edge("s", "j");

        assertOrthogonal(skip);
        Bounds start = routed.geometry().node("s");
        Bounds join = routed.geometry().node("j");
        double detourY = skip.waypoints().get(2).y();
        assertTrue(detourY < start.y() && detourY < join.y());
        // gateways are entered from the top
        assertEquals(new Point(join.centerX(), join.y()), skip.waypoints().get(skip.waypoints().size() - 1));
    }

    @Test
    void shouldRouteBackEdgeAroundTheRight() {
        ProcessGraph graph = new ProcessGraph("Loop", null, List.of("A"));
        graph.addNode("s", NodeKind.START_EVENT, "Start", "A").connectTo("a");
        graph.addNode("a", NodeKind.TASK, "Work", "A").connectTo("b");
        graph.addNode("b", NodeKind.EXCLUSIVE_GATEWAY, "Again?", "A").connectTo("e").connectTo("a", "again");
        graph.addNode("e", NodeKind.END_EVENT, "Done", "A");

        Routed routed = route(graph);
        RoutedEdge loop = routed.edge("b", "a");

        assertTrue(loop.backward());
        double farRight = routed.geometry().pool().right();
        assertTrue(loop.waypoints().stream().anyMatch(p -> p.x() == farRight));
        assertOrthogonal(loop);
        assertFalse(routed.edge("a", "b").backward());
    }

    @Test
    void shouldRouteCorridorEdgeThroughMidChannel() {
        ProcessGraph graph = new ProcessGraph("Crossing", null, List.of("A", "B", "C"));
        graph.addNode("s", NodeKind.START_EVENT, "Start", "A").connectTo("a1").connectTo("b1");
        graph.addNode("a1", NodeKind.TASK, "Prepare", "A").connectTo("c1");
        graph.addNode("b1", NodeKind.TASK, "Check", "B").connectTo("b2");
        graph.addNode("b2", NodeKind.TASK, "Record", "B");
        graph.addNode("c1", NodeKind.TASK, "Archive", "C");

        Routed routed = route(graph);
        RoutedEdge crossing = routed.edge("a1", "c1");

        assertTrue(crossing.corridor());
        assertOrthogonal(crossing);
        Bounds source = routed.geometry().node("a1");
        Bounds target = routed.geometry().node("c1");
        double channelX = source.right() + (target.x() - source.right()) / 2;
        assertEquals(channelX, crossing.waypoints().get(1).x());
        assertEquals(channelX, crossing.waypoints().get(2).x());
    }

    @Test
    void shouldSizeLabelByText() {
        Routed routed = route(decisionGraph());

        RoutedEdge yes = routed.edge("g", "a");
        assertNotNull(yes.labelBounds());
        assertEquals(3 * config.labelCharWidth, yes.labelBounds().width());
        assertEquals(config.labelHeight, yes.labelBounds().height());

        // vertical exit: label sits beside the first bend
        Point bend = yes.waypoints().get(1);
        assertEquals(bend.x() + 8, yes.labelBounds().x());
        assertEquals(bend.y() - 15, yes.labelBounds().y());

        assertNull(routed.edge("s", "g").labelBounds());
    }
}
