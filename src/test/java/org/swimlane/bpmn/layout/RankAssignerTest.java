package org.swimlane.bpmn.layout;

import org.junit.jupiter.api.Test;
import org.swimlane.bpmn.graph.GraphNormalizer;
import org.swimlane.bpmn.graph.models.NodeKind;
import org.swimlane.bpmn.graph.models.ProcessGraph;
import org.swimlane.bpmn.graph.models.ProcessNode;
import org.swimlane.bpmn.layout.models.EdgeKey;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RankAssignerTest {
    private final RankAssigner rankAssigner = new RankAssigner();

    private static LayoutGraph ranked(ProcessGraph graph) {
        LayoutGraph layoutGraph = new LayoutGraph(graph);
        layoutGraph.setLaneOrder(graph.lanes);
        new RankAssigner().assignRanks(layoutGraph);
        return layoutGraph;
    }

    private static void assertForwardEdgesIncreaseRank(LayoutGraph graph) {
        for (ProcessNode node : graph.nodes()) {
            for (String next : graph.forwardSuccessors(node.id)) {
                assertTrue(graph.rank(next) > graph.rank(node.id),
                        "Edge " + node.id + " -> " + next + " does not move right");
            }
        }
    }

    @Test
    void shouldRankLinearChainConsecutively() {
        ProcessGraph graph = new ProcessGraph("Chain", null, List.of("A"));
        graph.addNode("s", NodeKind.START_EVENT, "Start", "A").connectTo("t1");
        graph.addNode("t1", NodeKind.TASK, "One", "A").connectTo("t2");
        graph.addNode("t2", NodeKind.TASK, "Two", "A").connectTo("e");
        graph.addNode("e", NodeKind.END_EVENT, "Done", "A");

        LayoutGraph layoutGraph = ranked(graph);

        assertEquals(0, layoutGraph.rank("s"));
        assertEquals(1, layoutGraph.rank("t1"));
        assertEquals(2, layoutGraph.rank("t2"));
        assertEquals(3, layoutGraph.rank("e"));
    }

    @Test
    void shouldUseLongestPath() {
        ProcessGraph graph = new ProcessGraph("Longest", null, List.of("A"));
        graph.addNode("s", NodeKind.START_EVENT, "Start", "A").connectTo("t1").connectTo("j");
        graph.addNode("t1", NodeKind.TASK, "One", "A").connectTo("t2");
        graph.addNode("t2", NodeKind.TASK, "Two", "A").connectTo("j");
        graph.addNode("j", NodeKind.EXCLUSIVE_GATEWAY, "", "A");

        LayoutGraph layoutGraph = ranked(graph);

        assertEquals(3, layoutGraph.rank("j"));
    }

    @Test
    void shouldAlignBranchesOfDivergingGateway() {
        ProcessGraph graph = new ProcessGraph("Aligned", null, List.of("A"));
        graph.addNode("s", NodeKind.START_EVENT, "Start", "A").connectTo("g").connectTo("t1");
        graph.addNode("t1", NodeKind.TASK, "One", "A").connectTo("t2");
        graph.addNode("t2", NodeKind.TASK, "Two", "A").connectTo("b");
        graph.addNode("g", NodeKind.PARALLEL_GATEWAY, "", "A").connectTo("a").connectTo("b");
        graph.addNode("a", NodeKind.TASK, "Short branch", "A").connectTo("e");
        graph.addNode("b", NodeKind.TASK, "Long branch", "A");
        graph.addNode("e", NodeKind.END_EVENT, "Done", "A");

        LayoutGraph layoutGraph = ranked(graph);

        assertEquals(3, layoutGraph.rank("b"));
        assertEquals(3, layoutGraph.rank("a"));
        // raise is carried forward
        assertEquals(4, layoutGraph.rank("e"));
        assertEquals(List.of("a", "b"), layoutGraph.syncGroups().get("g"));
        assertForwardEdgesIncreaseRank(layoutGraph);
    }

    @Test
    void shouldNotAlignBranchThatLeadsToSibling() {
        ProcessGraph graph = new ProcessGraph("Shortcut", null, List.of("A"));
        graph.addNode("g", NodeKind.EXCLUSIVE_GATEWAY, "Skip?", "A").connectTo("a").connectTo("b");
        graph.addNode("a", NodeKind.TASK, "Optional step", "A").connectTo("b");
        graph.addNode("b", NodeKind.TASK, "Next", "A");

        LayoutGraph layoutGraph = ranked(graph);

        assertEquals(1, layoutGraph.rank("a"));
        assertEquals(2, layoutGraph.rank("b"));
        assertTrue(layoutGraph.syncGroups().isEmpty());
        assertForwardEdgesIncreaseRank(layoutGraph);
    }

    @Test
    void shouldKeepFlowOrderWhenBranchesOfTwoGatewaysCrossLink() {
        ProcessGraph graph = new ProcessGraph("Crossed", null, List.of("A"));
        graph.addNode("s", NodeKind.START_EVENT, "Start", "A").connectTo("g0");
        graph.addNode("g0", NodeKind.PARALLEL_GATEWAY, "", "A").connectTo("g1").connectTo("g2");
        graph.addNode("g1", NodeKind.EXCLUSIVE_GATEWAY, "", "A").connectTo("x").connectTo("y");
        graph.addNode("g2", NodeKind.EXCLUSIVE_GATEWAY, "", "A").connectTo("p").connectTo("q");
        graph.addNode("x", NodeKind.TASK, "X", "A").connectTo("q");
        graph.addNode("y", NodeKind.TASK, "Y", "A");
        graph.addNode("p", NodeKind.TASK, "P", "A").connectTo("y");
        graph.addNode("q", NodeKind.TASK, "Q", "A");

        LayoutGraph layoutGraph = ranked(new GraphNormalizer().normalize(graph));

        assertForwardEdgesIncreaseRank(layoutGraph);
        assertEquals(List.of("x", "Gateway_merge_y"), layoutGraph.syncGroups().get("g1"));
        // aligning p with the merge in front of q would contradict the alignment under g1
        assertNull(layoutGraph.syncGroups().get("g2"));
        assertEquals(layoutGraph.rank("x"), layoutGraph.rank("Gateway_merge_y"));
    }

    @Test
    void shouldExemptBackEdgesFromOrdering() {
        ProcessGraph graph = new ProcessGraph("Loop", null, List.of("A"));
        graph.addNode("s", NodeKind.START_EVENT, "Start", "A").connectTo("a");
        graph.addNode("a", NodeKind.TASK, "Work", "A").connectTo("b");
        graph.addNode("b", NodeKind.EXCLUSIVE_GATEWAY, "Again?", "A").connectTo("a").connectTo("e");
        graph.addNode("e", NodeKind.END_EVENT, "Done", "A");

        LayoutGraph layoutGraph = ranked(graph);

        assertTrue(layoutGraph.backEdges().contains(new EdgeKey("b", "a")));
        assertEquals(0, layoutGraph.rank("s"));
        assertEquals(1, layoutGraph.rank("a"));
        assertEquals(2, layoutGraph.rank("b"));
        assertEquals(3, layoutGraph.rank("e"));
    }

    @Test
    void shouldRankEveryNode() {
        ProcessGraph graph = new ProcessGraph("Islands", null, List.of("A"));
        graph.addNode("x", NodeKind.TASK, "Alone", "A");
        graph.addNode("y", NodeKind.TASK, "Also alone", "A");
        LayoutGraph layoutGraph = new LayoutGraph(graph);

        rankAssigner.assignRanks(layoutGraph);

        assertEquals(0, layoutGraph.rank("x"));
        assertEquals(0, layoutGraph.rank("y"));
        assertEquals(0, layoutGraph.maxRank());
    }
}
