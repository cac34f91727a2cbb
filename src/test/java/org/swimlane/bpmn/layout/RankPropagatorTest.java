package org.swimlane.bpmn.layout;

import org.junit.jupiter.api.Test;
import org.swimlane.bpmn.LayoutException;
import org.swimlane.bpmn.graph.GraphNormalizer;
import org.swimlane.bpmn.graph.models.NodeKind;
import org.swimlane.bpmn.graph.models.ProcessGraph;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RankPropagatorTest {

    /**
     * x feeds the merge in front of q while p feeds the merge in front of y.
     */
    private static LayoutGraph crossLinkedGraph() {
        ProcessGraph graph = new ProcessGraph("Crossed", null, List.of("A"));
        graph.addNode("g1", NodeKind.EXCLUSIVE_GATEWAY, "", "A").connectTo("x").connectTo("y");
        graph.addNode("g2", NodeKind.EXCLUSIVE_GATEWAY, "", "A").connectTo("p").connectTo("q");
        graph.addNode("x", NodeKind.TASK, "X", "A").connectTo("q");
        graph.addNode("y", NodeKind.TASK, "Y", "A");
        graph.addNode("p", NodeKind.TASK, "P", "A").connectTo("y");
        graph.addNode("q", NodeKind.TASK, "Q", "A");
        LayoutGraph layoutGraph = new LayoutGraph(new GraphNormalizer().normalize(graph));
        layoutGraph.setLaneOrder(List.of("A"));
        new RankAssigner().assignRanks(layoutGraph);
        return layoutGraph;
    }

    @Test
    void shouldCarryRaiseThroughSuccessorsAndSiblings() {
        LayoutGraph graph = crossLinkedGraph();
        int before = graph.rank("Gateway_merge_y");

        assertTrue(new RankPropagator(graph).raise("x", before + 3));

        assertEquals(before + 3, graph.rank("x"));
        assertEquals(before + 3, graph.rank("Gateway_merge_y"));
        assertTrue(graph.rank("Gateway_merge_q") > graph.rank("x"));
        assertTrue(graph.rank("y") > graph.rank("Gateway_merge_y"));
    }

    @Test
    void shouldIgnoreRaiseBelowCurrentRank() {
        LayoutGraph graph = crossLinkedGraph();

        assertFalse(new RankPropagator(graph).raise("x", 0));
    }

    @Test
    void shouldReportContradictingAlignmentsAsNotConverged() {
        LayoutGraph graph = crossLinkedGraph();
        Map<String, List<String>> contradicting = new LinkedHashMap<>();
        contradicting.put("g1", List.of("x", "Gateway_merge_y"));
        contradicting.put("g2", List.of("p", "Gateway_merge_q"));
        graph.setSyncGroups(contradicting);
        RankPropagator propagator = new RankPropagator(graph);

        LayoutException e = assertThrows(LayoutException.class,
                () -> propagator.raise("x", graph.rank("x") + 1));

        assertEquals(LayoutException.Reason.LAYOUT_NOT_CONVERGED, e.getReason());
        assertEquals("x", e.getElementId());
    }
}
