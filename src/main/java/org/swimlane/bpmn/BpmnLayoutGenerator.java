package org.swimlane.bpmn;

import lombok.extern.slf4j.Slf4j;
import org.swimlane.bpmn.graph.GraphNormalizer;
import org.swimlane.bpmn.graph.ProcessGraphHelper;
import org.swimlane.bpmn.graph.models.ProcessGraph;
import org.swimlane.bpmn.layout.CollisionResolver;
import org.swimlane.bpmn.layout.EdgeRouter;
import org.swimlane.bpmn.layout.GeometryEngine;
import org.swimlane.bpmn.layout.LaneAssigner;
import org.swimlane.bpmn.layout.LaneSequencer;
import org.swimlane.bpmn.layout.LayoutConfig;
import org.swimlane.bpmn.layout.LayoutGraph;
import org.swimlane.bpmn.layout.RankAssigner;
import org.swimlane.bpmn.layout.models.DiagramLayout;
import org.swimlane.bpmn.layout.models.Geometry;
import org.swimlane.bpmn.layout.models.RoutedEdge;
import org.swimlane.bpmn.serialization.BpmnXmlSerializer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Entry point of the layout engine. Runs the stages in order:
 * normalize, lane assignment and sequencing, ranking, collision resolution, geometry, routing
 * and finally serialization. The caller's graph is never modified; every run works on a copy.
 * <p>
 * Instances hold no per-run state and can be shared.
 */
@Slf4j
public class BpmnLayoutGenerator {
    private final LayoutConfig config;
    private final GraphNormalizer normalizer = new GraphNormalizer();
    private final LaneAssigner laneAssigner = new LaneAssigner();
    private final LaneSequencer laneSequencer = new LaneSequencer();
    private final RankAssigner rankAssigner = new RankAssigner();
    private final CollisionResolver collisionResolver = new CollisionResolver();
    private final GeometryEngine geometryEngine;
    private final EdgeRouter edgeRouter;
    private final BpmnXmlSerializer serializer;

    public BpmnLayoutGenerator() {
        this(LayoutConfig.load());
    }

    public BpmnLayoutGenerator(LayoutConfig config) {
        this.config = config;
        this.geometryEngine = new GeometryEngine(config);
        this.edgeRouter = new EdgeRouter(config);
        this.serializer = new BpmnXmlSerializer(config);
    }

    public LayoutConfig getConfig() {
        return config;
    }

    /**
     * Lays out the graph and returns the BPMN XML.
     *
     * @throws LayoutException if the graph violates the input contract or the layout does not converge
     */
    public String generate(ProcessGraph graph) {
        return serializer.serialize(layout(graph));
    }

    /**
     * Reads a process graph JSON file, lays it out and returns the BPMN XML.
     */
    public String generateFromFile(String jsonFilePath) {
        return generate(ProcessGraphHelper.loadFromFile(jsonFilePath));
    }

    /**
     * Runs every stage except serialization.
     */
    public DiagramLayout layout(ProcessGraph input) {
        ProcessGraphHelper.checkContract(input);
        ProcessGraph graph = normalizer.normalize(input);
        log.debug("Laying out process '{}': {} nodes, {} edges, {} lanes",
                graph.processName, graph.nodes.size(), graph.edgeCount(), graph.lanes.size());

        LayoutGraph layoutGraph = new LayoutGraph(graph);
        laneAssigner.optimizeGatewayLanes(layoutGraph);
        layoutGraph.setLaneOrder(laneSequencer.sequence(layoutGraph, graph.lanes));
        laneAssigner.enforceEndEventLanes(layoutGraph);

        rankAssigner.assignRanks(layoutGraph);
        collisionResolver.resolve(layoutGraph);

        Geometry geometry = geometryEngine.compute(layoutGraph);
        List<RoutedEdge> edges = edgeRouter.route(layoutGraph, geometry);

        log.debug("Layout of '{}' done: {} columns, {} corridor edges",
                graph.processName, layoutGraph.maxRank() + 1, layoutGraph.corridorEdges().size());

        return DiagramLayout.builder()
                .processName(graph.processName)
                .goal(graph.goal)
                .laneOrder(layoutGraph.laneOrder())
                .nodes(new ArrayList<>(layoutGraph.nodes()))
                .ranks(new LinkedHashMap<>(layoutGraph.ranks()))
                .corridorEdges(new LinkedHashSet<>(layoutGraph.corridorEdges()))
                .geometry(geometry)
                .edges(edges)
                .build();
    }
}
