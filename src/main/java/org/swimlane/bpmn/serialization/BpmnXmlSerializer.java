package org.swimlane.bpmn.serialization;

import lombok.extern.slf4j.Slf4j;
import org.swimlane.bpmn.graph.models.ProcessNode;
import org.swimlane.bpmn.layout.LayoutConfig;
import org.swimlane.bpmn.layout.models.Bounds;
import org.swimlane.bpmn.layout.models.DiagramLayout;
import org.swimlane.bpmn.layout.models.LaneBand;
import org.swimlane.bpmn.layout.models.Point;
import org.swimlane.bpmn.layout.models.RoutedEdge;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringWriter;
import java.util.List;

/**
 * Writes a finished {@link DiagramLayout} as a BPMN 2.0 document: one collaboration with a single
 * participant, the process with its lane set, flow nodes and sequence flows, and the diagram
 * interchange section with shapes, edges and a shared label style.
 * Coordinates are rounded here and nowhere earlier.
 */
@Slf4j
public class BpmnXmlSerializer {
    private static final String BPMN_NS = "http://www.omg.org/spec/BPMN/20100524/MODEL";
    private static final String BPMNDI_NS = "http://www.omg.org/spec/BPMN/20100524/DI";
    private static final String DC_NS = "http://www.omg.org/spec/DD/20100524/DC";
    private static final String DI_NS = "http://www.omg.org/spec/DD/20100524/DI";
    private static final String XMLNS_NS = "http://www.w3.org/2000/xmlns/";
    private static final String EXPORTER = "swimlane-bpmn-layout";

    private final LayoutConfig config;

    public BpmnXmlSerializer(LayoutConfig config) {
        this.config = config;
    }

    /**
     * @return the BPMN XML, UTF-8, indented by two spaces
     * @throws RuntimeException if the document cannot be built or written
     */
    public String serialize(DiagramLayout layout) {
        try {
            Document doc = buildDocument(layout);
            String xml = toXml(doc);
            log.debug("Serialized process '{}': {} nodes, {} flows", layout.processName(),
                    layout.nodes().size(), layout.edges().size());
            return xml;
        } catch (Exception e) {
            throw new RuntimeException("Failed to serialize BPMN document for process: " + layout.processName(), e);
        }
    }

    private Document buildDocument(DiagramLayout layout) throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        DocumentBuilder builder = factory.newDocumentBuilder();
        Document doc = builder.newDocument();

        BpmnIds ids = new BpmnIds(layout.processName());

        Element definitions = doc.createElementNS(BPMN_NS, "bpmn:definitions");
        definitions.setAttributeNS(XMLNS_NS, "xmlns:bpmn", BPMN_NS);
        definitions.setAttributeNS(XMLNS_NS, "xmlns:bpmndi", BPMNDI_NS);
        definitions.setAttributeNS(XMLNS_NS, "xmlns:dc", DC_NS);
        definitions.setAttributeNS(XMLNS_NS, "xmlns:di", DI_NS);
        definitions.setAttribute("id", ids.definitions());
        definitions.setAttribute("targetNamespace", config.targetNamespace);
        definitions.setAttribute("exporter", EXPORTER);
        doc.appendChild(definitions);

        Element collaboration = doc.createElementNS(BPMN_NS, "bpmn:collaboration");
        collaboration.setAttribute("id", ids.collaboration());
        Element participant = doc.createElementNS(BPMN_NS, "bpmn:participant");
        participant.setAttribute("id", ids.participant());
        participant.setAttribute("name", nullToEmpty(layout.processName()));
        participant.setAttribute("processRef", ids.process());
        collaboration.appendChild(participant);
        definitions.appendChild(collaboration);

        definitions.appendChild(buildProcess(doc, layout, ids));
        definitions.appendChild(buildDiagram(doc, layout, ids));
        return doc;
    }

    private Element buildProcess(Document doc, DiagramLayout layout, BpmnIds ids) {
        Element process = doc.createElementNS(BPMN_NS, "bpmn:process");
        process.setAttribute("id", ids.process());
        process.setAttribute("name", nullToEmpty(layout.processName()));
        process.setAttribute("isExecutable", "false");

        if (layout.goal() != null && !layout.goal().isBlank()) {
            Element documentation = doc.createElementNS(BPMN_NS, "bpmn:documentation");
            documentation.setTextContent(layout.goal());
            process.appendChild(documentation);
        }

        Element laneSet = doc.createElementNS(BPMN_NS, "bpmn:laneSet");
        laneSet.setAttribute("id", ids.laneSet());
        for (String laneName : layout.laneOrder()) {
            Element lane = doc.createElementNS(BPMN_NS, "bpmn:lane");
            lane.setAttribute("id", ids.lane(laneName));
            lane.setAttribute("name", laneName);
            for (ProcessNode node : layout.nodesInLane(laneName)) {
                Element ref = doc.createElementNS(BPMN_NS, "bpmn:flowNodeRef");
                ref.setTextContent(ids.node(node.id));
                lane.appendChild(ref);
            }
            laneSet.appendChild(lane);
        }
        process.appendChild(laneSet);

        for (ProcessNode node : layout.nodes()) {
            process.appendChild(buildFlowNode(doc, layout, ids, node));
        }

        for (RoutedEdge edge : layout.edges()) {
            Element flow = doc.createElementNS(BPMN_NS, "bpmn:sequenceFlow");
            flow.setAttribute("id", ids.flow(edge.sourceId(), edge.index()));
            if (edge.hasLabel()) {
                flow.setAttribute("name", edge.label());
            }
            flow.setAttribute("sourceRef", ids.node(edge.sourceId()));
            flow.setAttribute("targetRef", ids.node(edge.targetId()));
            process.appendChild(flow);
        }
        return process;
    }

    private Element buildFlowNode(Document doc, DiagramLayout layout, BpmnIds ids, ProcessNode node) {
        Element element = doc.createElementNS(BPMN_NS, "bpmn:" + node.kind.elementName());
        element.setAttribute("id", ids.node(node.id));
        element.setAttribute("name", nullToEmpty(node.label));

        List<RoutedEdge> incoming = layout.incoming(node.id);
        List<RoutedEdge> outgoing = layout.outgoing(node.id);
        if (node.isGateway()) {
            element.setAttribute("gatewayDirection", gatewayDirection(incoming.size(), outgoing.size()));
        }
        for (RoutedEdge edge : incoming) {
            Element ref = doc.createElementNS(BPMN_NS, "bpmn:incoming");
            ref.setTextContent(ids.flow(edge.sourceId(), edge.index()));
            element.appendChild(ref);
        }
        for (RoutedEdge edge : outgoing) {
            Element ref = doc.createElementNS(BPMN_NS, "bpmn:outgoing");
            ref.setTextContent(ids.flow(edge.sourceId(), edge.index()));
            element.appendChild(ref);
        }
        return element;
    }

    static String gatewayDirection(int incoming, int outgoing) {
        if (incoming > 1 && outgoing > 1) {
            return "Mixed";
        }
        if (outgoing > 1) {
            return "Diverging";
        }
        if (incoming > 1) {
            return "Converging";
        }
        return "Unspecified";
    }

    private Element buildDiagram(Document doc, DiagramLayout layout, BpmnIds ids) {
        Element diagram = doc.createElementNS(BPMNDI_NS, "bpmndi:BPMNDiagram");
        diagram.setAttribute("id", ids.diagram());
        diagram.setAttribute("name", nullToEmpty(layout.processName()));

        Element plane = doc.createElementNS(BPMNDI_NS, "bpmndi:BPMNPlane");
        plane.setAttribute("id", ids.plane());
        plane.setAttribute("bpmnElement", ids.collaboration());
        diagram.appendChild(plane);

        Element poolShape = shape(doc, ids.participant(), layout.geometry().pool());
        poolShape.setAttribute("isHorizontal", "true");
        plane.appendChild(poolShape);

        for (LaneBand band : layout.geometry().lanes().values()) {
            Element laneShape = shape(doc, ids.lane(band.lane()), band.bounds());
            laneShape.setAttribute("isHorizontal", "true");
            plane.appendChild(laneShape);
        }

        for (ProcessNode node : layout.nodes()) {
            Element nodeShape = shape(doc, ids.node(node.id), layout.geometry().node(node.id));
            if (node.hasLabel()) {
                Element label = doc.createElementNS(BPMNDI_NS, "bpmndi:BPMNLabel");
                label.setAttribute("labelStyle", ids.labelStyle());
                nodeShape.appendChild(label);
            }
            plane.appendChild(nodeShape);
        }

        for (RoutedEdge edge : layout.edges()) {
            plane.appendChild(edge(doc, ids, edge));
        }

        Element style = doc.createElementNS(BPMNDI_NS, "bpmndi:BPMNLabelStyle");
        style.setAttribute("id", ids.labelStyle());
        Element font = doc.createElementNS(DC_NS, "dc:Font");
        font.setAttribute("name", config.fontName);
        font.setAttribute("size", String.valueOf(config.fontSize));
        style.appendChild(font);
        diagram.appendChild(style);

        return diagram;
    }

    private Element shape(Document doc, String elementId, Bounds bounds) {
        Element shape = doc.createElementNS(BPMNDI_NS, "bpmndi:BPMNShape");
        shape.setAttribute("id", BpmnIds.shape(elementId));
        shape.setAttribute("bpmnElement", elementId);
        shape.appendChild(bounds(doc, bounds));
        return shape;
    }

    private Element edge(Document doc, BpmnIds ids, RoutedEdge routed) {
        String flowId = ids.flow(routed.sourceId(), routed.index());
        Element edge = doc.createElementNS(BPMNDI_NS, "bpmndi:BPMNEdge");
        edge.setAttribute("id", BpmnIds.shape(flowId));
        edge.setAttribute("bpmnElement", flowId);
        for (Point point : routed.waypoints()) {
            Element waypoint = doc.createElementNS(DI_NS, "di:waypoint");
            waypoint.setAttribute("x", coordinate(point.x()));
            waypoint.setAttribute("y", coordinate(point.y()));
            edge.appendChild(waypoint);
        }
        if (routed.labelBounds() != null) {
            Element label = doc.createElementNS(BPMNDI_NS, "bpmndi:BPMNLabel");
            label.setAttribute("labelStyle", ids.labelStyle());
            label.appendChild(bounds(doc, routed.labelBounds()));
            edge.appendChild(label);
        }
        return edge;
    }

    private Element bounds(Document doc, Bounds bounds) {
        Element element = doc.createElementNS(DC_NS, "dc:Bounds");
        element.setAttribute("x", coordinate(bounds.x()));
        element.setAttribute("y", coordinate(bounds.y()));
        element.setAttribute("width", coordinate(bounds.width()));
        element.setAttribute("height", coordinate(bounds.height()));
        return element;
    }

    private static String coordinate(double value) {
        return String.valueOf(Math.round(value));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String toXml(Document doc) throws Exception {
        TransformerFactory transformerFactory = TransformerFactory.newInstance();
        Transformer transformer = transformerFactory.newTransformer();
        transformer.setOutputProperty(OutputKeys.INDENT, "yes");
        transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
        transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
        transformer.setOutputProperty(OutputKeys.STANDALONE, "no");
        transformer.setOutputProperty(OutputKeys.METHOD, "xml");
        transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");

        StringWriter stringWriter = new StringWriter();
        transformer.transform(new DOMSource(doc), new StreamResult(stringWriter));

        // Remove extra blank lines (consecutive newlines)
        return stringWriter.toString().replaceAll("(\r?\n)\\s*\r?\n", "$1");
    }
}
