package org.swimlane.bpmn.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;
import org.swimlane.bpmn.LayoutException;
import org.swimlane.bpmn.graph.models.ProcessGraph;
import org.swimlane.bpmn.graph.models.ProcessNode;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
public class ProcessGraphHelper {

    private static final String SCHEMA_RESOURCE_PATH = "schemas/process_graph_schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private static JsonSchema schema;

    /**
     * Validates a process graph JSON document against the input schema.
     *
     * @param json the parsed JSON document
     * @return the validation messages, empty if the document is valid
     */
    public static Set<ValidationMessage> validate(JsonNode json) {
        return loadSchema().validate(json);
    }

    /**
     * Reads, schema-validates and binds a process graph from a JSON file.
     *
     * @param jsonFilePath path to the JSON file
     * @return the bound process graph
     * @throws LayoutException with reason INVALID_INPUT if the file is unreadable or invalid
     */
    public static ProcessGraph loadFromFile(String jsonFilePath) {
        JsonNode json;
        try {
            json = mapper.readTree(new File(jsonFilePath));
        } catch (IOException e) {
            throw new LayoutException(LayoutException.Reason.INVALID_INPUT, null,
                    "Failed to read process graph file: " + jsonFilePath, e);
        }
        return bind(json, jsonFilePath);
    }

    public static ProcessGraph loadFromString(String jsonContent) {
        JsonNode json;
        try {
            json = mapper.readTree(jsonContent);
        } catch (JsonProcessingException e) {
            throw new LayoutException(LayoutException.Reason.INVALID_INPUT, null,
                    "Failed to parse process graph JSON: " + e.getOriginalMessage(), e);
        }
        return bind(json, "<string>");
    }

    /**
     * Checks the caller contract that layout depends on: at least one node, at least one lane,
     * every node has an id and a kind, ids are unique and every lane is declared.
     * Dangling edge targets are not checked here; the normalizer drops them.
     *
     * @throws LayoutException describing the first violation found
     */
    public static void checkContract(ProcessGraph graph) {
        if (graph == null || graph.nodes == null || graph.nodes.isEmpty()) {
            throw new LayoutException(LayoutException.Reason.EMPTY_GRAPH, null,
                    "Process graph has no nodes; refusing to emit an empty diagram.");
        }
        if (graph.lanes == null || graph.lanes.isEmpty()) {
            throw new LayoutException(LayoutException.Reason.INVALID_GRAPH, null,
                    "Process '" + graph.processName + "' declares no lanes.");
        }

        Set<String> declaredLanes = new HashSet<>(graph.lanes);
        Set<String> seenIds = new HashSet<>();
        for (ProcessNode node : graph.nodes) {
            if (node == null || node.id == null || node.id.isBlank()) {
                throw new LayoutException(LayoutException.Reason.INVALID_GRAPH, null,
                        "Process '" + graph.processName + "' contains a node without an id.");
            }
            if (!seenIds.add(node.id)) {
                throw new LayoutException(LayoutException.Reason.INVALID_GRAPH, node.id,
                        "Node id '" + node.id + "' is used more than once.");
            }
            if (node.kind == null) {
                throw new LayoutException(LayoutException.Reason.INVALID_GRAPH, node.id,
                        "Node '" + node.id + "' has no kind.");
            }
            if (node.lane == null || !declaredLanes.contains(node.lane)) {
                throw new LayoutException(LayoutException.Reason.UNKNOWN_LANE, node.id,
                        String.format("Node '%s' references lane '%s', which is not one of the declared lanes %s.",
                                node.id, node.lane, graph.lanes));
            }
        }
    }

    private static ProcessGraph bind(JsonNode json, String source) {
        Set<ValidationMessage> errors = validate(json);
        if (!errors.isEmpty()) {
            String details = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new LayoutException(LayoutException.Reason.INVALID_INPUT, null,
                    "Process graph from " + source + " does not match the input schema: " + details);
        }

        try {
            ProcessGraph graph = mapper.treeToValue(json, ProcessGraph.class);
            log.debug("Loaded process '{}' from {} with {} nodes and {} lanes",
                    graph.processName, source, graph.nodes.size(), graph.lanes.size());
            return graph;
        } catch (IOException | IllegalArgumentException e) {
            throw new LayoutException(LayoutException.Reason.INVALID_INPUT, null,
                    "Failed to bind process graph from " + source + ": " + e.getMessage(), e);
        }
    }

    private static synchronized JsonSchema loadSchema() {
        if (schema != null) {
            return schema;
        }
        try (InputStream schemaStream = ProcessGraphHelper.class.getClassLoader()
                .getResourceAsStream(SCHEMA_RESOURCE_PATH)) {
            if (schemaStream == null) {
                throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE_PATH);
            }
            schema = factory.getSchema(mapper.readTree(schemaStream));
            return schema;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load schema: " + SCHEMA_RESOURCE_PATH, e);
        }
    }
}
