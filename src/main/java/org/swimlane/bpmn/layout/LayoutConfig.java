package org.swimlane.bpmn.layout;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Layout constants. Defaults are used for any key missing from the configuration file.
 * <p>
 * Example layout-config.json:
 * {
 * "taskWidth": 100,
 * "horizontalSpacing": 150,
 * "fontName": "Arial"
 * }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LayoutConfig {
    public static final String DEFAULT_RESOURCE = "layout-config.json";

    private static final ObjectMapper mapper = new ObjectMapper();

    // ------ Node footprints
    public double taskWidth = 100;
    public double taskHeight = 80;
    public double gatewayWidth = 40;
    public double gatewayHeight = 40;
    public double eventWidth = 30;
    public double eventHeight = 30;

    // ------ Spacing
    public double horizontalSpacing = 150;
    public double verticalSpacing = 80;
    public double lanePaddingTop = 60;
    public double lanePaddingBottom = 60;
    public double laneHeaderWidth = 30;
    public double laneContentPaddingX = 60;
    public double poolPaddingX = 40;
    public double poolPaddingY = 40;
    public double routingMargin = 30;

    // ------ Labels
    public double labelCharWidth = 7;
    public double labelHeight = 14;

    // ------ Serialization
    public String targetNamespace = "http://www.signavio.com";
    public String fontName = "Arial";
    public double fontSize = 12.0;

    /**
     * Width of one rank column: a task plus the gap to the next column.
     */
    public double columnPitch() {
        return taskWidth + horizontalSpacing;
    }

    public static LayoutConfig defaults() {
        return new LayoutConfig();
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, falling back to defaults if absent.
     */
    public static LayoutConfig load() {
        try (InputStream is = LayoutConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                return defaults();
            }
            return mapper.readValue(is, LayoutConfig.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load layout config: " + DEFAULT_RESOURCE, e);
        }
    }

    public static LayoutConfig loadFromFile(String configFilePath) {
        try {
            return mapper.readValue(new File(configFilePath), LayoutConfig.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load layout config: " + configFilePath, e);
        }
    }
}
