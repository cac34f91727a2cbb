package org.swimlane.bpmn;

import lombok.extern.slf4j.Slf4j;
import org.swimlane.bpmn.layout.LayoutConfig;
import org.swimlane.bpmn.serialization.BpmnValidator;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point.
 * <p>
 * Usage: {@code Main <input.json> [output.bpmn] [--config layout.json] [--validate]}
 */
@Slf4j
public class Main {
    static final String DEFAULT_OUTPUT = "output.bpmn";
    private static final String USAGE = "Usage: Main <input.json> [output.bpmn] [--config layout.json] [--validate]";

    private String inputPath;
    private String outputPath = DEFAULT_OUTPUT;
    private String configPath;
    private boolean validate;

    public static void main(String[] args) {
        Main main = new Main();
        try {
            main.parse(args);
        } catch (IllegalArgumentException e) {
            log.error("{}\n{}", e.getMessage(), USAGE);
            System.exit(2);
            return;
        }
        try {
            main.run();
        } catch (LayoutException e) {
            log.error("Layout failed ({}{}): {}", e.getReason(),
                    e.getElementId() == null ? "" : ", element " + e.getElementId(), e.getMessage());
            System.exit(1);
        } catch (RuntimeException e) {
            log.error("BPMN generation failed", e);
            System.exit(1);
        }
    }

    void parse(String[] args) {
        List<String> positional = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--config needs a file argument");
                    }
                    configPath = args[++i];
                    break;
                case "--validate":
                    validate = true;
                    break;
                default:
                    if (args[i].startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + args[i]);
                    }
                    positional.add(args[i]);
            }
        }
        if (positional.isEmpty() || positional.size() > 2) {
            throw new IllegalArgumentException("Expected an input file and an optional output file");
        }
        inputPath = positional.get(0);
        if (positional.size() == 2) {
            outputPath = positional.get(1);
        }
    }

    /**
     * Generates the diagram and writes it to the output path.
     */
    void run() {
        LayoutConfig config = configPath == null ? LayoutConfig.load() : LayoutConfig.loadFromFile(configPath);
        BpmnLayoutGenerator generator = new BpmnLayoutGenerator(config);

        log.info("Generating BPMN from {}", inputPath);
        String xml = generator.generateFromFile(inputPath);

        if (validate) {
            BpmnValidator.validate(xml);
            log.info("Generated BPMN passed schema validation");
        }

        try {
            Files.write(Paths.get(outputPath), xml.getBytes(StandardCharsets.UTF_8));
        } catch (Exception e) {
            throw new RuntimeException("Failed to write BPMN document: " + outputPath, e);
        }
        log.info("BPMN written to {}", outputPath);
    }

    String getInputPath() {
        return inputPath;
    }

    String getOutputPath() {
        return outputPath;
    }

    String getConfigPath() {
        return configPath;
    }

    boolean isValidate() {
        return validate;
    }
}
