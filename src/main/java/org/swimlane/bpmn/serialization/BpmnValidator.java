package org.swimlane.bpmn.serialization;

import org.camunda.bpm.model.bpmn.Bpmn;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.nio.charset.StandardCharsets;

public class BpmnValidator {

    /**
     * Parses generated BPMN XML with the Camunda model API and validates it against the BPMN schema.
     * Throws an exception if invalid.
     *
     * @return the parsed model, for callers that want to inspect it
     */
    public static BpmnModelInstance validate(String bpmnXml) {
        BpmnModelInstance modelInstance = Bpmn.readModelFromStream(
                new ByteArrayInputStream(bpmnXml.getBytes(StandardCharsets.UTF_8)));
        Bpmn.validateModel(modelInstance);  // throws exception if invalid
        return modelInstance;
    }

    /**
     * Validates a BPMN file from disk.
     * Throws an exception if invalid.
     */
    public static void validate(File bpmnFile) {
        BpmnModelInstance modelInstance = Bpmn.readModelFromFile(bpmnFile);
        Bpmn.validateModel(modelInstance);
    }

    /**
     * Boolean-style validation.
     */
    public static boolean isValid(String bpmnXml) {
        try {
            validate(bpmnXml);
            return true;
        } catch (Exception e) {
            return false;
        }
    }
}
