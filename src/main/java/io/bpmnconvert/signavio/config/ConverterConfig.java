package io.bpmnconvert.signavio.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converter settings. Fields absent from a config file keep the defaults below.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConverterConfig {
    /**
     * Value of the targetNamespace attribute on definitions.
     */
    public String targetNamespace = "http://bpmn.io/schema/bpmn";
    public String exporter = "signavio2bpmn";
    public String exporterVersion = "1.0.0";

    /**
     * Fixed ids of the generated container elements.
     */
    public String definitionsId = "Definitions_1";
    public String collaborationId = "Collaboration_1";
    public String defaultProcessId = "Process_1";

    public boolean executableProcesses = false;

    /**
     * Move the first and last waypoint of each edge onto the outline of its endpoint shape.
     */
    public boolean snapWaypointsToEdges = true;

    /**
     * Add two bend points to message flows that run between pools stacked vertically.
     */
    public boolean routeMessageFlows = true;

    /**
     * Worker threads for batch conversion; 0 or less means one per available processor.
     */
    public int threads = 0;

    public String outputExtension = ".bpmn";

    /**
     * Extra namespace declarations on the root element.
     * Example: {"signavio": "http://www.signavio.com"}
     */
    public Map<String, String> extensionNamespaces = new LinkedHashMap<>();

    public int effectiveThreads() {
        return threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
    }
}
