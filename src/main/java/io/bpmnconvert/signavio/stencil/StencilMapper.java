package io.bpmnconvert.signavio.stencil;

import com.fasterxml.jackson.databind.JsonNode;
import io.bpmnconvert.signavio.diagnostics.DiagnosticKind;
import io.bpmnconvert.signavio.diagnostics.Diagnostics;
import io.bpmnconvert.signavio.models.ProcessModel;
import io.bpmnconvert.signavio.models.SourceEdge;
import io.bpmnconvert.signavio.models.SourceNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Assigns the final element kind to every node and edge of a model.
 * Plain stencils resolve straight from {@link MappingTable}; Task and the Multiple event
 * stencils also look into their properties.
 */
public class StencilMapper {
    private static final String TASK_TYPE_PROPERTY = "tasktype";
    private static final String EVENT_DEFINITIONS_PROPERTY = "eventdefinitions";

    private static final Map<String, ElementKind> TASK_TYPES = Map.of(
            "none", ElementKind.TASK,
            "send", ElementKind.SEND_TASK,
            "receive", ElementKind.RECEIVE_TASK,
            "user", ElementKind.USER_TASK,
            "manual", ElementKind.MANUAL_TASK,
            "service", ElementKind.SERVICE_TASK,
            "businessrule", ElementKind.BUSINESS_RULE_TASK,
            "script", ElementKind.SCRIPT_TASK
    );

    public static void map(ProcessModel model, Diagnostics diagnostics) {
        SourceNode root = model.getRoot();
        root.setMapping(MappingTable.lookup("BPMNDiagram").orElseThrow());
        root.setKind(ElementKind.DEFINITIONS);

        for (SourceNode node : model.getNodes()) {
            if (node != root) {
                mapNode(node, diagnostics);
            }
        }
        for (SourceEdge edge : model.getEdges()) {
            mapEdge(edge, diagnostics);
        }
    }

    static void mapNode(SourceNode node, Diagnostics diagnostics) {
        Optional<MappingEntry> lookup = MappingTable.lookup(node.getStencilId());
        if (lookup.isEmpty() || lookup.get().kind() == ElementKind.DEFINITIONS || lookup.get().kind().isConnector()) {
            node.setDropped(true);
            diagnostics.report(DiagnosticKind.UNKNOWN_STENCIL, node.getId(),
                    "Stencil '" + node.getStencilId() + "' has no BPMN counterpart, element dropped");
            return;
        }
        MappingEntry entry = lookup.get();
        node.setMapping(entry);
        node.setKind(entry.kind());

        if (entry.has(StructuralRule.TASK_TYPE_FROM_PROPERTIES)) {
            node.setKind(resolveTaskType(node, diagnostics));
        }
        if (entry.eventDefinition() != null) {
            node.getEventDefinitions().add(entry.eventDefinition());
        }
        if (entry.has(StructuralRule.DEFINITIONS_FROM_PROPERTIES)) {
            node.getEventDefinitions().addAll(resolveEventDefinitions(node, diagnostics));
        }
        node.setOmitProcessRef(entry.has(StructuralRule.OMIT_PROCESS_REF));
        node.setTriggeredByEvent(entry.has(StructuralRule.TRIGGERED_BY_EVENT));
        node.setParallelMultiple(entry.has(StructuralRule.PARALLEL_MULTIPLE));
    }

    static void mapEdge(SourceEdge edge, Diagnostics diagnostics) {
        Optional<MappingEntry> lookup = MappingTable.lookup(edge.getStencilId());
        if (lookup.isEmpty() || !lookup.get().kind().isConnector()) {
            edge.setDropped(true);
            diagnostics.report(DiagnosticKind.UNKNOWN_STENCIL, edge.getId(),
                    "Connector stencil '" + edge.getStencilId() + "' has no BPMN counterpart, edge dropped");
            return;
        }
        edge.setMapping(lookup.get());
        edge.setKind(lookup.get().kind());
    }

    private static ElementKind resolveTaskType(SourceNode node, Diagnostics diagnostics) {
        String taskType = node.property(TASK_TYPE_PROPERTY);
        if (taskType == null) {
            diagnostics.report(DiagnosticKind.UNKNOWN_TASK_TYPE, node.getId(),
                    "Task has no task type, mapped to a generic task");
            return ElementKind.TASK;
        }
        String normalized = taskType.toLowerCase(Locale.ROOT).replaceAll("[\\s_-]", "");
        ElementKind kind = TASK_TYPES.get(normalized);
        if (kind == null) {
            diagnostics.report(DiagnosticKind.UNKNOWN_TASK_TYPE, node.getId(),
                    "Unrecognized task type '" + taskType + "', mapped to a generic task");
            return ElementKind.TASK;
        }
        return kind;
    }

    /**
     * Reads the nested definitions of a Multiple event. Accepts a plain array or an object
     * wrapping the array under "items"; each entry is a label or an object carrying one.
     */
    private static List<EventDefinitionKind> resolveEventDefinitions(SourceNode node, Diagnostics diagnostics) {
        List<EventDefinitionKind> definitions = new ArrayList<>();
        JsonNode value = node.propertyNode(EVENT_DEFINITIONS_PROPERTY);
        if (value != null && value.isObject()) {
            value = value.get("items");
        }
        if (value == null || value.isNull()) {
            return definitions;
        }
        if (!value.isArray()) {
            diagnostics.report(DiagnosticKind.INVALID_EVENT_DEFINITION, node.getId(),
                    "Event definitions property is not a list, ignored");
            return definitions;
        }
        for (JsonNode item : value) {
            String label = null;
            if (item.isTextual()) {
                label = item.asText();
            } else if (item.isObject()) {
                label = item.hasNonNull("type") ? item.get("type").asText() : item.path("eventdefinitiontype").asText(null);
            }
            Optional<EventDefinitionKind> kind = EventDefinitionKind.fromLabel(label);
            if (kind.isEmpty()) {
                diagnostics.report(DiagnosticKind.INVALID_EVENT_DEFINITION, node.getId(),
                        "Unrecognized event definition entry " + item + ", skipped");
                continue;
            }
            definitions.add(kind.get());
        }
        return definitions;
    }
}
