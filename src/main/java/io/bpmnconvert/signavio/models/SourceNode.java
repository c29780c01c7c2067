package io.bpmnconvert.signavio.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bpmnconvert.signavio.stencil.ElementKind;
import io.bpmnconvert.signavio.stencil.EventDefinitionKind;
import io.bpmnconvert.signavio.stencil.MappingEntry;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * A shape of the Signavio document that is not a connector.
 * <p>
 * The loader fills the source fields; the later stages annotate the node in place.
 * Properties are kept as parsed, so keys the converter does not know survive untouched.
 */
@Getter
public class SourceNode {
    private final String id;
    private final String stencilId;
    private final String name;
    private final ObjectNode properties;
    /** Bounds relative to the immediate container, null when the shape has none. */
    private final Bounds relativeBounds;
    /** Edge ids listed under "outgoing". */
    private final List<String> outgoingRefs;
    private final int documentIndex;

    @Setter
    private String parentId;

    // Stencil mapper
    @Setter
    private MappingEntry mapping;
    @Setter
    private ElementKind kind;
    private final List<EventDefinitionKind> eventDefinitions = new ArrayList<>();
    @Setter
    private boolean omitProcessRef;
    @Setter
    private boolean triggeredByEvent;
    @Setter
    private boolean parallelMultiple;

    // Reference resolver
    @Setter
    private boolean dropped;
    @Setter
    private List<String> ancestry = List.of();
    @Setter
    private String participantId;
    /** Id of the process, sub-process or participant whose content holds this element. */
    @Setter
    private String flowContainerId;
    @Setter
    private String laneId;
    @Setter
    private String attachedToRef;
    @Setter
    private boolean cancelActivity = true;
    /** Process id, only for participants that own a process. */
    @Setter
    private String processId;
    private final List<String> incomingFlowIds = new ArrayList<>();
    private final List<String> outgoingFlowIds = new ArrayList<>();

    // Coordinate transformer
    @Setter
    private Bounds absoluteBounds;

    public SourceNode(String id, String stencilId, String name, ObjectNode properties, Bounds relativeBounds,
                      String parentId, List<String> outgoingRefs, int documentIndex) {
        this.id = id;
        this.stencilId = stencilId;
        this.name = name;
        this.properties = properties;
        this.relativeBounds = relativeBounds;
        this.parentId = parentId;
        this.outgoingRefs = outgoingRefs == null ? List.of() : List.copyOf(outgoingRefs);
        this.documentIndex = documentIndex;
    }

    /**
     * Returns a scalar property as text, or null when absent or blank.
     */
    public String property(String key) {
        JsonNode value = properties == null ? null : properties.get(key);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    public JsonNode propertyNode(String key) {
        return properties == null ? null : properties.get(key);
    }

    public boolean isRoot() {
        return kind == ElementKind.DEFINITIONS;
    }

    public boolean is(ElementKind.Family family) {
        return kind != null && kind.getFamily() == family;
    }

    @Override
    public String toString() {
        return "SourceNode{id='" + id + "', stencil='" + stencilId + "', kind=" + kind + "}";
    }
}
