package io.bpmnconvert.signavio.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bpmnconvert.signavio.stencil.ElementKind;
import io.bpmnconvert.signavio.stencil.MappingEntry;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * A connector shape (sequence flow, message flow, association, conversation link).
 * Endpoints are ids only; the resolver fills {@link #sourceId} and {@link #targetId}.
 */
@Getter
public class SourceEdge {
    private final String id;
    private final String stencilId;
    private final String name;
    private final ObjectNode properties;
    /** Explicit "source" reference, null for the usual Signavio layout where the source lists the edge. */
    private final String sourceRef;
    /** "target" reference, or the first "outgoing" entry when no target is given. */
    private final String targetRef;
    /** Dockers as exported: first relative to the source, last relative to the target. */
    private final List<Point> dockers;
    private final int documentIndex;

    @Setter
    private String parentId;

    @Setter
    private MappingEntry mapping;
    @Setter
    private ElementKind kind;
    @Setter
    private EdgeClass edgeClass;
    @Setter
    private String sourceId;
    @Setter
    private String targetId;
    /** Id of the element whose content holds this edge (process, sub-process or collaboration). */
    @Setter
    private String containerId;
    @Setter
    private boolean dropped;
    @Setter
    private List<Point> absoluteWaypoints = List.of();

    public SourceEdge(String id, String stencilId, String name, ObjectNode properties, String sourceRef,
                      String targetRef, List<Point> dockers, String parentId, int documentIndex) {
        this.id = id;
        this.stencilId = stencilId;
        this.name = name;
        this.properties = properties;
        this.sourceRef = sourceRef;
        this.targetRef = targetRef;
        this.dockers = dockers == null ? List.of() : List.copyOf(dockers);
        this.parentId = parentId;
        this.documentIndex = documentIndex;
    }

    public String property(String key) {
        JsonNode value = properties == null ? null : properties.get(key);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    @Override
    public String toString() {
        return "SourceEdge{id='" + id + "', stencil='" + stencilId + "', " + sourceId + " -> " + targetId + "}";
    }
}
