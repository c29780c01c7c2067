package io.bpmnconvert.signavio.resolve;

import com.fasterxml.jackson.databind.JsonNode;
import io.bpmnconvert.signavio.config.ConverterConfig;
import io.bpmnconvert.signavio.diagnostics.DiagnosticKind;
import io.bpmnconvert.signavio.diagnostics.Diagnostics;
import io.bpmnconvert.signavio.json.SignavioJsonLoader;
import io.bpmnconvert.signavio.models.EdgeClass;
import io.bpmnconvert.signavio.models.ProcessModel;
import io.bpmnconvert.signavio.models.SourceEdge;
import io.bpmnconvert.signavio.models.SourceNode;
import io.bpmnconvert.signavio.stencil.ElementKind;
import io.bpmnconvert.signavio.stencil.ElementKind.Family;
import io.bpmnconvert.signavio.stencil.StructuralRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves containment and edge endpoints of a mapped model.
 * <p>
 * Every surviving node ends up with its ancestry, owning participant, flow container and lane;
 * every surviving edge with resolved endpoints, an edge class and a container. Containers are
 * identified by id: a participant's process id, an expanded sub-process id, the default process
 * id, the collaboration id or the definitions id.
 */
public class ReferenceResolver {
    private final ProcessModel model;
    private final ConverterConfig config;
    private final Diagnostics diagnostics;

    private ReferenceResolver(ProcessModel model, ConverterConfig config, Diagnostics diagnostics) {
        this.model = model;
        this.config = config;
        this.diagnostics = diagnostics;
    }

    public static void resolve(ProcessModel model, ConverterConfig config, Diagnostics diagnostics) {
        ReferenceResolver resolver = new ReferenceResolver(model, config, diagnostics);
        resolver.resolveAncestry();
        resolver.dropUnplacedNodes();
        resolver.assignProcesses();
        boolean collaboration = hasCollaboration(model);
        resolver.assignNodeContainers(collaboration);
        resolver.resolveEdges(collaboration);
        resolver.recomputeFlowReferences();
    }

    public static boolean hasCollaboration(ProcessModel model) {
        return model.getLiveNodes().stream().anyMatch(node -> node.getKind() == ElementKind.PARTICIPANT);
    }

    // Ancestry

    private void resolveAncestry() {
        String rootId = model.getRoot().getId();
        for (SourceNode node : model.getNodes()) {
            if (node == model.getRoot()) {
                continue;
            }
            String parentId = node.getParentId();
            if (parentId == null || model.getNode(parentId) == null) {
                diagnostics.report(DiagnosticKind.DANGLING_REFERENCE, node.getId(),
                        "Parent '" + parentId + "' does not exist, element moved to the diagram root");
                node.setParentId(rootId);
            }
        }

        for (SourceNode node : model.getNodes()) {
            if (node == model.getRoot()) {
                continue;
            }
            List<String> chain = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            seen.add(node.getId());
            String current = node.getParentId();
            boolean reachesRoot = false;
            while (current != null) {
                if (current.equals(rootId)) {
                    reachesRoot = true;
                    break;
                }
                if (!seen.add(current)) {
                    break;
                }
                chain.add(current);
                current = model.getNode(current).getParentId();
            }
            if (!reachesRoot) {
                node.setDropped(true);
                diagnostics.report(DiagnosticKind.CYCLIC_CONTAINMENT, node.getId(),
                        "Containment chain never reaches the diagram root, element dropped");
                continue;
            }
            Collections.reverse(chain);
            node.setAncestry(List.copyOf(chain));
        }
    }

    /**
     * Nearest ancestor that survived mapping, or null when only the root encloses the node.
     */
    private SourceNode semanticParent(SourceNode node) {
        List<String> ancestry = node.getAncestry();
        for (int i = ancestry.size() - 1; i >= 0; i--) {
            SourceNode ancestor = model.getNode(ancestry.get(i));
            if (!ancestor.isDropped()) {
                return ancestor;
            }
        }
        return null;
    }

    private SourceNode nearestAncestor(SourceNode node, ElementKind kind) {
        List<String> ancestry = node.getAncestry();
        for (int i = ancestry.size() - 1; i >= 0; i--) {
            SourceNode ancestor = model.getNode(ancestry.get(i));
            if (!ancestor.isDropped() && ancestor.getKind() == kind) {
                return ancestor;
            }
        }
        return null;
    }

    // Placement

    private void dropUnplacedNodes() {
        for (SourceNode node : model.getLiveNodes()) {
            if (node.is(Family.CHOREOGRAPHY)) {
                node.setDropped(true);
                diagnostics.report(DiagnosticKind.UNPLACED_ELEMENT, node.getId(),
                        "Choreography element '" + node.getStencilId() + "' cannot be placed, element dropped");
            }
        }
        for (SourceNode node : model.getLiveNodes()) {
            for (String ancestorId : node.getAncestry()) {
                SourceNode ancestor = model.getNode(ancestorId);
                if (ancestor.getKind() == ElementKind.PARTICIPANT && !ancestor.isDropped()) {
                    if (ancestor.getMapping().has(StructuralRule.COLLAPSED)) {
                        node.setDropped(true);
                        diagnostics.report(DiagnosticKind.UNPLACED_ELEMENT, node.getId(),
                                "Element inside collapsed pool '" + ancestorId + "' dropped");
                        break;
                    }
                    if (node.getKind() == ElementKind.PARTICIPANT) {
                        node.setDropped(true);
                        diagnostics.report(DiagnosticKind.UNPLACED_ELEMENT, node.getId(),
                                "Pool nested inside pool '" + ancestorId + "' dropped");
                        break;
                    }
                }
            }
        }
    }

    private void assignProcesses() {
        Set<String> taken = new HashSet<>();
        taken.add(config.definitionsId);
        taken.add(config.collaborationId);
        taken.add(config.defaultProcessId);
        model.getNodes().forEach(node -> taken.add(node.getId()));
        model.getEdges().forEach(edge -> taken.add(edge.getId()));

        for (SourceNode node : model.getLiveNodes()) {
            if (node.getKind() != ElementKind.PARTICIPANT || node.isOmitProcessRef()) {
                continue;
            }
            String declared = node.property("processid");
            String processId = declared == null ? null : SignavioJsonLoader.sanitizeId(declared);
            if (processId == null || processId.isEmpty() || taken.contains(processId)) {
                processId = "Process_" + node.getId();
            }
            taken.add(processId);
            node.setProcessId(processId);
        }
    }

    private void assignNodeContainers(boolean collaboration) {
        for (SourceNode node : model.getLiveNodes()) {
            SourceNode participant = nearestAncestor(node, ElementKind.PARTICIPANT);
            node.setParticipantId(participant == null ? null : participant.getId());

            switch (node.getKind().getFamily()) {
                case POOL -> node.setFlowContainerId(config.collaborationId);
                case MESSAGE -> node.setFlowContainerId(config.definitionsId);
                case CONVERSATION -> {
                    if (!collaboration) {
                        node.setDropped(true);
                        diagnostics.report(DiagnosticKind.UNPLACED_ELEMENT, node.getId(),
                                "Conversation outside a collaboration dropped");
                        continue;
                    }
                    node.setFlowContainerId(config.collaborationId);
                }
                case ARTIFACT -> {
                    String container = flowContainerOf(node);
                    if (collaboration && container.equals(config.defaultProcessId)) {
                        container = config.collaborationId;
                    }
                    node.setFlowContainerId(container);
                }
                default -> node.setFlowContainerId(flowContainerOf(node));
            }

            SourceNode parent = semanticParent(node);
            if (node.getKind() == ElementKind.INTERMEDIATE_CATCH_EVENT && parent != null && canHostBoundary(parent)) {
                attachBoundaryEvent(node, parent);
            }
            if (parent != null && parent.getKind() == ElementKind.LANE
                    && (node.getKind().isFlowNode() || node.getKind() == ElementKind.LANE)) {
                node.setLaneId(parent.getId());
            }
        }
    }

    private String flowContainerOf(SourceNode node) {
        List<String> ancestry = node.getAncestry();
        for (int i = ancestry.size() - 1; i >= 0; i--) {
            SourceNode ancestor = model.getNode(ancestry.get(i));
            if (ancestor.isDropped()) {
                continue;
            }
            if (ancestor.getKind() == ElementKind.SUB_PROCESS) {
                return ancestor.getId();
            }
            if (ancestor.getKind() == ElementKind.PARTICIPANT) {
                return ancestor.getProcessId() != null ? ancestor.getProcessId() : config.defaultProcessId;
            }
        }
        return config.defaultProcessId;
    }

    private static boolean canHostBoundary(SourceNode host) {
        return host.getKind().isTask()
                || (host.getKind() == ElementKind.SUB_PROCESS && host.getMapping().has(StructuralRule.COLLAPSED));
    }

    private void attachBoundaryEvent(SourceNode event, SourceNode host) {
        event.setKind(ElementKind.BOUNDARY_EVENT);
        event.setAttachedToRef(host.getId());
        event.setCancelActivity(isCancelActivity(event));
        event.setFlowContainerId(flowContainerOf(host));
    }

    private static boolean isCancelActivity(SourceNode event) {
        for (String key : List.of("boundarycancelactivity", "cancelactivity")) {
            JsonNode value = event.propertyNode(key);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isBoolean()) {
                return value.asBoolean();
            }
            return !"false".equalsIgnoreCase(value.asText().trim());
        }
        return true;
    }

    // Edges

    private void resolveEdges(boolean collaboration) {
        Map<String, String> sourceByEdge = new HashMap<>();
        for (SourceNode node : model.getNodes()) {
            for (String edgeId : node.getOutgoingRefs()) {
                sourceByEdge.putIfAbsent(edgeId, node.getId());
            }
        }

        for (SourceEdge edge : model.getEdges()) {
            if (edge.isDropped()) {
                continue;
            }
            String sourceId = edge.getSourceRef() != null ? edge.getSourceRef() : sourceByEdge.get(edge.getId());
            String targetId = edge.getTargetRef();
            if (!model.isLive(sourceId) || !model.isLive(targetId)) {
                edge.setDropped(true);
                diagnostics.report(DiagnosticKind.DANGLING_REFERENCE, edge.getId(),
                        "Endpoint missing or dropped (source=" + sourceId + ", target=" + targetId + "), edge dropped");
                continue;
            }
            edge.setSourceId(sourceId);
            edge.setTargetId(targetId);
            SourceNode source = model.getNode(sourceId);
            SourceNode target = model.getNode(targetId);

            if (edge.getParentId() != null && model.getNode(edge.getParentId()) == null) {
                edge.setParentId(model.getRoot().getId());
            }

            switch (edge.getKind()) {
                case SEQUENCE_FLOW -> {
                    if (Objects.equals(source.getParticipantId(), target.getParticipantId())) {
                        edge.setEdgeClass(EdgeClass.SEQUENCE_FLOW);
                        edge.setContainerId(commonContainer(source, target));
                    } else {
                        edge.setKind(ElementKind.MESSAGE_FLOW);
                        edge.setEdgeClass(EdgeClass.MESSAGE_FLOW);
                        placeInCollaboration(edge, collaboration);
                    }
                }
                case MESSAGE_FLOW -> {
                    edge.setEdgeClass(EdgeClass.MESSAGE_FLOW);
                    placeInCollaboration(edge, collaboration);
                }
                case CONVERSATION_LINK -> {
                    edge.setEdgeClass(EdgeClass.CONVERSATION_LINK);
                    placeInCollaboration(edge, collaboration);
                }
                default -> {
                    edge.setEdgeClass(EdgeClass.ASSOCIATION);
                    if (Objects.equals(source.getFlowContainerId(), target.getFlowContainerId())) {
                        edge.setContainerId(source.getFlowContainerId());
                    } else if (collaboration) {
                        edge.setContainerId(config.collaborationId);
                    } else {
                        edge.setContainerId(commonContainer(source, target));
                    }
                }
            }
        }
    }

    private void placeInCollaboration(SourceEdge edge, boolean collaboration) {
        if (!collaboration) {
            edge.setDropped(true);
            diagnostics.report(DiagnosticKind.UNPLACED_ELEMENT, edge.getId(),
                    "Message flow or conversation link without any pool dropped");
            return;
        }
        edge.setContainerId(config.collaborationId);
    }

    /**
     * Innermost flow container enclosing both endpoints. Containers nest through expanded
     * sub-processes, whose own container is the next level up.
     */
    private String commonContainer(SourceNode source, SourceNode target) {
        List<String> sourceChain = containerChain(source.getFlowContainerId());
        Set<String> targetChain = new LinkedHashSet<>(containerChain(target.getFlowContainerId()));
        for (String container : sourceChain) {
            if (targetChain.contains(container)) {
                return container;
            }
        }
        return sourceChain.get(sourceChain.size() - 1);
    }

    private List<String> containerChain(String containerId) {
        List<String> chain = new ArrayList<>();
        String current = containerId;
        while (current != null && !chain.contains(current)) {
            chain.add(current);
            SourceNode subProcess = model.getNode(current);
            current = subProcess == null ? null : subProcess.getFlowContainerId();
        }
        return chain;
    }

    private void recomputeFlowReferences() {
        for (SourceNode node : model.getNodes()) {
            node.getIncomingFlowIds().clear();
            node.getOutgoingFlowIds().clear();
        }
        for (SourceEdge edge : model.getLiveEdges()) {
            if (edge.getEdgeClass() == EdgeClass.SEQUENCE_FLOW) {
                model.getNode(edge.getSourceId()).getOutgoingFlowIds().add(edge.getId());
                model.getNode(edge.getTargetId()).getIncomingFlowIds().add(edge.getId());
            }
        }
    }
}
