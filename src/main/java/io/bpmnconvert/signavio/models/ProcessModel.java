package io.bpmnconvert.signavio.models;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Intermediate graph of one Signavio document.
 * Nodes form an arena indexed by id; containment is expressed by parent ids only.
 * Iteration order of nodes and edges is document order.
 */
public class ProcessModel {
    private final SourceNode root;
    private final Map<String, SourceNode> nodesById = new LinkedHashMap<>();
    private final Map<String, SourceEdge> edgesById = new LinkedHashMap<>();

    public ProcessModel(SourceNode root) {
        this.root = root;
        nodesById.put(root.getId(), root);
    }

    public SourceNode getRoot() {
        return root;
    }

    /**
     * Adds a node unless its id is already taken.
     *
     * @return false when another node or edge already uses the id
     */
    public boolean addNode(SourceNode node) {
        if (nodesById.containsKey(node.getId()) || edgesById.containsKey(node.getId())) {
            return false;
        }
        nodesById.put(node.getId(), node);
        return true;
    }

    public boolean addEdge(SourceEdge edge) {
        if (nodesById.containsKey(edge.getId()) || edgesById.containsKey(edge.getId())) {
            return false;
        }
        edgesById.put(edge.getId(), edge);
        return true;
    }

    public SourceNode getNode(String id) {
        return id == null ? null : nodesById.get(id);
    }

    public SourceEdge getEdge(String id) {
        return id == null ? null : edgesById.get(id);
    }

    /** All nodes including the root, in document order. */
    public Collection<SourceNode> getNodes() {
        return Collections.unmodifiableCollection(nodesById.values());
    }

    public Collection<SourceEdge> getEdges() {
        return Collections.unmodifiableCollection(edgesById.values());
    }

    /** Surviving nodes other than the root, in document order. */
    public List<SourceNode> getLiveNodes() {
        List<SourceNode> live = new ArrayList<>();
        for (SourceNode node : nodesById.values()) {
            if (!node.isDropped() && node != root) {
                live.add(node);
            }
        }
        return live;
    }

    public List<SourceEdge> getLiveEdges() {
        return edgesById.values().stream().filter(edge -> !edge.isDropped()).toList();
    }

    /** Direct children by declared parent, dropped ones included, in document order. */
    public List<SourceNode> childrenOf(String parentId) {
        List<SourceNode> children = new ArrayList<>();
        for (SourceNode node : nodesById.values()) {
            if (node != root && parentId.equals(node.getParentId())) {
                children.add(node);
            }
        }
        return children;
    }

    public boolean isLive(String nodeId) {
        SourceNode node = getNode(nodeId);
        return node != null && !node.isDropped() && node != root;
    }
}
