package io.bpmnconvert.signavio.layout;

import io.bpmnconvert.signavio.config.ConverterConfig;
import io.bpmnconvert.signavio.diagnostics.DiagnosticKind;
import io.bpmnconvert.signavio.diagnostics.Diagnostics;
import io.bpmnconvert.signavio.models.Bounds;
import io.bpmnconvert.signavio.models.EdgeClass;
import io.bpmnconvert.signavio.models.Point;
import io.bpmnconvert.signavio.models.ProcessModel;
import io.bpmnconvert.signavio.models.SourceEdge;
import io.bpmnconvert.signavio.models.SourceNode;
import io.bpmnconvert.signavio.stencil.ElementKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts container-relative Signavio geometry into absolute diagram coordinates.
 * <p>
 * Every node is a coordinate frame for its children, including nodes that were dropped
 * during mapping, so the children of an unknown shape still land where the editor showed them.
 */
public class CoordinateTransformer {
    private static final Point ORIGIN = new Point(0, 0);

    public static void transform(ProcessModel model, ConverterConfig config, Diagnostics diagnostics) {
        Map<String, List<SourceNode>> children = new HashMap<>();
        for (SourceNode node : model.getNodes()) {
            if (node != model.getRoot() && node.getParentId() != null) {
                children.computeIfAbsent(node.getParentId(), key -> new ArrayList<>()).add(node);
            }
        }

        SourceNode root = model.getRoot();
        root.setAbsoluteBounds(new Bounds(0, 0, 0, 0));
        place(root, children, diagnostics);

        for (SourceEdge edge : model.getLiveEdges()) {
            edge.setAbsoluteWaypoints(computeWaypoints(edge, model, config));
        }
    }

    private static void place(SourceNode container, Map<String, List<SourceNode>> children, Diagnostics diagnostics) {
        Point origin = container.getAbsoluteBounds().origin();
        for (SourceNode child : children.getOrDefault(container.getId(), List.of())) {
            if (child.getAbsoluteBounds() != null) {
                continue;
            }
            child.setAbsoluteBounds(normalize(child, diagnostics).translate(origin));
            place(child, children, diagnostics);
        }
    }

    /**
     * Relative bounds with negative or missing offsets replaced by zero and unusable sizes
     * replaced by the default size of the element kind.
     */
    static Bounds normalize(SourceNode node, Diagnostics diagnostics) {
        Bounds relative = node.getRelativeBounds();
        ElementKind kind = node.getKind();
        double defaultWidth = kind == null ? 0 : kind.getDefaultWidth();
        double defaultHeight = kind == null ? 0 : kind.getDefaultHeight();
        if (relative == null) {
            report(node, diagnostics, "No bounds, placed at the container origin with default size");
            return new Bounds(0, 0, defaultWidth, defaultHeight);
        }

        double x = relative.x();
        double y = relative.y();
        double width = relative.width();
        double height = relative.height();
        if (x < 0 || y < 0) {
            report(node, diagnostics, "Negative offset (" + x + ", " + y + ") clamped to the container edge");
            x = Math.max(x, 0);
            y = Math.max(y, 0);
        }
        if (width <= 0 || height <= 0) {
            report(node, diagnostics, "Non-positive size " + width + "x" + height + " replaced by the default size");
            width = defaultWidth;
            height = defaultHeight;
        }
        return new Bounds(x, y, width, height);
    }

    private static void report(SourceNode node, Diagnostics diagnostics, String message) {
        if (!node.isDropped()) {
            diagnostics.report(DiagnosticKind.MISSING_OR_INVALID_BOUNDS, node.getId(), message);
        }
    }

    static List<Point> computeWaypoints(SourceEdge edge, ProcessModel model, ConverterConfig config) {
        SourceNode source = model.getNode(edge.getSourceId());
        SourceNode target = model.getNode(edge.getTargetId());
        Bounds sourceBounds = source.getAbsoluteBounds();
        Bounds targetBounds = target.getAbsoluteBounds();

        List<Point> waypoints = new ArrayList<>();
        List<Point> dockers = edge.getDockers();
        if (!dockers.isEmpty() && sourceBounds != null && targetBounds != null) {
            waypoints.add(dockers.get(0).plus(sourceBounds.origin()));
            Point frame = frameOrigin(edge, model);
            for (int i = 1; i < dockers.size() - 1; i++) {
                waypoints.add(dockers.get(i).plus(frame));
            }
            waypoints.add(dockers.get(dockers.size() - 1).plus(targetBounds.origin()));
        }
        if (waypoints.size() < 2) {
            waypoints.clear();
            waypoints.add(sourceBounds != null ? sourceBounds.center() : ORIGIN);
            waypoints.add(targetBounds != null ? targetBounds.center() : ORIGIN);
        }

        if (config.routeMessageFlows && edge.getEdgeClass() == EdgeClass.MESSAGE_FLOW) {
            waypoints = new ArrayList<>(WaypointSnapper.routeMessageFlow(waypoints));
        }
        if (config.snapWaypointsToEdges) {
            List<Point> unsnapped = List.copyOf(waypoints);
            int last = waypoints.size() - 1;
            if (sourceBounds != null && source.getKind() != ElementKind.PARTICIPANT) {
                waypoints.set(0, WaypointSnapper.snapToOutline(sourceBounds, unsnapped.get(1),
                        WaypointSnapper.outlineOf(source.getKind())));
            }
            if (targetBounds != null && target.getKind() != ElementKind.PARTICIPANT) {
                waypoints.set(last, WaypointSnapper.snapToOutline(targetBounds, unsnapped.get(last - 1),
                        WaypointSnapper.outlineOf(target.getKind())));
            }
        }
        return List.copyOf(waypoints);
    }

    /**
     * Intermediate dockers are relative to the shape the edge was declared in; top-level
     * edges use the canvas origin.
     */
    private static Point frameOrigin(SourceEdge edge, ProcessModel model) {
        SourceNode parent = model.getNode(edge.getParentId());
        if (parent == null || parent.getAbsoluteBounds() == null) {
            return ORIGIN;
        }
        return parent.getAbsoluteBounds().origin();
    }
}
