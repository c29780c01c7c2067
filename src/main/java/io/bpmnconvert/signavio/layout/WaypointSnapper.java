package io.bpmnconvert.signavio.layout;

import io.bpmnconvert.signavio.models.Bounds;
import io.bpmnconvert.signavio.models.Point;
import io.bpmnconvert.signavio.stencil.ElementKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Edge geometry helpers: moving end points onto shape outlines and bending message flows.
 */
public class WaypointSnapper {
    private static final double EPSILON = 0.001;
    private static final double MIN_VERTICAL_DISTANCE = 50;
    private static final double MIN_HORIZONTAL_DISTANCE = 20;

    public enum Outline {
        CIRCLE, DIAMOND, RECTANGLE
    }

    public static Outline outlineOf(ElementKind kind) {
        return switch (kind.getFamily()) {
            case EVENT -> Outline.CIRCLE;
            case GATEWAY -> Outline.DIAMOND;
            default -> Outline.RECTANGLE;
        };
    }

    /**
     * Intersection of the ray from the centre of {@code bounds} towards {@code toward} with the
     * outline. Returns the centre when both points coincide.
     */
    public static Point snapToOutline(Bounds bounds, Point toward, Outline outline) {
        Point center = bounds.center();
        double dx = toward.x() - center.x();
        double dy = toward.y() - center.y();
        if (Math.abs(dx) < EPSILON && Math.abs(dy) < EPSILON) {
            return center;
        }
        double halfWidth = bounds.width() / 2;
        double halfHeight = bounds.height() / 2;
        double distance = Math.sqrt(dx * dx + dy * dy);

        switch (outline) {
            case CIRCLE -> {
                double radius = Math.min(bounds.width(), bounds.height()) / 2;
                return new Point(center.x() + dx / distance * radius, center.y() + dy / distance * radius);
            }
            case DIAMOND -> {
                double nx = dx / distance;
                double ny = dy / distance;
                double denominator = Math.abs(nx) * halfHeight + Math.abs(ny) * halfWidth;
                if (denominator <= 0) {
                    return center;
                }
                double t = halfWidth * halfHeight / denominator;
                return new Point(center.x() + nx * t, center.y() + ny * t);
            }
            default -> {
                double t = Double.MAX_VALUE;
                if (Math.abs(dx) > EPSILON) {
                    t = Math.min(t, halfWidth / Math.abs(dx));
                }
                if (Math.abs(dy) > EPSILON) {
                    t = Math.min(t, halfHeight / Math.abs(dy));
                }
                return new Point(center.x() + dx * t, center.y() + dy * t);
            }
        }
    }

    /**
     * Replaces a straight two-point message flow by a path that leaves the source vertically.
     * Bend points sit at 30% and 70% of the vertical distance. Paths with user-defined bends,
     * short vertical spans or nearly vertical lines are returned unchanged.
     */
    public static List<Point> routeMessageFlow(List<Point> waypoints) {
        if (waypoints.size() != 2) {
            return waypoints;
        }
        Point start = waypoints.get(0);
        Point end = waypoints.get(1);
        double verticalDistance = Math.abs(end.y() - start.y());
        double horizontalDistance = Math.abs(end.x() - start.x());
        if (verticalDistance < MIN_VERTICAL_DISTANCE || horizontalDistance < MIN_HORIZONTAL_DISTANCE) {
            return waypoints;
        }
        List<Point> routed = new ArrayList<>(4);
        routed.add(start);
        routed.add(new Point(start.x(), start.y() + (end.y() - start.y()) * 0.3));
        routed.add(new Point(end.x(), start.y() + (end.y() - start.y()) * 0.7));
        routed.add(end);
        return routed;
    }
}
