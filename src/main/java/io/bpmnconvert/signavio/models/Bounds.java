package io.bpmnconvert.signavio.models;

/**
 * A rectangle given by its upper-left corner and its size.
 * Relative or absolute depending on where it is stored.
 */
public record Bounds(
        double x,
        double y,
        double width,
        double height
) {
    public Point origin() {
        return new Point(x, y);
    }

    public Point center() {
        return new Point(x + width / 2, y + height / 2);
    }

    public Bounds translate(Point offset) {
        return new Bounds(x + offset.x(), y + offset.y(), width, height);
    }
}
