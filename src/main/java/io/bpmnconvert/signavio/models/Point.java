package io.bpmnconvert.signavio.models;

public record Point(double x, double y) {

    public Point plus(Point offset) {
        return new Point(x + offset.x, y + offset.y);
    }
}
