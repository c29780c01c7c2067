package io.bpmnconvert.signavio.layout;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bpmnconvert.signavio.config.ConverterConfig;
import io.bpmnconvert.signavio.diagnostics.DiagnosticKind;
import io.bpmnconvert.signavio.diagnostics.Diagnostics;
import io.bpmnconvert.signavio.json.SignavioJsonLoader;
import io.bpmnconvert.signavio.models.Bounds;
import io.bpmnconvert.signavio.models.Point;
import io.bpmnconvert.signavio.models.ProcessModel;
import io.bpmnconvert.signavio.resolve.ReferenceResolver;
import io.bpmnconvert.signavio.stencil.StencilMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static io.bpmnconvert.signavio.SignavioFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CoordinateTransformerTest {

    private static ProcessModel transformed(ProcessModel model, ConverterConfig config, Diagnostics diagnostics) {
        StencilMapper.map(model, diagnostics);
        ReferenceResolver.resolve(model, config, diagnostics);
        CoordinateTransformer.transform(model, config, diagnostics);
        return model;
    }

    private static ProcessModel transformed(ObjectNode document, ConverterConfig config, Diagnostics diagnostics) {
        return transformed(SignavioJsonLoader.load(bytes(document), diagnostics), config, diagnostics);
    }

    @Test
    void shouldAccumulateNestedOffsets() {
        ProcessModel model = transformed(diagram(
                shape("pool", "Pool", 5, 5, 605, 255,
                        shape("lane", "Lane", 5, 5, 575, 130,
                                shape("task", "Task", 5, 5, 105, 85)))), new ConverterConfig(), new Diagnostics());

        assertEquals(new Bounds(5, 5, 600, 250), model.getNode("pool").getAbsoluteBounds());
        assertEquals(new Bounds(10, 10, 570, 125), model.getNode("lane").getAbsoluteBounds());
        assertEquals(new Bounds(15, 15, 100, 80), model.getNode("task").getAbsoluteBounds());
    }

    @Test
    void shouldPlaceFixtureShapesAbsolutely() {
        Diagnostics diagnostics = new Diagnostics();
        ProcessModel model = transformed(SignavioJsonLoader.loadFromFile(
                Path.of(FIXTURE_DIR + "one_pool_one_lane.json"), diagnostics), plainGeometryConfig(), diagnostics);

        assertEquals(new Bounds(180, 150, 30, 30), model.getNode("start1").getAbsoluteBounds());
        assertEquals(new Bounds(280, 125, 100, 80), model.getNode("task1").getAbsoluteBounds());
        assertEquals(new Bounds(480, 151, 28, 28), model.getNode("end1").getAbsoluteBounds());
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void shouldAddDockersToEndpointOrigins() {
        ProcessModel model = transformed(SignavioJsonLoader.loadFromFile(
                Path.of(FIXTURE_DIR + "one_pool_one_lane.json"), new Diagnostics()), plainGeometryConfig(),
                new Diagnostics());

        assertEquals(List.of(new Point(195, 165), new Point(330, 165)),
                model.getEdge("flow1").getAbsoluteWaypoints());
        assertEquals(List.of(new Point(330, 165), new Point(494, 165)),
                model.getEdge("flow2").getAbsoluteWaypoints());
    }

    @Test
    void shouldSnapEndpointsToOutlines() {
        ProcessModel model = transformed(SignavioJsonLoader.loadFromFile(
                Path.of(FIXTURE_DIR + "one_pool_one_lane.json"), new Diagnostics()), new ConverterConfig(),
                new Diagnostics());

        List<Point> waypoints = model.getEdge("flow1").getAbsoluteWaypoints();
        assertEquals(2, waypoints.size());
        assertEquals(210, waypoints.get(0).x(), 1e-9);
        assertEquals(165, waypoints.get(0).y(), 1e-9);
        assertEquals(280, waypoints.get(1).x(), 1e-9);
        assertEquals(165, waypoints.get(1).y(), 1e-9);
    }

    @Test
    void shouldOffsetIntermediateDockersByDeclaringShape() {
        ProcessModel model = transformed(diagram(
                shape("sub", "Subprocess", 100, 100, 500, 300,
                        outgoing(shape("a", "Task", 20, 20, 120, 100), "e1"),
                        shape("b", "Task", 250, 100, 350, 180),
                        edge("e1", "SequenceFlow", "b", 50, 40, 200, 60, 200, 140, 50, 40))),
                plainGeometryConfig(), new Diagnostics());

        assertEquals(List.of(new Point(170, 160), new Point(300, 160), new Point(300, 240), new Point(400, 240)),
                model.getEdge("e1").getAbsoluteWaypoints());
    }

    @Test
    void shouldUseCentersWithoutDockers() {
        ProcessModel model = transformed(diagram(
                outgoing(shape("a", "Task", 0, 0, 100, 80), "e1"),
                shape("b", "Task", 200, 0, 300, 80),
                edge("e1", "SequenceFlow", "b")), plainGeometryConfig(), new Diagnostics());

        assertEquals(List.of(new Point(50, 40), new Point(250, 40)), model.getEdge("e1").getAbsoluteWaypoints());
    }

    @Test
    void shouldRouteMessageFlowsWhenEnabled() {
        ConverterConfig config = plainGeometryConfig();
        config.routeMessageFlows = true;

        ProcessModel model = transformed(diagram(
                shape("p1", "Pool", 0, 0, 600, 200, outgoing(shape("a", "Task", 50, 50, 150, 130), "m1")),
                shape("p2", "Pool", 0, 300, 600, 500, shape("b", "Task", 250, 50, 350, 130)),
                edge("m1", "MessageFlow", "b")), config, new Diagnostics());

        assertEquals(List.of(new Point(100, 90), new Point(100, 180), new Point(300, 300), new Point(300, 390)),
                model.getEdge("m1").getAbsoluteWaypoints());
    }

    @Test
    void shouldReplaceNegativeOffsetsAndEmptySizes() {
        Diagnostics diagnostics = new Diagnostics();
        ProcessModel model = transformed(diagram(
                shape("neg", "Task", -10, -20, 90, 60),
                shape("flat", "Exclusive_Databased_Gateway", 200, 0, 200, 0),
                shape("host", "Task", 100, 100, 200, 180,
                        shape("timer", "IntermediateTimerEvent", -15, 40, 15, 70))), new ConverterConfig(), diagnostics);

        assertEquals(new Bounds(0, 0, 100, 80), model.getNode("neg").getAbsoluteBounds());
        assertEquals(new Bounds(200, 0, 40, 40), model.getNode("flat").getAbsoluteBounds());
        assertEquals(new Bounds(100, 140, 30, 30), model.getNode("timer").getAbsoluteBounds());
        assertTrue(diagnostics.has(DiagnosticKind.MISSING_OR_INVALID_BOUNDS, "neg"));
        assertTrue(diagnostics.has(DiagnosticKind.MISSING_OR_INVALID_BOUNDS, "flat"));
        assertTrue(diagnostics.has(DiagnosticKind.MISSING_OR_INVALID_BOUNDS, "timer"));
    }

    @Test
    void shouldPlaceShapeWithoutBoundsAtContainerOrigin() {
        ObjectNode task = shape("task", "Task", 0, 0, 0, 0);
        task.remove("bounds");

        Diagnostics diagnostics = new Diagnostics();
        ProcessModel model = transformed(diagram(
                shape("pool", "Pool", 40, 60, 640, 310, task)), new ConverterConfig(), diagnostics);

        assertEquals(new Bounds(40, 60, 100, 80), model.getNode("task").getAbsoluteBounds());
        assertTrue(diagnostics.has(DiagnosticKind.MISSING_OR_INVALID_BOUNDS, "task"));
    }
}
