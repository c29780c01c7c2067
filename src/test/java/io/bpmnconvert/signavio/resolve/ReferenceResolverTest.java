package io.bpmnconvert.signavio.resolve;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bpmnconvert.signavio.config.ConverterConfig;
import io.bpmnconvert.signavio.diagnostics.DiagnosticKind;
import io.bpmnconvert.signavio.diagnostics.Diagnostics;
import io.bpmnconvert.signavio.json.SignavioJsonLoader;
import io.bpmnconvert.signavio.models.EdgeClass;
import io.bpmnconvert.signavio.models.ProcessModel;
import io.bpmnconvert.signavio.models.SourceEdge;
import io.bpmnconvert.signavio.models.SourceNode;
import io.bpmnconvert.signavio.stencil.ElementKind;
import io.bpmnconvert.signavio.stencil.StencilMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static io.bpmnconvert.signavio.SignavioFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ReferenceResolverTest {
    private final ConverterConfig config = new ConverterConfig();

    private ProcessModel resolved(ProcessModel model, Diagnostics diagnostics) {
        StencilMapper.map(model, diagnostics);
        ReferenceResolver.resolve(model, config, diagnostics);
        return model;
    }

    private ProcessModel resolved(ObjectNode document, Diagnostics diagnostics) {
        return resolved(SignavioJsonLoader.load(bytes(document), diagnostics), diagnostics);
    }

    private ProcessModel resolvedFixture(String file, Diagnostics diagnostics) {
        return resolved(SignavioJsonLoader.loadFromFile(Path.of(FIXTURE_DIR + file), diagnostics), diagnostics);
    }

    @Test
    void shouldAssignLaneAndProcessToFlowNodes() {
        Diagnostics diagnostics = new Diagnostics();
        ProcessModel model = resolvedFixture("one_pool_one_lane.json", diagnostics);

        assertEquals("shop_process", model.getNode("pool1").getProcessId());
        for (String id : List.of("start1", "task1", "end1")) {
            SourceNode node = model.getNode(id);
            assertEquals("lane1", node.getLaneId(), id);
            assertEquals("pool1", node.getParticipantId(), id);
            assertEquals("shop_process", node.getFlowContainerId(), id);
        }
        assertEquals(List.of("pool1", "lane1"), model.getNode("task1").getAncestry());
        assertNull(model.getNode("lane1").getLaneId());
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void shouldAssignNodesToInnermostLane() {
        Diagnostics diagnostics = new Diagnostics();
        ProcessModel model = resolved(nestedLanes(), diagnostics);

        assertEquals("laneA", model.getNode("a1").getLaneId());
        assertEquals("laneA1", model.getNode("a2").getLaneId());
        assertEquals("laneB", model.getNode("b1").getLaneId());
        assertEquals("laneA", model.getNode("laneA1").getLaneId());
        assertNull(model.getNode("laneB").getLaneId());
        for (String id : List.of("a1", "a2", "b1")) {
            assertEquals("Process_pool", model.getNode(id).getFlowContainerId(), id);
        }
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void shouldRecomputeIncomingAndOutgoing() {
        ProcessModel model = resolvedFixture("one_pool_one_lane.json", new Diagnostics());

        SourceNode task = model.getNode("task1");
        assertEquals(List.of("flow1"), task.getIncomingFlowIds());
        assertEquals(List.of("flow2"), task.getOutgoingFlowIds());
        assertEquals(List.of("flow1"), model.getNode("start1").getOutgoingFlowIds());
        assertTrue(model.getNode("end1").getOutgoingFlowIds().isEmpty());

        SourceEdge flow = model.getEdge("flow1");
        assertEquals("start1", flow.getSourceId());
        assertEquals("task1", flow.getTargetId());
        assertEquals(EdgeClass.SEQUENCE_FLOW, flow.getEdgeClass());
        assertEquals("shop_process", flow.getContainerId());
    }

    @Test
    void shouldAttachBoundaryEventToHostTask() {
        ProcessModel model = resolvedFixture("collaboration.json", new Diagnostics());

        SourceNode timer = model.getNode("timer1");
        assertEquals(ElementKind.BOUNDARY_EVENT, timer.getKind());
        assertEquals("task_a", timer.getAttachedToRef());
        assertFalse(timer.isCancelActivity());
        assertEquals("Process_pool1", timer.getFlowContainerId());
    }

    @Test
    void shouldDropContentOfCollapsedPool() {
        Diagnostics diagnostics = new Diagnostics();
        ProcessModel model = resolvedFixture("collaboration.json", diagnostics);

        assertTrue(model.getNode("hidden").isDropped());
        assertTrue(diagnostics.has(DiagnosticKind.UNPLACED_ELEMENT, "hidden"));
        assertFalse(model.getNode("pool2").isDropped());
        assertNull(model.getNode("pool2").getProcessId());
        assertEquals("Process_pool1", model.getNode("pool1").getProcessId());
    }

    @Test
    void shouldPlaceCollaborationContent() {
        ProcessModel model = resolvedFixture("collaboration.json", new Diagnostics());

        SourceEdge messageFlow = model.getEdge("mf1");
        assertEquals(EdgeClass.MESSAGE_FLOW, messageFlow.getEdgeClass());
        assertEquals("task_a", messageFlow.getSourceId());
        assertEquals("pool2", messageFlow.getTargetId());
        assertEquals(config.collaborationId, messageFlow.getContainerId());

        assertEquals(config.collaborationId, model.getNode("note1").getFlowContainerId());
        assertEquals(config.collaborationId, model.getEdge("assoc1").getContainerId());
        assertEquals("evsub", model.getNode("evstart").getFlowContainerId());
    }

    @Test
    void shouldTurnCrossPoolSequenceFlowIntoMessageFlow() {
        ProcessModel model = resolved(diagram(
                shape("p1", "Pool", 0, 0, 600, 200, outgoing(shape("a", "Task", 50, 50, 150, 130), "e1")),
                shape("p2", "Pool", 0, 300, 600, 500, shape("b", "Task", 50, 50, 150, 130)),
                edge("e1", "SequenceFlow", "b")), new Diagnostics());

        SourceEdge edge = model.getEdge("e1");
        assertEquals(EdgeClass.MESSAGE_FLOW, edge.getEdgeClass());
        assertEquals(ElementKind.MESSAGE_FLOW, edge.getKind());
        assertEquals(config.collaborationId, edge.getContainerId());
        assertTrue(model.getNode("a").getOutgoingFlowIds().isEmpty());
    }

    @Test
    void shouldDropEdgeWithMissingEndpoint() {
        Diagnostics diagnostics = new Diagnostics();
        ProcessModel model = resolved(diagram(
                outgoing(shape("a", "Task", 0, 0, 100, 80), "e1"),
                edge("e1", "SequenceFlow", "ghost")), diagnostics);

        assertTrue(model.getEdge("e1").isDropped());
        assertTrue(diagnostics.has(DiagnosticKind.DANGLING_REFERENCE, "e1"));
    }

    @Test
    void shouldDropMessageFlowWithoutPools() {
        Diagnostics diagnostics = new Diagnostics();
        ProcessModel model = resolved(diagram(
                outgoing(shape("a", "Task", 0, 0, 100, 80), "m1"),
                shape("b", "Task", 200, 0, 300, 80),
                edge("m1", "MessageFlow", "b")), diagnostics);

        assertTrue(model.getEdge("m1").isDropped());
        assertTrue(diagnostics.has(DiagnosticKind.UNPLACED_ELEMENT, "m1"));
        assertEquals(config.defaultProcessId, model.getNode("a").getFlowContainerId());
    }

    @Test
    void shouldMoveElementWithMissingParentToRoot() {
        ObjectNode orphan = shape("orphan", "Task", 0, 0, 100, 80);
        orphan.putObject("parent").put("resourceId", "ghost");

        Diagnostics diagnostics = new Diagnostics();
        ProcessModel model = resolved(diagram(orphan), diagnostics);

        SourceNode node = model.getNode("orphan");
        assertEquals("canvas", node.getParentId());
        assertFalse(node.isDropped());
        assertTrue(node.getAncestry().isEmpty());
        assertTrue(diagnostics.has(DiagnosticKind.DANGLING_REFERENCE, "orphan"));
    }

    @Test
    void shouldDropCyclicContainment() {
        ObjectNode first = shape("first", "Task", 0, 0, 100, 80);
        first.putObject("parent").put("resourceId", "second");
        ObjectNode second = shape("second", "Task", 200, 0, 300, 80);
        second.putObject("parent").put("resourceId", "first");

        Diagnostics diagnostics = new Diagnostics();
        ProcessModel model = resolved(diagram(first, second, shape("fine", "Task", 400, 0, 500, 80)), diagnostics);

        assertTrue(model.getNode("first").isDropped());
        assertTrue(model.getNode("second").isDropped());
        assertFalse(model.getNode("fine").isDropped());
        assertTrue(diagnostics.has(DiagnosticKind.CYCLIC_CONTAINMENT, "first"));
        assertTrue(diagnostics.has(DiagnosticKind.CYCLIC_CONTAINMENT, "second"));
    }

    @Test
    void shouldNotReuseTakenProcessId() {
        ProcessModel model = resolved(diagram(
                property(shape("p1", "Pool", 0, 0, 600, 200), "processid", "shared"),
                property(shape("p2", "Pool", 0, 300, 600, 500), "processid", "shared")), new Diagnostics());

        assertEquals("shared", model.getNode("p1").getProcessId());
        assertEquals("Process_p2", model.getNode("p2").getProcessId());
    }

    @Test
    void shouldPlaceSequenceFlowOfSubProcessInsideIt() {
        ProcessModel model = resolved(diagram(
                shape("sub", "Subprocess", 0, 0, 400, 200,
                        outgoing(shape("s", "StartNoneEvent", 20, 20, 50, 50), "inner"),
                        shape("t", "Task", 100, 20, 200, 100),
                        edge("inner", "SequenceFlow", "t"))), new Diagnostics());

        assertEquals("sub", model.getNode("t").getFlowContainerId());
        assertEquals("sub", model.getEdge("inner").getContainerId());
        assertEquals(config.defaultProcessId, model.getNode("sub").getFlowContainerId());
    }
}
