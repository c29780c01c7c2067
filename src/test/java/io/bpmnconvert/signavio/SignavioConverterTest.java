package io.bpmnconvert.signavio;

import io.bpmnconvert.signavio.config.ConverterConfig;
import io.bpmnconvert.signavio.diagnostics.DiagnosticKind;
import io.bpmnconvert.signavio.json.StructuralParseException;
import org.camunda.bpm.model.bpmn.Bpmn;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.camunda.bpm.model.bpmn.instance.BoundaryEvent;
import org.camunda.bpm.model.bpmn.instance.Participant;
import org.camunda.bpm.model.bpmn.instance.SequenceFlow;
import org.camunda.bpm.model.bpmn.instance.SubProcess;
import org.camunda.bpm.model.bpmn.instance.UserTask;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static io.bpmnconvert.signavio.SignavioFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class SignavioConverterTest {
    private static final Path ONE_POOL = Path.of(FIXTURE_DIR + "one_pool_one_lane.json");
    private static final Path COLLABORATION = Path.of(FIXTURE_DIR + "collaboration.json");

    private final SignavioConverter converter = new SignavioConverter(new ConverterConfig());

    private static BpmnModelInstance readBack(String xml) {
        BpmnModelInstance modelInstance =
                Bpmn.readModelFromStream(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        Bpmn.validateModel(modelInstance);
        return modelInstance;
    }

    @Test
    void shouldRejectNullConfig() {
        assertThrows(IllegalArgumentException.class, () -> new SignavioConverter(null));
    }

    @Test
    void shouldWriteProcessContentInSchemaOrder() {
        Document doc = parseXml(converter.convert(ONE_POOL).xml());

        Element process = elementById(doc, "shop_process");
        assertNotNull(process);
        assertEquals("process", process.getLocalName());
        assertEquals("false", process.getAttribute("isExecutable"));
        assertEquals(List.of("laneSet", "startEvent", "userTask", "endEvent", "sequenceFlow", "sequenceFlow"),
                childNames(process));
        assertEquals(List.of("flow1", "flow2"), bpmnElements(doc, "sequenceFlow").stream()
                .map(flow -> flow.getAttribute("id")).toList());
    }

    @Test
    void shouldListLaneMembersOnce() {
        Document doc = parseXml(converter.convert(ONE_POOL).xml());

        Element laneSet = elementById(doc, "LaneSet_pool1");
        assertNotNull(laneSet);
        Element lane = elementById(doc, "lane1");
        assertEquals("Clerk", lane.getAttribute("name"));
        assertEquals(List.of("start1", "task1", "end1"), children(lane).stream()
                .map(Element::getTextContent).toList());
    }

    private static List<String> flowNodeRefs(Element lane) {
        return children(lane).stream()
                .filter(child -> child.getLocalName().equals("flowNodeRef"))
                .map(Element::getTextContent)
                .toList();
    }

    private static List<String> allIds(Document doc) {
        List<String> ids = new ArrayList<>();
        NodeList all = doc.getElementsByTagName("*");
        for (int i = 0; i < all.getLength(); i++) {
            String id = ((Element) all.item(i)).getAttribute("id");
            if (!id.isEmpty()) {
                ids.add(id);
            }
        }
        return ids;
    }

    @Test
    void shouldListNodesOnlyInTheirOwnLane() {
        String xml = converter.convert(bytes(nestedLanes())).xml();
        Document doc = parseXml(xml);

        Element laneSet = elementById(doc, "LaneSet_pool");
        assertEquals(List.of("laneA", "laneB"), children(laneSet).stream()
                .map(lane -> lane.getAttribute("id")).toList());
        assertEquals(List.of("a1"), flowNodeRefs(elementById(doc, "laneA")));
        assertEquals(List.of("a2"), flowNodeRefs(elementById(doc, "laneA1")));
        assertEquals(List.of("b1"), flowNodeRefs(elementById(doc, "laneB")));

        Element childLaneSet = elementById(doc, "LaneSet_laneA");
        assertEquals("childLaneSet", childLaneSet.getLocalName());
        assertEquals(elementById(doc, "laneA"), childLaneSet.getParentNode());
        assertEquals(List.of("lane"), childNames(childLaneSet));
        readBack(xml);
    }

    @Test
    void shouldRemoveCharactersNotAllowedInXml() {
        ConvertedDocument result = converter.convert(bytes(diagram(
                outgoing(name(shape("t1", "Task", 0, 0, 100, 80), "A\u0001B"), "f1"),
                shape("t2", "Task", 200, 0, 300, 80),
                property(edge("f1", "SequenceFlow", "t2"), "conditionexpression", "x\u0002 > 1"))));

        Document doc = parseXml(result.xml());
        assertEquals("AB", elementById(doc, "t1").getAttribute("name"));
        assertEquals("x > 1", bpmnElements(doc, "conditionExpression").get(0).getTextContent());
        assertTrue(result.diagnostics().has(DiagnosticKind.INVALID_CHARACTER, "t1"));
        assertTrue(result.diagnostics().has(DiagnosticKind.INVALID_CHARACTER, "f1"));
        readBack(result.xml());
    }

    @Test
    void shouldKeepDerivedIdsUnique() {
        ConvertedDocument result = converter.convert(bytes(diagram(
                shape("d1", "DataObject", 0, 0, 40, 50),
                shape("DataObject_d1", "Task", 100, 0, 200, 80),
                shape("t1", "Task", 300, 0, 400, 80),
                shape("t1_di", "Task", 500, 0, 600, 80))));

        Document doc = parseXml(result.xml());
        List<String> ids = allIds(doc);
        assertEquals(ids.size(), new HashSet<>(ids).size());

        assertEquals("task", elementById(doc, "DataObject_d1").getLocalName());
        String dataObjectRef = elementById(doc, "d1").getAttribute("dataObjectRef");
        assertNotEquals("DataObject_d1", dataObjectRef);
        assertEquals("dataObject", elementById(doc, dataObjectRef).getLocalName());
        assertEquals("task", elementById(doc, "t1_di").getLocalName());
        assertTrue(result.diagnostics().has(DiagnosticKind.DUPLICATE_IDENTIFIER, "d1"));
        assertTrue(result.diagnostics().has(DiagnosticKind.DUPLICATE_IDENTIFIER, "t1"));
        readBack(result.xml());
    }

    @Test
    void shouldWriteDefinitionsHeaderAndCollaboration() {
        Document doc = parseXml(converter.convert(ONE_POOL).xml());
        Element definitions = doc.getDocumentElement();

        assertEquals(BPMN_NS, definitions.getNamespaceURI());
        assertEquals("Definitions_1", definitions.getAttribute("id"));
        assertEquals("signavio2bpmn", definitions.getAttribute("exporter"));
        assertEquals("shop_process", elementById(doc, "pool1").getAttribute("processRef"));
        assertEquals("Collaboration_1", elementById(doc, "BPMNPlane_1").getAttribute("bpmnElement"));
        assertNull(elementById(doc, "Process_1"));
    }

    @Test
    void shouldWriteRoundedBoundsAndWaypoints() {
        Document doc = parseXml(new SignavioConverter(plainGeometryConfig()).convert(ONE_POOL).xml());

        Element bounds = children(elementById(doc, "task1_di")).get(0);
        assertEquals("Bounds", bounds.getLocalName());
        assertEquals("280", bounds.getAttribute("x"));
        assertEquals("125", bounds.getAttribute("y"));
        assertEquals("100", bounds.getAttribute("width"));
        assertEquals("80", bounds.getAttribute("height"));
        assertEquals("true", elementById(doc, "pool1_di").getAttribute("isHorizontal"));

        List<Element> waypoints = children(elementById(doc, "flow2_di"));
        assertEquals(2, waypoints.size());
        assertEquals("330", waypoints.get(0).getAttribute("x"));
        assertEquals("494", waypoints.get(1).getAttribute("x"));
        assertEquals("165", waypoints.get(1).getAttribute("y"));
    }

    @Test
    void shouldProduceSameXmlForSameInput() {
        assertEquals(converter.convert(ONE_POOL).xml(), converter.convert(ONE_POOL).xml());
    }

    @Test
    void shouldReadBackSingleProcessWithCamunda() {
        BpmnModelInstance modelInstance = readBack(converter.convert(ONE_POOL).xml());

        UserTask task = modelInstance.getModelElementById("task1");
        assertEquals("Check order", task.getName());
        assertEquals("flow1", task.getIncoming().iterator().next().getId());

        SequenceFlow flow = modelInstance.getModelElementById("flow2");
        assertEquals("${approved}", flow.getConditionExpression().getTextContent());
        assertEquals("end1", flow.getTarget().getId());
    }

    @Test
    void shouldConvertCollaboration() {
        ConvertedDocument result = converter.convert(COLLABORATION);
        Document doc = parseXml(result.xml());

        Element collaboration = elementById(doc, "Collaboration_1");
        assertEquals(List.of("participant", "participant", "messageFlow", "textAnnotation", "association"),
                childNames(collaboration));
        assertFalse(elementById(doc, "pool2").hasAttribute("processRef"));
        assertEquals("Process_pool1", elementById(doc, "pool1").getAttribute("processRef"));
        assertEquals("One", elementById(doc, "assoc1").getAttribute("associationDirection"));
        assertEquals("Ask twice", children(elementById(doc, "note1")).get(0).getTextContent());
        assertNull(elementById(doc, "hidden"));
        assertNull(elementById(doc, "supplier_process"));
        assertTrue(result.diagnostics().has(DiagnosticKind.UNPLACED_ELEMENT, "hidden"));
    }

    @Test
    void shouldWriteTimerBoundaryEvent() {
        Document doc = parseXml(converter.convert(COLLABORATION).xml());

        Element timer = elementById(doc, "timer1");
        assertEquals("boundaryEvent", timer.getLocalName());
        assertEquals("task_a", timer.getAttribute("attachedToRef"));
        assertEquals("false", timer.getAttribute("cancelActivity"));

        Element definition = elementById(doc, "timer1_def");
        assertEquals("timerEventDefinition", definition.getLocalName());
        assertEquals(List.of("timeDuration"), childNames(definition));
        assertEquals("PT1H", children(definition).get(0).getTextContent());
    }

    @Test
    void shouldReadBackCollaborationWithCamunda() {
        BpmnModelInstance modelInstance = readBack(converter.convert(COLLABORATION).xml());

        BoundaryEvent timer = modelInstance.getModelElementById("timer1");
        assertFalse(timer.cancelActivity());
        assertEquals("task_a", timer.getAttachedTo().getId());

        SubProcess eventSubProcess = modelInstance.getModelElementById("evsub");
        assertTrue(eventSubProcess.triggeredByEvent());

        Participant supplier = modelInstance.getModelElementById("pool2");
        assertNull(supplier.getProcess());
    }

    @Test
    void shouldConvertModelWithoutPoolsIntoDefaultProcess() {
        String xml = converter.convert(bytes(diagram(
                outgoing(shape("start", "StartNoneEvent", 50, 50, 80, 80), "f1"),
                edge("f1", "SequenceFlow", "gw"),
                outgoing(shape("gw", "Exclusive_Databased_Gateway", 150, 45, 190, 85), "f2"),
                edge("f2", "SequenceFlow", "end"),
                shape("end", "EndTerminateEvent", 250, 51, 278, 79)))).xml();
        Document doc = parseXml(xml);

        assertEquals("Process_1", elementById(doc, "BPMNPlane_1").getAttribute("bpmnElement"));
        assertTrue(bpmnElements(doc, "collaboration").isEmpty());
        assertEquals("terminateEventDefinition", elementById(doc, "end_def").getLocalName());
        readBack(xml);
    }

    @Test
    void shouldWriteConvertedFile(@TempDir Path tempDir) throws Exception {
        Path output = tempDir.resolve("nested/out.bpmn");

        converter.convertFile(ONE_POOL, output);

        assertTrue(Files.exists(output));
        String written = Files.readString(output);
        assertTrue(written.startsWith("<?xml"));
        assertEquals(converter.convert(ONE_POOL).xml(), written);
    }

    @Test
    void shouldFailOnNonDocumentInput() {
        assertThrows(StructuralParseException.class,
                () -> converter.convert(Path.of(FIXTURE_DIR + "top_level_array.json")));
        assertThrows(RuntimeException.class, () -> converter.convert(Path.of(FIXTURE_DIR + "missing.json")));
    }
}
