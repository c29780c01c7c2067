package io.bpmnconvert.signavio.bpmn;

import io.bpmnconvert.signavio.config.ConverterConfig;
import io.bpmnconvert.signavio.diagnostics.DiagnosticKind;
import io.bpmnconvert.signavio.diagnostics.Diagnostics;
import io.bpmnconvert.signavio.models.Bounds;
import io.bpmnconvert.signavio.models.EdgeClass;
import io.bpmnconvert.signavio.models.Point;
import io.bpmnconvert.signavio.models.ProcessModel;
import io.bpmnconvert.signavio.models.SourceEdge;
import io.bpmnconvert.signavio.models.SourceNode;
import io.bpmnconvert.signavio.resolve.ReferenceResolver;
import io.bpmnconvert.signavio.stencil.ElementKind;
import io.bpmnconvert.signavio.stencil.EventDefinitionKind;
import io.bpmnconvert.signavio.stencil.StructuralRule;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Writes a resolved and laid out model as a BPMN 2.0 XML document.
 * <p>
 * Content is collected per container and written in the category order of its
 * {@link ContainerKind}, so the result follows the schema sequence regardless of the order
 * shapes had in the source document.
 */
public class BpmnXmlBuilder {
    public static final String BPMN_NS = "http://www.omg.org/spec/BPMN/20100524/MODEL";
    public static final String BPMNDI_NS = "http://www.omg.org/spec/BPMN/20100524/DI";
    public static final String DC_NS = "http://www.omg.org/spec/DD/20100524/DC";
    public static final String DI_NS = "http://www.omg.org/spec/DD/20100524/DI";
    public static final String XSI_NS = XMLConstants.W3C_XML_SCHEMA_INSTANCE_NS_URI;

    private static final String FORMAL_EXPRESSION = "bpmn:tFormalExpression";

    private final ProcessModel model;
    private final ConverterConfig config;
    private final Diagnostics diagnostics;
    private final boolean collaboration;
    private final Map<String, List<Item>> contentByContainer = new LinkedHashMap<>();
    private final Set<String> takenIds = new HashSet<>();
    private Document doc;

    /**
     * One element waiting to be written into its container.
     */
    private record Item(ContentCategory category, int documentIndex, SourceNode node, SourceEdge edge) {
    }

    private BpmnXmlBuilder(ProcessModel model, ConverterConfig config, Diagnostics diagnostics) {
        this.model = model;
        this.config = config;
        this.diagnostics = diagnostics;
        this.collaboration = ReferenceResolver.hasCollaboration(model);
    }

    /**
     * Builds the DOM for a model that went through mapping, resolution and layout.
     */
    public static Document build(ProcessModel model, ConverterConfig config, Diagnostics diagnostics) {
        return new BpmnXmlBuilder(model, config, diagnostics).buildDocument();
    }

    private Document buildDocument() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            doc = builder.newDocument();
        } catch (ParserConfigurationException e) {
            throw new RuntimeException("Failed to create BPMN document", e);
        }

        reserveSourceIds();

        Element definitionsEl = doc.createElementNS(BPMN_NS, "bpmn:definitions");
        doc.appendChild(definitionsEl);
        declareNamespaces(definitionsEl);
        definitionsEl.setAttribute("id", config.definitionsId);
        definitionsEl.setAttribute("targetNamespace", config.targetNamespace);
        definitionsEl.setAttribute("exporter", config.exporter);
        definitionsEl.setAttribute("exporterVersion", config.exporterVersion);

        collectContent();

        for (Item item : itemsOf(config.definitionsId, ContainerKind.DEFINITIONS)) {
            SourceNode message = item.node();
            Element messageEl = createBpmnElement(definitionsEl, "message", message.getId());
            setName(messageEl, message.getName());
        }

        if (collaboration) {
            Element collaborationEl = createBpmnElement(definitionsEl, "collaboration", config.collaborationId);
            writeContent(collaborationEl, config.collaborationId, ContainerKind.COLLABORATION);
        }

        for (SourceNode participant : model.getLiveNodes()) {
            if (participant.getKind() == ElementKind.PARTICIPANT && participant.getProcessId() != null) {
                writeProcess(definitionsEl, participant.getProcessId());
            }
        }
        if (!collaboration || contentByContainer.containsKey(config.defaultProcessId)) {
            writeProcess(definitionsEl, config.defaultProcessId);
        }

        writeDiagram(definitionsEl);
        return doc;
    }

    private void declareNamespaces(Element definitionsEl) {
        String xmlns = XMLConstants.XMLNS_ATTRIBUTE_NS_URI;
        definitionsEl.setAttributeNS(xmlns, "xmlns:bpmn", BPMN_NS);
        definitionsEl.setAttributeNS(xmlns, "xmlns:bpmndi", BPMNDI_NS);
        definitionsEl.setAttributeNS(xmlns, "xmlns:dc", DC_NS);
        definitionsEl.setAttributeNS(xmlns, "xmlns:di", DI_NS);
        definitionsEl.setAttributeNS(xmlns, "xmlns:xsi", XSI_NS);
        if (config.extensionNamespaces != null) {
            config.extensionNamespaces.forEach((prefix, uri) ->
                    definitionsEl.setAttributeNS(xmlns, "xmlns:" + prefix, uri));
        }
    }

    // Identifiers

    private void reserveSourceIds() {
        takenIds.add(config.definitionsId);
        takenIds.add(config.collaborationId);
        takenIds.add(config.defaultProcessId);
        for (SourceNode node : model.getLiveNodes()) {
            takenIds.add(node.getId());
            if (node.getProcessId() != null) {
                takenIds.add(node.getProcessId());
            }
        }
        for (SourceEdge edge : model.getLiveEdges()) {
            takenIds.add(edge.getId());
        }
    }

    /**
     * Reserves an id for an element that has no source shape of its own. A taken id gets a
     * numeric suffix until it is unique in the document.
     */
    private String derivedId(String candidate, String ownerId) {
        if (takenIds.add(candidate)) {
            return candidate;
        }
        int suffix = 2;
        while (!takenIds.add(candidate + "_" + suffix)) {
            suffix++;
        }
        String id = candidate + "_" + suffix;
        diagnostics.report(DiagnosticKind.DUPLICATE_IDENTIFIER, ownerId,
                "Derived id '" + candidate + "' already in use, written as '" + id + "'");
        return id;
    }

    // Content collection

    private void collectContent() {
        for (SourceNode node : model.getLiveNodes()) {
            if (node.getKind() == ElementKind.LANE && node.getLaneId() != null) {
                // nested lanes are written inside their parent lane
                continue;
            }
            addItem(node.getFlowContainerId(), node.getKind(), node.getDocumentIndex(), node, null);
        }
        for (SourceEdge edge : model.getLiveEdges()) {
            if (!model.isLive(edge.getSourceId()) || !model.isLive(edge.getTargetId())) {
                edge.setDropped(true);
                diagnostics.report(DiagnosticKind.DANGLING_REFERENCE, edge.getId(),
                        "Endpoint could not be placed, edge dropped");
                continue;
            }
            addItem(edge.getContainerId(), edge.getKind(), edge.getDocumentIndex(), null, edge);
        }
    }

    private void addItem(String containerId, ElementKind kind, int documentIndex, SourceNode node, SourceEdge edge) {
        ContainerKind containerKind = containerKindOf(containerId);
        ContentCategory category = containerKind.categoryOf(kind).orElse(null);
        String elementId = node != null ? node.getId() : edge.getId();
        if (category == null) {
            diagnostics.report(DiagnosticKind.UNPLACED_ELEMENT, elementId,
                    kind.getElementName() + " cannot be placed inside " + containerKind + " '" + containerId + "'");
            if (node != null) {
                node.setDropped(true);
            } else {
                edge.setDropped(true);
            }
            return;
        }
        contentByContainer.computeIfAbsent(containerId, key -> new ArrayList<>())
                .add(new Item(category, documentIndex, node, edge));
    }

    private ContainerKind containerKindOf(String containerId) {
        if (config.definitionsId.equals(containerId)) {
            return ContainerKind.DEFINITIONS;
        }
        if (config.collaborationId.equals(containerId)) {
            return ContainerKind.COLLABORATION;
        }
        SourceNode node = model.getNode(containerId);
        if (node != null && node.getKind() == ElementKind.SUB_PROCESS) {
            return ContainerKind.SUB_PROCESS;
        }
        return ContainerKind.PROCESS;
    }

    private List<Item> itemsOf(String containerId, ContainerKind containerKind) {
        List<Item> items = new ArrayList<>(contentByContainer.getOrDefault(containerId, List.of()));
        items.sort(Comparator.comparingInt((Item item) -> containerKind.getOrder().indexOf(item.category()))
                .thenComparingInt(Item::documentIndex));
        return items;
    }

    private void writeContent(Element parentEl, String containerId, ContainerKind containerKind) {
        List<Item> lanes = new ArrayList<>();
        for (Item item : itemsOf(containerId, containerKind)) {
            if (item.category() == ContentCategory.LANE_SET) {
                lanes.add(item);
                continue;
            }
            if (!lanes.isEmpty()) {
                writeLaneSet(parentEl, laneSetId(containerId), lanes);
                lanes.clear();
            }
            if (item.node() != null) {
                writeNode(parentEl, item.node());
            } else {
                writeEdge(parentEl, item.edge());
            }
        }
        if (!lanes.isEmpty()) {
            writeLaneSet(parentEl, laneSetId(containerId), lanes);
        }
    }

    private String laneSetId(String containerId) {
        String owner = laneSetOwner(containerId);
        return derivedId("LaneSet_" + owner, owner);
    }

    private String laneSetOwner(String containerId) {
        for (SourceNode node : model.getLiveNodes()) {
            if (node.getKind() == ElementKind.PARTICIPANT && containerId.equals(node.getProcessId())) {
                return node.getId();
            }
        }
        return containerId;
    }

    private void writeProcess(Element definitionsEl, String processId) {
        Element processEl = createBpmnElement(definitionsEl, "process", processId);
        processEl.setAttribute("isExecutable", String.valueOf(config.executableProcesses));
        writeContent(processEl, processId, ContainerKind.PROCESS);
    }

    // Lanes

    private void writeLaneSet(Element parentEl, String laneSetId, List<Item> lanes) {
        Element laneSetEl = createBpmnElement(parentEl, "laneSet", laneSetId);
        for (Item item : lanes) {
            writeLane(laneSetEl, item.node());
        }
    }

    private void writeLane(Element laneSetEl, SourceNode lane) {
        Element laneEl = createBpmnElement(laneSetEl, "lane", lane.getId());
        setName(laneEl, lane.getName());
        List<SourceNode> childLanes = new ArrayList<>();
        for (SourceNode node : model.getLiveNodes()) {
            if (!lane.getId().equals(node.getLaneId())) {
                continue;
            }
            if (node.getKind() == ElementKind.LANE) {
                childLanes.add(node);
            } else if (node.getKind().isFlowNode()) {
                appendText(laneEl, "flowNodeRef", node.getId());
            }
        }
        if (!childLanes.isEmpty()) {
            Element childLaneSetEl = createBpmnElement(laneEl, "childLaneSet",
                    derivedId("LaneSet_" + lane.getId(), lane.getId()));
            for (SourceNode childLane : childLanes) {
                writeLane(childLaneSetEl, childLane);
            }
        }
    }

    // Nodes

    private void writeNode(Element parentEl, SourceNode node) {
        ElementKind kind = node.getKind();
        switch (kind.getFamily()) {
            case POOL -> writeParticipant(parentEl, node);
            case DATA -> writeDataReference(parentEl, node);
            case ARTIFACT -> writeArtifact(parentEl, node);
            case CONVERSATION -> setName(createBpmnElement(parentEl, kind.getElementName(), node.getId()), node.getName());
            default -> writeFlowNode(parentEl, node);
        }
    }

    private void writeParticipant(Element parentEl, SourceNode participant) {
        Element participantEl = createBpmnElement(parentEl, "participant", participant.getId());
        setName(participantEl, participant.getName());
        if (!participant.isOmitProcessRef() && participant.getProcessId() != null) {
            participantEl.setAttribute("processRef", participant.getProcessId());
        }
    }

    private void writeFlowNode(Element parentEl, SourceNode node) {
        ElementKind kind = node.getKind();
        Element nodeEl = createBpmnElement(parentEl, kind.getElementName(), node.getId());
        setName(nodeEl, node.getName());

        if (kind == ElementKind.BOUNDARY_EVENT) {
            nodeEl.setAttribute("attachedToRef", node.getAttachedToRef());
            nodeEl.setAttribute("cancelActivity", String.valueOf(node.isCancelActivity()));
        }
        if (node.isParallelMultiple() && isCatchEvent(kind)) {
            nodeEl.setAttribute("parallelMultiple", "true");
        }
        if (kind == ElementKind.SUB_PROCESS && node.isTriggeredByEvent()) {
            nodeEl.setAttribute("triggeredByEvent", "true");
        }

        for (String incoming : node.getIncomingFlowIds()) {
            if (!model.getEdge(incoming).isDropped()) {
                appendText(nodeEl, "incoming", incoming);
            }
        }
        for (String outgoing : node.getOutgoingFlowIds()) {
            if (!model.getEdge(outgoing).isDropped()) {
                appendText(nodeEl, "outgoing", outgoing);
            }
        }

        if (kind.getFamily() == ElementKind.Family.EVENT) {
            List<EventDefinitionKind> definitions = node.getEventDefinitions();
            for (int i = 0; i < definitions.size(); i++) {
                String definitionId = definitions.size() == 1 ? node.getId() + "_def" : node.getId() + "_def_" + (i + 1);
                writeEventDefinition(nodeEl, node, definitions.get(i), derivedId(definitionId, node.getId()));
            }
        }
        if (kind == ElementKind.SUB_PROCESS) {
            writeContent(nodeEl, node.getId(), ContainerKind.SUB_PROCESS);
        }
    }

    private static boolean isCatchEvent(ElementKind kind) {
        return kind == ElementKind.START_EVENT || kind == ElementKind.INTERMEDIATE_CATCH_EVENT
                || kind == ElementKind.BOUNDARY_EVENT;
    }

    private void writeEventDefinition(Element eventEl, SourceNode event, EventDefinitionKind definition,
                                      String definitionId) {
        Element definitionEl = createBpmnElement(eventEl, definition.getElementName(), definitionId);
        switch (definition) {
            case CONDITIONAL -> {
                Element conditionEl = appendText(definitionEl, "condition", orEmpty(event.property("conditionexpression")));
                conditionEl.setAttributeNS(XSI_NS, "xsi:type", FORMAL_EXPRESSION);
            }
            case LINK -> {
                String linkName = event.getName();
                if (linkName.isEmpty()) {
                    linkName = event.property("linkname") != null ? event.property("linkname") : event.getId();
                }
                setName(definitionEl, linkName);
            }
            case TIMER -> {
                // the schema allows only one of the three
                for (String timerProperty : List.of("timeDate", "timeCycle", "timeDuration")) {
                    String value = event.property(timerProperty.toLowerCase(Locale.ROOT));
                    if (value != null) {
                        Element timerEl = appendText(definitionEl, timerProperty, value);
                        timerEl.setAttributeNS(XSI_NS, "xsi:type", FORMAL_EXPRESSION);
                        break;
                    }
                }
            }
            default -> {
            }
        }
    }

    private void writeDataReference(Element parentEl, SourceNode node) {
        if (node.getKind() == ElementKind.DATA_OBJECT_REFERENCE) {
            String dataObjectId = derivedId("DataObject_" + node.getId(), node.getId());
            createBpmnElement(parentEl, "dataObject", dataObjectId);
            Element referenceEl = createBpmnElement(parentEl, "dataObjectReference", node.getId());
            setName(referenceEl, node.getName());
            referenceEl.setAttribute("dataObjectRef", dataObjectId);
        } else {
            Element referenceEl = createBpmnElement(parentEl, node.getKind().getElementName(), node.getId());
            setName(referenceEl, node.getName());
        }
    }

    private void writeArtifact(Element parentEl, SourceNode node) {
        Element artifactEl = createBpmnElement(parentEl, node.getKind().getElementName(), node.getId());
        if (node.getKind() == ElementKind.TEXT_ANNOTATION) {
            String text = node.getName().isEmpty() ? orEmpty(node.property("text")) : node.getName();
            appendText(artifactEl, "text", text);
        }
    }

    // Edges

    private void writeEdge(Element parentEl, SourceEdge edge) {
        Element edgeEl = createBpmnElement(parentEl, edge.getKind().getElementName(), edge.getId());
        if (edge.getEdgeClass() != EdgeClass.ASSOCIATION) {
            setName(edgeEl, edge.getName());
        }
        edgeEl.setAttribute("sourceRef", edge.getSourceId());
        edgeEl.setAttribute("targetRef", edge.getTargetId());

        if (edge.getEdgeClass() == EdgeClass.SEQUENCE_FLOW) {
            String condition = edge.property("conditionexpression");
            if (condition != null) {
                Element conditionEl = appendText(edgeEl, "conditionExpression", condition);
                conditionEl.setAttributeNS(XSI_NS, "xsi:type", FORMAL_EXPRESSION);
            }
        } else if (edge.getEdgeClass() == EdgeClass.ASSOCIATION) {
            edgeEl.setAttribute("associationDirection", associationDirection(edge));
        }
    }

    private static String associationDirection(SourceEdge edge) {
        if (edge.getMapping() != null && edge.getMapping().has(StructuralRule.DIRECTION_ONE)) {
            return "One";
        }
        if (edge.getMapping() != null && edge.getMapping().has(StructuralRule.DIRECTION_BOTH)) {
            return "Both";
        }
        return "None";
    }

    // Diagram interchange

    private void writeDiagram(Element definitionsEl) {
        Element diagramEl = doc.createElementNS(BPMNDI_NS, "bpmndi:BPMNDiagram");
        diagramEl.setAttribute("id", derivedId("BPMNDiagram_1", config.definitionsId));
        definitionsEl.appendChild(diagramEl);

        Element planeEl = doc.createElementNS(BPMNDI_NS, "bpmndi:BPMNPlane");
        planeEl.setAttribute("id", derivedId("BPMNPlane_1", config.definitionsId));
        planeEl.setAttribute("bpmnElement", collaboration ? config.collaborationId : config.defaultProcessId);
        diagramEl.appendChild(planeEl);

        for (SourceNode node : model.getLiveNodes()) {
            writeShape(planeEl, node);
        }
        for (SourceEdge edge : model.getLiveEdges()) {
            writeEdgeDi(planeEl, edge);
        }
    }

    private void writeShape(Element planeEl, SourceNode node) {
        Element shapeEl = doc.createElementNS(BPMNDI_NS, "bpmndi:BPMNShape");
        shapeEl.setAttribute("id", derivedId(node.getId() + "_di", node.getId()));
        shapeEl.setAttribute("bpmnElement", node.getId());
        boolean vertical = node.getMapping().has(StructuralRule.VERTICAL);
        if (node.getKind() == ElementKind.PARTICIPANT || node.getKind() == ElementKind.LANE) {
            shapeEl.setAttribute("isHorizontal", String.valueOf(!vertical));
        }
        if (node.getKind() == ElementKind.SUB_PROCESS) {
            shapeEl.setAttribute("isExpanded", String.valueOf(!node.getMapping().has(StructuralRule.COLLAPSED)));
        }
        planeEl.appendChild(shapeEl);

        Bounds bounds = node.getAbsoluteBounds();
        Element boundsEl = doc.createElementNS(DC_NS, "dc:Bounds");
        boundsEl.setAttribute("x", formatCoordinate(bounds.x()));
        boundsEl.setAttribute("y", formatCoordinate(bounds.y()));
        boundsEl.setAttribute("width", formatCoordinate(Math.max(bounds.width(), 1)));
        boundsEl.setAttribute("height", formatCoordinate(Math.max(bounds.height(), 1)));
        shapeEl.appendChild(boundsEl);
    }

    private void writeEdgeDi(Element planeEl, SourceEdge edge) {
        Element edgeEl = doc.createElementNS(BPMNDI_NS, "bpmndi:BPMNEdge");
        edgeEl.setAttribute("id", derivedId(edge.getId() + "_di", edge.getId()));
        edgeEl.setAttribute("bpmnElement", edge.getId());
        planeEl.appendChild(edgeEl);
        for (Point point : edge.getAbsoluteWaypoints()) {
            Element waypointEl = doc.createElementNS(DI_NS, "di:waypoint");
            waypointEl.setAttribute("x", formatCoordinate(point.x()));
            waypointEl.setAttribute("y", formatCoordinate(point.y()));
            edgeEl.appendChild(waypointEl);
        }
    }

    static String formatCoordinate(double value) {
        return String.valueOf(Math.round(value));
    }

    // DOM helpers

    private Element createBpmnElement(Element parentEl, String localName, String id) {
        Element element = doc.createElementNS(BPMN_NS, "bpmn:" + localName);
        element.setAttribute("id", id);
        parentEl.appendChild(element);
        return element;
    }

    private Element appendText(Element parentEl, String localName, String text) {
        Element element = doc.createElementNS(BPMN_NS, "bpmn:" + localName);
        element.setTextContent(xmlText(text, parentEl.getAttribute("id")));
        parentEl.appendChild(element);
        return element;
    }

    private void setName(Element element, String name) {
        if (name != null && !name.isEmpty()) {
            element.setAttribute("name", xmlText(name, element.getAttribute("id")));
        }
    }

    private String xmlText(String text, String ownerId) {
        String cleaned = removeInvalidXmlChars(text);
        if (cleaned.length() != text.length()) {
            diagnostics.report(DiagnosticKind.INVALID_CHARACTER, ownerId,
                    (text.length() - cleaned.length()) + " character(s) not allowed in XML 1.0 removed");
        }
        return cleaned;
    }

    /**
     * Drops every code point outside the XML 1.0 {@code Char} production, unpaired surrogates included.
     */
    static String removeInvalidXmlChars(String text) {
        StringBuilder builder = null;
        int i = 0;
        while (i < text.length()) {
            int codePoint = text.codePointAt(i);
            int next = i + Character.charCount(codePoint);
            if (isXmlChar(codePoint)) {
                if (builder != null) {
                    builder.appendCodePoint(codePoint);
                }
            } else if (builder == null) {
                builder = new StringBuilder(text.length()).append(text, 0, i);
            }
            i = next;
        }
        return builder == null ? text : builder.toString();
    }

    private static boolean isXmlChar(int codePoint) {
        return codePoint == 0x9 || codePoint == 0xA || codePoint == 0xD
                || (codePoint >= 0x20 && codePoint <= 0xD7FF)
                || (codePoint >= 0xE000 && codePoint <= 0xFFFD)
                || (codePoint >= 0x10000 && codePoint <= 0x10FFFF);
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    // Serialization

    /**
     * Serializes a document with two-space indentation and UTF-8 encoding.
     *
     * @throws RuntimeException if the transformer fails
     */
    public static String toXmlString(Document doc) {
        try {
            TransformerFactory transformerFactory = TransformerFactory.newInstance();
            Transformer transformer = transformerFactory.newTransformer();
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.STANDALONE, "no");
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");

            StringWriter stringWriter = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(stringWriter));

            // Remove extra blank lines (consecutive newlines)
            return stringWriter.toString().replaceAll("(\r?\n)\\s*\r?\n", "$1");
        } catch (TransformerException e) {
            throw new RuntimeException("Failed to serialize BPMN document", e);
        }
    }

    public static void writeBpmnDocument(String xmlContent, Path outputFile) {
        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputFile, xmlContent, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write BPMN document: " + outputFile, e);
        }
    }
}
