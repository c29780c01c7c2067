package io.bpmnconvert.signavio.stencil;

/**
 * Target BPMN 2.0 element kinds a Signavio stencil can resolve to.
 * Width and height are the default shape size used when a shape carries no usable bounds.
 */
public enum ElementKind {
    DEFINITIONS("definitions", Family.ROOT, 0, 0),

    PARTICIPANT("participant", Family.POOL, 600, 250),
    LANE("lane", Family.LANE, 570, 125),

    TASK("task", Family.ACTIVITY, 100, 80),
    SEND_TASK("sendTask", Family.ACTIVITY, 100, 80),
    RECEIVE_TASK("receiveTask", Family.ACTIVITY, 100, 80),
    USER_TASK("userTask", Family.ACTIVITY, 100, 80),
    MANUAL_TASK("manualTask", Family.ACTIVITY, 100, 80),
    SERVICE_TASK("serviceTask", Family.ACTIVITY, 100, 80),
    BUSINESS_RULE_TASK("businessRuleTask", Family.ACTIVITY, 100, 80),
    SCRIPT_TASK("scriptTask", Family.ACTIVITY, 100, 80),
    SUB_PROCESS("subProcess", Family.ACTIVITY, 100, 80),

    EXCLUSIVE_GATEWAY("exclusiveGateway", Family.GATEWAY, 40, 40),
    PARALLEL_GATEWAY("parallelGateway", Family.GATEWAY, 40, 40),
    INCLUSIVE_GATEWAY("inclusiveGateway", Family.GATEWAY, 40, 40),
    EVENT_BASED_GATEWAY("eventBasedGateway", Family.GATEWAY, 40, 40),
    COMPLEX_GATEWAY("complexGateway", Family.GATEWAY, 40, 40),

    START_EVENT("startEvent", Family.EVENT, 30, 30),
    END_EVENT("endEvent", Family.EVENT, 28, 28),
    INTERMEDIATE_CATCH_EVENT("intermediateCatchEvent", Family.EVENT, 30, 30),
    INTERMEDIATE_THROW_EVENT("intermediateThrowEvent", Family.EVENT, 30, 30),
    BOUNDARY_EVENT("boundaryEvent", Family.EVENT, 30, 30),

    SEQUENCE_FLOW("sequenceFlow", Family.CONNECTOR, 0, 0),
    MESSAGE_FLOW("messageFlow", Family.CONNECTOR, 0, 0),
    ASSOCIATION("association", Family.CONNECTOR, 0, 0),
    CONVERSATION_LINK("conversationLink", Family.CONNECTOR, 0, 0),

    DATA_OBJECT_REFERENCE("dataObjectReference", Family.DATA, 40, 50),
    DATA_STORE_REFERENCE("dataStoreReference", Family.DATA, 60, 60),
    MESSAGE("message", Family.MESSAGE, 30, 20),

    TEXT_ANNOTATION("textAnnotation", Family.ARTIFACT, 100, 50),
    GROUP("group", Family.ARTIFACT, 200, 200),

    CHOREOGRAPHY_TASK("choreographyTask", Family.CHOREOGRAPHY, 100, 80),
    SUB_CHOREOGRAPHY("subChoreography", Family.CHOREOGRAPHY, 100, 80),
    CONVERSATION("conversation", Family.CONVERSATION, 40, 40);

    /**
     * Coarse grouping used for containment, ordering and outline geometry.
     */
    public enum Family {
        ROOT, POOL, LANE, ACTIVITY, GATEWAY, EVENT, CONNECTOR, DATA, MESSAGE, ARTIFACT, CHOREOGRAPHY, CONVERSATION
    }

    private final String elementName;
    private final Family family;
    private final double defaultWidth;
    private final double defaultHeight;

    ElementKind(String elementName, Family family, double defaultWidth, double defaultHeight) {
        this.elementName = elementName;
        this.family = family;
        this.defaultWidth = defaultWidth;
        this.defaultHeight = defaultHeight;
    }

    /** Local name of the element in the BPMN model namespace. */
    public String getElementName() { return elementName; }
    public Family getFamily()       { return family; }
    public double getDefaultWidth() { return defaultWidth; }
    public double getDefaultHeight() { return defaultHeight; }

    public boolean isTask() {
        return family == Family.ACTIVITY && this != SUB_PROCESS;
    }

    public boolean isFlowNode() {
        return family == Family.ACTIVITY || family == Family.GATEWAY || family == Family.EVENT;
    }

    public boolean isConnector() {
        return family == Family.CONNECTOR;
    }
}
