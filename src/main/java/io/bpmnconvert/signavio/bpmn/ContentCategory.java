package io.bpmnconvert.signavio.bpmn;

/**
 * Groups of child elements whose relative order the BPMN 2.0 schema fixes.
 */
public enum ContentCategory {
    ROOT_ELEMENT,
    COLLABORATION,
    PROCESS,
    PARTICIPANT,
    MESSAGE_FLOW,
    CONVERSATION_NODE,
    CONVERSATION_LINK,
    LANE_SET,
    FLOW_NODE,
    SEQUENCE_FLOW,
    ARTIFACT,
    ASSOCIATION
}
