package io.bpmnconvert.signavio.models;

public enum EdgeClass {
    SEQUENCE_FLOW,
    MESSAGE_FLOW,
    ASSOCIATION,
    CONVERSATION_LINK
}
