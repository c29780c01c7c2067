package io.bpmnconvert.signavio.diagnostics;

/**
 * Categories of non-fatal problems found while converting a single file.
 * Every kind is recovered locally: the affected element is dropped or defaulted.
 */
public enum DiagnosticKind {
    UNKNOWN_STENCIL,
    DANGLING_REFERENCE,
    MISSING_OR_INVALID_BOUNDS,
    CYCLIC_CONTAINMENT,
    UNKNOWN_TASK_TYPE,
    INVALID_EVENT_DEFINITION,
    DUPLICATE_IDENTIFIER,
    UNPLACED_ELEMENT,
    MALFORMED_SHAPE,
    INVALID_CHARACTER
}
