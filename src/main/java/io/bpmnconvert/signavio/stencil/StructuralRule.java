package io.bpmnconvert.signavio.stencil;

/**
 * Special handling attached to a mapping entry beyond the plain element kind.
 */
public enum StructuralRule {
    /** Black-box participant: never write a processRef. */
    OMIT_PROCESS_REF,
    /** Write triggeredByEvent="true" on the sub-process. */
    TRIGGERED_BY_EVENT,
    /** Write parallelMultiple="true" on the catch event. */
    PARALLEL_MULTIPLE,
    /** Final activity kind depends on the "tasktype" property. */
    TASK_TYPE_FROM_PROPERTIES,
    /** Event definitions are enumerated from nested properties. */
    DEFINITIONS_FROM_PROPERTIES,
    /** Drawn collapsed (pool without content, sub-process without expansion). */
    COLLAPSED,
    /** Pool or lane drawn vertically. */
    VERTICAL,
    DIRECTION_ONE,
    DIRECTION_BOTH,
    DIRECTION_NONE
}
