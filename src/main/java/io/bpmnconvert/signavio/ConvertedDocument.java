package io.bpmnconvert.signavio;

import io.bpmnconvert.signavio.diagnostics.Diagnostics;

/**
 * BPMN XML produced from one Signavio document, with everything noticed on the way.
 */
public record ConvertedDocument(
        String xml,
        Diagnostics diagnostics
) {
}
