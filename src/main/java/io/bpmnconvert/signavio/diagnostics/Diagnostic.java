package io.bpmnconvert.signavio.diagnostics;

/**
 * One recorded conversion problem.
 *
 * @param kind      the category
 * @param elementId the id of the node or edge concerned, may be null for document-level records
 * @param message   human readable detail
 */
public record Diagnostic(
        DiagnosticKind kind,
        String elementId,
        String message
) {
    @Override
    public String toString() {
        return kind + (elementId != null ? " [" + elementId + "]" : "") + ": " + message;
    }
}
