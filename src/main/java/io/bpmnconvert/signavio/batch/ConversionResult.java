package io.bpmnconvert.signavio.batch;

import io.bpmnconvert.signavio.diagnostics.Diagnostic;
import io.bpmnconvert.signavio.diagnostics.DiagnosticKind;
import lombok.Builder;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Builder
public record ConversionResult(
        Path inputFile,
        Path outputFile,  // null when the conversion failed
        boolean success,
        String failureMessage,
        List<Diagnostic> diagnostics,
        Map<DiagnosticKind, Integer> diagnosticCounts
) {
    // Missing lists and counts default to empty
    public ConversionResult {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        Map<DiagnosticKind, Integer> counts = new EnumMap<>(DiagnosticKind.class);
        if (diagnosticCounts != null) {
            counts.putAll(diagnosticCounts);
        }
        diagnosticCounts = Collections.unmodifiableMap(counts);
    }
}
