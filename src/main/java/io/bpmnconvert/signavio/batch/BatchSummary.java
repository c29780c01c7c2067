package io.bpmnconvert.signavio.batch;

import io.bpmnconvert.signavio.diagnostics.DiagnosticKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a batch run, one result per input file in input order.
 */
public record BatchSummary(List<ConversionResult> results) {

    public BatchSummary {
        results = List.copyOf(results);
    }

    public long succeeded() {
        return results.stream().filter(ConversionResult::success).count();
    }

    public long failed() {
        return results.size() - succeeded();
    }

    public boolean allSucceeded() {
        return failed() == 0;
    }

    public List<ConversionResult> failures() {
        return results.stream().filter(result -> !result.success()).toList();
    }

    public Map<DiagnosticKind, Integer> diagnosticTotals() {
        Map<DiagnosticKind, Integer> totals = new EnumMap<>(DiagnosticKind.class);
        for (ConversionResult result : results) {
            result.diagnosticCounts().forEach((kind, count) -> totals.merge(kind, count, Integer::sum));
        }
        return Collections.unmodifiableMap(totals);
    }

    public int totalDiagnostics() {
        return diagnosticTotals().values().stream().mapToInt(Integer::intValue).sum();
    }

    @Override
    public String toString() {
        return "Converted " + succeeded() + " of " + results.size() + " files, "
                + failed() + " failed, " + totalDiagnostics() + " diagnostics " + diagnosticTotals();
    }
}
