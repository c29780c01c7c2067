package io.bpmnconvert.signavio.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Collector threaded through every conversion stage of one file.
 * Not shared between files, so it needs no synchronization.
 */
public class Diagnostics {
    private static final Logger log = LoggerFactory.getLogger(Diagnostics.class);

    private final List<Diagnostic> records = new ArrayList<>();

    public void report(DiagnosticKind kind, String elementId, String message) {
        Diagnostic diagnostic = new Diagnostic(kind, elementId, message);
        records.add(diagnostic);
        log.debug("{}", diagnostic);
    }

    public List<Diagnostic> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public List<Diagnostic> ofKind(DiagnosticKind kind) {
        return records.stream().filter(d -> d.kind() == kind).toList();
    }

    public boolean has(DiagnosticKind kind, String elementId) {
        return records.stream()
                .anyMatch(d -> d.kind() == kind && elementId != null && elementId.equals(d.elementId()));
    }

    /**
     * Counts records per kind. Kinds without records are left out.
     */
    public Map<DiagnosticKind, Integer> countsByKind() {
        Map<DiagnosticKind, Integer> counts = new EnumMap<>(DiagnosticKind.class);
        for (Diagnostic record : records) {
            counts.merge(record.kind(), 1, Integer::sum);
        }
        return counts;
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }
}
