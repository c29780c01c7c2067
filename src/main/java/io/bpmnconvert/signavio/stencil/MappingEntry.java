package io.bpmnconvert.signavio.stencil;

import java.util.Set;

/**
 * One row of the stencil mapping table.
 *
 * @param stencilId       Signavio stencil identifier, e.g. "IntermediateTimerEvent"
 * @param kind            target element kind before property inspection
 * @param eventDefinition fixed event definition, null when none or derived from properties
 * @param rules           structural rules applied on top of the kind
 */
public record MappingEntry(
        String stencilId,
        ElementKind kind,
        EventDefinitionKind eventDefinition,
        Set<StructuralRule> rules
) {
    public MappingEntry {
        rules = rules == null ? Set.of() : Set.copyOf(rules);
    }

    public boolean has(StructuralRule rule) {
        return rules.contains(rule);
    }
}
