package io.bpmnconvert.signavio.stencil;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static io.bpmnconvert.signavio.stencil.ElementKind.*;
import static io.bpmnconvert.signavio.stencil.StructuralRule.*;

/**
 * Registry of every Signavio stencil the converter understands.
 * Built once and never modified afterwards, so it is shared freely between conversions.
 */
public final class MappingTable {
    private static final Map<String, MappingEntry> ENTRIES;

    static {
        Map<String, MappingEntry> entries = new HashMap<>();

        put(entries, "BPMNDiagram", DEFINITIONS);

        // Participants
        put(entries, "Pool", PARTICIPANT);
        put(entries, "VerticalPool", PARTICIPANT, VERTICAL);
        put(entries, "CollapsedPool", PARTICIPANT, OMIT_PROCESS_REF, COLLAPSED);
        put(entries, "CollapsedVerticalPool", PARTICIPANT, OMIT_PROCESS_REF, COLLAPSED, VERTICAL);
        put(entries, "Lane", LANE);
        put(entries, "VerticalLane", LANE, VERTICAL);

        // Activities
        put(entries, "Task", TASK, TASK_TYPE_FROM_PROPERTIES);
        put(entries, "Subprocess", SUB_PROCESS);
        put(entries, "CollapsedSubprocess", SUB_PROCESS, COLLAPSED);
        put(entries, "EventSubprocess", SUB_PROCESS, TRIGGERED_BY_EVENT);
        put(entries, "CollapsedEventSubprocess", SUB_PROCESS, TRIGGERED_BY_EVENT, COLLAPSED);

        // Gateways
        put(entries, "Exclusive_Databased_Gateway", EXCLUSIVE_GATEWAY);
        put(entries, "ParallelGateway", PARALLEL_GATEWAY);
        put(entries, "AND_Gateway", PARALLEL_GATEWAY);
        put(entries, "InclusiveGateway", INCLUSIVE_GATEWAY);
        put(entries, "EventbasedGateway", EVENT_BASED_GATEWAY);
        put(entries, "ComplexGateway", COMPLEX_GATEWAY);

        // Start events
        put(entries, "StartNoneEvent", START_EVENT);
        put(entries, "StartEvent", START_EVENT);
        event(entries, "StartMessageEvent", START_EVENT, EventDefinitionKind.MESSAGE);
        event(entries, "StartTimerEvent", START_EVENT, EventDefinitionKind.TIMER);
        event(entries, "StartConditionalEvent", START_EVENT, EventDefinitionKind.CONDITIONAL);
        event(entries, "StartSignalEvent", START_EVENT, EventDefinitionKind.SIGNAL);
        event(entries, "StartErrorEvent", START_EVENT, EventDefinitionKind.ERROR);
        event(entries, "StartEscalationEvent", START_EVENT, EventDefinitionKind.ESCALATION);
        event(entries, "StartCompensationEvent", START_EVENT, EventDefinitionKind.COMPENSATE);
        put(entries, "StartMultipleEvent", START_EVENT, DEFINITIONS_FROM_PROPERTIES);
        put(entries, "StartParallelMultipleEvent", START_EVENT, DEFINITIONS_FROM_PROPERTIES, PARALLEL_MULTIPLE);

        // End events
        put(entries, "EndNoneEvent", END_EVENT);
        put(entries, "EndEvent", END_EVENT);
        event(entries, "EndMessageEvent", END_EVENT, EventDefinitionKind.MESSAGE);
        event(entries, "EndEscalationEvent", END_EVENT, EventDefinitionKind.ESCALATION);
        event(entries, "EndErrorEvent", END_EVENT, EventDefinitionKind.ERROR);
        event(entries, "EndTerminateEvent", END_EVENT, EventDefinitionKind.TERMINATE);
        event(entries, "EndCancelEvent", END_EVENT, EventDefinitionKind.CANCEL);
        event(entries, "EndSignalEvent", END_EVENT, EventDefinitionKind.SIGNAL);
        event(entries, "EndCompensationEvent", END_EVENT, EventDefinitionKind.COMPENSATE);
        put(entries, "EndMultipleEvent", END_EVENT, DEFINITIONS_FROM_PROPERTIES);

        // Intermediate catching events
        put(entries, "IntermediateEvent", INTERMEDIATE_CATCH_EVENT);
        event(entries, "IntermediateMessageEventCatching", INTERMEDIATE_CATCH_EVENT, EventDefinitionKind.MESSAGE);
        event(entries, "IntermediateTimerEvent", INTERMEDIATE_CATCH_EVENT, EventDefinitionKind.TIMER);
        event(entries, "IntermediateConditionalEvent", INTERMEDIATE_CATCH_EVENT, EventDefinitionKind.CONDITIONAL);
        event(entries, "IntermediateSignalEventCatching", INTERMEDIATE_CATCH_EVENT, EventDefinitionKind.SIGNAL);
        event(entries, "IntermediateLinkEventCatching", INTERMEDIATE_CATCH_EVENT, EventDefinitionKind.LINK);
        event(entries, "IntermediateErrorEvent", INTERMEDIATE_CATCH_EVENT, EventDefinitionKind.ERROR);
        event(entries, "IntermediateCancelEvent", INTERMEDIATE_CATCH_EVENT, EventDefinitionKind.CANCEL);
        event(entries, "IntermediateEscalationEventCatching", INTERMEDIATE_CATCH_EVENT, EventDefinitionKind.ESCALATION);
        event(entries, "IntermediateCompensationEventCatching", INTERMEDIATE_CATCH_EVENT, EventDefinitionKind.COMPENSATE);
        put(entries, "IntermediateMultipleEventCatching", INTERMEDIATE_CATCH_EVENT, DEFINITIONS_FROM_PROPERTIES);
        put(entries, "IntermediateParallelMultipleEventCatching", INTERMEDIATE_CATCH_EVENT,
                DEFINITIONS_FROM_PROPERTIES, PARALLEL_MULTIPLE);

        // Intermediate throwing events
        put(entries, "IntermediateEventThrowing", INTERMEDIATE_THROW_EVENT);
        event(entries, "IntermediateMessageEventThrowing", INTERMEDIATE_THROW_EVENT, EventDefinitionKind.MESSAGE);
        event(entries, "IntermediateSignalEventThrowing", INTERMEDIATE_THROW_EVENT, EventDefinitionKind.SIGNAL);
        event(entries, "IntermediateLinkEventThrowing", INTERMEDIATE_THROW_EVENT, EventDefinitionKind.LINK);
        event(entries, "IntermediateCompensationEventThrowing", INTERMEDIATE_THROW_EVENT, EventDefinitionKind.COMPENSATE);
        event(entries, "IntermediateEscalationEvent", INTERMEDIATE_THROW_EVENT, EventDefinitionKind.ESCALATION);
        event(entries, "IntermediateEscalationEventThrowing", INTERMEDIATE_THROW_EVENT, EventDefinitionKind.ESCALATION);
        put(entries, "IntermediateMultipleEventThrowing", INTERMEDIATE_THROW_EVENT, DEFINITIONS_FROM_PROPERTIES);

        // Connectors
        put(entries, "SequenceFlow", SEQUENCE_FLOW);
        put(entries, "MessageFlow", MESSAGE_FLOW);
        put(entries, "Association_Unidirectional", ASSOCIATION, DIRECTION_ONE);
        put(entries, "Association_Undirected", ASSOCIATION, DIRECTION_NONE);
        put(entries, "Association_Bidirectional", ASSOCIATION, DIRECTION_BOTH);
        put(entries, "ConversationLink", CONVERSATION_LINK);

        // Data
        put(entries, "DataObject", DATA_OBJECT_REFERENCE);
        put(entries, "DataStore", DATA_STORE_REFERENCE);
        put(entries, "Message", MESSAGE);

        // Artifacts
        put(entries, "TextAnnotation", TEXT_ANNOTATION);
        put(entries, "Group", GROUP);

        // Choreography, kept only so the elements are recognized and then filtered
        put(entries, "ChoreographyTask", CHOREOGRAPHY_TASK);
        put(entries, "ChoreographyParticipant", PARTICIPANT, OMIT_PROCESS_REF);
        put(entries, "ChoreographySubprocessCollapsed", SUB_CHOREOGRAPHY, COLLAPSED);
        put(entries, "ChoreographySubprocessExpanded", SUB_CHOREOGRAPHY);

        // Conversation
        put(entries, "Communication", CONVERSATION);
        put(entries, "Participant", PARTICIPANT, OMIT_PROCESS_REF);

        // Signavio-specific shapes approximated by the closest data element
        put(entries, "ITSystem", DATA_STORE_REFERENCE);
        put(entries, "processparticipant", DATA_OBJECT_REFERENCE);

        ENTRIES = Map.copyOf(entries);
    }

    private MappingTable() {
    }

    private static void put(Map<String, MappingEntry> entries, String stencilId, ElementKind kind,
                            StructuralRule... rules) {
        Set<StructuralRule> ruleSet = rules.length == 0 ? Set.of() : EnumSet.of(rules[0], rules);
        entries.put(stencilId, new MappingEntry(stencilId, kind, null, ruleSet));
    }

    private static void event(Map<String, MappingEntry> entries, String stencilId, ElementKind kind,
                              EventDefinitionKind definition) {
        entries.put(stencilId, new MappingEntry(stencilId, kind, definition, Set.of()));
    }

    /**
     * Looks up a stencil.
     *
     * @param stencilId the Signavio stencil id
     * @return the entry, or empty when the stencil is unknown
     */
    public static Optional<MappingEntry> lookup(String stencilId) {
        if (stencilId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(ENTRIES.get(stencilId));
    }

    public static boolean isConnector(String stencilId) {
        return lookup(stencilId).map(entry -> entry.kind().isConnector()).orElse(false);
    }

    public static Set<String> stencilIds() {
        return ENTRIES.keySet();
    }

    public static int size() {
        return ENTRIES.size();
    }
}
