package io.bpmnconvert.signavio.stencil;

import java.util.Locale;
import java.util.Optional;

public enum EventDefinitionKind {
    MESSAGE("messageEventDefinition"),
    TIMER("timerEventDefinition"),
    CONDITIONAL("conditionalEventDefinition"),
    SIGNAL("signalEventDefinition"),
    ERROR("errorEventDefinition"),
    ESCALATION("escalationEventDefinition"),
    TERMINATE("terminateEventDefinition"),
    CANCEL("cancelEventDefinition"),
    COMPENSATE("compensateEventDefinition"),
    LINK("linkEventDefinition");

    private final String elementName;

    EventDefinitionKind(String elementName) {
        this.elementName = elementName;
    }

    public String getElementName() {
        return elementName;
    }

    /**
     * Resolves a free-form label as found in nested Signavio properties,
     * e.g. "Message", "timer", "compensation" or "signalEventDefinition".
     */
    public static Optional<EventDefinitionKind> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT)
                .replace("eventdefinition", "")
                .replace(" ", "")
                .replace("_", "");
        if (normalized.equals("compensation")) {
            return Optional.of(COMPENSATE);
        }
        for (EventDefinitionKind kind : values()) {
            if (kind.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
