package io.bpmnconvert.signavio.bpmn;

import io.bpmnconvert.signavio.stencil.ElementKind;

import java.util.List;
import java.util.Optional;

import static io.bpmnconvert.signavio.bpmn.ContentCategory.*;

/**
 * Element kinds that hold other elements, each with the category sequence its content is
 * written in. Elements keep document order within a category.
 */
public enum ContainerKind {
    DEFINITIONS(List.of(ROOT_ELEMENT, ContentCategory.COLLABORATION, ContentCategory.PROCESS)),
    COLLABORATION(List.of(PARTICIPANT, MESSAGE_FLOW, ARTIFACT, ASSOCIATION, CONVERSATION_NODE, CONVERSATION_LINK)),
    PROCESS(List.of(LANE_SET, FLOW_NODE, SEQUENCE_FLOW, ARTIFACT, ASSOCIATION)),
    SUB_PROCESS(List.of(LANE_SET, FLOW_NODE, SEQUENCE_FLOW, ARTIFACT, ASSOCIATION));

    private final List<ContentCategory> order;

    ContainerKind(List<ContentCategory> order) {
        this.order = order;
    }

    public List<ContentCategory> getOrder() {
        return order;
    }

    /**
     * Category an element of the given kind falls into inside this container.
     *
     * @return empty when the kind cannot appear in this container at all
     */
    public Optional<ContentCategory> categoryOf(ElementKind kind) {
        ContentCategory category = switch (this) {
            case DEFINITIONS -> kind == ElementKind.MESSAGE ? ROOT_ELEMENT : null;
            case COLLABORATION -> switch (kind.getFamily()) {
                case POOL -> ContentCategory.PARTICIPANT;
                case CONVERSATION -> CONVERSATION_NODE;
                case ARTIFACT -> ARTIFACT;
                case CONNECTOR -> switch (kind) {
                    case MESSAGE_FLOW -> ContentCategory.MESSAGE_FLOW;
                    case ASSOCIATION -> ContentCategory.ASSOCIATION;
                    case CONVERSATION_LINK -> ContentCategory.CONVERSATION_LINK;
                    default -> null;
                };
                default -> null;
            };
            case PROCESS, SUB_PROCESS -> switch (kind.getFamily()) {
                case LANE -> LANE_SET;
                case ACTIVITY, GATEWAY, EVENT, DATA -> FLOW_NODE;
                case ARTIFACT -> ARTIFACT;
                case CONNECTOR -> switch (kind) {
                    case SEQUENCE_FLOW -> ContentCategory.SEQUENCE_FLOW;
                    case ASSOCIATION -> ContentCategory.ASSOCIATION;
                    default -> null;
                };
                default -> null;
            };
        };
        return Optional.ofNullable(category);
    }
}
