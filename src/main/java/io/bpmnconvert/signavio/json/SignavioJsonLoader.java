package io.bpmnconvert.signavio.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.bpmnconvert.signavio.diagnostics.DiagnosticKind;
import io.bpmnconvert.signavio.diagnostics.Diagnostics;
import io.bpmnconvert.signavio.models.Bounds;
import io.bpmnconvert.signavio.models.Point;
import io.bpmnconvert.signavio.models.ProcessModel;
import io.bpmnconvert.signavio.models.SourceEdge;
import io.bpmnconvert.signavio.models.SourceNode;
import io.bpmnconvert.signavio.stencil.MappingTable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads a Signavio JSON export into a {@link ProcessModel}.
 * <p>
 * Shapes are nested through "childShapes"; the nesting gives each shape its declared parent
 * unless the shape names one explicitly through "parent". Connectors are told apart from
 * nodes by their stencil, or by a "target" reference when the stencil is unknown.
 */
public class SignavioJsonLoader {
    private static final String SCHEMA_RESOURCE_PATH = "schema/signavio_model_schema.json";
    private static final String DEFAULT_ROOT_ID = "canvas";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final JsonSchema modelSchema = loadModelSchema();

    private static JsonSchema loadModelSchema() {
        try (InputStream schemaStream = SignavioJsonLoader.class.getClassLoader()
                .getResourceAsStream(SCHEMA_RESOURCE_PATH)) {
            if (schemaStream == null) {
                throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE_PATH);
            }
            return factory.getSchema(mapper.readTree(schemaStream));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read schema resource: " + SCHEMA_RESOURCE_PATH, e);
        }
    }

    public static ProcessModel loadFromFile(Path jsonFile, Diagnostics diagnostics) {
        byte[] content;
        try {
            content = Files.readAllBytes(jsonFile);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read Signavio JSON file: " + jsonFile, e);
        }
        return load(content, diagnostics);
    }

    /**
     * Parses raw bytes into a process model.
     *
     * @throws StructuralParseException when the bytes are not JSON or not a shape document
     */
    public static ProcessModel load(byte[] content, Diagnostics diagnostics) {
        JsonNode document;
        try {
            document = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new StructuralParseException("Input is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new StructuralParseException("Input could not be read: " + e.getMessage(), e);
        }
        return load(document, diagnostics);
    }

    public static ProcessModel load(JsonNode document, Diagnostics diagnostics) {
        if (document == null || document.isMissingNode() || !document.isObject()) {
            throw new StructuralParseException("Top-level JSON value is not an object");
        }
        Set<ValidationMessage> result = modelSchema.validate(document);
        if (!result.isEmpty()) {
            String details = result.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new StructuralParseException("Not a Signavio shape document: " + details);
        }

        String rootId = sanitizeId(document.path("resourceId").asText(""));
        if (rootId.isEmpty()) {
            rootId = DEFAULT_ROOT_ID;
        }
        String rootStencil = document.path("stencil").path("id").asText("BPMNDiagram");
        SourceNode root = new SourceNode(rootId, rootStencil, normalizeName(document.path("properties")),
                propertiesOf(document), null, null, List.of(), 0);

        ProcessModel model = new ProcessModel(root);
        int[] counter = {1};
        readShapes(document.get("childShapes"), rootId, model, diagnostics, counter);
        return model;
    }

    private static void readShapes(JsonNode childShapes, String parentId, ProcessModel model,
                                   Diagnostics diagnostics, int[] counter) {
        if (childShapes == null || !childShapes.isArray()) {
            return;
        }
        for (JsonNode shape : childShapes) {
            String stencilId = shape.path("stencil").path("id").asText("");
            String resourceId = sanitizeId(shape.path("resourceId").asText(""));
            if (stencilId.isEmpty() || resourceId.isEmpty()) {
                diagnostics.report(DiagnosticKind.MALFORMED_SHAPE, resourceId.isEmpty() ? null : resourceId,
                        "Shape without stencil id or resource id skipped together with its children");
                continue;
            }

            String declaredParent = referenceOf(shape.get("parent"));
            String effectiveParent = declaredParent != null ? declaredParent : parentId;
            ObjectNode properties = propertiesOf(shape);
            String name = normalizeName(properties);
            List<String> outgoing = referencesOf(shape.get("outgoing"));
            int index = counter[0]++;

            boolean isEdge = MappingTable.isConnector(stencilId)
                    || (MappingTable.lookup(stencilId).isEmpty() && shape.hasNonNull("target"));

            if (isEdge) {
                String target = referenceOf(shape.get("target"));
                if (target == null && !outgoing.isEmpty()) {
                    target = outgoing.get(0);
                }
                SourceEdge edge = new SourceEdge(resourceId, stencilId, name, properties,
                        referenceOf(shape.get("source")), target, dockersOf(shape.get("dockers")),
                        effectiveParent, index);
                if (!model.addEdge(edge)) {
                    diagnostics.report(DiagnosticKind.DUPLICATE_IDENTIFIER, resourceId,
                            "Connector id already used, later occurrence skipped");
                }
                continue;
            }

            SourceNode node = new SourceNode(resourceId, stencilId, name, properties,
                    boundsOf(shape.get("bounds")), effectiveParent, outgoing, index);
            if (!model.addNode(node)) {
                diagnostics.report(DiagnosticKind.DUPLICATE_IDENTIFIER, resourceId,
                        "Shape id already used, later occurrence skipped together with its children");
                continue;
            }
            readShapes(shape.get("childShapes"), resourceId, model, diagnostics, counter);
        }
    }

    /**
     * Turns a Signavio resource id into a valid XML NCName.
     * Characters outside the NCName range become '_' and ids not starting with a letter or '_'
     * are prefixed with "id_".
     */
    public static String sanitizeId(String id) {
        if (id == null || id.isEmpty()) {
            return id == null ? "" : id;
        }
        StringBuilder sb = new StringBuilder(id.length());
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.') {
                sb.append(c);
            } else {
                sb.append('_');
            }
        }
        char first = sb.charAt(0);
        if (!Character.isLetter(first) && first != '_') {
            sb.insert(0, "id_");
        }
        return sb.toString();
    }

    private static String normalizeName(JsonNode properties) {
        JsonNode name = properties == null ? null : properties.get("name");
        if (name == null || name.isNull() || name.isContainerNode()) {
            return "";
        }
        return String.join(" ", name.asText().trim().split("\\s+")).trim();
    }

    private static ObjectNode propertiesOf(JsonNode shape) {
        JsonNode properties = shape.get("properties");
        if (properties != null && properties.isObject()) {
            return (ObjectNode) properties;
        }
        return mapper.createObjectNode();
    }

    private static String referenceOf(JsonNode reference) {
        if (reference == null || !reference.isObject()) {
            return null;
        }
        String id = sanitizeId(reference.path("resourceId").asText(""));
        return id.isEmpty() ? null : id;
    }

    private static List<String> referencesOf(JsonNode references) {
        List<String> ids = new ArrayList<>();
        if (references == null || !references.isArray()) {
            return ids;
        }
        for (JsonNode reference : references) {
            String id = referenceOf(reference);
            if (id != null) {
                ids.add(id);
            }
        }
        return ids;
    }

    private static List<Point> dockersOf(JsonNode dockers) {
        List<Point> points = new ArrayList<>();
        if (dockers == null || !dockers.isArray()) {
            return points;
        }
        for (JsonNode docker : dockers) {
            if (docker.path("x").isNumber() && docker.path("y").isNumber()) {
                points.add(new Point(docker.get("x").asDouble(), docker.get("y").asDouble()));
            }
        }
        return points;
    }

    /**
     * Reads {"upperLeft": {x, y}, "lowerRight": {x, y}}. Returns null when either corner is missing;
     * sign and size checks are left to the coordinate transformer.
     */
    private static Bounds boundsOf(JsonNode bounds) {
        if (bounds == null || !bounds.isObject()) {
            return null;
        }
        JsonNode upperLeft = bounds.get("upperLeft");
        JsonNode lowerRight = bounds.get("lowerRight");
        if (upperLeft == null || lowerRight == null
                || !upperLeft.path("x").isNumber() || !upperLeft.path("y").isNumber()) {
            return null;
        }
        double x = upperLeft.get("x").asDouble();
        double y = upperLeft.get("y").asDouble();
        double width = lowerRight.path("x").isNumber() ? lowerRight.get("x").asDouble() - x : 0;
        double height = lowerRight.path("y").isNumber() ? lowerRight.get("y").asDouble() - y : 0;
        return new Bounds(x, y, width, height);
    }
}
