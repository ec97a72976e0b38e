package io.responseparser.core.shape;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.responseparser.core.error.ShapeDefinitionException;
import io.responseparser.core.model.Location;
import io.responseparser.core.model.Serialization;
import io.responseparser.core.model.Shape;
import io.responseparser.core.model.ShapeKind;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reads service-model documents into a {@link ShapeModel}. YAML and JSON are both accepted (JSON
 * is read as YAML). The expected layout is a top-level {@code shapes} object:
 *
 * <pre>
 * shapes:
 *   DescribeOutput:
 *     type: structure
 *     resultWrapper: DescribeResult
 *     members:
 *       Items: { shape: ItemList }
 *       Etag: { shape: String, location: header, locationName: ETag }
 *   ItemList:
 *     type: list
 *     flattened: true
 *     member: { shape: String, locationName: item }
 *   String:
 *     type: string
 * </pre>
 *
 * <p>
 * A member reference ({@code members.*}, {@code member}, {@code key}, {@code value}) may overlay
 * {@code locationName}, {@code location} and {@code flattened} onto its target. Recursive shape
 * graphs cannot be represented as immutable trees and are rejected.
 *
 * <p>
 * Thread-safe: the YAML mapper is thread-safe and resolution state lives on the call stack.
 */
public final class ShapeModelParser {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Parses the model document at {@code path}.
     *
     * @throws ShapeDefinitionException if the file is unreadable or the shape graph is invalid
     */
    public ShapeModel parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new ShapeDefinitionException("Failed to read shape model: " + e.getMessage(), e, source);
        }
        return resolveAll(root, source);
    }

    /**
     * Parses a model document held in memory.
     *
     * @param content the YAML or JSON text
     * @param source  identifier used in error messages
     */
    public ShapeModel parse(String content, String source) {
        Objects.requireNonNull(content, "content must not be null");
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(content);
        } catch (IOException e) {
            throw new ShapeDefinitionException("Failed to read shape model: " + e.getMessage(), e, source);
        }
        return resolveAll(root, source);
    }

    private ShapeModel resolveAll(JsonNode root, String source) {
        if (root == null || !root.isObject() || !root.path("shapes").isObject()) {
            throw new ShapeDefinitionException("Shape model must contain a 'shapes' object", source);
        }
        Resolver resolver = new Resolver(root.get("shapes"), source);
        Map<String, Shape> shapes = new LinkedHashMap<>();
        Iterator<String> names = root.get("shapes").fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            shapes.put(name, resolver.resolve(name));
        }
        return new ShapeModel(source, shapes);
    }

    /** Per-document resolution state: memoized shapes and the current reference chain. */
    private static final class Resolver {

        private final JsonNode definitions;
        private final String source;
        private final Map<String, Shape> resolved = new LinkedHashMap<>();
        private final Deque<String> resolving = new ArrayDeque<>();

        Resolver(JsonNode definitions, String source) {
            this.definitions = definitions;
            this.source = source;
        }

        Shape resolve(String name) {
            Shape cached = resolved.get(name);
            if (cached != null) {
                return cached;
            }
            if (resolving.contains(name)) {
                throw new ShapeDefinitionException(
                        "Recursive shape reference: " + String.join(" -> ", resolving) + " -> " + name, source);
            }
            JsonNode definition = definitions.get(name);
            if (definition == null || !definition.isObject()) {
                throw new ShapeDefinitionException("Undefined shape '" + name + "'", source);
            }
            resolving.addLast(name);
            try {
                Shape shape = build(name, definition);
                resolved.put(name, shape);
                return shape;
            } finally {
                resolving.removeLast();
            }
        }

        private Shape build(String name, JsonNode definition) {
            String typeName = text(definition, "type");
            if (typeName == null) {
                throw new ShapeDefinitionException("Shape '" + name + "' has no 'type'", source);
            }
            ShapeKind kind;
            try {
                kind = ShapeKind.fromTypeName(typeName);
            } catch (IllegalArgumentException e) {
                throw new ShapeDefinitionException("Shape '" + name + "': " + e.getMessage(), e, source);
            }
            Serialization serialization = new Serialization(
                    text(definition, "locationName"),
                    null,
                    definition.path("flattened").asBoolean(false),
                    text(definition, "payload"),
                    text(definition, "resultWrapper"));

            return switch (kind) {
                case STRUCTURE -> {
                    Map<String, Shape> members = new LinkedHashMap<>();
                    JsonNode memberRefs = definition.path("members");
                    Iterator<Map.Entry<String, JsonNode>> fields = memberRefs.fields();
                    while (fields.hasNext()) {
                        Map.Entry<String, JsonNode> field = fields.next();
                        members.put(field.getKey(), reference(name + "." + field.getKey(), field.getValue()));
                    }
                    if (serialization.payload() != null && !members.containsKey(serialization.payload())) {
                        throw new ShapeDefinitionException(
                                "Shape '" + name + "' names payload '" + serialization.payload()
                                        + "' which is not a member",
                                source);
                    }
                    yield Shape.structure(members, serialization);
                }
                case LIST -> Shape.list(requireReference(name, definition, "member"), serialization);
                case MAP -> Shape.map(
                        requireReference(name, definition, "key"),
                        requireReference(name, definition, "value"),
                        serialization);
                default -> Shape.scalar(kind, serialization);
            };
        }

        private Shape requireReference(String owner, JsonNode definition, String field) {
            JsonNode ref = definition.get(field);
            if (ref == null) {
                throw new ShapeDefinitionException("Shape '" + owner + "' is missing '" + field + "'", source);
            }
            return reference(owner + "." + field, ref);
        }

        /** Resolves a member reference and overlays its serialization fields onto the target. */
        private Shape reference(String path, JsonNode ref) {
            String target = text(ref, "shape");
            if (target == null) {
                throw new ShapeDefinitionException("Member reference '" + path + "' has no 'shape'", source);
            }
            Shape shape = resolve(target);
            Serialization serialization = shape.serialization();
            String locationName = text(ref, "locationName");
            if (locationName != null) {
                serialization = serialization.withName(locationName);
            }
            String location = text(ref, "location");
            if (location != null) {
                try {
                    serialization = serialization.withLocation(Location.fromWireName(location));
                } catch (IllegalArgumentException e) {
                    throw new ShapeDefinitionException("Member '" + path + "': " + e.getMessage(), e, source);
                }
            }
            if (ref.has("flattened")) {
                serialization = serialization.withFlattened(ref.get("flattened").asBoolean());
            }
            return serialization.equals(shape.serialization()) ? shape : shape.withSerialization(serialization);
        }

        private static String text(JsonNode node, String field) {
            JsonNode value = node.get(field);
            return value != null && !value.isNull() ? value.asText() : null;
        }
    }
}
