package ai.typerender.model;

import ai.typerender.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a graph document: {@code topLevels} maps labels to type nodes and
 * {@code types} holds named definitions that nodes point at with
 * {@code {"$ref": id}}. Every reference to one id yields the same instance.
 */
public class TypeGraphReader {

    public TypeGraph read(Path path) throws IOException {
        return read(JsonUtils.readTree(path));
    }

    public TypeGraph read(String content) {
        return read(JsonUtils.readTree(content));
    }

    public TypeGraph read(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Graph document must be a JSON object");
        }
        return new Resolution(root.path("types")).graph(root.path("topLevels"));
    }

    private static final class Resolution {
        private final JsonNode definitions;
        private final Map<String, NamedType> resolved = new HashMap<>();
        private final Set<String> inProgress = new HashSet<>();

        Resolution(JsonNode definitions) {
            this.definitions = definitions;
        }

        TypeGraph graph(JsonNode topLevelsNode) {
            if (!topLevelsNode.isObject() || topLevelsNode.isEmpty()) {
                throw new IllegalStateException("Graph document has no topLevels");
            }

            // Shells first so that classes can refer to each other in any order.
            List<String> classIds = new ArrayList<>();
            for (Iterator<Map.Entry<String, JsonNode>> it = definitions.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> entry = it.next();
                String kind = entry.getValue().path("kind").asText("");
                if (kind.equals("class")) {
                    resolved.put(entry.getKey(), new ClassType(nameOf(entry.getValue(), entry.getKey())));
                    classIds.add(entry.getKey());
                } else if (kind.equals("enum")) {
                    resolved.put(entry.getKey(), parseEnum(entry.getValue(), entry.getKey()));
                } else if (!kind.equals("union")) {
                    throw new IllegalStateException("Unknown kind '" + kind + "' for type " + entry.getKey());
                }
            }
            for (String id : classIds) {
                fillProperties((ClassType) resolved.get(id), definitions.get(id));
            }

            Map<String, Type> topLevels = new LinkedHashMap<>();
            for (Iterator<Map.Entry<String, JsonNode>> it = topLevelsNode.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> entry = it.next();
                topLevels.put(entry.getKey(), parseType(entry.getValue(), entry.getKey(), "top level " + entry.getKey()));
            }
            return new TypeGraph(topLevels);
        }

        private Type parseType(JsonNode node, String nameHint, String location) {
            if (node == null || node.isMissingNode() || node.isNull()) {
                throw new IllegalStateException("Missing type at " + location);
            }
            if (node.isTextual()) {
                PrimitiveType primitive = PrimitiveType.fromKindName(node.asText());
                if (primitive == null) {
                    throw new IllegalStateException("Unknown primitive '" + node.asText() + "' at " + location);
                }
                return primitive;
            }
            if (!node.isObject()) {
                throw new IllegalStateException("Unexpected type node " + node + " at " + location);
            }
            if (node.has("$ref")) {
                return resolveReference(node.get("$ref").asText(), location);
            }

            String kind = node.path("kind").asText("");
            return switch (kind) {
                case "array" -> new ArrayType(parseType(node.get("items"), nameHint, location + " items"));
                case "map" -> new MapType(parseType(node.get("values"), nameHint, location + " values"));
                case "class" -> {
                    ClassType classType = new ClassType(nameOf(node, nameHint));
                    fillProperties(classType, node);
                    yield classType;
                }
                case "enum" -> parseEnum(node, nameHint);
                case "union" -> parseUnion(node, nameHint, location);
                default -> throw new IllegalStateException("Unknown kind '" + kind + "' at " + location);
            };
        }

        private NamedType resolveReference(String id, String location) {
            NamedType named = resolved.get(id);
            if (named != null) {
                return named;
            }
            JsonNode definition = definitions.get(id);
            if (definition == null) {
                throw new IllegalStateException("Unknown reference '" + id + "' at " + location);
            }
            // Only unions are resolved lazily; classes and enums already have shells.
            if (!inProgress.add(id)) {
                throw new IllegalStateException("Union " + id + " contains itself");
            }
            UnionType union = parseUnion(definition, id, "union " + id);
            inProgress.remove(id);
            resolved.put(id, union);
            return union;
        }

        private void fillProperties(ClassType classType, JsonNode node) {
            JsonNode properties = node.path("properties");
            for (Iterator<Map.Entry<String, JsonNode>> it = properties.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> entry = it.next();
                String location = "class " + classType.name() + ", property " + entry.getKey();
                JsonNode propertyNode = entry.getValue();
                Type type = parseType(propertyNode.get("type"), entry.getKey(), location);
                boolean optional = propertyNode.path("optional").asBoolean(false);
                classType.putProperty(entry.getKey(), new ClassProperty(type, optional));
            }
        }

        private EnumType parseEnum(JsonNode node, String nameHint) {
            List<String> cases = new ArrayList<>();
            for (JsonNode label : node.path("cases")) {
                cases.add(label.asText());
            }
            return new EnumType(nameOf(node, nameHint), cases);
        }

        private UnionType parseUnion(JsonNode node, String nameHint, String location) {
            List<Type> members = new ArrayList<>();
            int index = 0;
            for (JsonNode member : node.path("members")) {
                members.add(parseType(member, nameHint, location + " member " + index++));
            }
            String name = node.path("name").asText(null);
            try {
                return new UnionType(name != null ? name : nameHint, members);
            } catch (IllegalArgumentException ex) {
                throw new IllegalStateException("Invalid union at " + location, ex);
            }
        }

        private static String nameOf(JsonNode node, String fallback) {
            String name = node.path("name").asText(null);
            return name == null || name.isBlank() ? fallback : name;
        }
    }
}
