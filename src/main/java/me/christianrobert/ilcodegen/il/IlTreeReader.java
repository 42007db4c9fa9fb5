package me.christianrobert.ilcodegen.il;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses an IL JSON document into an immutable {@link IlNode} tree.
 *
 * <p>The document is validated once, here: every node must be a JSON object with a string
 * {@code kind}, and every declared field must have the shape its {@link IlKind} schema
 * declares. Absent fields stay absent (accessors return defaults), undeclared fields are
 * ignored, and unrecognized kinds become {@link IlKind#UNKNOWN} nodes.</p>
 */
@ApplicationScoped
public class IlTreeReader {

    private static final Logger log = LoggerFactory.getLogger(IlTreeReader.class);

    public static final String KIND_FIELD = "kind";

    /**
     * Parses a JSON document.
     *
     * @param json IL document text
     * @return root node
     * @throws IlFormatException if the text is not JSON or not a well-formed IL tree
     */
    public IlNode read(String json) {
        if (json == null || json.trim().isEmpty()) {
            throw new IlFormatException("IL document cannot be null or empty", "$");
        }

        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new IlFormatException("IL document is not valid JSON: " + e.getMessage(), "$", e);
        }

        IlNode node = readTree(root);
        log.debug("Read IL tree with root kind {}", node.getRawKind());
        return node;
    }

    /**
     * Converts an already parsed JSON element.
     */
    public IlNode readTree(JsonElement root) {
        if (root == null || !root.isJsonObject()) {
            throw new IlFormatException("IL root must be a JSON object", "$");
        }
        return readNode(root.getAsJsonObject(), "$");
    }

    private IlNode readNode(JsonObject object, String path) {
        JsonElement kindElement = object.get(KIND_FIELD);
        if (kindElement == null || !kindElement.isJsonPrimitive() || !kindElement.getAsJsonPrimitive().isString()) {
            throw new IlFormatException("IL node has no string '" + KIND_FIELD + "' property", path);
        }

        String rawKind = kindElement.getAsString();
        IlKind kind = IlKind.fromWireName(rawKind);
        IlNode.Builder builder = kind == IlKind.UNKNOWN ? IlNode.unknown(rawKind) : IlNode.builder(kind);

        for (Map.Entry<String, IlFieldSpec> entry : kind.getFields().entrySet()) {
            String fieldName = entry.getKey();
            if (!object.has(fieldName)) {
                continue;
            }
            readField(builder, entry.getValue(), object.get(fieldName), path + "." + fieldName);
        }

        builder.resultType(optionalText(object, "resultType", path));
        builder.description(optionalText(object, "description", path));
        builder.location(readLocation(object.get("loc")));
        return builder.build();
    }

    private void readField(IlNode.Builder builder, IlFieldSpec spec, JsonElement element, String path) {
        String name = spec.getName();
        if (element == null || element.isJsonNull()) {
            if (spec.getShape() == IlFieldSpec.Shape.VALUE) {
                builder.value(name, null);
            }
            return;
        }

        switch (spec.getShape()) {
            case NODE -> {
                if (!element.isJsonObject()) {
                    throw new IlFormatException("Field '" + name + "' must be a node object", path);
                }
                builder.node(name, readNode(element.getAsJsonObject(), path));
            }
            case NODES -> {
                if (!element.isJsonArray()) {
                    throw new IlFormatException("Field '" + name + "' must be an array of nodes", path);
                }
                builder.nodes(name, readNodeList(element.getAsJsonArray(), path));
            }
            case TEXT -> {
                if (!element.isJsonPrimitive()) {
                    throw new IlFormatException("Field '" + name + "' must be a string", path);
                }
                builder.text(name, element.getAsString());
            }
            case NUMBER -> builder.number(name, readNumber(element, name, path));
            case FLAG -> {
                if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isBoolean()) {
                    throw new IlFormatException("Field '" + name + "' must be a boolean", path);
                }
                builder.flag(name, element.getAsBoolean());
            }
            case VALUE -> {
                if (!element.isJsonPrimitive()) {
                    throw new IlFormatException("Field '" + name + "' must be a scalar literal value", path);
                }
                builder.value(name, readScalar(element.getAsJsonPrimitive()));
            }
        }
    }

    private List<IlNode> readNodeList(JsonArray array, String path) {
        List<IlNode> result = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            JsonElement item = array.get(i);
            String itemPath = path + "[" + i + "]";
            if (item == null || item.isJsonNull()) {
                // array holes ([, x]) carry no node
                continue;
            }
            if (!item.isJsonObject()) {
                throw new IlFormatException("Node list element must be a node object", itemPath);
            }
            result.add(readNode(item.getAsJsonObject(), itemPath));
        }
        return result;
    }

    private long readNumber(JsonElement element, String name, String path) {
        if (element.isJsonPrimitive()) {
            JsonPrimitive primitive = element.getAsJsonPrimitive();
            try {
                if (primitive.isNumber()) {
                    return primitive.getAsBigDecimal().longValueExact();
                }
                if (primitive.isString()) {
                    return Long.parseLong(primitive.getAsString().trim());
                }
            } catch (ArithmeticException | NumberFormatException e) {
                throw new IlFormatException("Field '" + name + "' must be an integer", path, e);
            }
        }
        throw new IlFormatException("Field '" + name + "' must be an integer", path);
    }

    private Object readScalar(JsonPrimitive primitive) {
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        if (primitive.isNumber()) {
            return primitive.getAsBigDecimal();
        }
        return primitive.getAsString();
    }

    private String optionalText(JsonObject object, String field, String path) {
        JsonElement element = object.get(field);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (!element.isJsonPrimitive()) {
            throw new IlFormatException("Field '" + field + "' must be a string", path + "." + field);
        }
        return element.getAsString();
    }

    private SourceLocation readLocation(JsonElement element) {
        // Locations are diagnostic only; a malformed one is dropped rather than rejected
        if (element == null || !element.isJsonObject()) {
            return null;
        }
        JsonObject loc = element.getAsJsonObject();
        if (loc.has("start") && loc.get("start").isJsonObject()) {
            loc = loc.getAsJsonObject("start");
        }
        int line = intOrDefault(loc.get("line"));
        int column = intOrDefault(loc.get("column"));
        if (line < 0) {
            return null;
        }
        return new SourceLocation(line, Math.max(column, 0));
    }

    private int intOrDefault(JsonElement element) {
        if (element != null && element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber()) {
            BigDecimal value = element.getAsBigDecimal();
            return value.intValue();
        }
        return -1;
    }
}
