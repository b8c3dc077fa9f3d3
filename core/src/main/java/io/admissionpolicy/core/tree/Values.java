package io.admissionpolicy.core.tree;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Conversions between Jackson trees and {@link Value} trees.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class Values {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private Values() {}

    /**
     * Converts a parsed Jackson node into a {@link Value}. Object field order is preserved.
     * Missing nodes and binary/POJO nodes are rejected.
     *
     * @param node the parsed node, must not be null
     * @return the equivalent value tree
     * @throws IllegalArgumentException if the node has no tree equivalent
     */
    public static Value fromJson(JsonNode node) {
        Objects.requireNonNull(node, "node must not be null");
        if (node.isObject()) {
            Map<String, Value> entries = new LinkedHashMap<>();
            for (Map.Entry<String, JsonNode> field : node.properties()) {
                entries.put(field.getKey(), fromJson(field.getValue()));
            }
            return new Value.MapValue(entries);
        }
        if (node.isArray()) {
            List<Value> elements = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                elements.add(fromJson(element));
            }
            return new Value.ArrayValue(elements);
        }
        if (node.isNull()) {
            return Value.nullValue();
        }
        if (node.isTextual()) {
            return Value.scalar(node.textValue());
        }
        if (node.isBoolean()) {
            return Value.scalar(node.booleanValue());
        }
        if (node.isNumber()) {
            return Value.scalar(node.numberValue());
        }
        throw new IllegalArgumentException("Unsupported document node type: " + node.getNodeType());
    }

    /** Converts a {@link Value} back into a Jackson node. */
    public static JsonNode toJson(Value value) {
        Objects.requireNonNull(value, "value must not be null");
        return value.match(
                map -> {
                    ObjectNode object = NODES.objectNode();
                    map.entries().forEach((key, child) -> object.set(key, toJson(child)));
                    return object;
                },
                array -> {
                    ArrayNode arrayNode = NODES.arrayNode();
                    array.elements().forEach(child -> arrayNode.add(toJson(child)));
                    return arrayNode;
                },
                Values::scalarToJson);
    }

    private static JsonNode scalarToJson(Value.ScalarValue scalar) {
        Object raw = scalar.raw();
        if (raw == null) {
            return NODES.nullNode();
        }
        if (raw instanceof String s) {
            return NODES.textNode(s);
        }
        if (raw instanceof Boolean b) {
            return NODES.booleanNode(b);
        }
        if (raw instanceof Integer i) {
            return NODES.numberNode(i);
        }
        if (raw instanceof Long l) {
            return NODES.numberNode(l);
        }
        if (raw instanceof BigInteger bi) {
            return NODES.numberNode(bi);
        }
        if (raw instanceof BigDecimal bd) {
            return NODES.numberNode(bd);
        }
        return NODES.numberNode(((Number) raw).doubleValue());
    }
}
