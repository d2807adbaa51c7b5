package io.veraaws.json.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.veraaws.core.AwsException;
import io.veraaws.core.ValueTree;
import io.veraaws.server.spi.ServiceProtocol;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Conversions between Jackson trees and {@link ValueTree}.
 */
final class JacksonValueTrees {
    private JacksonValueTrees() {}

    static JsonNode toJson(ValueTree tree, ServiceProtocol protocol) {
        JsonNodeFactory f = JsonNodeFactory.instance;
        if (tree instanceof ValueTree.Mapping m) {
            ObjectNode obj = f.objectNode();
            for (Map.Entry<String, ValueTree> e : m.fields().entrySet()) {
                obj.set(protocol.memberName(e.getKey()), toJson(e.getValue(), protocol));
            }
            return obj;
        }
        if (tree instanceof ValueTree.Sequence s) {
            ArrayNode arr = f.arrayNode();
            for (ValueTree item : s.items()) arr.add(toJson(item, protocol));
            return arr;
        }
        Object v = ((ValueTree.Scalar) tree).value();
        if (v instanceof Boolean b) return f.booleanNode(b);
        if (v instanceof Integer i) return f.numberNode(i);
        if (v instanceof Long l) return f.numberNode(l);
        if (v instanceof Double d) return f.numberNode(d);
        if (v instanceof BigDecimal d) return f.numberNode(d);
        if (v instanceof BigInteger i) return f.numberNode(i);
        if (v instanceof Number n) return f.numberNode(n.doubleValue());
        return f.textNode(v.toString());
    }

    static ValueTree.Mapping toMapping(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new AwsException.MalformedParameter("SerializationException", "Request body must be a JSON object");
        }
        return (ValueTree.Mapping) fromJson(node);
    }

    /** JSON {@code null} members are dropped. */
    static ValueTree fromJson(JsonNode node) {
        if (node.isObject()) {
            ValueTree.Mapping.Builder b = ValueTree.Mapping.builder();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (e.getValue().isNull()) continue;
                b.put(e.getKey(), fromJson(e.getValue()));
            }
            return b.build();
        }
        if (node.isArray()) {
            List<ValueTree> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                if (!item.isNull()) items.add(fromJson(item));
            }
            return new ValueTree.Sequence(items);
        }
        if (node.isBoolean()) return ValueTree.of(node.booleanValue());
        if (node.isIntegralNumber()) return new ValueTree.Scalar(node.numberValue());
        if (node.isNumber()) return new ValueTree.Scalar(node.decimalValue());
        return ValueTree.of(node.asText());
    }
}
