package im.arun.hoteltree.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Map;

/**
 * Maps plain JSON to Firestore's typed value representation and back.
 * <p>
 * {@code {"price": 12}} becomes {@code {"price": {"integerValue": "12"}}}, objects become
 * {@code mapValue}, arrays {@code arrayValue}.
 */
public class FirestoreValueCodec {
    private static final Logger logger = LoggerFactory.getLogger(FirestoreValueCodec.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public ObjectNode encodeFields(ObjectNode json) {
        ObjectNode fields = NODES.objectNode();
        Iterator<Map.Entry<String, JsonNode>> it = json.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            fields.set(field.getKey(), encodeValue(field.getValue()));
        }
        return fields;
    }

    public ObjectNode encodeValue(JsonNode value) {
        ObjectNode typed = NODES.objectNode();
        if (value == null || value.isNull() || value.isMissingNode()) {
            typed.putNull("nullValue");
        } else if (value.isTextual()) {
            typed.put("stringValue", value.asText());
        } else if (value.isBoolean()) {
            typed.put("booleanValue", value.booleanValue());
        } else if (value.isIntegralNumber()) {
            typed.put("integerValue", value.asText());
        } else if (value.isNumber()) {
            typed.put("doubleValue", value.doubleValue());
        } else if (value.isArray()) {
            ObjectNode array = typed.putObject("arrayValue");
            if (!value.isEmpty()) {
                ArrayNode values = array.putArray("values");
                value.forEach(element -> values.add(encodeValue(element)));
            }
        } else if (value.isObject()) {
            typed.putObject("mapValue").set("fields", encodeFields((ObjectNode) value));
        } else {
            typed.put("stringValue", value.asText());
        }
        return typed;
    }

    public ObjectNode decodeFields(JsonNode fields) {
        ObjectNode json = NODES.objectNode();
        if (fields == null || !fields.isObject()) {
            return json;
        }
        Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            json.set(field.getKey(), decodeValue(field.getValue()));
        }
        return json;
    }

    public JsonNode decodeValue(JsonNode typed) {
        if (typed.has("stringValue")) {
            return NODES.textNode(typed.get("stringValue").asText());
        }
        if (typed.has("integerValue")) {
            long number = Long.parseLong(typed.get("integerValue").asText());
            if (number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE) {
                return NODES.numberNode((int) number);
            }
            return NODES.numberNode(number);
        }
        if (typed.has("doubleValue")) {
            return NODES.numberNode(typed.get("doubleValue").asDouble());
        }
        if (typed.has("booleanValue")) {
            return NODES.booleanNode(typed.get("booleanValue").asBoolean());
        }
        if (typed.has("nullValue")) {
            return NODES.nullNode();
        }
        if (typed.has("arrayValue")) {
            ArrayNode array = NODES.arrayNode();
            typed.get("arrayValue").path("values").forEach(element -> array.add(decodeValue(element)));
            return array;
        }
        if (typed.has("mapValue")) {
            return decodeFields(typed.get("mapValue").path("fields"));
        }
        if (typed.has("timestampValue")) {
            return NODES.textNode(typed.get("timestampValue").asText());
        }
        if (typed.has("referenceValue")) {
            return NODES.textNode(typed.get("referenceValue").asText());
        }
        logger.warn("Unsupported Firestore value, keeping it as-is: {}", typed);
        return typed.deepCopy();
    }
}
