package im.arun.hoteltree.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;

/**
 * Strips absent values before a payload is handed to the remote store, which rejects them.
 * Works depth-first through objects and arrays and never modifies its input.
 */
public final class JsonSanitizer {

    private JsonSanitizer() {}

    public static ObjectNode sanitize(ObjectNode json) {
        return (ObjectNode) sanitizeNode(json);
    }

    public static JsonNode sanitizeNode(JsonNode json) {
        if (json.isObject()) {
            ObjectNode clean = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!isAbsent(field.getValue())) {
                    clean.set(field.getKey(), sanitizeNode(field.getValue()));
                }
            }
            return clean;
        }
        if (json.isArray()) {
            ArrayNode clean = JsonNodeFactory.instance.arrayNode();
            for (JsonNode element : json) {
                if (!isAbsent(element)) {
                    clean.add(sanitizeNode(element));
                }
            }
            return clean;
        }
        return json.deepCopy();
    }

    static boolean isAbsent(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode();
    }
}
