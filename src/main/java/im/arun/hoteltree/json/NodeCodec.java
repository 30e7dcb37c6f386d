package im.arun.hoteltree.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import im.arun.hoteltree.model.Attribute;
import im.arun.hoteltree.model.ContentNode;
import im.arun.hoteltree.model.HotelTemplate;
import im.arun.hoteltree.model.NodePatch;
import im.arun.hoteltree.model.NodePayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts between {@link ContentNode} trees and their JSON form.
 * <p>
 * The JSON layout is the one stored documents already use: the node kind lives under {@code type},
 * children under {@code children}, and every key this model does not know is kept verbatim as an
 * extension. A known key whose value has an unexpected shape (e.g. a localized {@code name} object)
 * is kept as an extension too, so decode followed by encode reproduces the input.
 */
public class NodeCodec {
    private static final Logger logger = LoggerFactory.getLogger(NodeCodec.class);

    public static final String ID = "id";
    public static final String KIND = "type";
    public static final String NAME = "name";
    public static final String VALUE = "value";
    public static final String DESCRIPTION = "description";
    public static final String ATTRIBUTES = "attributes";
    public static final String CHILDREN = "children";
    public static final String PAYLOAD = "payload";
    public static final String CREATED_AT = "createdAt";
    public static final String DATA = "data";

    private static final Set<String> TEXT_FIELDS = Set.of(ID, KIND, NAME, VALUE, DESCRIPTION);

    private final ObjectMapper objectMapper;

    public NodeCodec() {
        this(new ObjectMapper());
    }

    public NodeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    // --- encoding ---

    /**
     * Encodes the node with its whole subtree.
     */
    public ObjectNode encode(ContentNode node) {
        ObjectNode json = encodeScalars(node);
        ArrayNode children = json.putArray(CHILDREN);
        for (ContentNode child : node.getChildren()) {
            children.add(encode(child));
        }
        return json;
    }

    /**
     * Encodes the node's own fields, leaving out {@code children}.
     */
    public ObjectNode encodeScalars(ContentNode node) {
        ObjectNode json = objectMapper.createObjectNode();
        putText(json, ID, node.getId());
        putText(json, KIND, node.getKind());
        putText(json, NAME, node.getName());
        putText(json, VALUE, node.getValue());
        putText(json, DESCRIPTION, node.getDescription());

        if (!node.getAttributes().isEmpty()) {
            ArrayNode attributes = json.putArray(ATTRIBUTES);
            for (Attribute attribute : node.getAttributes()) {
                attributes.add(objectMapper.<JsonNode>valueToTree(attribute));
            }
        }
        if (node.getPayload() != null) {
            ObjectNode payload = objectMapper.valueToTree(node.getPayload());
            payload.put("schemaType", node.getPayload().schemaType());
            json.set(PAYLOAD, payload);
        }
        node.getExtensions().forEach((key, value) -> {
            if (!json.has(key) && !CHILDREN.equals(key)) {
                json.set(key, value.deepCopy());
            }
        });
        return json;
    }

    /**
     * Encodes a template as {@code id}, {@code name}, {@code description}, {@code createdAt} and the
     * node tree under {@code data}.
     */
    public ObjectNode encodeTemplate(HotelTemplate template) {
        ObjectNode json = objectMapper.createObjectNode();
        putText(json, ID, template.getId());
        putText(json, NAME, template.getName());
        putText(json, DESCRIPTION, template.getDescription());
        json.put(CREATED_AT, template.getCreatedAt());
        json.set(DATA, encode(template.getData()));
        return json;
    }

    public String toJson(ContentNode node) throws JsonProcessingException {
        return objectMapper.writeValueAsString(encode(node));
    }

    // --- decoding ---

    public ContentNode fromJson(String json) throws JsonProcessingException {
        return decode(objectMapper.readTree(json));
    }

    /**
     * Decodes a node and its subtree. Absent {@code children} and an empty array both produce a leaf.
     *
     * @throws IllegalArgumentException if {@code json} is not an object
     */
    public ContentNode decode(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException("Expected a JSON object for a content node, got: "
                    + (json == null ? "null" : json.getNodeType()));
        }

        ContentNode.ContentNodeBuilder builder = ContentNode.builder();
        Map<String, JsonNode> extensions = new LinkedHashMap<>();

        Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();

            if (value.isNull() && (TEXT_FIELDS.contains(key) || CHILDREN.equals(key))) {
                continue;
            }
            if (TEXT_FIELDS.contains(key) && (value.isTextual() || value.isNumber())) {
                applyText(builder, key, value.asText());
            } else if (ATTRIBUTES.equals(key) && value.isArray()) {
                builder.attributes(decodeAttributes(value));
            } else if (CHILDREN.equals(key) && value.isArray()) {
                builder.children(decodeChildren(value));
            } else if (PAYLOAD.equals(key) && value.isObject()) {
                NodePayload payload = decodePayload(value);
                if (payload != null) {
                    builder.payload(payload);
                } else {
                    extensions.put(key, value.deepCopy());
                }
            } else {
                extensions.put(key, value.deepCopy());
            }
        }
        return builder.extensions(extensions).build();
    }

    /**
     * Decodes a partial node (as sent by the AI architect) into a patch. An {@code id} key is carried
     * into the patch so that the tree store can refuse it.
     */
    public NodePatch decodePatch(JsonNode json) {
        ContentNode partial = decode(json);
        return NodePatch.builder()
                .id(partial.getId())
                .kind(partial.getKind())
                .name(partial.getName())
                .value(partial.getValue())
                .description(partial.getDescription())
                .attributes(json.has(ATTRIBUTES) ? partial.getAttributes() : null)
                .payload(partial.getPayload())
                .extensions(partial.getExtensions().isEmpty() ? null : partial.getExtensions())
                .build();
    }

    /**
     * Decodes a stored template: {@code id}, {@code name}, {@code description}, {@code createdAt}
     * and the node tree under {@code data}.
     */
    public HotelTemplate decodeTemplate(JsonNode json) {
        if (json == null || !json.path(DATA).isObject()) {
            throw new IllegalArgumentException("Template has no data tree");
        }
        return HotelTemplate.builder()
                .id(json.path(ID).asText(null))
                .name(json.path(NAME).asText(null))
                .description(json.path(DESCRIPTION).asText(null))
                .createdAt(json.path(CREATED_AT).asLong())
                .data(decode(json.get(DATA)))
                .build();
    }

    private List<Attribute> decodeAttributes(JsonNode array) {
        List<Attribute> attributes = new ArrayList<>();
        for (JsonNode element : array) {
            if (!element.isObject()) {
                logger.warn("Skipping attribute that is not an object: {}", element);
                continue;
            }
            attributes.add(objectMapper.convertValue(element, Attribute.class));
        }
        return attributes;
    }

    private List<ContentNode> decodeChildren(JsonNode array) {
        List<ContentNode> children = new ArrayList<>();
        for (JsonNode element : array) {
            if (!element.isObject()) {
                logger.warn("Skipping child that is not an object: {}", element);
                continue;
            }
            children.add(decode(element));
        }
        return children;
    }

    private NodePayload decodePayload(JsonNode json) {
        try {
            return objectMapper.convertValue(json, NodePayload.class);
        } catch (IllegalArgumentException e) {
            logger.warn("Keeping unrecognised payload as raw extension: {}", e.getMessage());
            return null;
        }
    }

    private static void applyText(ContentNode.ContentNodeBuilder builder, String key, String text) {
        switch (key) {
            case ID:
                builder.id(text);
                break;
            case KIND:
                builder.kind(text);
                break;
            case NAME:
                builder.name(text);
                break;
            case VALUE:
                builder.value(text);
                break;
            case DESCRIPTION:
                builder.description(text);
                break;
            default:
                throw new IllegalStateException("Not a text field: " + key);
        }
    }

    private static void putText(ObjectNode json, String key, String value) {
        if (value != null) {
            json.put(key, value);
        }
    }
}
