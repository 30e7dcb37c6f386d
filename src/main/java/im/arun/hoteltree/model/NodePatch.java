package im.arun.hoteltree.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Partial update for a single node. Null fields are left untouched; {@code extensions} entries are
 * merged key by key into the target's extensions.
 * <p>
 * {@code id} exists only so that patches decoded from untrusted input can be recognised and
 * rejected; a patch that sets it is never applied.
 */
@Value
@Builder(toBuilder = true)
public class NodePatch {

    String id;

    String kind;

    String name;

    String value;

    String description;

    List<Attribute> attributes;

    NodePayload payload;

    Map<String, JsonNode> extensions;

    public static NodePatch value(String value) {
        return NodePatch.builder().value(value).build();
    }

    public static NodePatch name(String name) {
        return NodePatch.builder().name(name).build();
    }

    public boolean touchesId() {
        return id != null;
    }

    public boolean isEmpty() {
        return id == null && kind == null && name == null && value == null && description == null
                && attributes == null && payload == null && (extensions == null || extensions.isEmpty());
    }
}
