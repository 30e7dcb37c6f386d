package im.arun.hoteltree.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One element of the hotel knowledge tree.
 * <p>
 * Instances are immutable: lists and maps are unmodifiable copies and every edit goes through
 * {@code toBuilder()}. {@code children} and {@code attributes} are never null; an empty
 * {@code children} list marks a leaf.
 * <p>
 * {@code extensions} carries top-level fields this model does not know about (legacy keys such as
 * {@code price} or {@code tags}). Their values are treated as read-only and are carried unchanged
 * through every tree operation.
 */
@Value
@Builder(toBuilder = true)
public class ContentNode {

    String id;

    /** Open type tag such as {@code category}, {@code field} or {@code menu_item}. */
    String kind;

    String name;

    String value;

    String description;

    @Singular
    List<Attribute> attributes;

    @Singular
    List<ContentNode> children;

    NodePayload payload;

    @Singular
    Map<String, JsonNode> extensions;

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public ContentNode withChildren(List<ContentNode> newChildren) {
        return toBuilder().clearChildren().children(newChildren).build();
    }

    public ContentNode withId(String newId) {
        return toBuilder().id(newId).build();
    }

    /**
     * Returns the extension value stored under {@code key} as text, or null when it is absent or
     * not a scalar.
     */
    public String extensionText(String key) {
        JsonNode node = extensions.get(key);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }
}
