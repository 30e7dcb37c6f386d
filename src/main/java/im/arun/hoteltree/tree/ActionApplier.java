package im.arun.hoteltree.tree;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import im.arun.hoteltree.json.NodeCodec;
import im.arun.hoteltree.model.ApplyOutcome;
import im.arun.hoteltree.model.Attribute;
import im.arun.hoteltree.model.ContentNode;
import im.arun.hoteltree.model.NodePatch;
import im.arun.hoteltree.model.StructuralAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Applies AI-proposed structural actions through {@link TreeStore}, one at a time and in order.
 * An action that cannot be applied is recorded and skipped; the rest of the batch still runs.
 */
public class ActionApplier {
    private static final Logger logger = LoggerFactory.getLogger(ActionApplier.class);
    /** Key-value map the architect uses for properties such as price or opening hours. */
    static final String FEATURES = "features";

    private final NodeCodec codec;

    public ActionApplier(NodeCodec codec) {
        this.codec = codec;
    }

    public ApplyOutcome apply(ContentNode root, List<StructuralAction> actions) {
        ContentNode tree = root;
        int applied = 0;
        List<String> failures = new ArrayList<>();

        for (int i = 0; i < actions.size(); i++) {
            StructuralAction action = actions.get(i);
            try {
                tree = applyOne(tree, action);
                applied++;
            } catch (RuntimeException e) {
                String message = String.format("Action %d (%s %s) skipped: %s", i + 1,
                        action.getType(), action.getTargetId(), e.getMessage());
                logger.warn(message);
                failures.add(message);
            }
        }
        return new ApplyOutcome(tree, applied, failures);
    }

    private ContentNode applyOne(ContentNode tree, StructuralAction action) {
        String type = action.getType() == null ? "" : action.getType().toLowerCase(Locale.ROOT);
        String targetId = resolveTarget(tree, action.getTargetId());

        switch (type) {
            case StructuralAction.ADD:
                return add(tree, targetId, requireObject(action));
            case StructuralAction.UPDATE:
                return update(tree, targetId, requireObject(action));
            case StructuralAction.DELETE:
                if (targetId.equals(tree.getId())) {
                    throw new IllegalArgumentException("the root cannot be deleted");
                }
                requireNode(tree, targetId);
                return TreeStore.deleteNode(tree, targetId);
            default:
                throw new IllegalArgumentException("unknown action type '" + action.getType() + "'");
        }
    }

    private ContentNode add(ContentNode tree, String parentId, ObjectNode data) {
        requireNode(tree, parentId);
        ObjectNode json = data.deepCopy();
        List<Attribute> features = featuresToAttributes(json.remove(FEATURES), List.of());

        ContentNode node = codec.decode(json);
        ContentNode.ContentNodeBuilder builder = node.toBuilder();
        if (node.getKind() == null) {
            builder.kind("item");
        }
        if (!features.isEmpty()) {
            builder.attributes(features);
        }
        Set<String> taken = new HashSet<>();
        collectIds(tree, taken);
        ContentNode fresh = withUniqueIds(builder.build(), taken);
        return TreeStore.insertChild(tree, parentId, fresh);
    }

    private ContentNode update(ContentNode tree, String id, ObjectNode data) {
        ContentNode existing = requireNode(tree, id);
        ObjectNode json = data.deepCopy();
        if (json.has(NodeCodec.ID) && id.equals(json.get(NodeCodec.ID).asText())) {
            json.remove(NodeCodec.ID);
        }
        json.remove(NodeCodec.CHILDREN);
        JsonNode features = json.remove(FEATURES);

        NodePatch patch = codec.decodePatch(json);
        if (features != null) {
            List<Attribute> base = patch.getAttributes() != null ? patch.getAttributes() : existing.getAttributes();
            patch = patch.toBuilder().attributes(featuresToAttributes(features, base)).build();
        }
        if (patch.touchesId()) {
            throw new IllegalArgumentException("changing a node id is not allowed");
        }
        return TreeStore.updateNode(tree, id, patch);
    }

    /**
     * Merges a {@code features} map into attributes: existing keys get the new value, new keys are
     * appended.
     */
    private List<Attribute> featuresToAttributes(JsonNode features, List<Attribute> existing) {
        List<Attribute> merged = new ArrayList<>(existing);
        if (features == null || !features.isObject()) {
            return merged;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = features.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> feature = fields.next();
            String value = feature.getValue().asText();
            boolean replaced = false;
            for (int i = 0; i < merged.size(); i++) {
                if (feature.getKey().equalsIgnoreCase(merged.get(i).getKey())) {
                    merged.set(i, merged.get(i).toBuilder().value(value).build());
                    replaced = true;
                    break;
                }
            }
            if (!replaced) {
                merged.add(Attribute.builder()
                        .id(IdGenerator.generate("attr"))
                        .key(feature.getKey())
                        .value(value)
                        .kind("text")
                        .build());
            }
        }
        return merged;
    }

    private ContentNode withUniqueIds(ContentNode node, Set<String> taken) {
        String id = node.getId();
        if (id == null || id.isBlank() || taken.contains(id)) {
            id = IdGenerator.generate("ai");
        }
        taken.add(id);
        List<ContentNode> children = new ArrayList<>();
        for (ContentNode child : node.getChildren()) {
            children.add(withUniqueIds(child, taken));
        }
        return node.toBuilder().id(id).clearChildren().children(children).build();
    }

    private static void collectIds(ContentNode node, Set<String> ids) {
        ids.add(node.getId());
        node.getChildren().forEach(child -> collectIds(child, ids));
    }

    private static String resolveTarget(ContentNode tree, String targetId) {
        if (targetId == null || targetId.isBlank()) {
            throw new IllegalArgumentException("missing targetId");
        }
        // the architect refers to the root as "root" whatever its stored id
        if ("root".equals(targetId) && !TreeStore.containsId(tree, targetId)) {
            return tree.getId();
        }
        return targetId;
    }

    private static ContentNode requireNode(ContentNode tree, String id) {
        Optional<ContentNode> node = TreeStore.findNode(tree, id);
        if (node.isEmpty()) {
            throw new IllegalArgumentException("node '" + id + "' not found");
        }
        return node.get();
    }

    private static ObjectNode requireObject(StructuralAction action) {
        if (action.getData() == null || !action.getData().isObject()) {
            throw new IllegalArgumentException("action has no data object");
        }
        return (ObjectNode) action.getData();
    }
}
