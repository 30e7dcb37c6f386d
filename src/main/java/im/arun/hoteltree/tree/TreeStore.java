package im.arun.hoteltree.tree;

import com.fasterxml.jackson.databind.JsonNode;
import im.arun.hoteltree.model.Attribute;
import im.arun.hoteltree.model.ContentNode;
import im.arun.hoteltree.model.DiningPayload;
import im.arun.hoteltree.model.MovePosition;
import im.arun.hoteltree.model.NodePatch;
import im.arun.hoteltree.model.NodePayload;
import im.arun.hoteltree.model.ScheduledEventPayload;
import im.arun.hoteltree.model.TreeStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Pure operations over a {@link ContentNode} tree.
 * <p>
 * Every operation returns a new root and leaves its input untouched. Only nodes on the path to the
 * edit are rebuilt, untouched subtrees are shared. When an operation has nothing to do (unknown id,
 * protected root, cyclic move...) the very same root instance is returned, so callers detect a change
 * with {@code before != after}.
 */
public class TreeStore {
    private static final Logger logger = LoggerFactory.getLogger(TreeStore.class);

    /** Kinds that group other nodes rather than hold a value themselves. */
    public static final Set<String> CONTAINER_KINDS = Set.of("root", "category", "menu", "list");

    /** Legacy extension keys that hold content rather than structure. */
    static final Set<String> VALUE_EXTENSIONS = Set.of("price", "startTime", "endTime", "answer", "calories");

    // --- lookups ---

    public static Optional<ContentNode> findNode(ContentNode root, String id) {
        if (root == null || id == null) {
            return Optional.empty();
        }
        if (id.equals(root.getId())) {
            return Optional.of(root);
        }
        for (ContentNode child : root.getChildren()) {
            Optional<ContentNode> found = findNode(child, id);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * Nodes from the root down to the node with the given id, both included. Empty when the id is
     * not in the tree.
     */
    public static List<ContentNode> findPath(ContentNode root, String id) {
        List<ContentNode> path = new ArrayList<>();
        if (root != null && id != null && collectPath(root, id, path)) {
            Collections.reverse(path);
            return path;
        }
        return List.of();
    }

    private static boolean collectPath(ContentNode node, String id, List<ContentNode> path) {
        if (id.equals(node.getId())) {
            path.add(node);
            return true;
        }
        for (ContentNode child : node.getChildren()) {
            if (collectPath(child, id, path)) {
                path.add(node);
                return true;
            }
        }
        return false;
    }

    public static Optional<ContentNode> findParent(ContentNode root, String id) {
        List<ContentNode> path = findPath(root, id);
        return path.size() < 2 ? Optional.empty() : Optional.of(path.get(path.size() - 2));
    }

    public static boolean containsId(ContentNode root, String id) {
        return findNode(root, id).isPresent();
    }

    // --- structural edits ---

    /**
     * Appends {@code node} as the last child of {@code parentId}. Ids are not deduplicated; the caller
     * hands in a node with fresh ids.
     */
    public static ContentNode insertChild(ContentNode root, String parentId, ContentNode node) {
        if (node == null) {
            return root;
        }
        return replaceNode(root, parentId, parent -> parent.toBuilder().child(node).build());
    }

    /**
     * Shallow-merges the non-null fields of {@code patch} into the node. Children are never touched
     * and a patch that sets {@code id} is refused.
     */
    public static ContentNode updateNode(ContentNode root, String id, NodePatch patch) {
        if (patch == null || patch.isEmpty()) {
            return root;
        }
        if (patch.touchesId()) {
            logger.debug("Refusing patch for {} that rewrites its id", id);
            return root;
        }
        return replaceNode(root, id, node -> applyPatch(node, patch));
    }

    static ContentNode applyPatch(ContentNode node, NodePatch patch) {
        ContentNode.ContentNodeBuilder builder = node.toBuilder();
        if (patch.getKind() != null) {
            builder.kind(patch.getKind());
        }
        if (patch.getName() != null) {
            builder.name(patch.getName());
        }
        if (patch.getValue() != null) {
            builder.value(patch.getValue());
        }
        if (patch.getDescription() != null) {
            builder.description(patch.getDescription());
        }
        if (patch.getAttributes() != null) {
            builder.clearAttributes().attributes(patch.getAttributes());
        }
        if (patch.getPayload() != null) {
            builder.payload(patch.getPayload());
        }
        if (patch.getExtensions() != null && !patch.getExtensions().isEmpty()) {
            Map<String, JsonNode> merged = new LinkedHashMap<>(node.getExtensions());
            patch.getExtensions().forEach((key, value) -> {
                // an explicit null removes the key
                if (value == null || value.isNull()) {
                    merged.remove(key);
                } else {
                    merged.put(key, value);
                }
            });
            builder.clearExtensions().extensions(merged);
        }
        return builder.build();
    }

    /**
     * Assigns a new id to a non-root node. Refused for the root, for blank ids and for ids already
     * present in the tree.
     */
    public static ContentNode changeNodeId(ContentNode root, String oldId, String newId) {
        if (newId == null || newId.isBlank() || newId.equals(oldId)) {
            return root;
        }
        if (root.getId() != null && root.getId().equals(oldId)) {
            return root;
        }
        if (containsId(root, newId)) {
            logger.debug("Id {} already exists, not renaming {}", newId, oldId);
            return root;
        }
        return replaceNode(root, oldId, node -> node.withId(newId));
    }

    /**
     * Removes the node and its whole subtree. The root cannot be deleted.
     */
    public static ContentNode deleteNode(ContentNode root, String id) {
        if (id == null || id.equals(root.getId())) {
            return root;
        }
        return removeNode(root, id);
    }

    /**
     * Moves the subtree rooted at {@code sourceId} next to or into {@code targetId}.
     * <p>
     * Refused (input returned) when the source is the root, either id is unknown, source and target
     * coincide, the target lies inside the source subtree, or a sibling placement is requested
     * relative to the root.
     */
    public static ContentNode moveNode(ContentNode root, String sourceId, String targetId, MovePosition position) {
        if (sourceId == null || targetId == null || position == null) {
            return root;
        }
        if (sourceId.equals(root.getId()) || sourceId.equals(targetId)) {
            return root;
        }
        if (position != MovePosition.INSIDE && targetId.equals(root.getId())) {
            return root;
        }
        Optional<ContentNode> source = findNode(root, sourceId);
        if (source.isEmpty() || !containsId(root, targetId)) {
            return root;
        }
        if (containsId(source.get(), targetId)) {
            logger.debug("Refusing to move {} into its own descendant {}", sourceId, targetId);
            return root;
        }

        ContentNode detached = removeNode(root, sourceId);
        if (position == MovePosition.INSIDE) {
            return insertChild(detached, targetId, source.get());
        }

        String parentId = findParent(detached, targetId).map(ContentNode::getId).orElse(null);
        return replaceNode(detached, parentId, parent -> {
            List<ContentNode> siblings = new ArrayList<>(parent.getChildren());
            int targetIndex = indexOf(siblings, targetId);
            siblings.add(position == MovePosition.BEFORE ? targetIndex : targetIndex + 1, source.get());
            return parent.withChildren(siblings);
        });
    }

    // --- whole-subtree transforms ---

    /**
     * Replaces every node and attribute id in the subtree with a freshly generated one.
     */
    public static ContentNode regenerateIds(ContentNode subtree) {
        List<Attribute> attributes = new ArrayList<>();
        for (Attribute attribute : subtree.getAttributes()) {
            attributes.add(attribute.toBuilder().id(IdGenerator.generate("attr")).build());
        }
        List<ContentNode> children = new ArrayList<>();
        for (ContentNode child : subtree.getChildren()) {
            children.add(regenerateIds(child));
        }
        return subtree.toBuilder()
                .id(IdGenerator.generate(IdGenerator.prefixFor(subtree.getKind())))
                .clearAttributes().attributes(attributes)
                .clearChildren().children(children)
                .build();
    }

    /**
     * Clears content (value, description, attribute values, value-like payload fields) and keeps
     * kinds, names and shape. Used for structure-only templates.
     */
    public static ContentNode stripValues(ContentNode subtree) {
        List<Attribute> attributes = new ArrayList<>();
        for (Attribute attribute : subtree.getAttributes()) {
            attributes.add(attribute.toBuilder().value(null).build());
        }
        Map<String, JsonNode> extensions = new LinkedHashMap<>(subtree.getExtensions());
        extensions.keySet().removeAll(VALUE_EXTENSIONS);

        List<ContentNode> children = new ArrayList<>();
        for (ContentNode child : subtree.getChildren()) {
            children.add(stripValues(child));
        }
        return subtree.toBuilder()
                .value(null)
                .description(null)
                .payload(stripPayload(subtree.getPayload()))
                .clearAttributes().attributes(attributes)
                .clearExtensions().extensions(extensions)
                .clearChildren().children(children)
                .build();
    }

    private static NodePayload stripPayload(NodePayload payload) {
        if (payload instanceof DiningPayload) {
            return ((DiningPayload) payload).toBuilder().price(null).calories(null).build();
        }
        if (payload instanceof ScheduledEventPayload) {
            return ((ScheduledEventPayload) payload).toBuilder().startTime(null).endTime(null).build();
        }
        return payload;
    }

    // --- search and statistics ---

    /**
     * Case-insensitive search over names, values, attributes and tags. Keeps matching nodes and
     * their ancestors; empty when nothing matches. A blank query returns the whole tree.
     */
    public static Optional<ContentNode> filter(ContentNode root, String query) {
        if (query == null || query.isBlank()) {
            return Optional.of(root);
        }
        return Optional.ofNullable(prune(root, query.toLowerCase(Locale.ROOT)));
    }

    private static ContentNode prune(ContentNode node, String needle) {
        List<ContentNode> kept = new ArrayList<>();
        for (ContentNode child : node.getChildren()) {
            ContentNode pruned = prune(child, needle);
            if (pruned != null) {
                kept.add(pruned);
            }
        }
        if (matches(node, needle) || !kept.isEmpty()) {
            return node.withChildren(kept);
        }
        return null;
    }

    private static boolean matches(ContentNode node, String needle) {
        if (contains(node.getName(), needle) || contains(node.getValue(), needle)) {
            return true;
        }
        for (Attribute attribute : node.getAttributes()) {
            if (contains(attribute.getKey(), needle) || contains(attribute.getValue(), needle)) {
                return true;
            }
        }
        for (String tag : tagsOf(node)) {
            if (contains(tag, needle)) {
                return true;
            }
        }
        return false;
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }

    static List<String> tagsOf(ContentNode node) {
        List<String> tags = new ArrayList<>();
        JsonNode legacy = node.getExtensions().get("tags");
        if (legacy != null && legacy.isArray()) {
            legacy.forEach(tag -> tags.add(tag.asText()));
        }
        if (node.getPayload() instanceof DiningPayload) {
            tags.addAll(((DiningPayload) node.getPayload()).getTags());
        }
        return tags;
    }

    public static TreeStats stats(ContentNode root) {
        int[] counters = new int[5]; // total, depth, categories, fillable, empty
        traverseStats(root, 1, counters);
        int fillable = counters[3];
        int empty = counters[4];
        int completion = fillable > 0 ? Math.round((fillable - empty) * 100f / fillable) : 100;
        return TreeStats.builder()
                .totalNodes(counters[0])
                .depth(counters[1])
                .categories(counters[2])
                .fillableItems(fillable)
                .emptyFieldCount(empty)
                .completionRate(completion)
                .build();
    }

    private static void traverseStats(ContentNode node, int depth, int[] counters) {
        counters[0]++;
        counters[1] = Math.max(counters[1], depth);
        if (isContainer(node)) {
            counters[2]++;
        } else {
            counters[3]++;
            if (isBlank(primaryContent(node))) {
                counters[4]++;
            }
        }
        for (ContentNode child : node.getChildren()) {
            traverseStats(child, depth + 1, counters);
        }
    }

    public static boolean isContainer(ContentNode node) {
        return node.getKind() != null && CONTAINER_KINDS.contains(node.getKind());
    }

    /**
     * The field that carries a node's content: the answer of a Q&A pair, the price of a menu item,
     * the value of anything else.
     */
    public static String primaryContent(ContentNode node) {
        if ("qa_pair".equals(node.getKind())) {
            return node.extensionText("answer");
        }
        if ("menu_item".equals(node.getKind())) {
            if (node.getPayload() instanceof DiningPayload) {
                return ((DiningPayload) node.getPayload()).getPrice();
            }
            return node.extensionText("price");
        }
        return node.getValue();
    }

    /**
     * Kind given to a new child when the caller does not name one.
     */
    public static String defaultChildKind(String parentKind) {
        if (parentKind == null) {
            return "item";
        }
        switch (parentKind) {
            case "root":
                return "category";
            case "menu":
                return "menu_item";
            case "category":
            case "list":
                return "item";
            default:
                return "field";
        }
    }

    // --- helpers ---

    private static ContentNode replaceNode(ContentNode node, String id, UnaryOperator<ContentNode> edit) {
        if (id == null) {
            return node;
        }
        if (id.equals(node.getId())) {
            return edit.apply(node);
        }
        List<ContentNode> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            ContentNode child = children.get(i);
            ContentNode replaced = replaceNode(child, id, edit);
            if (replaced != child) {
                List<ContentNode> copy = new ArrayList<>(children);
                copy.set(i, replaced);
                return node.withChildren(copy);
            }
        }
        return node;
    }

    private static ContentNode removeNode(ContentNode node, String id) {
        List<ContentNode> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            ContentNode child = children.get(i);
            if (id.equals(child.getId())) {
                List<ContentNode> copy = new ArrayList<>(children);
                copy.remove(i);
                return node.withChildren(copy);
            }
            ContentNode pruned = removeNode(child, id);
            if (pruned != child) {
                List<ContentNode> copy = new ArrayList<>(children);
                copy.set(i, pruned);
                return node.withChildren(copy);
            }
        }
        return node;
    }

    private static int indexOf(List<ContentNode> nodes, String id) {
        for (int i = 0; i < nodes.size(); i++) {
            if (id.equals(nodes.get(i).getId())) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
