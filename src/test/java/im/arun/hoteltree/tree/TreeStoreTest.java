package im.arun.hoteltree.tree;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import im.arun.hoteltree.model.Attribute;
import im.arun.hoteltree.model.ContentNode;
import im.arun.hoteltree.model.DiningPayload;
import im.arun.hoteltree.model.MovePosition;
import im.arun.hoteltree.model.NodePatch;
import im.arun.hoteltree.model.TreeStats;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TreeStoreTest {

    private static ContentNode node(String id, String kind, String name, ContentNode... children) {
        return ContentNode.builder().id(id).kind(kind).name(name).children(List.of(children)).build();
    }

    /**
     * root
     *  +- dining (category)
     *  |   +- breakfast (field)
     *  |   +- menu (menu)
     *  |       +- eggs (menu_item)
     *  +- rooms (category)
     */
    private static ContentNode sampleTree() {
        return node("root", "root", "Grand Hotel",
                node("dining", "category", "Dining",
                        node("breakfast", "field", "Breakfast"),
                        node("menu", "menu", "Room Service",
                                node("eggs", "menu_item", "Eggs"))),
                node("rooms", "category", "Rooms"));
    }

    private static List<String> childIds(ContentNode node) {
        List<String> ids = new ArrayList<>();
        node.getChildren().forEach(child -> ids.add(child.getId()));
        return ids;
    }

    private static void collectIds(ContentNode node, List<String> ids) {
        ids.add(node.getId());
        node.getChildren().forEach(child -> collectIds(child, ids));
    }

    @Test
    void wifiScenarioInsertUpdateFilterAndStats() {
        ContentNode root = node("root", "root", "Grand Hotel");
        TreeStats before = TreeStore.stats(root);

        root = TreeStore.insertChild(root, "root", ContentNode.builder().id("c1").kind("field").name("Wifi").build());
        TreeStats afterInsert = TreeStore.stats(root);
        assertEquals(before.getTotalNodes() + 1, afterInsert.getTotalNodes());

        root = TreeStore.updateNode(root, "c1", NodePatch.value("Free"));
        TreeStats afterUpdate = TreeStore.stats(root);
        assertEquals(afterInsert.getEmptyFieldCount() - 1, afterUpdate.getEmptyFieldCount());

        Optional<ContentNode> filtered = TreeStore.filter(root, "wifi");
        assertTrue(filtered.isPresent());
        assertEquals("root", filtered.get().getId());
        assertEquals(1, filtered.get().getChildren().size());
        assertEquals("c1", filtered.get().getChildren().get(0).getId());
        assertEquals("Free", filtered.get().getChildren().get(0).getValue());
    }

    @Test
    void findNodePathAndParent() {
        ContentNode root = sampleTree();
        assertEquals("Eggs", TreeStore.findNode(root, "eggs").map(ContentNode::getName).orElse(null));
        assertTrue(TreeStore.findNode(root, "missing").isEmpty());

        List<String> path = new ArrayList<>();
        TreeStore.findPath(root, "eggs").forEach(n -> path.add(n.getId()));
        assertEquals(List.of("root", "dining", "menu", "eggs"), path);
        assertTrue(TreeStore.findPath(root, "missing").isEmpty());

        assertEquals("menu", TreeStore.findParent(root, "eggs").map(ContentNode::getId).orElse(null));
        assertTrue(TreeStore.findParent(root, "root").isEmpty());
    }

    @Test
    void insertAppendsAsLastChildAndLeavesInputUntouched() {
        ContentNode root = sampleTree();
        ContentNode updated = TreeStore.insertChild(root, "dining", node("spa", "field", "Spa"));

        assertEquals(List.of("breakfast", "menu", "spa"), childIds(TreeStore.findNode(updated, "dining").get()));
        assertEquals(List.of("breakfast", "menu"), childIds(TreeStore.findNode(root, "dining").get()));
        // untouched branches are shared
        assertSame(root.getChildren().get(1), updated.getChildren().get(1));
    }

    @Test
    void insertUnderUnknownParentIsNoOp() {
        ContentNode root = sampleTree();
        assertSame(root, TreeStore.insertChild(root, "nope", node("x", "field", "X")));
    }

    @Test
    void updateMergesFieldsAndKeepsChildren() {
        ContentNode root = sampleTree();
        NodePatch patch = NodePatch.builder().name("Restaurants").description("All outlets").build();

        ContentNode dining = TreeStore.findNode(TreeStore.updateNode(root, "dining", patch), "dining").get();

        assertEquals("Restaurants", dining.getName());
        assertEquals("All outlets", dining.getDescription());
        assertEquals("category", dining.getKind());
        assertEquals(List.of("breakfast", "menu"), childIds(dining));
    }

    @Test
    void updateReplacesAttributesAndMergesExtensions() {
        ContentNode root = TreeStore.insertChild(sampleTree(), "rooms", ContentNode.builder()
                .id("suite").kind("item").name("Suite")
                .extension("floor", JsonNodeFactory.instance.textNode("7"))
                .extension("legacy", JsonNodeFactory.instance.textNode("x"))
                .build());
        Map<String, JsonNode> extensions = new HashMap<>();
        extensions.put("legacy", NullNode.getInstance());
        extensions.put("view", JsonNodeFactory.instance.textNode("Sea"));
        NodePatch patch = NodePatch.builder()
                .attributes(List.of(Attribute.builder().id("a1").key("Beds").value("2").kind("number").build()))
                .extensions(extensions)
                .build();

        ContentNode suite = TreeStore.findNode(TreeStore.updateNode(root, "suite", patch), "suite").get();

        assertEquals(1, suite.getAttributes().size());
        assertEquals("Beds", suite.getAttributes().get(0).getKey());
        assertEquals("7", suite.extensionText("floor"));
        assertEquals("Sea", suite.extensionText("view"));
        assertFalse(suite.getExtensions().containsKey("legacy"));
    }

    @Test
    void updateRefusesPatchThatRewritesId() {
        ContentNode root = sampleTree();
        NodePatch patch = NodePatch.builder().id("other").name("Renamed").build();
        assertSame(root, TreeStore.updateNode(root, "dining", patch));
    }

    @Test
    void noOpSafetyForRootDeleteAndUnknownUpdate() {
        ContentNode root = sampleTree();
        assertEquals(root, TreeStore.deleteNode(root, "root"));
        assertEquals(root, TreeStore.updateNode(root, "does-not-exist", NodePatch.value("x")));
        assertEquals(root, TreeStore.deleteNode(root, "does-not-exist"));
    }

    @Test
    void deleteRemovesWholeSubtree() {
        ContentNode updated = TreeStore.deleteNode(sampleTree(), "menu");
        assertFalse(TreeStore.containsId(updated, "menu"));
        assertFalse(TreeStore.containsId(updated, "eggs"));
        assertTrue(TreeStore.containsId(updated, "breakfast"));
        assertEquals(4, TreeStore.stats(updated).getTotalNodes());
    }

    @Test
    void changeNodeIdRejectsRootDuplicatesAndBlank() {
        ContentNode root = sampleTree();
        assertSame(root, TreeStore.changeNodeId(root, "root", "hotel"));
        assertSame(root, TreeStore.changeNodeId(root, "breakfast", "rooms"));
        assertSame(root, TreeStore.changeNodeId(root, "breakfast", " "));

        ContentNode renamed = TreeStore.changeNodeId(root, "breakfast", "morning");
        assertTrue(TreeStore.containsId(renamed, "morning"));
        assertFalse(TreeStore.containsId(renamed, "breakfast"));
    }

    @Test
    void moveInsideAppendsToTarget() {
        ContentNode moved = TreeStore.moveNode(sampleTree(), "breakfast", "rooms", MovePosition.INSIDE);
        assertEquals(List.of("menu"), childIds(TreeStore.findNode(moved, "dining").get()));
        assertEquals(List.of("breakfast"), childIds(TreeStore.findNode(moved, "rooms").get()));
    }

    @Test
    void moveBeforeAndAfterPlaceAsSibling() {
        ContentNode before = TreeStore.moveNode(sampleTree(), "rooms", "dining", MovePosition.BEFORE);
        assertEquals(List.of("rooms", "dining"), childIds(before));

        ContentNode after = TreeStore.moveNode(sampleTree(), "eggs", "breakfast", MovePosition.AFTER);
        assertEquals(List.of("breakfast", "eggs", "menu"), childIds(TreeStore.findNode(after, "dining").get()));
        assertTrue(TreeStore.findNode(after, "menu").get().isLeaf());
    }

    @Test
    void moveCycleGuardRejectsMoveIntoDescendant() {
        ContentNode root = sampleTree();
        assertSame(root, TreeStore.moveNode(root, "dining", "eggs", MovePosition.INSIDE));
        assertSame(root, TreeStore.moveNode(root, "dining", "menu", MovePosition.AFTER));
        assertSame(root, TreeStore.moveNode(root, "dining", "dining", MovePosition.INSIDE));
    }

    @Test
    void moveRejectsRootSourceUnknownIdsAndSiblingOfRoot() {
        ContentNode root = sampleTree();
        assertSame(root, TreeStore.moveNode(root, "root", "rooms", MovePosition.INSIDE));
        assertSame(root, TreeStore.moveNode(root, "ghost", "rooms", MovePosition.INSIDE));
        assertSame(root, TreeStore.moveNode(root, "rooms", "ghost", MovePosition.INSIDE));
        assertSame(root, TreeStore.moveNode(root, "rooms", "root", MovePosition.BEFORE));
    }

    @Test
    void moveKeepsEveryNodeReachableExactlyOnce() {
        ContentNode root = sampleTree();
        ContentNode moved = TreeStore.moveNode(root, "menu", "rooms", MovePosition.INSIDE);

        List<String> before = new ArrayList<>();
        List<String> after = new ArrayList<>();
        collectIds(root, before);
        collectIds(moved, after);
        assertEquals(new HashSet<>(before), new HashSet<>(after));
        assertEquals(before.size(), after.size());
        assertEquals("rooms", TreeStore.findParent(moved, "menu").get().getId());
    }

    @Test
    void regenerateIdsKeepsShapeWithFreshIds() {
        ContentNode root = TreeStore.insertChild(sampleTree(), "breakfast", ContentNode.builder()
                .id("hours").kind("field").name("Hours").value("7-10")
                .attribute(Attribute.builder().id("attr-1").key("Days").value("Daily").build())
                .build());
        ContentNode copy = TreeStore.regenerateIds(root);

        List<String> original = new ArrayList<>();
        List<String> fresh = new ArrayList<>();
        collectIds(root, original);
        collectIds(copy, fresh);
        assertEquals(original.size(), fresh.size());
        Set<String> overlap = new HashSet<>(original);
        overlap.retainAll(fresh);
        assertTrue(overlap.isEmpty());
        assertEquals(fresh.size(), new HashSet<>(fresh).size());

        ContentNode hours = copy.getChildren().get(0).getChildren().get(0).getChildren().get(0);
        assertEquals("Hours", hours.getName());
        assertEquals("7-10", hours.getValue());
        assertNotEquals("attr-1", hours.getAttributes().get(0).getId());
    }

    @Test
    void stripValuesKeepsStructure() {
        ContentNode root = TreeStore.updateNode(sampleTree(), "breakfast", NodePatch.value("7-10"));
        root = TreeStore.updateNode(root, "eggs", NodePatch.builder()
                .payload(DiningPayload.builder().price("12").tag("vegetarian").build()).build());

        ContentNode stripped = TreeStore.stripValues(root);

        assertNull(TreeStore.findNode(stripped, "breakfast").get().getValue());
        DiningPayload eggs = (DiningPayload) TreeStore.findNode(stripped, "eggs").get().getPayload();
        assertNull(eggs.getPrice());
        assertEquals(List.of("vegetarian"), eggs.getTags());
        assertEquals(TreeStore.stats(root).getTotalNodes(), TreeStore.stats(stripped).getTotalNodes());
    }

    @Test
    void filterMatchesTagsAndReturnsEmptyWhenNothingMatches() {
        ContentNode root = TreeStore.updateNode(sampleTree(), "eggs", NodePatch.builder()
                .payload(DiningPayload.builder().price("12").tag("Vegetarian").build()).build());

        ContentNode filtered = TreeStore.filter(root, "vegetarian").get();
        assertEquals(List.of("dining"), childIds(filtered));
        assertEquals(List.of("menu"), childIds(filtered.getChildren().get(0)));

        assertTrue(TreeStore.filter(root, "sauna").isEmpty());
        assertSame(root, TreeStore.filter(root, "  ").get());
    }

    @Test
    void statsCountContainersAndPrimaryContent() {
        ContentNode root = TreeStore.updateNode(sampleTree(), "eggs", NodePatch.builder()
                .payload(DiningPayload.builder().price("12").build()).build());
        TreeStats stats = TreeStore.stats(root);

        assertEquals(6, stats.getTotalNodes());
        assertEquals(4, stats.getDepth());
        assertEquals(4, stats.getCategories());
        assertEquals(2, stats.getFillableItems());
        assertEquals(1, stats.getEmptyFieldCount());
        assertEquals(50, stats.getCompletionRate());
    }

    @Test
    void statsOfLoneRoot() {
        TreeStats stats = TreeStore.stats(node("root", "root", "Empty"));
        assertEquals(1, stats.getTotalNodes());
        assertEquals(1, stats.getDepth());
        assertEquals(100, stats.getCompletionRate());
    }

    @Test
    void defaultChildKinds() {
        assertEquals("category", TreeStore.defaultChildKind("root"));
        assertEquals("menu_item", TreeStore.defaultChildKind("menu"));
        assertEquals("item", TreeStore.defaultChildKind("category"));
        assertEquals("field", TreeStore.defaultChildKind("item"));
    }
}
