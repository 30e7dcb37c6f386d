package im.arun.hoteltree.tree;

import im.arun.hoteltree.model.ContentNode;
import im.arun.hoteltree.model.HotelTemplate;
import im.arun.hoteltree.model.NodePatch;

/**
 * Builds the tree of a newly created hotel, either from scratch or from a template.
 */
public class TemplateImporter {

    /**
     * Starting tree for a hotel created without a template.
     */
    public static ContentNode initialTree(String hotelName) {
        ContentNode hotelNameField = ContentNode.builder()
                .id(IdGenerator.generate("fie"))
                .kind("field")
                .name("Hotel Name")
                .value(hotelName)
                .build();
        ContentNode generalInfo = ContentNode.builder()
                .id(IdGenerator.generate("cat"))
                .kind("category")
                .name("General Information")
                .child(hotelNameField)
                .build();
        return ContentNode.builder()
                .id("root")
                .kind("root")
                .name(hotelName)
                .child(generalInfo)
                .build();
    }

    /**
     * Clones the template's tree with fresh ids, optionally dropping all values, and names it.
     * When the first grandchild is a field (usually "General Information" &gt; "Hotel Name") its
     * value is set to the new name as well.
     */
    public ContentNode instantiate(HotelTemplate template, String hotelName, boolean structureOnly) {
        ContentNode tree = TreeStore.regenerateIds(template.getData());
        if (structureOnly) {
            tree = TreeStore.stripValues(tree);
        }
        tree = tree.toBuilder().name(hotelName).build();

        if (!tree.isLeaf() && !tree.getChildren().get(0).isLeaf()) {
            ContentNode firstGrandchild = tree.getChildren().get(0).getChildren().get(0);
            if ("field".equals(firstGrandchild.getKind())) {
                tree = TreeStore.updateNode(tree, firstGrandchild.getId(),
                        NodePatch.value(hotelName));
            }
        }
        return tree;
    }
}
