package im.arun.hoteltree.tree;

import im.arun.hoteltree.model.ContentNode;
import im.arun.hoteltree.model.HealthIssue;
import im.arun.hoteltree.model.HealthIssue.HealthFix;
import im.arun.hoteltree.model.IssueSeverity;
import im.arun.hoteltree.model.NodePatch;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Local, rule-based health check that needs no AI service. Findings are advisory only.
 */
public class TreeValidator {
    static final int MAX_COMFORTABLE_DEPTH = 5;
    private static final Set<String> PLACEHOLDER_NAMES = Set.of("new item", "untitled");
    private static final Set<String> VALUE_KINDS = Set.of("item", "field");

    public List<HealthIssue> validate(ContentNode root) {
        List<HealthIssue> issues = new ArrayList<>();
        findEmptyNodes(root, issues);
        findStructuralIssues(root, 0, issues);
        findDuplicateSiblings(root, issues);
        return issues;
    }

    private void findEmptyNodes(ContentNode node, List<HealthIssue> issues) {
        String name = node.getName();
        if (isBlank(name)) {
            issues.add(issue(node, IssueSeverity.CRITICAL, "Node has no name.",
                    new HealthFix("Set Name", NodePatch.name("New Item"))));
        } else if (PLACEHOLDER_NAMES.contains(name.trim().toLowerCase(Locale.ROOT))) {
            issues.add(issue(node, IssueSeverity.WARNING, "Node has default placeholder name.", null));
        }

        if (VALUE_KINDS.contains(node.getKind()) && isBlank(node.getValue())) {
            issues.add(issue(node, IssueSeverity.WARNING, String.format("Field \"%s\" is empty.", name),
                    new HealthFix("Set Placeholder", NodePatch.value("TBD"))));
        }
        if ("menu_item".equals(node.getKind()) && isBlank(TreeStore.primaryContent(node))) {
            issues.add(issue(node, IssueSeverity.WARNING, String.format("Menu item \"%s\" has no price.", name), null));
        }
        if ("qa_pair".equals(node.getKind()) && isBlank(TreeStore.primaryContent(node))) {
            String question = node.extensionText("question");
            issues.add(issue(node, IssueSeverity.CRITICAL,
                    String.format("Question \"%s\" has no answer.", question != null ? question : "Unknown"), null));
        }

        for (ContentNode child : node.getChildren()) {
            findEmptyNodes(child, issues);
        }
    }

    private void findStructuralIssues(ContentNode node, int depth, List<HealthIssue> issues) {
        if (depth > MAX_COMFORTABLE_DEPTH) {
            issues.add(issue(node, IssueSeverity.OPTIMIZATION,
                    String.format("Nesting level (%d) is too deep for good UX.", depth), null));
        }
        if ("field".equals(node.getKind()) && !node.isLeaf()) {
            issues.add(issue(node, IssueSeverity.WARNING,
                    String.format("Node \"%s\" is a 'field' type but has children. Should it be a 'category'?", node.getName()),
                    new HealthFix("Convert to Category", NodePatch.builder().kind("category").build())));
        }
        for (ContentNode child : node.getChildren()) {
            findStructuralIssues(child, depth + 1, issues);
        }
    }

    private void findDuplicateSiblings(ContentNode node, List<HealthIssue> issues) {
        if (node.getChildren().size() > 1) {
            Map<String, Integer> nameCounts = new HashMap<>();
            for (ContentNode child : node.getChildren()) {
                String key = normalized(child.getName());
                if (!key.isEmpty()) {
                    nameCounts.merge(key, 1, Integer::sum);
                }
            }
            for (ContentNode child : node.getChildren()) {
                if (nameCounts.getOrDefault(normalized(child.getName()), 0) > 1) {
                    issues.add(issue(child, IssueSeverity.CRITICAL,
                            String.format("Duplicate name \"%s\" found in same category.", child.getName()),
                            new HealthFix("Rename", NodePatch.name(child.getName() + " (Copy)"))));
                }
            }
        }
        for (ContentNode child : node.getChildren()) {
            findDuplicateSiblings(child, issues);
        }
    }

    private HealthIssue issue(ContentNode node, IssueSeverity severity, String message, HealthFix fix) {
        return HealthIssue.builder()
                .id(IdGenerator.generate("issue"))
                .nodeId(node.getId())
                .nodeName(isBlank(node.getName()) ? "Unnamed Node" : node.getName())
                .severity(severity)
                .message(message)
                .fix(fix)
                .build();
    }

    private static String normalized(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
