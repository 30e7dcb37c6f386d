package im.arun.hoteltree.tree;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import im.arun.hoteltree.json.NodeCodec;
import im.arun.hoteltree.model.ContentNode;
import im.arun.hoteltree.model.DiningPayload;
import im.arun.hoteltree.model.ScheduledEventPayload;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only renderings of a tree for AI context windows and file export.
 */
public class TreeExporter {
    private static final List<String> CSV_COLUMNS = List.of("System_ID", "Semantic_Path", "Node_Type", "Name",
            "Primary_Content", "Rich_Attributes", "Tags", "AI_Description");
    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final Set<String> NOISE_FIELDS = Set.of("id", "lastSaved", "lastModified", "uiState", "isExpanded");

    private final NodeCodec codec;

    public TreeExporter(NodeCodec codec) {
        this.codec = codec;
    }

    /**
     * JSON without ids, UI flags and empty fields; children are listed under {@code contains}.
     */
    public ObjectNode toCleanJson(ContentNode node) {
        return clean(node, false);
    }

    /**
     * Same as {@link #toCleanJson} but keeps node ids, so that a model proposing edits can name
     * the nodes it targets.
     */
    public ObjectNode toArchitectJson(ContentNode node) {
        return clean(node, true);
    }

    private ObjectNode clean(ContentNode node, boolean keepIds) {
        ObjectNode json = codec.encodeScalars(node);
        JsonNode id = json.get(NodeCodec.ID);
        json.remove(NOISE_FIELDS);
        if (keepIds && id != null) {
            json.set(NodeCodec.ID, id);
        }

        pruneEmpty(json);

        if (!node.isLeaf()) {
            ArrayNode contains = json.putArray("contains");
            for (ContentNode child : node.getChildren()) {
                contains.add(clean(child, keepIds));
            }
        }
        return json;
    }

    private static void pruneEmpty(JsonNode json) {
        Iterator<JsonNode> values = json.elements();
        while (values.hasNext()) {
            JsonNode value = values.next();
            if (value.isContainerNode()) {
                pruneEmpty(value);
            }
            if (value.isNull() || (value.isTextual() && value.asText().isEmpty())
                    || (value.isContainerNode() && value.isEmpty())) {
                values.remove();
            }
        }
    }

    /**
     * Flat spreadsheet export, one row per node in depth-first order. The semantic path joins the
     * names from the root down with {@code " > "}.
     */
    public String toCsv(ContentNode root) {
        CsvSchema.Builder schema = CsvSchema.builder();
        CSV_COLUMNS.forEach(schema::addColumn);
        StringWriter out = new StringWriter();
        try (SequenceWriter writer = CSV_MAPPER.writer(schema.build().withHeader()).writeValues(out)) {
            writeCsvRows(root, new ArrayList<>(), writer);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV export", e);
        }
        return out.toString();
    }

    private void writeCsvRows(ContentNode node, List<String> path, SequenceWriter writer) throws IOException {
        path.add(node.getName() != null ? node.getName() : "Untitled");
        Map<String, String> row = new LinkedHashMap<>();
        row.put("System_ID", node.getId());
        row.put("Semantic_Path", String.join(" > ", path));
        row.put("Node_Type", node.getKind());
        row.put("Name", node.getName());
        row.put("Primary_Content", firstNonEmpty(node.getValue(), node.extensionText("answer"), node.extensionText("question")));
        row.put("Rich_Attributes", String.join(" | ", richAttributes(node)));
        row.put("Tags", String.join(", ", TreeStore.tagsOf(node)));
        row.put("AI_Description", node.getDescription());
        writer.write(row);

        for (ContentNode child : node.getChildren()) {
            writeCsvRows(child, path, writer);
        }
        path.remove(path.size() - 1);
    }

    private List<String> richAttributes(ContentNode node) {
        List<String> parts = new ArrayList<>();
        String price = node.extensionText("price");
        String calories = node.extensionText("calories");
        boolean paid = node.getExtensions().containsKey("isPaid") && node.getExtensions().get("isPaid").asBoolean();
        if (node.getPayload() instanceof DiningPayload) {
            DiningPayload dining = (DiningPayload) node.getPayload();
            price = firstNonEmpty(dining.getPrice(), price);
            calories = firstNonEmpty(dining.getCalories(), calories);
            paid |= Boolean.TRUE.equals(dining.getPaid());
        }
        if (price != null) {
            parts.add("Price: $" + price);
        }
        if (calories != null) {
            parts.add("Calories: " + calories + "kcal");
        }
        if (node.getPayload() instanceof ScheduledEventPayload) {
            ScheduledEventPayload event = (ScheduledEventPayload) node.getPayload();
            if (event.getStartTime() != null && event.getEndTime() != null) {
                parts.add("Time: " + event.getStartTime() + "-" + event.getEndTime());
            }
            if (event.getRecurrenceType() != null) {
                parts.add("Recurrence: " + event.getRecurrenceType());
            }
            if (!event.getDays().isEmpty()) {
                parts.add("Days: " + String.join("/", event.getDays()));
            }
            if (event.getTargetAudience() != null) {
                parts.add("Audience: " + event.getTargetAudience());
            }
            if (event.getEventStatus() != null) {
                parts.add("Status: " + event.getEventStatus());
            }
        }
        if (paid) {
            parts.add("Requires Payment");
        }
        if (node.getExtensions().containsKey("isMandatory") && node.getExtensions().get("isMandatory").asBoolean()) {
            parts.add("Mandatory");
        }
        return parts;
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

    /**
     * Indented markdown outline: top-level categories become headings, everything else a bullet
     * with its value and compact attributes.
     */
    public String toAiText(ContentNode root) {
        List<String> lines = new ArrayList<>();
        appendLines(root, 0, lines);
        return String.join("\n", lines);
    }

    private void appendLines(ContentNode node, int depth, List<String> lines) {
        String marker = "-";
        boolean category = "category".equals(node.getKind());
        if (depth == 0) {
            marker = "#";
        } else if (depth == 1 && category) {
            marker = "##";
        } else if (depth == 2 && category) {
            marker = "###";
        }

        StringBuilder line = new StringBuilder("  ".repeat(depth))
                .append(marker).append(' ')
                .append(node.getName() != null ? node.getName() : "Untitled");
        if (node.getValue() != null && !node.getValue().isEmpty()) {
            line.append(": ").append(node.getValue());
        }
        String question = node.extensionText("question");
        String answer = node.extensionText("answer");
        if (question != null) {
            line.append(" (Q: ").append(question).append(')');
        }
        if (answer != null) {
            line.append(" (A: ").append(answer).append(')');
        }

        List<String> attrs = compactAttributes(node);
        if (!attrs.isEmpty()) {
            line.append(" [").append(String.join(" | ", attrs)).append(']');
        }
        lines.add(line.toString());

        for (ContentNode child : node.getChildren()) {
            appendLines(child, depth + 1, lines);
        }
    }

    private List<String> compactAttributes(ContentNode node) {
        List<String> attrs = new ArrayList<>();
        String price = node.extensionText("price");
        if (node.getPayload() instanceof DiningPayload && ((DiningPayload) node.getPayload()).getPrice() != null) {
            price = ((DiningPayload) node.getPayload()).getPrice();
        }
        if (price != null && !price.isEmpty()) {
            attrs.add("$" + price);
        }
        if (node.getPayload() instanceof ScheduledEventPayload) {
            ScheduledEventPayload event = (ScheduledEventPayload) node.getPayload();
            if (event.getStartTime() != null && event.getEndTime() != null) {
                attrs.add(event.getStartTime() + "-" + event.getEndTime());
            }
            if (event.getEventStatus() != null) {
                attrs.add(event.getEventStatus());
            }
        }
        node.getAttributes().forEach(attribute -> {
            if (attribute.getValue() != null && !attribute.getValue().isEmpty()) {
                attrs.add(attribute.getKey() + ": " + attribute.getValue());
            }
        });
        List<String> tags = TreeStore.tagsOf(node);
        if (!tags.isEmpty()) {
            attrs.add("Tags: " + String.join(",", tags));
        }
        if (node.getDescription() != null && !node.getDescription().isEmpty()) {
            attrs.add("Note: " + node.getDescription());
        }
        return attrs;
    }
}
