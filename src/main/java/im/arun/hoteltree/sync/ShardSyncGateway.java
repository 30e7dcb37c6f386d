package im.arun.hoteltree.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import im.arun.hoteltree.json.JsonSanitizer;
import im.arun.hoteltree.json.NodeCodec;
import im.arun.hoteltree.model.ContentNode;
import im.arun.hoteltree.model.HotelSummary;
import im.arun.hoteltree.model.HotelTemplate;
import im.arun.hoteltree.store.DocumentStore;
import im.arun.hoteltree.store.RemoteStoreException;
import im.arun.hoteltree.store.StoredDocument;
import im.arun.hoteltree.store.WriteBatch;
import im.arun.hoteltree.tree.IdGenerator;
import im.arun.hoteltree.tree.TreeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Persists hotel trees in the remote document store, one root document plus one shard per
 * top-level child.
 * <p>
 * Layout for hotel {@code h}:
 * <pre>
 *   hotels/h                 root fields + childOrder: [c1, c2, ...]
 *   hotels/h/nodes/c1        c1 with its whole subtree embedded
 *   hotels/h/nodes/c2        ...
 * </pre>
 * Remote failures never reach the caller: saves fall back to the local cache and reads are served
 * from it.
 */
public class ShardSyncGateway {
    private static final Logger logger = LoggerFactory.getLogger(ShardSyncGateway.class);
    static final String CHILD_ORDER = "childOrder";
    public static final String DEFAULT_TEMPLATES_COLLECTION = "templates";
    /**
     * Firestore nests maps and arrays at most this deep. Each branch level of a shard takes two
     * (the node map and its children array), so roughly nine levels below a top-level child fit.
     */
    static final int MAX_NESTING_DEPTH = 20;

    private final DocumentStore store;
    private final LocalCache localCache;
    private final NodeCodec codec;
    private final String hotelsCollection;
    private final String shardCollection;
    private final String templatesCollection;

    public ShardSyncGateway(DocumentStore store, LocalCache localCache, NodeCodec codec,
                            String hotelsCollection, String shardCollection) {
        this(store, localCache, codec, hotelsCollection, shardCollection, DEFAULT_TEMPLATES_COLLECTION);
    }

    public ShardSyncGateway(DocumentStore store, LocalCache localCache, NodeCodec codec,
                            String hotelsCollection, String shardCollection, String templatesCollection) {
        this.store = store;
        this.localCache = localCache;
        this.codec = codec;
        this.hotelsCollection = hotelsCollection;
        this.shardCollection = shardCollection;
        this.templatesCollection = templatesCollection;
    }

    /**
     * Writes the tree as root manifest plus shards in one batch, deleting shards of top-level
     * children that no longer exist.
     *
     * @return {@link SaveResult#REMOTE} when the batch committed, {@link SaveResult#LOCAL_FALLBACK}
     *         when the remote store failed and the tree went to the local cache
     * @throws PersistenceException if the local fallback write fails as well
     */
    public SaveResult save(String hotelId, ContentNode root) {
        if (hotelId == null || hotelId.isBlank()) {
            throw new IllegalArgumentException("No hotel ID provided");
        }
        if (root == null) {
            throw new IllegalArgumentException("No data provided to save");
        }

        try {
            saveRemote(hotelId, root);
            return SaveResult.REMOTE;
        } catch (RemoteStoreException e) {
            logger.warn("Remote store unavailable (offline mode), saving hotel {} locally: {}", hotelId, e.getMessage());
            localCache.saveTree(hotelId, root);
            localCache.upsertSummary(hotelId, root.getName());
            return SaveResult.LOCAL_FALLBACK;
        }
    }

    private void saveRemote(String hotelId, ContentNode root) throws RemoteStoreException {
        String shardPath = shardPath(hotelId);

        ObjectNode manifest = codec.encodeScalars(root);
        ArrayNode childOrder = manifest.putArray(CHILD_ORDER);
        Set<String> currentIds = new LinkedHashSet<>();
        for (ContentNode child : root.getChildren()) {
            if (child.getId() == null || child.getId().isBlank()) {
                throw new IllegalArgumentException("Top-level node '" + child.getName() + "' has no id and cannot be stored");
            }
            childOrder.add(child.getId());
            currentIds.add(child.getId());
        }

        WriteBatch batch = store.batch();
        batch.set(hotelsCollection, hotelId, JsonSanitizer.sanitize(manifest));
        for (ContentNode child : root.getChildren()) {
            ObjectNode shard = JsonSanitizer.sanitize(codec.encode(child));
            int depth = nestingDepth(shard);
            if (depth > MAX_NESTING_DEPTH) {
                throw new RemoteStoreException("Section '" + child.getName() + "' (" + child.getId() + ") nests "
                        + depth + " levels deep; Firestore allows " + MAX_NESTING_DEPTH, -1);
            }
            batch.set(shardPath, child.getId(), shard);
        }

        int orphans = 0;
        for (String existingId : store.listIds(shardPath)) {
            if (!currentIds.contains(existingId)) {
                batch.delete(shardPath, existingId);
                orphans++;
            }
        }

        batch.commit();
        logger.info("Saved hotel {}: {} shards written, {} orphans removed", hotelId, currentIds.size(), orphans);
    }

    /**
     * Rebuilds the tree from the root manifest and its shards. Shards missing from the manifest are
     * appended after the ordered ones; manifest entries without a shard are skipped.
     */
    public Optional<ContentNode> load(String hotelId) {
        try {
            Optional<ObjectNode> manifest = store.get(hotelsCollection, hotelId);
            if (manifest.isEmpty()) {
                logger.info("Hotel {} not found in remote store, checking local cache", hotelId);
                return localCache.loadTree(hotelId);
            }
            List<StoredDocument> shards = store.list(shardPath(hotelId));
            return Optional.of(reassemble(manifest.get(), shards));
        } catch (RemoteStoreException e) {
            logger.warn("Remote store unavailable (offline mode), loading hotel {} from local cache: {}", hotelId, e.getMessage());
            return localCache.loadTree(hotelId);
        }
    }

    ContentNode reassemble(ObjectNode manifest, List<StoredDocument> shards) {
        ObjectNode scalars = manifest.deepCopy();
        JsonNode childOrder = scalars.remove(CHILD_ORDER);

        // documents written before sharding embed the whole tree in the root document
        if (childOrder == null && shards.isEmpty() && scalars.has(NodeCodec.CHILDREN)) {
            return codec.decode(scalars);
        }
        scalars.remove(NodeCodec.CHILDREN);

        Map<String, ContentNode> shardsById = new LinkedHashMap<>();
        for (StoredDocument shard : shards) {
            shardsById.put(shard.getId(), codec.decode(shard.getFields()));
        }

        List<ContentNode> children = new ArrayList<>();
        if (childOrder != null) {
            for (JsonNode id : childOrder) {
                ContentNode child = shardsById.remove(id.asText());
                if (child != null) {
                    children.add(child);
                } else {
                    logger.debug("Manifest lists {} but no shard exists for it", id.asText());
                }
            }
        }
        if (!shardsById.isEmpty()) {
            logger.info("Appending {} shards missing from the manifest: {}", shardsById.size(), shardsById.keySet());
            children.addAll(shardsById.values());
        }

        return codec.decode(scalars).withChildren(children);
    }

    /**
     * Lists hotels from root documents only, falling back to the local index.
     */
    public List<HotelSummary> list() {
        try {
            List<HotelSummary> hotels = new ArrayList<>();
            for (StoredDocument document : store.list(hotelsCollection, List.of(NodeCodec.NAME))) {
                hotels.add(HotelSummary.of(document.getId(), document.getFields().path(NodeCodec.NAME).asText(null)));
            }
            return hotels;
        } catch (RemoteStoreException e) {
            logger.warn("Remote store unavailable (offline mode), listing hotels from local cache: {}", e.getMessage());
            return localCache.listSummaries();
        }
    }

    /**
     * Assigns a new hotel id, stamps it on the root and saves the tree.
     *
     * @return the stored tree; its root id is the new hotel id
     */
    public ContentNode create(ContentNode initialTree) {
        String hotelId = IdGenerator.generate("hotel");
        ContentNode root = initialTree.withId(hotelId);
        SaveResult result = save(hotelId, root);
        logger.info("Created hotel {} ({})", hotelId, result);
        return root;
    }

    // --- templates ---

    /**
     * Stores a snapshot of {@code tree} as a reusable template. With {@code structureOnly} the
     * values are dropped first and only names, kinds and shape are kept.
     *
     * @return the stored template, remotely or in the local cache
     */
    public HotelTemplate saveTemplate(String name, String description, ContentNode tree, boolean structureOnly) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Template name must not be empty");
        }
        if (tree == null) {
            throw new IllegalArgumentException("No data provided to save");
        }
        HotelTemplate template = HotelTemplate.builder()
                .id(IdGenerator.generate("template"))
                .name(name)
                .description(description != null ? description : "")
                .createdAt(System.currentTimeMillis())
                .data(structureOnly ? TreeStore.stripValues(tree) : tree)
                .build();

        ObjectNode fields = codec.encodeTemplate(template);
        fields.remove(NodeCodec.ID);
        try {
            store.batch().set(templatesCollection, template.getId(), JsonSanitizer.sanitize(fields)).commit();
            logger.info("Saved template {} ({})", template.getId(), name);
        } catch (RemoteStoreException e) {
            logger.warn("Remote store unavailable (offline mode), saving template {} locally: {}", template.getId(), e.getMessage());
            List<HotelTemplate> templates = localCache.listTemplates();
            templates.add(template);
            localCache.saveTemplates(templates);
        }
        return template;
    }

    /**
     * Lists all templates with their trees, falling back to the locally stored ones.
     */
    public List<HotelTemplate> listTemplates() {
        try {
            List<HotelTemplate> templates = new ArrayList<>();
            for (StoredDocument document : store.list(templatesCollection)) {
                ObjectNode fields = document.getFields().deepCopy();
                fields.put(NodeCodec.ID, document.getId());
                try {
                    templates.add(codec.decodeTemplate(fields));
                } catch (IllegalArgumentException e) {
                    logger.warn("Skipping template {}: {}", document.getId(), e.getMessage());
                }
            }
            return templates;
        } catch (RemoteStoreException e) {
            logger.warn("Remote store unavailable (offline mode), listing templates from local cache: {}", e.getMessage());
            return localCache.listTemplates();
        }
    }

    public Optional<HotelTemplate> findTemplate(String templateId) {
        return listTemplates().stream().filter(template -> templateId.equals(template.getId())).findFirst();
    }

    public void deleteTemplate(String templateId) {
        try {
            store.batch().delete(templatesCollection, templateId).commit();
            logger.info("Deleted template {}", templateId);
        } catch (RemoteStoreException e) {
            logger.warn("Remote store unavailable (offline mode), deleting template {} locally: {}", templateId, e.getMessage());
            List<HotelTemplate> templates = localCache.listTemplates();
            if (templates.removeIf(template -> templateId.equals(template.getId()))) {
                localCache.saveTemplates(templates);
            }
        }
    }

    /**
     * Deepest chain of maps and arrays below the document's own fields; scalar fields count 0.
     */
    static int nestingDepth(ObjectNode fields) {
        int depth = 0;
        for (JsonNode value : fields) {
            depth = Math.max(depth, containerDepth(value));
        }
        return depth;
    }

    private static int containerDepth(JsonNode value) {
        if (!value.isContainerNode()) {
            return 0;
        }
        int deepest = 0;
        for (JsonNode element : value) {
            deepest = Math.max(deepest, containerDepth(element));
        }
        return 1 + deepest;
    }

    private String shardPath(String hotelId) {
        return hotelsCollection + "/" + hotelId + "/" + shardCollection;
    }
}
