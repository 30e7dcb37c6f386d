package im.arun.hoteltree.sync;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import im.arun.hoteltree.json.NodeCodec;
import im.arun.hoteltree.model.ContentNode;
import im.arun.hoteltree.model.HotelSummary;
import im.arun.hoteltree.model.HotelTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link LocalCache} storing one JSON file per record in a directory.
 * <p>
 * File names are namespaced with a prefix: {@code <prefix>hotel_data_<id>.json} holds a whole tree,
 * {@code <prefix>hotels_list.json} the index and {@code <prefix>templates_list.json} the templates. Writes go to a temp file which is then moved over the
 * record, so a crash never leaves a half-written record behind.
 */
public class FileLocalCache implements LocalCache {
    private static final Logger logger = LoggerFactory.getLogger(FileLocalCache.class);
    private static final String HOTELS_LIST = "hotels_list";
    private static final String HOTEL_DATA = "hotel_data_";
    private static final String TEMPLATES_LIST = "templates_list";

    private final Path dir;
    private final String prefix;
    private final NodeCodec codec;
    private final ObjectMapper objectMapper;

    public FileLocalCache(Path dir, String prefix, NodeCodec codec) {
        this.dir = dir;
        this.prefix = prefix == null ? "" : prefix;
        this.codec = codec;
        this.objectMapper = codec.getObjectMapper();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new PersistenceException("Failed to create local cache directory " + dir, e);
        }
    }

    @Override
    public Optional<ContentNode> loadTree(String hotelId) {
        Path file = recordPath(HOTEL_DATA + encode(hotelId));
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decode(objectMapper.readTree(file.toFile())));
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Ignoring unreadable local record {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public synchronized void saveTree(String hotelId, ContentNode root) {
        try {
            write(recordPath(HOTEL_DATA + encode(hotelId)), objectMapper.writeValueAsBytes(codec.encode(root)));
        } catch (IOException e) {
            throw new PersistenceException("Failed to write local copy of hotel " + hotelId, e);
        }
        logger.debug("Saved hotel {} to local cache", hotelId);
    }

    @Override
    public List<HotelSummary> listSummaries() {
        Path file = recordPath(HOTELS_LIST);
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try {
            return objectMapper.readValue(file.toFile(), new TypeReference<ArrayList<HotelSummary>>() {});
        } catch (IOException e) {
            logger.warn("Ignoring unreadable local hotel index {}: {}", file, e.getMessage());
            return new ArrayList<>();
        }
    }

    @Override
    public synchronized void saveSummaries(List<HotelSummary> summaries) {
        try {
            write(recordPath(HOTELS_LIST), objectMapper.writeValueAsBytes(summaries));
        } catch (IOException e) {
            throw new PersistenceException("Failed to write local hotel index", e);
        }
    }

    @Override
    public List<HotelTemplate> listTemplates() {
        Path file = recordPath(TEMPLATES_LIST);
        List<HotelTemplate> templates = new ArrayList<>();
        if (!Files.exists(file)) {
            return templates;
        }
        JsonNode array;
        try {
            array = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            logger.warn("Ignoring unreadable local template list {}: {}", file, e.getMessage());
            return templates;
        }
        for (JsonNode element : array) {
            try {
                templates.add(codec.decodeTemplate(element));
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping unreadable local template {}: {}", element.path(NodeCodec.ID).asText(), e.getMessage());
            }
        }
        return templates;
    }

    @Override
    public synchronized void saveTemplates(List<HotelTemplate> templates) {
        ArrayNode array = objectMapper.createArrayNode();
        templates.forEach(template -> array.add(codec.encodeTemplate(template)));
        try {
            write(recordPath(TEMPLATES_LIST), objectMapper.writeValueAsBytes(array));
        } catch (IOException e) {
            throw new PersistenceException("Failed to write local template list", e);
        }
    }

    @Override
    public synchronized void upsertSummary(String hotelId, String name) {
        LocalCache.super.upsertSummary(hotelId, name);
    }

    Path recordPath(String key) {
        return dir.resolve(prefix + key + ".json");
    }

    private void write(Path target, byte[] bytes) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.write(tmp, bytes);
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static String encode(String hotelId) {
        return URLEncoder.encode(hotelId, StandardCharsets.UTF_8);
    }
}
