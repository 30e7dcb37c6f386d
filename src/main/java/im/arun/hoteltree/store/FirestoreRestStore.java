package im.arun.hoteltree.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.ConnectionPool;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link DocumentStore} backed by the Cloud Firestore REST API (v1).
 * <p>
 * Reads use {@code GET} on documents and collections (paged with {@code pageToken}); batches are
 * sent as a single {@code documents:commit} call, which Firestore applies atomically. A batch holds
 * at most {@value #MAX_WRITES_PER_COMMIT} writes; larger ones fail before anything is sent.
 */
public class FirestoreRestStore implements DocumentStore {
    private static final Logger logger = LoggerFactory.getLogger(FirestoreRestStore.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int PAGE_SIZE = 300;
    /** Firestore rejects commits with more writes than this. */
    public static final int MAX_WRITES_PER_COMMIT = 500;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final FirestoreValueCodec valueCodec;
    private final HttpUrl baseUrl;
    private final String documentsPath;
    private final String apiKey;
    private final String accessToken;

    /**
     * @param baseUrl     API root, normally {@code https://firestore.googleapis.com/v1}
     * @param projectId   Google Cloud project id
     * @param databaseId  database id, {@code (default)} for the default database
     * @param apiKey      web API key sent as {@code key} query parameter, may be null
     * @param accessToken OAuth bearer token, may be null
     */
    public FirestoreRestStore(String baseUrl, String projectId, String databaseId, String apiKey, String accessToken) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("Firestore project id must be provided");
        }
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid Firestore base URL: " + baseUrl);
        }
        this.baseUrl = parsed;
        this.documentsPath = "projects/" + projectId + "/databases/" + databaseId + "/documents";
        this.apiKey = apiKey;
        this.accessToken = accessToken;
        this.objectMapper = new ObjectMapper();
        this.valueCodec = new FirestoreValueCodec();
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .connectionPool(new ConnectionPool(8, 5, TimeUnit.MINUTES))
                .build();
    }

    @Override
    public Optional<ObjectNode> get(String collectionPath, String documentId) throws RemoteStoreException {
        HttpUrl url = url(documentsPath + "/" + collectionPath + "/" + documentId).build();
        Request request = authorized(new Request.Builder().url(url).get()).build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() == 404) {
                return Optional.empty();
            }
            JsonNode document = readBody(response, "get " + collectionPath + "/" + documentId);
            return Optional.of(valueCodec.decodeFields(document.get("fields")));
        } catch (IOException e) {
            throw new RemoteStoreException("Failed to read " + collectionPath + "/" + documentId, e);
        }
    }

    @Override
    public List<StoredDocument> list(String collectionPath) throws RemoteStoreException {
        return list(collectionPath, null);
    }

    @Override
    public List<StoredDocument> list(String collectionPath, List<String> fieldMask) throws RemoteStoreException {
        List<StoredDocument> documents = new ArrayList<>();
        String pageToken = null;
        do {
            HttpUrl.Builder url = url(documentsPath + "/" + collectionPath)
                    .addQueryParameter("pageSize", String.valueOf(PAGE_SIZE));
            if (fieldMask != null) {
                fieldMask.forEach(path -> url.addQueryParameter("mask.fieldPaths", path));
            }
            if (pageToken != null) {
                url.addQueryParameter("pageToken", pageToken);
            }
            Request request = authorized(new Request.Builder().url(url.build()).get()).build();

            try (Response response = httpClient.newCall(request).execute()) {
                JsonNode page = readBody(response, "list " + collectionPath);
                for (JsonNode document : page.path("documents")) {
                    String name = document.path("name").asText();
                    documents.add(new StoredDocument(name.substring(name.lastIndexOf('/') + 1),
                            valueCodec.decodeFields(document.get("fields"))));
                }
                pageToken = page.hasNonNull("nextPageToken") ? page.get("nextPageToken").asText() : null;
            } catch (IOException e) {
                throw new RemoteStoreException("Failed to list " + collectionPath, e);
            }
        } while (pageToken != null && !pageToken.isEmpty());

        logger.debug("Listed {} documents under {}", documents.size(), collectionPath);
        return documents;
    }

    @Override
    public List<String> listIds(String collectionPath) throws RemoteStoreException {
        List<String> ids = new ArrayList<>();
        for (StoredDocument document : list(collectionPath, List.of("id"))) {
            ids.add(document.getId());
        }
        return ids;
    }

    @Override
    public WriteBatch batch() {
        return new CommitBatch();
    }

    private void commit(ArrayNode writes) throws RemoteStoreException {
        ObjectNode body = objectMapper.createObjectNode();
        body.set("writes", writes);

        HttpUrl url = url(documentsPath + ":commit").build();
        Request request;
        try {
            request = authorized(new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON))).build();
        } catch (IOException e) {
            throw new RemoteStoreException("Failed to serialize commit request", e);
        }

        try (Response response = httpClient.newCall(request).execute()) {
            readBody(response, "commit of " + writes.size() + " writes");
        } catch (IOException e) {
            throw new RemoteStoreException("Failed to commit " + writes.size() + " writes", e);
        }
    }

    private JsonNode readBody(Response response, String operation) throws IOException, RemoteStoreException {
        String body = response.body() != null ? response.body().string() : "";
        if (!response.isSuccessful()) {
            throw new RemoteStoreException("Firestore " + operation + " failed (HTTP " + response.code() + "): "
                    + body, response.code());
        }
        if (body.isEmpty()) {
            return objectMapper.createObjectNode();
        }
        return objectMapper.readTree(body);
    }

    private HttpUrl.Builder url(String path) {
        HttpUrl.Builder builder = baseUrl.newBuilder().addPathSegments(path);
        if (apiKey != null && !apiKey.isEmpty()) {
            builder.addQueryParameter("key", apiKey);
        }
        return builder;
    }

    private Request.Builder authorized(Request.Builder builder) {
        if (accessToken != null && !accessToken.isEmpty()) {
            builder.addHeader("Authorization", "Bearer " + accessToken);
        }
        return builder;
    }

    private String resourceName(String collectionPath, String documentId) {
        return documentsPath + "/" + collectionPath + "/" + documentId;
    }

    private class CommitBatch implements WriteBatch {
        private final ArrayNode writes = objectMapper.createArrayNode();

        @Override
        public WriteBatch set(String collectionPath, String documentId, ObjectNode fields) {
            ObjectNode update = writes.addObject().putObject("update");
            update.put("name", resourceName(collectionPath, documentId));
            update.set("fields", valueCodec.encodeFields(fields));
            return this;
        }

        @Override
        public WriteBatch delete(String collectionPath, String documentId) {
            writes.addObject().put("delete", resourceName(collectionPath, documentId));
            return this;
        }

        @Override
        public int size() {
            return writes.size();
        }

        @Override
        public void commit() throws RemoteStoreException {
            if (writes.isEmpty()) {
                return;
            }
            if (writes.size() > MAX_WRITES_PER_COMMIT) {
                throw new RemoteStoreException("Batch of " + writes.size() + " writes exceeds the Firestore limit of "
                        + MAX_WRITES_PER_COMMIT + " writes per commit", -1);
            }
            FirestoreRestStore.this.commit(writes);
        }
    }
}
