package im.arun.hoteltree.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Chat-completion client with retry logic.
 * Talks to any OpenAI-compatible {@code /chat/completions} endpoint.
 */
public class OpenAIClient {
    private static final Logger logger = LoggerFactory.getLogger(OpenAIClient.class);
    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    private static final int DEFAULT_MAX_RETRIES = 5;
    private static final long BASE_BACKOFF_MS = 1000;
    private static final long MAX_BACKOFF_MS = 30000;
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final String apiKey;
    private final String completionsUrl;
    private final int maxRetries;
    private final long baseBackoffMs;
    private final ObjectMapper objectMapper;

    public OpenAIClient(String apiKey) {
        this(apiKey, DEFAULT_BASE_URL, DEFAULT_MAX_RETRIES, BASE_BACKOFF_MS);
    }

    public OpenAIClient(String apiKey, String baseUrl, int maxRetries, long baseBackoffMs) {
        this.apiKey = apiKey != null ? apiKey : System.getenv("CHATGPT_API_KEY");
        if (this.apiKey == null || this.apiKey.isEmpty()) {
            throw new IllegalArgumentException("OpenAI API key must be provided or set in CHATGPT_API_KEY environment variable");
        }
        String base = baseUrl != null ? baseUrl : DEFAULT_BASE_URL;
        this.completionsUrl = (base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + "/chat/completions";
        this.maxRetries = Math.max(1, maxRetries);
        this.baseBackoffMs = baseBackoffMs;

        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(120, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .connectionPool(new ConnectionPool(8, 5, TimeUnit.MINUTES))
                .build();

        this.objectMapper = new ObjectMapper();
    }

    /**
     * Single-turn completion at temperature 0.
     */
    public String chat(String model, String prompt) {
        return complete(model, null, prompt, null, 0.0, false).content;
    }

    /**
     * Single-turn completion that asks the endpoint for a JSON object.
     */
    public String chatJson(String model, String prompt) {
        return complete(model, null, prompt, null, 0.0, true).content;
    }

    /**
     * Conversational completion.
     *
     * @param systemPrompt instructions sent ahead of the history, may be null
     * @param chatHistory  earlier turns as {@code role}/{@code content} maps, may be null
     */
    public String chat(String model, String systemPrompt, String prompt, List<Map<String, String>> chatHistory,
                       double temperature) {
        return complete(model, systemPrompt, prompt, chatHistory, temperature, false).content;
    }

    /**
     * Completion that returns both content and finish reason.
     */
    public ChatResponse complete(String model, String systemPrompt, String prompt,
                                 List<Map<String, String>> chatHistory, double temperature, boolean jsonMode) {
        String requestBody = buildRequestBody(model, systemPrompt, prompt, chatHistory, temperature, jsonMode);

        for (int attempt = 0; attempt < maxRetries; attempt++) {
            try {
                String responseContent = executeRequest(requestBody);

                JsonNode jsonResponse = objectMapper.readTree(responseContent);
                JsonNode choice = jsonResponse.path("choices").path(0);
                if (choice.isMissingNode()) {
                    throw new IOException("Response has no choices: " + responseContent);
                }
                String content = choice.path("message").path("content").asText("");
                String finishReason = choice.path("finish_reason").asText("");

                String status = "length".equals(finishReason) ? "max_output_reached" : "finished";
                return new ChatResponse(content, status);

            } catch (IOException e) {
                logger.error("Chat completion failed (attempt {}/{}): {}", attempt + 1, maxRetries, e.getMessage());
                if (attempt < maxRetries - 1) {
                    try {
                        long backoff = Math.min(baseBackoffMs * (1L << attempt), MAX_BACKOFF_MS);
                        logger.debug("Retrying in {}ms", backoff);
                        Thread.sleep(backoff);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RuntimeException("Interrupted during retry wait", ie);
                    }
                } else {
                    throw new RuntimeException("Max retries reached for chat completion", e);
                }
            }
        }
        throw new RuntimeException("Unexpected: exceeded max retries without throwing exception");
    }

    private String buildRequestBody(String model, String systemPrompt, String prompt,
                                    List<Map<String, String>> chatHistory, double temperature, boolean jsonMode) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("temperature", temperature);

        ArrayNode messages = body.putArray("messages");
        if (systemPrompt != null && !systemPrompt.isEmpty()) {
            messages.addObject().put("role", "system").put("content", systemPrompt);
        }
        if (chatHistory != null) {
            for (Map<String, String> turn : chatHistory) {
                messages.addObject().put("role", turn.get("role")).put("content", turn.get("content"));
            }
        }
        messages.addObject().put("role", "user").put("content", prompt);

        if (jsonMode) {
            body.putObject("response_format").put("type", "json_object");
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize chat request", e);
        }
    }

    private String executeRequest(String jsonBody) throws IOException {
        Request request = new Request.Builder()
                .url(completionsUrl)
                .addHeader("Authorization", "Bearer " + apiKey)
                .addHeader("Content-Type", "application/json")
                .post(RequestBody.create(jsonBody, JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                String errorBody = response.body() != null ? response.body().string() : "No error body";
                throw new IOException("Chat completion error (HTTP " + response.code() + "): " + errorBody);
            }

            return response.body() != null ? response.body().string() : "";
        }
    }

    /**
     * Response object containing both content and finish reason.
     */
    public static class ChatResponse {
        public final String content;
        public final String finishReason;

        public ChatResponse(String content, String finishReason) {
            this.content = content;
            this.finishReason = finishReason;
        }
    }
}
