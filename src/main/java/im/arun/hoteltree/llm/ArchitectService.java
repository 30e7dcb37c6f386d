package im.arun.hoteltree.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.hoteltree.model.ArchitectResponse;
import im.arun.hoteltree.model.ContentNode;
import im.arun.hoteltree.tree.TreeExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * AI features over a hotel tree: free-text analysis, structure audit, guest chat and proposing
 * structural edits. Context sent to the model is cut to a token budget.
 */
public class ArchitectService {
    private static final Logger logger = LoggerFactory.getLogger(ArchitectService.class);
    private static final String TRUNCATED = "\n...[Data Truncated]...";
    private static final double CHAT_TEMPERATURE = 0.7;

    private final OpenAIClient client;
    private final PromptBuilder promptBuilder;
    private final JsonResponseParser parser;
    private final TokenCounter tokenCounter;
    private final TreeExporter exporter;
    private final ObjectMapper objectMapper;
    private final String model;
    private final int maxContextTokens;
    private final Clock clock;

    public ArchitectService(OpenAIClient client, TreeExporter exporter, String model, int maxContextTokens) {
        this(client, exporter, model, maxContextTokens, Clock.systemDefaultZone());
    }

    public ArchitectService(OpenAIClient client, TreeExporter exporter, String model, int maxContextTokens, Clock clock) {
        this.client = client;
        this.exporter = exporter;
        this.model = model;
        this.maxContextTokens = maxContextTokens;
        this.clock = clock;
        this.promptBuilder = new PromptBuilder();
        this.parser = new JsonResponseParser();
        this.tokenCounter = new TokenCounter();
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String analyze(ContentNode root) {
        String context = tokenCounter.truncate(exporter.toAiText(root), maxContextTokens, TRUNCATED);
        logger.info("Analyzing hotel {} ({} context tokens)", root.getId(), tokenCounter.countTokens(context));
        return client.chat(model, promptBuilder.buildAnalysisPrompt(context));
    }

    public String audit(ContentNode root) {
        String context = tokenCounter.truncate(prettyJson(exporter.toCleanJson(root)), maxContextTokens, TRUNCATED);
        return client.chat(model, promptBuilder.buildAuditPrompt(context));
    }

    /**
     * Answers a guest question from the hotel data.
     *
     * @param history earlier turns as {@code role}/{@code content} maps
     */
    public String chat(ContentNode root, String message, List<Map<String, String>> history) {
        String context = tokenCounter.truncate(exporter.toAiText(root), maxContextTokens, TRUNCATED);
        String system = promptBuilder.buildChatSystemPrompt(context, LocalDateTime.now(clock));
        return client.chat(model, system, message, history, CHAT_TEMPERATURE);
    }

    /**
     * Asks the model for structural actions that carry out {@code command}. The actions are not
     * applied here.
     *
     * @return the proposal; a response that cannot be parsed yields no actions
     */
    public ArchitectResponse proposeActions(ContentNode root, String command) {
        String context = tokenCounter.truncate(prettyJson(exporter.toArchitectJson(root)), maxContextTokens, TRUNCATED);
        String raw = client.chatJson(model, promptBuilder.buildArchitectPrompt(command, context));

        JsonNode json = parser.extractJson(raw);
        ArchitectResponse response;
        try {
            response = json.isObject() && json.size() > 0
                    ? objectMapper.treeToValue(json, ArchitectResponse.class)
                    : null;
        } catch (JsonProcessingException e) {
            logger.error("Architect response does not match the expected schema: {}", e.getOriginalMessage());
            response = null;
        }
        if (response == null) {
            return new ArchitectResponse("Error parsing AI response.", new ArrayList<>());
        }
        if (response.getActions() == null) {
            response.setActions(new ArrayList<>());
        }
        logger.info("Architect proposed {} actions for '{}'", response.getActions().size(), command);
        return response;
    }

    private String prettyJson(JsonNode json) {
        try {
            return objectMapper.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render tree as JSON", e);
        }
    }
}
