package im.arun.hoteltree.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lenient JSON extraction from model output: strips markdown fences and surrounding prose and
 * repairs trailing commas.
 */
public class JsonResponseParser {
    private static final Logger logger = LoggerFactory.getLogger(JsonResponseParser.class);
    private final ObjectMapper objectMapper;

    public JsonResponseParser() {
        this(new ObjectMapper());
    }

    public JsonResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses the JSON object or array in {@code response}.
     *
     * @return the parsed value, or an empty object when nothing parseable was found
     */
    public JsonNode extractJson(String response) {
        if (response == null || response.trim().isEmpty()) {
            logger.error("Empty response provided to extractJson");
            return objectMapper.createObjectNode();
        }

        String cleaned = getJsonContent(response);
        try {
            return objectMapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            logger.debug("First parse failed ({}), retrying without trailing commas", e.getOriginalMessage());
        }
        String repaired = cleaned.replaceAll(",\\s*]", "]").replaceAll(",\\s*}", "}");
        try {
            return objectMapper.readTree(repaired);
        } catch (JsonProcessingException e) {
            logger.error("Failed to parse JSON from response: {}", e.getOriginalMessage());
            logger.debug("Original response: {}", response);
            return objectMapper.createObjectNode();
        }
    }

    /**
     * Returns the JSON text inside a {@code ```json} fence, or from the first opening brace or
     * bracket to the matching last closing one.
     */
    public String getJsonContent(String response) {
        if (response == null) {
            return "{}";
        }

        String content = response;
        int startIdx = content.indexOf("```json");
        if (startIdx != -1) {
            content = content.substring(startIdx + 7);
        } else if (content.strip().startsWith("```")) {
            content = content.substring(content.indexOf("```") + 3);
        }
        int endIdx = content.lastIndexOf("```");
        if (endIdx != -1) {
            content = content.substring(0, endIdx);
        }

        content = content.strip();
        int open = firstOpening(content);
        if (open > 0) {
            char closing = content.charAt(open) == '{' ? '}' : ']';
            int close = content.lastIndexOf(closing);
            if (close > open) {
                content = content.substring(open, close + 1);
            }
        }
        return content;
    }

    public boolean isValidJson(String json) {
        try {
            objectMapper.readTree(json);
            return true;
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    private static int firstOpening(String text) {
        int brace = text.indexOf('{');
        int bracket = text.indexOf('[');
        if (brace == -1) {
            return bracket;
        }
        if (bracket == -1) {
            return brace;
        }
        return Math.min(brace, bracket);
    }
}
