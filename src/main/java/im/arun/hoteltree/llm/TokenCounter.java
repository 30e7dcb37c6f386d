package im.arun.hoteltree.llm;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * Token counting and truncation using JTokkit (Java port of tiktoken), so prompt context can be
 * cut to the model's budget instead of a character count.
 */
public class TokenCounter {
    private final Encoding encoding;

    public TokenCounter() {
        EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
        // cl100k_base covers the chat models this client is used with
        this.encoding = registry.getEncoding(EncodingType.CL100K_BASE);
    }

    public int countTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return encoding.countTokensOrdinary(text);
    }

    /**
     * Cuts {@code text} to at most {@code maxTokens} tokens and appends {@code marker} when it was
     * cut. Text within budget is returned unchanged.
     */
    public String truncate(String text, int maxTokens, String marker) {
        if (text == null || maxTokens <= 0 || countTokens(text) <= maxTokens) {
            return text;
        }
        String head = encoding.decode(encoding.encodeOrdinary(text, maxTokens).getTokens());
        return marker != null ? head + marker : head;
    }
}
