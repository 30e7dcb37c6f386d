package im.arun.hoteltree.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class HotelTreeConfig {
    private String projectId;
    private String databaseId = "(default)";
    private String apiKey;
    private String accessToken;
    private String firestoreBaseUrl = "https://firestore.googleapis.com/v1";
    private String hotelsCollection = "hotels";
    private String shardCollection = "nodes";
    private String templatesCollection = "templates";
    private String cacheDir = System.getProperty("user.home") + "/.hoteltree";
    private String cacheKeyPrefix = "cms_";
    private long debounceMillis = 2000;
    private long savedHoldMillis = 3000;
    private String model = "gpt-4o-2024-11-20";
    private String llmBaseUrl = "https://api.openai.com/v1";
    private String llmApiKey;
    private int maxContextTokens = 30000;
}
