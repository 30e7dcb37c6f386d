package im.arun.hoteltree.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Loads {@link HotelTreeConfig} from YAML: an explicit file first, then {@code config.yaml} on the
 * classpath, then built-in defaults. Secrets missing from the file are taken from
 * {@code FIRESTORE_API_KEY} and {@code CHATGPT_API_KEY}.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final HotelTreeConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this(configPath, System::getenv);
    }

    ConfigLoader(String configPath, UnaryOperator<String> environment) {
        this.defaultConfig = loadDefaultConfig(configPath);
        if (defaultConfig.getApiKey() == null) {
            defaultConfig.setApiKey(environment.apply("FIRESTORE_API_KEY"));
        }
        if (defaultConfig.getLlmApiKey() == null) {
            defaultConfig.setLlmApiKey(environment.apply("CHATGPT_API_KEY"));
        }
    }

    private HotelTreeConfig loadDefaultConfig(String configPath) {
        try {
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.info("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), HotelTreeConfig.class);
                }
                logger.warn("Config file {} does not exist, falling back to classpath config.yaml", path);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream("config.yaml")) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, HotelTreeConfig.class);
                }
            }

            logger.warn("No config.yaml found, using default configuration");
            return new HotelTreeConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new HotelTreeConfig();
        }
    }

    /**
     * Returns a copy of the loaded configuration with {@code userOptions} merged over it key by key.
     * Unknown keys and values of the wrong type are logged and ignored.
     */
    public HotelTreeConfig load(Map<String, Object> userOptions) {
        HotelTreeConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            try {
                switch (key) {
                    case "projectId":
                        config.setProjectId(value.toString());
                        break;
                    case "databaseId":
                        config.setDatabaseId(value.toString());
                        break;
                    case "apiKey":
                        config.setApiKey(value.toString());
                        break;
                    case "accessToken":
                        config.setAccessToken(value.toString());
                        break;
                    case "firestoreBaseUrl":
                        config.setFirestoreBaseUrl(value.toString());
                        break;
                    case "hotelsCollection":
                        config.setHotelsCollection(value.toString());
                        break;
                    case "shardCollection":
                        config.setShardCollection(value.toString());
                        break;
                    case "templatesCollection":
                        config.setTemplatesCollection(value.toString());
                        break;
                    case "cacheDir":
                        config.setCacheDir(value.toString());
                        break;
                    case "cacheKeyPrefix":
                        config.setCacheKeyPrefix(value.toString());
                        break;
                    case "debounceMillis":
                        config.setDebounceMillis(parseLong(value));
                        break;
                    case "savedHoldMillis":
                        config.setSavedHoldMillis(parseLong(value));
                        break;
                    case "model":
                        config.setModel(value.toString());
                        break;
                    case "llmBaseUrl":
                        config.setLlmBaseUrl(value.toString());
                        break;
                    case "llmApiKey":
                        config.setLlmApiKey(value.toString());
                        break;
                    case "maxContextTokens":
                        config.setMaxContextTokens((int) parseLong(value));
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (NumberFormatException e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
            }
        });

        return config;
    }

    private long parseLong(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return Long.parseLong(value.toString().trim());
    }

    private HotelTreeConfig copyConfig(HotelTreeConfig source) {
        return yamlMapper.convertValue(source, HotelTreeConfig.class);
    }
}
