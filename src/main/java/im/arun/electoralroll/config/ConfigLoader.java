package im.arun.electoralroll.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import im.arun.electoralroll.ocr.RecognitionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads {@link ElectoralRollConfig} from YAML and merges command-line overrides on top.
 * An explicit file path wins over the classpath {@code config.yaml}; with neither, built-in defaults apply.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final ElectoralRollConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private ElectoralRollConfig loadDefaultConfig(String configPath) {
        try {
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.info("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), ElectoralRollConfig.class);
                }
                logger.warn("Configuration file {} not found, falling back to classpath", configPath);
            }

            InputStream resourceStream = getClass().getClassLoader().getResourceAsStream("config.yaml");
            if (resourceStream != null) {
                try (InputStream in = resourceStream) {
                    return yamlMapper.readValue(in, ElectoralRollConfig.class);
                }
            }

            logger.warn("No config.yaml found, using default configuration");
            return new ElectoralRollConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new ElectoralRollConfig();
        }
    }

    public ElectoralRollConfig load(Map<String, Object> userOptions) {
        ElectoralRollConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            try {
                switch (key) {
                    case "dpi":
                        config.setDpi(parseInt(value));
                        break;
                    case "worker_count":
                    case "workerCount":
                        config.setWorkerCount(parseInt(value));
                        break;
                    case "debug_enabled":
                    case "debugEnabled":
                        config.setDebugEnabled(parseBoolean(value));
                        break;
                    case "debug_dir":
                    case "debugDir":
                        config.setDebugDir(value.toString());
                        break;
                    case "language":
                        config.setLanguage(value.toString());
                        break;
                    case "tessdata_path":
                    case "tessdataPath":
                        config.setTessdataPath(value.toString());
                        break;
                    case "minimum_width":
                    case "minimumWidth":
                        config.setMinimumWidth(parseInt(value));
                        break;
                    case "metadata_pages":
                    case "metadataPages":
                        config.setMetadataPages(parseInt(value));
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (Exception e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
            }
        });

        return config;
    }

    private int parseInt(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString().trim());
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private ElectoralRollConfig copyConfig(ElectoralRollConfig source) {
        ElectoralRollConfig copy = new ElectoralRollConfig();
        copy.setDpi(source.getDpi());
        copy.setWorkerCount(source.getWorkerCount());
        copy.setDebugEnabled(source.isDebugEnabled());
        copy.setDebugDir(source.getDebugDir());
        copy.setLanguage(source.getLanguage());
        copy.setTessdataPath(source.getTessdataPath());
        copy.setOcrEngineMode(source.getOcrEngineMode());
        copy.setMinimumWidth(source.getMinimumWidth());
        copy.setContrastFactor(source.getContrastFactor());
        copy.setSharpnessFactor(source.getSharpnessFactor());
        copy.setMetadataPages(source.getMetadataPages());
        List<RecognitionStrategy> strategies = new ArrayList<>();
        for (RecognitionStrategy strategy : source.getStrategies()) {
            strategies.add(strategy.copy());
        }
        copy.setStrategies(strategies);
        copy.setDigitSubstitutions(new LinkedHashMap<>(source.getDigitSubstitutions()));
        copy.setLabelCorrections(new LinkedHashMap<>(source.getLabelCorrections()));
        return copy;
    }
}
