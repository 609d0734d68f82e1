package im.arun.domtree.config;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import im.arun.domtree.dom.ParseMode;
import im.arun.domtree.tree.TextMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_RESOURCE = "domtree.yaml";

    private final ObjectMapper yamlMapper = YAMLMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();
    private final DomTreeConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private DomTreeConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled defaults
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.info("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), DomTreeConfig.class);
                }
                logger.warn("Config file {} not found, falling back to {}", configPath, DEFAULT_RESOURCE);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, DomTreeConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new DomTreeConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new DomTreeConfig();
        }
    }

    public DomTreeConfig load(Map<String, Object> userOptions) {
        DomTreeConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            try {
                switch (key) {
                    case "block_tags":
                    case "blockTags":
                        config.setBlockTags(parseList(value));
                        break;
                    case "text_mode":
                    case "textMode":
                        config.setTextMode(TextMode.valueOf(value.toString().toUpperCase(Locale.ROOT)));
                        break;
                    case "parse_mode":
                    case "parseMode":
                        config.setParseMode(ParseMode.valueOf(value.toString().toUpperCase(Locale.ROOT)));
                        break;
                    case "json_output":
                    case "jsonOutput":
                        config.setJsonOutput(value.toString());
                        break;
                    case "report_output":
                    case "reportOutput":
                        config.setReportOutput(value.toString());
                        break;
                    case "max_retries":
                    case "maxRetries":
                        config.setMaxRetries(parseInt(value));
                        break;
                    case "retry_delay_ms":
                    case "retryDelayMs":
                        config.setRetryDelayMs(parseInt(value));
                        break;
                    case "proxy":
                        config.setProxy(value.toString());
                        break;
                    case "user_agent":
                    case "userAgent":
                        config.setUserAgent(value.toString());
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (IllegalArgumentException e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
            }
        });

        return config;
    }

    private List<String> parseList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                result.add(item.toString().strip());
            }
        } else {
            Arrays.stream(value.toString().split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .forEach(result::add);
        }
        return result;
    }

    private int parseInt(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString().strip());
    }

    private DomTreeConfig copyConfig(DomTreeConfig source) {
        DomTreeConfig copy = new DomTreeConfig();
        copy.setBlockTags(new ArrayList<>(source.getBlockTags()));
        copy.setTextMode(source.getTextMode());
        copy.setParseMode(source.getParseMode());
        copy.setJsonOutput(source.getJsonOutput());
        copy.setReportOutput(source.getReportOutput());
        copy.setMaxRetries(source.getMaxRetries());
        copy.setRetryDelayMs(source.getRetryDelayMs());
        copy.setProxy(source.getProxy());
        copy.setUserAgent(source.getUserAgent());
        copy.setConnectTimeoutSeconds(source.getConnectTimeoutSeconds());
        copy.setReadTimeoutSeconds(source.getReadTimeoutSeconds());
        return copy;
    }
}
