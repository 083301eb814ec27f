package im.arun.treequery.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String RESOURCE_NAME = "treequery.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final TreeQueryConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private TreeQueryConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled resource
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.info("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), TreeQueryConfig.class);
                }
                logger.warn("Config file {} not found", path);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, TreeQueryConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", RESOURCE_NAME);
            return new TreeQueryConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new TreeQueryConfig();
        }
    }

    public TreeQueryConfig load() {
        return load(null);
    }

    public TreeQueryConfig load(Map<String, Object> userOptions) {
        TreeQueryConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        // Merge user options into config
        userOptions.forEach((key, value) -> {
            try {
                switch (key) {
                    case "view_indent":
                    case "viewIndent":
                        if (value instanceof Integer) config.setViewIndent((Integer) value);
                        break;
                    case "branch_marker":
                    case "branchMarker":
                        if (value instanceof String) config.setBranchMarker((String) value);
                        break;
                    case "agreeing_phrases":
                    case "agreeingPhrases":
                        config.setAgreeingPhrases(parseList(value));
                        break;
                    case "detachable_phrases":
                    case "detachablePhrases":
                        config.setDetachablePhrases(parseList(value));
                        break;
                    case "declinable_categories":
                    case "declinableCategories":
                        config.setDeclinableCategories(parseList(value));
                        break;
                    case "demonstrative_lemmas":
                    case "demonstrativeLemmas":
                        config.setDemonstrativeLemmas(parseList(value));
                        break;
                    case "lexicon_path":
                    case "lexiconPath":
                        if (value instanceof String) config.setLexiconPath((String) value);
                        break;
                    case "worker_threads":
                    case "workerThreads":
                        if (value instanceof Integer) config.setWorkerThreads((Integer) value);
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

    private List<String> parseList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                result.add(String.valueOf(item).trim());
            }
        } else if (value instanceof String) {
            for (String item : ((String) value).split(",")) {
                if (!item.isBlank()) {
                    result.add(item.trim());
                }
            }
        } else {
            throw new IllegalArgumentException("Expected a list or a comma-separated string, got " + value);
        }
        return result;
    }

    private TreeQueryConfig copyConfig(TreeQueryConfig source) {
        TreeQueryConfig copy = new TreeQueryConfig();
        copy.setViewIndent(source.getViewIndent());
        copy.setBranchMarker(source.getBranchMarker());
        copy.setAgreeingPhrases(new ArrayList<>(source.getAgreeingPhrases()));
        copy.setDetachablePhrases(new ArrayList<>(source.getDetachablePhrases()));
        copy.setDeclinableCategories(new ArrayList<>(source.getDeclinableCategories()));
        copy.setDemonstrativeLemmas(new ArrayList<>(source.getDemonstrativeLemmas()));
        copy.setLexiconPath(source.getLexiconPath());
        copy.setWorkerThreads(source.getWorkerThreads());
        return copy;
    }
}
