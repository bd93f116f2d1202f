package com.raditha.cogent.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Loads {@link AnalysisConfig} from {@code cogent.yml} with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > cogent.yml > preset > defaults. The YAML
 * file holds its settings under a {@code complexity} key.
 */
public class CogentSettings {

    private static final Logger logger = LoggerFactory.getLogger(CogentSettings.class);

    static final String CONFIG_KEY = "complexity";
    static final String DEFAULT_RESOURCE = "cogent.yml";

    private CogentSettings() {
    }

    /**
     * Load configuration.
     *
     * @param configFile       YAML file to read, or null for the classpath default
     * @param maxCyclomaticCLI CLI cyclomatic limit (0 = use YAML/default)
     * @param maxCognitiveCLI  CLI cognitive limit (0 = use YAML/default)
     * @param presetCLI        CLI preset name (null = use YAML/default)
     * @param noExtractionCLI  true when the CLI switched extraction off
     * @throws IOException if an explicitly named file cannot be read
     */
    public static AnalysisConfig loadConfig(@Nullable Path configFile, int maxCyclomaticCLI, int maxCognitiveCLI,
                                            @Nullable String presetCLI, boolean noExtractionCLI) throws IOException {
        Map<String, Object> config = section(readYaml(configFile));
        return fromMap(config, maxCyclomaticCLI, maxCognitiveCLI, presetCLI, noExtractionCLI);
    }

    static AnalysisConfig fromMap(Map<String, Object> config, int maxCyclomaticCLI, int maxCognitiveCLI,
                                  @Nullable String presetCLI, boolean noExtractionCLI) {
        String preset = presetCLI != null ? presetCLI : getString(config, "preset", "moderate");
        AnalysisConfig base = AnalysisConfig.preset(preset);

        int maxCyclomatic = maxCyclomaticCLI != 0 ? maxCyclomaticCLI
                : getInt(config, "max_cyclomatic", base.maxCyclomatic());
        int maxCognitive = maxCognitiveCLI != 0 ? maxCognitiveCLI
                : getInt(config, "max_cognitive", base.maxCognitive());
        boolean extraction = !noExtractionCLI && getBoolean(config, "enable_extraction", base.enableExtraction());

        return new AnalysisConfig(
                maxCyclomatic,
                maxCognitive,
                extraction,
                getDouble(config, "extraction_multiplier", base.extractionMultiplier()),
                getInt(config, "min_extraction_percentage", base.minExtractionPercentage()),
                getInt(config, "nesting_tip_threshold", base.nestingTipThreshold()),
                getInt(config, "else_if_chain_threshold", base.elseIfChainThreshold()),
                getInt(config, "logical_operator_threshold", base.logicalOperatorThreshold()),
                getListString(config, "exclude_patterns"));
    }

    static Object readYaml(@Nullable Path configFile) throws IOException {
        if (configFile != null) {
            logger.debug("Reading configuration from {}", configFile);
            try (InputStream in = Files.newInputStream(configFile)) {
                return new Yaml().load(in);
            }
        }
        try (InputStream in = CogentSettings.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                logger.debug("No {} on the classpath, using defaults", DEFAULT_RESOURCE);
                return Map.of();
            }
            return new Yaml().load(in);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(@Nullable Object yaml) {
        if (yaml instanceof Map<?, ?> root && root.get(CONFIG_KEY) instanceof Map<?, ?> section) {
            return (Map<String, Object>) section;
        }
        return Map.of();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    @SuppressWarnings("unchecked")
    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List) {
            return (List<String>) value;
        }
        return List.of();
    }
}
