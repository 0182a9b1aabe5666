package com.raditha.mdr.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads mining configuration from the {@code data_record_miner} section of a
 * YAML file.
 * <p>
 * Configuration priority: explicit overrides > YAML > defaults.
 * A shared {@code threshold} key sets all three thresholds; specific keys win
 * over it.
 */
public class MiningSettings {

    private static final Logger logger = LoggerFactory.getLogger(MiningSettings.class);

    static final String CONFIG_KEY = "data_record_miner";
    static final String DEFAULT_RESOURCE = "data-record-miner.yml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private MiningSettings() {
    }

    /**
     * Load configuration from {@value #DEFAULT_RESOURCE} on the classpath, or
     * the defaults if the resource is missing.
     */
    public static MiningConfig loadDefault() {
        try (InputStream in = MiningSettings.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                logger.debug("{} not found on classpath, using defaults", DEFAULT_RESOURCE);
                return MiningConfig.defaults();
            }
            return loadConfig(in);
        } catch (IOException e) {
            throw new MiningConfigurationException("Cannot read " + DEFAULT_RESOURCE, e);
        }
    }

    public static MiningConfig loadConfig(Path yamlFile) {
        return loadConfig(yamlFile, null, null);
    }

    /**
     * Load configuration from a file, applying caller overrides where provided.
     *
     * @param yamlFile          YAML file holding a {@code data_record_miner} section
     * @param maxWindowOverride window size (null = use YAML/default)
     * @param thresholdOverride value for all three thresholds (null = use YAML/default)
     * @return Complete mining configuration
     */
    public static MiningConfig loadConfig(Path yamlFile, Integer maxWindowOverride, Double thresholdOverride) {
        try (InputStream in = Files.newInputStream(yamlFile)) {
            return loadConfig(readDocument(in), maxWindowOverride, thresholdOverride);
        } catch (IOException e) {
            throw new MiningConfigurationException("Cannot read " + yamlFile, e);
        }
    }

    public static MiningConfig loadConfig(InputStream yaml) {
        return loadConfig(readDocument(yaml), null, null);
    }

    private static Map<String, Object> readDocument(InputStream yaml) {
        Map<String, Object> document;
        try {
            document = YAML.readValue(yaml, new TypeReference<Map<String, Object>>() {
            });
        } catch (IOException e) {
            throw new MiningConfigurationException("Invalid YAML configuration", e);
        }
        return document == null ? Map.of() : document;
    }

    /**
     * Build configuration from an already parsed YAML document.
     * Missing keys fall back to the defaults.
     */
    public static MiningConfig loadConfig(Map<String, Object> document) {
        return loadConfig(document, null, null);
    }

    /**
     * Build configuration from a parsed document with caller overrides.
     * A threshold override replaces the shared and the specific threshold keys.
     */
    public static MiningConfig loadConfig(Map<String, Object> document,
                                          Integer maxWindowOverride, Double thresholdOverride) {
        Object section = document.get(CONFIG_KEY);

        @SuppressWarnings("unchecked")
        Map<String, Object> config = section instanceof Map ? (Map<String, Object>) section : Map.of();

        int maxWindow = maxWindowOverride != null
                ? maxWindowOverride
                : getInt(config, "max_window", MiningConfig.DEFAULT_MAX_WINDOW);

        if (thresholdOverride != null) {
            return new MiningConfig(maxWindow, thresholdOverride, thresholdOverride, thresholdOverride,
                    getInt(config, "minimum_depth", MiningConfig.DEFAULT_MINIMUM_DEPTH));
        }

        double threshold = getDouble(config, "threshold", MiningConfig.DEFAULT_THRESHOLD);

        return new MiningConfig(
                maxWindow,
                getDouble(config, "region_threshold", threshold),
                getDouble(config, "record_threshold_1", threshold),
                getDouble(config, "record_threshold_n", threshold),
                getInt(config, "minimum_depth", MiningConfig.DEFAULT_MINIMUM_DEPTH));
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            double number = ((Number) value).doubleValue();
            if (number == Math.rint(number) && number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE) {
                return (int) number;
            }
        }
        throw new IllegalArgumentException(key + " must be an integer (got " + value + ")");
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw new IllegalArgumentException(key + " must be a number (got " + value + ")");
    }
}
