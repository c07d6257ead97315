package com.raditha.repairgraph.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.raditha.repairgraph.cfg.BlockPolicy;
import com.raditha.repairgraph.ged.BeamWidthPolicy;
import com.raditha.repairgraph.model.GraphKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads analysis configuration from repairgraph.yml with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > repairgraph.yml > preset defaults
 */
public class AnalysisSettings {
    private static final Logger logger = LoggerFactory.getLogger(AnalysisSettings.class);

    public static final String DEFAULT_FILE = "repairgraph.yml";
    private static final String CONFIG_KEY = "repair_graph";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private AnalysisSettings() {
    }

    /**
     * Values given on the command line. Zero or null means not given.
     *
     * @param preset          preset name
     * @param beamWidth       forced beam width
     * @param timeoutSeconds  GED budget in seconds
     * @param kinds           comma separated graph kinds
     */
    public record Overrides(String preset, int beamWidth, int timeoutSeconds, String kinds) {
        public static Overrides none() {
            return new Overrides(null, 0, 0, null);
        }
    }

    /**
     * Load configuration from a YAML file, applying CLI overrides where provided.
     *
     * @param configFile the YAML file; null reads repairgraph.yml from the classpath if present
     * @param cli        command line values
     * @return complete analysis configuration
     * @throws IOException if the file cannot be read or is not valid YAML
     */
    public static AnalysisConfig loadConfig(Path configFile, Overrides cli) throws IOException {
        Map<String, Object> config = configFile != null ? readFile(configFile) : readClasspath();
        return fromMap(config, cli);
    }

    /**
     * Build a configuration from the {@code repair_graph} section of a parsed YAML document.
     */
    public static AnalysisConfig fromMap(Map<String, Object> config, Overrides cli) {
        String preset = cli.preset() != null ? cli.preset() : getString(config, "preset", "default");
        AnalysisConfig base = AnalysisConfig.preset(preset);

        int timeoutSeconds = cli.timeoutSeconds() != 0 ? cli.timeoutSeconds()
                : getInt(config, "ged_timeout_seconds", (int) base.gedTimeout().toSeconds());
        int beamWidth = cli.beamWidth() != 0 ? cli.beamWidth() : getInt(config, "beam_width", base.beamWidth());

        String policyText = getString(config, "beam_width_policy", null);
        BeamWidthPolicy policy = policyText != null ? BeamWidthPolicy.parse(policyText) : base.beamWidthPolicy();

        String blockText = getString(config, "block_policy", null);
        BlockPolicy blockPolicy = blockText != null ? BlockPolicy.fromString(blockText) : base.blockPolicy();

        int threads = getInt(config, "threads", 0);
        Set<GraphKind> kinds = cli.kinds() != null ? parseKinds(Arrays.asList(cli.kinds().split(",")))
                : parseKinds(getListString(config, "kinds"));

        return new AnalysisConfig(
                Duration.ofSeconds(timeoutSeconds),
                policy,
                beamWidth,
                blockPolicy,
                getInt(config, "max_candidates", base.maxCandidates()),
                threads > 0 ? threads : base.threads(),
                Duration.ofSeconds(getInt(config, "instance_timeout_seconds",
                        (int) base.instanceTimeout().toSeconds())),
                getInt(config, "max_scope_files", base.maxScopeFiles()),
                getBoolean(config, "cache_enabled", base.cacheEnabled()),
                kinds.isEmpty() ? base.kinds() : kinds);
    }

    static Set<GraphKind> parseKinds(List<String> names) {
        Set<GraphKind> kinds = EnumSet.noneOf(GraphKind.class);
        for (String name : names) {
            if (!name.isBlank()) {
                kinds.add(GraphKind.fromString(name.trim()));
            }
        }
        return kinds;
    }

    private static Map<String, Object> readFile(Path configFile) throws IOException {
        if (!Files.isRegularFile(configFile)) {
            throw new IOException("Configuration file not found: " + configFile);
        }
        try (InputStream in = Files.newInputStream(configFile)) {
            logger.debug("Reading configuration from {}", configFile);
            return section(YAML.readValue(in, Map.class));
        }
    }

    private static Map<String, Object> readClasspath() throws IOException {
        try (InputStream in = AnalysisSettings.class.getClassLoader().getResourceAsStream(DEFAULT_FILE)) {
            if (in == null) {
                return Map.of();
            }
            return section(YAML.readValue(in, Map.class));
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> document) {
        if (document == null) {
            return Map.of();
        }
        Object section = document.get(CONFIG_KEY);
        if (section instanceof Map) {
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
