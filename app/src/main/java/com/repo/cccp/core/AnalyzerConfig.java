package com.repo.cccp.core;

import com.repo.cccp.metrics.AlgorithmVariant;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Configuration for plan depth / plan index analysis.
 * Loaded from cccp.yaml in the analyzed root or uses sensible defaults.
 */
public class AnalyzerConfig {

    public static final String FILE_NAME = "cccp.yaml";

    private AlgorithmVariant variant = AlgorithmVariant.CANONICAL;
    private UnitMode unitMode = UnitMode.MODULE;

    // Wrapped copies of scripts are generated and would be scored twice
    private Set<String> exclusions = Set.of("**/wrapped_*", "**/__pycache__/**");

    private String pythonCommand = "python3";
    private int pythonTimeoutSeconds = 30;

    /**
     * Load configuration from {@value #FILE_NAME} in {@code root} or return defaults.
     */
    public static AnalyzerConfig load(Path root) {
        Path configFile = root.resolve(FILE_NAME);
        if (Files.exists(configFile)) {
            return loadFile(configFile);
        }
        return new AnalyzerConfig();
    }

    /**
     * Load configuration from an explicit YAML file. Missing, unreadable or
     * syntactically broken files fall back to defaults with a warning.
     */
    public static AnalyzerConfig loadFile(Path configFile) {
        AnalyzerConfig config = new AnalyzerConfig();
        try (InputStream is = Files.newInputStream(configFile)) {
            Yaml yaml = new Yaml();
            Object data = yaml.load(is);
            if (data instanceof Map<?, ?> map) {
                config.parseYaml(asStringMap(map));
            }
            System.out.println("Loaded configuration from: " + configFile);
        } catch (IOException | YAMLException e) {
            System.err.println("Warning: Could not read config file, using defaults: " + e.getMessage());
        }
        return config;
    }

    /**
     * Default configuration.
     */
    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig();
    }

    private void parseYaml(Map<String, Object> data) {
        if (data.get("variant") instanceof String name) {
            variant = AlgorithmVariant.fromName(name);
        }
        if (data.get("units") instanceof String mode) {
            unitMode = UnitMode.fromName(mode);
        }

        if (data.get("exclusions") instanceof List<?> excList && !excList.isEmpty()) {
            Set<String> parsed = new LinkedHashSet<>();
            for (Object o : excList) {
                parsed.add(String.valueOf(o));
            }
            exclusions = parsed;
        }

        if (data.get("python") instanceof Map<?, ?> python) {
            Map<String, Object> py = asStringMap(python);
            if (py.get("command") instanceof String command && !command.isBlank()) {
                pythonCommand = command;
            }
            pythonTimeoutSeconds = getInt(py, "timeout_seconds", pythonTimeoutSeconds);
        }
    }

    private static Map<String, Object> asStringMap(Map<?, ?> map) {
        Map<String, Object> result = new HashMap<>();
        map.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    private int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).intValue();
        return defaultVal;
    }

    // === Getters ===

    public AlgorithmVariant getVariant() {
        return variant;
    }

    public UnitMode getUnitMode() {
        return unitMode;
    }

    public Set<String> getExclusions() {
        return exclusions;
    }

    public String getPythonCommand() {
        return pythonCommand;
    }

    public int getPythonTimeoutSeconds() {
        return pythonTimeoutSeconds;
    }

    public boolean shouldExclude(Path path) {
        String pathStr = path.toString().replace('\\', '/');
        for (String pattern : exclusions) {
            if (matchesGlob(pathStr, pattern)) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesGlob(String path, String glob) {
        String regex = glob
                .replace(".", "\\.")
                .replace("**", "<<<DOUBLESTAR>>>")
                .replace("*", "[^/]*")
                .replace("<<<DOUBLESTAR>>>", ".*");
        return path.matches(".*" + regex + ".*");
    }

    // === Overrides from the command line ===

    public AnalyzerConfig withVariant(AlgorithmVariant variant) {
        this.variant = variant;
        return this;
    }

    public AnalyzerConfig withUnitMode(UnitMode unitMode) {
        this.unitMode = unitMode;
        return this;
    }
}
