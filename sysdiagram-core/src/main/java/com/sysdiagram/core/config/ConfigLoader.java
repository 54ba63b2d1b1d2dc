package com.sysdiagram.core.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

/**
 * Loads SysDiagram configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code sysdiagram.yaml} into {@link ProjectConfig} records.
 * If the file is missing, unreadable, empty or invalid, a warning is logged and
 * {@link ProjectConfig#defaults()} is returned. Enum values are matched case-insensitively.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProjectConfig config = ConfigLoader.load(Paths.get("sysdiagram.yaml"));
 * ModelParser parser = new ModelParser(config.scopePolicy());
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /** Conventional configuration file name */
    public static final String DEFAULT_FILE_NAME = "sysdiagram.yaml";

    private static final ObjectMapper YAML_MAPPER = YAMLMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .build();

    private ConfigLoader() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Loads configuration from a YAML file, falling back to {@link ProjectConfig#defaults()}.
     *
     * @param configPath path to {@code sysdiagram.yaml}, may be null
     * @return loaded configuration or defaults if unavailable
     */
    public static ProjectConfig load(Path configPath) {
        if (configPath == null) {
            return fallback("no configuration path given");
        }
        if (Files.notExists(configPath)) {
            return fallback(configPath + " does not exist");
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            return fallback(configPath + " is not a readable file");
        }

        ProjectConfig config;
        try {
            config = YAML_MAPPER.readValue(configPath.toFile(), ProjectConfig.class);
        } catch (IOException e) {
            log.error("Invalid configuration in {}: {}", configPath, e.getMessage());
            return ProjectConfig.defaults();
        }
        if (config == null) {
            return fallback(configPath + " is empty");
        }
        log.info("Using configuration {} (policy {})", configPath, config.scopePolicy());
        return config;
    }

    private static ProjectConfig fallback(String reason) {
        log.warn("Default configuration in effect: {}", reason);
        return ProjectConfig.defaults();
    }
}
