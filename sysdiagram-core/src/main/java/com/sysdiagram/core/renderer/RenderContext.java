package com.sysdiagram.core.renderer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;

/**
 * Where generated diagrams go and which renderer flags apply.
 *
 * <p>Flags are plain strings keyed by renderer, such as {@code filesystem.overwrite} or
 * {@code console.separator}. An absent flag means the renderer's default.
 *
 * @param outputDirectory directory that relative file paths are resolved against
 * @param settings renderer flags
 */
public record RenderContext(
    String outputDirectory,
    Map<String, String> settings
) {
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    /**
     * Creates a context without flags.
     *
     * @param outputDirectory output directory
     * @return context
     */
    public static RenderContext of(String outputDirectory) {
        return new RenderContext(outputDirectory, Map.of());
    }

    /**
     * @return the output directory as a path
     */
    public Path outputPath() {
        return Paths.get(outputDirectory);
    }

    /**
     * @param key flag name
     * @return flag value, or null when absent
     */
    public String getSetting(String key) {
        return settings.get(key);
    }

    /**
     * @param key flag name
     * @param defaultValue value used when the flag is absent
     * @return flag value or the default
     */
    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }

    /**
     * Reads a boolean flag. Anything other than {@code true} (ignoring case) is false.
     *
     * @param key flag name
     * @param defaultValue value used when the flag is absent
     * @return flag value or the default
     */
    public boolean isEnabled(String key, boolean defaultValue) {
        String value = settings.get(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.strip());
    }
}
