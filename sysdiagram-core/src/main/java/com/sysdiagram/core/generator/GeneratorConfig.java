package com.sysdiagram.core.generator;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration for diagram generation.
 *
 * <p>Generators read their tunables from {@code customSettings}, keyed by
 * {@code <generator-id>.<setting>}. Unset keys fall back to each generator's defaults.
 *
 * @param customSettings generator-specific settings
 */
public record GeneratorConfig(
    Map<String, Object> customSettings
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        customSettings = customSettings == null
            ? Map.of()
            : Collections.unmodifiableMap(new HashMap<>(customSettings));
    }

    /**
     * Creates a default configuration.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(Map.of());
    }

    /**
     * Returns a copy of this configuration with one setting replaced.
     *
     * @param key setting key
     * @param value setting value
     * @return new configuration
     */
    public GeneratorConfig withSetting(String key, Object value) {
        Map<String, Object> settings = new HashMap<>(customSettings);
        settings.put(key, value);
        return new GeneratorConfig(settings);
    }

    /**
     * Gets a custom setting value.
     *
     * @param key setting key
     * @param <T> expected type
     * @return setting value or null
     */
    @SuppressWarnings("unchecked")
    public <T> T getSetting(String key) {
        return (T) customSettings.get(key);
    }

    /**
     * Gets a custom setting with a default.
     *
     * @param key setting key
     * @param defaultValue default value
     * @param <T> expected type
     * @return setting value or default
     */
    @SuppressWarnings("unchecked")
    public <T> T getSettingOrDefault(String key, T defaultValue) {
        T value = (T) customSettings.get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Gets a setting as text. YAML scalars such as {@code 2024} or {@code true} arrive as
     * numbers or booleans and are converted with {@link String#valueOf(Object)}.
     *
     * @param key setting key
     * @param defaultValue value used when the key is unset
     * @return setting text or default
     */
    public String getStringSetting(String key, String defaultValue) {
        Object value = customSettings.get(key);
        return value != null ? String.valueOf(value) : defaultValue;
    }
}
