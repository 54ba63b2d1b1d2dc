package com.sysdiagram.core.config;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sysdiagram.core.generator.GeneratorConfig;
import com.sysdiagram.core.parser.ScopePolicy;

/**
 * Root configuration for SysDiagram.
 *
 * <p>Loaded from {@code sysdiagram.yaml}. Every section is optional; missing sections
 * fall back to the values of {@link #defaults()} through the accessor helpers.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "Drone"
 *
 * parser:
 *   policy: INDENTATION
 *
 * generators:
 *   enabled:
 *     - mermaid
 *     - plantuml
 *     - graphviz
 *   settings:
 *     plantuml.developmentPackagePrefix: "DroneDevelopment"
 *     graphviz.orderingFirst: "DroneFunctions"
 *
 * output:
 *   directory: "./diagrams"
 *   writeModel: true
 * }</pre>
 *
 * @param project project metadata
 * @param parser parser settings
 * @param generators generator selection and settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("parser") ParserSettings parser,
    @JsonProperty("generators") GeneratorSettings generators,
    @JsonProperty("output") OutputConfig output
) {
    /** Default output directory */
    public static final String DEFAULT_OUTPUT_DIRECTORY = ".";

    /**
     * Creates the default configuration: indentation policy, all generators, output to the
     * working directory, model IR written.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(
            new ProjectInfo("model", null),
            new ParserSettings(ScopePolicy.INDENTATION),
            new GeneratorSettings(List.of(), Map.of()),
            new OutputConfig(DEFAULT_OUTPUT_DIRECTORY, true)
        );
    }

    /**
     * Returns the configured scope policy, {@link ScopePolicy#INDENTATION} when unset.
     *
     * @return effective scope policy
     */
    public ScopePolicy scopePolicy() {
        if (parser == null || parser.policy() == null) {
            return ScopePolicy.INDENTATION;
        }
        return parser.policy();
    }

    /**
     * Checks if a generator is enabled. An absent or empty list enables every generator.
     *
     * @param generatorId generator ID to check
     * @return true if the generator should run
     */
    public boolean isGeneratorEnabled(String generatorId) {
        if (generators == null || generators.enabled() == null || generators.enabled().isEmpty()) {
            return true;
        }
        return generators.enabled().stream().anyMatch(id -> id.equalsIgnoreCase(generatorId));
    }

    /**
     * Builds the generator configuration from the {@code generators.settings} map.
     *
     * @return generator configuration
     */
    public GeneratorConfig generatorConfig() {
        if (generators == null || generators.settings() == null) {
            return GeneratorConfig.defaults();
        }
        return new GeneratorConfig(generators.settings());
    }

    /**
     * Returns the configured output directory, {@value #DEFAULT_OUTPUT_DIRECTORY} when unset.
     *
     * @return output directory
     */
    public String outputDirectory() {
        if (output == null || output.directory() == null || output.directory().isBlank()) {
            return DEFAULT_OUTPUT_DIRECTORY;
        }
        return output.directory();
    }

    /**
     * Returns whether the JSON model IR should be written next to the diagrams.
     *
     * @return true unless explicitly disabled
     */
    public boolean writeModel() {
        return output == null || output.writeModel() == null || output.writeModel();
    }

    /**
     * Project metadata.
     *
     * @param name project name
     * @param description optional project description
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description
    ) {}

    /**
     * Parser settings.
     *
     * @param policy scope policy
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ParserSettings(
        @JsonProperty("policy") ScopePolicy policy
    ) {}

    /**
     * Generator settings.
     *
     * @param enabled enabled generator IDs, empty for all
     * @param settings generator-specific settings passed through {@link GeneratorConfig}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GeneratorSettings(
        @JsonProperty("enabled") List<String> enabled,
        @JsonProperty("settings") Map<String, Object> settings
    ) {}

    /**
     * Output configuration.
     *
     * @param directory output directory path
     * @param writeModel whether to write the JSON model IR
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("writeModel") Boolean writeModel
    ) {}
}
