package com.sysdiagram.core.generator;

import com.sysdiagram.core.model.ModelNode;

/**
 * Interface for diagram generators that turn the parsed model tree into a diagram document.
 *
 * <p>Every generator walks the same containment tree: the synthetic root is skipped and its
 * children are emitted in declaration order. Each generator owns its identifier scheme and
 * label composition; identifiers are never derived from display names and are issued from
 * a sequence created per {@link #generate} call, so generating twice yields identical output.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.sysdiagram.core.generator.DiagramGenerator}
 *
 * @see GeneratorRegistry
 * @see GeneratorConfig
 * @see GeneratedDiagram
 */
public interface DiagramGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Used for referencing the generator in configuration and on the command line.
     * Lowercase (e.g., "mermaid", "plantuml", "graphviz").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated diagrams, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Returns the notation this generator produces.
     *
     * @return diagram type
     */
    DiagramType getDiagramType();

    /**
     * Generates a diagram from the model tree.
     *
     * @param root synthetic root of the model tree
     * @param config generator configuration
     * @return generated diagram content
     * @throws IllegalArgumentException if {@code root} is not a synthetic root node
     */
    GeneratedDiagram generate(ModelNode root, GeneratorConfig config);
}
