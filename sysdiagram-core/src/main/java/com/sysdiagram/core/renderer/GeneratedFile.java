package com.sysdiagram.core.renderer;

import java.util.Objects;

import com.sysdiagram.core.generator.GeneratedDiagram;

/**
 * A generated document to be written out.
 *
 * @param relativePath path relative to the output directory (e.g., "Model1.puml")
 * @param content file content
 * @param contentType content type or notation name, may be null
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
    }

    /**
     * Creates the file for a generated diagram, named {@code <baseName>.<extension>}.
     *
     * @param baseName file name without extension
     * @param diagram generated diagram
     * @return generated file
     */
    public static GeneratedFile of(String baseName, GeneratedDiagram diagram) {
        Objects.requireNonNull(baseName, "baseName must not be null");
        Objects.requireNonNull(diagram, "diagram must not be null");
        return new GeneratedFile(diagram.fileNameFor(baseName), diagram.content(), diagram.name());
    }
}
