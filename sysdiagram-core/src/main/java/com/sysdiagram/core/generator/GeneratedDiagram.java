package com.sysdiagram.core.generator;

import java.util.Objects;

/**
 * One diagram document produced from a parsed model.
 *
 * @param name notation name, such as {@code flowchart} or {@code containment}
 * @param content complete Mermaid, PlantUML or DOT source
 * @param fileExtension extension without the leading dot
 */
public record GeneratedDiagram(
    String name,
    String content,
    String fileExtension
) {
    public GeneratedDiagram {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
        if (fileExtension.startsWith(".")) {
            fileExtension = fileExtension.substring(1);
        }
    }

    /**
     * @param baseName file name without extension, e.g. {@code drone}
     * @return {@code baseName.extension}
     */
    public String fileNameFor(String baseName) {
        return baseName + "." + fileExtension;
    }
}
