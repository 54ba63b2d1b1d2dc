package com.sysdiagram.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of parsing a model source.
 *
 * @param root synthetic root of the containment tree
 * @param warnings diagnostics for lines that were skipped, in encounter order
 */
public record ParsedModel(
    ModelNode root,
    List<String> warnings
) {
    /**
     * Compact constructor with validation.
     */
    public ParsedModel {
        Objects.requireNonNull(root, "root must not be null");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Returns whether any line was skipped.
     *
     * @return true if warnings were recorded
     */
    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
