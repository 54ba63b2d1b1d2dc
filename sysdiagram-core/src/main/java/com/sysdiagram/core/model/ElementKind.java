package com.sysdiagram.core.model;

/**
 * Semantic kinds recognised by the diagram generators.
 *
 * <p>A {@link ModelNode} carries an open-ended type tag (the type name after {@code :} in
 * a part declaration). Only a handful of tags get dedicated rendering; every other tag maps
 * to {@link #OTHER} and is rendered generically.
 */
public enum ElementKind {
    /** Synthetic root of the tree, never rendered */
    ROOT("Root", true),

    /** Grouping package declared with the {@code package} keyword */
    PACKAGE("Package", true),

    /** Logical component part, may contain nested parts */
    LOGICAL_COMPONENT("LogicalComponent", true),

    /** Logical function part, rendered with a name/description label */
    LOGICAL_FUNCTION("LogicalFunction", true),

    /** Logical actor, declared with {@code actor} or as a typed part */
    LOGICAL_ACTOR("LogicalActor", true),

    /** Any other typed part, always a leaf */
    OTHER(null, false);

    private final String typeName;
    private final boolean scope;

    ElementKind(String typeName, boolean scope) {
        this.typeName = typeName;
        this.scope = scope;
    }

    /**
     * Returns the type tag stored in the IR for this kind.
     *
     * @return type tag, or {@code null} for {@link #OTHER}
     */
    public String typeName() {
        return typeName;
    }

    /**
     * Returns whether nodes of this kind may own children.
     *
     * @return true for scope-bearing kinds
     */
    public boolean isScope() {
        return scope;
    }

    /**
     * Maps a declared type tag to its kind. Matching is case-sensitive. The root tag is
     * never matched: a part declared with type {@code Root} is an ordinary leaf, and only
     * {@link ModelNode#isRoot()} identifies the synthetic root.
     *
     * @param typeName type tag from the model, may be null
     * @return matching kind, {@link #OTHER} when the tag is unknown
     */
    public static ElementKind fromTypeName(String typeName) {
        if (typeName == null) {
            return OTHER;
        }
        for (ElementKind kind : values()) {
            if (kind != ROOT && typeName.equals(kind.typeName)) {
                return kind;
            }
        }
        return OTHER;
    }
}
