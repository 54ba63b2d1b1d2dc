package com.sysdiagram.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A single element of the parsed system model.
 *
 * <p>The model is a strict containment tree rooted at a synthetic {@link ElementKind#ROOT}
 * node. Children keep declaration order; generators rely on that order.
 *
 * @param type type tag ({@code Package}, {@code LogicalFunction}, any declared part type, ...)
 * @param name display name, free text; null only for the synthetic root
 * @param alias optional short identifier
 * @param description optional free-text description
 * @param children ordered child nodes, empty for leaves
 */
public record ModelNode(
    String type,
    String name,
    String alias,
    String description,
    List<ModelNode> children
) {
    /** Type tag of the synthetic root. */
    public static final String ROOT_TYPE = "Root";

    /**
     * Compact constructor with validation.
     */
    public ModelNode {
        Objects.requireNonNull(type, "type must not be null");
        if (name == null && !ROOT_TYPE.equals(type)) {
            throw new NullPointerException("name must not be null");
        }
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Creates a synthetic root holding the given top-level nodes.
     *
     * @param children top-level nodes
     * @return root node
     */
    public static ModelNode root(List<ModelNode> children) {
        return new ModelNode(ROOT_TYPE, null, null, null, children);
    }

    /**
     * Creates a leaf node without alias or description.
     *
     * @param type type tag
     * @param name display name
     * @return leaf node
     */
    public static ModelNode leaf(String type, String name) {
        return new ModelNode(type, name, null, null, List.of());
    }

    /**
     * Returns the semantic kind derived from the type tag.
     *
     * @return element kind
     */
    public ElementKind kind() {
        return isRoot() ? ElementKind.ROOT : ElementKind.fromTypeName(type);
    }

    /**
     * Returns whether this node is the synthetic root: root type tag and no name.
     *
     * @return true for the root
     */
    public boolean isRoot() {
        return isRoot(type, name);
    }

    /**
     * @param type type tag
     * @param name display name
     * @return true when the pair describes the synthetic root
     */
    public static boolean isRoot(String type, String name) {
        return name == null && ROOT_TYPE.equals(type);
    }

    /**
     * Returns whether this node has any children.
     *
     * @return true if at least one child exists
     */
    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * Counts the nodes below this one, at any depth.
     *
     * @return number of descendants
     */
    public int descendantCount() {
        int count = 0;
        for (ModelNode child : children) {
            count += 1 + child.descendantCount();
        }
        return count;
    }

    /**
     * Returns the display name trimmed, or an empty string for the root.
     *
     * @return trimmed name
     */
    public String trimmedName() {
        return name == null ? "" : name.strip();
    }
}
