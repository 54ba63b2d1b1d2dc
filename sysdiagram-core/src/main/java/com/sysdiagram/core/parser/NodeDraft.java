package com.sysdiagram.core.parser;

import java.util.ArrayList;
import java.util.List;

import com.sysdiagram.core.model.ElementKind;
import com.sysdiagram.core.model.ModelNode;

/**
 * Mutable node used while the tree is being built. Frozen into {@link ModelNode}
 * records once parsing ends.
 */
final class NodeDraft {

    private final String type;
    private final String name;
    private final String alias;
    private final List<NodeDraft> children = new ArrayList<>();
    private String description;

    NodeDraft(String type, String name, String alias) {
        this.type = type;
        this.name = name;
        this.alias = alias;
    }

    static NodeDraft root() {
        return new NodeDraft(ModelNode.ROOT_TYPE, null, null);
    }

    ElementKind kind() {
        return ModelNode.isRoot(type, name) ? ElementKind.ROOT : ElementKind.fromTypeName(type);
    }

    String name() {
        return name;
    }

    void addChild(NodeDraft child) {
        children.add(child);
    }

    void setDescription(String description) {
        this.description = description;
    }

    ModelNode freeze() {
        List<ModelNode> frozen = new ArrayList<>(children.size());
        for (NodeDraft child : children) {
            frozen.add(child.freeze());
        }
        return new ModelNode(type, name, alias, description, frozen);
    }
}
