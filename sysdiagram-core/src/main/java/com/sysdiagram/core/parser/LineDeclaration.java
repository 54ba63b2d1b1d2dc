package com.sysdiagram.core.parser;

import java.util.Objects;

import com.sysdiagram.core.model.ElementKind;

/**
 * Classification of a single model source line.
 *
 * <p>Produced by {@link LineClassifier#classify(String)}. Element declarations
 * ({@link PackageDecl}, {@link PartDecl}, {@link ActorDecl}) create nodes; a
 * {@link DescriptionDecl} annotates the innermost open node; {@link Unrecognized}
 * lines are reported and skipped.
 */
public sealed interface LineDeclaration
    permits LineDeclaration.ElementDecl,
            LineDeclaration.DescriptionDecl,
            LineDeclaration.Unrecognized {

    /**
     * A declaration that creates a node in the tree.
     */
    sealed interface ElementDecl extends LineDeclaration
        permits PackageDecl, PartDecl, ActorDecl {

        /**
         * @return display name
         */
        String name();

        /**
         * @return optional alias, null when absent
         */
        String alias();

        /**
         * @return type tag of the node this declaration creates
         */
        String typeName();
    }

    /**
     * {@code package <name> [as <alias>]}
     *
     * @param name package name, quotes removed
     * @param alias optional alias
     */
    record PackageDecl(String name, String alias) implements ElementDecl {
        public PackageDecl {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String typeName() {
            return ElementKind.PACKAGE.typeName();
        }
    }

    /**
     * {@code part <name> [as <alias>] : <type>}
     *
     * @param name part name, may carry an array suffix such as {@code rotors[4]}
     * @param alias optional alias
     * @param type declared type name
     */
    record PartDecl(String name, String alias, String type) implements ElementDecl {
        public PartDecl {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }

        @Override
        public String typeName() {
            return type;
        }
    }

    /**
     * {@code actor <name> [as <alias>]}
     *
     * @param name actor name, quotes removed
     * @param alias optional alias
     */
    record ActorDecl(String name, String alias) implements ElementDecl {
        public ActorDecl {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String typeName() {
            return ElementKind.LOGICAL_ACTOR.typeName();
        }
    }

    /**
     * {@code description = "<text>"}
     *
     * @param text description text, trimmed
     */
    record DescriptionDecl(String text) implements LineDeclaration {
        public DescriptionDecl {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /**
     * A line matching none of the declaration patterns.
     *
     * @param line the original line text
     */
    record Unrecognized(String line) implements LineDeclaration {
        public Unrecognized {
            Objects.requireNonNull(line, "line must not be null");
        }
    }
}
