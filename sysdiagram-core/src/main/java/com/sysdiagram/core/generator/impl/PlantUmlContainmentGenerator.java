package com.sysdiagram.core.generator.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sysdiagram.core.generator.DiagramGenerator;
import com.sysdiagram.core.generator.DiagramType;
import com.sysdiagram.core.generator.GeneratedDiagram;
import com.sysdiagram.core.generator.GeneratorConfig;
import com.sysdiagram.core.model.ModelNode;

/**
 * Generates PlantUML containment diagrams from the model tree.
 *
 * <h2>Mapping</h2>
 * <ul>
 *   <li><b>Package:</b> {@code package} block holding its children</li>
 *   <li><b>LogicalComponent:</b> {@code rectangle} with the {@code <<logicalComponent>>}
 *       stereotype, a block when it has children</li>
 *   <li><b>LogicalFunction:</b> {@code class} with the {@code <<logicalFunction>>} stereotype
 *       and a single {@code description} attribute</li>
 *   <li><b>LogicalActor:</b> {@code rectangle} with the {@code <<logicalActor>>} stereotype</li>
 *   <li><b>Other parts:</b> empty {@code package} block</li>
 * </ul>
 *
 * <p>Elements are named {@code "name" as alias} when an alias exists and by the quoted name
 * otherwise.
 *
 * <h2>Sibling Reordering</h2>
 * Inside the package whose name starts with the development prefix
 * ({@value #DEFAULT_DEVELOPMENT_PREFIX} by default), children whose name starts with the
 * functions prefix ({@value #DEFAULT_FUNCTIONS_PREFIX}) are emitted first. Both groups keep
 * their relative order. No other package is reordered.
 *
 * @see <a href="https://plantuml.com/">PlantUML</a>
 */
public class PlantUmlContainmentGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(PlantUmlContainmentGenerator.class);

    private static final String GENERATOR_ID = "plantuml";
    private static final String GENERATOR_DISPLAY_NAME = "PlantUML Containment Generator";
    private static final String FILE_EXTENSION = "puml";

    /** Setting key for the name prefix of the package whose children get reordered */
    public static final String SETTING_DEVELOPMENT_PREFIX = "plantuml.developmentPackagePrefix";

    /** Setting key for the name prefix of the children moved to the front */
    public static final String SETTING_FUNCTIONS_PREFIX = "plantuml.functionsPackagePrefix";

    public static final String DEFAULT_DEVELOPMENT_PREFIX = "DroneDevelopment";
    public static final String DEFAULT_FUNCTIONS_PREFIX = "DroneFunctions";

    private static final String INDENT = "    ";

    private static final String STEREOTYPE_COMPONENT = "<<logicalComponent>>";
    private static final String STEREOTYPE_FUNCTION = "<<logicalFunction>>";
    private static final String STEREOTYPE_ACTOR = "<<logicalActor>>";

    private static final List<String> HEADER = List.of(
        "@startuml",
        "'==================================================",
        "' Define Profile Styles with Stereotypes",
        "'==================================================",
        "",
        "allowmixing",
        "' Class for Logical Functions with custom formatting",
        "skinparam class {",
        "  BackgroundColor<<logicalFunction>> LightGreen",
        "  BorderColor<<logicalFunction>> DarkGreen",
        "  FontStyle<<logicalFunction>> Bold",
        "  FontColor<<logicalFunction>> Black",
        "}",
        "",
        "' Rectangle for Logical Components",
        "skinparam rectangle {",
        "  BackgroundColor<<logicalComponent>> LightSteelBlue",
        "  BorderColor<<logicalComponent>> DarkBlue",
        "  FontStyle<<logicalComponent>> Bold",
        "  FontColor<<logicalComponent>> Black",
        "}",
        "",
        "' Rectangle for Logical Actors",
        "skinparam rectangle {",
        "  BackgroundColor<<logicalActor>> LightBlue",
        "  BorderColor<<logicalActor>> Blue",
        "  FontStyle<<logicalActor>> Bold",
        "  FontColor<<logicalActor>> Black",
        "}",
        "",
        "'==================================================",
        "' Generated SysML Diagram",
        "'=================================================="
    );

    private static final String FOOTER = "@enduml";

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public DiagramType getDiagramType() {
        return DiagramType.CONTAINMENT;
    }

    @Override
    public GeneratedDiagram generate(ModelNode root, GeneratorConfig config) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(config, "config must not be null");
        if (!root.isRoot()) {
            throw new IllegalArgumentException("Expected the synthetic root node, got: " + root.type());
        }

        Reordering reordering = new Reordering(
            config.getStringSetting(SETTING_DEVELOPMENT_PREFIX, DEFAULT_DEVELOPMENT_PREFIX),
            config.getStringSetting(SETTING_FUNCTIONS_PREFIX, DEFAULT_FUNCTIONS_PREFIX));

        List<String> lines = new ArrayList<>(HEADER);
        for (ModelNode child : root.children()) {
            appendNode(lines, child, 0, reordering);
        }
        lines.add(FOOTER);

        log.info("Generated PlantUML containment diagram with {} top-level elements", root.children().size());
        return new GeneratedDiagram(diagramName(), String.join("\n", lines), FILE_EXTENSION);
    }

    private void appendNode(List<String> lines, ModelNode node, int level, Reordering reordering) {
        String spacing = INDENT.repeat(level);
        String element = formatElement(node);

        switch (node.kind()) {
            case PACKAGE -> {
                lines.add(spacing + "package " + element + " {");
                for (ModelNode child : reordering.apply(node)) {
                    appendNode(lines, child, level + 1, reordering);
                }
                lines.add(spacing + "}");
            }
            case LOGICAL_COMPONENT -> {
                if (node.hasChildren()) {
                    lines.add(spacing + "rectangle " + element + " " + STEREOTYPE_COMPONENT + " {");
                    for (ModelNode child : node.children()) {
                        appendNode(lines, child, level + 1, reordering);
                    }
                    lines.add(spacing + "}");
                } else {
                    lines.add(spacing + "rectangle " + element + " " + STEREOTYPE_COMPONENT);
                }
            }
            case LOGICAL_FUNCTION -> {
                String description = node.description() != null ? node.description() : "";
                lines.add(spacing + "class " + element + " " + STEREOTYPE_FUNCTION + " {");
                lines.add(spacing + INDENT + "description = \"" + description + "\"");
                lines.add(spacing + "}");
            }
            case LOGICAL_ACTOR -> lines.add(spacing + "rectangle " + element + " " + STEREOTYPE_ACTOR);
            default -> {
                lines.add(spacing + "package " + element + " {");
                lines.add(spacing + "}");
            }
        }
    }

    /**
     * Formats an element reference: {@code "name" as alias}, or {@code "name"} without alias.
     */
    private static String formatElement(ModelNode node) {
        String quoted = "\"" + node.name() + "\"";
        return node.alias() != null ? quoted + " as " + node.alias() : quoted;
    }

    private static String diagramName() {
        return DiagramType.CONTAINMENT.name().toLowerCase().replace('_', '-');
    }

    /**
     * Moves the functions group to the front inside the development package only.
     *
     * @param developmentPrefix name prefix of the package whose children are reordered
     * @param functionsPrefix name prefix of the children moved first
     */
    record Reordering(String developmentPrefix, String functionsPrefix) {

        List<ModelNode> apply(ModelNode pkg) {
            if (!pkg.trimmedName().startsWith(developmentPrefix)) {
                return pkg.children();
            }
            List<ModelNode> functions = new ArrayList<>();
            List<ModelNode> others = new ArrayList<>();
            for (ModelNode child : pkg.children()) {
                if (child.trimmedName().startsWith(functionsPrefix)) {
                    functions.add(child);
                } else {
                    others.add(child);
                }
            }
            functions.addAll(others);
            return functions;
        }
    }
}
