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
import com.sysdiagram.core.generator.label.HtmlTableLabels;
import com.sysdiagram.core.generator.label.LabelBox;
import com.sysdiagram.core.generator.label.LabelTemplates;
import com.sysdiagram.core.model.ModelNode;
import com.sysdiagram.core.util.IdSequence;

/**
 * Generates Mermaid flowchart definitions from the model tree.
 *
 * <h2>Mapping</h2>
 * <ul>
 *   <li><b>Package:</b> {@code subgraph} wrapping its children</li>
 *   <li><b>LogicalFunction:</b> node with a two-compartment label, name over description</li>
 *   <li><b>LogicalComponent, LogicalActor:</b> node with an empty top compartment and the
 *       name below</li>
 *   <li><b>Other parts:</b> plain node showing the name</li>
 * </ul>
 *
 * <p>Children of non-package scopes are emitted right after their owner, one level deeper.
 * Node identifiers are {@code n1, n2, ...} in emission order; display names only appear in
 * labels, so two elements sharing a name never collide.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ModelNode root = new ModelParser().parse(text).root();
 * GeneratedDiagram diagram = new MermaidFlowchartGenerator().generate(root, GeneratorConfig.defaults());
 * }</pre>
 *
 * @see <a href="https://mermaid.js.org/syntax/flowchart.html">Mermaid Flowchart</a>
 */
public class MermaidFlowchartGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidFlowchartGenerator.class);

    private static final String GENERATOR_ID = "mermaid";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid Flowchart Generator";
    private static final String FILE_EXTENSION = "mmd";

    /** Setting key for the indentation unit, default four spaces */
    public static final String SETTING_INDENT = "mermaid.indent";

    /** Setting key for the flowchart direction, default {@code TD} */
    public static final String SETTING_DIRECTION = "mermaid.direction";

    private static final String DEFAULT_INDENT = "    ";
    private static final String DEFAULT_DIRECTION = "TD";
    private static final String ID_PREFIX = "n";

    // Characters that end a bare [text] label early
    private static final String LABEL_SPECIAL_CHARS = "[](){}\"|";

    private final LabelTemplates labels;

    /**
     * Creates a generator with the standard HTML table labels.
     */
    public MermaidFlowchartGenerator() {
        this(new HtmlTableLabels());
    }

    /**
     * Creates a generator with custom label templates.
     *
     * @param labels label templates
     */
    public MermaidFlowchartGenerator(LabelTemplates labels) {
        this.labels = Objects.requireNonNull(labels, "labels must not be null");
    }

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
        return DiagramType.FLOWCHART;
    }

    @Override
    public GeneratedDiagram generate(ModelNode root, GeneratorConfig config) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(config, "config must not be null");
        if (!root.isRoot()) {
            throw new IllegalArgumentException("Expected the synthetic root node, got: " + root.type());
        }

        String indent = config.getStringSetting(SETTING_INDENT, DEFAULT_INDENT);
        String direction = config.getStringSetting(SETTING_DIRECTION, DEFAULT_DIRECTION);

        List<String> lines = new ArrayList<>();
        lines.add("flowchart " + direction);

        IdSequence ids = new IdSequence(ID_PREFIX);
        for (ModelNode child : root.children()) {
            appendNode(lines, child, 1, indent, ids);
        }

        log.info("Generated Mermaid flowchart with {} nodes", ids.issued());
        return new GeneratedDiagram(diagramName(), String.join("\n", lines), FILE_EXTENSION);
    }

    /**
     * Appends one node and, recursively, its children.
     *
     * @param lines output lines
     * @param node node to emit
     * @param level nesting level, 1 for top-level elements
     * @param indent indentation unit
     * @param ids identifier sequence of this generation pass
     */
    private void appendNode(List<String> lines, ModelNode node, int level, String indent, IdSequence ids) {
        String spacing = indent.repeat(level);
        String id = ids.next();

        switch (node.kind()) {
            case PACKAGE -> {
                lines.add(spacing + "subgraph " + id + "[" + label(node.name()) + "]");
                appendChildren(lines, node, level + 1, indent, ids);
                lines.add(spacing + "end");
                return;
            }
            case LOGICAL_FUNCTION -> lines.add(spacing + id + "["
                + labels.twoCompartment(tableText(node.name()), tableText(descriptionOf(node)), LabelBox.FUNCTION) + "]");
            case LOGICAL_COMPONENT, LOGICAL_ACTOR -> lines.add(spacing + id + "["
                + labels.bottomOnly(tableText(node.name()), LabelBox.COMPONENT) + "]");
            default -> lines.add(spacing + id + "[" + label(node.name()) + "]");
        }

        appendChildren(lines, node, level + 1, indent, ids);
    }

    private void appendChildren(List<String> lines, ModelNode node, int level, String indent, IdSequence ids) {
        for (ModelNode child : node.children()) {
            appendNode(lines, child, level, indent, ids);
        }
    }

    private static String descriptionOf(ModelNode node) {
        return node.description() != null ? node.description() : "";
    }

    /**
     * Quotes a plain-text label when it contains characters Mermaid treats as syntax.
     *
     * @param text display text
     * @return label text safe inside square brackets
     */
    static String label(String text) {
        for (char c : text.toCharArray()) {
            if (LABEL_SPECIAL_CHARS.indexOf(c) >= 0) {
                return "\"" + text.replace("\"", "#quot;") + "\"";
            }
        }
        return text;
    }

    /**
     * Escapes text placed in a table cell. Table labels sit in bare square brackets, so
     * Mermaid syntax characters are replaced by entity codes instead of quoting.
     *
     * @param text display text
     * @return text safe inside a table label
     */
    static String tableText(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (LABEL_SPECIAL_CHARS.indexOf(c) >= 0) {
                escaped.append(c == '"' ? "#quot;" : "#" + (int) c + ";");
            } else {
                escaped.append(c);
            }
        }
        return escaped.toString();
    }

    private static String diagramName() {
        return DiagramType.FLOWCHART.name().toLowerCase().replace('_', '-');
    }
}
