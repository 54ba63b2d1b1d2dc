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
import com.sysdiagram.core.generator.label.GraphvizTableLabels;
import com.sysdiagram.core.generator.label.LabelBox;
import com.sysdiagram.core.generator.label.LabelTemplates;
import com.sysdiagram.core.model.ModelNode;
import com.sysdiagram.core.util.IdSequence;

/**
 * Generates Graphviz DOT cluster graphs from the model tree.
 *
 * <p>Every element becomes its own {@code subgraph cluster_*} holding exactly one
 * representative node, the connectable point standing in for the whole cluster. Container
 * kinds nest their children's clusters after the representative node.
 *
 * <h2>Mapping</h2>
 * <ul>
 *   <li><b>LogicalFunction:</b> filled node with a name/description label</li>
 *   <li><b>LogicalComponent with children:</b> labelled, filled cluster; blank representative
 *       node; nested child clusters</li>
 *   <li><b>LogicalComponent without children:</b> filled node with a bottom-only label</li>
 *   <li><b>LogicalActor:</b> fixed-size filled node with a bottom-only label</li>
 *   <li><b>Package:</b> labelled cluster; blank representative node; nested child clusters</li>
 *   <li><b>Other parts:</b> plain node labelled with the name</li>
 * </ul>
 *
 * <p>Cluster and node identifiers share one counter per generation pass
 * ({@code cluster_id1}, {@code id2}, ...).
 *
 * <h2>Ordering Edge</h2>
 * When the top level holds elements named exactly {@value #DEFAULT_ORDERING_FIRST} and
 * {@value #DEFAULT_ORDERING_SECOND} (configurable), an invisible edge between their
 * representative nodes is emitted so the layout engine stacks the first above the second.
 * The edge carries no model relationship.
 *
 * @see <a href="https://graphviz.org/doc/info/lang.html">DOT Language</a>
 */
public class GraphvizClusterGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(GraphvizClusterGenerator.class);

    private static final String GENERATOR_ID = "graphviz";
    private static final String GENERATOR_DISPLAY_NAME = "Graphviz Cluster Graph Generator";
    private static final String FILE_EXTENSION = "dot";

    /** Setting key for the top-level element placed above */
    public static final String SETTING_ORDERING_FIRST = "graphviz.orderingFirst";

    /** Setting key for the top-level element placed below */
    public static final String SETTING_ORDERING_SECOND = "graphviz.orderingSecond";

    public static final String DEFAULT_ORDERING_FIRST = "DroneFunctions";
    public static final String DEFAULT_ORDERING_SECOND = "DroneLogicalArchitecture";

    private static final String ID_PREFIX = "id";
    private static final String CLUSTER_PREFIX = "cluster_";
    private static final int INDENT_STEP = 4;

    private static final List<String> HEADER = List.of(
        "digraph G {",
        "    graph [layout=osage, splines=ortho, rankdir=TB, compound=true, size=\"8,4!\", ratio=0.5, stylesheet=\"mystyle.css\"];",
        "    node [fontname=\"Helvetica\", fontsize=10];",
        ""
    );

    private final LabelTemplates labels;

    /**
     * Creates a generator with Graphviz HTML-like table labels.
     */
    public GraphvizClusterGenerator() {
        this(new GraphvizTableLabels());
    }

    /**
     * Creates a generator with custom label templates.
     *
     * @param labels label templates
     */
    public GraphvizClusterGenerator(LabelTemplates labels) {
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
        return DiagramType.CLUSTER_GRAPH;
    }

    @Override
    public GeneratedDiagram generate(ModelNode root, GeneratorConfig config) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(config, "config must not be null");
        if (!root.isRoot()) {
            throw new IllegalArgumentException("Expected the synthetic root node, got: " + root.type());
        }

        String orderingFirst = config.getStringSetting(SETTING_ORDERING_FIRST, DEFAULT_ORDERING_FIRST);
        String orderingSecond = config.getStringSetting(SETTING_ORDERING_SECOND, DEFAULT_ORDERING_SECOND);

        List<String> lines = new ArrayList<>(HEADER);
        IdSequence ids = new IdSequence(ID_PREFIX);
        String firstRep = null;
        String secondRep = null;

        for (ModelNode child : root.children()) {
            String rep = appendCluster(lines, child, INDENT_STEP, ids);
            String name = child.trimmedName();
            if (name.equals(orderingFirst)) {
                firstRep = rep;
            } else if (name.equals(orderingSecond)) {
                secondRep = rep;
            }
        }

        if (firstRep != null && secondRep != null) {
            log.debug("Adding ordering edge {} -> {}", firstRep, secondRep);
            lines.add(" ".repeat(INDENT_STEP) + firstRep + " -> " + secondRep + " [style=invis];");
        }

        lines.add("}");

        log.info("Generated Graphviz cluster graph with {} identifiers", ids.issued());
        return new GeneratedDiagram(diagramName(), String.join("\n", lines), FILE_EXTENSION);
    }

    /**
     * Appends the cluster of one element and, recursively, the clusters of its children.
     *
     * @param lines output lines
     * @param node element to emit
     * @param indent indentation width of the cluster line
     * @param ids identifier sequence of this generation pass
     * @return identifier of the element's representative node
     */
    private String appendCluster(List<String> lines, ModelNode node, int indent, IdSequence ids) {
        String spacing = " ".repeat(indent);
        String inner = spacing + " ".repeat(INDENT_STEP);
        String clusterId = CLUSTER_PREFIX + ids.next();
        String rep = ids.next();

        lines.add(spacing + "subgraph " + clusterId + " {");
        switch (node.kind()) {
            case LOGICAL_FUNCTION -> {
                String description = node.description() != null ? node.description() : "";
                lines.add(inner + rep + " [shape=none, style=filled, fillcolor=lightgreen, label="
                    + labels.twoCompartment(node.name(), description, LabelBox.FUNCTION) + "];");
            }
            case LOGICAL_COMPONENT -> {
                if (node.hasChildren()) {
                    lines.add(inner + "label = \"" + escape(node.name()) + "\";");
                    lines.add(inner + "style=filled;");
                    lines.add(inner + "fillcolor=lightblue;");
                    lines.add(inner + "margin=10;");
                    lines.add(inner + rep + " [shape=none, label=\"\"];");
                    appendChildClusters(lines, node, indent + INDENT_STEP, ids);
                } else {
                    lines.add(inner + rep + " [shape=none, style=filled, fillcolor=lightblue, label="
                        + labels.bottomOnly(node.name(), LabelBox.COMPONENT) + "];");
                }
            }
            case LOGICAL_ACTOR -> lines.add(inner + rep
                + " [shape=none, style=filled, fillcolor=lightblue, fixedsize=true, label="
                + labels.bottomOnly(node.name(), LabelBox.ACTOR) + "];");
            case PACKAGE -> {
                lines.add(inner + "label = \"" + escape(node.name()) + "\";");
                lines.add(inner + rep + " [shape=none, label=\"\"];");
                appendChildClusters(lines, node, indent + INDENT_STEP, ids);
            }
            default -> lines.add(inner + rep + " [label=\"" + escape(node.name()) + "\"];");
        }
        lines.add(spacing + "}");
        return rep;
    }

    private void appendChildClusters(List<String> lines, ModelNode node, int indent, IdSequence ids) {
        for (ModelNode child : node.children()) {
            appendCluster(lines, child, indent, ids);
        }
    }

    /**
     * Escapes a value for use inside a double-quoted DOT string.
     */
    static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static String diagramName() {
        return DiagramType.CLUSTER_GRAPH.name().toLowerCase().replace('_', '-');
    }
}
