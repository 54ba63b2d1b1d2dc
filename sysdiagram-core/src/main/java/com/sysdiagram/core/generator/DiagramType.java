package com.sysdiagram.core.generator;

/**
 * Diagram notations the generators produce.
 */
public enum DiagramType {
    /** Node-and-subgraph flowchart (Mermaid) */
    FLOWCHART,

    /** UML-like containment diagram (PlantUML) */
    CONTAINMENT,

    /** Clustered directed graph (Graphviz DOT) */
    CLUSTER_GRAPH
}
