package com.sysdiagram.core.generator.label;

/**
 * Produces the HTML-like labels used by the flowchart and cluster-graph generators.
 *
 * <p>Generators treat the result as an opaque string and embed it as the node label.
 */
public interface LabelTemplates {

    /**
     * Label with two compartments: {@code top} above, {@code bottom} below.
     *
     * @param top top cell text
     * @param bottom bottom cell text, may be empty
     * @param box cell dimensions
     * @return label markup
     */
    String twoCompartment(String top, String bottom, LabelBox box);

    /**
     * Label with an empty top compartment and {@code text} in the bottom one.
     *
     * @param text bottom cell text
     * @param box cell dimensions
     * @return label markup
     */
    String bottomOnly(String text, LabelBox box);
}
