package com.sysdiagram.core.generator.label;

/**
 * Graphviz HTML-like labels. The returned string includes the enclosing angle brackets
 * and is used verbatim as a {@code label=} attribute value.
 */
public class GraphvizTableLabels implements LabelTemplates {

    private static final String TEMPLATE = """
        <<TABLE BORDER="0" CELLBORDER="1" CELLSPACING="0" CELLPADDING="2">
          <TR><TD FIXEDSIZE="true" WIDTH="%1$d" HEIGHT="%2$d" ALIGN="CENTER">%4$s</TD></TR>
          <TR><TD FIXEDSIZE="true" WIDTH="%1$d" HEIGHT="%3$d" ALIGN="CENTER">%5$s</TD></TR>
        </TABLE>>""";

    @Override
    public String twoCompartment(String top, String bottom, LabelBox box) {
        return TEMPLATE.formatted(box.width(), box.topHeight(), box.bottomHeight(), top, bottom);
    }

    @Override
    public String bottomOnly(String text, LabelBox box) {
        return TEMPLATE.formatted(box.width(), box.topHeight(), box.bottomHeight(), "", text);
    }
}
