package com.sysdiagram.core.generator.label;

/**
 * Plain HTML table labels, as accepted by Mermaid flowchart nodes.
 */
public class HtmlTableLabels implements LabelTemplates {

    private static final String TEMPLATE = """
        <table border="1" cellspacing="0" cellpadding="2">
          <tr><td fixedsize="true" width="%1$d" height="%2$d" align="center">%4$s</td></tr>
          <tr><td fixedsize="true" width="%1$d" height="%3$d" align="center">%5$s</td></tr>
        </table>""";

    @Override
    public String twoCompartment(String top, String bottom, LabelBox box) {
        return TEMPLATE.formatted(box.width(), box.topHeight(), box.bottomHeight(), top, bottom);
    }

    @Override
    public String bottomOnly(String text, LabelBox box) {
        return TEMPLATE.formatted(box.width(), box.topHeight(), box.bottomHeight(), "", text);
    }
}
