package com.sysdiagram.core.generator.label;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link HtmlTableLabels}, {@link GraphvizTableLabels} and {@link LabelBox}.
 */
class LabelTemplatesTest {

    @Test
    void htmlTwoCompartment_rendersBothCells() {
        String label = new HtmlTableLabels().twoCompartment("Sense", "Detect obstacles", LabelBox.FUNCTION);

        assertThat(label).isEqualTo("""
            <table border="1" cellspacing="0" cellpadding="2">
              <tr><td fixedsize="true" width="120" height="15" align="center">Sense</td></tr>
              <tr><td fixedsize="true" width="120" height="30" align="center">Detect obstacles</td></tr>
            </table>""");
    }

    @Test
    void htmlBottomOnly_leavesTopCellEmpty() {
        String label = new HtmlTableLabels().bottomOnly("Lidar", LabelBox.COMPONENT);

        assertThat(label).contains("width=\"150\" height=\"10\" align=\"center\"></td>");
        assertThat(label).contains("width=\"150\" height=\"40\" align=\"center\">Lidar</td>");
    }

    @Test
    void graphvizLabel_isHtmlLikeDotLabel() {
        String label = new GraphvizTableLabels().bottomOnly("Pilot", LabelBox.ACTOR);

        assertThat(label).startsWith("<<TABLE BORDER=\"0\" CELLBORDER=\"1\"");
        assertThat(label).endsWith("</TABLE>>");
        assertThat(label).contains("WIDTH=\"120\" HEIGHT=\"40\" ALIGN=\"CENTER\">Pilot</TD>");
    }

    @Test
    void labelBox_withNonPositiveDimension_throwsException() {
        assertThatThrownBy(() -> new LabelBox(0, 10, 10))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LabelBox(10, -1, 10))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
