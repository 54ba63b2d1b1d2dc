package com.sysdiagram.core.generator.label;

/**
 * Fixed cell dimensions of a two-compartment label.
 *
 * @param width width of both cells
 * @param topHeight height of the top cell
 * @param bottomHeight height of the bottom cell
 */
public record LabelBox(int width, int topHeight, int bottomHeight) {

    /** Name over description, used for logical functions */
    public static final LabelBox FUNCTION = new LabelBox(120, 15, 30);

    /** Empty top cell, name below; used for logical components */
    public static final LabelBox COMPONENT = new LabelBox(150, 10, 40);

    /** Empty top cell, name below; used for actors in cluster graphs */
    public static final LabelBox ACTOR = new LabelBox(120, 10, 40);

    public LabelBox {
        if (width <= 0 || topHeight <= 0 || bottomHeight <= 0) {
            throw new IllegalArgumentException("Label dimensions must be positive");
        }
    }
}
