package io.surfworks.tileforge.diagram;

import java.util.Locale;

/**
 * Outline a diagram node is drawn with.
 */
public enum Shape {
    BOX,
    DIAMOND;

    /**
     * Graphviz shape name.
     */
    public String dotName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
