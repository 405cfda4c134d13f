package io.surfworks.tileforge.graph;

import java.util.Objects;

/**
 * Opaque named reference to a value consumed or produced by a kernel or step.
 *
 * @param name the value's name, used as the edge label in diagrams
 */
public record Handle(String name) {

    public Handle {
        Objects.requireNonNull(name, "name cannot be null");
    }

    public static Handle of(String name) {
        return new Handle(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
