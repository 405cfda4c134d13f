package io.surfworks.tileforge.trace;

import io.surfworks.tileforge.symbolic.Coord;

import java.util.Objects;

/**
 * Where a step definition takes the tag of each invocation from.
 */
public sealed interface TagSource permits TagSource.Literal, TagSource.Parameter {

    /**
     * Every invocation uses the same fixed coordinate.
     */
    record Literal(Coord coord) implements TagSource {
        public Literal {
            Objects.requireNonNull(coord, "coord cannot be null");
        }
    }

    /**
     * Each invocation reads its tag from the argument bound to the named parameter.
     */
    record Parameter(String name) implements TagSource {
        public Parameter {
            Objects.requireNonNull(name, "name cannot be null");
        }
    }

    static TagSource literal(Coord coord) {
        return new Literal(coord);
    }

    static TagSource parameter(String name) {
        return new Parameter(name);
    }
}
