package io.surfworks.tileforge.graph;

import java.util.List;

/**
 * The reusable step definition a {@link StepNode} was recorded from.
 *
 * <p>Two step nodes recorded from the same definition share one origin and
 * therefore one {@link #identity()}.
 */
public interface StepOrigin {

    /**
     * Human-readable step name.
     */
    String name();

    /**
     * Stable identity token; compared by reference.
     */
    Object identity();

    /**
     * Handles every invocation of this step reads.
     */
    default List<Handle> inputs() {
        return List.of();
    }

    /**
     * Handles every invocation of this step produces; recorded steps use them as targets.
     */
    default List<Handle> outputs() {
        return List.of();
    }
}
