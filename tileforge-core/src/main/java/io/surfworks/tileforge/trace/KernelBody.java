package io.surfworks.tileforge.trace;

import io.surfworks.tileforge.symbolic.SymbolicInt;

/**
 * Body of a kernel launched through {@link Tracer#launch}.
 */
@FunctionalInterface
public interface KernelBody {

    /**
     * @param block the linear block index: the grid induction symbol when recording,
     *              a concrete index when executing
     */
    void run(SymbolicInt block);
}
