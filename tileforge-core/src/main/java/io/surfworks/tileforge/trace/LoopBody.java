package io.surfworks.tileforge.trace;

import io.surfworks.tileforge.symbolic.SymbolicInt;

/**
 * Body of a loop run through {@link Tracer#range}.
 */
@FunctionalInterface
public interface LoopBody {

    /**
     * @param index the induction variable: a loop symbol when recording,
     *              a concrete value when executing
     */
    void run(SymbolicInt index);
}
