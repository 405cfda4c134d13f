package io.surfworks.tileforge.lift;

/**
 * A program to trace. Its kernel launches, loops and steps go through
 * {@link io.surfworks.tileforge.trace.Tracer} and {@link io.surfworks.tileforge.trace.StepDefinition}.
 */
@FunctionalInterface
public interface TracedProgram {

    void run();
}
