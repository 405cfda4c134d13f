package io.surfworks.tileforge.trace;

/**
 * The computation a step definition performs on each invocation.
 */
@FunctionalInterface
public interface StepBody {

    /**
     * @param args the invocation arguments, in parameter order
     * @return the step's result, or null
     */
    Object apply(Object[] args);
}
