package io.surfworks.tileforge.trace;

import io.surfworks.tileforge.graph.StepNode;
import io.surfworks.tileforge.symbolic.Coord;

/**
 * One recorded use of a step definition inside a context.
 *
 * @param definitionId id the context assigned to the step definition
 * @param tag          tag the step was invoked with
 * @param node         the step node created for this invocation
 */
public record StepInvocation(int definitionId, Coord tag, StepNode node) {
}
