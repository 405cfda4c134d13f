package io.surfworks.tileforge.graph;

import io.surfworks.tileforge.symbolic.Coord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One traced invocation of a step definition.
 */
public final class StepNode extends Node {

    private final StepOrigin origin;
    private final List<Handle> inputs;
    private final List<Handle> outputs;

    public StepNode(StepOrigin origin, Coord tag, List<Handle> inputs, List<Handle> outputs) {
        super(tag);
        this.origin = Objects.requireNonNull(origin, "origin cannot be null");
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STEP;
    }

    /**
     * Returns the output handle names, in declaration order.
     */
    @Override
    public List<String> targets() {
        List<String> names = new ArrayList<>(outputs.size());
        for (Handle output : outputs) {
            names.add(output.name());
        }
        return names;
    }

    public StepOrigin origin() {
        return origin;
    }

    public String name() {
        return origin.name();
    }

    public List<Handle> inputs() {
        return inputs;
    }

    public List<Handle> outputs() {
        return outputs;
    }

    @Override
    public String describe() {
        return "<Step> " + origin.name() + " [" + tag().toText() + "] id=" + id();
    }
}
