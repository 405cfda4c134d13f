package io.surfworks.tileforge.trace;

import io.surfworks.tileforge.graph.Handle;
import io.surfworks.tileforge.graph.StepOrigin;
import io.surfworks.tileforge.symbolic.Coord;
import io.surfworks.tileforge.symbolic.SymbolicInt;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A reusable leaf computation whose invocations become Step nodes when recording.
 *
 * <p>The tag of each invocation comes from its {@link TagSource}: either a fixed
 * coordinate, or the argument passed for one of the declared parameters.
 * <pre>{@code
 * StepDefinition load = new StepDefinition("load", List.of("c", "src"),
 *         TagSource.parameter("c"), args -> copyTile(args[1]))
 *     .withOutputs("tile");
 *
 * Tracer.range(0, 4, 1, i -> load.invoke(Coord.of(grid, i), src));
 * }</pre>
 *
 * <p>Each constructor call creates a fresh identity token. Copies made with
 * {@code withInputs}/{@code withOutputs} keep their source's token, since they
 * describe the same step; {@link #withIdentity(Object)} sets one explicitly. A
 * context rejects recording two different definitions under one token.
 */
public final class StepDefinition implements StepOrigin {

    private final String name;
    private final List<String> parameters;
    private final TagSource tagSource;
    private final StepBody body;
    private final Object identity;
    private final List<Handle> inputs;
    private final List<Handle> outputs;
    private final int tagParameterIndex;

    /**
     * @throws TraceException LOOKUP_FAILURE if {@code tagSource} names a parameter
     *         not in {@code parameters}
     */
    public StepDefinition(String name, List<String> parameters, TagSource tagSource, StepBody body) {
        this(name, parameters, tagSource, body, new Object(), List.of(), List.of());
    }

    private StepDefinition(String name, List<String> parameters, TagSource tagSource, StepBody body,
                           Object identity, List<Handle> inputs, List<Handle> outputs) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.parameters = List.copyOf(parameters);
        this.tagSource = Objects.requireNonNull(tagSource, "tagSource cannot be null");
        this.body = Objects.requireNonNull(body, "body cannot be null");
        this.identity = Objects.requireNonNull(identity, "identity cannot be null");
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);

        if (tagSource instanceof TagSource.Parameter parameter) {
            int index = this.parameters.indexOf(parameter.name());
            if (index < 0) {
                throw new TraceException("Step " + name + " has no parameter '" + parameter.name()
                        + "' to take its tag from; parameters are " + this.parameters,
                        TraceException.ErrorCode.LOOKUP_FAILURE);
            }
            this.tagParameterIndex = index;
        } else {
            this.tagParameterIndex = -1;
        }
    }

    /**
     * Creates a parameterless step whose invocations all carry {@code tag}.
     */
    public static StepDefinition literal(String name, Coord tag, StepBody body) {
        return new StepDefinition(name, List.of(), TagSource.literal(tag), body);
    }

    /**
     * Returns a copy reading the given input handles.
     */
    public StepDefinition withInputs(String... names) {
        return new StepDefinition(name, parameters, tagSource, body, identity, handles(names), outputs);
    }

    /**
     * Returns a copy producing the given output handles; these become the step's targets.
     */
    public StepDefinition withOutputs(String... names) {
        return new StepDefinition(name, parameters, tagSource, body, identity, inputs, handles(names));
    }

    /**
     * Returns a copy using an explicit identity token.
     */
    public StepDefinition withIdentity(Object identity) {
        return new StepDefinition(name, parameters, tagSource, body, identity, inputs, outputs);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Object identity() {
        return identity;
    }

    public List<String> parameters() {
        return parameters;
    }

    public TagSource tagSource() {
        return tagSource;
    }

    @Override
    public List<Handle> inputs() {
        return inputs;
    }

    @Override
    public List<Handle> outputs() {
        return outputs;
    }

    /**
     * Invokes this step: records a Step node when recording, then runs the body.
     *
     * @param args one argument per declared parameter
     * @return the body's result
     * @throws IllegalArgumentException if the argument count is wrong or the tag
     *         argument is not a coordinate, symbolic value or integer
     */
    public Object invoke(Object... args) {
        Object[] actual = args == null ? new Object[0] : args;
        if (actual.length != parameters.size()) {
            throw new IllegalArgumentException("Step " + name + " expects " + parameters.size()
                    + " argument(s) " + parameters + ", got " + actual.length);
        }
        Tracer.step(this, resolveTag(actual), inputs, outputs);
        return body.apply(actual);
    }

    /**
     * Resolves the tag an invocation with these arguments would carry.
     */
    public Coord resolveTag(Object[] args) {
        if (tagSource instanceof TagSource.Literal literal) {
            return literal.coord();
        }
        Object arg = args[tagParameterIndex];
        if (arg instanceof Coord || arg instanceof SymbolicInt || arg instanceof Integer || arg instanceof Long) {
            return Coord.from(arg);
        }
        String type = arg == null ? "null" : arg.getClass().getName();
        throw new IllegalArgumentException("Tag argument '" + parameters.get(tagParameterIndex)
                + "' of step " + name + " must be a Coord, SymbolicInt or integer, got " + type);
    }

    private static List<Handle> handles(String... names) {
        List<Handle> result = new ArrayList<>(names.length);
        for (String n : names) {
            result.add(Handle.of(n));
        }
        return result;
    }

    @Override
    public String toString() {
        return "StepDefinition[" + name + parameters + ", tag=" + tagSource + "]";
    }
}
