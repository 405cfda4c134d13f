package io.surfworks.tileforge.trace;

import io.surfworks.tileforge.config.TraceOptions;
import io.surfworks.tileforge.graph.GraphDump;
import io.surfworks.tileforge.graph.Handle;
import io.surfworks.tileforge.graph.KernelNode;
import io.surfworks.tileforge.graph.LaunchConfig;
import io.surfworks.tileforge.graph.LoopNode;
import io.surfworks.tileforge.graph.Node;
import io.surfworks.tileforge.graph.StepNode;
import io.surfworks.tileforge.graph.StepOrigin;
import io.surfworks.tileforge.symbolic.Coord;
import io.surfworks.tileforge.symbolic.Coords;
import io.surfworks.tileforge.symbolic.SymbolSource;
import io.surfworks.tileforge.symbolic.SymbolicInt;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Builds the Kernel/Loop/Step graph of one trace.
 *
 * <p>A context moves through three states as the traced program runs:
 * <pre>
 * IDLE --openKernel--&gt; IN_KERNEL --openLoop--&gt; IN_NESTED_LOOP(k) --closeLoop--&gt; ... --&gt; IN_KERNEL --closeKernel--&gt; IDLE
 * </pre>
 * The current scope is the innermost open loop; new loops and steps are appended
 * to it. Every node gets the next id from a single counter shared by all kinds.
 *
 * <p>Contexts are activated on a per-thread stack so that a trace can run inside
 * another one:
 * <pre>{@code
 * try (GraphContext ctx = new GraphContext().enter()) {
 *     ctx.openKernel("add_kernel");
 *     ctx.openLoop();
 *     ctx.recordStep(load, Coord.of(0));
 *     ctx.closeLoop();
 *     ctx.closeKernel();
 *     GraphDump.dump(ctx.kernels().get(0));
 * }
 * }</pre>
 *
 * <p>Thread safety: a context belongs to the first thread that enters or mutates
 * it; use from any other thread fails with {@link IllegalStateException} unless
 * {@link TraceOptions#guardThread()} is off.
 */
public final class GraphContext implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(GraphContext.class.getName());

    private static final ThreadLocal<Deque<GraphContext>> ACTIVE = ThreadLocal.withInitial(ArrayDeque::new);

    /**
     * Position of a context in its kernel/loop state machine.
     */
    public enum State {
        IDLE,
        IN_KERNEL,
        IN_NESTED_LOOP
    }

    private final TraceOptions options;
    private final SymbolSource gridSymbols;
    private final SymbolSource loopSymbols;

    private final List<Node> nodes = new ArrayList<>();
    private final Map<Node, Integer> registered = new IdentityHashMap<>();
    private final List<KernelNode> kernels = new ArrayList<>();

    private final Map<Object, Integer> definitionIds = new IdentityHashMap<>();
    private final List<StepOrigin> definitions = new ArrayList<>();
    private final List<StepInvocation> invocations = new ArrayList<>();

    private KernelNode currentKernel;
    private LoopNode currentScope;
    private Thread owner;

    public GraphContext() {
        this(TraceOptions.defaults());
    }

    public GraphContext(TraceOptions options) {
        this.options = Objects.requireNonNull(options, "options cannot be null");
        this.gridSymbols = new SymbolSource(options.gridSymbolPrefix());
        this.loopSymbols = new SymbolSource(options.loopSymbolPrefix());
    }

    // ==================== Activation ====================

    /**
     * Returns the innermost context entered on this thread.
     */
    public static Optional<GraphContext> current() {
        return Optional.ofNullable(ACTIVE.get().peek());
    }

    /**
     * Pushes this context onto the current thread's active stack.
     *
     * @return this context, for try-with-resources
     * @throws IllegalStateException if this context is already active
     */
    public GraphContext enter() {
        checkThread();
        Deque<GraphContext> stack = ACTIVE.get();
        if (stack.contains(this)) {
            throw new IllegalStateException("GraphContext already entered");
        }
        stack.push(this);
        LOG.fine("Entered graph context (depth " + stack.size() + ")");
        return this;
    }

    /**
     * Pops this context from the current thread's active stack.
     *
     * @throws IllegalStateException if this context is not the innermost active one
     */
    public void exit() {
        Deque<GraphContext> stack = ACTIVE.get();
        if (stack.peek() != this) {
            throw new IllegalStateException("GraphContext is not the innermost active context");
        }
        stack.pop();
        LOG.fine("Exited graph context (depth " + stack.size() + ")");
    }

    public boolean isActive() {
        return ACTIVE.get().contains(this);
    }

    /**
     * Exits this context if it is active. Idempotent.
     */
    @Override
    public void close() {
        if (isActive()) {
            exit();
        }
    }

    // ==================== Registration ====================

    /**
     * Registers a node and assigns it the next id.
     *
     * @return the assigned id
     * @throws TraceException DUPLICATE_NODE if the node is already registered
     */
    public int registerNode(Node node) {
        Objects.requireNonNull(node, "node cannot be null");
        checkThread();
        Integer existing = registered.get(node);
        if (existing != null) {
            throw new TraceException("Node " + node + " already registered as id=" + existing,
                    TraceException.ErrorCode.DUPLICATE_NODE);
        }
        if (node.isRegistered()) {
            throw new TraceException("Node " + node + " already registered in another context",
                    TraceException.ErrorCode.DUPLICATE_NODE);
        }
        int id = nodes.size();
        node.assignId(id);
        nodes.add(node);
        registered.put(node, id);
        LOG.fine("Registered " + node);
        return id;
    }

    /**
     * Binds a step definition to a definition id in this context.
     *
     * <p>Registering the same definition again returns its existing id. A different
     * definition sharing the same identity token is rejected, so one physical step
     * cannot appear as two unrelated graph nodes.
     *
     * @return the definition id
     * @throws TraceException DUPLICATE_STEP_DEFINITION on an identity clash
     */
    public int registerDefinition(StepOrigin origin) {
        Objects.requireNonNull(origin, "origin cannot be null");
        checkThread();
        Integer existing = definitionIds.get(origin.identity());
        if (existing != null) {
            StepOrigin bound = definitions.get(existing);
            if (bound != origin) {
                throw new TraceException("Step identity of " + origin.name()
                        + " already bound to definition id=" + existing + " (" + bound.name() + ")",
                        TraceException.ErrorCode.DUPLICATE_STEP_DEFINITION);
            }
            return existing;
        }
        int id = definitions.size();
        definitions.add(origin);
        definitionIds.put(origin.identity(), id);
        return id;
    }

    // ==================== Scopes ====================

    /**
     * Opens a single-block kernel with an unbound tag template.
     *
     * @see #openKernel(String, LaunchConfig, Coord, List, List)
     */
    public KernelNode openKernel(String name) {
        return openKernel(name, LaunchConfig.SINGLE, Coord.unbound(), List.of(), List.of());
    }

    /**
     * Opens a kernel and its grid loop, making the grid loop the current scope.
     *
     * <p>The grid loop's tag is {@code tagTemplate} bound with a fresh grid symbol.
     *
     * @throws TraceException NESTED_KERNEL if a kernel is already open
     */
    public KernelNode openKernel(String name, LaunchConfig launchConfig, Coord tagTemplate,
                                 List<Handle> inputs, List<Handle> outputs) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(tagTemplate, "tagTemplate cannot be null");
        checkThread();
        if (currentKernel != null) {
            throw new TraceException("Already in kernel " + currentKernel.name()
                    + "; cannot launch " + name + " within a kernel",
                    TraceException.ErrorCode.NESTED_KERNEL);
        }

        SymbolicInt.Symbol induction = gridSymbols.next();
        LoopNode grid = LoopNode.grid(Coords.bind(tagTemplate, induction), induction);
        KernelNode kernel = new KernelNode(name, tagTemplate, launchConfig, grid, inputs, outputs);
        kernel.setVisualize(options.visualizeKernels());
        grid.setVisualize(options.visualizeLoops());

        registerNode(kernel);
        registerNode(grid);
        kernels.add(kernel);
        currentKernel = kernel;
        currentScope = grid;
        LOG.fine("Opened kernel " + name + " with " + launchConfig);
        return kernel;
    }

    /**
     * Opens a loop under the current scope and makes it the current scope.
     *
     * <p>The loop's tag is the enclosing loop's tag bound with a fresh loop symbol.
     *
     * @throws TraceException SCOPE_ERROR if no kernel is open
     */
    public LoopNode openLoop() {
        checkThread();
        requireKernel("open a loop");
        SymbolicInt.Symbol induction = loopSymbols.next();
        LoopNode loop = LoopNode.nested(Coords.bind(currentScope.tag(), induction), induction);
        loop.setVisualize(options.visualizeLoops());
        registerNode(loop);
        currentScope.addChild(loop);
        currentScope = loop;
        return loop;
    }

    /**
     * Closes the current loop, returning to its parent.
     *
     * @throws TraceException SCOPE_ERROR if no kernel is open or the current scope is the grid loop
     */
    public void closeLoop() {
        checkThread();
        requireKernel("close a loop");
        if (currentScope.isGridLoop()) {
            throw TraceException.scope("Cannot close the grid loop of " + currentKernel.name()
                    + "; that would exit the kernel");
        }
        LoopNode parent = currentScope.parent();
        if (parent == null) {
            throw TraceException.scope("Current loop " + currentScope + " has no parent");
        }
        currentScope = parent;
    }

    /**
     * Records a step invocation reading and producing the origin's declared handles.
     *
     * @see #recordStep(StepOrigin, Coord, List, List)
     */
    public StepNode recordStep(StepOrigin origin, Coord tag) {
        Objects.requireNonNull(origin, "origin cannot be null");
        return recordStep(origin, tag, origin.inputs(), origin.outputs());
    }

    /**
     * Records a step invocation under the current scope.
     *
     * @throws TraceException SCOPE_ERROR if no kernel is open, or
     *         DUPLICATE_STEP_DEFINITION if the origin's identity is bound to another definition
     */
    public StepNode recordStep(StepOrigin origin, Coord tag, List<Handle> inputs, List<Handle> outputs) {
        Objects.requireNonNull(origin, "origin cannot be null");
        Objects.requireNonNull(tag, "tag cannot be null");
        checkThread();
        requireKernel("record step " + origin.name());
        int definitionId = registerDefinition(origin);

        StepNode step = new StepNode(origin, tag, inputs, outputs);
        step.setVisualize(options.visualizeSteps());
        registerNode(step);
        currentScope.addChild(step);
        invocations.add(new StepInvocation(definitionId, tag, step));
        return step;
    }

    /**
     * Closes the open kernel. Its subtree rejects further changes.
     *
     * @return the closed kernel
     * @throws TraceException SCOPE_ERROR unless the current scope is the kernel's grid loop
     */
    public KernelNode closeKernel() {
        checkThread();
        if (currentKernel == null) {
            throw TraceException.scope("Not in a kernel; nothing to close");
        }
        if (currentScope != currentKernel.gridLoop()) {
            throw TraceException.scope("Cannot close kernel " + currentKernel.name()
                    + " with " + currentScope.depth() + " loop(s) still open");
        }
        KernelNode closed = currentKernel;
        closed.close();
        currentKernel = null;
        currentScope = null;
        LOG.fine("Closed kernel " + closed.name() + " (" + nodes.size() + " nodes in context)");
        return closed;
    }

    // ==================== Queries ====================

    public TraceOptions options() {
        return options;
    }

    public State state() {
        if (currentKernel == null) {
            return State.IDLE;
        }
        return currentScope.isGridLoop() ? State.IN_KERNEL : State.IN_NESTED_LOOP;
    }

    /**
     * Number of loops open below the grid loop; 0 when idle or at the grid loop.
     */
    public int loopDepth() {
        return currentScope == null ? 0 : currentScope.depth();
    }

    public Optional<KernelNode> currentKernel() {
        return Optional.ofNullable(currentKernel);
    }

    /**
     * Returns the current scope, or empty when no kernel is open.
     */
    public Optional<LoopNode> currentScope() {
        return Optional.ofNullable(currentScope);
    }

    /**
     * Returns all kernels in launch order; the index is the kernel id.
     */
    public List<KernelNode> kernels() {
        return Collections.unmodifiableList(kernels);
    }

    /**
     * Returns the node with the given id.
     *
     * @throws IndexOutOfBoundsException if no such node exists
     */
    public Node node(int id) {
        return nodes.get(id);
    }

    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Returns the id bound to a step definition, if it has been recorded in this context.
     */
    public Optional<Integer> definitionId(StepOrigin origin) {
        Integer id = definitionIds.get(origin.identity());
        return id != null && definitions.get(id) == origin ? Optional.of(id) : Optional.empty();
    }

    /**
     * Returns every recorded invocation, in recording order.
     */
    public List<StepInvocation> invocations() {
        return Collections.unmodifiableList(invocations);
    }

    /**
     * Returns the recorded invocations of one step definition, in recording order.
     */
    public List<StepInvocation> invocations(StepOrigin origin) {
        Optional<Integer> id = definitionId(origin);
        if (id.isEmpty()) {
            return List.of();
        }
        List<StepInvocation> result = new ArrayList<>();
        for (StepInvocation invocation : invocations) {
            if (invocation.definitionId() == id.get()) {
                result.add(invocation);
            }
        }
        return result;
    }

    /**
     * Dumps every kernel in launch order, each headed by its kernel id.
     */
    public List<String> dumpAll() {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < kernels.size(); i++) {
            lines.add("Kernel " + i + ":");
            for (String line : GraphDump.dump(kernels.get(i))) {
                lines.add(GraphDump.INDENT + line);
            }
        }
        return lines;
    }

    private void requireKernel(String action) {
        if (currentKernel == null) {
            throw TraceException.scope("Cannot " + action + " outside of a kernel");
        }
    }

    private void checkThread() {
        if (!options.guardThread()) {
            return;
        }
        Thread caller = Thread.currentThread();
        if (owner == null) {
            owner = caller;
        } else if (owner != caller) {
            throw new IllegalStateException("GraphContext owned by thread " + owner.getName()
                    + " used from " + caller.getName() + "; concurrent tracing is unsupported");
        }
    }

    @Override
    public String toString() {
        return String.format("GraphContext[state=%s, kernels=%d, nodes=%d]",
                state(), kernels.size(), nodes.size());
    }
}
