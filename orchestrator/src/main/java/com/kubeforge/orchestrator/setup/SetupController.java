package com.kubeforge.orchestrator.setup;

import com.kubeforge.orchestrator.model.SetupStepKind;
import com.kubeforge.orchestrator.node.NodeFault;
import com.kubeforge.orchestrator.node.NodeProxy;
import com.kubeforge.orchestrator.registry.StepKey;
import com.kubeforge.orchestrator.registry.StepRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Drives an ordered list of setup steps across a fixed node set.
 *
 * <p>Execution rules:
 * <ul>
 *   <li>Steps run strictly in the order they were added. A step starts only
 *       after the previous one has finished on every node (barrier per step).</li>
 *   <li>GLOBAL steps run once on the calling thread. A failure ends the run;
 *       no later step executes.</li>
 *   <li>PER_NODE steps fan out over the non-faulted nodes matching the step's
 *       filter, at most {@link #getMaxParallel()} at a time. A failure faults
 *       that node only: it is skipped by every later per-node step while the
 *       other nodes carry on.</li>
 *   <li>Every step body (except the built-in reachability probe) passes through
 *       the shared {@link StepRegistry}, so re-running the controller skips
 *       work that already completed.</li>
 *   <li>Registered disposables are closed when {@link #run()} returns, whatever
 *       the outcome.</li>
 * </ul>
 *
 * @param <C> typed setup context handed to every step body via {@link #context()}
 */
public class SetupController<C> {

    private static final Logger log = LoggerFactory.getLogger(SetupController.class);

    public static final int DEFAULT_MAX_PARALLEL = 500;

    private static final Duration DEFAULT_ONLINE_POLL_INTERVAL = Duration.ofSeconds(5);

    private final String          title;
    private final List<NodeProxy> nodes;
    private final StepRegistry    registry;
    private final C               context;
    private final MeterRegistry   meterRegistry;

    private final List<SetupStep<C>>          steps       = new CopyOnWriteArrayList<>();
    private final Set<String>                 stepKeys    = new HashSet<>();
    private final List<AutoCloseable>         disposables = new CopyOnWriteArrayList<>();
    private final List<SetupProgressListener> listeners   = new CopyOnWriteArrayList<>();
    private final List<String>                globalErrors = Collections.synchronizedList(new ArrayList<>());
    private final AtomicBoolean               running     = new AtomicBoolean();

    private volatile int            maxParallel        = DEFAULT_MAX_PARALLEL;
    private volatile Duration       onlinePollInterval = DEFAULT_ONLINE_POLL_INTERVAL;
    private volatile SetupStep<C>   currentStep;
    private volatile SetupRunResult lastResult;

    public SetupController(String title, List<NodeProxy> nodes, StepRegistry registry, C context,
                           MeterRegistry meterRegistry) {
        this.title         = Objects.requireNonNull(title, "title");
        this.nodes         = List.copyOf(nodes);
        this.registry      = Objects.requireNonNull(registry, "registry");
        this.context       = context;
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");

        Set<String> names = new HashSet<>();
        for (NodeProxy node : this.nodes) {
            if (!names.add(node.name())) {
                throw new IllegalArgumentException("Duplicate node name: " + node.name());
            }
        }
    }

    // ------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------

    public String          title()       { return title; }
    public List<NodeProxy> nodes()       { return nodes; }
    public StepRegistry    registry()    { return registry; }
    public C               context()     { return context; }
    public boolean         isRunning()   { return running.get(); }
    public SetupStep<C>    currentStep() { return currentStep; }
    public SetupRunResult  lastResult()  { return lastResult; }

    public List<SetupStep<C>> steps() {
        return Collections.unmodifiableList(steps);
    }

    public NodeProxy getNode(String name) {
        return nodes.stream()
                .filter(n -> n.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown node: " + name));
    }

    public int getMaxParallel() { return maxParallel; }

    /** Takes effect from the next per-node step; hosting managers lower this while provisioning. */
    public void setMaxParallel(int maxParallel) {
        if (maxParallel < 1) {
            throw new IllegalArgumentException("maxParallel must be >= 1");
        }
        this.maxParallel = maxParallel;
    }

    public void setOnlinePollInterval(Duration onlinePollInterval) {
        this.onlinePollInterval = Objects.requireNonNull(onlinePollInterval);
    }

    // ------------------------------------------------------------------
    // Step list construction
    // ------------------------------------------------------------------

    public void addGlobalStep(String name, GlobalStepAction<C> action) {
        addGlobalStep(name, keyFor(name), action);
    }

    public void addGlobalStep(String name, String key, GlobalStepAction<C> action) {
        Objects.requireNonNull(action, "action");
        addStep(SetupStep.global(name, key, action));
    }

    public void addNodeStep(String name, NodeStepAction<C> action) {
        addNodeStep(name, keyFor(name), action, null);
    }

    public void addNodeStep(String name, NodeStepAction<C> action, Predicate<NodeProxy> nodeFilter) {
        addNodeStep(name, keyFor(name), action, nodeFilter);
    }

    public void addNodeStep(String name, String key, NodeStepAction<C> action, Predicate<NodeProxy> nodeFilter) {
        Objects.requireNonNull(action, "action");
        addStep(SetupStep.perNode(name, key, action, nodeFilter, true));
    }

    /**
     * Adds a per-node probe that polls each node until it answers or
     * {@code timeout} passes. Nodes that never answer are faulted.
     *
     * Not recorded in the registry: reachability is re-checked on every run.
     */
    public void addWaitUntilOnlineStep(Duration timeout) {
        addStep(SetupStep.perNode("wait until online", keyFor("wait until online"),
                (controller, node) -> {
                    node.setStatus("waiting: online");
                    Waiter.waitFor("node [" + node.name() + "] to come online",
                            node::isOnline, timeout, onlinePollInterval);
                    node.setStatus("online");
                },
                null, false));
    }

    /** Closed when {@link #run()} returns, in reverse registration order. */
    public void addDisposable(AutoCloseable resource) {
        disposables.add(Objects.requireNonNull(resource, "resource"));
    }

    public void addProgressListener(SetupProgressListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    private void addStep(SetupStep<C> step) {
        if (running.get()) {
            throw new IllegalStateException("Cannot add steps while [" + title + "] is running");
        }
        synchronized (stepKeys) {
            if (!stepKeys.add(step.key())) {
                throw new IllegalArgumentException("Duplicate step key: " + step.key());
            }
        }
        steps.add(step);
    }

    /** Stable idempotency key derived from a step name, e.g. "prepare node" → "setup/prepare-node". */
    static String keyFor(String name) {
        Objects.requireNonNull(name, "name");
        String slug = name.trim().toLowerCase().replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
        if (slug.isEmpty()) {
            throw new IllegalArgumentException("Step name must contain letters or digits: '" + name + "'");
        }
        return "setup/" + slug;
    }

    // ------------------------------------------------------------------
    // Progress reporting
    // ------------------------------------------------------------------

    public void logProgress(String verb, String message) {
        log.info("{} {}", verb, message);
        listeners.forEach(l -> l.progress(null, verb, message));
    }

    public void logProgress(NodeProxy node, String verb, String message) {
        node.setStatus(verb + ": " + message);
        log.info("[{}] {} {}", node.name(), verb, message);
        listeners.forEach(l -> l.progress(node, verb, message));
    }

    /**
     * Reports a cluster-wide error. When called from a global step body, that
     * step fails once the body returns and the run stops.
     */
    public void logError(String message) {
        log.error(message);
        globalErrors.add(message);
        listeners.forEach(l -> l.error(null, message));
    }

    /** Reports an error for one node and faults it. */
    public void logError(NodeProxy node, String message) {
        log.error("[{}] {}", node.name(), message);
        SetupStep<C> step = currentStep;
        node.fault(step == null ? "" : step.name(), message);
        listeners.forEach(l -> l.error(node, message));
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    /**
     * Executes every step in order.
     *
     * Node faults are reported in the result, never thrown. A failed global
     * step is reported as {@link SetupRunResult#failedStep()}.
     *
     * @throws IllegalStateException if the controller is already running
     */
    public SetupRunResult run() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("[" + title + "] is already running");
        }

        Instant   start      = Instant.now();
        String    failedStep = null;
        Throwable failure    = null;

        log.info("# BEGIN: {} ({} node(s), {} step(s), maxParallel={})",
                title, nodes.size(), steps.size(), maxParallel);

        for (NodeProxy node : nodes) {
            node.clearFault();
            node.setStatus("");
        }
        steps.forEach(SetupStep::reset);

        try {
            for (SetupStep<C> step : steps) {
                currentStep = step;
                Throwable error = step.kind() == SetupStepKind.GLOBAL
                        ? executeGlobalStep(step)
                        : executeNodeStep(step);
                if (error != null) {
                    failedStep = step.name();
                    failure    = error;
                    break;
                }
            }
        } finally {
            currentStep = null;
            dispose();
            running.set(false);
        }

        Map<String, NodeFault> faults = new LinkedHashMap<>();
        for (NodeProxy node : nodes) {
            node.getFault().ifPresent(f -> faults.put(node.name(), f));
        }

        SetupRunResult result = new SetupRunResult(
                failedStep == null && faults.isEmpty(),
                faults, failedStep, failure, Duration.between(start, Instant.now()));
        lastResult = result;

        if (result.success()) {
            log.info("# END-SUCCESS: {} ({} ms)", title, result.elapsed().toMillis());
        } else if (result.isAborted()) {
            log.error("# END-FAILED: {} aborted at global step '{}': {}",
                    title, failedStep, failure == null ? "" : failure.getMessage());
        } else {
            log.error("# END-FAILED: {} finished with {} faulted node(s): {}",
                    title, faults.size(), faults.keySet());
        }
        return result;
    }

    /** @return the failure that must abort the run, or null when the step succeeded */
    private Throwable executeGlobalStep(SetupStep<C> step) {
        MDC.put("step", step.name());
        step.start();
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            log.info("Global step: {}", step.name());
            globalErrors.clear();
            boolean executed = registry.invokeIdempotent(StepKey.GLOBAL_SCOPE, step.key(), () -> {
                step.globalAction().run(this);
                if (!globalErrors.isEmpty()) {
                    throw new SetupException(String.join("; ", globalErrors));
                }
            });
            if (!executed) {
                skipped(step);
            }
            step.finish(true);
            return null;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            step.finish(false);
            log.error("Global step '{}' failed: {}", step.name(), e.getMessage(), e);
            listeners.forEach(l -> l.error(null, step.name() + ": " + e.getMessage()));
            return e;
        } finally {
            sample.stop(meterRegistry.timer("kubeforge.setup.step.duration",
                    "step", step.name(), "kind", "global"));
            MDC.remove("step");
        }
    }

    /**
     * Fans the step out over eligible nodes and waits for all of them.
     *
     * @return non-null only when the controller thread itself was interrupted
     */
    private Throwable executeNodeStep(SetupStep<C> step) {
        List<NodeProxy> eligible = nodes.stream()
                .filter(n -> !n.isFaulted())
                .filter(step::appliesTo)
                .toList();

        step.start();
        if (eligible.isEmpty()) {
            log.info("Node step: {} (no eligible nodes)", step.name());
            step.finish(true);
            return null;
        }

        int threads = Math.min(maxParallel, eligible.size());
        log.info("Node step: {} on {} node(s), parallel={}", step.name(), eligible.size(), threads);

        Timer.Sample    sample = Timer.start(meterRegistry);
        ExecutorService pool   = Executors.newFixedThreadPool(threads, workerThreads(step));
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (NodeProxy node : eligible) {
                futures.add(pool.submit(() -> executeOnNode(step, node)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            step.finish(false);
            return e;
        } catch (ExecutionException e) {
            // executeOnNode catches every Exception, so only an Error lands here.
            futures.forEach(f -> f.cancel(true));
            step.finish(false);
            return e.getCause();
        } finally {
            pool.shutdownNow();
            sample.stop(meterRegistry.timer("kubeforge.setup.step.duration",
                    "step", step.name(), "kind", "node"));
        }

        boolean anyFaulted = eligible.stream().anyMatch(NodeProxy::isFaulted);
        step.finish(!anyFaulted);
        return null;
    }

    private void executeOnNode(SetupStep<C> step, NodeProxy node) {
        MDC.put("node", node.name());
        MDC.put("step", step.name());
        try {
            if (step.isIdempotent()) {
                boolean executed = node.invokeIdempotent(step.key(), () -> {
                    step.nodeAction().run(this, node);
                    // A node faulted through logError must not have the step recorded as complete.
                    Optional<NodeFault> reported = node.getFault();
                    if (reported.isPresent()) {
                        throw new SetupException(reported.get().message());
                    }
                });
                if (!executed) {
                    skipped(step);
                }
            } else {
                step.nodeAction().run(this, node);
            }
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            meterRegistry.counter("kubeforge.setup.node.faults", "step", step.name()).increment();
            if (node.isFaulted()) {
                // Already reported through logError.
                return;
            }
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            node.fault(new NodeFault(step.name(), message, e));
            log.error("[{}] step '{}' failed: {}", node.name(), step.name(), message, e);
            listeners.forEach(l -> l.error(node, step.name() + ": " + message));
        } finally {
            MDC.remove("node");
            MDC.remove("step");
        }
    }

    private void skipped(SetupStep<C> step) {
        log.debug("Step '{}' already complete, skipped", step.name());
        meterRegistry.counter("kubeforge.setup.step.skipped", "step", step.name()).increment();
    }

    private static ThreadFactory workerThreads(SetupStep<?> step) {
        AtomicInteger counter = new AtomicInteger();
        String prefix = "setup-" + step.key().replace("setup/", "") + "-";
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private void dispose() {
        List<AutoCloseable> reversed = new ArrayList<>(disposables);
        Collections.reverse(reversed);
        for (AutoCloseable resource : reversed) {
            try {
                resource.close();
            } catch (Exception e) {
                log.warn("Could not dispose {}: {}", resource, e.getMessage());
            }
        }
        disposables.clear();
    }
}
