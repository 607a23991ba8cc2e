package com.kubeforge.orchestrator.setup;

import com.kubeforge.orchestrator.model.SetupStepKind;
import com.kubeforge.orchestrator.model.SetupStepState;
import com.kubeforge.orchestrator.node.NodeProxy;

import java.time.Instant;
import java.util.function.Predicate;

/**
 * One entry in a controller's ordered step list.
 *
 * Exactly one of {@code globalAction} / {@code nodeAction} is set, matching
 * {@link #kind()}. State and timestamps are written by the controller thread
 * and read by status observers.
 */
public class SetupStep<C> {

    private final String                name;
    private final String                key;
    private final SetupStepKind         kind;
    private final GlobalStepAction<C>   globalAction;
    private final NodeStepAction<C>     nodeAction;
    private final Predicate<NodeProxy>  nodeFilter;
    private final boolean               idempotent;

    private volatile SetupStepState state = SetupStepState.PENDING;
    private volatile Instant        startedAt;
    private volatile Instant        finishedAt;

    private SetupStep(String name, String key, SetupStepKind kind,
                      GlobalStepAction<C> globalAction, NodeStepAction<C> nodeAction,
                      Predicate<NodeProxy> nodeFilter, boolean idempotent) {
        this.name         = name;
        this.key          = key;
        this.kind         = kind;
        this.globalAction = globalAction;
        this.nodeAction   = nodeAction;
        this.nodeFilter   = nodeFilter;
        this.idempotent   = idempotent;
    }

    static <C> SetupStep<C> global(String name, String key, GlobalStepAction<C> action) {
        return new SetupStep<>(name, key, SetupStepKind.GLOBAL, action, null, node -> true, true);
    }

    static <C> SetupStep<C> perNode(String name, String key, NodeStepAction<C> action,
                                    Predicate<NodeProxy> filter, boolean idempotent) {
        return new SetupStep<>(name, key, SetupStepKind.PER_NODE, null, action,
                filter == null ? node -> true : filter, idempotent);
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String         name()       { return name; }
    public String         key()        { return key; }
    public SetupStepKind  kind()       { return kind; }
    public SetupStepState state()      { return state; }
    public Instant        startedAt()  { return startedAt; }
    public Instant        finishedAt() { return finishedAt; }

    /** False only for built-in probes that must re-run every time, such as "wait until online". */
    public boolean isIdempotent()      { return idempotent; }

    GlobalStepAction<C>  globalAction() { return globalAction; }
    NodeStepAction<C>    nodeAction()   { return nodeAction; }

    boolean appliesTo(NodeProxy node) {
        return nodeFilter.test(node);
    }

    // ------------------------------------------------------------------
    // State transitions (controller thread only)
    // ------------------------------------------------------------------

    void reset() {
        state      = SetupStepState.PENDING;
        startedAt  = null;
        finishedAt = null;
    }

    void start() {
        state     = SetupStepState.RUNNING;
        startedAt = Instant.now();
    }

    void finish(boolean success) {
        state      = success ? SetupStepState.DONE : SetupStepState.FAILED;
        finishedAt = Instant.now();
    }

    @Override
    public String toString() {
        return name + " [" + kind + ", " + state + "]";
    }
}
