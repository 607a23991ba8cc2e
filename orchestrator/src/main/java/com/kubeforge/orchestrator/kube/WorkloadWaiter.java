package com.kubeforge.orchestrator.kube;

import com.kubeforge.orchestrator.retry.Sleeper;
import com.kubeforge.orchestrator.setup.Waiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Blocks until every matching workload is ready.
 *
 * An empty listing and a failed API call both mean "not ready yet": right
 * after a chart install the objects may not exist and the API server may be
 * briefly unavailable. Gives up with a
 * {@link com.kubeforge.orchestrator.setup.SetupTimeoutException}.
 */
public class WorkloadWaiter {

    private static final Logger log = LoggerFactory.getLogger(WorkloadWaiter.class);

    private final KubernetesClient client;
    private final Duration         timeout;
    private final Duration         pollInterval;
    private final Sleeper          sleeper;

    public WorkloadWaiter(KubernetesClient client, Duration timeout, Duration pollInterval) {
        this(client, timeout, pollInterval, Sleeper.SYSTEM);
    }

    public WorkloadWaiter(KubernetesClient client, Duration timeout, Duration pollInterval, Sleeper sleeper) {
        this.client       = client;
        this.timeout      = timeout;
        this.pollInterval = pollInterval;
        this.sleeper      = sleeper;
    }

    public void waitForReady(WorkloadKind kind, String namespace, String labelSelector) throws InterruptedException {
        String what = kind.resource() + " in [" + namespace + "]"
                + (labelSelector == null ? "" : " matching [" + labelSelector + "]");
        Waiter.waitFor(what, () -> isReady(kind, namespace, labelSelector), timeout, pollInterval, sleeper);
        log.info("{} ready", what);
    }

    boolean isReady(WorkloadKind kind, String namespace, String labelSelector) {
        try {
            List<WorkloadStatus> workloads = client.listWorkloads(kind, namespace, labelSelector);
            if (workloads.isEmpty()) {
                return false;
            }
            for (WorkloadStatus workload : workloads) {
                if (!workload.isReady()) {
                    log.debug("{} {}/{} not ready: {}/{}", kind, namespace, workload.name(),
                            workload.ready(), workload.desired());
                    return false;
                }
            }
            return true;
        } catch (RuntimeException e) {
            log.debug("Listing {} in {} failed, treating as not ready: {}", kind, namespace, e.getMessage());
            return false;
        }
    }
}
