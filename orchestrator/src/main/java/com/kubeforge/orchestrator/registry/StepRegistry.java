package com.kubeforge.orchestrator.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Completion set for setup steps, keyed by {@link StepKey}.
 *
 * <p>Presence of a key means the step finished successfully; there is no
 * payload. Once marked, a key is never executed again for the lifetime of
 * this registry.
 *
 * <p>Concurrency model:
 * <ul>
 *   <li>The completion set is a concurrent set, so lookups never block.</li>
 *   <li>Each key gets its own lock, held while that key's body runs.
 *       Callers racing on the same key are serialized: the loser waits,
 *       re-checks the set and skips the body if the winner succeeded.
 *       Different keys never contend. A key's lock is dropped once the
 *       key is complete.</li>
 *   <li>Bodies may call back into the registry for other keys. A nested
 *       call for the key whose body is already running on the current
 *       thread short-circuits instead of recursing.</li>
 * </ul>
 */
public class StepRegistry {

    private static final Logger log = LoggerFactory.getLogger(StepRegistry.class);

    private final Set<StepKey>                       completed = ConcurrentHashMap.newKeySet();
    private final ConcurrentHashMap<StepKey, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final List<CompletionListener>           listeners = new CopyOnWriteArrayList<>();

    public boolean isComplete(String scope, String key) {
        return completed.contains(new StepKey(scope, key));
    }

    public boolean isComplete(StepKey key) {
        return completed.contains(key);
    }

    /** Idempotent: marking an already complete key is a no-op. */
    public void markComplete(String scope, String key) {
        markComplete(new StepKey(scope, key));
    }

    public void markComplete(StepKey key) {
        if (completed.add(key)) {
            for (CompletionListener listener : listeners) {
                listener.completed(key);
            }
        }
    }

    /**
     * Run {@code body} unless {@code (scope, key)} is already complete.
     *
     * The key is marked complete only when the body returns normally. If the
     * body throws, the exception propagates and the key stays unmarked, so a
     * later call retries it.
     *
     * @return true when the body was invoked and completed, false when skipped
     */
    public boolean invokeIdempotent(String scope, String key, StepBody body) throws Exception {
        StepKey stepKey = new StepKey(scope, key);
        if (completed.contains(stepKey)) {
            log.debug("Skipping completed step {}", stepKey);
            return false;
        }

        ReentrantLock lock = locks.computeIfAbsent(stepKey, k -> new ReentrantLock());
        if (lock.isHeldByCurrentThread()) {
            log.debug("Step {} is already running on this thread, skipping nested call", stepKey);
            return false;
        }

        lock.lock();
        try {
            if (completed.contains(stepKey)) {
                log.debug("Step {} completed while waiting, skipping", stepKey);
                return false;
            }
            body.run();
            markComplete(stepKey);
            // Later callers stop at the completion check and never need the lock again.
            locks.remove(stepKey, lock);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Seed the registry with keys completed by an earlier run. Listeners are
     * not notified for restored keys.
     */
    public void restore(Collection<StepKey> keys) {
        completed.addAll(keys);
        log.info("Restored {} completed step(s)", keys.size());
    }

    /** Point-in-time copy of the completion set. */
    public Set<StepKey> snapshot() {
        return Set.copyOf(completed);
    }

    /** Number of keys currently holding a lock entry. */
    int lockCount() {
        return locks.size();
    }

    public void addListener(CompletionListener listener) {
        listeners.add(listener);
    }
}
