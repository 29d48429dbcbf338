package org.kvplane.registry;

import lombok.extern.slf4j.Slf4j;
import org.kvplane.dao.worker.RuntimeConfig;
import org.kvplane.dao.worker.WorkerInfo;
import org.kvplane.dao.worker.WorkerMembership;
import org.kvplane.dao.worker.WorkerRef;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live set of workers.
 * <p>
 * Reads go to an immutable map swapped on every change, so {@link #snapshot()} and {@link #contains} never block.
 * Changes are serialized and listeners are notified synchronously, inside the change, after the new map is
 * published. When {@link #deregister} returns every listener has seen the removal.
 */
@Slf4j
@Component
public class WorkerRegistry implements WorkerMembership {

    private final ReentrantLock lock = new ReentrantLock();

    private final List<WorkerRegistryListener> listeners = new CopyOnWriteArrayList<>();

    private volatile Map<WorkerRef, RuntimeConfig> workers = Collections.emptyMap();

    @Override
    public Set<WorkerRef> snapshot() {
        return workers.keySet();
    }

    @Override
    public boolean contains(WorkerRef workerRef) {
        return workerRef != null && workers.containsKey(workerRef);
    }

    /**
     * @return runtime config of a live worker, null when the worker is unknown
     */
    public RuntimeConfig runtimeConfig(WorkerRef workerRef) {
        return workerRef == null ? null : workers.get(workerRef);
    }

    public int size() {
        return workers.size();
    }

    /**
     * Subscribe to membership changes. The listener first receives an add for every worker already registered.
     */
    public void subscribe(WorkerRegistryListener listener) {
        Objects.requireNonNull(listener, "listener");
        lock.lock();
        try {
            listeners.add(listener);
            workers.forEach(listener::onWorkerAdded);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Idempotent. Re-registering with a changed runtime config notifies listeners with an add.
     */
    public void register(WorkerRef worker, RuntimeConfig runtimeConfig) {
        Objects.requireNonNull(worker, "worker");
        RuntimeConfig config = runtimeConfig == null ? RuntimeConfig.defaults() : runtimeConfig;
        lock.lock();
        try {
            RuntimeConfig previous = workers.get(worker);
            if (config.equals(previous)) {
                return;
            }
            Map<WorkerRef, RuntimeConfig> next = new HashMap<>(workers);
            next.put(worker, config);
            workers = Collections.unmodifiableMap(next);
            log.info("{} worker {} with {}", previous == null ? "Registered" : "Updated", worker, config);
            for (WorkerRegistryListener listener : listeners) {
                notifyAdded(listener, worker, config);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove the worker. Unknown workers are ignored.
     */
    public void deregister(WorkerRef worker) {
        if (worker == null) {
            return;
        }
        lock.lock();
        try {
            if (!workers.containsKey(worker)) {
                return;
            }
            Map<WorkerRef, RuntimeConfig> next = new HashMap<>(workers);
            next.remove(worker);
            workers = Collections.unmodifiableMap(next);
            log.info("Deregistered worker {}", worker);
            for (WorkerRegistryListener listener : listeners) {
                notifyRemoved(listener, worker);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Bring the live set in line with a full discovery listing
     */
    public void reconcile(Collection<WorkerInfo> discovered) {
        Map<WorkerRef, RuntimeConfig> target = new HashMap<>();
        if (discovered != null) {
            for (WorkerInfo info : discovered) {
                if (info != null && info.getWorkerRef() != null) {
                    target.put(info.getWorkerRef(), info.getRuntimeConfig());
                }
            }
        }
        lock.lock();
        try {
            Set<WorkerRef> gone = new HashSet<>(workers.keySet());
            gone.removeAll(target.keySet());
            gone.forEach(this::deregister);
            target.forEach(this::register);
            if (!gone.isEmpty()) {
                log.info("Reconciled worker set, removed {}, live {}", gone, workers.size());
            }
        } finally {
            lock.unlock();
        }
    }

    private void notifyAdded(WorkerRegistryListener listener, WorkerRef worker, RuntimeConfig config) {
        try {
            listener.onWorkerAdded(worker, config);
        } catch (RuntimeException e) {
            log.error("Listener {} failed on add of worker {}", listener.getClass().getSimpleName(), worker, e);
        }
    }

    private void notifyRemoved(WorkerRegistryListener listener, WorkerRef worker) {
        try {
            listener.onWorkerRemoved(worker);
        } catch (RuntimeException e) {
            log.error("Listener {} failed on removal of worker {}", listener.getClass().getSimpleName(), worker, e);
        }
    }
}
