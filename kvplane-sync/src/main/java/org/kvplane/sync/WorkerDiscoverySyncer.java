package org.kvplane.sync;

import lombok.extern.slf4j.Slf4j;
import org.kvplane.discovery.ServiceDiscovery;
import org.kvplane.registry.WorkerRegistry;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;

/**
 * Keeps the registry in line with service discovery
 */
@Slf4j
@Component
public class WorkerDiscoverySyncer {

    private final ServiceDiscovery serviceDiscovery;

    private final WorkerRegistry workerRegistry;

    public WorkerDiscoverySyncer(ServiceDiscovery serviceDiscovery, WorkerRegistry workerRegistry) {
        this.serviceDiscovery = serviceDiscovery;
        this.workerRegistry = workerRegistry;
    }

    @PostConstruct
    public void start() {
        workerRegistry.reconcile(serviceDiscovery.getWorkers());
        serviceDiscovery.listen(workerRegistry::reconcile);
        log.info("Worker discovery sync started with {}, {} live workers",
                serviceDiscovery.getClass().getSimpleName(), workerRegistry.size());
    }
}
