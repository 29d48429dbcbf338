package org.kvplane.config;

import lombok.extern.slf4j.Slf4j;
import org.kvplane.balance.router.KvRouter;
import org.kvplane.balance.scheduler.KvScheduler;
import org.kvplane.cache.core.KvIndexer;
import org.kvplane.cache.core.KvIndexerFactory;
import org.kvplane.cache.hash.BlockHasher;
import org.kvplane.cache.monitor.CacheMetricsReporter;
import org.kvplane.discovery.ServiceDiscovery;
import org.kvplane.discovery.StaticServiceDiscovery;
import org.kvplane.discovery.ZookeeperServiceDiscovery;
import org.kvplane.enums.DiscoveryType;
import org.kvplane.registry.IndexerEvictionListener;
import org.kvplane.registry.WorkerRegistry;
import org.kvplane.service.monitor.RoutingReporter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the routing stack. The indexer and the scheduler subscribe to the registry here, so worker removal evicts
 * index entries synchronously and reaches the scheduler as a command.
 */
@Slf4j
@Configuration
public class RouterConfiguration {

    @Bean(destroyMethod = "shutdown")
    public ServiceDiscovery serviceDiscovery(ConfigService configService) {
        RouterConfig config = configService.routerConfig();
        if (config.getDiscoveryType() == DiscoveryType.ZOOKEEPER) {
            ZookeeperServiceDiscovery discovery =
                    new ZookeeperServiceDiscovery(config.getZkConnectString(), config.getZkWorkerPath());
            discovery.start();
            return discovery;
        }
        return StaticServiceDiscovery.fromEnvironment();
    }

    @Bean
    public BlockHasher blockHasher(ConfigService configService) {
        return new BlockHasher(configService.routerConfig().getBlockSize());
    }

    @Bean
    public KvIndexer kvIndexer(ConfigService configService, WorkerRegistry workerRegistry,
                               CacheMetricsReporter cacheMetricsReporter) {
        KvIndexer indexer = KvIndexerFactory.create(configService.routerConfig(), workerRegistry, cacheMetricsReporter);
        workerRegistry.subscribe(new IndexerEvictionListener(indexer));
        return indexer;
    }

    @Bean(destroyMethod = "shutdown")
    public KvScheduler kvScheduler(ConfigService configService, WorkerRegistry workerRegistry,
                                   RoutingReporter routingReporter) {
        KvScheduler scheduler = new KvScheduler(configService.routerConfig(), workerRegistry, routingReporter);
        // started before subscribing so the replayed adds are accepted
        scheduler.start();
        workerRegistry.subscribe(scheduler);
        return scheduler;
    }

    @Bean
    public KvRouter kvRouter(ConfigService configService, BlockHasher blockHasher, KvIndexer kvIndexer,
                             WorkerRegistry workerRegistry, KvScheduler kvScheduler,
                             CacheMetricsReporter cacheMetricsReporter) {
        return new KvRouter(configService.routerConfig(), blockHasher, kvIndexer, workerRegistry, kvScheduler,
                cacheMetricsReporter);
    }
}
