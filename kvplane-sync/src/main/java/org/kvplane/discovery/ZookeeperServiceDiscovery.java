package org.kvplane.discovery;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.framework.recipes.cache.ChildData;
import org.apache.curator.framework.recipes.cache.CuratorCache;
import org.apache.curator.framework.recipes.cache.CuratorCacheListener;
import org.apache.curator.retry.ExponentialBackoffRetry;
import org.apache.curator.utils.CloseableUtils;
import org.apache.curator.utils.ZKPaths;
import org.kvplane.dao.worker.RuntimeConfig;
import org.kvplane.dao.worker.WorkerInfo;
import org.kvplane.dao.worker.WorkerRef;
import org.kvplane.enums.StatusEnum;
import org.kvplane.util.JsonUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * ZookeeperServiceDiscovery - workers register ephemeral nodes under one parent path.
 * <p>
 * Each child is named {@code <workerId>-<dpRank>} and holds the worker's {@link RuntimeConfig} as JSON. An empty
 * payload means default runtime config. Listeners get the full list after every change of the subtree.
 */
@Slf4j
public class ZookeeperServiceDiscovery implements ServiceDiscovery {

    private static final int CONNECT_TIMEOUT_MS = 10000;

    private final CuratorFramework client;

    private final String workerPath;

    private final List<WorkerChangeListener> listeners = new CopyOnWriteArrayList<>();

    private CuratorCache cache;

    public ZookeeperServiceDiscovery(String connectString, String workerPath) {
        this(CuratorFrameworkFactory.builder()
                .connectString(connectString)
                .sessionTimeoutMs(CONNECT_TIMEOUT_MS)
                .connectionTimeoutMs(CONNECT_TIMEOUT_MS)
                .retryPolicy(new ExponentialBackoffRetry(1000, 3))
                .build(), workerPath);
    }

    ZookeeperServiceDiscovery(CuratorFramework client, String workerPath) {
        this.client = client;
        this.workerPath = workerPath;
    }

    public void start() {
        try {
            client.start();
            if (!client.blockUntilConnected(CONNECT_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                throw StatusEnum.SERVICE_DISCOVERY_ERROR.toException(
                        "zookeeper not connected within " + CONNECT_TIMEOUT_MS + "ms");
            }
            cache = CuratorCache.build(client, workerPath);
            cache.listenable().addListener(CuratorCacheListener.builder()
                    .forAll((type, oldData, data) -> fireChanged())
                    .build());
            cache.start();
            log.info("Watching workers under zookeeper path {}", workerPath);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown();
            throw StatusEnum.SERVICE_DISCOVERY_ERROR.toException("interrupted while connecting to zookeeper", e);
        }
    }

    @Override
    public List<WorkerInfo> getWorkers() {
        if (cache == null) {
            return new ArrayList<>();
        }
        return cache.stream()
                .filter(data -> isDirectChild(data.getPath()))
                .map(this::toWorker)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    @Override
    public void listen(WorkerChangeListener listener) {
        listeners.add(listener);
    }

    @Override
    public void shutdown() {
        if (cache != null) {
            CloseableUtils.closeQuietly(cache);
        }
        CloseableUtils.closeQuietly(client);
        log.info("ZookeeperServiceDiscovery shutdown");
    }

    private void fireChanged() {
        List<WorkerInfo> workers = getWorkers();
        for (WorkerChangeListener listener : listeners) {
            try {
                listener.onWorkersChanged(workers);
            } catch (RuntimeException e) {
                log.error("Worker change listener failed", e);
            }
        }
    }

    private boolean isDirectChild(String path) {
        return workerPath.equals(ZKPaths.getPathAndNode(path).getPath());
    }

    private WorkerInfo toWorker(ChildData data) {
        String node = ZKPaths.getNodeFromPath(data.getPath());
        try {
            return parseNode(node, data.getData());
        } catch (RuntimeException e) {
            log.warn("Skipping malformed worker node {}: {}", data.getPath(), e.getMessage());
            return null;
        }
    }

    /**
     * @param nodeName node name, {@code <workerId>-<dpRank>}
     * @param payload  JSON runtime config, may be empty
     */
    static WorkerInfo parseNode(String nodeName, byte[] payload) {
        int dash = nodeName.lastIndexOf('-');
        if (dash <= 0 || dash == nodeName.length() - 1) {
            throw StatusEnum.SERVICE_DISCOVERY_ERROR.toException("invalid worker node name: " + nodeName);
        }
        WorkerRef worker;
        try {
            worker = WorkerRef.of(Long.parseLong(nodeName.substring(0, dash)),
                    Integer.parseInt(nodeName.substring(dash + 1)));
        } catch (IllegalArgumentException e) {
            throw StatusEnum.SERVICE_DISCOVERY_ERROR.toException("invalid worker node name: " + nodeName, e);
        }
        String json = payload == null ? null : new String(payload, StandardCharsets.UTF_8);
        RuntimeConfig runtimeConfig = StringUtils.isBlank(json)
                ? RuntimeConfig.defaults()
                : JsonUtils.toObject(json, RuntimeConfig.class);
        return WorkerInfo.of(worker, runtimeConfig);
    }
}
