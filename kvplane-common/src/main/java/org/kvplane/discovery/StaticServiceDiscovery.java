package org.kvplane.discovery;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.kvplane.dao.worker.RuntimeConfig;
import org.kvplane.dao.worker.WorkerInfo;
import org.kvplane.dao.worker.WorkerRef;
import org.kvplane.enums.StatusEnum;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * StaticServiceDiscovery - fixed worker list, by default read from the {@code KVPLANE_WORKERS} environment variable
 * <p>
 * Format: {@code id[/dpRank][@gpus]} entries separated by commas, e.g. {@code 1,2/1,3@4}
 */
@Slf4j
public final class StaticServiceDiscovery implements ServiceDiscovery {

    public static final String ENV_WORKERS = "KVPLANE_WORKERS";

    private final List<WorkerInfo> workers;

    public StaticServiceDiscovery(String workersConfig) {
        this.workers = parse(workersConfig);
    }

    public static StaticServiceDiscovery fromEnvironment() {
        return new StaticServiceDiscovery(System.getenv(ENV_WORKERS));
    }

    @Override
    public List<WorkerInfo> getWorkers() {
        return workers;
    }

    @Override
    public void listen(WorkerChangeListener listener) {
        log.info("StaticServiceDiscovery does not support dynamic listening, delivering {} workers once", workers.size());
        if (listener != null) {
            listener.onWorkersChanged(workers);
        }
    }

    @Override
    public void shutdown() {
        log.info("StaticServiceDiscovery shutdown");
    }

    static List<WorkerInfo> parse(String workersConfig) {
        if (StringUtils.isBlank(workersConfig)) {
            log.warn("No static workers configured, expected env var: {}", ENV_WORKERS);
            return Collections.emptyList();
        }
        return Arrays.stream(workersConfig.split(","))
                .map(String::trim)
                .filter(StringUtils::isNotBlank)
                .map(StaticServiceDiscovery::parseWorker)
                .collect(Collectors.toUnmodifiableList());
    }

    private static WorkerInfo parseWorker(String entry) {
        try {
            String idPart = entry;
            int gpus = 1;
            int at = entry.indexOf('@');
            if (at >= 0) {
                gpus = Integer.parseInt(entry.substring(at + 1).trim());
                idPart = entry.substring(0, at);
            }
            int dpRank = 0;
            int slash = idPart.indexOf('/');
            if (slash >= 0) {
                dpRank = Integer.parseInt(idPart.substring(slash + 1).trim());
                idPart = idPart.substring(0, slash);
            }
            long workerId = Long.parseLong(idPart.trim());
            return WorkerInfo.of(WorkerRef.of(workerId, dpRank), RuntimeConfig.builder().gpuCount(gpus).build());
        } catch (IllegalArgumentException e) {
            throw StatusEnum.SERVICE_DISCOVERY_ERROR.toException(
                    "invalid worker entry: " + entry + ", expected id[/dpRank][@gpus]", e);
        }
    }
}
