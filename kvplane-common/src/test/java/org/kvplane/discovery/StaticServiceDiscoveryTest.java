package org.kvplane.discovery;

import org.junit.jupiter.api.Test;
import org.kvplane.dao.worker.WorkerInfo;
import org.kvplane.dao.worker.WorkerRef;
import org.kvplane.exception.ServiceDiscoveryException;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StaticServiceDiscoveryTest {

    @Test
    void should_parse_worker_id_rank_and_gpus() {
        StaticServiceDiscovery discovery = new StaticServiceDiscovery(" 1, 2/1 ,3@4,4/2@8 ");

        List<WorkerInfo> workers = discovery.getWorkers();

        assertEquals(4, workers.size());
        assertEquals(WorkerRef.of(1), workers.get(0).getWorkerRef());
        assertEquals(1, workers.get(0).getRuntimeConfig().getGpuCount());
        assertEquals(WorkerRef.of(2, 1), workers.get(1).getWorkerRef());
        assertEquals(4, workers.get(2).getRuntimeConfig().getGpuCount());
        assertEquals(WorkerRef.of(4, 2), workers.get(3).getWorkerRef());
        assertEquals(8, workers.get(3).getRuntimeConfig().getGpuCount());
    }

    @Test
    void should_return_empty_list_when_not_configured() {
        assertTrue(new StaticServiceDiscovery(null).getWorkers().isEmpty());
        assertTrue(new StaticServiceDiscovery("  ").getWorkers().isEmpty());
    }

    @Test
    void should_reject_malformed_entry() {
        assertThrows(ServiceDiscoveryException.class, () -> new StaticServiceDiscovery("1,abc"));
    }

    @Test
    void should_deliver_workers_once_on_listen() {
        StaticServiceDiscovery discovery = new StaticServiceDiscovery("7,8");
        List<List<WorkerInfo>> deliveries = new ArrayList<>();

        discovery.listen(deliveries::add);

        assertEquals(1, deliveries.size());
        assertEquals(2, deliveries.get(0).size());
    }
}
