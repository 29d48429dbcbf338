package org.kvplane.balance.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.kvplane.dao.worker.WorkerRef;
import org.kvplane.util.Logger;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reserved decode blocks and in-flight prefill tokens per worker, as reserve/release pairs keyed by request id.
 * <p>
 * Mutated by the scheduler loop only. Reads from other threads see a consistent value per worker field.
 */
@Slf4j
public class ActiveLoadTracker {

    private final Map<WorkerRef, WorkerLoad> loads = new ConcurrentHashMap<>();

    private final Map<String, Reservation> reservations = new ConcurrentHashMap<>();

    boolean hasReservation(String requestId) {
        return reservations.containsKey(requestId);
    }

    void reserve(String requestId, WorkerRef worker, long decodeBlocks, long prefillTokens) {
        reservations.put(requestId, new Reservation(requestId, worker, decodeBlocks, prefillTokens, false));
        loads.computeIfAbsent(worker, k -> new WorkerLoad()).add(decodeBlocks, prefillTokens);
    }

    /**
     * Release everything the request still holds
     *
     * @return false when the request holds nothing
     */
    boolean release(String requestId) {
        Reservation reservation = requestId == null ? null : reservations.remove(requestId);
        if (reservation == null) {
            Logger.debug("No reservation to free for request {}", requestId);
            return false;
        }
        WorkerLoad load = loads.get(reservation.getWorker());
        if (load != null) {
            load.subtract(reservation.getDecodeBlocks(), reservation.isPrefillDone() ? 0 : reservation.getPrefillTokens());
            if (load.isIdle()) {
                loads.remove(reservation.getWorker());
            }
        }
        return true;
    }

    /**
     * Release only the prefill tokens of the request. A second call is a no-op.
     */
    boolean markPrefillComplete(String requestId) {
        Reservation reservation = requestId == null ? null : reservations.get(requestId);
        if (reservation == null || reservation.isPrefillDone()) {
            return false;
        }
        reservation.setPrefillDone(true);
        WorkerLoad load = loads.get(reservation.getWorker());
        if (load != null) {
            load.subtract(0, reservation.getPrefillTokens());
        }
        return true;
    }

    WorkerLoad loadOf(WorkerRef worker) {
        return loads.getOrDefault(worker, WorkerLoad.EMPTY);
    }

    /**
     * Forget the worker and every reservation made on it
     */
    void removeWorker(WorkerRef worker) {
        loads.remove(worker);
        int dropped = 0;
        for (Reservation reservation : reservations.values()) {
            if (worker.equals(reservation.getWorker()) && reservations.remove(reservation.getRequestId()) != null) {
                dropped++;
            }
        }
        if (dropped > 0) {
            log.info("Dropped {} reservations of removed worker {}", dropped, worker);
        }
    }

    void clear() {
        loads.clear();
        reservations.clear();
    }

    public int reservationCount() {
        return reservations.size();
    }

    public long totalDecodeBlocks() {
        return loads.values().stream().mapToLong(WorkerLoad::getDecodeBlocks).sum();
    }

    public long totalPrefillTokens() {
        return loads.values().stream().mapToLong(WorkerLoad::getPrefillTokens).sum();
    }

    /**
     * @return copy of the non-idle workers' loads
     */
    public Map<WorkerRef, WorkerLoad> snapshot() {
        return Collections.unmodifiableMap(new HashMap<>(loads));
    }
}
