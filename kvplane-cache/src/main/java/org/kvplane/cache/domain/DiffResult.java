package org.kvplane.cache.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.kvplane.dao.worker.WorkerRef;

import java.util.Collections;
import java.util.Set;

/**
 * Difference between the indexed blocks of a worker and a full listing it reported
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiffResult {

    @Builder.Default
    private Set<Long> addedBlocks = Collections.emptySet();

    @Builder.Default
    private Set<Long> removedBlocks = Collections.emptySet();

    private WorkerRef worker;

    public boolean hasChanges() {
        return !addedBlocks.isEmpty() || !removedBlocks.isEmpty();
    }

    public static DiffResult empty(WorkerRef worker) {
        return DiffResult.builder()
                .worker(worker)
                .build();
    }
}
