package org.kvplane.dao.worker;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-worker runtime facts published when the worker registers
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuntimeConfig {

    /**
     * GPUs used by one replica of this worker
     */
    @Builder.Default
    private int gpuCount = 1;

    /**
     * Free-form engine name, e.g. vllm, sglang, trtllm
     */
    private String engineType;

    /**
     * Total KV blocks the worker can hold, 0 when unknown
     */
    private long totalKvBlocks;

    /**
     * KV capacity in blocks, falling back to {@code gpuCount * defaultKvBlocksPerGpu} when the worker did not report one
     */
    public long kvCapacityBlocks(long defaultKvBlocksPerGpu) {
        if (totalKvBlocks > 0) {
            return totalKvBlocks;
        }
        return Math.max(1, gpuCount) * Math.max(1, defaultKvBlocksPerGpu);
    }

    public static RuntimeConfig defaults() {
        return RuntimeConfig.builder().build();
    }
}
