package org.kvplane.config;

import lombok.Getter;
import lombok.Setter;
import org.kvplane.enums.DiscoveryType;
import org.kvplane.enums.IndexerMode;
import org.kvplane.enums.RouterMode;

/**
 * Router and scheduler settings, loaded from {@code KVPLANE_ROUTER_CONFIG}
 */
@Getter
@Setter
public class RouterConfig {

    private RouterMode routerMode = RouterMode.KV;

    private IndexerMode indexerMode = IndexerMode.EXACT;

    /**
     * Tokens per KV block, must match the engines
     */
    private int blockSize = 16;

    /**
     * Weight of the normalized prefix overlap against the load penalty
     */
    private double overlapScoreWeight = 1.0;

    /**
     * Softmax temperature, 0 selects the best score deterministically
     */
    private double temperature = 0.0;

    /**
     * When false nothing is reserved and every load penalty is zero
     */
    private boolean trackActiveBlocks = true;

    /**
     * Bounded wait for a scheduler decision
     */
    private long schedulerTimeoutMs = 50;

    private int schedulerQueueSize = 4096;

    /**
     * How long the approximate indexer assumes a routed block stays cached
     */
    private long approxTtlSecs = 120;

    /**
     * KV capacity of one GPU, used when a worker does not report its total blocks
     */
    private long defaultKvBlocksPerGpu = 4096;

    private DiscoveryType discoveryType = DiscoveryType.STATIC;

    private String zkConnectString = "127.0.0.1:2181";

    private String zkWorkerPath = "/kvplane/workers";
}
