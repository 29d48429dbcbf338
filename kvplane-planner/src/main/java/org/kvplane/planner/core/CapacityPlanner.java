package org.kvplane.planner.core;

import lombok.extern.slf4j.Slf4j;
import org.kvplane.config.PlannerConfig;
import org.kvplane.planner.domain.CorrectionFactors;
import org.kvplane.planner.domain.LoadForecast;
import org.kvplane.planner.domain.ReplicaPlan;
import org.kvplane.planner.domain.SlaTarget;
import org.kvplane.planner.profile.PerformanceProfile;

/**
 * Turns a traffic forecast into prefill and decode replica counts that meet the latency targets within the GPU
 * budget. Holds no state.
 */
@Slf4j
public class CapacityPlanner {

    private final PlannerConfig config;

    private final PerformanceProfile profile;

    public CapacityPlanner(PlannerConfig config, PerformanceProfile profile) {
        this.config = config;
        this.profile = profile;
    }

    public ReplicaPlan plan(LoadForecast forecast, SlaTarget sla, CorrectionFactors factors) {
        long prefill = prefillReplicas(forecast, factors);
        long decode = decodeReplicas(forecast, sla, factors);
        ReplicaPlan plan = applyBudget(prefill, decode);
        log.info("forecast {} with factors {} -> prefill {} (raw {}), decode {} (raw {})", forecast, factors,
                plan.getPrefillReplicas(), prefill, plan.getDecodeReplicas(), decode);
        return plan;
    }

    long prefillReplicas(LoadForecast forecast, CorrectionFactors factors) {
        double interval = config.getAdjustmentIntervalSecs();
        double requiredTokensPerSec = forecast.getRequestCount() * forecast.getInputLen() / interval
                * factors.getPrefill();
        double throughputPerGpu = profile.prefillThroughputPerGpu(forecast.getInputLen());
        return replicasFor(requiredTokensPerSec, throughputPerGpu * config.getPrefillGpusPerReplica());
    }

    long decodeReplicas(LoadForecast forecast, SlaTarget sla, CorrectionFactors factors) {
        double interval = config.getAdjustmentIntervalSecs();
        double correctedItl = sla.getItlMs() / factors.getDecode();
        double contextLen = forecast.getInputLen() + forecast.getOutputLen() / 2;
        double throughputPerGpu = profile.decodeThroughputPerGpu(correctedItl, contextLen);
        double requiredTokensPerSec = forecast.getRequestCount() * forecast.getOutputLen() / interval;
        return replicasFor(requiredTokensPerSec, throughputPerGpu * config.getDecodeGpusPerReplica());
    }

    private static long replicasFor(double required, double perReplica) {
        if (required <= 0) {
            return 0;
        }
        if (perReplica <= 0) {
            return Integer.MAX_VALUE;
        }
        return (long) Math.min(Integer.MAX_VALUE, Math.ceil(required / perReplica));
    }

    /**
     * Scale both roles by the same ratio when their demand exceeds the budget, then clamp each to
     * {@code [minReplicas, budget / gpusPerReplica]}.
     */
    ReplicaPlan applyBudget(long prefill, long decode) {
        int gpuBudget = config.getGpuBudget();
        int prefillGpus = config.getPrefillGpusPerReplica();
        int decodeGpus = config.getDecodeGpusPerReplica();
        int minPrefill = config.getMinPrefillReplicas();
        int minDecode = config.getMinDecodeReplicas();

        ReplicaPlan.ReplicaPlanBuilder plan = ReplicaPlan.builder()
                .unclampedPrefillReplicas(toInt(prefill))
                .unclampedDecodeReplicas(toInt(decode));

        if (gpuBudget <= 0) {
            return plan.prefillReplicas(toInt(Math.max(prefill, minPrefill)))
                    .decodeReplicas(toInt(Math.max(decode, minDecode)))
                    .build();
        }

        if ((long) minPrefill * prefillGpus + (long) minDecode * decodeGpus > gpuBudget) {
            log.warn("minimum replicas prefill {} x {} GPUs + decode {} x {} GPUs exceed GPU budget {}",
                    minPrefill, prefillGpus, minDecode, decodeGpus, gpuBudget);
            return plan.prefillReplicas(minPrefill)
                    .decodeReplicas(minDecode)
                    .capacityInfeasible(true)
                    .build();
        }

        double demand = (double) prefill * prefillGpus + (double) decode * decodeGpus;
        if (demand > gpuBudget) {
            double scale = gpuBudget / demand;
            prefill = (long) Math.floor(prefill * scale);
            decode = (long) Math.floor(decode * scale);
        }
        prefill = clamp(prefill, minPrefill, gpuBudget / prefillGpus);
        decode = clamp(decode, minDecode, gpuBudget / decodeGpus);

        // raising a role to its minimum can push the pair over budget again
        while (prefill * prefillGpus + decode * decodeGpus > gpuBudget) {
            boolean shrinkPrefill = prefill > minPrefill
                    && (decode <= minDecode || prefill * prefillGpus >= decode * decodeGpus);
            if (shrinkPrefill) {
                prefill--;
            } else {
                decode--;
            }
        }
        return plan.prefillReplicas(toInt(prefill))
                .decodeReplicas(toInt(decode))
                .build();
    }

    private static long clamp(long value, long min, long max) {
        return Math.max(min, Math.min(max, value));
    }

    private static int toInt(long value) {
        return (int) Math.min(Integer.MAX_VALUE, value);
    }
}
