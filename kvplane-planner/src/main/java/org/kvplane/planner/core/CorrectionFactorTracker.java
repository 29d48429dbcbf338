package org.kvplane.planner.core;

import lombok.extern.slf4j.Slf4j;
import org.kvplane.config.PlannerConfig;
import org.kvplane.planner.domain.CorrectionFactors;
import org.kvplane.planner.domain.MetricsSample;
import org.kvplane.planner.domain.SlaTarget;

/**
 * Exponentially weighted ratio of observed latency to target latency, per role
 */
@Slf4j
public class CorrectionFactorTracker {

    private final double alpha;

    private final double min;

    private final double max;

    private volatile CorrectionFactors factors = CorrectionFactors.identity();

    public CorrectionFactorTracker(PlannerConfig config) {
        this.alpha = config.getCorrectionAlpha();
        this.min = config.getCorrectionMin();
        this.max = config.getCorrectionMax();
    }

    /**
     * Fold one interval into the factors. Intervals without traffic leave them unchanged, as does a non-positive
     * latency reading for the corresponding role.
     */
    public CorrectionFactors update(MetricsSample sample, SlaTarget sla) {
        if (!sample.hasTraffic()) {
            return factors;
        }
        CorrectionFactors previous = factors;
        double prefill = previous.getPrefill();
        double decode = previous.getDecode();
        if (sample.getTtftMs() > 0 && sla.getTtftMs() > 0) {
            prefill = smooth(sample.getTtftMs() / sla.getTtftMs(), prefill);
        }
        if (sample.getItlMs() > 0 && sla.getItlMs() > 0) {
            decode = smooth(sample.getItlMs() / sla.getItlMs(), decode);
        }
        CorrectionFactors next = new CorrectionFactors(prefill, decode);
        log.debug("correction factors {} -> {}", previous, next);
        factors = next;
        return next;
    }

    public CorrectionFactors current() {
        return factors;
    }

    private double smooth(double observed, double previous) {
        double value = alpha * observed + (1 - alpha) * previous;
        return Math.max(min, Math.min(max, value));
    }
}
