package org.kvplane.planner.predictor;

import org.kvplane.enums.PredictorType;

/**
 * Carries the last observed value forward
 */
public class ConstantPredictor extends SeriesLoadPredictor {

    @Override
    public PredictorType type() {
        return PredictorType.CONSTANT;
    }

    @Override
    public int minimumSamples() {
        return 1;
    }

    @Override
    protected double forecastNext(double[] series) {
        return series[series.length - 1];
    }
}
