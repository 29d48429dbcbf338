package org.kvplane.planner.predictor;

import org.kvplane.planner.domain.LoadForecast;
import org.kvplane.planner.domain.MetricsSample;

import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Fits request count, input length and output length independently with the same univariate model
 */
public abstract class SeriesLoadPredictor implements LoadPredictor {

    @Override
    public LoadForecast fitPredict(List<MetricsSample> samples) {
        if (samples.isEmpty()) {
            return LoadForecast.zero();
        }
        return new LoadForecast(
                nonNegative(forecastNext(series(samples, MetricsSample::getRequestCount))),
                nonNegative(forecastNext(series(samples, MetricsSample::getInputLen))),
                nonNegative(forecastNext(series(samples, MetricsSample::getOutputLen))));
    }

    /**
     * One step ahead forecast of a non-empty series
     */
    protected abstract double forecastNext(double[] series);

    private static double[] series(List<MetricsSample> samples, ToDoubleFunction<MetricsSample> field) {
        return samples.stream().mapToDouble(field).toArray();
    }

    // NaN passes through so the caller can detect a degenerate fit
    private static double nonNegative(double value) {
        return value < 0 ? 0 : value;
    }

    static double mean(double[] series, int from, int to) {
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += series[i];
        }
        return sum / (to - from);
    }
}
