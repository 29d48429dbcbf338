package org.kvplane.planner.predictor;

import org.junit.jupiter.api.Test;
import org.kvplane.planner.domain.LoadForecast;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.kvplane.planner.predictor.PredictorTestSupport.samples;

class AutoRegressivePredictorTest {

    @Test
    void should_require_two_p_plus_one_samples() {
        assertEquals(7, new AutoRegressivePredictor(3).minimumSamples());
        assertEquals(3, new AutoRegressivePredictor(1).minimumSamples());
        assertThrows(IllegalArgumentException.class, () -> new AutoRegressivePredictor(0));
    }

    @Test
    void should_forecast_mean_of_constant_series() {
        LoadForecast forecast = new AutoRegressivePredictor(3).fitPredict(samples(42, 42, 42, 42, 42, 42, 42, 42));

        assertEquals(42, forecast.getRequestCount(), 1e-9);
        assertEquals(42, forecast.getOutputLen(), 1e-9);
    }

    @Test
    void should_follow_alternating_series() {
        double[] values = new double[20];
        for (int i = 0; i < values.length; i++) {
            values[i] = i % 2 == 0 ? 10 : 20;
        }

        LoadForecast forecast = new AutoRegressivePredictor(1).fitPredict(samples(values));

        // phi = -0.95 on the centered series, last value +5 above the mean of 15
        assertEquals(10.25, forecast.getRequestCount(), 1e-9);
    }

    @Test
    void should_solve_yule_walker_for_known_autocovariance() {
        // AR(1) with phi 0.5 has r[k] = 0.5^k * r[0]
        double[] phi = AutoRegressivePredictor.levinsonDurbin(new double[]{1.0, 0.5, 0.25}, 2);

        assertArrayEquals(new double[]{0.0, 0.5, 0.0}, phi, 1e-12);
    }
}
