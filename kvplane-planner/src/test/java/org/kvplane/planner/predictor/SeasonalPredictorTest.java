package org.kvplane.planner.predictor;

import org.junit.jupiter.api.Test;
import org.kvplane.planner.domain.LoadForecast;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.kvplane.planner.predictor.PredictorTestSupport.samples;

class SeasonalPredictorTest {

    @Test
    void should_require_two_seasons() {
        assertEquals(16, new SeasonalPredictor(8).minimumSamples());
    }

    @Test
    void should_repeat_periodic_pattern() {
        LoadForecast forecast = new SeasonalPredictor(4)
                .fitPredict(samples(10, 20, 30, 40, 10, 20, 30, 40, 10, 20, 30, 40, 10, 20));

        assertEquals(30, forecast.getRequestCount(), 1e-9);
        assertEquals(30, forecast.getInputLen(), 1e-9);
    }

    @Test
    void should_clamp_negative_forecast_to_zero() {
        LoadForecast forecast = new SeasonalPredictor(2).fitPredict(samples(30, 20, 10, 0));

        assertEquals(0, forecast.getRequestCount());
        assertEquals(0, forecast.getOutputLen());
    }
}
