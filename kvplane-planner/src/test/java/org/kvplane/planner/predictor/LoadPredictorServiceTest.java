package org.kvplane.planner.predictor;

import org.junit.jupiter.api.Test;
import org.kvplane.config.PlannerConfig;
import org.kvplane.enums.PredictorType;
import org.kvplane.exception.ConfigException;
import org.kvplane.planner.domain.LoadForecast;
import org.kvplane.planner.domain.MetricsSample;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.kvplane.planner.predictor.PredictorTestSupport.samples;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LoadPredictorServiceTest {

    @Test
    void should_use_constant_forecast_during_cold_start() {
        LoadPredictor autoRegressive = mock(LoadPredictor.class);
        when(autoRegressive.minimumSamples()).thenReturn(7);
        when(autoRegressive.type()).thenReturn(PredictorType.AUTOREGRESSIVE);

        LoadForecast forecast = new LoadPredictorService(autoRegressive).predict(samples(5, 6, 9));

        assertEquals(9, forecast.getRequestCount());
        verify(autoRegressive, never()).fitPredict(anyList());
    }

    @Test
    void should_forecast_zero_for_empty_window() {
        LoadPredictorService service = new LoadPredictorService(new AutoRegressivePredictor(3));

        assertEquals(LoadForecast.zero(), service.predict(Collections.emptyList()));
    }

    @Test
    void should_fall_back_when_fit_is_not_finite() {
        LoadPredictor broken = mock(LoadPredictor.class);
        when(broken.minimumSamples()).thenReturn(1);
        when(broken.type()).thenReturn(PredictorType.SEASONAL);
        when(broken.fitPredict(anyList())).thenReturn(new LoadForecast(Double.NaN, 1, 1));

        LoadForecast forecast = new LoadPredictorService(broken).predict(samples(3, 4));

        assertEquals(4, forecast.getRequestCount());
    }

    @Test
    void should_use_configured_predictor_once_window_is_full() {
        List<MetricsSample> window = samples(10, 20, 10, 20, 10, 20, 10, 20, 10, 20, 10, 20, 10, 20, 10, 20, 10, 20, 10, 20);
        LoadPredictorService service = new LoadPredictorService(new AutoRegressivePredictor(1));

        assertEquals(10.25, service.predict(window).getRequestCount(), 1e-9);
    }

    @Test
    void should_create_registered_predictors() {
        PlannerConfig config = new PlannerConfig();
        config.setArOrder(2);
        config.setSeasonLength(6);

        assertInstanceOf(ConstantPredictor.class, LoadPredictorFactory.create(PredictorType.CONSTANT, config));
        assertEquals(5, LoadPredictorFactory.create(PredictorType.AUTOREGRESSIVE, config).minimumSamples());
        assertEquals(12, LoadPredictorFactory.create(PredictorType.SEASONAL, config).minimumSamples());
        assertThrows(ConfigException.class, () -> LoadPredictorFactory.create(null, config));
    }
}
