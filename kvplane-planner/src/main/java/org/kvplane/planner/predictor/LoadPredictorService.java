package org.kvplane.planner.predictor;

import lombok.extern.slf4j.Slf4j;
import org.kvplane.planner.domain.LoadForecast;
import org.kvplane.planner.domain.MetricsSample;

import java.util.List;

/**
 * Runs the configured predictor, falling back to {@link ConstantPredictor} while the window is too short or when
 * the fit degenerates.
 */
@Slf4j
public class LoadPredictorService {

    private final LoadPredictor predictor;

    private final LoadPredictor fallback = new ConstantPredictor();

    public LoadPredictorService(LoadPredictor predictor) {
        this.predictor = predictor;
    }

    public LoadForecast predict(List<MetricsSample> window) {
        if (window.size() < predictor.minimumSamples()) {
            log.info("cold start, {} of {} samples for {}, using constant forecast",
                    window.size(), predictor.minimumSamples(), predictor.type());
            return fallback.fitPredict(window);
        }
        LoadForecast forecast;
        try {
            forecast = predictor.fitPredict(window);
        } catch (ArithmeticException | IllegalArgumentException e) {
            log.warn("{} predictor failed, using constant forecast", predictor.type(), e);
            return fallback.fitPredict(window);
        }
        if (!isFinite(forecast)) {
            log.info("{} predictor produced {}, using constant forecast", predictor.type(), forecast);
            return fallback.fitPredict(window);
        }
        return forecast;
    }

    public LoadPredictor getPredictor() {
        return predictor;
    }

    private static boolean isFinite(LoadForecast forecast) {
        return Double.isFinite(forecast.getRequestCount())
                && Double.isFinite(forecast.getInputLen())
                && Double.isFinite(forecast.getOutputLen());
    }
}
