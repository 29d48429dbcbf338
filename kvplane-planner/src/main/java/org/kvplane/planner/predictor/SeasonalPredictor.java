package org.kvplane.planner.predictor;

import org.kvplane.enums.PredictorType;

/**
 * Additive Holt-Winters smoothing. Level and trend start from the first two seasons, seasonal terms from the first
 * season's deviations.
 */
public class SeasonalPredictor extends SeriesLoadPredictor {

    static final double ALPHA = 0.5;

    static final double BETA = 0.1;

    static final double GAMMA = 0.1;

    private final int seasonLength;

    public SeasonalPredictor(int seasonLength) {
        if (seasonLength < 2) {
            throw new IllegalArgumentException("season length must be at least 2, got " + seasonLength);
        }
        this.seasonLength = seasonLength;
    }

    @Override
    public PredictorType type() {
        return PredictorType.SEASONAL;
    }

    @Override
    public int minimumSamples() {
        return 2 * seasonLength;
    }

    @Override
    protected double forecastNext(double[] series) {
        int m = seasonLength;
        int n = series.length;
        if (n < 2 * m) {
            return series[n - 1];
        }
        double firstMean = mean(series, 0, m);
        double secondMean = mean(series, m, 2 * m);
        double level = firstMean;
        double trend = (secondMean - firstMean) / m;
        double[] seasonal = new double[m];
        for (int i = 0; i < m; i++) {
            seasonal[i] = series[i] - firstMean;
        }
        for (int t = m; t < n; t++) {
            double previousSeasonal = seasonal[t % m];
            double previousLevel = level;
            level = ALPHA * (series[t] - previousSeasonal) + (1 - ALPHA) * (level + trend);
            trend = BETA * (level - previousLevel) + (1 - BETA) * trend;
            seasonal[t % m] = GAMMA * (series[t] - level) + (1 - GAMMA) * previousSeasonal;
        }
        return level + trend + seasonal[n % m];
    }
}
