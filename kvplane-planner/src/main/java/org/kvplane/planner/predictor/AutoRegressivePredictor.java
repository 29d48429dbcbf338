package org.kvplane.planner.predictor;

import org.kvplane.enums.PredictorType;

/**
 * AR(p) model fitted with the Yule-Walker equations, solved by the Levinson-Durbin recursion.
 */
public class AutoRegressivePredictor extends SeriesLoadPredictor {

    private final int order;

    public AutoRegressivePredictor(int order) {
        if (order < 1) {
            throw new IllegalArgumentException("AR order must be positive, got " + order);
        }
        this.order = order;
    }

    @Override
    public PredictorType type() {
        return PredictorType.AUTOREGRESSIVE;
    }

    @Override
    public int minimumSamples() {
        return 2 * order + 1;
    }

    @Override
    protected double forecastNext(double[] series) {
        int n = series.length;
        double mu = mean(series, 0, n);
        double[] centered = new double[n];
        for (int i = 0; i < n; i++) {
            centered[i] = series[i] - mu;
        }
        int p = Math.min(order, n - 1);
        double[] r = autocovariance(centered, p);
        if (r[0] <= 0) {
            // constant series
            return mu;
        }
        double[] phi = levinsonDurbin(r, p);
        double forecast = mu;
        for (int j = 1; j <= p; j++) {
            forecast += phi[j] * centered[n - j];
        }
        return forecast;
    }

    /**
     * Biased sample autocovariance for lags {@code 0..maxLag}
     */
    static double[] autocovariance(double[] centered, int maxLag) {
        int n = centered.length;
        double[] r = new double[maxLag + 1];
        for (int k = 0; k <= maxLag; k++) {
            double sum = 0;
            for (int t = k; t < n; t++) {
                sum += centered[t] * centered[t - k];
            }
            r[k] = sum / n;
        }
        return r;
    }

    /**
     * @return coefficients {@code phi[1..p]}, {@code phi[0]} unused
     */
    static double[] levinsonDurbin(double[] r, int p) {
        double[] phi = new double[p + 1];
        double error = r[0];
        for (int k = 1; k <= p; k++) {
            double acc = r[k];
            for (int j = 1; j < k; j++) {
                acc -= phi[j] * r[k - j];
            }
            double reflection = acc / error;
            double[] next = phi.clone();
            next[k] = reflection;
            for (int j = 1; j < k; j++) {
                next[j] = phi[j] - reflection * phi[k - j];
            }
            phi = next;
            error *= 1 - reflection * reflection;
            if (error <= 0) {
                break;
            }
        }
        return phi;
    }
}
