package revenue.ml;

import revenue.data.TimeSeries;

import java.util.Arrays;

/**
 * Classical additive decomposition: series = trend + seasonal + residual.
 * <p>
 * The trend is a centered moving average over one period (a 2 x s average for even s), the
 * seasonal component is the per-position mean of the detrended series, centered to sum to zero.
 * Trend and residual are NaN for the half period at each end where the average is undefined.
 */
public class SeasonalDecomposer {

    private final int period;

    public SeasonalDecomposer() {
        this(SeasonalOrder.DEFAULT_PERIOD);
    }

    public SeasonalDecomposer(int period) {
        if (period < 2) throw new IllegalArgumentException("Period must be at least 2: " + period);
        this.period = period;
    }

    public Decomposition decompose(TimeSeries series) {
        return decompose(series.values());
    }

    public Decomposition decompose(double[] x) {
        int n = x.length;
        if (n < 2 * period) {
            throw new IllegalArgumentException("Need at least two full periods (" + 2 * period + " values), got " + n);
        }
        double[] trend = centeredMovingAverage(x);

        double[] positionSum = new double[period];
        int[] positionCount = new int[period];
        for (int i = 0; i < n; i++) {
            if (Double.isNaN(trend[i])) continue;
            positionSum[i % period] += x[i] - trend[i];
            positionCount[i % period]++;
        }
        double[] index = new double[period];
        double indexMean = 0;
        for (int j = 0; j < period; j++) {
            index[j] = positionSum[j] / positionCount[j];
            indexMean += index[j] / period;
        }
        double[] seasonal = new double[n];
        double[] residual = new double[n];
        for (int i = 0; i < n; i++) {
            seasonal[i] = index[i % period] - indexMean;
            residual[i] = x[i] - trend[i] - seasonal[i];
        }
        return new Decomposition(x.clone(), trend, seasonal, residual);
    }

    private double[] centeredMovingAverage(double[] x) {
        int n = x.length;
        double[] out = new double[n];
        Arrays.fill(out, Double.NaN);
        int half = period / 2;
        for (int i = half; i < n - half; i++) {
            double sum = 0;
            if (period % 2 == 1) {
                for (int k = -half; k <= half; k++) sum += x[i + k];
                out[i] = sum / period;
            } else {
                // 2 x s average: half weight on both ends
                for (int k = -half + 1; k < half; k++) sum += x[i + k];
                sum += 0.5 * (x[i - half] + x[i + half]);
                out[i] = sum / period;
            }
        }
        return out;
    }

    public static final class Decomposition {

        private final double[] observed;
        private final double[] trend;
        private final double[] seasonal;
        private final double[] residual;

        Decomposition(double[] observed, double[] trend, double[] seasonal, double[] residual) {
            this.observed = observed;
            this.trend = trend;
            this.seasonal = seasonal;
            this.residual = residual;
        }

        public double[] getObserved() { return observed.clone(); }
        public double[] getTrend() { return trend.clone(); }
        public double[] getSeasonal() { return seasonal.clone(); }
        public double[] getResidual() { return residual.clone(); }
    }
}
