package revenue.ml;

import revenue.data.TimeSeries;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Random;

/** Seeded series with known generating processes. */
final class SyntheticSeries {

    static final LocalDate START = LocalDate.of(2023, 1, 1);

    private SyntheticSeries() {}

    /** y_t = a₁ y_{t-1} + a₂ y_{t-2} + ε_t, ε ~ N(0, 1), first 52 values discarded. */
    static double[] ar2(long seed, int n, double a1, double a2) {
        Random random = new Random(seed);
        double[] y = new double[n + 52];
        for (int t = 2; t < y.length; t++) {
            y[t] = a1 * y[t - 1] + a2 * y[t - 2] + random.nextGaussian();
        }
        return Arrays.copyOfRange(y, 52, y.length);
    }

    /** y_t = a₁ y_{t-1} + a₂ y_{t-2} exactly, from y₀ = 10 and y₁ = 7. */
    static double[] noiseFreeAr2(int n, double a1, double a2) {
        double[] y = new double[n];
        y[0] = 10;
        y[1] = 7;
        for (int t = 2; t < n; t++) {
            y[t] = a1 * y[t - 1] + a2 * y[t - 2];
        }
        return y;
    }

    /** Positive daily revenue: level + AR(1) noise + a weekly pattern. */
    static TimeSeries dailyRevenue(long seed, int days) {
        Random random = new Random(seed);
        double[] values = new double[days];
        double noise = 0;
        for (int t = 0; t < days; t++) {
            noise = 0.5 * noise + 4 * random.nextGaussian();
            values[t] = 200 + 20 * Math.sin(2 * Math.PI * t / 7.0) + noise;
        }
        return TimeSeries.daily(START, values);
    }

    static TimeSeries constant(int days, double value) {
        double[] values = new double[days];
        Arrays.fill(values, value);
        return TimeSeries.daily(START, values);
    }

    static double[] whiteNoise(long seed, int n) {
        Random random = new Random(seed);
        double[] x = new double[n];
        for (int i = 0; i < n; i++) x[i] = random.nextGaussian();
        return x;
    }

    static double[] randomWalk(long seed, int n) {
        double[] x = whiteNoise(seed, n);
        for (int i = 1; i < n; i++) x[i] += x[i - 1];
        return x;
    }
}
