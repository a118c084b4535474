package revenue.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Augmented Dickey-Fuller and KPSS tests at the 5% level.
 * <p>
 * Advisory only: the result explains whether a configured differencing order makes sense, it
 * never blocks a fit.
 */
public class StationarityAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(StationarityAnalyzer.class);

    static final int MIN_OBSERVATIONS = 10;

    /** MacKinnon (2010) response surface for the 5% ADF critical value, constant, no trend. */
    private static final double[] ADF_CRITICAL_5PCT = {-2.86154, -2.8903, -4.234, -40.040};
    /** KPSS level-stationarity 5% critical value (Kwiatkowski et al. 1992, table 1). */
    static final double KPSS_CRITICAL_5PCT = 0.463;

    public StationarityResult analyze(double[] series) {
        if (series == null || series.length < MIN_OBSERVATIONS) {
            LOG.warn("Stationarity check needs at least {} observations", MIN_OBSERVATIONS);
            return StationarityResult.inconclusive();
        }
        if (isConstant(series)) {
            LOG.warn("Stationarity check skipped: series is constant");
            return StationarityResult.inconclusive();
        }

        Adf adf;
        try {
            adf = adf(series);
        } catch (IllegalArgumentException e) {
            // e.g. a straight line, whose differences are constant
            LOG.warn("ADF test unavailable, reporting KPSS only: {}", e.getMessage());
            adf = Adf.UNAVAILABLE;
        }
        double kpss = kpss(series);
        boolean adfStationary = adf.statistic < adf.criticalValue;
        boolean kpssStationary = kpss < KPSS_CRITICAL_5PCT;
        StationarityResult result = new StationarityResult(adfStationary, kpssStationary, adf.statistic,
                adf.criticalValue, adf.lags, kpss, KPSS_CRITICAL_5PCT);
        LOG.info("{}", result);
        return result;
    }

    /**
     * ADF regression Δy_t = α + γ y_{t-1} + Σ δ_i Δy_{t-i} + ε_t. The lag count is chosen by AIC
     * over a common sample, then the chosen regression is refit on all usable rows.
     */
    static Adf adf(double[] y) {
        int n = y.length;
        double[] dy = Sarima.diff(y, 1);
        int maxLag = (int) Math.ceil(12.0 * Math.pow(n / 100.0, 0.25));
        maxLag = Math.max(0, Math.min(maxLag, n / 2 - 2));

        int bestLag = 0;
        double bestAic = Double.POSITIVE_INFINITY;
        for (int lag = 0; lag <= maxLag; lag++) {
            double aic = adfRegression(y, dy, lag, maxLag).getAic();
            if (aic < bestAic) {
                bestAic = aic;
                bestLag = lag;
            }
        }
        LinearRegression fit = adfRegression(y, dy, bestLag, bestLag);
        int nobs = fit.getObservationCount();
        double crit = ADF_CRITICAL_5PCT[0] + ADF_CRITICAL_5PCT[1] / nobs
                + ADF_CRITICAL_5PCT[2] / Math.pow(nobs, 2) + ADF_CRITICAL_5PCT[3] / Math.pow(nobs, 3);
        return new Adf(fit.getTStatistic(0), crit, bestLag);
    }

    /** Rows start after {@code start} lags so that regressions with different lags share a sample. */
    private static LinearRegression adfRegression(double[] y, double[] dy, int lag, int start) {
        int rows = dy.length - start;
        double[][] X = new double[rows][lag + 1];
        double[] target = new double[rows];
        for (int t = start; t < dy.length; t++) {
            X[t - start][0] = y[t];
            for (int i = 1; i <= lag; i++) X[t - start][i] = dy[t - i];
            target[t - start] = dy[t];
        }
        return new LinearRegression(X, target);
    }

    /** KPSS level statistic with a Newey-West long-run variance, lag floor(3√n / 13). */
    static double kpss(double[] x) {
        int n = x.length;
        double mean = 0;
        for (double v : x) mean += v;
        mean /= n;
        double[] e = new double[n];
        for (int i = 0; i < n; i++) e[i] = x[i] - mean;

        double cumulative = 0;
        double s2 = 0;
        for (double v : e) {
            cumulative += v;
            s2 += cumulative * cumulative;
        }
        int lag = (int) (3 * Math.sqrt(n) / 13);
        double longRunVariance = neweyWest(e, lag);
        return longRunVariance != 0 ? s2 / (n * (double) n) / longRunVariance : 0;
    }

    private static double neweyWest(double[] e, int lag) {
        int n = e.length;
        double variance = 0;
        for (double v : e) variance += v * v;
        for (int i = 1; i <= lag; i++) {
            double cov = 0;
            for (int j = i; j < n; j++) cov += e[j] * e[j - i];
            // Bartlett weights
            variance += 2 * cov * (1 - i / (lag + 1.0));
        }
        return variance / n;
    }

    private static boolean isConstant(double[] x) {
        for (double v : x) {
            if (v != x[0]) return false;
        }
        return true;
    }

    static final class Adf {
        /** NaN comparisons are false, so an unavailable test never reports stationarity. */
        static final Adf UNAVAILABLE = new Adf(Double.NaN, Double.NaN, 0);

        final double statistic;
        final double criticalValue;
        final int lags;

        Adf(double statistic, double criticalValue, int lags) {
            this.statistic = statistic;
            this.criticalValue = criticalValue;
            this.lags = lags;
        }
    }
}
