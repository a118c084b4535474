package revenue.ml;

import java.util.LinkedHashMap;
import java.util.Map;

/** Forecast accuracy over the aligned holdout days. */
public final class BacktestMetrics {

    /** Guards the percentage error against zero-revenue days. */
    public static final double MAPE_EPSILON = 1e-8;

    private final double mae;
    private final double mse;
    private final double rmse;
    private final double mape;
    private final int pairs;

    private BacktestMetrics(double mae, double mse, double mape, int pairs) {
        this.mae = mae;
        this.mse = mse;
        this.rmse = Math.sqrt(mse);
        this.mape = mape;
        this.pairs = pairs;
    }

    /**
     * Metrics over paired actual and forecast values of equal length.
     *
     * @throws IllegalArgumentException if the arrays are empty or differ in length
     */
    public static BacktestMetrics of(double[] actual, double[] forecast) {
        if (actual.length != forecast.length || actual.length == 0) {
            throw new IllegalArgumentException("Need the same, non-zero number of actual and forecast values");
        }
        double absSum = 0;
        double sqSum = 0;
        double pctSum = 0;
        for (int i = 0; i < actual.length; i++) {
            double err = actual[i] - forecast[i];
            absSum += Math.abs(err);
            sqSum += err * err;
            pctSum += Math.abs(err) / (Math.abs(actual[i]) + MAPE_EPSILON);
        }
        int n = actual.length;
        return new BacktestMetrics(absSum / n, sqSum / n, pctSum / n * 100, n);
    }

    public double getMae() { return mae; }
    public double getMse() { return mse; }
    public double getRmse() { return rmse; }
    public double getMape() { return mape; }

    /** Number of aligned (actual, forecast) pairs the metrics were computed over. */
    public int getPairs() { return pairs; }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("mae", mae);
        out.put("mse", mse);
        out.put("rmse", rmse);
        out.put("mape", mape);
        out.put("pairs", pairs);
        return out;
    }
}
