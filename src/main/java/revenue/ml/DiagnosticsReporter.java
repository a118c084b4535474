package revenue.ml;

import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.stat.StatUtils;
import revenue.exception.ForecastException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Residual diagnostics for a fitted model. Read-only: the model is never modified.
 */
public class DiagnosticsReporter {

    public static final int LJUNG_BOX_LAGS = 10;

    public ModelDiagnostics report(FittedModel model) {
        if (model == null) throw new ForecastException("Model must be fitted before diagnostics");
        double[] residuals = model.getResiduals();
        double mean = StatUtils.mean(residuals);
        double std = residuals.length > 1 ? Math.sqrt(StatUtils.variance(residuals, mean)) : Double.NaN;
        return new ModelDiagnostics(model.getAic(), model.getBic(), model.getLogLikelihood(), mean, std,
                ljungBoxPValue(residuals, LJUNG_BOX_LAGS), model.getOrder(), model.getSeasonalOrder());
    }

    /**
     * Absolute size of each estimated parameter, keyed {@code parameter_0} upwards in the order of
     * {@link FittedModel#getParameters()} (φ, θ, Φ, Θ, then σ²).
     */
    public Map<String, Double> parameterImportance(FittedModel model) {
        if (model == null) throw new ForecastException("Model must be fitted before parameter importance");
        double[] params = model.getParameters();
        Map<String, Double> out = new LinkedHashMap<>();
        for (int i = 0; i < params.length; i++) {
            out.put("parameter_" + i, Math.abs(params[i]));
        }
        return out;
    }

    /**
     * Ljung-Box portmanteau test: Q = n(n+2) Σ_{k=1..h} r_k² / (n-k), compared against χ²(h).
     * The number of lags is reduced when the sample is shorter than {@code lags + 1}.
     */
    static double ljungBoxPValue(double[] x, int lags) {
        int n = x.length;
        int h = Math.min(lags, n - 1);
        if (h < 1) return Double.NaN;
        double mean = StatUtils.mean(x);
        double denominator = 0;
        for (double v : x) denominator += (v - mean) * (v - mean);
        if (denominator == 0) return Double.NaN;

        double q = 0;
        for (int k = 1; k <= h; k++) {
            double num = 0;
            for (int t = k; t < n; t++) num += (x[t] - mean) * (x[t - k] - mean);
            double r = num / denominator;
            q += r * r / (n - k);
        }
        q *= n * (n + 2.0);
        return 1 - new ChiSquaredDistribution(null, h).cumulativeProbability(q);
    }
}
