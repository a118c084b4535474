package revenue.ml;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import revenue.exception.ForecastException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Multi-step forecasts with confidence intervals from a {@link FittedModel}.
 * <p>
 * The fitted coefficients are put back into integrated form, φ(B)Φ(B^s)(1-B)^d(1-B^s)^D, and the
 * Kalman filter is run over the original series. Its prediction step, repeated past the end of
 * the sample, gives the mean of each future day and the prediction error variance accumulated
 * up to it: σ_h² = σ² F_h. Bounds are mean ± z σ_h with z the two-sided normal quantile.
 */
public class Forecaster {

    private static final Logger LOG = LoggerFactory.getLogger(Forecaster.class);

    public static final double DEFAULT_CONFIDENCE = 0.95;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0, 1);

    public ForecastResult forecast(FittedModel model, int horizon) {
        return forecast(model, horizon, DEFAULT_CONFIDENCE);
    }

    /**
     * @throws ForecastException if {@code model} is null, i.e. there was no successful fit
     * @throws IllegalArgumentException if horizon is below 1 or confidence is outside (0, 1)
     */
    public ForecastResult forecast(FittedModel model, int horizon, double confidence) {
        if (model == null) throw new ForecastException("Model must be fitted before forecasting");
        if (horizon < 1) throw new IllegalArgumentException("Forecast horizon must be at least 1 day: " + horizon);
        if (!(confidence > 0 && confidence < 1)) {
            throw new IllegalArgumentException("Confidence level must be in (0, 1): " + confidence);
        }

        KalmanFilter filter = model.getModel().integratedFilter();
        KalmanFilter.Run run = filter.filter(model.getSeries().values());
        double[][] ahead = filter.extend(run, horizon);
        double z = zScore(confidence);
        double sigma2 = model.getSigma2();

        LocalDate last = model.getSeries().getLastDate();
        List<ForecastPoint> points = new ArrayList<>(horizon);
        for (int h = 0; h < horizon; h++) {
            double mean = ahead[0][h];
            double se = Math.sqrt(Math.max(0, sigma2 * ahead[1][h]));
            points.add(new ForecastPoint(last.plusDays(h + 1L), mean, mean - z * se, mean + z * se));
        }
        LOG.info("Generated {} days of forecasts", horizon);
        return new ForecastResult(points, confidence);
    }

    /** Two-sided standard normal quantile for a confidence level, e.g. 1.96 for 0.95. */
    static double zScore(double confidence) {
        return STANDARD_NORMAL.inverseCumulativeProbability(1 - (1 - confidence) / 2);
    }
}
