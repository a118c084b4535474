package revenue.ml;

import java.util.Arrays;

/**
 * Maximum-likelihood estimate of a SARIMA model on a plain numeric sample.
 * Immutable; {@link FittedModel} adds the dated series it came from.
 */
public final class Estimation {

    private final ModelOrder order;
    private final SeasonalOrder seasonalOrder;
    private final double[] coefficients;
    private final double sigma2;
    private final double logLikelihood;
    private final int effectiveObservations;
    private final double[] residuals;
    private final int iterations;

    Estimation(ModelOrder order, SeasonalOrder seasonalOrder, double[] coefficients, double sigma2,
               double logLikelihood, int effectiveObservations, double[] residuals, int iterations) {
        this.order = order;
        this.seasonalOrder = seasonalOrder;
        this.coefficients = coefficients.clone();
        this.sigma2 = sigma2;
        this.logLikelihood = logLikelihood;
        this.effectiveObservations = effectiveObservations;
        this.residuals = residuals.clone();
        this.iterations = iterations;
    }

    public ModelOrder getOrder() { return order; }
    public SeasonalOrder getSeasonalOrder() { return seasonalOrder; }

    /** ARMA coefficients [φ, θ, Φ, Θ]. */
    public double[] getCoefficients() { return coefficients.clone(); }

    /** Innovation variance σ². */
    public double getSigma2() { return sigma2; }

    /** Full parameter vector [φ, θ, Φ, Θ, σ²]. */
    public double[] getParameters() {
        double[] out = Arrays.copyOf(coefficients, coefficients.length + 1);
        out[coefficients.length] = sigma2;
        return out;
    }

    /** Number of estimated parameters, σ² included. */
    public int getParameterCount() {
        return coefficients.length + 1;
    }

    public double getLogLikelihood() { return logLikelihood; }

    /** Observations that entered the likelihood, i.e. the length of the differenced series. */
    public int getEffectiveObservations() { return effectiveObservations; }

    /** One-step prediction errors of the differenced series. */
    public double[] getResiduals() { return residuals.clone(); }

    /** Optimizer iterations used; 0 when there was nothing to optimize. */
    public int getIterations() { return iterations; }

    /** AIC = -2 logL + 2k */
    public double getAic() {
        return -2 * logLikelihood + 2 * getParameterCount();
    }

    /** BIC = -2 logL + k ln(n) */
    public double getBic() {
        return -2 * logLikelihood + getParameterCount() * Math.log(effectiveObservations);
    }

    public Sarima toSarima() {
        return new Sarima(order, seasonalOrder, coefficients);
    }
}
