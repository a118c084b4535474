package revenue.ml;

import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.PowellOptimizer;
import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import revenue.data.TimeSeries;
import revenue.exception.ModelFitException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Maximum-likelihood estimation of SARIMA(p,d,q)(P,D,Q,s) models.
 * <p>
 * The series is differenced d times at lag 1 and D times at lag s. The differenced series is
 * treated as an ARMA process with the expanded polynomials φ(B)Φ(B^s) and θ(B)Θ(B^s), written in
 * state-space form and run through a {@link KalmanFilter} started from the stationary state
 * covariance. The exact Gaussian log-likelihood of the one-step prediction errors, with σ²
 * concentrated out, is maximized over the ARMA coefficients by Powell's method. Neither
 * stationarity nor invertibility is enforced: coefficients with a non-stationary AR part have no
 * stationary covariance and start from the approximate diffuse prior, whose large initial
 * variances lower the likelihood without excluding the candidate.
 * <p>
 * Estimates of different differencing orders describe different samples. For comparing them,
 * {@link #estimate(double[], ModelOrder, SeasonalOrder, int)} conditions the likelihood on the same
 * leading observations of the undifferenced series: the prediction errors of those observations are
 * left out, and the remaining terms are the density of the same later observations for every order.
 * <p>
 * Stateless: every call works on its own copy of the data, so concurrent fits need no locking.
 */
public class SarimaEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(SarimaEstimator.class);

    public static final int DEFAULT_MIN_OBSERVATIONS = 30;
    public static final int DEFAULT_MAX_ITERATIONS = 100;

    private static final double RELATIVE_TOLERANCE = 1e-8;
    private static final double ABSOLUTE_TOLERANCE = 1e-10;
    private static final int MAX_EVALUATIONS = 200_000;
    /** Objective value where the filter overflows. */
    private static final double PENALTY = 1e20;
    /** Lower bound on σ², reached only by exactly predictable series. */
    static final double MIN_SIGMA2 = 1e-12;
    /** σ² floor as a fraction of the sample variance, so exact fits of any scale tie at the same bound. */
    static final double RELATIVE_SIGMA2_FLOOR = 1e-10;
    /** Starting coefficients are kept inside the stationary/invertible box. */
    private static final double START_LIMIT = 0.9;

    private final int minObservations;
    private final int maxIterations;

    public SarimaEstimator() {
        this(DEFAULT_MIN_OBSERVATIONS, DEFAULT_MAX_ITERATIONS);
    }

    public SarimaEstimator(int minObservations, int maxIterations) {
        if (minObservations < 1) throw new IllegalArgumentException("minObservations must be positive");
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be positive");
        this.minObservations = minObservations;
        this.maxIterations = maxIterations;
    }

    /**
     * Fit a model to a dated series.
     *
     * @throws ModelFitException if the series is too short or the optimizer does not converge
     */
    public FittedModel fit(TimeSeries series, ModelOrder order, SeasonalOrder seasonalOrder) {
        Objects.requireNonNull(series, "series");
        LOG.info("Fitting SARIMA model with order={}, seasonal_order={} on {} observations",
                order, seasonalOrder, series.size());
        Estimation estimation = estimate(series.values(), order, seasonalOrder);
        LOG.info("Model fitted successfully. AIC: {} ({} iterations)",
                String.format("%.2f", estimation.getAic()), estimation.getIterations());
        return new FittedModel(series, estimation);
    }

    /**
     * Estimate a model on a plain numeric sample.
     *
     * @throws ModelFitException if the sample is too short or the optimizer does not converge
     */
    public Estimation estimate(double[] values, ModelOrder order, SeasonalOrder seasonalOrder) {
        return estimate(values, order, seasonalOrder, 0);
    }

    /**
     * Estimate a model with the likelihood conditioned on the first {@code conditioned} observations
     * of {@code values}. Observations lost to differencing count towards them; prediction errors of
     * the rest are skipped. The effective sample is then {@code values.length - conditioned} for
     * every order that differences at most {@code conditioned} times, so their AIC values compare
     * like for like.
     *
     * @throws ModelFitException if the sample is too short or the optimizer does not converge
     */
    public Estimation estimate(double[] values, ModelOrder order, SeasonalOrder seasonalOrder, int conditioned) {
        Objects.requireNonNull(values, "values");
        Objects.requireNonNull(order, "order");
        Objects.requireNonNull(seasonalOrder, "seasonalOrder");
        if (conditioned < 0) throw new IllegalArgumentException("conditioned must not be negative: " + conditioned);
        if (values.length < minObservations) {
            throw new ModelFitException("insufficient observations: " + values.length
                    + " (minimum " + minObservations + " required)");
        }
        for (double v : values) {
            if (!Double.isFinite(v)) throw new ModelFitException("series contains non-finite values");
        }

        int k = Sarima.coefficientCount(order, seasonalOrder);
        Sarima structure = new Sarima(order, seasonalOrder, new double[k]);
        double[] z = structure.difference(values);
        int skip = Math.max(0, conditioned - (values.length - z.length));
        if (z.length - skip <= k + 1) {
            throw new ModelFitException("insufficient observations after differencing: " + (z.length - skip)
                    + " usable for " + (k + 1) + " parameters of SARIMA" + order + seasonalOrder);
        }

        Likelihood likelihood = new Likelihood(order, seasonalOrder, z, skip, sigma2Floor(values));
        double[] best;
        int iterations = 0;
        if (k == 0) {
            best = new double[0];
        } else {
            PowellOptimizer optimizer = new PowellOptimizer(RELATIVE_TOLERANCE, ABSOLUTE_TOLERANCE);
            try {
                PointValuePair result = optimizer.optimize(
                    new MaxEval(MAX_EVALUATIONS),
                    new MaxIter(maxIterations),
                    new ObjectiveFunction(likelihood::negativeLogLikelihood),
                    GoalType.MINIMIZE,
                    new InitialGuess(startingValues(z, order, seasonalOrder))
                );
                best = result.getPoint();
                iterations = optimizer.getIterations();
            } catch (MaxCountExceededException e) {
                throw new ModelFitException("optimizer did not converge within " + maxIterations
                        + " iterations for SARIMA" + order + seasonalOrder, e);
            }
        }

        Likelihood.Value value = likelihood.evaluate(best);
        if (!Double.isFinite(value.logLikelihood)) {
            throw new ModelFitException("log-likelihood is not finite at the optimum for SARIMA" + order + seasonalOrder);
        }
        return new Estimation(order, seasonalOrder, best, value.sigma2, value.logLikelihood,
                z.length - skip, value.residuals, iterations);
    }

    static double sigma2Floor(double[] values) {
        return Math.max(RELATIVE_SIGMA2_FLOOR * StatUtils.variance(values), MIN_SIGMA2);
    }

    /**
     * Starting point: AR and seasonal AR coefficients from an OLS regression of the differenced
     * series on its own lags, MA terms at zero. AR starts that are not stationary are reset to zero.
     */
    static double[] startingValues(double[] z, ModelOrder order, SeasonalOrder seasonal) {
        int p = order.getP();
        int q = order.getQ();
        int P = seasonal.getP();
        int s = seasonal.getPeriod();
        double[] params = new double[Sarima.coefficientCount(order, seasonal)];
        if (p + P == 0) return params;

        int[] lags = new int[p + P];
        for (int i = 0; i < p; i++) lags[i] = i + 1;
        for (int i = 0; i < P; i++) lags[p + i] = (i + 1) * s;
        int maxLag = Arrays.stream(lags).max().orElse(0);
        int rows = z.length - maxLag;
        if (rows <= lags.length + 1) return params;

        double[][] X = new double[rows][lags.length];
        double[] y = new double[rows];
        for (int t = maxLag; t < z.length; t++) {
            for (int j = 0; j < lags.length; j++) X[t - maxLag][j] = z[t - lags[j]];
            y[t - maxLag] = z[t];
        }
        try {
            LinearRegression lr = new LinearRegression(X, y);
            double[] ar = new double[p];
            double[] seasonalAr = new double[P];
            for (int i = 0; i < p; i++) ar[i] = clamp(lr.getCoefficient(i));
            for (int i = 0; i < P; i++) seasonalAr[i] = clamp(lr.getCoefficient(p + i));
            // φ(B)Φ(B^s) is stationary exactly when both factors are
            if (new KalmanFilter(ar, new double[0]).isStationary()) System.arraycopy(ar, 0, params, 0, p);
            if (new KalmanFilter(seasonalAr, new double[0]).isStationary()) System.arraycopy(seasonalAr, 0, params, p + q, P);
        } catch (IllegalArgumentException e) {
            // a constant differenced series has no lag structure to regress on
            LOG.debug("Starting AR values left at zero: {}", e.getMessage());
        }
        return params;
    }

    private static double clamp(double v) {
        if (!Double.isFinite(v)) return 0;
        return Math.max(-START_LIMIT, Math.min(START_LIMIT, v));
    }

    /**
     * Concentrated Gaussian log-likelihood of the differenced sample, exact when nothing is skipped
     * and otherwise conditional on the first {@code skip} differenced observations.
     */
    private static final class Likelihood {

        private final ModelOrder order;
        private final SeasonalOrder seasonal;
        private final double[] z;
        private final int skip;
        private final double sigma2Floor;

        Likelihood(ModelOrder order, SeasonalOrder seasonal, double[] z, int skip, double sigma2Floor) {
            this.order = order;
            this.seasonal = seasonal;
            this.z = z;
            this.skip = skip;
            this.sigma2Floor = sigma2Floor;
        }

        double negativeLogLikelihood(double[] coefficients) {
            Value value = evaluate(coefficients);
            return Double.isFinite(value.logLikelihood) ? -value.logLikelihood : PENALTY;
        }

        Value evaluate(double[] coefficients) {
            KalmanFilter filter = new Sarima(order, seasonal, coefficients).stationaryFilter();
            double[][] initial = filter.stationaryCovariance();
            KalmanFilter.Run run = initial != null ? filter.filter(z, initial) : filter.filter(z);
            int count = z.length - skip;
            double weightedSquares = 0;
            double sumLogVariance = 0;
            double[] residuals = run.getInnovations();
            for (int t = skip; t < z.length; t++) {
                double v = run.innovation(t);
                double f = run.variance(t);
                weightedSquares += v * v / f;
                sumLogVariance += Math.log(f);
            }
            double sigma2 = Math.max(weightedSquares / count, sigma2Floor);
            double logL = -0.5 * (count * Math.log(2 * Math.PI * sigma2) + weightedSquares / sigma2 + sumLogVariance);
            return new Value(logL, sigma2, residuals);
        }

        static final class Value {
            final double logLikelihood;
            final double sigma2;
            final double[] residuals;

            Value(double logLikelihood, double sigma2, double[] residuals) {
                this.logLikelihood = logLikelihood;
                this.sigma2 = sigma2;
                this.residuals = residuals;
            }
        }
    }
}
