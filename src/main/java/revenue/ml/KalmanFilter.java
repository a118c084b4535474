package revenue.ml;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.Arrays;

/**
 * Kalman filter for an ARMA process in Harvey's state-space form.
 * <p>
 * With r = max(k_ar, k_ma + 1):
 * <pre>
 *   y_t     = Z α_t,                Z = [1, 0, ..., 0]
 *   α_{t+1} = T α_t + R ε_{t+1},    T = [c | I_{r-1} ; 0],  R = [1, m₁, ..., m_{r-1}]'
 * </pre>
 * The filter runs with unit innovation variance; every variance it produces is relative to σ²,
 * which lets the estimator concentrate σ² out of the likelihood.
 * <p>
 * A stationary process starts from its unconditional state covariance, which makes the
 * likelihood exact over every observation. Integrated processes have no such covariance and
 * start from an approximate diffuse prior instead.
 * <p>
 * Instances are immutable and can be shared between threads.
 */
public final class KalmanFilter {

    static final double DIFFUSE_VARIANCE = 1e6;
    private static final int MAX_DOUBLING_STEPS = 60;
    private static final double DOUBLING_TOLERANCE = 1e-12;

    private final int dim;
    private final double[] transition; // first column of T, length dim
    private final double[] selection;  // R, length dim

    public KalmanFilter(double[] arCoefficients, double[] maCoefficients) {
        this.dim = Math.max(arCoefficients.length, maCoefficients.length + 1);
        this.transition = Arrays.copyOf(arCoefficients, dim);
        this.selection = new double[dim];
        selection[0] = 1;
        System.arraycopy(maCoefficients, 0, selection, 1, maCoefficients.length);
    }

    /**
     * Whether the AR recursion is stationary, i.e. every root of 1 - c₁z - ... - c_r z^r lies
     * outside the unit circle. Checked by stepping the coefficients down to partial
     * autocorrelations, which must all be below 1 in absolute value.
     */
    public boolean isStationary() {
        double[] a = transition.clone();
        for (int k = a.length; k > 0; k--) {
            double r = a[k - 1];
            if (!(Math.abs(r) < 1)) return false;
            double[] lower = new double[k - 1];
            for (int j = 0; j < k - 1; j++) {
                lower[j] = (a[j] + r * a[k - 2 - j]) / (1 - r * r);
            }
            a = lower;
        }
        return true;
    }

    /**
     * Unconditional state covariance, the solution of P = T P T' + R R', found by the doubling
     * iteration P ← P + A P A', A ← A².
     *
     * @return the covariance, or {@code null} if the process is not stationary
     */
    public double[][] stationaryCovariance() {
        if (!isStationary()) return null;
        RealMatrix t = MatrixUtils.createRealMatrix(dim, dim);
        for (int i = 0; i < dim; i++) {
            t.setEntry(i, 0, transition[i]);
            if (i + 1 < dim) t.setEntry(i, i + 1, 1);
        }
        RealMatrix r = MatrixUtils.createColumnRealMatrix(selection);
        RealMatrix p = r.multiply(r.transpose());
        RealMatrix a = t;
        for (int step = 0; step < MAX_DOUBLING_STEPS; step++) {
            RealMatrix increment = a.multiply(p).multiply(a.transpose());
            p = p.add(increment);
            a = a.multiply(a);
            if (maxAbs(increment) <= DOUBLING_TOLERANCE * maxAbs(p)) return p.getData();
        }
        return null;
    }

    private static double maxAbs(RealMatrix m) {
        double max = 0;
        for (int i = 0; i < m.getRowDimension(); i++) {
            for (int j = 0; j < m.getColumnDimension(); j++) {
                max = Math.max(max, Math.abs(m.getEntry(i, j)));
            }
        }
        return max;
    }

    /** Run the filter from the approximate diffuse prior. */
    public Run filter(double[] y) {
        double[][] diffuse = new double[dim][dim];
        for (int i = 0; i < dim; i++) diffuse[i][i] = DIFFUSE_VARIANCE;
        return filter(y, diffuse);
    }

    /**
     * Run the filter over the whole sample, starting from a zero state mean.
     *
     * @param initialCovariance covariance of the initial state, r x r; not modified
     * @return one-step prediction errors and their (σ²-relative) variances, plus the predicted
     * state for the first period after the sample
     */
    public Run filter(double[] y, double[][] initialCovariance) {
        double[] a = new double[dim];
        double[][] cov = new double[dim][];
        for (int i = 0; i < dim; i++) cov[i] = initialCovariance[i].clone();

        double[] innovations = new double[y.length];
        double[] variances = new double[y.length];
        double[] row = new double[dim];
        for (int t = 0; t < y.length; t++) {
            double v = y[t] - a[0];
            double f = cov[0][0];
            innovations[t] = v;
            variances[t] = f;
            if (f > 0) {
                // update: a += K v, P -= K P[0,:] with K = P[:,0] / F
                System.arraycopy(cov[0], 0, row, 0, dim);
                for (int i = 0; i < dim; i++) {
                    double k = cov[i][0] / f;
                    a[i] += k * v;
                    for (int j = 0; j < dim; j++) {
                        cov[i][j] -= k * row[j];
                    }
                }
            }
            predict(a, cov);
        }
        return new Run(innovations, variances, a, cov);
    }

    /**
     * Continue the prediction recursion past the end of the sample.
     *
     * @return {means, variances} of the next {@code steps} observations, variances relative to σ²
     */
    public double[][] extend(Run run, int steps) {
        double[] a = run.nextState.clone();
        double[][] cov = new double[dim][];
        for (int i = 0; i < dim; i++) cov[i] = run.nextCovariance[i].clone();

        double[] means = new double[steps];
        double[] variances = new double[steps];
        for (int h = 0; h < steps; h++) {
            means[h] = a[0];
            variances[h] = cov[0][0];
            predict(a, cov);
        }
        return new double[][]{means, variances};
    }

    /** a ← T a, P ← T P T' + R R'. T is a companion matrix, so both are O(r²). */
    private void predict(double[] a, double[][] cov) {
        double a0 = a[0];
        for (int i = 0; i < dim; i++) {
            a[i] = transition[i] * a0 + (i + 1 < dim ? a[i + 1] : 0);
        }

        double[][] tp = new double[dim][dim];
        for (int i = 0; i < dim; i++) {
            for (int j = 0; j < dim; j++) {
                tp[i][j] = transition[i] * cov[0][j] + (i + 1 < dim ? cov[i + 1][j] : 0);
            }
        }
        for (int i = 0; i < dim; i++) {
            for (int j = i; j < dim; j++) {
                double value = tp[i][0] * transition[j] + (j + 1 < dim ? tp[i][j + 1] : 0)
                        + selection[i] * selection[j];
                cov[i][j] = value;
                cov[j][i] = value;
            }
        }
    }

    /** Output of one pass of the filter over a sample. */
    public static final class Run {

        private final double[] innovations;
        private final double[] variances;
        private final double[] nextState;
        private final double[][] nextCovariance;

        Run(double[] innovations, double[] variances, double[] nextState, double[][] nextCovariance) {
            this.innovations = innovations;
            this.variances = variances;
            this.nextState = nextState;
            this.nextCovariance = nextCovariance;
        }

        /** One-step prediction errors v_t. */
        public double[] getInnovations() { return innovations.clone(); }

        /** Prediction error variances F_t, relative to σ². */
        public double[] getVariances() { return variances.clone(); }

        double innovation(int t) { return innovations[t]; }
        double variance(int t) { return variances[t]; }
    }
}
