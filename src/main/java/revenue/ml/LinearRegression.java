package revenue.ml;

import org.apache.commons.math3.linear.*;

/**
 * Ordinary Least Squares (OLS) linear regression with an intercept.
 * <p>
 * Model: y = β₀ + β₁x₁ + β₂x₂ + ... + βₙxₙ
 * <p>
 * Closed-form solution (normal equation): β = (X'X)⁻¹X'y
 * where X is the design matrix (with column of 1s for intercept) and y is the response vector.
 * Used for the Dickey-Fuller regressions and for autoregressive starting values.
 */
public class LinearRegression {

    private final double[] coefficients;  // β₀, β₁, ..., βₙ
    private final double[] standardErrors;
    private final double residualSumOfSquares;
    private final int n;
    private final int p;

    /**
     * Fit the model using the normal equation: β = (X'X)⁻¹X'y
     *
     * @param X design matrix (rows = observations, columns = features; no intercept column)
     * @param y response vector (length = number of observations)
     * @throws IllegalArgumentException if the inputs are inconsistent or X'X is singular
     */
    public LinearRegression(double[][] X, double[] y) {
        if (X == null || y == null || X.length != y.length || X.length == 0) {
            throw new IllegalArgumentException("X and y must be non-null, same length, and non-empty");
        }
        n = X.length;
        int features = X[0].length;
        p = features + 1; // +1 for intercept
        if (n <= p) {
            throw new IllegalArgumentException("Need more observations (" + n + ") than coefficients (" + p + ")");
        }

        // Build design matrix with intercept column (1s)
        double[][] design = new double[n][p];
        for (int i = 0; i < n; i++) {
            design[i][0] = 1.0;
            for (int j = 0; j < features; j++) {
                design[i][j + 1] = X[i][j];
            }
        }

        RealMatrix Xm = MatrixUtils.createRealMatrix(design);
        RealVector yv = MatrixUtils.createRealVector(y);

        // β = (X'X)⁻¹ X' y
        RealMatrix Xt = Xm.transpose();
        RealMatrix XtX = Xt.multiply(Xm);
        DecompositionSolver solver = new LUDecomposition(XtX).getSolver();
        if (!solver.isNonSingular()) {
            throw new IllegalArgumentException("Design matrix X'X is singular; cannot compute (X'X)⁻¹");
        }
        RealVector beta = solver.solve(Xt.operate(yv));
        coefficients = beta.toArray();

        RealVector residuals = yv.subtract(Xm.operate(beta));
        residualSumOfSquares = residuals.dotProduct(residuals);

        // Var(β) = s² (X'X)⁻¹, s² = RSS / (n - p)
        RealMatrix inverse = solver.getInverse();
        double s2 = residualSumOfSquares / (n - p);
        standardErrors = new double[p];
        for (int i = 0; i < p; i++) {
            standardErrors[i] = Math.sqrt(Math.max(0, s2 * inverse.getEntry(i, i)));
        }
    }

    /** Intercept β₀ */
    public double getIntercept() {
        return coefficients[0];
    }

    /** Coefficient βᵢ for feature i (0-based). β₁ is first feature. */
    public double getCoefficient(int i) {
        return coefficients[i + 1];
    }

    /** t statistic of the coefficient for feature i (0-based). */
    public double getTStatistic(int i) {
        return coefficients[i + 1] / standardErrors[i + 1];
    }

    public double getResidualSumOfSquares() { return residualSumOfSquares; }
    public int getObservationCount() { return n; }

    /** Gaussian log-likelihood at the OLS estimate. */
    public double getLogLikelihood() {
        return -0.5 * n * (Math.log(2 * Math.PI) + Math.log(residualSumOfSquares / n) + 1);
    }

    /** Akaike information criterion, counting the intercept as a parameter. */
    public double getAic() {
        return -2 * getLogLikelihood() + 2 * p;
    }
}
