package revenue.ml;

import java.util.Arrays;

/**
 * Seasonal Autoregressive Integrated Moving Average (SARIMA) model structure.
 * <p>
 * Model: SARIMA(p,d,q)(P,D,Q)s
 * φ(B)Φ(B^s) ∇^d ∇_s^D y_t = θ(B)Θ(B^s) ε_t
 * <p>
 * - p,d,q: non-seasonal AR order, differencing, MA order
 * - P,D,Q: seasonal AR, seasonal differencing, seasonal MA
 * - s: season length (7 for daily data with weekly seasonality)
 * <p>
 * Coefficients are laid out as [φ₁..φₚ, θ₁..θq, Φ₁..Φ_P, Θ₁..Θ_Q]. Polynomials follow the
 * 1 - φ₁B - ... (AR) and 1 + θ₁B + ... (MA) sign conventions. No constant term.
 */
public final class Sarima {

    private final int p, d, q, P, D, Q, s;
    private final double[] ar;         // φ₁..φₚ
    private final double[] ma;         // θ₁..θq
    private final double[] seasonalAr; // Φ₁..Φ_P
    private final double[] seasonalMa; // Θ₁..Θ_Q

    public Sarima(ModelOrder order, SeasonalOrder seasonal, double[] coefficients) {
        this.p = order.getP();
        this.d = order.getD();
        this.q = order.getQ();
        this.P = seasonal.getP();
        this.D = seasonal.getD();
        this.Q = seasonal.getQ();
        this.s = seasonal.getPeriod();
        if (coefficients.length != coefficientCount(order, seasonal)) {
            throw new IllegalArgumentException("Expected " + coefficientCount(order, seasonal)
                    + " coefficients, got " + coefficients.length);
        }
        int idx = 0;
        this.ar = Arrays.copyOfRange(coefficients, idx, idx += p);
        this.ma = Arrays.copyOfRange(coefficients, idx, idx += q);
        this.seasonalAr = Arrays.copyOfRange(coefficients, idx, idx += P);
        this.seasonalMa = Arrays.copyOfRange(coefficients, idx, idx + Q);
    }

    /** Number of ARMA coefficients (the innovation variance is not counted). */
    public static int coefficientCount(ModelOrder order, SeasonalOrder seasonal) {
        return order.getP() + order.getQ() + seasonal.getP() + seasonal.getQ();
    }

    /** Apply non-seasonal differencing d times and seasonal differencing D times (lag s). */
    public double[] difference(double[] series) {
        double[] z = series.clone();
        for (int i = 0; i < d; i++) {
            z = diff(z, 1);
        }
        for (int i = 0; i < D; i++) {
            z = diff(z, s);
        }
        return z;
    }

    /** Observations lost to differencing. */
    public int differencingLoss() {
        return d + D * s;
    }

    static double[] diff(double[] x, int lag) {
        if (lag >= x.length) return new double[0];
        double[] out = new double[x.length - lag];
        for (int i = lag; i < x.length; i++) {
            out[i - lag] = x[i] - x[i - lag];
        }
        return out;
    }

    /**
     * Autoregressive coefficients c₁..c_k of the stationary part, from expanding φ(B)Φ(B^s):
     * w_t = Σ c_k w_{t-k} + (MA terms).
     */
    public double[] expandedAr() {
        return toRecursion(arPolynomial());
    }

    /**
     * Autoregressive coefficients of the undifferenced series, from expanding
     * φ(B)Φ(B^s)(1-B)^d(1-B^s)^D. The differencing roots sit on the unit circle.
     */
    public double[] integratedAr() {
        double[] poly = arPolynomial();
        for (int i = 0; i < d; i++) {
            poly = multiply(poly, seasonalLag(1, new double[]{-1}));
        }
        for (int i = 0; i < D; i++) {
            poly = multiply(poly, seasonalLag(s, new double[]{-1}));
        }
        return toRecursion(poly);
    }

    /** Moving-average coefficients m₁..m_k from expanding θ(B)Θ(B^s). */
    public double[] expandedMa() {
        double[] poly = multiply(seasonalLag(1, ma), seasonalLag(s, seasonalMa));
        return trim(Arrays.copyOfRange(poly, 1, poly.length));
    }

    private double[] arPolynomial() {
        return multiply(seasonalLag(1, negate(ar)), seasonalLag(s, negate(seasonalAr)));
    }

    /** 1 + c₁B^lag + c₂B^(2·lag) + ... as a dense lag polynomial. */
    private static double[] seasonalLag(int lag, double[] coefficients) {
        double[] poly = new double[coefficients.length * Math.max(lag, 1) + 1];
        poly[0] = 1;
        for (int i = 0; i < coefficients.length; i++) {
            poly[(i + 1) * lag] = coefficients[i];
        }
        return poly;
    }

    private static double[] multiply(double[] a, double[] b) {
        double[] out = new double[a.length + b.length - 1];
        for (int i = 0; i < a.length; i++) {
            if (a[i] == 0) continue;
            for (int j = 0; j < b.length; j++) {
                out[i + j] += a[i] * b[j];
            }
        }
        return out;
    }

    private static double[] negate(double[] x) {
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) out[i] = -x[i];
        return out;
    }

    /** 1 - c₁B - c₂B² ... to [c₁, c₂, ...]. */
    private static double[] toRecursion(double[] poly) {
        double[] out = new double[poly.length - 1];
        for (int i = 1; i < poly.length; i++) out[i - 1] = -poly[i];
        return trim(out);
    }

    /** Drop trailing zero lags, which only grow the state. */
    private static double[] trim(double[] x) {
        int n = x.length;
        while (n > 0 && x[n - 1] == 0) n--;
        return n == x.length ? x : Arrays.copyOf(x, n);
    }

    /** Kalman filter over the differenced (stationary) series, used for estimation. */
    public KalmanFilter stationaryFilter() {
        return new KalmanFilter(expandedAr(), expandedMa());
    }

    /** Kalman filter over the original series, used for forecasting. */
    public KalmanFilter integratedFilter() {
        return new KalmanFilter(integratedAr(), expandedMa());
    }

    public double[] getAr() { return ar.clone(); }
    public double[] getMa() { return ma.clone(); }
    public double[] getSeasonalAr() { return seasonalAr.clone(); }
    public double[] getSeasonalMa() { return seasonalMa.clone(); }

    public int getSeasonLength() { return s; }
    public int getP() { return p; }
    public int getD() { return d; }
    public int getQ() { return q; }
    public int getSeasonalP() { return P; }
    public int getSeasonalD() { return D; }
    public int getSeasonalQ() { return Q; }
}
