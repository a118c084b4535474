package revenue.ml;

import java.util.Arrays;
import java.util.List;

/**
 * Seasonal order (P, D, Q, s). The period s is at least 2, except for {@link #none()}, the
 * all-zero order used for purely non-seasonal models.
 */
public final class SeasonalOrder {

    public static final int DEFAULT_PERIOD = 7;
    public static final int MAX_AR = 5;
    public static final int MAX_DIFF = 2;
    public static final int MAX_MA = 5;

    private static final SeasonalOrder NONE = new SeasonalOrder(0, 0, 0, 0);

    private final int P, D, Q, s;

    private SeasonalOrder(int P, int D, int Q, int s) {
        this.P = P;
        this.D = D;
        this.Q = Q;
        this.s = s;
    }

    public static SeasonalOrder of(int P, int D, int Q, int s) {
        if (P == 0 && D == 0 && Q == 0 && s == 0) return NONE;
        if (P < 0 || D < 0 || Q < 0) throw new IllegalArgumentException("Seasonal orders must be non-negative: " + Arrays.asList(P, D, Q, s));
        if (P > MAX_AR || D > MAX_DIFF || Q > MAX_MA) {
            throw new IllegalArgumentException("Seasonal order out of bounds (P,Q <= 5, D <= 2): " + Arrays.asList(P, D, Q, s));
        }
        if (s < 2) throw new IllegalArgumentException("Seasonal period must be at least 2: " + s);
        return new SeasonalOrder(P, D, Q, s);
    }

    /** No seasonal component. */
    public static SeasonalOrder none() {
        return NONE;
    }

    public int getP() { return P; }
    public int getD() { return D; }
    public int getQ() { return Q; }
    public int getPeriod() { return s; }

    public boolean isNone() {
        return P == 0 && D == 0 && Q == 0;
    }

    public List<Integer> toList() {
        return Arrays.asList(P, D, Q, s);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SeasonalOrder)) return false;
        SeasonalOrder that = (SeasonalOrder) o;
        return P == that.P && D == that.D && Q == that.Q && s == that.s;
    }

    @Override
    public int hashCode() {
        return ((P * 31 + D) * 31 + Q) * 31 + s;
    }

    @Override
    public String toString() {
        return "(" + P + "," + D + "," + Q + "," + s + ")";
    }
}
