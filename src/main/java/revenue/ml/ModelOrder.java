package revenue.ml;

import java.util.Arrays;
import java.util.List;

/** Non-seasonal ARIMA order (p, d, q). */
public final class ModelOrder {

    public static final int MAX_AR = 5;
    public static final int MAX_DIFF = 2;
    public static final int MAX_MA = 5;

    private final int p, d, q;

    private ModelOrder(int p, int d, int q) {
        this.p = p;
        this.d = d;
        this.q = q;
    }

    /** @throws IllegalArgumentException if an order is negative or above its policy bound */
    public static ModelOrder of(int p, int d, int q) {
        if (p < 0 || d < 0 || q < 0) throw new IllegalArgumentException("Orders must be non-negative: " + Arrays.asList(p, d, q));
        if (p > MAX_AR || d > MAX_DIFF || q > MAX_MA) {
            throw new IllegalArgumentException("Order out of bounds (p,q <= 5, d <= 2): " + Arrays.asList(p, d, q));
        }
        return new ModelOrder(p, d, q);
    }

    public int getP() { return p; }
    public int getD() { return d; }
    public int getQ() { return q; }

    public List<Integer> toList() {
        return Arrays.asList(p, d, q);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModelOrder)) return false;
        ModelOrder that = (ModelOrder) o;
        return p == that.p && d == that.d && q == that.q;
    }

    @Override
    public int hashCode() {
        return (p * 31 + d) * 31 + q;
    }

    @Override
    public String toString() {
        return "(" + p + "," + d + "," + q + ")";
    }
}
